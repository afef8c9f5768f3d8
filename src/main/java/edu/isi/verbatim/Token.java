package edu.isi.verbatim;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One classified token: a category with named fields in order, or a plain
 * token with a single value. Tokens coming out of the tokenizer also know
 * the span of text they cover.
 */
public class Token {
	private final String category;
	private final LinkedHashMap<String, String> fields = new LinkedHashMap<String, String>();
	private int start = -1;
	private int end = -1;
	private String text = null;

	// category null makes a plain token
	public Token(String category) {
		this.category = category;
	}

	public static Token plain(String value) {
		return new Token(null).addField(TokenMarkers.PLAIN_FIELD, value);
	}

	public Token addField(String name, String value) {
		fields.put(name, value);
		return this;
	}

	public boolean isPlain() {
		return category == null;
	}

	public String getCategory() {
		return category;
	}

	// key of the verbalizer for this token
	public String getVerbalizerName() {
		return isPlain() ? TokenMarkers.PLAIN_FIELD : category;
	}

	public String getField(String name) {
		return fields.get(name);
	}

	public Map<String, String> getFields() {
		return Collections.unmodifiableMap(fields);
	}

	public String getValue() {
		return fields.get(TokenMarkers.PLAIN_FIELD);
	}

	/**
	 * Record where the token came from.
	 * @param start code point offset of the first character
	 * @param end code point offset just past the last character
	 * @param text the characters themselves
	 */
	public void setSource(int start, int end, String text) {
		this.start = start;
		this.end = end;
		this.text = text;
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	public String getText() {
		return text;
	}

	/**
	 * The token body in wire format, <code>cardinal { integer: "one" }</code>
	 * or <code>name: "x"</code>.
	 */
	public String toString() {
		StringBuilder sb = new StringBuilder();
		if (!isPlain())
			sb.append(category).append(" { ");
		boolean first = true;
		for (Map.Entry<String, String> e : fields.entrySet()) {
			if (!first)
				sb.append(' ');
			first = false;
			sb.append(e.getKey()).append(": \"").append(escape(e.getValue())).append('"');
		}
		if (!isPlain())
			sb.append(" }");
		return sb.toString();
	}

	public static String escape(String s) {
		StringBuilder sb = new StringBuilder(s.length());
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			if (c == '"' || c == '\\')
				sb.append('\\');
			sb.append(c);
		}
		return sb.toString();
	}

	public boolean equals(Object o) {
		if (!(o instanceof Token))
			return false;
		Token t = (Token)o;
		return (category == null ? t.category == null : category.equals(t.category)) && fields.equals(t.fields);
	}

	public int hashCode() {
		return (category == null ? 0 : category.hashCode())*31+fields.hashCode();
	}
}
