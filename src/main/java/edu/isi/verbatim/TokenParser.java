package edu.isi.verbatim;

import gnu.trove.list.array.TIntArrayList;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the output of the classify graph back into tokens:
 * <pre>
 *   tokens { cardinal { integer: "one" } } tokens { name: "," }
 * </pre>
 * Field names are letters, digits and underscores; values are quoted with
 * '\' escaping '"' and itself.
 */
public class TokenParser {
	private static final String TOKENS = "tokens";

	private final String s;
	private int pos = 0;

	private TokenParser(String s) {
		this.s = s;
	}

	public static List<Token> parse(String s) throws DataFormatException {
		return parse(s, null);
	}

	/**
	 * @param offsets if not null, receives for each token the offset of its
	 *        "tokens" keyword and the offset of its closing brace
	 */
	public static List<Token> parse(String s, TIntArrayList offsets) throws DataFormatException {
		TokenParser p = new TokenParser(s);
		List<Token> ret = new ArrayList<Token>();
		p.skipSpace();
		while (p.pos < s.length()) {
			int open = p.pos;
			p.expect(TOKENS);
			p.skipSpace();
			p.expect("{");
			p.skipSpace();
			ret.add(p.body());
			p.skipSpace();
			int close = p.pos;
			p.expect("}");
			if (offsets != null) {
				offsets.add(open);
				offsets.add(close);
			}
			p.skipSpace();
		}
		return ret;
	}

	private Token body() throws DataFormatException {
		String name = ident();
		skipSpace();
		if (peek() == ':') {
			pos++;
			skipSpace();
			if (!name.equals(TokenMarkers.PLAIN_FIELD))
				throw error("a token without category must have a single "+TokenMarkers.PLAIN_FIELD+" field, not "+name);
			return Token.plain(quoted());
		}
		Token t = new Token(name);
		expect("{");
		skipSpace();
		while (peek() != '}') {
			String field = ident();
			expect(":");
			skipSpace();
			t.addField(field, quoted());
			skipSpace();
		}
		pos++;
		if (t.getFields().isEmpty())
			throw error("category "+name+" has no fields");
		return t;
	}

	private String ident() throws DataFormatException {
		int st = pos;
		while (pos < s.length() && (Character.isLetterOrDigit(s.charAt(pos)) || s.charAt(pos) == '_'))
			pos++;
		if (st == pos)
			throw error("expected a name");
		return s.substring(st, pos);
	}

	private String quoted() throws DataFormatException {
		expect("\"");
		StringBuilder sb = new StringBuilder();
		while (true) {
			if (pos >= s.length())
				throw error("unterminated value");
			char c = s.charAt(pos++);
			if (c == '"')
				return sb.toString();
			if (c == '\\') {
				if (pos >= s.length())
					throw error("dangling escape");
				c = s.charAt(pos++);
				if (c != '"' && c != '\\')
					throw error("bad escape \\"+c);
			}
			sb.append(c);
		}
	}

	private void expect(String lit) throws DataFormatException {
		if (!s.startsWith(lit, pos))
			throw error("expected "+lit);
		pos += lit.length();
	}

	private char peek() throws DataFormatException {
		if (pos >= s.length())
			throw error("unexpected end");
		return s.charAt(pos);
	}

	private void skipSpace() {
		while (pos < s.length() && s.charAt(pos) == ' ')
			pos++;
	}

	private DataFormatException error(String msg) {
		return new DataFormatException("Bad token string at offset "+pos+": "+msg+" in "+s);
	}
}
