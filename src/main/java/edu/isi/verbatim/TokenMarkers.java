package edu.isi.verbatim;

/**
 * Builders for the token wire format on both sides: inserting category
 * wrappers and fields when classifying, deleting them when verbalizing.
 * Field values escape '"' and '\' with a backslash.
 */
public class TokenMarkers {
	public static final String PLAIN_FIELD = "name";

	// category { ... }
	public static Fst wrap(String category, Fst body) {
		return FstBuilder.concat(FstBuilder.insert(category+" { "), body, FstBuilder.insert(" }"));
	}

	// name: "value"
	public static Fst field(String name, Fst value) {
		return FstBuilder.concat(FstBuilder.insert(name+": \""), value, FstBuilder.insert("\""));
	}

	// the field separator
	public static Fst space() {
		return FstBuilder.insert(" ");
	}

	public static Fst plain(Fst value) {
		return field(PLAIN_FIELD, value);
	}

	/**
	 * Copies single symbols of the given class, escaping the quote and the
	 * backslash on the way out.
	 */
	public static Fst escape(int[] labels) {
		Fst special = FstBuilder.stringMap(new String[][] {{"\"", "\\\""}, {"\\", "\\\\"}});
		Fst chars = FstBuilder.labelSet(labels);
		Fst escaped = FstBuilder.compose(chars, special);
		return FstBuilder.priorityUnion(escaped, chars, chars);
	}

	// verbalizer side: strip the wrapper around body
	public static Fst unwrap(String category, Fst body) {
		return FstBuilder.concat(FstBuilder.delete(category+" { "), body, FstBuilder.delete(" }"));
	}

	// verbalizer side: name: "value" -> value, unescaped
	public static Fst value(String name, Alphabet alpha) {
		return FstBuilder.concat(FstBuilder.delete(name+": \""), unescapedText(alpha), FstBuilder.delete("\""));
	}

	private static Fst unescapedText(Alphabet alpha) {
		int[] all = alpha.labels(Alphabet.CharClass.ALL);
		int n = 0;
		for (int l : all)
			if (l != '"' && l != '\\')
				n++;
		int[] ordinary = new int[n];
		n = 0;
		for (int l : all)
			if (l != '"' && l != '\\')
				ordinary[n++] = l;
		Fst one = FstBuilder.union(FstBuilder.labelSet(ordinary),
				FstBuilder.cross("\\\"", "\""),
				FstBuilder.cross("\\\\", "\\"));
		return FstBuilder.star(one);
	}

	// verbalizer side: the separator between fields, kept as a space
	public static Fst keepSpace() {
		return FstBuilder.accept(" ");
	}
}
