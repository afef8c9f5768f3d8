package edu.isi.verbatim;

/**
 * Ordinal numbers written with an English suffix: <code>21st</code> becomes
 * <code>ordinal { integer: "twenty first" }</code>. The suffix must agree
 * with the last digits, so 11th, 12th and 13th take "th".
 * <p>
 * The spoken form is the cardinal reading with its last word inflected:
 * irregular words come from the ordinal/irregular table, every other
 * word takes "th".
 */
public class OrdinalGrammar implements Classifier, Verbalizer {
	public static final String NAME = "ordinal";
	public static final String IRREGULAR = "ordinal/irregular";
	public static final String REGULAR_SUFFIX = "th";

	private final Fst number;
	private final Fst classify;
	private final Fst verbalize;

	public OrdinalGrammar(Lexicon lex, NumberReader reader) throws ConfigureException {
		boolean debug = false;
		Alphabet alpha = lex.getAlphabet();
		Fst digit = alpha.get(Alphabet.CharClass.DIGIT);
		Fst digits = FstBuilder.union(reader.getPlain(), reader.getGrouped());
		number = Optimizer.optimize(FstBuilder.compose(digits,
				inflectLastWord(alpha, lex.stringMap(IRREGULAR), REGULAR_SUFFIX)));

		Fst digitOrComma = FstBuilder.union(digit, FstBuilder.accept(","));
		Fst first = endsIn(digitOrComma, digit, "1");
		Fst second = endsIn(digitOrComma, digit, "2");
		Fst third = endsIn(digitOrComma, digit, "3");
		Fst rest = FstBuilder.difference(Optimizer.optimize(FstBuilder.plus(digitOrComma)),
				Optimizer.optimize(FstBuilder.union(first, second, third)));
		Fst written = Optimizer.optimize(FstBuilder.union(
				FstBuilder.concat(first, FstBuilder.accept("st")),
				FstBuilder.concat(second, FstBuilder.accept("nd")),
				FstBuilder.concat(third, FstBuilder.accept("rd")),
				FstBuilder.concat(rest, FstBuilder.accept("th"))));
		Fst suffix = FstBuilder.delete(FstBuilder.union(FstBuilder.accept("st"), FstBuilder.accept("nd"),
				FstBuilder.accept("rd"), FstBuilder.accept("th")));
		classify = Optimizer.optimize(TokenMarkers.wrap(NAME,
				TokenMarkers.field("integer", FstBuilder.compose(written, FstBuilder.concat(number, suffix)))));

		verbalize = Optimizer.optimize(TokenMarkers.unwrap(NAME, TokenMarkers.value("integer", alpha)));
		if (debug) Debug.debug(debug, "Ordinal: "+classify.numStates()+" classify states");
	}

	// digit strings whose last digit is d and whose last two digits are not 1d
	private static Fst endsIn(Fst digitOrComma, Fst digit, String d) {
		Fst notOne = FstBuilder.difference(digit, FstBuilder.accept("1"));
		return FstBuilder.concat(FstBuilder.optional(FstBuilder.concat(FstBuilder.star(digitOrComma), notOne)),
				FstBuilder.accept(d));
	}

	/**
	 * Rewrites the last word of a phrase of lower-case words separated by
	 * single spaces: a word the irregular map reads is replaced, any other
	 * word has the suffix appended.
	 */
	public static Fst inflectLastWord(Alphabet alpha, Fst irregular, String suffix) {
		Fst letter = alpha.get(Alphabet.CharClass.ALPHA);
		Fst word = Optimizer.optimize(FstBuilder.plus(letter));
		Fst last = FstBuilder.priorityUnion(irregular, FstBuilder.concat(word, FstBuilder.insert(suffix)), word);
		Fst lead = FstBuilder.optional(FstBuilder.concat(
				FstBuilder.star(FstBuilder.union(letter, FstBuilder.accept(" "))), FstBuilder.accept(" ")));
		return Optimizer.optimize(FstBuilder.concat(lead, last));
	}

	// digits to ordinal words, no suffix: "21" -> "twenty first"
	public Fst getNumber() {
		return number;
	}

	public String getName() {
		return NAME;
	}

	public double getWeight() {
		return Priority.SPECIFIC.getWeight();
	}

	public Fst getClassifyFst() {
		return classify;
	}

	public Fst getVerbalizeFst() {
		return verbalize;
	}
}
