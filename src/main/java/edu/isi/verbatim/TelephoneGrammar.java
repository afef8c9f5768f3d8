package edu.isi.verbatim;

/**
 * Telephone numbers, read digit by digit:
 * <code>+1 555-123-4567 ext. 89</code> becomes
 * <code>telephone { country_code: "plus one" number_part: "five five five one two three four five six seven" extension: "eight nine" }</code>.
 * <p>
 * Separated shapes are 3-3-4, 3-4 and 2-4-4 with dashes, or 3-3-4 and
 * 2-4-4 with dots. Bare runs of 7 to 10 digits also qualify, at a small
 * extra cost so that a round number still reads as a cardinal.
 */
public class TelephoneGrammar implements Classifier, Verbalizer {
	public static final String NAME = "telephone";
	public static final String SYMBOL = "telephone/symbol";
	public static final String EXTENSION = "telephone/extension";
	public static final double BARE_RUN_WEIGHT = 0.1;

	private final Fst classify;
	private final Fst verbalize;

	public TelephoneGrammar(Lexicon lex, NumberReader reader) throws ConfigureException {
		Alphabet alpha = lex.getAlphabet();
		Fst d = reader.getSingleDigit();

		Fst bare = FstBuilder.addWeight(run(d, 7, 10), BARE_RUN_WEIGHT);
		Fst dash = sep("-");
		Fst dot = sep(".");
		Fst shaped = FstBuilder.union(
				FstBuilder.concat(run(d, 3, 3), dash, run(d, 3, 3), dash, run(d, 4, 4)),
				FstBuilder.concat(run(d, 3, 3), dash, run(d, 4, 4)),
				FstBuilder.concat(run(d, 2, 2), dash, run(d, 4, 4), dash, run(d, 4, 4)),
				FstBuilder.concat(run(d, 3, 3), dot, run(d, 3, 3), dot, run(d, 4, 4)),
				FstBuilder.concat(run(d, 2, 2), dot, run(d, 4, 4), dot, run(d, 4, 4)));
		Fst number = FstBuilder.union(shaped, bare);

		// +cc, then a space or a dash before the number
		Fst countryCode = FstBuilder.concat(lex.stringMap(SYMBOL), FstBuilder.insert(" "), run(d, 1, 3),
				FstBuilder.union(FstBuilder.delete(" "), FstBuilder.delete("-")));
		Fst extension = FstBuilder.concat(FstBuilder.delete(" "), FstBuilder.delete(lex.keys(EXTENSION)),
				FstBuilder.optional(FstBuilder.delete(" ")), run(d, 1, 5));

		Fst body = FstBuilder.concat(
				FstBuilder.optional(FstBuilder.concat(TokenMarkers.field("country_code", countryCode), TokenMarkers.space())),
				TokenMarkers.field("number_part", number),
				FstBuilder.optional(FstBuilder.concat(TokenMarkers.space(), TokenMarkers.field("extension", extension))));
		classify = Optimizer.optimize(TokenMarkers.wrap(NAME, body));

		String ext = lex.lookup(EXTENSION, "ext");
		Fst vbody = FstBuilder.concat(
				FstBuilder.optional(FstBuilder.concat(TokenMarkers.value("country_code", alpha), TokenMarkers.keepSpace())),
				TokenMarkers.value("number_part", alpha),
				FstBuilder.optional(FstBuilder.concat(TokenMarkers.keepSpace(), FstBuilder.insert(ext+" "), TokenMarkers.value("extension", alpha))));
		verbalize = Optimizer.optimize(TokenMarkers.unwrap(NAME, vbody));
	}

	// min to max single digits, one word each
	private static Fst run(Fst digit, int min, int max) {
		Fst next = FstBuilder.concat(FstBuilder.insert(" "), digit);
		return FstBuilder.concat(digit, FstBuilder.closure(next, min-1, max-1));
	}

	private static Fst sep(String s) {
		return FstBuilder.concat(FstBuilder.delete(s), FstBuilder.insert(" "));
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
