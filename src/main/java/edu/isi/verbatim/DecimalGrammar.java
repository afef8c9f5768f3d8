package edu.isi.verbatim;

/**
 * Decimal fractions: <code>-3.14</code> becomes
 * <code>decimal { negative: "true" integer_part: "three" fractional_part: "one four" }</code>.
 * The fractional part is read digit by digit.
 */
public class DecimalGrammar implements Classifier, Verbalizer {
	public static final String NAME = "decimal";
	public static final String SEPARATOR = "decimal/separator";

	private final Fst classify;
	private final Fst verbalize;
	private final Fst number;

	public DecimalGrammar(Lexicon lex, NumberReader reader) throws ConfigureException {
		Alphabet alpha = lex.getAlphabet();
		Fst negative = FstBuilder.optional(FstBuilder.concat(FstBuilder.delete(lex.keys(CardinalGrammar.SIGN)),
				FstBuilder.insert("negative: \"true\""), TokenMarkers.space()));
		Fst separator = FstBuilder.delete(lex.keys(SEPARATOR));
		classify = Optimizer.optimize(TokenMarkers.wrap(NAME, FstBuilder.concat(negative,
				TokenMarkers.field("integer_part", reader.getAny()), separator, TokenMarkers.space(),
				TokenMarkers.field("fractional_part", reader.getDigitByDigit()))));

		String point = lex.getTable(SEPARATOR).getRows().get(0).getValue();
		number = Optimizer.optimize(FstBuilder.concat(reader.getPlain(), separator, FstBuilder.insert(" "+point+" "), reader.getDigitByDigit()));

		String minus = lex.lookup(CardinalGrammar.SIGN, "-");
		Fst unsign = FstBuilder.optional(FstBuilder.concat(FstBuilder.cross("negative: \"true\"", minus), TokenMarkers.keepSpace()));
		verbalize = Optimizer.optimize(TokenMarkers.unwrap(NAME, FstBuilder.concat(unsign,
				TokenMarkers.value("integer_part", alpha), TokenMarkers.keepSpace(), FstBuilder.insert(point+" "),
				TokenMarkers.value("fractional_part", alpha))));
	}

	// unsigned decimal read in one go, "3.14" -> "three point one four"
	public Fst getNumber() {
		return number;
	}

	public String getName() {
		return NAME;
	}

	public double getWeight() {
		return Priority.GENERIC.getWeight();
	}

	public Fst getClassifyFst() {
		return classify;
	}

	public Fst getVerbalizeFst() {
		return verbalize;
	}
}
