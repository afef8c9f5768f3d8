package edu.isi.verbatim;

/**
 * Whole numbers: <code>-1,234</code> becomes
 * <code>cardinal { negative: "true" integer: "one thousand two hundred thirty four" }</code>.
 * <p>
 * Plain digit strings of 7 to 10 digits are left to the telephone grammar
 * unless they end in six zeros.
 */
public class CardinalGrammar implements Classifier, Verbalizer {
	public static final String NAME = "cardinal";
	public static final String SIGN = "numbers/sign";
	public static final String DIGIT_SCRIPT = "numbers/digit_script";
	/** extra cost of the digit-by-digit reading offered in non-deterministic mode */
	public static final double ALTERNATIVE_WEIGHT = 0.0001;

	private final Fst number;
	private final Fst classify;
	private final Fst verbalize;

	public CardinalGrammar(Lexicon lex, boolean deterministic) throws ConfigureException {
		this(lex, new NumberReader(lex), deterministic);
	}

	public CardinalGrammar(Lexicon lex, NumberReader reader, boolean deterministic) throws ConfigureException {
		boolean debug = false;
		Alphabet alpha = lex.getAlphabet();
		Fst digit = alpha.get(Alphabet.CharClass.DIGIT);

		Fst any = reader.getAny();
		if (!deterministic)
			any = FstBuilder.union(any,
					FstBuilder.addWeight(FstBuilder.compose(FstBuilder.closure(digit, 2, -1), reader.getDigitByDigit()), ALTERNATIVE_WEIGHT));

		// telephone-shaped: 7 to 10 digits, not a round number of millions
		Fst phoneShaped = FstBuilder.difference(FstBuilder.closure(digit, 7, 10),
				FstBuilder.concat(FstBuilder.closure(digit, 1, 4), FstBuilder.accept("000000")));
		Fst domain = FstBuilder.difference(Optimizer.optimize(FstBuilder.project(any, FstBuilder.Tape.INPUT)), phoneShaped);
		Fst ascii = FstBuilder.compose(domain, any);
		Fst n = ascii;
		if (lex.hasTable(DIGIT_SCRIPT))
			n = FstBuilder.union(ascii, FstBuilder.compose(FstBuilder.plus(lex.stringMap(DIGIT_SCRIPT)), ascii));
		number = Optimizer.optimize(n);

		Fst negative = FstBuilder.optional(FstBuilder.concat(FstBuilder.delete(lex.keys(SIGN)),
				FstBuilder.insert("negative: \"true\""), TokenMarkers.space()));
		classify = Optimizer.optimize(TokenMarkers.wrap(NAME, FstBuilder.concat(negative, TokenMarkers.field("integer", number))));

		String minus = lex.lookup(SIGN, "-");
		Fst unsign = FstBuilder.optional(FstBuilder.concat(FstBuilder.cross("negative: \"true\"", minus), TokenMarkers.keepSpace()));
		verbalize = Optimizer.optimize(TokenMarkers.unwrap(NAME, FstBuilder.concat(unsign, TokenMarkers.value("integer", alpha))));
		if (debug) Debug.debug(debug, "Cardinal: "+classify.numStates()+" classify states, "+verbalize.numStates()+" verbalize states");
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

	// unsigned digits to number names, telephone shapes excluded
	public Fst getNumber() {
		return number;
	}
}
