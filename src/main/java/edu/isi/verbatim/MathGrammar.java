package edu.isi.verbatim;

import gnu.trove.list.array.TIntArrayList;

/**
 * Arithmetic: <code>1+2</code> becomes
 * <code>math { left: "one" operator: "plus" right: "two" }</code>, and
 * <code>a * b = c</code> fills the middle and operator_two fields as well.
 * Operands are numbers, decimals, named constants or single letters; space
 * around the operators is optional.
 * <p>
 * In the tight form <code>10-2=8</code> the dash may also read as "from",
 * offset by {@link Priority#SPECIAL_IDIOM} so that this reading wins.
 */
public class MathGrammar implements Classifier, Verbalizer {
	public static final String NAME = "math";
	public static final String OPERATOR = "math/operator";
	public static final String IDIOM = "math/idiom";
	public static final String CONSTANT = "math/constant";

	private final Fst classify;
	private final Fst verbalize;

	public MathGrammar(Lexicon lex, NumberReader reader, DecimalGrammar decimal) throws ConfigureException {
		Alphabet alpha = lex.getAlphabet();
		Fst operand = FstBuilder.union(reader.getPlain(), decimal.getNumber(), lex.stringMap(CONSTANT), FstBuilder.labelSet(asciiLetters()));
		Fst operator = lex.stringMap(OPERATOR);
		Fst gap = FstBuilder.optional(FstBuilder.delete(" "));

		Fst basic = FstBuilder.concat(
				TokenMarkers.field("left", operand), gap, TokenMarkers.space(),
				TokenMarkers.field("operator", operator), gap, TokenMarkers.space(),
				TokenMarkers.field("right", operand));
		Fst extended = FstBuilder.concat(
				TokenMarkers.field("left", operand), gap, TokenMarkers.space(),
				TokenMarkers.field("operator", operator), gap, TokenMarkers.space(),
				TokenMarkers.field("middle", operand), gap, TokenMarkers.space(),
				TokenMarkers.field("operator_two", operator), gap, TokenMarkers.space(),
				TokenMarkers.field("right", operand));
		// tight a-b=c only
		Fst idiom = FstBuilder.concat(
				TokenMarkers.field("left", operand), TokenMarkers.space(),
				TokenMarkers.field("operator", lex.stringMap(IDIOM)), TokenMarkers.space(),
				TokenMarkers.field("middle", operand), TokenMarkers.space(),
				TokenMarkers.field("operator_two", FstBuilder.compose(FstBuilder.accept("="), operator)), TokenMarkers.space(),
				TokenMarkers.field("right", operand));
		classify = Optimizer.optimize(TokenMarkers.wrap(NAME, FstBuilder.union(basic, extended,
				FstBuilder.addWeight(idiom, Priority.SPECIAL_IDIOM.getWeight()))));

		Fst vbasic = FstBuilder.concat(value("left", alpha), sep(), value("operator", alpha), sep(), value("right", alpha));
		Fst vext = FstBuilder.concat(value("left", alpha), sep(), value("operator", alpha), sep(), value("middle", alpha),
				sep(), value("operator_two", alpha), sep(), value("right", alpha));
		verbalize = Optimizer.optimize(TokenMarkers.unwrap(NAME, FstBuilder.union(vbasic, vext)));
	}

	private static Fst value(String field, Alphabet alpha) {
		return TokenMarkers.value(field, alpha);
	}

	private static Fst sep() {
		return TokenMarkers.keepSpace();
	}

	private static int[] asciiLetters() {
		TIntArrayList l = new TIntArrayList();
		for (int c = 'A'; c <= 'Z'; c++)
			l.add(c);
		for (int c = 'a'; c <= 'z'; c++)
			l.add(c);
		return l.toArray();
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
