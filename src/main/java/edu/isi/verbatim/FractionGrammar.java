package edu.isi.verbatim;

import java.util.ArrayList;
import java.util.List;

/**
 * Fractions with a slash, optionally after a whole number, and the
 * vulgar fraction characters: <code>2 3/4</code> becomes
 * <code>fraction { integer_part: "two" numerator: "three" denominator: "quarters" }</code>.
 * The denominator is read as an ordinal, plural unless the numerator is
 * one. Denominators 0 and 1 are not fractions.
 */
public class FractionGrammar implements Classifier, Verbalizer {
	public static final String NAME = "fraction";
	public static final String DENOMINATOR = "fraction/denominator";
	public static final String PLURAL = "fraction/plural";
	public static final String VULGAR = "fraction/vulgar";
	public static final String WORDS = "fraction/words";

	private final Fst classify;
	private final Fst verbalize;

	public FractionGrammar(Lexicon lex, NumberReader reader, OrdinalGrammar ordinal) throws ConfigureException {
		Alphabet alpha = lex.getAlphabet();
		Fst plain = reader.getPlain();
		Fst plainDigits = Optimizer.optimize(FstBuilder.project(plain, FstBuilder.Tape.INPUT));

		Fst denominatorDigits = FstBuilder.difference(plainDigits,
				FstBuilder.union(FstBuilder.accept("0"), FstBuilder.accept("1")));
		Fst singular = FstBuilder.priorityUnion(lex.stringMap(DENOMINATOR),
				FstBuilder.compose(denominatorDigits, ordinal.getNumber()), denominatorDigits);
		Fst plural = FstBuilder.compose(singular, OrdinalGrammar.inflectLastWord(alpha, lex.stringMap(PLURAL), "s"));

		Fst one = FstBuilder.compose(FstBuilder.accept("1"), plain);
		Fst many = FstBuilder.compose(FstBuilder.difference(plainDigits, FstBuilder.accept("1")), plain);
		Fst slash = FstBuilder.concat(FstBuilder.delete("/"), TokenMarkers.space());
		Fst simple = FstBuilder.union(
				FstBuilder.concat(TokenMarkers.field("numerator", one), slash, TokenMarkers.field("denominator", singular)),
				FstBuilder.concat(TokenMarkers.field("numerator", many), slash, TokenMarkers.field("denominator", plural)));
		Fst vulgar = FstBuilder.compose(lex.stringMap(VULGAR), simple);

		Fst whole = FstBuilder.concat(TokenMarkers.field("integer_part", plain), TokenMarkers.space());
		List<Fst> shapes = new ArrayList<Fst>();
		shapes.add(simple);
		shapes.add(vulgar);
		shapes.add(FstBuilder.concat(whole, FstBuilder.delete(" "), simple));
		shapes.add(FstBuilder.concat(whole, FstBuilder.optional(FstBuilder.delete(" ")), vulgar));
		classify = Optimizer.optimize(TokenMarkers.wrap(NAME, FstBuilder.union(shapes)));

		String and = lex.lookup(WORDS, "and");
		Fst vwhole = FstBuilder.optional(FstBuilder.concat(TokenMarkers.value("integer_part", alpha),
				TokenMarkers.keepSpace(), FstBuilder.insert(and+" ")));
		verbalize = Optimizer.optimize(TokenMarkers.unwrap(NAME, FstBuilder.concat(vwhole,
				TokenMarkers.value("numerator", alpha), TokenMarkers.keepSpace(),
				TokenMarkers.value("denominator", alpha))));
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
