package edu.isi.verbatim;

import java.util.ArrayList;
import java.util.List;

/**
 * Quantities with a unit after them, with or without a space:
 * <code>-12.5kg</code> becomes
 * <code>measure { negative: "true" amount: "twelve point five" units: "kilograms" }</code>
 * and <code>5%</code> becomes <code>measure { amount: "five" units: "percent" }</code>.
 * An amount of exactly one takes the singular unit name.
 */
public class MeasureGrammar implements Classifier, Verbalizer {
	public static final String NAME = "measure";
	public static final String UNIT = "measure/unit";
	public static final String UNIT_SINGULAR = "measure/unit_singular";

	private final Fst classify;
	private final Fst verbalize;

	public MeasureGrammar(Lexicon lex, NumberReader reader, DecimalGrammar decimal) throws ConfigureException {
		boolean debug = false;
		Alphabet alpha = lex.getAlphabet();
		Fst amount = FstBuilder.union(reader.getPlain(), reader.getGrouped(), decimal.getNumber());
		Fst one = FstBuilder.compose(FstBuilder.accept("1"), amount);
		Fst many = FstBuilder.compose(FstBuilder.difference(Optimizer.optimize(FstBuilder.project(amount, FstBuilder.Tape.INPUT)),
				FstBuilder.accept("1")), amount);
		Fst gap = FstBuilder.optional(FstBuilder.delete(" "));

		List<Fst> alts = new ArrayList<Fst>();
		alts.add(FstBuilder.concat(TokenMarkers.field("amount", one), gap, TokenMarkers.space(),
				TokenMarkers.field("units", lex.stringMap(UNIT_SINGULAR))));
		alts.add(FstBuilder.concat(TokenMarkers.field("amount", many), gap, TokenMarkers.space(),
				TokenMarkers.field("units", lex.stringMap(UNIT))));
		Fst negative = FstBuilder.optional(FstBuilder.concat(FstBuilder.delete(lex.keys(CardinalGrammar.SIGN)),
				FstBuilder.insert("negative: \"true\""), TokenMarkers.space()));
		classify = Optimizer.optimize(TokenMarkers.wrap(NAME, FstBuilder.concat(negative, FstBuilder.union(alts))));

		String minus = lex.lookup(CardinalGrammar.SIGN, "-");
		Fst unsign = FstBuilder.optional(FstBuilder.concat(FstBuilder.cross("negative: \"true\"", minus), TokenMarkers.keepSpace()));
		verbalize = Optimizer.optimize(TokenMarkers.unwrap(NAME, FstBuilder.concat(unsign,
				TokenMarkers.value("amount", alpha), TokenMarkers.keepSpace(),
				TokenMarkers.value("units", alpha))));
		if (debug) Debug.debug(debug, "Measure: "+lex.getTable(UNIT).getRows().size()+" units");
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
