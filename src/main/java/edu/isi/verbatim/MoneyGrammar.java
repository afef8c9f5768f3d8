package edu.isi.verbatim;

import java.util.ArrayList;
import java.util.List;

/**
 * Currency amounts written with a leading symbol: <code>$5.50</code> becomes
 * <code>money { integer_part: "five" currency: "dollars" fractional_part: "fifty" minor_currency: "cents" }</code>.
 * An amount of exactly one takes the singular currency name; ".00" and
 * ".0" are dropped. A one-digit minor part counts tens, so <code>$1.5</code>
 * is one dollar and fifty cents. Longer fractions, and any fraction of a
 * currency without a minor unit, read the amount as a decimal:
 * <code>$1.505</code> becomes
 * <code>money { integer_part: "one point five zero five" currency: "dollars" }</code>.
 */
public class MoneyGrammar implements Classifier, Verbalizer {
	public static final String NAME = "money";
	public static final String CURRENCY = "money/currency";
	public static final String CURRENCY_SINGULAR = "money/currency_singular";
	public static final String MINOR_CURRENCY = "money/minor_currency";
	public static final String WORDS = "money/words";

	private final Fst classify;
	private final Fst verbalize;

	public MoneyGrammar(Lexicon lex, NumberReader reader, DecimalGrammar decimal) throws ConfigureException {
		boolean debug = false;
		Alphabet alpha = lex.getAlphabet();
		Fst digit = alpha.get(Alphabet.CharClass.DIGIT);
		Fst amount = reader.getAny();
		Fst one = FstBuilder.compose(FstBuilder.accept("1"), amount);
		Fst many = FstBuilder.compose(FstBuilder.difference(Optimizer.optimize(FstBuilder.project(amount, FstBuilder.Tape.INPUT)),
				FstBuilder.accept("1")), amount);
		Fst nonZero = FstBuilder.difference(digit, FstBuilder.accept("0"));
		Fst minorAmount = FstBuilder.union(
				FstBuilder.compose(FstBuilder.difference(FstBuilder.closure(digit, 2, 2), FstBuilder.accept("00")), reader.group(2, true)),
				FstBuilder.compose(FstBuilder.concat(nonZero, FstBuilder.insert("0")), reader.group(2, false)));
		Fst plainDigits = Optimizer.optimize(FstBuilder.project(reader.getPlain(), FstBuilder.Tape.INPUT));
		Fst zeros = FstBuilder.union(FstBuilder.accept("0"), FstBuilder.accept("00"));
		Fst gap = FstBuilder.optional(FstBuilder.delete(" "));

		LexiconTable minors = lex.getTable(MINOR_CURRENCY);
		List<Fst> alts = new ArrayList<Fst>();
		for (LexiconTable.Row r : lex.getTable(CURRENCY).getRows()) {
			String sym = r.getKey();
			String singular = lex.lookup(CURRENCY_SINGULAR, sym);
			Fst major = FstBuilder.union(
					FstBuilder.concat(TokenMarkers.field("integer_part", one), TokenMarkers.space(),
							TokenMarkers.field("currency", FstBuilder.insert(singular))),
					FstBuilder.concat(TokenMarkers.field("integer_part", many), TokenMarkers.space(),
							TokenMarkers.field("currency", FstBuilder.insert(r.getValue()))));
			Fst minor = FstBuilder.union(FstBuilder.delete(".00"), FstBuilder.delete(".0"));
			List<String> minorNames = minors.lookup(sym);
			Fst fraction;
			if (!minorNames.isEmpty()) {
				minor = FstBuilder.union(minor, FstBuilder.concat(FstBuilder.delete("."),
						TokenMarkers.space(), TokenMarkers.field("fractional_part", minorAmount),
						TokenMarkers.space(), TokenMarkers.field("minor_currency", FstBuilder.insert(minorNames.get(0)))));
				fraction = FstBuilder.closure(digit, 3, -1);
			}
			else
				fraction = FstBuilder.difference(Optimizer.optimize(FstBuilder.plus(digit)), zeros);
			Fst decimalAmount = FstBuilder.compose(FstBuilder.concat(plainDigits, FstBuilder.accept("."), fraction), decimal.getNumber());
			Fst asDecimal = FstBuilder.concat(TokenMarkers.field("integer_part", decimalAmount), TokenMarkers.space(),
					TokenMarkers.field("currency", FstBuilder.insert(r.getValue())));
			alts.add(FstBuilder.concat(FstBuilder.delete(sym), gap,
					FstBuilder.union(FstBuilder.concat(major, FstBuilder.optional(minor)), asDecimal)));
			if (debug) Debug.debug(debug, "Money: "+sym+" -> "+r.getValue()+(minorNames.isEmpty() ? "" : " / "+minorNames.get(0)));
		}
		classify = Optimizer.optimize(TokenMarkers.wrap(NAME, FstBuilder.union(alts)));

		String and = lex.lookup(WORDS, "and");
		Fst vminor = FstBuilder.optional(FstBuilder.concat(TokenMarkers.keepSpace(), FstBuilder.insert(and+" "),
				TokenMarkers.value("fractional_part", alpha), TokenMarkers.keepSpace(),
				TokenMarkers.value("minor_currency", alpha)));
		verbalize = Optimizer.optimize(TokenMarkers.unwrap(NAME, FstBuilder.concat(
				TokenMarkers.value("integer_part", alpha), TokenMarkers.keepSpace(),
				TokenMarkers.value("currency", alpha), vminor)));
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
