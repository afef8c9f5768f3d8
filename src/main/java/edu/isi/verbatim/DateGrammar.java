package edu.isi.verbatim;

import java.util.ArrayList;
import java.util.List;

/**
 * Numeric day-month-year dates: <code>15/08/1947</code> becomes
 * <code>date { day: "fifteen" month: "august" year: "one thousand nine hundred forty seven" }</code>.
 * Both separators must be the same, one of '/', '-' or '.'.
 */
public class DateGrammar implements Classifier, Verbalizer {
	public static final String NAME = "date";
	public static final String MONTH = "date/month";
	private static final String[] SEPARATORS = new String[] {"/", "-", "."};

	private final Fst classify;
	private final Fst verbalize;

	public DateGrammar(Lexicon lex, NumberReader reader) throws ConfigureException {
		Alphabet alpha = lex.getAlphabet();
		Fst digit = alpha.get(Alphabet.CharClass.DIGIT);

		List<Fst> days = new ArrayList<Fst>();
		for (int i = 1; i <= 31; i++) {
			days.add(FstBuilder.accept(Integer.toString(i)));
			if (i < 10)
				days.add(FstBuilder.accept("0"+i));
		}
		Fst day = FstBuilder.compose(FstBuilder.union(days), FstBuilder.union(reader.group(1, false), reader.group(2, true)));
		Fst month = lex.stringMap(MONTH);
		Fst nonZero = FstBuilder.difference(digit, FstBuilder.accept("0"));
		Fst year = FstBuilder.compose(FstBuilder.concat(nonZero, FstBuilder.closure(digit, 3, 3)), reader.getPlain());

		List<Fst> shapes = new ArrayList<Fst>();
		for (String sep : SEPARATORS) {
			shapes.add(FstBuilder.concat(
					TokenMarkers.field("day", day),
					FstBuilder.delete(sep), TokenMarkers.space(),
					TokenMarkers.field("month", month),
					FstBuilder.delete(sep), TokenMarkers.space(),
					TokenMarkers.field("year", year)));
		}
		classify = Optimizer.optimize(TokenMarkers.wrap(NAME, FstBuilder.union(shapes)));

		verbalize = Optimizer.optimize(TokenMarkers.unwrap(NAME, FstBuilder.concat(
				TokenMarkers.value("day", alpha), TokenMarkers.keepSpace(),
				TokenMarkers.value("month", alpha), TokenMarkers.keepSpace(),
				TokenMarkers.value("year", alpha))));
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
