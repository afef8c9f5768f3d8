package edu.isi.verbatim;

import java.util.ArrayList;
import java.util.List;

/**
 * Clock times, 24-hour or with a suffix: <code>9:05 pm</code> becomes
 * <code>time { hours: "nine" minutes: "oh five" suffix: "p m" }</code>.
 * Zero minutes and zero seconds leave their field out, and the spoken form
 * then says "o'clock".
 */
public class TimeGrammar implements Classifier, Verbalizer {
	public static final String NAME = "time";
	public static final String WORDS = "time/words";
	public static final String SUFFIX = "time/suffix";

	private final Fst classify;
	private final Fst verbalize;

	public TimeGrammar(Lexicon lex, NumberReader reader) throws ConfigureException {
		Alphabet alpha = lex.getAlphabet();
		String zero = lex.lookup(NumberReader.ZERO, "0");
		String oh = lex.lookup(WORDS, "oh");

		List<Fst> hourKeys = new ArrayList<Fst>();
		for (int i = 1; i <= 23; i++) {
			hourKeys.add(FstBuilder.accept(Integer.toString(i)));
			if (i < 10)
				hourKeys.add(FstBuilder.accept("0"+i));
		}
		Fst hours = FstBuilder.union(
				FstBuilder.cross("0", zero),
				FstBuilder.cross("00", zero),
				FstBuilder.compose(FstBuilder.union(hourKeys), FstBuilder.union(reader.group(1, false), reader.group(2, true))));

		Fst minutes = FstBuilder.union(
				FstBuilder.concat(FstBuilder.delete("0"), FstBuilder.insert(oh+" "), reader.group(1, false)),
				FstBuilder.compose(sixty(), reader.group(2, false)));
		Fst seconds = FstBuilder.compose(FstBuilder.union(sixty(), leadingZero()), reader.group(2, true));

		Fst minutePart = FstBuilder.union(FstBuilder.delete("00"),
				FstBuilder.concat(TokenMarkers.space(), TokenMarkers.field("minutes", minutes)));
		Fst secondPart = FstBuilder.optional(FstBuilder.concat(FstBuilder.delete(":"), FstBuilder.union(FstBuilder.delete("00"),
				FstBuilder.concat(TokenMarkers.space(), TokenMarkers.field("seconds", seconds)))));
		Fst suffixPart = FstBuilder.optional(FstBuilder.concat(FstBuilder.optional(FstBuilder.delete(" ")),
				TokenMarkers.space(), TokenMarkers.field("suffix", lex.stringMap(SUFFIX))));
		classify = Optimizer.optimize(TokenMarkers.wrap(NAME, FstBuilder.concat(
				TokenMarkers.field("hours", hours), FstBuilder.delete(":"), minutePart, secondPart, suffixPart)));

		String oclock = lex.lookup(WORDS, "oclock");
		String and = lex.lookup(WORDS, "and");
		String secondsWord = lex.lookup(WORDS, "seconds");
		Fst vminutes = FstBuilder.union(
				FstBuilder.concat(TokenMarkers.keepSpace(), TokenMarkers.value("minutes", alpha)),
				FstBuilder.insert(" "+oclock));
		Fst vseconds = FstBuilder.optional(FstBuilder.concat(TokenMarkers.keepSpace(), FstBuilder.insert(and+" "),
				TokenMarkers.value("seconds", alpha), FstBuilder.insert(" "+secondsWord)));
		Fst vsuffix = FstBuilder.optional(FstBuilder.concat(TokenMarkers.keepSpace(), TokenMarkers.value("suffix", alpha)));
		verbalize = Optimizer.optimize(TokenMarkers.unwrap(NAME, FstBuilder.concat(
				TokenMarkers.value("hours", alpha), vminutes, vseconds, vsuffix)));
	}

	// "10" to "59"
	private static Fst sixty() {
		List<Fst> keys = new ArrayList<Fst>();
		for (int i = 10; i < 60; i++)
			keys.add(FstBuilder.accept(Integer.toString(i)));
		return FstBuilder.union(keys);
	}

	// "01" to "09"
	private static Fst leadingZero() {
		List<Fst> keys = new ArrayList<Fst>();
		for (int i = 1; i < 10; i++)
			keys.add(FstBuilder.accept("0"+i));
		return FstBuilder.union(keys);
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
