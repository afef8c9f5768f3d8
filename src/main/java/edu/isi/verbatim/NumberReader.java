package edu.isi.verbatim;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads digit strings as number names, driven by the magnitude table.
 * Digits are split into groups at the exponents of the magnitudes above a
 * hundred (3, 6, 9 for thousand, million, billion; 3, 5, 7 for thousand,
 * lakh, crore), each group is read with the hundred/two-digit/digit tables,
 * and groups that are all zeros stay silent. Groups may be at most three
 * digits wide.
 */
public class NumberReader {
	public static final String ZERO = "numbers/zero";
	public static final String DIGIT = "numbers/digit";
	public static final String TWO_DIGIT = "numbers/two_digit";
	public static final String MAGNITUDE = "numbers/magnitude";

	private final Fst digit;
	private final Fst zero;
	private final Fst twoDigit;
	private final Fst digitChar;
	private final String hundred;
	private final TreeMap<Integer, String> scales = new TreeMap<Integer, String>();
	private final int maxDigits;

	private Fst plain = null;
	private Fst grouped = null;
	private Fst digitByDigit = null;
	private Fst any = null;

	public NumberReader(Lexicon lex) throws ConfigureException {
		digit = lex.stringMap(DIGIT);
		zero = lex.stringMap(ZERO);
		twoDigit = lex.stringMap(TWO_DIGIT);
		digitChar = lex.getAlphabet().get(Alphabet.CharClass.DIGIT);
		String h = null;
		for (LexiconTable.Row r : lex.getTable(MAGNITUDE).getRows()) {
			String k = r.getKey();
			if (!k.matches("10+"))
				throw new ConfigureException("Magnitude "+k+" is not a power of ten");
			int exp = k.length()-1;
			if (exp == 2)
				h = r.getValue();
			else if (exp >= 3)
				scales.put(exp, r.getValue());
			else
				throw new ConfigureException("Magnitude "+k+" is below a hundred");
		}
		if (h == null)
			throw new ConfigureException("Table "+MAGNITUDE+" has no entry for 100");
		hundred = h;
		int prev = 0;
		for (int e : scales.keySet()) {
			if (e-prev > 3)
				throw new ConfigureException("Magnitude 10^"+e+" leaves a group of "+(e-prev)+" digits; at most 3 can be read");
			prev = e;
		}
		maxDigits = prev+3;
	}

	public int getMaxDigits() {
		return maxDigits;
	}

	// one digit, zero included
	public Fst getSingleDigit() {
		return FstBuilder.union(zero, digit);
	}

	/**
	 * Exactly w digits (1 to 3) read as one number with value above zero.
	 * With leadingZeros, "07" reads as seven; without, the first digit is
	 * never 0.
	 */
	public Fst group(int w, boolean leadingZeros) {
		switch (w) {
		case 1:
			return digit;
		case 2:
			if (!leadingZeros)
				return twoDigit;
			return FstBuilder.union(FstBuilder.concat(FstBuilder.delete("0"), digit), twoDigit);
		case 3:
			Fst rest = FstBuilder.union(FstBuilder.delete("00"), FstBuilder.concat(FstBuilder.insert(" "), group(2, true)));
			Fst hundreds = FstBuilder.concat(digit, FstBuilder.insert(" "+hundred), rest);
			if (!leadingZeros)
				return hundreds;
			return FstBuilder.union(hundreds, FstBuilder.concat(FstBuilder.delete("0"), group(2, true)));
		default:
			throw new IllegalArgumentException("Digit groups are 1 to 3 wide, not "+w);
		}
	}

	// n digits, first one non-zero; null if n is out of reach
	private Fst length(int n, boolean commas) {
		List<Integer> bounds = new ArrayList<Integer>();
		bounds.add(0);
		for (int e : scales.keySet())
			if (e < n)
				bounds.add(e);
		int low = bounds.get(bounds.size()-1);
		if (n-low > 3)
			return null;
		if (commas && bounds.size() < 2)
			return null;
		List<Fst> parts = new ArrayList<Fst>();
		parts.add(group(n-low, false));
		if (low > 0)
			parts.add(FstBuilder.insert(" "+scales.get(low)));
		for (int i = bounds.size()-2; i >= 0; i--) {
			int lo = bounds.get(i), w = bounds.get(i+1)-lo;
			Fst spoken = FstBuilder.concat(FstBuilder.insert(" "), group(w, true),
					lo > 0 ? FstBuilder.insert(" "+scales.get(lo)) : FstBuilder.epsilon());
			Fst part = FstBuilder.union(spoken, FstBuilder.delete(zeros(w)));
			if (commas)
				part = FstBuilder.concat(FstBuilder.delete(","), part);
			parts.add(part);
		}
		return FstBuilder.concat(parts);
	}

	private static String zeros(int w) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < w; i++)
			sb.append('0');
		return sb.toString();
	}

	// digit strings without leading zeros, "0" itself included
	public Fst getPlain() {
		if (plain == null) {
			List<Fst> alts = new ArrayList<Fst>();
			alts.add(zero);
			for (int n = 1; n <= maxDigits; n++)
				alts.add(length(n, false));
			plain = Optimizer.optimize(FstBuilder.union(alts));
		}
		return plain;
	}

	// digits with a comma at every group boundary: 1,000,000
	public Fst getGrouped() {
		if (grouped == null) {
			List<Fst> alts = new ArrayList<Fst>();
			for (int n = 1; n <= maxDigits; n++) {
				Fst f = length(n, true);
				if (f != null)
					alts.add(f);
			}
			grouped = Optimizer.optimize(FstBuilder.union(alts));
		}
		return grouped;
	}

	// "0 4 2" style: one word per digit
	public Fst getDigitByDigit() {
		if (digitByDigit == null) {
			Fst d = getSingleDigit();
			digitByDigit = Optimizer.optimize(FstBuilder.concat(d, FstBuilder.star(FstBuilder.concat(FstBuilder.insert(" "), d))));
		}
		return digitByDigit;
	}

	/**
	 * Any digit string: plain and comma-grouped numbers as number names;
	 * strings with a leading zero, and strings too long to name, digit by
	 * digit.
	 */
	public Fst getAny() {
		if (any == null) {
			Fst leadingZero = FstBuilder.concat(FstBuilder.accept("0"), FstBuilder.plus(digitChar));
			Fst tooLong = FstBuilder.closure(digitChar, maxDigits+1, -1);
			Fst spelled = FstBuilder.compose(FstBuilder.union(leadingZero, tooLong), getDigitByDigit());
			any = Optimizer.optimize(FstBuilder.union(getPlain(), getGrouped(), spelled));
		}
		return any;
	}

	// the magnitude names above a hundred, by exponent
	public Map<Integer, String> getScales() {
		return scales;
	}
}
