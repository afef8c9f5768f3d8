package edu.isi.verbatim;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A small in-memory lexicon over printable ASCII with upper-case spoken
 * forms, so that test expectations cannot be confused with the shipped
 * English data.
 */
final class TestLexicon {
	private static final String[] ONES = {"ZERO", "ONE", "TWO", "THREE", "FOUR", "FIVE", "SIX", "SEVEN", "EIGHT", "NINE"};
	private static final String[] TEENS = {"TEN", "ELEVEN", "TWELVE", "THIRTEEN", "FOURTEEN", "FIFTEEN", "SIXTEEN", "SEVENTEEN", "EIGHTEEN", "NINETEEN"};
	private static final String[] TENS = {"", "", "TWENTY", "THIRTY", "FORTY", "FIFTY", "SIXTY", "SEVENTY", "EIGHTY", "NINETY"};

	private TestLexicon() {
	}

	static Alphabet asciiAlphabet() throws ConfigureException {
		List<Integer> cps = new ArrayList<Integer>();
		cps.add((int)'\t');
		cps.add((int)'\n');
		for (int c = 0x20; c <= 0x7E; c++)
			cps.add(c);
		int[] a = new int[cps.size()];
		for (int i = 0; i < a.length; i++)
			a[i] = cps.get(i);
		return new Alphabet(a);
	}

	static Map<String, LexiconTable> numberTables() {
		Map<String, LexiconTable> t = new LinkedHashMap<String, LexiconTable>();
		t.put(NumberReader.ZERO, LexiconTable.of(NumberReader.ZERO, "0", "ZERO"));
		String[] digits = new String[18];
		for (int i = 1; i <= 9; i++) {
			digits[2*(i-1)] = Integer.toString(i);
			digits[2*(i-1)+1] = ONES[i];
		}
		t.put(NumberReader.DIGIT, LexiconTable.of(NumberReader.DIGIT, digits));
		String[] two = new String[180];
		for (int n = 10; n < 100; n++) {
			String spoken = n < 20 ? TEENS[n-10] : (n%10 == 0 ? TENS[n/10] : TENS[n/10]+" "+ONES[n%10]);
			two[2*(n-10)] = Integer.toString(n);
			two[2*(n-10)+1] = spoken;
		}
		t.put(NumberReader.TWO_DIGIT, LexiconTable.of(NumberReader.TWO_DIGIT, two));
		t.put(NumberReader.MAGNITUDE, LexiconTable.of(NumberReader.MAGNITUDE,
				"100", "HUNDRED", "1000", "THOUSAND", "1000000", "MILLION", "1000000000", "BILLION"));
		t.put(CardinalGrammar.SIGN, LexiconTable.of(CardinalGrammar.SIGN, "-", "MINUS"));
		return t;
	}

	// numbers, decimals and arithmetic
	static Lexicon mathLexicon() throws ConfigureException {
		Map<String, LexiconTable> t = numberTables();
		t.put(DecimalGrammar.SEPARATOR, LexiconTable.of(DecimalGrammar.SEPARATOR, ".", "POINT"));
		t.put(MathGrammar.OPERATOR, LexiconTable.of(MathGrammar.OPERATOR,
				"+", "PLUS", "-", "MINUS", "*", "TIMES", "=", "EQUALS"));
		t.put(MathGrammar.IDIOM, LexiconTable.of(MathGrammar.IDIOM, "-", "FROM"));
		t.put(MathGrammar.CONSTANT, LexiconTable.of(MathGrammar.CONSTANT, "pi", "PI"));
		return new Lexicon("test", asciiAlphabet(), t);
	}

	static Lexicon with(String name, LexiconTable table) throws ConfigureException {
		Map<String, LexiconTable> t = numberTables();
		t.put(name, table);
		return new Lexicon("test", asciiAlphabet(), t);
	}
}
