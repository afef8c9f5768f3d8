package edu.isi.verbatim;

import gnu.trove.list.array.TIntArrayList;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * English. Categories are declared most specific first, which only
 * matters for exact ties.
 */
public class EnglishPack extends LanguagePack {
	// square root, n-ary sum, n-ary product, integral, partial differential, nabla
	private static final int[] MATH_SYMBOLS = new int[] {0x221A, 0x2211, 0x220F, 0x222B, 0x2202, 0x2207};
	private static final String EM_DASH = "—";

	public String getLanguage() {
		return "en";
	}

	public GrammarSet build(Lexicon lex, NormalizerConfig config) throws ConfigureException {
		Date start = new Date();
		Alphabet alpha = lex.getAlphabet();
		NumberReader reader = new NumberReader(lex);
		boolean det = config.isDeterministic();

		CardinalGrammar cardinal = new CardinalGrammar(lex, reader, det);
		DecimalGrammar decimal = new DecimalGrammar(lex, reader);
		TelephoneGrammar telephone = new TelephoneGrammar(lex, reader);
		DateGrammar date = new DateGrammar(lex, reader);
		TimeGrammar time = new TimeGrammar(lex, reader);
		MoneyGrammar money = new MoneyGrammar(lex, reader, decimal);
		MathGrammar math = new MathGrammar(lex, reader, decimal);
		OrdinalGrammar ordinal = new OrdinalGrammar(lex, reader);
		FractionGrammar fraction = new FractionGrammar(lex, reader, ordinal);
		MeasureGrammar measure = new MeasureGrammar(lex, reader, decimal);
		WhitelistGrammar whitelist = new WhitelistGrammar(lex, config.getInputCase() == NormalizerConfig.InputCase.LOWER_CASED);
		Debug.dbtime(2, start, "built en categories");

		List<Classifier> classifiers = new ArrayList<Classifier>();
		classifiers.add(whitelist);
		classifiers.add(telephone);
		classifiers.add(date);
		classifiers.add(time);
		classifiers.add(fraction);
		classifiers.add(measure);
		classifiers.add(ordinal);
		classifiers.add(money);
		classifiers.add(decimal);
		classifiers.add(cardinal);
		classifiers.add(math);

		List<Verbalizer> verbalizers = new ArrayList<Verbalizer>();
		verbalizers.add(telephone);
		verbalizers.add(date);
		verbalizers.add(time);
		verbalizers.add(fraction);
		verbalizers.add(measure);
		verbalizers.add(ordinal);
		verbalizers.add(money);
		verbalizers.add(decimal);
		verbalizers.add(cardinal);
		verbalizers.add(math);
		verbalizers.add(new PlainVerbalizer(alpha));

		return new GrammarSet(alpha, buildCascade(alpha), classifiers,
				new PunctuationGrammar(lex), new WordGrammar(lex), verbalizers);
	}

	/**
	 * Spacing fixes applied before classification, in order:
	 * space after a math symbol glued to a digit or letter (√2),
	 * an em dash between a digit and a letter becomes a space,
	 * space after an em dash glued to a digit,
	 * spaces around '=' glued between a non-digit and a digit,
	 * a hyphen between a digit and a letter becomes a space.
	 */
	public static RewriteCascade buildCascade(Alphabet alpha) throws ConfigureException {
		Date start = new Date();
		Fst digit = alpha.get(Alphabet.CharClass.DIGIT);
		Fst letter = alpha.get(Alphabet.CharClass.ALPHA);
		TIntArrayList nonDigit = new TIntArrayList();
		for (int l : alpha.labels(Alphabet.CharClass.NOT_SPACE))
			if (l < '0' || l > '9')
				nonDigit.add(l);

		RewriteCascade c = new RewriteCascade();
		c.add("math_symbol_spacing", Rewrite.compile(FstBuilder.insert(" "),
				FstBuilder.labelSet(MATH_SYMBOLS), FstBuilder.union(digit, letter), alpha));
		c.add("em_dash_joiner", Rewrite.compile(FstBuilder.cross(EM_DASH, " "), digit, letter, alpha));
		c.add("em_dash_before_digit", Rewrite.compile(FstBuilder.cross(EM_DASH, EM_DASH+" "), null, digit, alpha));
		c.add("glued_equals", Rewrite.compile(FstBuilder.cross("=", " = "), FstBuilder.labelSet(nonDigit.toArray()), digit, alpha));
		c.add("joiner_hyphen", Rewrite.compile(FstBuilder.cross("-", " "), digit, letter, alpha));
		Debug.dbtime(2, start, "compiled "+c.size()+" rewrite rules");
		return c;
	}
}
