package edu.isi.verbatim;

import gnu.trove.list.array.TIntArrayList;

/**
 * Runs of punctuation as plain tokens, kept as written:
 * <code>!?</code> becomes <code>name: "!?"</code>. A lone '=' is spoken
 * through the math operator table.
 */
public class PunctuationGrammar implements Classifier {
	public static final String NAME = "punctuation";

	private final Fst classify;

	public PunctuationGrammar(Lexicon lex) throws ConfigureException {
		Alphabet alpha = lex.getAlphabet();
		TIntArrayList marks = new TIntArrayList();
		for (int l : alpha.labels(Alphabet.CharClass.PUNCT))
			if (l != '=')
				marks.add(l);
		Fst run = FstBuilder.plus(TokenMarkers.escape(marks.toArray()));
		String equals = "=";
		if (lex.hasTable(MathGrammar.OPERATOR) && !lex.getTable(MathGrammar.OPERATOR).lookup("=").isEmpty())
			equals = lex.lookup(MathGrammar.OPERATOR, "=");
		Fst body = FstBuilder.union(run, FstBuilder.cross("=", equals));
		classify = Optimizer.optimize(TokenMarkers.plain(body));
	}

	public String getName() {
		return NAME;
	}

	public double getWeight() {
		return Priority.PUNCTUATION.getWeight();
	}

	public Fst getClassifyFst() {
		return classify;
	}
}
