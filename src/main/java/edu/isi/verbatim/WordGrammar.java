package edu.isi.verbatim;

import gnu.trove.list.array.TIntArrayList;

/**
 * The fallback: any run of non-space characters that does not begin or end
 * with punctuation, copied into a plain token. Together with
 * {@link PunctuationGrammar} it covers every input.
 */
public class WordGrammar implements Classifier {
	public static final String NAME = "word";

	private final Fst classify;

	public WordGrammar(Lexicon lex) {
		Alphabet alpha = lex.getAlphabet();
		TIntArrayList letters = new TIntArrayList();
		TIntArrayList punct = new TIntArrayList(alpha.labels(Alphabet.CharClass.PUNCT));
		for (int l : alpha.labels(Alphabet.CharClass.NOT_SPACE))
			if (!punct.contains(l))
				letters.add(l);
		Fst core = FstBuilder.plus(TokenMarkers.escape(letters.toArray()));
		Fst inner = FstBuilder.plus(TokenMarkers.escape(punct.toArray()));
		Fst word = FstBuilder.concat(core, FstBuilder.star(FstBuilder.concat(inner, core)));
		classify = Optimizer.optimize(TokenMarkers.plain(word));
	}

	public String getName() {
		return NAME;
	}

	public double getWeight() {
		return Priority.FALLBACK.getWeight();
	}

	public Fst getClassifyFst() {
		return classify;
	}
}
