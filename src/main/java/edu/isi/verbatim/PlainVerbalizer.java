package edu.isi.verbatim;

/**
 * Verbalizes tokens with no category, <code>name: "..."</code>: the value
 * is the spoken text.
 */
public class PlainVerbalizer implements Verbalizer {
	private final Fst fst;

	public PlainVerbalizer(Alphabet alpha) {
		fst = Optimizer.optimize(TokenMarkers.value(TokenMarkers.PLAIN_FIELD, alpha));
	}

	public String getName() {
		return TokenMarkers.PLAIN_FIELD;
	}

	public Fst getVerbalizeFst() {
		return fst;
	}
}
