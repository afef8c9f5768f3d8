package edu.isi.verbatim;

import gnu.trove.list.array.TIntArrayList;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into classified tokens: the rewrite cascade runs once, the
 * rewritten text is classified in one pass over the classify graph, and the
 * best path is read back as tokens. Token spans refer to the rewritten text.
 */
public class Tokenizer {
	private final Alphabet alpha;
	private final RewriteCascade cascade;
	private final Fst classify;

	public Tokenizer(Alphabet alpha, RewriteCascade cascade, Fst classify) {
		this.alpha = alpha;
		this.cascade = cascade;
		this.classify = classify;
	}

	public String rewrite(String text) throws UnusualConditionException {
		return cascade.apply(text, alpha);
	}

	/**
	 * The best tokenization. Empty or all-whitespace text has no tokens.
	 * @throws UnusualConditionException if the graph has no path for the text,
	 *         which only happens when the grammars are misconfigured
	 */
	public List<Token> tokenize(String text) throws UnusualConditionException {
		if (isBlank(text))
			return new ArrayList<Token>();
		String rewritten = rewrite(text);
		int[] source = Labels.toLabels(rewritten);
		Fst lattice = lattice(source, rewritten);
		return read(ShortestPath.best(lattice), source);
	}

	/**
	 * Up to n tokenizations with distinct token strings, best first.
	 */
	public List<List<Token>> tokenizeOptions(String text, int n) throws UnusualConditionException {
		List<List<Token>> ret = new ArrayList<List<Token>>();
		if (isBlank(text))
			return ret;
		String rewritten = rewrite(text);
		int[] source = Labels.toLabels(rewritten);
		Fst lattice = lattice(source, rewritten);
		for (Path p : KBestPaths.nBest(lattice, n, true))
			ret.add(read(p, source));
		return ret;
	}

	private Fst lattice(int[] source, String rewritten) throws UnusualConditionException {
		boolean debug = false;
		Fst lattice = FstBuilder.compose(FstBuilder.linear(alpha.encode(source)), classify);
		if (lattice.isEmpty())
			throw new UnusualConditionException("No tokenization of \""+rewritten+"\"; is the fallback grammar missing?");
		if (debug) Debug.debug(debug, "Lattice for \""+rewritten+"\": "+lattice.numStates()+" states");
		return lattice;
	}

	private static List<Token> read(Path p, int[] source) throws UnusualConditionException {
		TIntArrayList positions = new TIntArrayList();
		String out = p.getOutput(source, positions);
		TIntArrayList offsets = new TIntArrayList();
		List<Token> tokens;
		try {
			tokens = TokenParser.parse(out, offsets);
		}
		catch (DataFormatException e) {
			throw new UnusualConditionException("Classify graph wrote an unreadable token string", e);
		}
		for (int k = 0; k < tokens.size(); k++) {
			int st = positions.get(offsets.get(2*k));
			int en = positions.get(offsets.get(2*k+1));
			tokens.get(k).setSource(st, en, new String(source, st, en-st));
		}
		return tokens;
	}

	private static boolean isBlank(String text) {
		for (int i = 0; i < text.length(); ) {
			int cp = text.codePointAt(i);
			if (!Alphabet.isSpace(cp))
				return false;
			i += Character.charCount(cp);
		}
		return true;
	}
}
