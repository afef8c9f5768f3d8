package edu.isi.verbatim;

import java.util.ArrayList;
import java.util.List;

// running automata on strings in tests
final class FstTesting {
	private FstTesting() {
	}

	static Fst apply(Fst f, String input) {
		return FstBuilder.compose(FstBuilder.linear(Labels.toLabels(input)), f);
	}

	static boolean accepts(Fst f, String input) {
		return !apply(f, input).isEmpty();
	}

	// best output, or null if f rejects the input
	static String best(Fst f, String input) throws UnusualConditionException {
		Fst l = apply(f, input);
		if (l.isEmpty())
			return null;
		return ShortestPath.best(l).getOutput();
	}

	static double weight(Fst f, String input) throws UnusualConditionException {
		return ShortestPath.shortestDistance(apply(f, input));
	}

	// distinct outputs, best first
	static List<String> outputs(Fst f, String input, int n) throws UnusualConditionException {
		List<String> ret = new ArrayList<String>();
		for (Path p : KBestPaths.nBest(apply(f, input), n, true))
			ret.add(p.getOutput());
		return ret;
	}
}
