package edu.isi.verbatim;

import java.util.Arrays;

/**
 * Build-time checks on the weights of a grammar: no cycle may have negative
 * total weight, and the heaviest accepting path gives the bound used by the
 * fallback dominance check.
 */
public class WeightBounds {

	/**
	 * Reject negative-weight cycles. Bellman-Ford runs only inside strongly
	 * connected components that carry a negative arc; acyclic negative arcs
	 * are fine.
	 */
	public static void checkNegativeCycles(Fst f, String name) throws ConfigureException {
		boolean debug = false;
		Components comps = new Components(f);
		int nc = comps.numComponents();
		boolean[] negative = new boolean[nc];
		int[] size = new int[nc];
		boolean any = false;
		for (int s = 0; s < f.numStates(); s++) {
			int c = comps.getComponent(s);
			size[c]++;
			for (int i = 0; i < f.numArcs(s); i++) {
				Arc a = f.getArc(s, i);
				if (a.getWeight() < 0 && comps.getComponent(a.getNextstate()) == c) {
					negative[c] = true;
					any = true;
				}
			}
		}
		if (!any)
			return;
		double[] dist = new double[f.numStates()];
		for (int c = 0; c < nc; c++) {
			if (!negative[c])
				continue;
			if (debug) Debug.debug(debug, "Component "+c+" of "+name+" has "+size[c]+" states and a negative arc");
			// virtual source: every state of the component starts at 0
			for (int round = 0; round <= size[c]; round++) {
				boolean changed = false;
				for (int s = 0; s < f.numStates(); s++) {
					if (comps.getComponent(s) != c)
						continue;
					for (int i = 0; i < f.numArcs(s); i++) {
						Arc a = f.getArc(s, i);
						int t = a.getNextstate();
						if (comps.getComponent(t) != c)
							continue;
						if (dist[s]+a.getWeight() < dist[t]-1e-9) {
							dist[t] = dist[s]+a.getWeight();
							changed = true;
						}
					}
				}
				if (!changed)
					break;
				if (round == size[c])
					throw new ConfigureException("Grammar "+name+" has a cycle of negative total weight through state "+firstState(comps, c, f));
			}
		}
	}

	private static int firstState(Components comps, int c, Fst f) {
		for (int s = 0; s < f.numStates(); s++)
			if (comps.getComponent(s) == c)
				return s;
		return -1;
	}

	/**
	 * Upper bound on the weight of any accepting path. Inside a strongly
	 * connected component every positive arc is counted once; between
	 * components the heaviest route is taken. Empty relation gives 0.
	 */
	public static double worstCase(Fst f) {
		if (f.isEmpty())
			return 0;
		Components comps = new Components(f);
		int nc = comps.numComponents();
		double[] internal = new double[nc];
		double[] best = new double[nc];
		Arrays.fill(best, Double.NEGATIVE_INFINITY);
		for (int s = 0; s < f.numStates(); s++) {
			int c = comps.getComponent(s);
			for (int i = 0; i < f.numArcs(s); i++) {
				Arc a = f.getArc(s, i);
				if (comps.getComponent(a.getNextstate()) == c && a.getWeight() > 0)
					internal[c] += a.getWeight();
			}
		}
		// components come numbered sinks first, so successors are done before we need them
		int[] order = new int[f.numStates()];
		int[] counts = new int[nc+1];
		for (int s = 0; s < f.numStates(); s++)
			counts[comps.getComponent(s)+1]++;
		for (int c = 0; c < nc; c++)
			counts[c+1] += counts[c];
		int[] fill = counts.clone();
		for (int s = 0; s < f.numStates(); s++)
			order[fill[comps.getComponent(s)]++] = s;
		for (int c = 0; c < nc; c++) {
			double w = Double.NEGATIVE_INFINITY;
			for (int k = counts[c]; k < counts[c+1]; k++) {
				int s = order[k];
				if (f.isFinal(s))
					w = Math.max(w, f.getFinal(s));
				for (int i = 0; i < f.numArcs(s); i++) {
					Arc a = f.getArc(s, i);
					int d = comps.getComponent(a.getNextstate());
					if (d != c && best[d] != Double.NEGATIVE_INFINITY)
						w = Math.max(w, a.getWeight()+best[d]);
				}
			}
			if (w != Double.NEGATIVE_INFINITY)
				best[c] = w+internal[c];
		}
		double r = best[comps.getComponent(f.getStart())];
		return r == Double.NEGATIVE_INFINITY ? 0 : r;
	}
}
