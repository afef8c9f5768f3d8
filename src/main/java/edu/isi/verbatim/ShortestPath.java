package edu.isi.verbatim;

import gnu.trove.list.array.TIntArrayList;

import java.util.Arrays;

/**
 * Single best path under the tropical semiring.
 * <p>
 * Distances to the final states are computed first by label correction, so
 * negative arcs are allowed as long as no cycle is negative. The path is then
 * read off depth first in arc order, following only arcs that stay on some
 * optimal path (weights compared within {@link TropicalSemiring#DELTA}).
 * Among several optimal paths the one found first in arc order wins; since
 * union lays out its branches in argument order, a tie goes to the earliest
 * declared alternative at the first point where the tied paths diverge.
 */
public class ShortestPath {
	private static final Semiring sr = new TropicalSemiring();

	// shortest distance from every state to a final state
	public static double[] distanceToFinal(Fst f) throws UnusualConditionException {
		int n = f.numStates();
		double[] beta = new double[n];
		Arrays.fill(beta, sr.ZERO());
		// predecessor lists, compressed: arc (state, index) entering each state
		int[] head = new int[n+1];
		for (int s = 0; s < n; s++)
			for (int i = 0; i < f.numArcs(s); i++)
				head[f.getArc(s, i).getNextstate()+1]++;
		for (int s = 0; s < n; s++)
			head[s+1] += head[s];
		int[] predState = new int[head[n]];
		int[] predArc = new int[head[n]];
		int[] fill = head.clone();
		for (int s = 0; s < n; s++) {
			for (int i = 0; i < f.numArcs(s); i++) {
				int t = f.getArc(s, i).getNextstate();
				predState[fill[t]] = s;
				predArc[fill[t]++] = i;
			}
		}
		boolean[] queued = new boolean[n];
		int[] rounds = new int[n];
		TIntArrayList queue = new TIntArrayList();
		for (int s = 0; s < n; s++) {
			if (f.isFinal(s)) {
				beta[s] = f.getFinal(s);
				queued[s] = true;
				queue.add(s);
			}
		}
		for (int qi = 0; qi < queue.size(); qi++) {
			int t = queue.get(qi);
			queued[t] = false;
			if (++rounds[t] > n+1)
				throw new UnusualConditionException("Negative weight cycle through state "+t);
			for (int k = head[t]; k < head[t+1]; k++) {
				int s = predState[k];
				double d = sr.times(f.getArc(s, predArc[k]).getWeight(), beta[t]);
				if (sr.better(d, beta[s]) && !sr.approx(d, beta[s])) {
					beta[s] = d;
					if (!queued[s]) {
						queued[s] = true;
						queue.add(s);
					}
				}
			}
			// keep the queue from growing without bound
			if (qi > 4096 && qi*2 > queue.size()) {
				queue.remove(0, qi+1);
				qi = -1;
			}
		}
		return beta;
	}

	public static double shortestDistance(Fst f) throws UnusualConditionException {
		if (f.isEmpty())
			return sr.ZERO();
		return distanceToFinal(f)[f.getStart()];
	}

	public static Path best(Fst f) throws UnusualConditionException {
		if (f.isEmpty())
			throw new UnusualConditionException("No accepting path: empty automaton");
		return best(f, distanceToFinal(f));
	}

	public static Path best(Fst f, double[] beta) throws UnusualConditionException {
		boolean debug = false;
		int start = f.getStart();
		if (start < 0 || sr.isZero(beta[start]))
			throw new UnusualConditionException("No accepting path");
		boolean[] visited = new boolean[f.numStates()];
		TIntArrayList states = new TIntArrayList();
		TIntArrayList next = new TIntArrayList();
		states.add(start);
		next.add(0);
		visited[start] = true;
		while (!states.isEmpty()) {
			int top = states.size()-1;
			int s = states.get(top);
			if (next.get(top) == 0 && f.isFinal(s) && sr.approx(f.getFinal(s), beta[s]))
				break;
			int i = next.get(top);
			boolean moved = false;
			for (; i < f.numArcs(s); i++) {
				Arc a = f.getArc(s, i);
				int t = a.getNextstate();
				if (visited[t] || sr.isZero(beta[t]))
					continue;
				if (sr.approx(sr.times(a.getWeight(), beta[t]), beta[s])) {
					next.set(top, i+1);
					visited[t] = true;
					states.add(t);
					next.add(0);
					moved = true;
					break;
				}
			}
			if (!moved) {
				if (debug) Debug.debug(debug, "Backing out of state "+s);
				states.removeAt(top);
				next.removeAt(top);
			}
		}
		if (states.isEmpty())
			throw new UnusualConditionException("Optimal path could not be traced from state "+start);
		int len = states.size()-1;
		int[] il = new int[len];
		int[] ol = new int[len];
		for (int k = 0; k < len; k++) {
			Arc a = f.getArc(states.get(k), next.get(k)-1);
			il[k] = a.getIlabel();
			ol[k] = a.getOlabel();
		}
		return new Path(il, ol, beta[start]);
	}
}
