package edu.isi.verbatim;

import edu.stanford.nlp.util.FixedPrioritiesPriorityQueue;

import gnu.trove.list.array.TIntArrayList;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The n best paths, found by best-first search with the exact distance to a
 * final state as heuristic. Each state is expanded a bounded number of
 * times, so when unique outputs are requested and many paths share an
 * output, fewer than n paths may come back.
 */
public class KBestPaths {
	private static final Semiring sr = new TropicalSemiring();
	private static final int EXPANSION_FACTOR = 16;
	private static final int MAX_POPS = 500000;

	// a partial path: where it is, what it cost, how it got here
	private static final class Item {
		final int state;
		final double cost;
		final Item back;
		final Arc arc;
		final boolean complete;
		Item(int state, double cost, Item back, Arc arc, boolean complete) {
			this.state = state;
			this.cost = cost;
			this.back = back;
			this.arc = arc;
			this.complete = complete;
		}
	}

	public static List<Path> nBest(Fst f, int n, boolean uniqueOutputs) throws UnusualConditionException {
		boolean debug = false;
		List<Path> ret = new ArrayList<Path>();
		if (f.isEmpty() || n <= 0)
			return ret;
		double[] beta = ShortestPath.distanceToFinal(f);
		if (sr.isZero(beta[f.getStart()]))
			return ret;
		int[] expanded = new int[f.numStates()];
		int limit = n*EXPANSION_FACTOR;
		Set<String> seen = new HashSet<String>();
		// highest priority comes off first, so costs go in negated
		FixedPrioritiesPriorityQueue<Item> agenda = new FixedPrioritiesPriorityQueue<Item>();
		agenda.add(new Item(f.getStart(), sr.ONE(), null, null, false), -beta[f.getStart()]);
		int pops = 0;
		while (!agenda.isEmpty() && ret.size() < n && pops++ < MAX_POPS) {
			Item it = agenda.removeFirst();
			if (it.complete) {
				Path p = trace(it);
				if (uniqueOutputs && !seen.add(p.getOutput()))
					continue;
				if (debug) Debug.debug(debug, "Path "+ret.size()+": "+p);
				ret.add(p);
				continue;
			}
			int s = it.state;
			if (expanded[s]++ >= limit)
				continue;
			if (f.isFinal(s)) {
				double c = sr.times(it.cost, f.getFinal(s));
				agenda.add(new Item(s, c, it, null, true), -c);
			}
			for (int i = 0; i < f.numArcs(s); i++) {
				Arc a = f.getArc(s, i);
				int t = a.getNextstate();
				if (sr.isZero(beta[t]))
					continue;
				double c = sr.times(it.cost, a.getWeight());
				agenda.add(new Item(t, c, it, a, false), -sr.times(c, beta[t]));
			}
		}
		return ret;
	}

	private static Path trace(Item last) {
		TIntArrayList il = new TIntArrayList();
		TIntArrayList ol = new TIntArrayList();
		for (Item it = last.back; it != null; it = it.back) {
			if (it.arc != null) {
				il.add(it.arc.getIlabel());
				ol.add(it.arc.getOlabel());
			}
		}
		il.reverse();
		ol.reverse();
		return new Path(il.toArray(), ol.toArray(), last.cost);
	}
}
