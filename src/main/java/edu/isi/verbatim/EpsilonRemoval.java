package edu.isi.verbatim;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TIntDoubleHashMap;

/**
 * Removes arcs that are epsilon on both tapes. Each state takes over the
 * real arcs and final weights of everything in its epsilon closure, with the
 * shortest epsilon distance added. Arcs that read or write something are
 * kept, including epsilon:x and x:epsilon arcs.
 */
public class EpsilonRemoval {
	private static final Semiring sr = new TropicalSemiring();

	public static Fst removeEpsilons(Fst f) {
		if (f.isEmpty())
			return f;
		boolean any = false;
		for (int s = 0; s < f.numStates() && !any; s++)
			for (int i = 0; i < f.numArcs(s); i++)
				if (isEpsilon(f.getArc(s, i))) {
					any = true;
					break;
				}
		if (!any)
			return f;
		MutableFst m = new MutableFst();
		for (int s = 0; s < f.numStates(); s++)
			m.addState();
		m.setStart(f.getStart());
		TIntArrayList order = new TIntArrayList();
		TIntDoubleHashMap dist = new TIntDoubleHashMap();
		for (int q = 0; q < f.numStates(); q++) {
			closure(f, q, order, dist);
			double fin = sr.ZERO();
			for (int k = 0; k < order.size(); k++) {
				int r = order.get(k);
				double d = dist.get(r);
				if (f.isFinal(r))
					fin = sr.plus(fin, sr.times(d, f.getFinal(r)));
				for (int i = 0; i < f.numArcs(r); i++) {
					Arc a = f.getArc(r, i);
					if (isEpsilon(a))
						continue;
					m.addArc(q, a.getIlabel(), a.getOlabel(), sr.times(d, a.getWeight()), a.getNextstate());
				}
			}
			m.setFinal(q, fin);
		}
		return Connector.connect(m.build());
	}

	private static boolean isEpsilon(Arc a) {
		return a.getIlabel() == Labels.EPSILON && a.getOlabel() == Labels.EPSILON;
	}

	// shortest epsilon distances from q, label-correcting so negative arcs are fine
	private static void closure(Fst f, int q, TIntArrayList order, TIntDoubleHashMap dist) {
		order.clear();
		dist.clear();
		dist.put(q, sr.ONE());
		order.add(q);
		TIntArrayList queue = new TIntArrayList();
		queue.add(q);
		int pops = 0;
		int limit = f.numStates()*(f.numStates()+1);
		while (!queue.isEmpty()) {
			int s = queue.removeAt(queue.size()-1);
			if (++pops > limit)
				throw new IllegalStateException("Epsilon cycle of negative weight at state "+s);
			double ds = dist.get(s);
			int end = f.lowerBound(s, 1);
			for (int i = 0; i < end; i++) {
				Arc a = f.getArc(s, i);
				if (a.getOlabel() != Labels.EPSILON)
					continue;
				int t = a.getNextstate();
				double nd = sr.times(ds, a.getWeight());
				if (!dist.containsKey(t)) {
					dist.put(t, nd);
					order.add(t);
					queue.add(t);
				}
				else if (sr.better(nd, dist.get(t)) && !sr.approx(nd, dist.get(t))) {
					dist.put(t, nd);
					queue.add(t);
				}
			}
		}
	}
}
