package edu.isi.verbatim;

import gnu.trove.impl.Constants;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TLongIntHashMap;

/**
 * Relational composition a o b under the three-state epsilon filter.
 * Filter 0: nothing pending. Filter 1: a has just moved alone on an
 * epsilon output. Filter 2: b has just moved alone on an epsilon input.
 * A lone move of a is allowed from 0 or 1, a lone move of b from 0 or 2,
 * a simultaneous epsilon move only from 0, and every real match resets to 0.
 * This keeps exactly one path for each way of pairing up the two tapes.
 * <p>
 * The result is built eagerly over accessible triples and then trimmed.
 * Arcs of a result state come out in a fixed order: lone moves of b first
 * (in b's arc order), then a's arcs in a's order.
 */
public class Composition {

	public static Fst compose(Fst a, Fst b) {
		boolean debug = false;
		if (a.isEmpty() || b.isEmpty())
			return FstBuilder.empty();
		TLongIntHashMap ids = new TLongIntHashMap(Constants.DEFAULT_CAPACITY, Constants.DEFAULT_LOAD_FACTOR, -1L, -1);
		TIntArrayList q1 = new TIntArrayList();
		TIntArrayList q2 = new TIntArrayList();
		TIntArrayList filt = new TIntArrayList();
		MutableFst m = new MutableFst();
		int start = lookup(a.getStart(), b.getStart(), 0, ids, q1, q2, filt, m);
		m.setStart(start);
		for (int cur = 0; cur < q1.size(); cur++) {
			int s1 = q1.get(cur), s2 = q2.get(cur), f = filt.get(cur);
			if (a.isFinal(s1) && b.isFinal(s2))
				m.setFinal(cur, a.getFinal(s1)+b.getFinal(s2));
			int bEps = b.lowerBound(s2, 1);
			// b moves alone
			if (f != 1) {
				for (int j = 0; j < bEps; j++) {
					Arc y = b.getArc(s2, j);
					int t = lookup(s1, y.getNextstate(), 2, ids, q1, q2, filt, m);
					m.addArc(cur, Labels.EPSILON, y.getOlabel(), y.getWeight(), t);
				}
			}
			for (int i = 0; i < a.numArcs(s1); i++) {
				Arc x = a.getArc(s1, i);
				if (x.getOlabel() == Labels.EPSILON) {
					// a moves alone
					if (f != 2) {
						int t = lookup(x.getNextstate(), s2, 1, ids, q1, q2, filt, m);
						m.addArc(cur, x.getIlabel(), Labels.EPSILON, x.getWeight(), t);
					}
					// both move on epsilon
					if (f == 0) {
						for (int j = 0; j < bEps; j++) {
							Arc y = b.getArc(s2, j);
							int t = lookup(x.getNextstate(), y.getNextstate(), 0, ids, q1, q2, filt, m);
							m.addArc(cur, x.getIlabel(), y.getOlabel(), x.getWeight()+y.getWeight(), t);
						}
					}
					continue;
				}
				int l = x.getOlabel();
				for (int j = b.lowerBound(s2, l); j < b.numArcs(s2); j++) {
					Arc y = b.getArc(s2, j);
					if (y.getIlabel() != l)
						break;
					int t = lookup(x.getNextstate(), y.getNextstate(), 0, ids, q1, q2, filt, m);
					m.addArc(cur, x.getIlabel(), y.getOlabel(), x.getWeight()+y.getWeight(), t);
				}
			}
		}
		if (debug) Debug.debug(debug, "Composed "+a.numStates()+" x "+b.numStates()+" into "+m.numStates()+" states");
		return Connector.connect(m.build());
	}

	private static int lookup(int s1, int s2, int f, TLongIntHashMap ids,
			TIntArrayList q1, TIntArrayList q2, TIntArrayList filt, MutableFst m) {
		long key = ((long)s1 << 32) | ((long)s2 << 2) | f;
		int id = ids.get(key);
		if (id >= 0)
			return id;
		id = m.addState();
		ids.put(key, id);
		q1.add(s1);
		q2.add(s2);
		filt.add(f);
		return id;
	}
}
