package edu.isi.verbatim;

import gnu.trove.impl.Constants;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TIntObjectHashMap;
import gnu.trove.map.hash.TObjectIntHashMap;
import gnu.trove.set.hash.TIntHashSet;

import java.util.ArrayList;
import java.util.List;

/**
 * Subset construction. Input must be free of epsilon:epsilon arcs.
 * <p>
 * {@link #determinizeEncoded} treats every (input, output, weight) triple as
 * one symbol, so the construction is exact for any transducer; the final
 * weight of a subset is the best final weight among its members.
 * {@link #determinizeAcceptor} looks at input labels only and drops weights.
 */
public class Determinizer {
	private static final Semiring sr = new TropicalSemiring();

	public static Fst determinizeAcceptor(Fst f) {
		return subsets(EpsilonRemoval.removeEpsilons(f), new ArcEncoder(true), false, Integer.MAX_VALUE);
	}

	// null if more than maxStates subsets would be needed
	public static Fst determinizeEncoded(Fst f, int maxStates) {
		return subsets(f, new ArcEncoder(false), true, maxStates);
	}

	private static Fst subsets(Fst f, ArcEncoder enc, boolean weighted, int maxStates) {
		boolean debug = false;
		if (f.isEmpty())
			return f;
		TObjectIntHashMap<TIntArrayList> ids = new TObjectIntHashMap<TIntArrayList>(Constants.DEFAULT_CAPACITY, Constants.DEFAULT_LOAD_FACTOR, -1);
		List<TIntArrayList> members = new ArrayList<TIntArrayList>();
		MutableFst m = new MutableFst();
		TIntArrayList first = new TIntArrayList();
		first.add(f.getStart());
		m.setStart(lookup(first, ids, members, m));
		for (int cur = 0; cur < members.size(); cur++) {
			if (members.size() > maxStates) {
				if (debug) Debug.debug(debug, "Giving up after "+members.size()+" subsets");
				return null;
			}
			TIntArrayList set = members.get(cur);
			double fin = sr.ZERO();
			boolean isFinal = false;
			// symbols in order of first appearance, each with its target set
			TIntArrayList symbols = new TIntArrayList();
			TIntObjectHashMap<TIntHashSet> targets = new TIntObjectHashMap<TIntHashSet>();
			for (int k = 0; k < set.size(); k++) {
				int s = set.get(k);
				if (f.isFinal(s)) {
					isFinal = true;
					fin = sr.plus(fin, f.getFinal(s));
				}
				for (int i = 0; i < f.numArcs(s); i++) {
					Arc a = f.getArc(s, i);
					int c = enc.encode(a);
					TIntHashSet t = targets.get(c);
					if (t == null) {
						t = new TIntHashSet();
						targets.put(c, t);
						symbols.add(c);
					}
					t.add(a.getNextstate());
				}
			}
			if (isFinal)
				m.setFinal(cur, weighted ? fin : sr.ONE());
			for (int k = 0; k < symbols.size(); k++) {
				int c = symbols.get(k);
				TIntArrayList next = new TIntArrayList(targets.get(c).toArray());
				next.sort();
				int t = lookup(next, ids, members, m);
				m.addArc(cur, enc.decode(c, t));
			}
		}
		if (debug) Debug.debug(debug, "Determinized "+f.numStates()+" states into "+m.numStates());
		return m.build();
	}

	private static int lookup(TIntArrayList set, TObjectIntHashMap<TIntArrayList> ids, List<TIntArrayList> members, MutableFst m) {
		int id = ids.get(set);
		if (id >= 0)
			return id;
		id = m.addState();
		ids.put(set, id);
		members.add(set);
		return id;
	}
}
