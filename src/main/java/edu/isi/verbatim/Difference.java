package edu.isi.verbatim;

import gnu.trove.impl.Constants;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TLongIntHashMap;

/**
 * a minus b over strings, for an acceptor a. b is read on its input tape,
 * weights ignored; it is determinized and complemented on the fly, a
 * missing transition leading to a sink that accepts everything.
 */
public class Difference {
	private static final int SINK = -1;

	public static Fst difference(Fst a, Fst b) {
		if (!a.isAcceptor())
			throw new IllegalArgumentException("Difference needs an acceptor on the left");
		if (a.isEmpty())
			return a;
		Fst d = b.isEmpty() ? b : Determinizer.determinizeAcceptor(FstBuilder.project(b, FstBuilder.Tape.INPUT));
		TLongIntHashMap ids = new TLongIntHashMap(Constants.DEFAULT_CAPACITY, Constants.DEFAULT_LOAD_FACTOR, Long.MIN_VALUE, -1);
		TIntArrayList qa = new TIntArrayList();
		TIntArrayList qb = new TIntArrayList();
		MutableFst m = new MutableFst();
		int dstart = d.isEmpty() ? SINK : d.getStart();
		m.setStart(lookup(a.getStart(), dstart, ids, qa, qb, m));
		for (int cur = 0; cur < qa.size(); cur++) {
			int sa = qa.get(cur), sb = qb.get(cur);
			if (a.isFinal(sa) && (sb == SINK || !d.isFinal(sb)))
				m.setFinal(cur, a.getFinal(sa));
			for (int i = 0; i < a.numArcs(sa); i++) {
				Arc x = a.getArc(sa, i);
				int nb = sb;
				if (x.getIlabel() != Labels.EPSILON && sb != SINK) {
					int j = d.lowerBound(sb, x.getIlabel());
					if (j < d.numArcs(sb) && d.getArc(sb, j).getIlabel() == x.getIlabel())
						nb = d.getArc(sb, j).getNextstate();
					else
						nb = SINK;
				}
				int t = lookup(x.getNextstate(), nb, ids, qa, qb, m);
				m.addArc(cur, x.moveTo(t));
			}
		}
		return Connector.connect(m.build());
	}

	private static int lookup(int sa, int sb, TLongIntHashMap ids, TIntArrayList qa, TIntArrayList qb, MutableFst m) {
		long key = ((long)sa << 32) | (sb & 0xffffffffL);
		int id = ids.get(key);
		if (id >= 0)
			return id;
		id = m.addState();
		ids.put(key, id);
		qa.add(sa);
		qb.add(sb);
		return id;
	}
}
