package edu.isi.verbatim;

import gnu.trove.list.array.TDoubleArrayList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;

/**
 * Construction-time automaton. States are added, arcs hung on them, then
 * {@link #build()} freezes the result into an arc-sorted {@link Fst}.
 */
public class MutableFst {
	private static final Comparator<Arc> BY_ILABEL = new Comparator<Arc>() {
		public int compare(Arc a, Arc b) {
			return Integer.compare(a.getIlabel(), b.getIlabel());
		}
	};

	private int start = -1;
	private final ArrayList<ArrayList<Arc>> arcs = new ArrayList<ArrayList<Arc>>();
	private final TDoubleArrayList finals = new TDoubleArrayList();

	public int addState() {
		arcs.add(new ArrayList<Arc>());
		finals.add(Double.POSITIVE_INFINITY);
		return arcs.size()-1;
	}

	public int numStates() {
		return arcs.size();
	}

	public void setStart(int s) {
		check(s);
		start = s;
	}

	public int getStart() {
		return start;
	}

	public void setFinal(int s, double w) {
		check(s);
		finals.set(s, w);
	}

	public double getFinal(int s) {
		return finals.get(s);
	}

	public boolean isFinal(int s) {
		return finals.get(s) != Double.POSITIVE_INFINITY;
	}

	public void addArc(int from, int ilabel, int olabel, double weight, int to) {
		addArc(from, new Arc(ilabel, olabel, weight, to));
	}

	public void addArc(int from, Arc a) {
		check(from);
		check(a.getNextstate());
		arcs.get(from).add(a);
	}

	/**
	 * Copy all states and arcs of f into this automaton. Start and final
	 * weights are copied as data only: the caller decides how to wire them.
	 * @return the id that f's state 0 has in this automaton
	 */
	public int addFst(Fst f) {
		int offset = arcs.size();
		for (int s = 0; s < f.numStates(); s++)
			addState();
		for (int s = 0; s < f.numStates(); s++) {
			finals.set(offset+s, f.getFinal(s));
			ArrayList<Arc> l = arcs.get(offset+s);
			for (int i = 0; i < f.numArcs(s); i++) {
				Arc a = f.getArc(s, i);
				l.add(a.moveTo(a.getNextstate()+offset));
			}
		}
		return offset;
	}

	// arcs are sorted by input label; the sort is stable so equal labels keep insertion order
	public Fst build() {
		int n = arcs.size();
		Arc[][] out = new Arc[n][];
		double[] fin = new double[n];
		for (int s = 0; s < n; s++) {
			ArrayList<Arc> l = new ArrayList<Arc>(arcs.get(s));
			Collections.sort(l, BY_ILABEL);
			out[s] = l.toArray(new Arc[l.size()]);
			fin[s] = finals.get(s);
		}
		return new Fst(n == 0 ? -1 : start, fin, out);
	}

	private void check(int s) {
		if (s < 0 || s >= arcs.size())
			throw new IllegalArgumentException("No such state "+s+" (have "+arcs.size()+")");
	}
}
