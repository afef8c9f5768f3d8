package edu.isi.verbatim;

import java.io.Serializable;

/**
 * Immutable weighted transducer over the tropical semiring. Arcs of each
 * state are sorted by input label, ties kept in construction order. A start
 * state of -1 denotes the empty relation.
 */
public class Fst implements Serializable {
	private static final long serialVersionUID = 1L;

	private final int start;
	private final double[] finals;
	private final Arc[][] arcs;

	Fst(int start, double[] finals, Arc[][] arcs) {
		this.start = start;
		this.finals = finals;
		this.arcs = arcs;
	}

	public int getStart() {
		return start;
	}

	public boolean isEmpty() {
		return start < 0;
	}

	public int numStates() {
		return arcs.length;
	}

	public double getFinal(int s) {
		return finals[s];
	}

	public boolean isFinal(int s) {
		return finals[s] != Double.POSITIVE_INFINITY;
	}

	public int numArcs(int s) {
		return arcs[s].length;
	}

	public Arc getArc(int s, int i) {
		return arcs[s][i];
	}

	public int numArcs() {
		int n = 0;
		for (Arc[] a : arcs)
			n += a.length;
		return n;
	}

	// index of the first arc of s with input label >= ilabel
	public int lowerBound(int s, int ilabel) {
		Arc[] a = arcs[s];
		int lo = 0, hi = a.length;
		while (lo < hi) {
			int mid = (lo+hi) >>> 1;
			if (a[mid].getIlabel() < ilabel)
				lo = mid+1;
			else
				hi = mid;
		}
		return lo;
	}

	public boolean isAcceptor() {
		for (Arc[] as : arcs)
			for (Arc a : as)
				if (a.getIlabel() != a.getOlabel())
					return false;
		return true;
	}

	public boolean hasEpsilons() {
		for (Arc[] as : arcs)
			for (Arc a : as)
				if (a.getIlabel() == Labels.EPSILON || a.getOlabel() == Labels.EPSILON)
					return true;
		return false;
	}

	public MutableFst toMutable() {
		MutableFst m = new MutableFst();
		m.addFst(this);
		if (start >= 0)
			m.setStart(start);
		return m;
	}

	// one arc per line, then finals, in the AT&T text layout
	public String toString() {
		StringBuilder sb = new StringBuilder();
		if (start < 0)
			return "<empty>\n";
		sb.append("start ").append(start).append('\n');
		for (int s = 0; s < arcs.length; s++) {
			for (Arc a : arcs[s])
				sb.append(s).append('\t').append(a.getNextstate()).append('\t')
				.append(Labels.display(a.getIlabel())).append('\t')
				.append(Labels.display(a.getOlabel())).append('\t')
				.append(a.getWeight()).append('\n');
		}
		for (int s = 0; s < arcs.length; s++)
			if (isFinal(s))
				sb.append(s).append('\t').append(finals[s]).append('\n');
		return sb.toString();
	}
}
