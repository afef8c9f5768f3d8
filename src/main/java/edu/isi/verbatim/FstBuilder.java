package edu.isi.verbatim;

import gnu.trove.map.hash.TIntIntHashMap;

import java.util.ArrayList;
import java.util.List;

/**
 * The grammar-writing algebra. Every operation takes immutable automata and
 * returns a new one; nothing here mutates its arguments.
 */
public class FstBuilder {
	public enum Tape { INPUT, OUTPUT }

	// the empty relation: accepts nothing
	public static Fst empty() {
		return new MutableFst().build();
	}

	// accepts only the empty string
	public static Fst epsilon() {
		MutableFst m = new MutableFst();
		int s = m.addState();
		m.setStart(s);
		m.setFinal(s, 0);
		return m.build();
	}

	/**
	 * Literal pair: maps exactly in to exactly out. Labels are paired left to
	 * right and the shorter side is padded with epsilon.
	 */
	public static Fst cross(int[] in, int[] out, double weight) {
		MutableFst m = new MutableFst();
		int s = m.addState();
		m.setStart(s);
		int len = Math.max(in.length, out.length);
		for (int i = 0; i < len; i++) {
			int t = m.addState();
			m.addArc(s, i < in.length ? in[i] : Labels.EPSILON, i < out.length ? out[i] : Labels.EPSILON, 0, t);
			s = t;
		}
		m.setFinal(s, weight);
		return m.build();
	}

	public static Fst cross(String in, String out) {
		return cross(Labels.toLabels(in), Labels.toLabels(out), 0);
	}

	public static Fst accept(String s) {
		int[] l = Labels.toLabels(s);
		return cross(l, l, 0);
	}

	public static Fst accept(int[] labels) {
		return cross(labels, labels, 0);
	}

	public static Fst insert(String s) {
		return cross(new int[0], Labels.toLabels(s), 0);
	}

	public static Fst delete(String s) {
		return cross(Labels.toLabels(s), new int[0], 0);
	}

	// reads what the acceptor accepts and writes nothing
	public static Fst delete(Fst acceptor) {
		return relabel(acceptor, false, true);
	}

	// reads nothing and writes what the acceptor accepts
	public static Fst insert(Fst acceptor) {
		return relabel(acceptor, true, false);
	}

	private static Fst relabel(Fst f, boolean clearInput, boolean clearOutput) {
		MutableFst m = new MutableFst();
		for (int s = 0; s < f.numStates(); s++)
			m.setFinal(m.addState(), f.getFinal(s));
		for (int s = 0; s < f.numStates(); s++) {
			for (int i = 0; i < f.numArcs(s); i++) {
				Arc a = f.getArc(s, i);
				int il = a.getIlabel(), ol = a.getOlabel();
				if (clearInput) il = Labels.EPSILON;
				if (clearOutput) ol = Labels.EPSILON;
				m.addArc(s, il, ol, a.getWeight(), a.getNextstate());
			}
		}
		if (!f.isEmpty())
			m.setStart(f.getStart());
		return m.build();
	}

	// one symbol out of the given set, read and written unchanged
	public static Fst labelSet(int[] labels) {
		MutableFst m = new MutableFst();
		int s = m.addState();
		int t = m.addState();
		m.setStart(s);
		m.setFinal(t, 0);
		for (int l : labels)
			m.addArc(s, l, l, 0, t);
		return m.build();
	}

	/**
	 * Many literal pairs at once, compiled into a trie over the input side.
	 * The output of a row is emitted after its whole input has been read.
	 * Rows may repeat an input with different outputs.
	 */
	public static Fst stringMap(List<LexiconTable.Row> rows) {
		MutableFst m = new MutableFst();
		int root = m.addState();
		m.setStart(root);
		List<TIntIntHashMap> children = new ArrayList<TIntIntHashMap>();
		children.add(new TIntIntHashMap());
		for (LexiconTable.Row r : rows) {
			int s = root;
			for (int l : Labels.toLabels(r.getKey())) {
				TIntIntHashMap kids = children.get(s);
				if (kids.containsKey(l))
					s = kids.get(l);
				else {
					int t = m.addState();
					children.add(new TIntIntHashMap());
					m.addArc(s, l, Labels.EPSILON, 0, t);
					kids.put(l, t);
					s = t;
				}
			}
			int[] out = Labels.toLabels(r.getValue());
			if (out.length == 0) {
				m.setFinal(s, Math.min(m.getFinal(s), r.getWeight()));
				continue;
			}
			for (int l : out) {
				int t = m.addState();
				children.add(new TIntIntHashMap());
				m.addArc(s, Labels.EPSILON, l, 0, t);
				s = t;
			}
			m.setFinal(s, r.getWeight());
		}
		return m.build();
	}

	// convenience for literal tables written inline: {input, output} pairs
	public static Fst stringMap(String[][] pairs) {
		List<LexiconTable.Row> rows = new ArrayList<LexiconTable.Row>();
		for (String[] p : pairs)
			rows.add(new LexiconTable.Row(p[0], p.length > 1 ? p[1] : p[0], 0));
		return stringMap(rows);
	}

	// new start with epsilon arcs to each operand, in argument order
	public static Fst union(Fst... fs) {
		MutableFst m = new MutableFst();
		int s = m.addState();
		m.setStart(s);
		for (Fst f : fs) {
			if (f.isEmpty())
				continue;
			int off = m.addFst(f);
			m.addArc(s, Labels.EPSILON, Labels.EPSILON, 0, off+f.getStart());
		}
		return m.build();
	}

	public static Fst union(List<Fst> fs) {
		return union(fs.toArray(new Fst[fs.size()]));
	}

	// each final of one operand gets an epsilon arc, carrying its final weight, to the next operand's start
	public static Fst concat(Fst... fs) {
		if (fs.length == 0)
			return epsilon();
		for (Fst f : fs)
			if (f.isEmpty())
				return empty();
		MutableFst m = new MutableFst();
		int[] offs = new int[fs.length];
		for (int k = 0; k < fs.length; k++)
			offs[k] = m.addFst(fs[k]);
		m.setStart(offs[0]+fs[0].getStart());
		for (int k = 0; k+1 < fs.length; k++) {
			Fst f = fs[k];
			int nextStart = offs[k+1]+fs[k+1].getStart();
			for (int s = 0; s < f.numStates(); s++) {
				if (!f.isFinal(s))
					continue;
				m.addArc(offs[k]+s, Labels.EPSILON, Labels.EPSILON, f.getFinal(s), nextStart);
				m.setFinal(offs[k]+s, Double.POSITIVE_INFINITY);
			}
		}
		return m.build();
	}

	public static Fst concat(List<Fst> fs) {
		return concat(fs.toArray(new Fst[fs.size()]));
	}

	// Kleene star: a new final start state, finals loop back to it
	public static Fst star(Fst f) {
		if (f.isEmpty())
			return epsilon();
		MutableFst m = new MutableFst();
		int s0 = m.addState();
		m.setStart(s0);
		m.setFinal(s0, 0);
		int off = m.addFst(f);
		m.addArc(s0, Labels.EPSILON, Labels.EPSILON, 0, off+f.getStart());
		for (int s = 0; s < f.numStates(); s++) {
			if (!f.isFinal(s))
				continue;
			m.addArc(off+s, Labels.EPSILON, Labels.EPSILON, f.getFinal(s), s0);
			m.setFinal(off+s, Double.POSITIVE_INFINITY);
		}
		return m.build();
	}

	public static Fst plus(Fst f) {
		return concat(f, star(f));
	}

	public static Fst optional(Fst f) {
		return union(f, epsilon());
	}

	/**
	 * Bounded closure f{min,max}, unrolled. max of -1 means unbounded.
	 * The optional copies nest, (f(f(f)?)?)?, so each count has one path.
	 */
	public static Fst closure(Fst f, int min, int max) {
		if (min < 0 || (max >= 0 && max < min))
			throw new IllegalArgumentException("Bad closure bounds {"+min+","+max+"}");
		List<Fst> parts = new ArrayList<Fst>();
		for (int i = 0; i < min; i++)
			parts.add(f);
		if (max < 0)
			parts.add(star(f));
		else {
			Fst tail = null;
			for (int i = 0; i < max-min; i++)
				tail = tail == null ? optional(f) : optional(concat(f, tail));
			if (tail != null)
				parts.add(tail);
		}
		return concat(parts);
	}

	// added once per accepted path, on the final weights
	public static Fst addWeight(Fst f, double w) {
		MutableFst m = f.toMutable();
		for (int s = 0; s < m.numStates(); s++)
			if (m.isFinal(s))
				m.setFinal(s, m.getFinal(s)+w);
		return m.build();
	}

	public static Fst project(Fst f, Tape tape) {
		MutableFst m = new MutableFst();
		for (int s = 0; s < f.numStates(); s++)
			m.setFinal(m.addState(), f.getFinal(s));
		for (int s = 0; s < f.numStates(); s++) {
			for (int i = 0; i < f.numArcs(s); i++) {
				Arc a = f.getArc(s, i);
				int l = tape == Tape.INPUT ? a.getIlabel() : a.getOlabel();
				m.addArc(s, l, l, a.getWeight(), a.getNextstate());
			}
		}
		if (!f.isEmpty())
			m.setStart(f.getStart());
		return m.build();
	}

	public static Fst invert(Fst f) {
		MutableFst m = new MutableFst();
		for (int s = 0; s < f.numStates(); s++)
			m.setFinal(m.addState(), f.getFinal(s));
		for (int s = 0; s < f.numStates(); s++) {
			for (int i = 0; i < f.numArcs(s); i++) {
				Arc a = f.getArc(s, i);
				m.addArc(s, a.getOlabel(), a.getIlabel(), a.getWeight(), a.getNextstate());
			}
		}
		if (!f.isEmpty())
			m.setStart(f.getStart());
		return m.build();
	}

	// maps reverse(x) to reverse(y) whenever f maps x to y
	public static Fst reverse(Fst f) {
		if (f.isEmpty())
			return empty();
		MutableFst m = new MutableFst();
		for (int s = 0; s < f.numStates(); s++)
			m.addState();
		int start = m.addState();
		m.setStart(start);
		for (int s = 0; s < f.numStates(); s++) {
			for (int i = 0; i < f.numArcs(s); i++) {
				Arc a = f.getArc(s, i);
				m.addArc(a.getNextstate(), a.getIlabel(), a.getOlabel(), a.getWeight(), s);
			}
			if (f.isFinal(s))
				m.addArc(start, Labels.EPSILON, Labels.EPSILON, f.getFinal(s), s);
		}
		m.setFinal(f.getStart(), 0);
		return m.build();
	}

	public static Fst compose(Fst a, Fst b) {
		return Composition.compose(a, b);
	}

	public static Fst compose(Fst... fs) {
		Fst r = fs[0];
		for (int i = 1; i < fs.length; i++)
			r = Composition.compose(r, fs[i]);
		return r;
	}

	public static Fst difference(Fst a, Fst b) {
		return Difference.difference(a, b);
	}

	public static Fst optimize(Fst f) {
		return Optimizer.optimize(f);
	}

	public static Fst connect(Fst f) {
		return Connector.connect(f);
	}

	/**
	 * q where q applies, r everywhere else in sigmaStar: q | ((sigmaStar - dom(q)) o r)
	 */
	public static Fst priorityUnion(Fst q, Fst r, Fst sigmaStar) {
		Fst rest = difference(sigmaStar, project(q, Tape.INPUT));
		return union(q, compose(rest, r));
	}

	// input string as a linear acceptor
	public static Fst linear(int[] labels) {
		return accept(labels);
	}
}
