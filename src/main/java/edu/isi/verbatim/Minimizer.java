package edu.isi.verbatim;

import gnu.trove.map.hash.TObjectIntHashMap;
import gnu.trove.impl.Constants;

import java.util.Arrays;

/**
 * Moore partition refinement on an automaton that is deterministic over
 * encoded (input, output, weight) symbols. States start out split by final
 * weight and are split again until every class agrees on where each symbol
 * leads.
 */
public class Minimizer {

	public static Fst minimize(Fst f) {
		boolean debug = false;
		if (f.isEmpty())
			return f;
		int n = f.numStates();
		ArcEncoder enc = new ArcEncoder(false);
		int[][] codes = new int[n][];
		for (int s = 0; s < n; s++) {
			codes[s] = new int[f.numArcs(s)];
			for (int i = 0; i < f.numArcs(s); i++)
				codes[s][i] = enc.encode(f.getArc(s, i));
		}
		int[] cls = new int[n];
		int count;
		{
			TObjectIntHashMap<Double> byFinal = new TObjectIntHashMap<Double>(Constants.DEFAULT_CAPACITY, Constants.DEFAULT_LOAD_FACTOR, -1);
			for (int s = 0; s < n; s++) {
				Double w = f.getFinal(s);
				int c = byFinal.get(w);
				if (c < 0) {
					c = byFinal.size();
					byFinal.put(w, c);
				}
				cls[s] = c;
			}
			count = byFinal.size();
		}
		int rounds = 0;
		while (true) {
			rounds++;
			TObjectIntHashMap<Signature> sigs = new TObjectIntHashMap<Signature>(Constants.DEFAULT_CAPACITY, Constants.DEFAULT_LOAD_FACTOR, -1);
			int[] next = new int[n];
			for (int s = 0; s < n; s++) {
				Signature sig = new Signature(cls[s], codes[s], f, s, cls);
				int c = sigs.get(sig);
				if (c < 0) {
					c = sigs.size();
					sigs.put(sig, c);
				}
				next[s] = c;
			}
			cls = next;
			if (sigs.size() == count)
				break;
			count = sigs.size();
		}
		if (debug) Debug.debug(debug, "Minimized "+n+" states to "+count+" in "+rounds+" rounds");
		if (count == n)
			return f;
		MutableFst m = new MutableFst();
		for (int c = 0; c < count; c++)
			m.addState();
		boolean[] done = new boolean[count];
		for (int s = 0; s < n; s++) {
			int c = cls[s];
			if (done[c])
				continue;
			done[c] = true;
			m.setFinal(c, f.getFinal(s));
			for (int i = 0; i < f.numArcs(s); i++) {
				Arc a = f.getArc(s, i);
				m.addArc(c, a.moveTo(cls[a.getNextstate()]));
			}
		}
		m.setStart(cls[f.getStart()]);
		return m.build();
	}

	// class of the state plus its (symbol, target class) pairs in symbol order
	private static final class Signature {
		final int[] data;
		final int hash;
		Signature(int own, int[] codes, Fst f, int s, int[] cls) {
			long[] pairs = new long[codes.length];
			for (int i = 0; i < codes.length; i++)
				pairs[i] = ((long)codes[i] << 32) | (cls[f.getArc(s, i).getNextstate()] & 0xffffffffL);
			Arrays.sort(pairs);
			data = new int[1+2*pairs.length];
			data[0] = own;
			for (int i = 0; i < pairs.length; i++) {
				data[1+2*i] = (int)(pairs[i] >>> 32);
				data[2+2*i] = (int)pairs[i];
			}
			hash = Arrays.hashCode(data);
		}
		public boolean equals(Object o) {
			return o instanceof Signature && Arrays.equals(data, ((Signature)o).data);
		}
		public int hashCode() {
			return hash;
		}
	}
}
