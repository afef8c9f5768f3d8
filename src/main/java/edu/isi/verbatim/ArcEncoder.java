package edu.isi.verbatim;

import gnu.trove.impl.Constants;
import gnu.trove.map.hash.TObjectIntHashMap;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps each distinct (input, output, weight) triple to a small integer so
 * that a transducer can be treated as an unweighted acceptor. With
 * acceptor-only encoding the code is the input label alone and weights are
 * ignored.
 */
public class ArcEncoder {
	private final boolean labelsOnly;
	private final TObjectIntHashMap<Triple> codes = new TObjectIntHashMap<Triple>(Constants.DEFAULT_CAPACITY, Constants.DEFAULT_LOAD_FACTOR, -1);
	private final List<Triple> triples = new ArrayList<Triple>();

	public ArcEncoder(boolean labelsOnly) {
		this.labelsOnly = labelsOnly;
	}

	public int encode(Arc a) {
		if (labelsOnly)
			return a.getIlabel();
		Triple t = new Triple(a.getIlabel(), a.getOlabel(), a.getWeight());
		int c = codes.get(t);
		if (c < 0) {
			c = triples.size();
			triples.add(t);
			codes.put(t, c);
		}
		return c;
	}

	// arc carrying the labels and weight behind code
	public Arc decode(int code, int next) {
		if (labelsOnly)
			return new Arc(code, code, 0, next);
		Triple t = triples.get(code);
		return new Arc(t.in, t.out, t.weight, next);
	}

	private static final class Triple {
		final int in;
		final int out;
		final double weight;
		Triple(int in, int out, double weight) {
			this.in = in;
			this.out = out;
			this.weight = weight;
		}
		public boolean equals(Object o) {
			if (!(o instanceof Triple))
				return false;
			Triple t = (Triple)o;
			return in == t.in && out == t.out && Double.compare(weight, t.weight) == 0;
		}
		public int hashCode() {
			long w = Double.doubleToLongBits(weight);
			return (in*31+out)*31+(int)(w ^ (w >>> 32));
		}
	}
}
