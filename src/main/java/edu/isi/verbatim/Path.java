package edu.isi.verbatim;

import gnu.trove.list.array.TIntArrayList;

/**
 * One path through an automaton: the label pairs of its arcs in order and
 * its total weight.
 */
public class Path {
	private final int[] ilabels;
	private final int[] olabels;
	private final double weight;

	public Path(int[] ilabels, int[] olabels, double weight) {
		this.ilabels = ilabels;
		this.olabels = olabels;
		this.weight = weight;
	}

	public double getWeight() {
		return weight;
	}

	public String getOutput() {
		return Labels.toString(olabels);
	}

	/**
	 * Output text with placeholder symbols restored. source is the code point
	 * sequence the path read; wherever an arc copies a placeholder unchanged,
	 * the character at that input position is written back. If positions is
	 * not null it receives, for each UTF-16 unit of the result, the input
	 * position at which it was written.
	 */
	public String getOutput(int[] source, TIntArrayList positions) {
		StringBuilder sb = new StringBuilder(olabels.length);
		int pos = 0;
		for (int k = 0; k < ilabels.length; k++) {
			int o = olabels[k];
			if (o != Labels.EPSILON) {
				int cp = o;
				if (o == Labels.OTHER && ilabels[k] == Labels.OTHER && pos < source.length)
					cp = source[pos];
				sb.appendCodePoint(cp);
				if (positions != null) {
					for (int u = 0; u < Character.charCount(cp); u++)
						positions.add(pos);
				}
			}
			if (ilabels[k] != Labels.EPSILON)
				pos++;
		}
		return sb.toString();
	}

	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (int k = 0; k < ilabels.length; k++) {
			if (k > 0)
				sb.append(' ');
			sb.append(Labels.display(ilabels[k])).append(':').append(Labels.display(olabels[k]));
		}
		sb.append(" / ").append(weight);
		return sb.toString();
	}
}
