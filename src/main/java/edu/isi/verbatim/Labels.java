package edu.isi.verbatim;

import gnu.trove.list.array.TIntArrayList;

/**
 * Arc labels are Unicode code points. Label 0 is epsilon, and a few code points
 * from the private use area are reserved for the engine's own bookkeeping.
 */
public final class Labels {
	public static final int EPSILON = 0;
	/** stands for any input character outside the declared alphabet */
	public static final int OTHER = 0xE000;
	/** rewrite marker: a rule applies here */
	public static final int LEFT_MARK = 0xE001;
	/** rewrite marker: a rule would apply here if the left context held */
	public static final int LEFT_MARK_UNMET = 0xE002;
	/** rewrite marker: the right context holds here */
	public static final int RIGHT_MARK = 0xE003;

	private Labels() {
	}

	public static boolean isReserved(int label) {
		return label == EPSILON || (label >= OTHER && label <= RIGHT_MARK);
	}

	// code points of s, epsilon never appears
	public static int[] toLabels(String s) {
		TIntArrayList out = new TIntArrayList(s.length());
		for (int i = 0; i < s.length(); ) {
			int cp = s.codePointAt(i);
			out.add(cp == EPSILON ? OTHER : cp);
			i += Character.charCount(cp);
		}
		return out.toArray();
	}

	// epsilons dropped
	public static String toString(int[] labels) {
		StringBuilder sb = new StringBuilder(labels.length);
		for (int l : labels)
			if (l != EPSILON)
				sb.appendCodePoint(l);
		return sb.toString();
	}

	// human-readable, for dumps and messages
	public static String display(int label) {
		switch (label) {
		case EPSILON: return "<eps>";
		case OTHER: return "<other>";
		case LEFT_MARK: return "<1";
		case LEFT_MARK_UNMET: return "<2";
		case RIGHT_MARK: return ">";
		case ' ': return "<space>";
		case '\t': return "<tab>";
		case '\n': return "<nl>";
		default:
			return new String(Character.toChars(label));
		}
	}
}
