package edu.isi.verbatim;

import gnu.trove.list.array.TIntArrayList;

/**
 * Context-dependent rewrite rules, compiled into transducers after Mohri
 * and Sproat: every occurrence of dom(tau) between lambda and rho is
 * rewritten by tau, obligatorily and left to right; everything else is
 * copied. The rule is the composition of five machines:
 * <pre>
 *   r        inserts &gt; before every match of rho
 *   f        inserts &lt;1 or &lt;2 before every match of dom(tau) followed by &gt;
 *   replace  rewrites &lt;1 dom(tau) &gt; with tau and drops the other &gt;
 *   l1       admits &lt;1 only right after lambda
 *   l2       admits &lt;2 only where lambda has not just matched
 * </pre>
 * lambda is matched against the rewritten text, rho against the original.
 */
public class Rewrite {
	private enum MarkerType {
		/** insert the markers wherever the automaton is in a final state */
		MARK,
		/** delete the markers, allowed only in final states */
		CHECK,
		/** delete the markers, allowed only in non-final states */
		CHECK_COMPLEMENT
	}

	private static final int[] RIGHT = new int[] {Labels.RIGHT_MARK};
	private static final int[] LEFT = new int[] {Labels.LEFT_MARK, Labels.LEFT_MARK_UNMET};
	private static final int[] ALL_MARKS = new int[] {Labels.LEFT_MARK, Labels.LEFT_MARK_UNMET, Labels.RIGHT_MARK};

	/**
	 * Compile tau / lambda __ rho over the alphabet. lambda and rho are
	 * acceptors; null or {@link FstBuilder#epsilon()} means no condition.
	 * tau must read and write only alphabet symbols.
	 */
	public static Fst compile(Fst tau, Fst lambda, Fst rho, Alphabet alpha) throws ConfigureException {
		boolean debug = false;
		if (lambda == null)
			lambda = FstBuilder.epsilon();
		if (rho == null)
			rho = FstBuilder.epsilon();
		checkLabels(tau, alpha, "rewrite");
		checkLabels(lambda, alpha, "left context");
		checkLabels(rho, alpha, "right context");
		int[] sigma = alpha.getLabels();
		Fst sigmaStar = Alphabet.loop(sigma);

		// r: > before each rho, built right to left
		Fst rRev = Determinizer.determinizeAcceptor(FstBuilder.concat(sigmaStar,
				FstBuilder.reverse(FstBuilder.project(rho, FstBuilder.Tape.INPUT))));
		Fst r = FstBuilder.reverse(marker(rRev, MarkerType.MARK, RIGHT));

		// f: <1 or <2 before each dom(tau) followed by >, also right to left
		Fst phi = ignore(FstBuilder.project(tau, FstBuilder.Tape.INPUT), RIGHT);
		Fst fRev = Determinizer.determinizeAcceptor(FstBuilder.concat(Alphabet.loop(union(sigma, RIGHT)),
				FstBuilder.accept(RIGHT), FstBuilder.reverse(phi)));
		Fst f = FstBuilder.reverse(marker(fRev, MarkerType.MARK, LEFT));

		Fst dropRight = FstBuilder.cross(RIGHT, new int[0], 0);
		Fst replace = FstBuilder.star(FstBuilder.union(
				FstBuilder.labelSet(sigma),
				FstBuilder.accept(new int[] {Labels.LEFT_MARK_UNMET}),
				dropRight,
				FstBuilder.concat(FstBuilder.accept(new int[] {Labels.LEFT_MARK}), deleting(tau, ALL_MARKS), dropRight)));

		int[] withUnmet = union(sigma, new int[] {Labels.LEFT_MARK_UNMET});
		Fst l1Dfa = Determinizer.determinizeAcceptor(FstBuilder.concat(Alphabet.loop(withUnmet),
				ignore(FstBuilder.project(lambda, FstBuilder.Tape.INPUT), new int[] {Labels.LEFT_MARK_UNMET})));
		Fst l1 = marker(l1Dfa, MarkerType.CHECK, new int[] {Labels.LEFT_MARK});
		Fst l2Dfa = Determinizer.determinizeAcceptor(FstBuilder.concat(sigmaStar, FstBuilder.project(lambda, FstBuilder.Tape.INPUT)));
		Fst l2 = marker(l2Dfa, MarkerType.CHECK_COMPLEMENT, new int[] {Labels.LEFT_MARK_UNMET});

		Fst rule = Optimizer.optimize(FstBuilder.compose(r, f, replace, l1, l2));
		if (debug) Debug.debug(debug, "Rewrite rule: r="+r.numStates()+" f="+f.numStates()+" replace="+replace.numStates()
				+" l1="+l1.numStates()+" l2="+l2.numStates()+" -> "+rule.numStates());
		return rule;
	}

	// rewrite everywhere tau applies, no context
	public static Fst compile(Fst tau, Alphabet alpha) throws ConfigureException {
		return compile(tau, null, null, alpha);
	}

	private static void checkLabels(Fst f, Alphabet alpha, String what) throws ConfigureException {
		for (int s = 0; s < f.numStates(); s++) {
			for (int i = 0; i < f.numArcs(s); i++) {
				Arc a = f.getArc(s, i);
				for (int l : new int[] {a.getIlabel(), a.getOlabel()}) {
					if (l == Labels.EPSILON)
						continue;
					if (Labels.isReserved(l) && l != Labels.OTHER)
						throw new ConfigureException("The "+what+" of a rule uses the reserved marker "+Labels.display(l));
					if (!alpha.contains(l))
						throw new ConfigureException("The "+what+" of a rule uses "+Labels.display(l)+", which is outside the alphabet");
				}
			}
		}
	}

	private static int[] union(int[] a, int[] b) {
		TIntArrayList l = new TIntArrayList(a);
		l.addAll(b);
		return l.toArray();
	}

	// copy of f that also reads the given labels, unchanged, anywhere
	private static Fst ignore(Fst f, int[] labels) {
		return loops(f, labels, true);
	}

	// copy of f that also deletes the given labels anywhere
	private static Fst deleting(Fst f, int[] labels) {
		return loops(f, labels, false);
	}

	private static Fst loops(Fst f, int[] labels, boolean keep) {
		MutableFst m = f.toMutable();
		for (int s = 0; s < m.numStates(); s++)
			for (int l : labels)
				m.addArc(s, l, keep ? l : Labels.EPSILON, 0, s);
		return m.build();
	}

	/*
	 * dfa must be deterministic and complete over its alphabet, so that every
	 * prefix of the input ends in exactly one state.
	 */
	private static Fst marker(Fst dfa, MarkerType type, int[] marks) {
		MutableFst m = new MutableFst();
		for (int s = 0; s < dfa.numStates(); s++)
			m.addState();
		m.setStart(dfa.getStart());
		for (int s = 0; s < dfa.numStates(); s++) {
			if (type == MarkerType.MARK && dfa.isFinal(s)) {
				// the arcs of s move to a copy that can only be reached by writing a marker
				int c = m.addState();
				m.setFinal(c, 0);
				for (int i = 0; i < dfa.numArcs(s); i++)
					m.addArc(c, dfa.getArc(s, i));
				for (int mk : marks)
					m.addArc(s, Labels.EPSILON, mk, 0, c);
				continue;
			}
			m.setFinal(s, 0);
			for (int i = 0; i < dfa.numArcs(s); i++)
				m.addArc(s, dfa.getArc(s, i));
			if (type == MarkerType.CHECK && dfa.isFinal(s) || type == MarkerType.CHECK_COMPLEMENT && !dfa.isFinal(s)) {
				for (int mk : marks)
					m.addArc(s, mk, Labels.EPSILON, 0, s);
			}
		}
		return m.build();
	}
}
