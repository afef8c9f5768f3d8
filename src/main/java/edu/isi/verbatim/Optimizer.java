package edu.isi.verbatim;

/**
 * Epsilon removal, then determinization and minimization of the transducer
 * encoded as an acceptor over (input, output, weight) symbols. When the
 * subset construction would grow past {@link #MAX_SUBSETS} states the
 * epsilon-free automaton is returned instead.
 */
public class Optimizer {
	public static final int MAX_SUBSETS = 250000;

	public static Fst optimize(Fst f) {
		boolean debug = false;
		Fst g = removeEpsilons(f);
		Fst d = Determinizer.determinizeEncoded(g, MAX_SUBSETS);
		if (d == null) {
			Debug.prettyDebug("Warning: determinization of a "+g.numStates()+"-state grammar exceeded "+MAX_SUBSETS+" subsets; keeping it epsilon-free only");
			return g;
		}
		Fst r = Connector.connect(Minimizer.minimize(d));
		if (debug) Debug.debug(debug, f.numStates()+" -> "+g.numStates()+" -> "+d.numStates()+" -> "+r.numStates());
		return r;
	}

	public static Fst removeEpsilons(Fst f) {
		return EpsilonRemoval.removeEpsilons(Connector.connect(f));
	}
}
