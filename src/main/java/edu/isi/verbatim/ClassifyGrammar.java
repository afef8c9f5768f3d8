package edu.isi.verbatim;

import java.util.ArrayList;
import java.util.List;

/**
 * The tokenize-and-classify graph. Every token of the input becomes
 * <code>tokens { ... }</code>, produced either by one of the categories
 * (in declaration order, each with its bias added once) or by the
 * fallback, or by the punctuation grammar. Tokens are separated in the
 * source by whitespace, which collapses to one space; a punctuation token
 * may also be glued to its neighbours. Leading and trailing whitespace is
 * dropped.
 * <p>
 * The frame around the category union and the punctuation grammar:
 * <pre>
 *   start   --ws:eps*-->  items
 *   items   --eps-->      X | P
 *   X       --eps-->      afterX        P --eps--> afterP
 *   afterX  --eps:" "-->  P             (glued X P)
 *   afterP  --eps:" "-->  items         (glued P X, P P)
 *   afterX, afterP --eps:" " ws:eps+-->  items
 *   afterX, afterP --eps--> end  --ws:eps*-->  (final)
 * </pre>
 */
public class ClassifyGrammar {
	private static final String OPEN = "tokens { ";
	private static final String CLOSE = " }";

	private final Fst fst;

	/**
	 * @throws ConfigureException if a category has a negative-weight cycle, or
	 *         if the fallback does not outweigh all other categories together
	 */
	public ClassifyGrammar(Alphabet alpha, List<Classifier> categories, Classifier punctuation, Classifier fallback) throws ConfigureException {
		boolean debug = false;
		List<Classifier> all = new ArrayList<Classifier>(categories);
		all.add(punctuation);
		double sum = 0;
		for (Classifier c : all) {
			WeightBounds.checkNegativeCycles(c.getClassifyFst(), c.getName());
			double worst = WeightBounds.worstCase(c.getClassifyFst());
			sum += c.getWeight()+worst;
			if (debug) Debug.debug(debug, c.getName()+": bias "+c.getWeight()+", worst case "+worst);
		}
		WeightBounds.checkNegativeCycles(fallback.getClassifyFst(), fallback.getName());
		if (!(sum < fallback.getWeight()))
			throw new ConfigureException("Fallback "+fallback.getName()+" weighs "+fallback.getWeight()
					+" but the other categories can reach "+sum+" together; the fallback must be heavier");

		List<Fst> choices = new ArrayList<Fst>();
		for (Classifier c : categories)
			choices.add(FstBuilder.addWeight(c.getClassifyFst(), c.getWeight()));
		choices.add(FstBuilder.addWeight(fallback.getClassifyFst(), fallback.getWeight()));
		Fst x = token(FstBuilder.union(choices));
		Fst p = token(FstBuilder.addWeight(punctuation.getClassifyFst(), punctuation.getWeight()));
		fst = frame(x, p, alpha.labels(Alphabet.CharClass.SPACE));
		if (debug) Debug.debug(debug, "Classify graph has "+fst.numStates()+" states and "+fst.numArcs()+" arcs");
	}

	private static Fst token(Fst body) {
		return FstBuilder.concat(FstBuilder.insert(OPEN), body, FstBuilder.insert(CLOSE));
	}

	private static Fst frame(Fst x, Fst p, int[] space) {
		MutableFst m = new MutableFst();
		int start = m.addState();
		int items = m.addState();
		int afterX = m.addState();
		int afterP = m.addState();
		int gap = m.addState();
		int gapMore = m.addState();
		int end = m.addState();
		m.setStart(start);
		m.setFinal(end, 0);
		int xs = splice(m, x, afterX);
		int ps = splice(m, p, afterP);

		for (int w : space) {
			m.addArc(start, w, Labels.EPSILON, 0, start);
			m.addArc(gap, w, Labels.EPSILON, 0, gapMore);
			m.addArc(gapMore, w, Labels.EPSILON, 0, gapMore);
			m.addArc(end, w, Labels.EPSILON, 0, end);
		}
		m.addArc(start, Labels.EPSILON, Labels.EPSILON, 0, items);
		m.addArc(items, Labels.EPSILON, Labels.EPSILON, 0, xs);
		m.addArc(items, Labels.EPSILON, Labels.EPSILON, 0, ps);
		// glue
		m.addArc(afterX, Labels.EPSILON, ' ', 0, ps);
		m.addArc(afterP, Labels.EPSILON, ' ', 0, items);
		// whitespace
		m.addArc(afterX, Labels.EPSILON, ' ', 0, gap);
		m.addArc(afterP, Labels.EPSILON, ' ', 0, gap);
		m.addArc(gapMore, Labels.EPSILON, Labels.EPSILON, 0, items);
		m.addArc(afterX, Labels.EPSILON, Labels.EPSILON, 0, end);
		m.addArc(afterP, Labels.EPSILON, Labels.EPSILON, 0, end);
		return m.build();
	}

	// copy f into m, its finals leading on to exit; returns f's start in m
	private static int splice(MutableFst m, Fst f, int exit) {
		int off = m.addFst(f);
		for (int s = 0; s < f.numStates(); s++) {
			if (!f.isFinal(s))
				continue;
			m.addArc(off+s, Labels.EPSILON, Labels.EPSILON, f.getFinal(s), exit);
			m.setFinal(off+s, Double.POSITIVE_INFINITY);
		}
		return off+f.getStart();
	}

	public Fst getFst() {
		return fst;
	}
}
