package edu.isi.verbatim;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered list of compiled rewrite rules, each applied once to the
 * output of the one before.
 */
public class RewriteCascade {
	private final List<String> names = new ArrayList<String>();
	private final List<Fst> rules = new ArrayList<Fst>();

	public RewriteCascade() {
	}

	public RewriteCascade add(String name, Fst rule) {
		names.add(name);
		rules.add(rule);
		return this;
	}

	public List<String> getNames() {
		return Collections.unmodifiableList(names);
	}

	public List<Fst> getRules() {
		return Collections.unmodifiableList(rules);
	}

	public int size() {
		return rules.size();
	}

	/**
	 * Run text through every rule in order. Characters outside the alphabet
	 * pass through unchanged.
	 */
	public String apply(String text, Alphabet alpha) throws UnusualConditionException {
		boolean debug = false;
		String cur = text;
		for (int i = 0; i < rules.size(); i++) {
			int[] source = Labels.toLabels(cur);
			Fst lattice = FstBuilder.compose(FstBuilder.linear(alpha.encode(source)), rules.get(i));
			if (lattice.isEmpty())
				throw new UnusualConditionException("Rewrite rule "+names.get(i)+" rejected \""+cur+"\"");
			String next = ShortestPath.best(lattice).getOutput(source, null);
			if (debug && !next.equals(cur)) Debug.debug(debug, names.get(i)+": \""+cur+"\" -> \""+next+"\"");
			cur = next;
		}
		return cur;
	}
}
