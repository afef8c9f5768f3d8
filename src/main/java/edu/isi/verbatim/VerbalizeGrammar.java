package edu.isi.verbatim;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Verbalizer transducers by name, one per category plus the plain one.
 * A token is verbalized by composing its wire form with the transducer of
 * its category.
 */
public class VerbalizeGrammar {
	private final Alphabet alpha;
	private final Map<String, Fst> verbalizers;

	public VerbalizeGrammar(Alphabet alpha, Map<String, Fst> verbalizers) {
		this.alpha = alpha;
		this.verbalizers = new LinkedHashMap<String, Fst>(verbalizers);
	}

	/**
	 * @throws UnusualConditionException if there is no verbalizer for the
	 *         token's category or it cannot read the token
	 */
	public String verbalize(Token t) throws UnusualConditionException {
		Fst v = verbalizers.get(t.getVerbalizerName());
		if (v == null)
			throw new UnusualConditionException("No verbalizer for "+t.getVerbalizerName()+" tokens");
		String body = t.toString();
		int[] source = Labels.toLabels(body);
		Fst lattice = FstBuilder.compose(FstBuilder.linear(alpha.encode(source)), v);
		if (lattice.isEmpty())
			throw new UnusualConditionException("Verbalizer "+t.getVerbalizerName()+" can't read "+body);
		return ShortestPath.best(lattice).getOutput(source, null);
	}
}
