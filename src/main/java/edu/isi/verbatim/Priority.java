package edu.isi.verbatim;

/**
 * Named disambiguation weights, lowest (most preferred) first. A category's
 * level is added once per token it produces; finer adjustments inside a
 * grammar stay well below the gap between neighbouring levels.
 * <p>
 * SPECIAL_IDIOM &lt; EXACT &lt; SPECIFIC &lt; GENERIC &lt; PUNCTUATION &lt; FALLBACK
 */
public enum Priority {
	/** offset for an idiomatic branch inside a grammar, added to that grammar's own level */
	SPECIAL_IDIOM(-0.2),
	/** literal whitelist entries */
	EXACT(1.01),
	/** narrow shapes: dates, times, telephone numbers */
	SPECIFIC(1.05),
	/** open-ended shapes: numbers, money, arithmetic */
	GENERIC(1.1),
	PUNCTUATION(2.1),
	/** the catch-all word grammar; must outweigh every other category combined */
	FALLBACK(100);

	private final double weight;

	Priority(double weight) {
		this.weight = weight;
	}

	public double getWeight() {
		return weight;
	}
}
