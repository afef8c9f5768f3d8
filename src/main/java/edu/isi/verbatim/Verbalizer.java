package edu.isi.verbatim;

/**
 * Maps the body of one token of its category back to spoken text.
 */
public interface Verbalizer {
	String getName();
	Fst getVerbalizeFst();
}
