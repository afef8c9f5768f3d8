package edu.isi.verbatim;

/**
 * A category that recognizes a span of raw text and writes its token body,
 * e.g. <code>cardinal { integer: "twelve" }</code>.
 */
public interface Classifier {
	/** category tag, also the key of the matching verbalizer */
	String getName();
	/** bias added once per token this category produces */
	double getWeight();
	Fst getClassifyFst();
}
