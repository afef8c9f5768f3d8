package edu.isi.verbatim;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything a language pack contributes: the rewrite cascade, the
 * categories in declaration order, punctuation, the fallback and the
 * verbalizers.
 */
public class GrammarSet {
	private final Alphabet alphabet;
	private final RewriteCascade cascade;
	private final List<Classifier> classifiers;
	private final Classifier punctuation;
	private final Classifier fallback;
	private final List<Verbalizer> verbalizers;

	public GrammarSet(Alphabet alphabet, RewriteCascade cascade, List<Classifier> classifiers,
			Classifier punctuation, Classifier fallback, List<Verbalizer> verbalizers) {
		this.alphabet = alphabet;
		this.cascade = cascade;
		this.classifiers = new ArrayList<Classifier>(classifiers);
		this.punctuation = punctuation;
		this.fallback = fallback;
		this.verbalizers = new ArrayList<Verbalizer>(verbalizers);
	}

	public Alphabet getAlphabet() {
		return alphabet;
	}

	public RewriteCascade getCascade() {
		return cascade;
	}

	public List<Classifier> getClassifiers() {
		return Collections.unmodifiableList(classifiers);
	}

	public Classifier getPunctuation() {
		return punctuation;
	}

	public Classifier getFallback() {
		return fallback;
	}

	public List<Verbalizer> getVerbalizers() {
		return Collections.unmodifiableList(verbalizers);
	}
}
