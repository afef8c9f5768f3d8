package edu.isi.verbatim;

/**
 * The grammars of one language, built over its lexicon.
 */
public abstract class LanguagePack {

	public abstract String getLanguage();

	public abstract GrammarSet build(Lexicon lex, NormalizerConfig config) throws ConfigureException;

	public static LanguagePack forLanguage(String language) throws ConfigureException {
		if ("en".equals(language))
			return new EnglishPack();
		throw new ConfigureException("Unsupported language ("+language+"); valid values are en");
	}
}
