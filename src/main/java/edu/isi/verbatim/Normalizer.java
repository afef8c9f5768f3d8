package edu.isi.verbatim;

import java.io.File;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Written text in, spoken text out. Building compiles (or restores) the
 * grammars of one configuration; after that a normalizer holds only
 * immutable automata and may be shared between threads.
 */
public class Normalizer {
	public static final String CLASSIFY = "tokenize_and_classify";
	public static final String REWRITE = "rewrite/";
	public static final String VERBALIZE = "verbalize/";

	private final Alphabet alpha;
	private final Tokenizer tokenizer;
	private final VerbalizeGrammar verbalizer;

	/**
	 * Build the grammars for config, or restore them from its cache
	 * directory when an up-to-date archive is there.
	 */
	public Normalizer(NormalizerConfig config) throws ConfigureException, DataFormatException {
		boolean debug = false;
		Date start = new Date();
		if (debug) Debug.debug(debug, "Building normalizer: "+config);
		LanguagePack pack = LanguagePack.forLanguage(config.getLanguage());
		Lexicon lex = Lexicon.load(config.getLanguage(), config.getWhitelist());
		Map<String, Fst> grammars = null;
		GrammarArchive archive = null;
		if (config.getCacheDir() != null) {
			archive = new GrammarArchive(new File(config.getCacheDir(), config.getArchiveName()), fingerprint(lex, config));
			if (!config.isOverwriteCache()) {
				grammars = archive.read();
				if (grammars != null)
					Debug.prettyDebug("Restored grammars from "+archive.getFile());
			}
		}
		if (grammars == null) {
			grammars = compile(pack.build(lex, config));
			if (archive != null && archive.write(grammars))
				Debug.prettyDebug("Created "+archive.getFile());
		}
		alpha = lex.getAlphabet();
		tokenizer = tokenizer(alpha, grammars);
		verbalizer = verbalizer(alpha, grammars);
		Debug.dbtime(1, start, "normalizer for "+config.getLanguage());
	}

	/**
	 * Use already compiled grammars, keyed as {@link #compile} keys them.
	 */
	public Normalizer(Alphabet alpha, Map<String, Fst> grammars) throws ConfigureException {
		this.alpha = alpha;
		tokenizer = tokenizer(alpha, grammars);
		verbalizer = verbalizer(alpha, grammars);
	}

	private static Tokenizer tokenizer(Alphabet alpha, Map<String, Fst> grammars) throws ConfigureException {
		Fst classify = grammars.get(CLASSIFY);
		if (classify == null)
			throw new ConfigureException("No "+CLASSIFY+" grammar among "+grammars.keySet());
		RewriteCascade cascade = new RewriteCascade();
		for (Map.Entry<String, Fst> e : grammars.entrySet())
			if (e.getKey().startsWith(REWRITE))
				cascade.add(e.getKey().substring(REWRITE.length()), e.getValue());
		return new Tokenizer(alpha, cascade, classify);
	}

	private static VerbalizeGrammar verbalizer(Alphabet alpha, Map<String, Fst> grammars) throws ConfigureException {
		Map<String, Fst> verbalizers = new LinkedHashMap<String, Fst>();
		for (Map.Entry<String, Fst> e : grammars.entrySet())
			if (e.getKey().startsWith(VERBALIZE))
				verbalizers.put(e.getKey().substring(VERBALIZE.length()), e.getValue());
		if (!verbalizers.containsKey(TokenMarkers.PLAIN_FIELD))
			throw new ConfigureException("No verbalizer for plain tokens among "+verbalizers.keySet());
		return new VerbalizeGrammar(alpha, verbalizers);
	}

	/**
	 * Compile a grammar set into named automata: the classify graph, the
	 * rewrite rules in order and one verbalizer per name.
	 */
	public static Map<String, Fst> compile(GrammarSet set) throws ConfigureException {
		Date start = new Date();
		Map<String, Fst> ret = new LinkedHashMap<String, Fst>();
		ClassifyGrammar cg = new ClassifyGrammar(set.getAlphabet(), set.getClassifiers(), set.getPunctuation(), set.getFallback());
		ret.put(CLASSIFY, cg.getFst());
		RewriteCascade cascade = set.getCascade();
		for (int i = 0; i < cascade.size(); i++)
			ret.put(REWRITE+cascade.getNames().get(i), cascade.getRules().get(i));
		for (Verbalizer v : set.getVerbalizers())
			ret.put(VERBALIZE+v.getName(), v.getVerbalizeFst());
		Debug.dbtime(1, start, "compiled "+ret.size()+" grammars");
		return ret;
	}

	// archive identity: lexicon contents plus everything in the configuration that changes the grammars
	private static String fingerprint(Lexicon lex, NormalizerConfig config) {
		return lex.fingerprint()+"/"+config.isDeterministic()+"/"+config.getInputCase().tag();
	}

	public Alphabet getAlphabet() {
		return alpha;
	}

	public List<Token> tokenize(String text) throws UnusualConditionException {
		return tokenizer.tokenize(text);
	}

	/**
	 * The spoken form of text. Tokens are joined with single spaces, except
	 * that punctuation written without a space next to its neighbour stays
	 * attached to it.
	 */
	public String normalize(String text) throws UnusualConditionException {
		return verbalize(tokenizer.tokenize(text));
	}

	/**
	 * Up to n distinct spoken forms, best first.
	 */
	public List<String> normalizeOptions(String text, int n) throws UnusualConditionException {
		LinkedHashSet<String> forms = new LinkedHashSet<String>();
		for (List<Token> tokens : tokenizer.tokenizeOptions(text, n))
			forms.add(verbalize(tokens));
		return new ArrayList<String>(forms);
	}

	public String verbalize(List<Token> tokens) throws UnusualConditionException {
		StringBuilder sb = new StringBuilder();
		Token prev = null;
		for (Token t : tokens) {
			String spoken = verbalizer.verbalize(t);
			if (prev != null) {
				boolean glued = prev.getEnd() == t.getStart() && (isPunctuation(prev) || isPunctuation(t));
				if (!glued)
					sb.append(' ');
			}
			sb.append(spoken);
			prev = t;
		}
		return sb.toString();
	}

	private static boolean isPunctuation(Token t) {
		String s = t.getText();
		if (s == null || s.length() == 0)
			return false;
		for (int i = 0; i < s.length(); ) {
			int cp = s.codePointAt(i);
			if (!Alphabet.member(Alphabet.CharClass.PUNCT, cp))
				return false;
			i += Character.charCount(cp);
		}
		return true;
	}
}
