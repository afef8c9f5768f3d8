package edu.isi.verbatim;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Literal entries of the whitelist table, written as plain tokens:
 * <code>Dr.</code> becomes <code>name: "doctor"</code>. Verbalized by
 * {@link PlainVerbalizer}.
 */
public class WhitelistGrammar implements Classifier {
	public static final String NAME = "whitelist";

	private final Fst classify;

	/**
	 * @param lowerCased also accept the lower-cased form of every key
	 */
	public WhitelistGrammar(Lexicon lex, boolean lowerCased) throws ConfigureException {
		Fst map;
		if (!lex.hasTable(Lexicon.WHITELIST))
			map = FstBuilder.empty();
		else if (!lowerCased)
			map = lex.stringMap(Lexicon.WHITELIST);
		else {
			List<LexiconTable.Row> rows = new ArrayList<LexiconTable.Row>();
			for (LexiconTable.Row r : lex.getTable(Lexicon.WHITELIST).getRows()) {
				rows.add(r);
				String lower = r.getKey().toLowerCase(Locale.ROOT);
				if (!lower.equals(r.getKey()) && lex.getTable(Lexicon.WHITELIST).lookup(lower).isEmpty())
					rows.add(new LexiconTable.Row(lower, r.getValue(), r.getWeight()));
			}
			map = Optimizer.optimize(FstBuilder.stringMap(rows));
		}
		classify = Optimizer.optimize(TokenMarkers.plain(map));
	}

	public String getName() {
		return NAME;
	}

	public double getWeight() {
		return Priority.EXACT.getWeight();
	}

	public Fst getClassifyFst() {
		return classify;
	}
}
