package edu.isi.verbatim;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All lexical tables of one language, loaded once and shared by reference
 * between the category grammars of a configuration. Compiled string maps are
 * memoized, so a table used by several grammars is compiled once.
 */
public class Lexicon {
	public static final String WHITELIST = "whitelist";

	private final String language;
	private final Alphabet alphabet;
	private final Map<String, LexiconTable> tables;
	private final Map<String, Fst> compiled = new HashMap<String, Fst>();

	public Lexicon(String language, Alphabet alphabet, Map<String, LexiconTable> tables) {
		this.language = language;
		this.alphabet = alphabet;
		this.tables = new LinkedHashMap<String, LexiconTable>(tables);
	}

	/**
	 * Load the tables listed in data/&lt;language&gt;/tables.txt. Rows of
	 * an extra whitelist file replace built-in whitelist rows with the same
	 * written form and add the rest.
	 */
	public static Lexicon load(String language, File extraWhitelist) throws ConfigureException, DataFormatException {
		Alphabet alpha = Alphabet.load(language);
		Map<String, LexiconTable> tables = new LinkedHashMap<String, LexiconTable>();
		String index = "data/"+language+"/tables.txt";
		InputStream is = Lexicon.class.getResourceAsStream(index);
		if (is == null)
			throw new ConfigureException("No lexicon index for language "+language+" (looked for "+index+")");
		try {
			List<String> names = new ArrayList<String>();
			try {
				BufferedReader br = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
				String line;
				while ((line = br.readLine()) != null) {
					line = line.trim();
					if (line.length() > 0 && !line.startsWith("#"))
						names.add(line);
				}
			}
			finally {
				is.close();
			}
			for (String name : names) {
				String res = "data/"+language+"/"+name+".tsv";
				InputStream ts = Lexicon.class.getResourceAsStream(res);
				if (ts == null)
					throw new ConfigureException("Table "+name+" is listed in "+index+" but "+res+" is missing");
				try {
					tables.put(name, LexiconTable.read(res, new InputStreamReader(ts, StandardCharsets.UTF_8)));
				}
				finally {
					ts.close();
				}
			}
			if (extraWhitelist != null) {
				InputStream ws = new FileInputStream(extraWhitelist);
				LexiconTable extra;
				try {
					extra = LexiconTable.read(extraWhitelist.getPath(), new InputStreamReader(ws, StandardCharsets.UTF_8));
				}
				finally {
					ws.close();
				}
				tables.put(WHITELIST, mergeWhitelist(tables.get(WHITELIST), extra));
			}
		}
		catch (IOException e) {
			throw new ConfigureException("Couldn't read lexicon for "+language+": "+e.getMessage(), e);
		}
		return new Lexicon(language, alpha, tables);
	}

	private static LexiconTable mergeWhitelist(LexiconTable base, LexiconTable extra) {
		List<LexiconTable.Row> rows = new ArrayList<LexiconTable.Row>(extra.getRows());
		if (base != null) {
			for (LexiconTable.Row r : base.getRows())
				if (extra.lookup(r.getKey()).isEmpty())
					rows.add(r);
		}
		return new LexiconTable(WHITELIST, rows);
	}

	public String getLanguage() {
		return language;
	}

	public Alphabet getAlphabet() {
		return alphabet;
	}

	public boolean hasTable(String name) {
		return tables.containsKey(name);
	}

	public LexiconTable getTable(String name) throws ConfigureException {
		LexiconTable t = tables.get(name);
		if (t == null)
			throw new ConfigureException("Lexicon "+language+" has no table "+name);
		return t;
	}

	// first spoken form of key; a missing entry is a configuration error
	public String lookup(String table, String key) throws ConfigureException {
		List<String> v = getTable(table).lookup(key);
		if (v.isEmpty())
			throw new ConfigureException("Table "+table+" of "+language+" has no entry for \""+key+"\"");
		return v.get(0);
	}

	/**
	 * The table as a written-to-spoken transducer, optimized. Every written
	 * form must be spelled over the alphabet.
	 */
	public Fst stringMap(String name) throws ConfigureException {
		Fst f = compiled.get(name);
		if (f != null)
			return f;
		LexiconTable t = getTable(name);
		for (LexiconTable.Row r : t.getRows()) {
			for (int cp : Labels.toLabels(r.getKey()))
				if (!alphabet.contains(cp))
					throw new ConfigureException("Table "+name+": \""+r.getKey()+"\" uses U+"+Integer.toHexString(cp).toUpperCase()+", which is outside the alphabet of "+language);
		}
		f = Optimizer.optimize(FstBuilder.stringMap(t.getRows()));
		compiled.put(name, f);
		return f;
	}

	// written forms of the table as an acceptor
	public Fst keys(String name) throws ConfigureException {
		return Optimizer.optimize(FstBuilder.project(stringMap(name), FstBuilder.Tape.INPUT));
	}

	/**
	 * Digest of every row of every table and of the alphabet. Two lexicons
	 * with the same fingerprint compile to the same grammars.
	 */
	public String fingerprint() {
		try {
			MessageDigest md = MessageDigest.getInstance("SHA-1");
			md.update(language.getBytes(StandardCharsets.UTF_8));
			for (int l : alphabet.getLabels())
				md.update(Integer.toString(l).getBytes(StandardCharsets.UTF_8));
			for (Map.Entry<String, LexiconTable> e : tables.entrySet()) {
				md.update(("\n#"+e.getKey()+"\n").getBytes(StandardCharsets.UTF_8));
				for (LexiconTable.Row r : e.getValue().getRows())
					md.update((r.toString()+"\n").getBytes(StandardCharsets.UTF_8));
			}
			StringBuilder sb = new StringBuilder();
			for (byte b : md.digest())
				sb.append(String.format("%02x", b));
			return sb.toString();
		}
		catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-1 is not available", e);
		}
	}
}
