package edu.isi.verbatim;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.set.hash.TIntHashSet;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The declared symbol set of a language, Σ. Input characters outside it are
 * read as {@link Labels#OTHER}, which every class that admits letters also
 * admits, so unknown scripts flow through as words.
 */
public class Alphabet {
	public enum CharClass { ALL, DIGIT, SPACE, NOT_SPACE, ALPHA, PUNCT, NOT_QUOTE }

	// 0041 or 0041-005A, then an optional comment
	private static final Pattern rangePat = Pattern.compile("^([0-9A-Fa-f]{1,6})(?:-([0-9A-Fa-f]{1,6}))?(?:\\s.*)?$");

	private final TIntHashSet symbols = new TIntHashSet();
	private final int[] sorted;
	private final Fst[] classes = new Fst[CharClass.values().length];
	private Fst sigmaStar = null;

	public Alphabet(int[] codepoints) throws ConfigureException {
		TIntArrayList l = new TIntArrayList();
		for (int cp : codepoints) {
			if (Labels.isReserved(cp))
				throw new ConfigureException("Alphabet may not contain reserved label U+"+Integer.toHexString(cp).toUpperCase());
			if (symbols.add(cp))
				l.add(cp);
		}
		l.add(Labels.OTHER);
		l.sort();
		sorted = l.toArray();
	}

	public static Alphabet load(String language) throws ConfigureException, DataFormatException {
		String res = "data/"+language+"/alphabet.txt";
		InputStream is = Alphabet.class.getResourceAsStream(res);
		if (is == null)
			throw new ConfigureException("No alphabet for language "+language+" (looked for "+res+")");
		try {
			try {
				return read(new InputStreamReader(is, StandardCharsets.UTF_8), res);
			}
			finally {
				is.close();
			}
		}
		catch (IOException e) {
			throw new ConfigureException("Couldn't read "+res, e);
		}
	}

	public static Alphabet read(Reader r, String name) throws IOException, DataFormatException, ConfigureException {
		BufferedReader br = new BufferedReader(r);
		TIntArrayList cps = new TIntArrayList();
		String line;
		int lineno = 0;
		while ((line = br.readLine()) != null) {
			lineno++;
			line = line.trim();
			if (line.length() == 0 || line.startsWith("#"))
				continue;
			Matcher m = rangePat.matcher(line);
			if (!m.matches())
				throw new DataFormatException(name+":"+lineno+": expected a hex code point or range, got "+line);
			int lo = Integer.parseInt(m.group(1), 16);
			int hi = m.group(2) == null ? lo : Integer.parseInt(m.group(2), 16);
			if (hi < lo || !Character.isValidCodePoint(hi))
				throw new DataFormatException(name+":"+lineno+": bad range "+line);
			for (int c = lo; c <= hi; c++)
				cps.add(c);
		}
		return new Alphabet(cps.toArray());
	}

	public boolean contains(int cp) {
		return cp == Labels.OTHER || symbols.contains(cp);
	}

	// all labels, placeholder included, ascending
	public int[] getLabels() {
		return sorted.clone();
	}

	// code points of text, undeclared ones replaced by the placeholder
	public int[] encode(String text) {
		return encode(Labels.toLabels(text));
	}

	public int[] encode(int[] cps) {
		int[] out = new int[cps.length];
		for (int i = 0; i < cps.length; i++)
			out[i] = symbols.contains(cps[i]) ? cps[i] : Labels.OTHER;
		return out;
	}

	public int[] labels(CharClass c) {
		TIntArrayList l = new TIntArrayList();
		for (int cp : sorted)
			if (member(c, cp))
				l.add(cp);
		return l.toArray();
	}

	// class membership of a code point as written, outside any alphabet
	public static boolean member(CharClass c, int cp) {
		switch (c) {
		case ALL: return true;
		case DIGIT: return cp >= '0' && cp <= '9';
		case SPACE: return isSpace(cp);
		case NOT_SPACE: return !isSpace(cp);
		case ALPHA: return cp == Labels.OTHER || Character.isLetter(cp);
		case PUNCT: return cp != Labels.OTHER && !isSpace(cp) && !Character.isLetterOrDigit(cp);
		case NOT_QUOTE: return cp != '"';
		}
		return false;
	}

	public static boolean isSpace(int cp) {
		return cp != Labels.OTHER && (Character.isWhitespace(cp) || Character.isSpaceChar(cp));
	}

	// one symbol of the class
	public Fst get(CharClass c) {
		if (classes[c.ordinal()] == null)
			classes[c.ordinal()] = FstBuilder.labelSet(labels(c));
		return classes[c.ordinal()];
	}

	public Fst sigma() {
		return get(CharClass.ALL);
	}

	// any string over the alphabet, as a single looping state
	public Fst sigmaStar() {
		if (sigmaStar == null)
			sigmaStar = loop(sorted);
		return sigmaStar;
	}

	public static Fst loop(int[] labels) {
		MutableFst m = new MutableFst();
		int s = m.addState();
		m.setStart(s);
		m.setFinal(s, 0);
		for (int l : labels)
			m.addArc(s, l, l, 0, s);
		return m.build();
	}
}
