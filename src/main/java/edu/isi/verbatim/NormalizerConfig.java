package edu.isi.verbatim;

import java.io.File;
import java.util.Locale;

/**
 * What to build: language, case handling, determinism, an optional extra
 * whitelist, and where to cache compiled grammars.
 */
public class NormalizerConfig {
	public enum InputCase {
		CASED, LOWER_CASED;

		public String tag() {
			return name().toLowerCase(Locale.ROOT);
		}

		public static InputCase get(String s) throws ConfigureException {
			for (InputCase c : values()) {
				if (c.tag().equals(s) || c.name().equals(s))
					return c;
			}
			throw new ConfigureException("Invalid input case ("+s+"); valid values are cased, lower_cased");
		}
	}

	private String language = "en";
	private InputCase inputCase = InputCase.CASED;
	private boolean deterministic = true;
	private File whitelist = null;
	private File cacheDir = null;
	private boolean overwriteCache = false;

	public String getLanguage() {
		return language;
	}

	public NormalizerConfig setLanguage(String language) {
		this.language = language;
		return this;
	}

	public InputCase getInputCase() {
		return inputCase;
	}

	public NormalizerConfig setInputCase(InputCase inputCase) {
		this.inputCase = inputCase;
		return this;
	}

	public boolean isDeterministic() {
		return deterministic;
	}

	public NormalizerConfig setDeterministic(boolean deterministic) {
		this.deterministic = deterministic;
		return this;
	}

	public File getWhitelist() {
		return whitelist;
	}

	public NormalizerConfig setWhitelist(File whitelist) {
		this.whitelist = whitelist;
		return this;
	}

	public File getCacheDir() {
		return cacheDir;
	}

	public NormalizerConfig setCacheDir(File cacheDir) {
		this.cacheDir = cacheDir;
		return this;
	}

	public boolean isOverwriteCache() {
		return overwriteCache;
	}

	public NormalizerConfig setOverwriteCache(boolean overwriteCache) {
		this.overwriteCache = overwriteCache;
		return this;
	}

	/**
	 * File name of the grammar archive for this configuration, e.g.
	 * <code>en_tn_true_deterministic_cased_none_tokenize.far</code>.
	 */
	public String getArchiveName() {
		String wl = "none";
		if (whitelist != null) {
			wl = whitelist.getName();
			int dot = wl.lastIndexOf('.');
			if (dot > 0)
				wl = wl.substring(0, dot);
		}
		return language+"_tn_"+deterministic+"_deterministic_"+inputCase.tag()+"_"+wl+"_tokenize.far";
	}

	public String toString() {
		return "language="+language+" case="+inputCase.tag()+" deterministic="+deterministic
				+" whitelist="+whitelist+" cache="+cacheDir+(overwriteCache ? " (overwrite)" : "");
	}
}
