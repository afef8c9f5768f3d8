package edu.isi.verbatim;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.util.Date;
import java.util.List;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.EnumeratedStringParser;
import com.martiansoftware.jsap.stringparsers.FileStringParser;
import com.martiansoftware.jsap.stringparsers.IntegerStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;

// command line: normalize the given text, or each line of stdin
public class Verbatim {
	static final String VERSION = "1.0";

	// everything having to do with the JSAP parameters and config exceptions based on this.
	// Sets the jsap object
	private static JSAPResult processParameters(JSAP jsap, String[] argv) throws ConfigureException, JSAPException {

		Switch helpsw = new Switch("help",
				'h',
				"help",
		"print this help message");
		jsap.registerParameter(helpsw);

		FlaggedOption langopt = new FlaggedOption("language",
				StringStringParser.getParser(),
				"en",
				true,
				'l',
				"language",
		"language of the grammars to use");
		jsap.registerParameter(langopt);

		FlaggedOption caseopt = new FlaggedOption("inputcase",
				EnumeratedStringParser.getParser("cased; lower_cased"),
				"cased",
				true,
				JSAP.NO_SHORTFLAG,
				"input-case",
				"cased, or lower_cased to also accept lower-cased whitelist entries");
		jsap.registerParameter(caseopt);

		Switch nondetsw = new Switch("nondeterministic",
				JSAP.NO_SHORTFLAG,
				"non-deterministic",
		"build grammars that also offer alternative readings (useful with -n)");
		jsap.registerParameter(nondetsw);

		FlaggedOption nbestopt = new FlaggedOption("nbest",
				IntegerStringParser.getParser(),
				"1",
				true,
				'n',
				"nbest",
		"print up to this many distinct spoken forms per input, best first");
		jsap.registerParameter(nbestopt);

		FlaggedOption wlopt = new FlaggedOption("whitelist",
				FileStringParser.getParser().setMustBeFile(true).setMustExist(true),
				null,
				false,
				'w',
				"whitelist",
		"extra whitelist: written<TAB>spoken per line, replacing built-in entries with the same written form");
		jsap.registerParameter(wlopt);

		FlaggedOption cacheopt = new FlaggedOption("cachedir",
				FileStringParser.getParser(),
				null,
				false,
				'c',
				"cache-dir",
		"directory for compiled grammar archives; without it grammars are compiled on every run");
		jsap.registerParameter(cacheopt);

		Switch overwritesw = new Switch("overwrite",
				JSAP.NO_SHORTFLAG,
				"overwrite-cache",
		"rebuild and rewrite the grammar archive even if it is up to date");
		jsap.registerParameter(overwritesw);

		FlaggedOption encodingopt = new FlaggedOption("encoding",
				StringStringParser.getParser(),
				"utf-8",
				true,
				'e',
				"encoding",
				"encoding of input and output, if other than utf-8. Use the same "+
		"naming you would use if specifying this charset in a java program");
		jsap.registerParameter(encodingopt);

		FlaggedOption timeopt = new FlaggedOption("time",
				IntegerStringParser.getParser(),
				null,
				false,
				't',
				"time",
				"Print timing information to stderr at a variety of levels: 0+ for "+
		"total operation, 1+ for grammar building, 2+ for each grammar");
		jsap.registerParameter(timeopt);

		UnflaggedOption textopt = new UnflaggedOption("text",
				StringStringParser.getParser(),
				null,
				false,
				true,
		"text to normalize, as one line. Without it each line of standard input is normalized");
		jsap.registerParameter(textopt);

		JSAPResult config = jsap.parse(argv);
		if (config.success() && config.getInt("nbest") < 1)
			throw new ConfigureException("nbest (-n) must be at least 1");
		return config;
	}

	public static void main(String argv[]) throws Exception {
		Date startTime = new Date();
		JSAP jsap = new JSAP();
		JSAPResult config = null;
		int timeLevel = -1;
		String encoding = null;
		NormalizerConfig nc = new NormalizerConfig();
		try {
			config = processParameters(jsap, argv);
			encoding = config.getString("encoding");
			Debug.setEncoding(encoding);
			if (config.contains("time")) {
				timeLevel = config.getInt("time", -1);
				Debug.setDbLevel(timeLevel);
			}
		}
		catch (JSAPException e) {
			System.err.println("Verbatim options improperly configured: "+e.getMessage());
			System.err.println("Try 'verbatim -h` for a detailed help message");
			System.exit(1);
		}
		catch (ConfigureException e) {
			System.err.println("Verbatim options improperly configured: "+e.getMessage());
			System.err.println("Try 'verbatim -h` for a detailed help message");
			System.exit(1);
		}

		if (config.getBoolean("help")) {
			Debug.prettyDebug("This is Verbatim, version "+VERSION);
			Debug.prettyDebug("Usage: verbatim ");
			Debug.prettyDebug("             "+jsap.getUsage());
			Debug.prettyDebug("");
			Debug.prettyDebug(jsap.getHelp());
			System.exit(0);
		}

		if (!config.success()) {
			for (java.util.Iterator errs = config.getErrorMessageIterator();
			errs.hasNext();) {
				Debug.prettyDebug("Error: " + errs.next());
			}
			Debug.prettyDebug("Usage: verbatim ");
			Debug.prettyDebug("             "+jsap.getUsage());
			System.exit(1);
		}

		Normalizer normalizer = null;
		try {
			nc.setLanguage(config.getString("language"))
				.setInputCase(NormalizerConfig.InputCase.get(config.getString("inputcase")))
				.setDeterministic(!config.getBoolean("nondeterministic"))
				.setWhitelist(config.getFile("whitelist"))
				.setCacheDir(config.getFile("cachedir"))
				.setOverwriteCache(config.getBoolean("overwrite"));
			Date preBuildTime = new Date();
			normalizer = new Normalizer(nc);
			Debug.dbtime(timeLevel, 1, preBuildTime, new Date(), "build grammars");
		}
		catch (ConfigureException e) {
			System.err.println("Couldn't build grammars: "+e.getMessage());
			System.exit(1);
		}
		catch (DataFormatException e) {
			System.err.println("Bad grammar data: "+e.getMessage());
			System.exit(1);
		}

		int nbest = config.getInt("nbest");
		OutputStreamWriter w = new OutputStreamWriter(System.out, encoding);
		try {
			String[] text = config.getStringArray("text");
			if (text != null && text.length > 0) {
				StringBuilder sb = new StringBuilder();
				for (String s : text) {
					if (sb.length() > 0)
						sb.append(' ');
					sb.append(s);
				}
				process(normalizer, sb.toString(), nbest, w);
			}
			else {
				BufferedReader br = new BufferedReader(new InputStreamReader(System.in, encoding));
				String line;
				while ((line = br.readLine()) != null)
					process(normalizer, line, nbest, w);
			}
			w.flush();
		}
		catch (UnusualConditionException e) {
			System.err.println("Normalization failed: "+e.getMessage());
			System.exit(1);
		}
		catch (IOException e) {
			System.err.println("I/O error: "+e.getMessage());
			System.exit(1);
		}
		Debug.dbtime(timeLevel, 0, startTime, new Date(), "total operation");
	}

	private static void process(Normalizer normalizer, String text, int nbest, OutputStreamWriter w) throws UnusualConditionException, IOException {
		if (nbest == 1) {
			w.write(normalizer.normalize(text)+"\n");
			return;
		}
		List<String> forms = normalizer.normalizeOptions(text, nbest);
		for (String f : forms)
			w.write(f+"\n");
		w.flush();
	}
}
