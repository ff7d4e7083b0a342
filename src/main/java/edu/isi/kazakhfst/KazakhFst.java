package edu.isi.kazakhfst;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.EnumeratedStringParser;
import com.martiansoftware.jsap.stringparsers.IntegerStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;

// command line front end: builds one of the two pipelines and runs words through it
public class KazakhFst {
	public static final String VERSION = "1.0";

	// everything having to do with the JSAP parameters and config exceptions based on this.
	// Sets the jsap object
	private static JSAPResult processParameters(JSAP jsap, String[] argv) throws ConfigureException, JSAPException {

		// HELP OPTION
		Switch helpsw = new Switch("help",
				'h',
				"help",
		"print this help message");
		jsap.registerParameter(helpsw);

		// format of the input and output words - assumed utf-8 but can be changed here
		FlaggedOption encodingopt = new FlaggedOption("encoding",
				StringStringParser.getParser(),
				"utf-8",
				true,
				'e',
				"encoding",
				"encoding of input and output, if other than utf-8. Use the same "+
		"naming you would use if specifying this charset in a java program");
		jsap.registerParameter(encodingopt);

		// which cascade to build
		FlaggedOption pipelineopt = new FlaggedOption("pipeline",
				EnumeratedStringParser.getParser("phonology; morphology"),
				"phonology",
				true,
				'p',
				"pipeline",
				"phonology converts words to phonemes; morphology inflects stems followed by tags, "+
		"e.g. bala+PLR+1SING-POSS");
		jsap.registerParameter(pipelineopt);

		// print timing information to stderr. number determines level of information
		FlaggedOption timeopt = new FlaggedOption("time",
				IntegerStringParser.getParser(),
				null,
				false,
				't',
				"timedebug",
				"Print timing information to stderr at a variety of levels: 1+ for "+
		"the whole build, 2+ for each rule group and composition, 3+ for each rule and composition step");
		jsap.registerParameter(timeopt);

		Switch csw = new Switch("check",
				'c',
				"check",
				"print the number of rules, states, and arcs of the compiled cascade instead of "+
		"transducing words");
		jsap.registerParameter(csw);

		UnflaggedOption wordsopt = new UnflaggedOption("words",
				StringStringParser.getParser(),
				"-",
				true,
				true,
				"words to transduce, one result per line. The special word '-' (no quote), the default, "+
		"reads words from STDIN, one per line");
		jsap.registerParameter(wordsopt);

		JSAPResult config = jsap.parse(argv);
		if (config.success() && config.contains("time") && config.getInt("time") < 0)
			throw new ConfigureException("Timing level (-t) can't be negative");
		return config;
	}

	/** everything main does, with the streams and the exit status left to the caller */
	public static int run(String[] argv, InputStream in, PrintStream out) {
		boolean debug = false;
		Date startTime = new Date();
		JSAP jsap = new JSAP();
		JSAPResult config = null;
		String encoding = null;

		// 1) Set up all parameters. Die on bad combinations.
		try {
			config = processParameters(jsap, argv);
			encoding = config.getString("encoding");
			if (encoding != null)
				Debug.setEncoding(encoding);
			if (config.contains("time"))
				Debug.setDbLevel(config.getInt("time"));
		}
		catch (JSAPException e) {
			System.err.println("KazakhFst options improperly configured: "+e.getMessage());
			System.err.println("Try 'kazakhfst -h' for a detailed help message");
			return 1;
		}
		catch (ConfigureException e) {
			System.err.println("KazakhFst options improperly configured: "+e.getMessage());
			System.err.println("Try 'kazakhfst -h' for a detailed help message");
			return 1;
		}

		if (!config.success()) {
			for (java.util.Iterator errs = config.getErrorMessageIterator();
			errs.hasNext();) {
				Debug.prettyDebug("Error: " + errs.next());
			}
			Debug.prettyDebug("Usage: kazakhfst ");
			Debug.prettyDebug("             "+jsap.getUsage());
			return 1;
		}

		if (config.getBoolean("help")) {
			Debug.prettyDebug("Usage: kazakhfst ");
			Debug.prettyDebug("             "+jsap.getUsage());
			Debug.prettyDebug("");
			Debug.prettyDebug(jsap.getHelp());
			return 0;
		}

		// 2) Build the cascade
		String pipeline = config.getString("pipeline");
		CompiledCascade cascade = null;
		try {
			if (pipeline.equals("phonology"))
				cascade = KazakhPhonology.buildPhonologyPipeline(KazakhPhonology.ruleTable());
			else if (pipeline.equals("morphology"))
				cascade = KazakhMorphology.buildMorphologyPipeline(KazakhMorphology.ruleTable());
			else
				throw new ConfigureException("Unexpected pipeline: "+pipeline);
		}
		catch (ConfigureException e) {
			System.err.println("KazakhFst options improperly configured: "+e.getMessage());
			return 1;
		}
		catch (AlphabetMismatchException e) {
			System.err.println("Alphabet mismatch while building "+pipeline+": "+e.getMessage());
			return 1;
		}
		catch (ConflictingSubstitutionException e) {
			System.err.println("Conflicting substitution while building "+pipeline+": "+e.getMessage());
			return 1;
		}
		catch (EmptyLanguageException e) {
			System.err.println("Empty language while building "+pipeline+": "+e.getMessage());
			return 1;
		}
		catch (UnusualConditionException e) {
			System.err.println("Unusual condition while building "+pipeline+": "+e.getMessage());
			return 1;
		}

		if (config.getBoolean("check")) {
			out.println(cascade.getStats());
			out.flush();
			return 0;
		}

		// 3) Transduce. A bad word is reported and skipped
		KazakhPhonology g2p = pipeline.equals("phonology") ? new KazakhPhonology(cascade) : null;
		KazakhMorphology morph = pipeline.equals("morphology") ? new KazakhMorphology(cascade) : null;
		try {
			Writer w = new OutputStreamWriter(out, encoding);
			for (String word : gatherWords(config.getStringArray("words"), in, encoding)) {
				if (debug) Debug.debug(debug, "Resolving "+word);
				try {
					w.write(g2p != null ? g2p.toPhoneme(word) : morph.inflect(word));
					w.write("\n");
				}
				catch (InvalidSymbolException e) {
					Debug.prettyDebug("Invalid input "+word+": "+e.getMessage());
				}
				catch (NoValidTransductionException e) {
					Debug.prettyDebug("No output for "+word+": "+e.getMessage());
				}
			}
			w.flush();
		}
		catch (UnsupportedEncodingException e) {
			System.err.println("Unsupported encoding "+encoding+": "+e.getMessage());
			return 1;
		}
		catch (IOException e) {
			System.err.println("Problem reading or writing words: "+e.getMessage());
			return 1;
		}
		catch (UnusualConditionException e) {
			System.err.println("Unusual condition while transducing: "+e.getMessage());
			return 1;
		}
		Debug.dbtime(1, startTime, "total operation");
		return 0;
	}

	// the words in order; "-" stands for every non-blank line of the input stream
	private static List<String> gatherWords(String[] words, InputStream in, String encoding) throws IOException {
		ArrayList<String> ret = new ArrayList<String>();
		for (String word : words) {
			if (!word.equals("-")) {
				ret.add(word);
				continue;
			}
			BufferedReader br = new BufferedReader(new InputStreamReader(in, encoding));
			String line;
			while ((line = br.readLine()) != null) {
				line = line.trim();
				if (line.length() > 0)
					ret.add(line);
			}
		}
		return ret;
	}

	public static void main(String argv[]) {
		System.exit(run(argv, System.in, System.out));
	}
}
