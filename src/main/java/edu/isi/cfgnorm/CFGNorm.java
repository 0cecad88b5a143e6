package edu.isi.cfgnorm;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.util.Arrays;
import java.util.Date;
import java.util.Iterator;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.FileStringParser;
import com.martiansoftware.jsap.stringparsers.IntegerStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;

import gnu.trove.TIntIntHashMap;

// command line options, etc.
public class CFGNorm {
	// version number. change this when updating cfgnorm!
	static final String VERSION = "1.0";

	// named steps that can be asked for with --steps
	public enum STEP {
		NULL("null"), UNIT("unit"), REACH("reach"), PROD("prod"),
		USELESS("useless"), PAIR("pair"), TERM("term"), CNF("cnf");

		private final String key;
		STEP(String k) { key = k; }
		public String getKey() { return key; }

		private static final String list;
		public static final String getList() { return list;}
		static {
			StringBuffer sb = new StringBuffer();
			for (STEP x: STEP.values()) {
				sb.append(x.key+" ");
			}
			list = sb.toString();
		}
		public static STEP get(String s) throws ConfigureException {
			for (STEP x : STEP.values()) {
				if (x.key.equals(s))
					return x;
			}
			throw new ConfigureException("Invalid step ("+s+"); valid values are "+list);
		}

		public Pipeline getPipeline() {
			switch (this) {
			case NULL: return Pipeline.withoutEpsilonRules();
			case UNIT: return Pipeline.withoutUnitRules();
			case REACH: return Pipeline.withReachableSymbols();
			case PROD: return Pipeline.withProductiveSymbols();
			case USELESS: return Pipeline.withUsefulSymbols();
			case PAIR: return Pipeline.withPairRules();
			case TERM: return Pipeline.withUnitTerminals();
			case CNF: return Pipeline.chomskyNormalForm();
			default: throw new IllegalStateException("no pipeline for "+this);
			}
		}
	}

	// create a summary of a grammar and add it to a buffer
	static void getRuleSetCheck(StringBuffer buffer, String name, CFGRuleSet rs) {
		buffer.append("CFG info for "+name+":\n");
		buffer.append("\t"+rs.getNumStates()+" nonterminals\n");
		buffer.append("\t"+rs.getNumRules()+" rules\n");
		buffer.append("\t"+rs.getNumTerminals()+" unique terminal symbols\n");
		buffer.append("\t"+(rs.isNormal() ? "in" : "not in")+" Chomsky normal form\n");
		// how many alternatives of each length
		TIntIntHashMap lengths = new TIntIntHashMap();
		for (CFGRule r : rs.getRuleList()) {
			int len = r.getRHS().getSize();
			if (lengths.containsKey(len))
				lengths.put(len, lengths.get(len)+1);
			else
				lengths.put(len, 1);
		}
		int[] keys = lengths.keys();
		Arrays.sort(keys);
		buffer.append("\trules by length:");
		for (int k : keys)
			buffer.append(" "+k+":"+lengths.get(k));
		buffer.append("\n");
	}

	// the steps asked for, in the order they will run
	static Pipeline buildPipeline(JSAPResult config) throws ConfigureException {
		Pipeline p = new Pipeline();
		if (config.contains("steps")) {
			for (String s : config.getString("steps").split(",")) {
				String key = s.trim();
				if (key.length() == 0)
					throw new ConfigureException("Empty step name in "+config.getString("steps"));
				p.add(STEP.get(key).getPipeline());
			}
			return p;
		}
		if (config.getBoolean("null"))
			p.add(STEP.NULL.getPipeline());
		if (config.getBoolean("unit"))
			p.add(STEP.UNIT.getPipeline());
		if (config.getBoolean("reach"))
			p.add(STEP.REACH.getPipeline());
		if (config.getBoolean("prod"))
			p.add(STEP.PROD.getPipeline());
		if (config.getBoolean("useless"))
			p.add(STEP.USELESS.getPipeline());
		if (config.getBoolean("cnf"))
			p.add(STEP.CNF.getPipeline());
		return p;
	}

	// everything having to do with the JSAP parameters and config exceptions based on this.
	// Sets the jsap object
	static JSAPResult processParameters(JSAP jsap, String[] argv) throws ConfigureException, JSAPException {

		// HELP OPTION
		Switch helpsw = new Switch("help",
				'h',
				"help",
		"print this help message");
		jsap.registerParameter(helpsw);

		// format of the input (and output data) - assumed utf-8 but can be changed here
		FlaggedOption encodingopt = new FlaggedOption("encoding",
				StringStringParser.getParser(),
				"utf-8",
				true,
				'e',
				"encoding",
				"encoding of input and output files, if other than utf-8. Use the same "+
		"naming you would use if specifying this charset in a java program");
		jsap.registerParameter(encodingopt);

		// OPTIONS REGARDING WHICH REWRITES TO RUN
		// the switches are applied in a fixed order: null, unit, reach, prod, useless, cnf

		Switch prodsw = new Switch("prod",
				'p',
				"prod",
				"eliminate nonproductive nonterminals");
		jsap.registerParameter(prodsw);

		Switch reachsw = new Switch("reach",
				'r',
				"reach",
				"eliminate unreachable symbols");
		jsap.registerParameter(reachsw);

		Switch uselesssw = new Switch("useless",
				'l',
				"useless",
				"eliminate useless symbols (nonproductive first, then unreachable)");
		jsap.registerParameter(uselesssw);

		Switch nullsw = new Switch("null",
				'n',
				"null",
				"eliminate null rules");
		jsap.registerParameter(nullsw);

		Switch unitsw = new Switch("unit",
				'u',
				"unit",
				"eliminate unit rules");
		jsap.registerParameter(unitsw);

		Switch cnfsw = new Switch("cnf",
				'c',
				"cnf",
				"convert to chomsky normal form");
		jsap.registerParameter(cnfsw);

		// explicit sequence of steps. overrides the switches above
		FlaggedOption stepsopt = new FlaggedOption("steps",
				StringStringParser.getParser(),
				null,
				false,
				'x',
				"steps",
				"comma-separated steps to run in the given order, overriding -n -u -r -p -l -c. "+
				"Valid steps are "+STEP.getList());
		jsap.registerParameter(stepsopt);

		// OPTIONS REGARDING OUTPUT

		Switch verbosesw = new Switch("verbose",
				'v',
				"verbose",
				"print the original grammar, the grammar after every step, and every analysis result");
		jsap.registerParameter(verbosesw);

		Switch checksw = new Switch("check",
				JSAP.NO_SHORTFLAG,
				"check",
				"print the number of nonterminals, rules and terminals of the result "+
				"and whether it is in chomsky normal form, instead of the grammar");
		jsap.registerParameter(checksw);

		FlaggedOption timeopt = new FlaggedOption("time",
				IntegerStringParser.getParser(),
				null,
				false,
				't',
				"time",
				"report timing of the stages: 1 for reading and rewriting, 2 to include configuration");
		jsap.registerParameter(timeopt);

		// output file - if specified, the final grammar is written here. otherwise to stdout
		FlaggedOption outfileopt =
			new FlaggedOption("outfile",
					FileStringParser.getParser(),
					null,
					false,
					'o',
					"outputfile",
					"file to write the final grammar or summary. If absent, writing is done "+
			"to stdout");
		jsap.registerParameter(outfileopt);

		UnflaggedOption infileopt = new UnflaggedOption("infile",
				StringStringParser.getParser(),
				null,
				true,
				false,
				"grammar file: records 'LHS -> alt | alt' separated by ';;', '%' for the empty "+
				"alternative. The first record's left side is the start symbol. Use '-' to read STDIN");
		jsap.registerParameter(infileopt);

		JSAPResult config = jsap.parse(argv);
		if (config.success() && config.contains("steps") &&
				(config.getBoolean("null") ||
						config.getBoolean("unit") ||
						config.getBoolean("reach") ||
						config.getBoolean("prod") ||
						config.getBoolean("useless") ||
						config.getBoolean("cnf")))
			throw new ConfigureException("Cannot combine --steps (-x) with -n, -u, -r, -p, -l, or -c");
		return config;
	}

	static BufferedReader openInput(String name, String encoding, InputStream stdin) throws IOException {
		InputStream is;
		if (name.equals("-"))
			is = stdin;
		else {
			File f = new File(name);
			if (!f.exists())
				throw new FileNotFoundException(name);
			is = new FileInputStream(f);
		}
		return new BufferedReader(new InputStreamReader(is, encoding));
	}

	public static void main(String argv[]) {
		System.exit(run(argv, System.in, System.out));
	}

	// the whole program, minus the exit. returns the exit status
	public static int run(String argv[], InputStream stdin, OutputStream stdout) {
		Date startTime = new Date();
		JSAP jsap = new JSAP();
		JSAPResult config = null;
		int timeLevel = -1;
		String encoding = null;
		Pipeline pipeline = null;
		File outfile = null;
		String infile = null;
		PrintWriter out = null;

		// 1) Set up all parameters. Die on bad combinations.
		try {
			config = processParameters(jsap, argv);
			if (config.getBoolean("help")) {
				Debug.prettyDebug("This is cfgnorm, version "+VERSION);
				Debug.prettyDebug("Usage: cfgnorm ");
				Debug.prettyDebug("             "+jsap.getUsage());
				Debug.prettyDebug("");
				Debug.prettyDebug(jsap.getHelp());
				return 0;
			}
			if (!config.success()) {
				for (Iterator errs = config.getErrorMessageIterator(); errs.hasNext();) {
					Debug.prettyDebug("Error: " + errs.next());
				}
				Debug.prettyDebug("Usage: cfgnorm ");
				Debug.prettyDebug("             "+jsap.getUsage());
				return 1;
			}
			encoding = config.getString("encoding");
			Debug.setEncoding(encoding);
			if (config.contains("time"))
				timeLevel = config.getInt("time", -1);
			pipeline = buildPipeline(config);
			outfile = config.getFile("outfile");
			infile = config.getString("infile");
			out = new PrintWriter(new OutputStreamWriter(stdout, encoding));
		}
		catch (JSAPException e) {
			System.err.println("cfgnorm options improperly configured: "+e.getMessage());
			System.err.println("Try 'cfgnorm -h` for a detailed help message");
			return 1;
		}
		catch (ConfigureException e) {
			System.err.println("cfgnorm options improperly configured: "+e.getMessage());
			System.err.println("Try 'cfgnorm -h` for a detailed help message");
			return 1;
		}
		catch (UnsupportedEncodingException e) {
			System.err.println("cfgnorm options improperly configured: unknown encoding "+e.getMessage());
			return 1;
		}
		Date configureParametersTime = new Date();
		Debug.dbtime(timeLevel, 2, startTime, configureParametersTime, "register and configure parameters");

		// 2) Read the grammar
		CFGRuleSet rs = null;
		try {
			Date preReadTime = new Date();
			rs = CFGRuleSet.fromReader(openInput(infile, encoding, stdin));
			Debug.dbtime(timeLevel, 1, preReadTime, new Date(), "read grammar");
		}
		catch (FileNotFoundException e) {
			System.err.println("Input file not found: "+e.getMessage());
			return 1;
		}
		catch (DataFormatException e) {
			System.err.println("Syntax error while reading grammar: "+e.getMessage());
			return 1;
		}
		catch (IOException e) {
			System.err.println("Problem processing input file: "+e.getMessage());
			return 1;
		}

		// 3) Rewrite and write the result
		boolean verbose = config.getBoolean("verbose");
		StepListener listener = StepListener.NONE;
		if (verbose) {
			out.println("Original");
			out.println(rs.toString());
			out.flush();
			listener = new TracePrinter(out, true);
		}
		Date preRewriteTime = new Date();
		CFGRuleSet result = pipeline.run(rs, listener);
		Debug.dbtime(timeLevel, 1, preRewriteTime, new Date(), "ran "+pipeline.getSteps().size()+" steps");

		String text;
		if (config.getBoolean("check")) {
			StringBuffer sb = new StringBuffer();
			getRuleSetCheck(sb, infile, result);
			text = sb.toString();
		}
		else
			text = result.toString();

		try {
			if (outfile != null) {
				OutputStreamWriter w = new OutputStreamWriter(new FileOutputStream(outfile), encoding);
				w.write(text);
				w.close();
			}
			// verbose mode has already shown the final grammar as the last step
			else if (!verbose || pipeline.isEmpty() || config.getBoolean("check")) {
				out.print(text);
				out.flush();
			}
		}
		catch (IOException e) {
			System.err.println("Problem writing output: "+e.getMessage());
			return 1;
		}
		Debug.dbtime(timeLevel, 1, startTime, new Date(), "total");
		return 0;
	}
}
