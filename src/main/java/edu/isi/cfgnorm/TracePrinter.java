package edu.isi.cfgnorm;

import java.io.PrintWriter;
import java.util.Set;

// verbose mode of the command line: title and grammar after every named step,
// and the analysis sets as they are computed
public class TracePrinter implements StepListener {
	private final PrintWriter w;
	private final boolean showAnalyses;

	public TracePrinter(PrintWriter writer, boolean analyses) {
		w = writer;
		showAnalyses = analyses;
	}

	public void analysisDone(String name, Set<?> result) {
		if (!showAnalyses)
			return;
		w.println(name+": "+TraceCollector.formatSet(result));
		w.flush();
	}

	public void stepDone(String name, CFGRuleSet result) {
		w.println(name);
		w.println(result.toString());
		w.flush();
	}
}
