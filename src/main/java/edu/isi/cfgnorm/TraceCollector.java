package edu.isi.cfgnorm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

// keeps the serialized form of every step (and analysis) of a run, in order
public class TraceCollector implements StepListener {

	public static class Entry {
		private final String name;
		private final String text;
		private final boolean isStep;
		Entry(String n, String t, boolean s) { name = n; text = t; isStep = s; }
		public String getName() { return name; }
		public String getText() { return text; }
		public boolean isStep() { return isStep; }
		public String toString() { return name+": "+text; }
	}

	private final ArrayList<Entry> entries = new ArrayList<Entry>();

	public void analysisDone(String name, Set<?> result) {
		entries.add(new Entry(name, formatSet(result), false));
	}

	public void stepDone(String name, CFGRuleSet result) {
		entries.add(new Entry(name, result.toString(), true));
	}

	public List<Entry> getEntries() {
		return Collections.unmodifiableList(entries);
	}

	// just the named steps, in run order
	public List<String> getStepNames() {
		ArrayList<String> names = new ArrayList<String>();
		for (Entry e : entries) {
			if (e.isStep())
				names.add(e.getName());
		}
		return names;
	}

	// sorted by printed form so traces are stable between runs
	static String formatSet(Set<?> set) {
		TreeSet<String> sorted = new TreeSet<String>();
		for (Object o : set)
			sorted.add(o.toString());
		return sorted.toString();
	}
}
