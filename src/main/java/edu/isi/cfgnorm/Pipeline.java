package edu.isi.cfgnorm;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Ordered sequence of rewrite steps. A pipeline is itself a step, so pipelines
 * nest; a run flattens the nesting and threads one grammar through every named
 * step in order, reporting each result to the listener.
 */
public class Pipeline implements Step {

	/** the function behind a named step; analyses it runs report to the listener */
	public interface Rewrite {
		CFGRuleSet rewrite(CFGRuleSet rs, StepListener listener);
	}

	/** a leaf step with a printable name */
	public static class NamedStep implements Step {
		private final String name;
		private final Rewrite rewrite;
		public NamedStep(String n, Rewrite r) {
			if (n == null || r == null)
				throw new IllegalArgumentException("named step needs a name and a rewrite");
			name = n;
			rewrite = r;
		}
		public String getName() { return name; }
		public CFGRuleSet apply(CFGRuleSet rs, StepListener listener) {
			CFGRuleSet out = rewrite.rewrite(rs, listener);
			listener.stepDone(name, out);
			return out;
		}
		public String toString() { return name; }
	}

	private final ArrayList<Step> actions;

	public Pipeline(Step... steps) {
		actions = new ArrayList<Step>(Arrays.asList(steps));
	}

	public Pipeline add(Step... steps) {
		actions.addAll(Arrays.asList(steps));
		return this;
	}

	public List<Step> getActions() {
		return Collections.unmodifiableList(actions);
	}

	public boolean isEmpty() {
		return getSteps().isEmpty();
	}

	/** the steps this pipeline runs, nesting removed, in run order */
	public List<Step> getSteps() {
		ArrayList<Step> flat = new ArrayList<Step>();
		flatten(this, flat);
		return flat;
	}

	private static void flatten(Step s, List<Step> flat) {
		if (s instanceof Pipeline) {
			for (Step inner : ((Pipeline)s).actions)
				flatten(inner, flat);
		}
		else {
			flat.add(s);
		}
	}

	public CFGRuleSet run(CFGRuleSet rs) {
		return run(rs, StepListener.NONE);
	}

	public CFGRuleSet run(CFGRuleSet rs, StepListener listener) {
		boolean debug = false;
		CFGRuleSet g = rs;
		for (Step s : getSteps()) {
			if (debug) Debug.debug(debug, "Running "+s);
			g = s.apply(g, listener);
		}
		return g;
	}

	public CFGRuleSet apply(CFGRuleSet rs, StepListener listener) {
		return run(rs, listener);
	}

	public String toString() {
		return getSteps().toString();
	}

	// the standard steps

	public static Pipeline withoutEpsilonRules() {
		return new Pipeline(new NamedStep("Without Epsilon Rules", new Rewrite() {
			public CFGRuleSet rewrite(CFGRuleSet rs, StepListener l) { return rs.withoutEpsilonRules(l); }
		}));
	}

	public static Pipeline withoutUnitRules() {
		return new Pipeline(new NamedStep("Without Unit Rules", new Rewrite() {
			public CFGRuleSet rewrite(CFGRuleSet rs, StepListener l) { return rs.withoutUnitRules(l); }
		}));
	}

	public static Pipeline withProductiveSymbols() {
		return new Pipeline(new NamedStep("With Productive Symbols", new Rewrite() {
			public CFGRuleSet rewrite(CFGRuleSet rs, StepListener l) { return rs.withProductiveSymbols(l); }
		}));
	}

	public static Pipeline withReachableSymbols() {
		return new Pipeline(new NamedStep("With Reachable Symbols", new Rewrite() {
			public CFGRuleSet rewrite(CFGRuleSet rs, StepListener l) { return rs.withReachableSymbols(l); }
		}));
	}

	public static Pipeline withPairRules() {
		return new Pipeline(new NamedStep("With Pair Rules", new Rewrite() {
			public CFGRuleSet rewrite(CFGRuleSet rs, StepListener l) { return rs.withPairRules(); }
		}));
	}

	public static Pipeline withUnitTerminals() {
		return new Pipeline(new NamedStep("With Unit Terminals", new Rewrite() {
			public CFGRuleSet rewrite(CFGRuleSet rs, StepListener l) { return rs.withUnitTerminals(); }
		}));
	}

	// productive before reachable; the other order can leave useless symbols
	public static Pipeline withUsefulSymbols() {
		return new Pipeline(
			withProductiveSymbols(),
			withReachableSymbols());
	}

	/**
	 * The order matters: epsilon removal before unit removal so absorption can't
	 * bring empty alternatives back, useless symbols gone before binarization so
	 * dead rules don't make helpers, and binarization before terminal isolation,
	 * which expects alternatives of length two at most.
	 */
	public static Pipeline chomskyNormalForm() {
		return new Pipeline(
			withoutEpsilonRules(),
			withoutUnitRules(),
			withUsefulSymbols(),
			withPairRules(),
			withUnitTerminals());
	}
}
