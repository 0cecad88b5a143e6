package edu.isi.cfgnorm;

import java.util.Set;

/**
 * Receives intermediate results of a pipeline run. Passed explicitly to each
 * run, so tracing one run never affects another.
 */
public interface StepListener {

	/** ignores everything */
	StepListener NONE = new StepListener() {
		public void analysisDone(String name, Set<?> result) {}
		public void stepDone(String name, CFGRuleSet result) {}
	};

	/**
	 * Called after a fixpoint analysis has run inside a rewrite operation.
	 * @param name printable name, e.g. "Nullable Nonterminals"
	 * @param result the fixpoint, never null but possibly empty
	 */
	void analysisDone(String name, Set<?> result);

	/**
	 * Called after each named step of a pipeline.
	 * @param name printable step name, e.g. "Without Unit Rules"
	 * @param result the grammar the step produced
	 */
	void stepDone(String name, CFGRuleSet result);
}
