package edu.isi.cfgnorm;

/** a rewrite from one grammar to a new one. Must not change its input */
public interface Step {
	CFGRuleSet apply(CFGRuleSet rs, StepListener listener);
}
