package edu.isi.cfgnorm;

import static org.junit.jupiter.api.Assertions.*;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

class PipelineTest {

	@Test
	void nestedPipelinesFlatten() {
		Pipeline p = new Pipeline(
				Pipeline.withoutEpsilonRules(),
				new Pipeline(Pipeline.withoutUnitRules(), new Pipeline()),
				Pipeline.withUsefulSymbols());
		List<Step> steps = p.getSteps();
		assertEquals(4, steps.size());
		assertEquals("[Without Epsilon Rules, Without Unit Rules, With Productive Symbols, With Reachable Symbols]",
				p.toString());
		assertEquals(3, p.getActions().size());
	}

	@Test
	void emptyPipelineIsIdentity() throws Exception {
		CFGRuleSet rs = CFGRuleSet.fromString("S -> aSb | %");
		Pipeline p = new Pipeline(new Pipeline(), new Pipeline());
		assertTrue(p.isEmpty());
		assertSame(rs, p.run(rs));
	}

	@Test
	void addAppends() {
		Pipeline p = new Pipeline().add(Pipeline.withPairRules()).add(Pipeline.withUnitTerminals());
		assertEquals("[With Pair Rules, With Unit Terminals]", p.toString());
	}

	@Test
	void normalFormStepNames() throws Exception {
		TraceCollector trace = new TraceCollector();
		CFGRuleSet.fromString("S -> aSa | b").toChomskyNormalForm(trace);
		assertEquals(Arrays.asList("Without Epsilon Rules", "Without Unit Rules", "With Productive Symbols",
				"With Reachable Symbols", "With Pair Rules", "With Unit Terminals"),
				trace.getStepNames());
	}

	@Test
	void analysesReportedBeforeTheirStep() throws Exception {
		TraceCollector trace = new TraceCollector();
		Pipeline.withoutEpsilonRules().run(CFGRuleSet.fromString("S -> AB ;; A -> % | a ;; B -> b"), trace);
		List<TraceCollector.Entry> entries = trace.getEntries();
		assertEquals(2, entries.size());
		assertFalse(entries.get(0).isStep());
		assertEquals("Nullable Nonterminals", entries.get(0).getName());
		assertEquals("[A]", entries.get(0).getText());
		assertTrue(entries.get(1).isStep());
		assertEquals("S -> A B | B ;;\nA -> a ;;\nB -> b ;;\n", entries.get(1).getText());
	}

	@Test
	void lastStepMatchesResult() throws Exception {
		TraceCollector trace = new TraceCollector();
		CFGRuleSet out = Pipeline.chomskyNormalForm().run(CFGRuleSet.fromString("S -> aSb | ab | %"), trace);
		List<TraceCollector.Entry> entries = trace.getEntries();
		assertEquals(out.toString(), entries.get(entries.size()-1).getText());
	}

	@Test
	void tracingDoesNotChangeResult() throws Exception {
		CFGRuleSet rs = CFGRuleSet.fromString("E -> E+T | T ;; T -> (E) | x");
		assertEquals(rs.toChomskyNormalForm(), rs.toChomskyNormalForm(new TraceCollector()));
	}

	@Test
	void runsAreIndependent() throws Exception {
		TraceCollector first = new TraceCollector();
		TraceCollector second = new TraceCollector();
		CFGRuleSet rs = CFGRuleSet.fromString("S -> A ;; A -> a");
		Pipeline.withoutUnitRules().run(rs, first);
		Pipeline.withReachableSymbols().run(rs, StepListener.NONE);
		Pipeline.withPairRules().run(rs, second);
		assertEquals(Arrays.asList("Without Unit Rules"), first.getStepNames());
		assertEquals(Arrays.asList("With Pair Rules"), second.getStepNames());
	}

	@Test
	void printerWritesStepsAndAnalyses() throws Exception {
		StringWriter sw = new StringWriter();
		Pipeline.withUsefulSymbols().run(CFGRuleSet.fromString("S -> a ;; A -> b"),
				new TracePrinter(new PrintWriter(sw), true));
		String expected =
				"Productive Symbols: [A, S, a, b]\n"+
				"With Productive Symbols\n"+
				"S -> a ;;\nA -> b ;;\n\n"+
				"Reachable Symbols: [S, a]\n"+
				"With Reachable Symbols\n"+
				"S -> a ;;\n\n";
		assertEquals(expected, sw.toString().replace("\r\n", "\n"));
	}

	@Test
	void printerCanSkipAnalyses() throws Exception {
		StringWriter sw = new StringWriter();
		Pipeline.withReachableSymbols().run(CFGRuleSet.fromString("S -> a ;; A -> b"),
				new TracePrinter(new PrintWriter(sw), false));
		assertEquals("With Reachable Symbols\nS -> a ;;\n\n", sw.toString().replace("\r\n", "\n"));
	}

	@Test
	void namedStepNeedsNameAndRewrite() {
		assertThrows(IllegalArgumentException.class, () -> new Pipeline.NamedStep(null, null));
	}
}
