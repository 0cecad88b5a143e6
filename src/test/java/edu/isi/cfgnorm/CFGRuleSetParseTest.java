package edu.isi.cfgnorm;

import static org.junit.jupiter.api.Assertions.*;

import java.io.BufferedReader;
import java.io.File;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CFGRuleSetParseTest {

	private static Symbol sym(String s) {
		return SymbolFactory.getSymbol(s);
	}

	@Test
	void readsRecordsAndAlternatives() throws Exception {
		CFGRuleSet rs = CFGRuleSet.fromString("S -> aSb | % ;; A -> a");
		assertEquals(sym("S"), rs.getStartState());
		assertEquals(2, rs.getNumStates());
		assertEquals(3, rs.getNumRules());
		assertTrue(rs.getRulesOfType(sym("S")).contains(Alternative.getEpsilon()));
		assertTrue(rs.getRulesOfType(sym("S")).contains(Alternative.of(sym("a"), sym("S"), sym("b"))));
		assertEquals(2, rs.getNumTerminals());
	}

	@Test
	void whitespaceInsideAlternativeIsIgnored() throws Exception {
		CFGRuleSet a = CFGRuleSet.fromString("S -> a S b");
		CFGRuleSet b = CFGRuleSet.fromString("S->aSb;;");
		assertEquals(a, b);
	}

	@Test
	void blankAlternativeIsEmpty() throws Exception {
		CFGRuleSet rs = CFGRuleSet.fromString("S -> a |  | b");
		assertTrue(rs.getRulesOfType(sym("S")).contains(Alternative.getEpsilon()));
		assertEquals(3, rs.getNumRules());
	}

	@Test
	void emptyRightSideMeansNoAlternatives() throws Exception {
		CFGRuleSet rs = CFGRuleSet.fromString("S -> A ;; A ->");
		assertTrue(rs.getStates().contains(sym("A")));
		assertTrue(rs.getRulesOfType(sym("A")).isEmpty());
		assertEquals("S -> A ;;\nA -> ;;\n", rs.toString());
	}

	@Test
	void repeatedLeftSideMerges() throws Exception {
		CFGRuleSet rs = CFGRuleSet.fromString("S -> a ;; S -> b ;; S -> a");
		assertEquals(2, rs.getRulesOfType(sym("S")).size());
	}

	@Test
	void canonicalOrder() throws Exception {
		CFGRuleSet rs = CFGRuleSet.fromString("T -> b | % | aT ;; B -> b ;; A -> a");
		assertEquals("T -> % | a T | b ;;\nA -> a ;;\nB -> b ;;\n", rs.toString());
	}

	@Test
	void printingIsStableAcrossInputOrder() throws Exception {
		CFGRuleSet a = CFGRuleSet.fromString("S -> AB | a ;; A -> a ;; B -> b");
		CFGRuleSet b = CFGRuleSet.fromString("S -> a | AB ;; B -> b ;; A -> a");
		assertEquals(a.toString(), b.toString());
		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
	}

	@Test
	void printedFormReadsBack() throws Exception {
		CFGRuleSet rs = CFGRuleSet.fromString("S -> aSb | % | AB ;; A -> a | ;; B -> Bb | b");
		assertEquals(rs, CFGRuleSet.fromString(rs.toString()));
	}

	@Test
	void startSymbolAddedWhenMissing() {
		Symbol s = sym("S");
		CFGRuleSet rs = new CFGRuleSet(new java.util.HashMap<Symbol, java.util.Set<Alternative>>(), s);
		assertEquals(1, rs.getNumStates());
		assertEquals(0, rs.getNumRules());
		assertEquals("S -> ;;\n", rs.toString());
	}

	@Test
	void recordWithoutArrowFails() {
		DataFormatException e = assertThrows(DataFormatException.class,
				() -> CFGRuleSet.fromString("S -> a ;; A = b"));
		assertEquals("Record 1 <<< A = b >>> contains no \"->\"", e.getMessage());
		assertEquals(1, e.getRecord());
	}

	@Test
	void emptyLeftSideFails() {
		assertThrows(DataFormatException.class, () -> CFGRuleSet.fromString(" -> a"));
	}

	@Test
	void multiSymbolLeftSideFails() {
		assertThrows(DataFormatException.class, () -> CFGRuleSet.fromString("A B -> a"));
	}

	@Test
	void noRecordsFails() {
		DataFormatException e = assertThrows(DataFormatException.class, () -> CFGRuleSet.fromString(""));
		assertEquals(-1, e.getRecord());
		assertThrows(DataFormatException.class, () -> CFGRuleSet.fromString(" ;; ;;\n"));
	}

	@Test
	void readsAcrossLines() throws Exception {
		String text = "S -> a S\n  | b ;;\n";
		CFGRuleSet rs = CFGRuleSet.fromReader(new BufferedReader(new StringReader(text)));
		assertEquals("S -> a S | b ;;\n", rs.toString());
	}

	@Test
	void readsFileInGivenEncoding(@TempDir File dir) throws Exception {
		File f = new File(dir, "g.cfg");
		Files.write(f.toPath(), "S -> \u00e9S | \u00e8".getBytes(StandardCharsets.ISO_8859_1));
		CFGRuleSet rs = CFGRuleSet.fromFile(f.getPath(), "iso-8859-1");
		assertEquals("S -> \u00e8 | \u00e9 S ;;\n", rs.toString());
	}

	@Test
	void printWritesCanonicalText() throws Exception {
		CFGRuleSet rs = CFGRuleSet.fromString("S -> ab");
		StringWriter w = new StringWriter();
		rs.print(w);
		assertEquals(rs.toString(), w.toString());
	}

	@Test
	void ruleListFollowsPrintingOrder() throws Exception {
		CFGRuleSet rs = CFGRuleSet.fromString("S -> b | a ;; A -> c");
		assertEquals("[S -> a, S -> b, A -> c]", rs.getRuleList().toString());
	}
}
