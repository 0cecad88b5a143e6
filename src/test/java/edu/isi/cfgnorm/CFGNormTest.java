package edu.isi.cfgnorm;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CFGNormTest {

	@TempDir
	File tmp;

	private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();

	private static InputStream stdin(String text) {
		return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
	}

	private String output() {
		return new String(stdout.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
	}

	private File write(String name, String text) throws Exception {
		File f = new File(tmp, name);
		Files.write(f.toPath(), text.getBytes(StandardCharsets.UTF_8));
		return f;
	}

	@Test
	void normalFormFromStdin() {
		int status = CFGNorm.run(new String[] {"-c", "-"}, stdin("S -> aSa | b"), stdout);
		assertEquals(0, status);
		assertEquals("S -> a# S_0:1 | b ;;\nS_0:1 -> S a# ;;\na# -> a ;;\nb# -> b ;;\n", output());
	}

	@Test
	void noStepsEchoesCanonicalGrammar() {
		assertEquals(0, CFGNorm.run(new String[] {"-"}, stdin("B -> b ;; S -> B | a"), stdout));
		assertEquals("B -> b ;;\nS -> B | a ;;\n", output());
	}

	@Test
	void switchesRunInFixedOrder() {
		// -u given before -n still runs after it, so the unit rule left by -n goes too
		assertEquals(0, CFGNorm.run(new String[] {"-u", "-n", "-"}, stdin("S -> AB ;; A -> % ;; B -> b"), stdout));
		assertEquals("S -> A B | b ;;\nA -> ;;\nB -> b ;;\n", output());
	}

	@Test
	void explicitStepsRunInGivenOrder() {
		assertEquals(0, CFGNorm.run(new String[] {"-x", "unit,pair", "-"}, stdin("S -> A ;; A -> abc"), stdout));
		assertEquals("S -> a S_0:1 ;;\nA -> a A_0:1 ;;\nA_0:1 -> b c ;;\nS_0:1 -> b c ;;\n", output());
	}

	@Test
	void unknownStepFails() {
		assertEquals(1, CFGNorm.run(new String[] {"-x", "bogus", "-"}, stdin("S -> a"), stdout));
		assertEquals("", output());
	}

	@Test
	void stepsCannotBeCombinedWithSwitches() {
		assertEquals(1, CFGNorm.run(new String[] {"-x", "null", "-n", "-"}, stdin("S -> a"), stdout));
	}

	@Test
	void malformedFileFails() throws Exception {
		File f = write("bad.cfg", "S -> a ;; A = b");
		assertEquals(1, CFGNorm.run(new String[] {"-c", f.getPath()}, stdin(""), stdout));
		assertEquals("", output());
	}

	@Test
	void missingFileFails() {
		File f = new File(tmp, "nothere.cfg");
		assertEquals(1, CFGNorm.run(new String[] {"-c", f.getPath()}, stdin(""), stdout));
	}

	@Test
	void writesToOutputFile() throws Exception {
		File in = write("g.cfg", "S -> aSb | %");
		File out = new File(tmp, "g.cnf");
		assertEquals(0, CFGNorm.run(new String[] {"-n", "-o", out.getPath(), in.getPath()}, stdin(""), stdout));
		assertEquals("", output());
		String text = new String(Files.readAllBytes(out.toPath()), StandardCharsets.UTF_8);
		assertEquals("S' -> % | S ;;\nS -> a S b | a b ;;\n", text);
	}

	@Test
	void checkSummarizesResult() {
		assertEquals(0, CFGNorm.run(new String[] {"--check", "-c", "-"}, stdin("S -> aSa | b"), stdout));
		String text = output();
		assertTrue(text.startsWith("CFG info for -:\n"), text);
		assertTrue(text.contains("\t4 nonterminals\n"), text);
		assertTrue(text.contains("\t5 rules\n"), text);
		assertTrue(text.contains("\tin Chomsky normal form\n"), text);
		assertTrue(text.contains("\trules by length: 1:3 2:2\n"), text);
	}

	@Test
	void verboseShowsEveryStepOnce() {
		assertEquals(0, CFGNorm.run(new String[] {"-v", "-n", "-"}, stdin("S -> aSb | %"), stdout));
		String expected =
				"Original\n"+
				"S -> % | a S b ;;\n\n"+
				"Nullable Nonterminals: [S]\n"+
				"Without Epsilon Rules\n"+
				"S' -> % | S ;;\nS -> a S b | a b ;;\n\n";
		assertEquals(expected, output());
	}

	@Test
	void helpExitsCleanly() {
		assertEquals(0, CFGNorm.run(new String[] {"-h", "-"}, stdin(""), stdout));
		assertEquals("", output());
	}

	@Test
	void stepKeys() throws Exception {
		assertEquals(CFGNorm.STEP.USELESS, CFGNorm.STEP.get("useless"));
		assertEquals("null unit reach prod useless pair term cnf ", CFGNorm.STEP.getList());
		assertThrows(ConfigureException.class, () -> CFGNorm.STEP.get("CNF"));
		assertEquals(6, CFGNorm.STEP.CNF.getPipeline().getSteps().size());
	}
}
