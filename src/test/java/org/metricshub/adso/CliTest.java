package org.metricshub.adso;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class CliTest {

	@Rule
	public TemporaryFolder tempFolder = new TemporaryFolder();

	private ByteArrayOutputStream out;
	private ByteArrayOutputStream err;

	@Before
	public void setUp() {
		out = new ByteArrayOutputStream();
		err = new ByteArrayOutputStream();
	}

	private String source(String text) throws IOException {
		File file = tempFolder.newFile();
		Files.write(file.toPath(), text.getBytes(StandardCharsets.UTF_8));
		return file.getAbsolutePath();
	}

	private int execute(String... args) {
		return Cli.execute(args, new PrintStream(out, true), new PrintStream(err, true));
	}

	private String out() {
		return new String(out.toByteArray(), StandardCharsets.UTF_8);
	}

	private String err() {
		return new String(err.toByteArray(), StandardCharsets.UTF_8);
	}

	@Test
	public void testRunFile() throws Exception {
		String file = source("int fact(int n){ if(n<1){return 1;} return n*fact(n-1); }\nvoid main(){ print(fact(5)); }\n");
		assertEquals(0, execute(file));
		assertEquals(Collections.singletonList("120"), AdsoTestSupport.lines(out()));
		assertEquals("", err());
	}

	@Test
	public void testNoArgument() {
		assertEquals(1, execute());
		assertTrue(err(), err().contains("Usage:"));
	}

	@Test
	public void testTwoArguments() throws Exception {
		String file = source("void main() { }");
		assertEquals(1, execute(file, file));
		assertTrue(err(), err().contains("Usage:"));
		assertEquals("", out());
	}

	@Test
	public void testUnreadableFile() {
		String missing = new File(tempFolder.getRoot(), "missing.adso").getAbsolutePath();
		assertEquals(1, execute(missing));
		assertTrue(err(), err().startsWith("failed to read " + missing));
	}

	@Test
	public void testParseErrorIsReported() throws Exception {
		String file = source("void main() {\n  print(1)\n}");
		assertEquals(1, execute(file));
		assertTrue(err(), err().startsWith("ParserException (line 3): failed to parse St"));
	}

	@Test
	public void testRuntimeErrorIsReported() throws Exception {
		String file = source("void helper() { print(1); }");
		assertEquals(1, execute(file));
		assertTrue(err(), err().startsWith("UnboundNameException: Unbound name: main"));
		assertEquals("", out());
	}

	@Test
	public void testOutputBeforeErrorIsKept() throws Exception {
		String file = source("void main() { print(4); if (2) { } }");
		assertEquals(1, execute(file));
		assertEquals(Collections.singletonList("4"), AdsoTestSupport.lines(out()));
		assertTrue(err(), err().startsWith("TypeMismatchException (line 1)"));
	}

	@Test
	public void testPretty() throws Exception {
		String file = source("void   main(){print(1);}");
		assertEquals(0, execute("--pretty", file));
		assertEquals("void main() {\n\tprint(1);\n}\n", out());
	}

	@Test
	public void testDumpSyntax() throws Exception {
		String file = source("void main(){print(1);}");
		assertEquals(0, execute(file, "--dump-syntax"));
		assertEquals(
				Arrays.asList("Program", " FnDef void main()", "  FnCallSt", "   FnCall print", "    Number 1"),
				AdsoTestSupport.lines(out()));
	}

	@Test
	public void testMaxDepth() throws Exception {
		String file = source("int r(int n) { return r(n); }\nvoid main() { r(1); }");
		assertEquals(1, execute("--max-depth", "10", file));
		assertTrue(err(), err().startsWith("CallDepthExceededException (line 1): Call depth exceeded 10"));
	}

	@Test
	public void testDeepNestingIsReported() throws Exception {
		StringBuilder terms = new StringBuilder();
		for (int i = 0; i < 200000; i++) {
			terms.append("1-");
		}
		String file = source("void main() { print(" + terms + "1); }");
		assertEquals(1, execute(file));
		assertTrue(err(), err().startsWith("ParserException (line 1): failed to parse Program: nesting too deep"));
		assertEquals("", out());
	}

	@Test
	public void testHelp() {
		assertEquals(0, execute("-h"));
		assertTrue(out(), out().startsWith("Usage:"));
	}

	@Test
	public void testParseOptions() {
		Cli cli = new Cli(new PrintStream(out, true));
		cli.parse(new String[] { "--max-depth", "7", "--pretty", "prog.adso" });
		assertEquals("prog.adso", cli.getSourceFile());
		assertEquals(7, cli.getSettings().getMaxCallDepth());
		assertTrue(cli.isPrettyPrint());
		assertFalse(cli.isDumpSyntaxTree());
	}

	@Test
	public void testInvalidOptions() {
		Cli cli = new Cli(new PrintStream(out, true));
		assertThrows(IllegalArgumentException.class, () -> cli.parse(new String[] { "--bogus", "prog.adso" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "--max-depth" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "--max-depth", "0", "a" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "-h", "a" }));
	}
}
