package org.metricshub.adso;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.metricshub.adso.ext.BuiltinFunction;
import org.metricshub.adso.util.AdsoSettings;

/**
 * Reusable helpers for building and executing Adso tests. The fluent
 * builder returned by {@link #adsoTest(String)} lets tests describe a program,
 * the built-ins and settings it runs with, and the expected output or error
 * before executing it.
 */
public final class AdsoTestSupport {

	private AdsoTestSupport() {}

	/**
	 * Creates a builder for a test that runs a program through the {@link Adso} API.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static AdsoTestBuilder adsoTest(String description) {
		return new AdsoTestBuilder(description);
	}

	/**
	 * Splits output into lines, ignoring the trailing line separator and
	 * normalising Windows line endings.
	 */
	static List<String> lines(String output) {
		String normalized = output.replace("\r\n", "\n");
		if (normalized.isEmpty()) {
			return Collections.emptyList();
		}
		if (normalized.endsWith("\n")) {
			normalized = normalized.substring(0, normalized.length() - 1);
		}
		return Arrays.asList(normalized.split("\n", -1));
	}

	/**
	 * Captures the outcome of executing a configured test.
	 */
	public static final class TestResult {
		private final String description;
		private final String output;
		private final Throwable thrownException;
		private final List<String> expectedLines;
		private final Class<? extends Throwable> expectedException;

		TestResult(
				String description,
				String output,
				Throwable thrownException,
				List<String> expectedLines,
				Class<? extends Throwable> expectedException) {
			this.description = description;
			this.output = output;
			this.thrownException = thrownException;
			this.expectedLines = expectedLines;
			this.expectedException = expectedException;
		}

		public String output() {
			return output;
		}

		public List<String> lines() {
			return AdsoTestSupport.lines(output);
		}

		public Throwable thrownException() {
			return thrownException;
		}

		/**
		 * Asserts the captured output and exception against the expectations of
		 * the builder.
		 */
		public void assertExpected() {
			if (expectedException != null) {
				assertNotNull(description + ": expected " + expectedException.getSimpleName(), thrownException);
				assertTrue(
						description + ": expected " + expectedException.getSimpleName() + " but got " + thrownException,
						expectedException.isInstance(thrownException));
			} else if (thrownException != null) {
				throw new AssertionError(description + ": unexpected exception", thrownException);
			}
			if (expectedLines != null) {
				assertEquals(description, expectedLines, lines());
			}
		}
	}

	/**
	 * Builder of a test running an Adso program.
	 */
	public static final class AdsoTestBuilder {
		private final String description;
		private String script;
		private final List<BuiltinFunction> builtins = new ArrayList<>();
		private final AdsoSettings settings = new AdsoSettings();
		private List<String> expectedLines;
		private Class<? extends Throwable> expectedException;

		AdsoTestBuilder(String description) {
			this.description = description;
		}

		public AdsoTestBuilder script(String text) {
			this.script = text;
			return this;
		}

		public AdsoTestBuilder builtin(BuiltinFunction builtin) {
			builtins.add(builtin);
			return this;
		}

		public AdsoTestBuilder maxCallDepth(int depth) {
			settings.setMaxCallDepth(depth);
			return this;
		}

		/**
		 * Expects the program to print exactly the specified lines.
		 */
		public AdsoTestBuilder expectLines(String... lines) {
			this.expectedLines = Arrays.asList(lines);
			return this;
		}

		/**
		 * Expects the program to fail with the specified exception.
		 */
		public AdsoTestBuilder expectThrow(Class<? extends Throwable> exception) {
			this.expectedException = exception;
			return this;
		}

		public ConfiguredTest build() {
			if (script == null) {
				fail(description + ": no script configured");
			}
			return new ConfiguredTest(this);
		}
	}

	/**
	 * A fully configured test case.
	 */
	public static final class ConfiguredTest {
		private final AdsoTestBuilder builder;

		ConfiguredTest(AdsoTestBuilder builder) {
			this.builder = builder;
		}

		/**
		 * Executes the program and captures its output and the exception it
		 * raised, if any, without asserting them.
		 *
		 * @return the captured result
		 */
		public TestResult run() {
			ByteArrayOutputStream out = new ByteArrayOutputStream();
			builder.settings.setOutputStream(new PrintStream(out, true));
			Throwable thrown = null;
			try {
				new Adso(builder.builtins).invoke(builder.script, builder.settings);
			} catch (RuntimeException e) {
				thrown = e;
			}
			return new TestResult(
					builder.description,
					new String(out.toByteArray(), StandardCharsets.UTF_8),
					thrown,
					builder.expectedLines,
					builder.expectedException);
		}

		/**
		 * Executes the program and asserts the configured expectations.
		 *
		 * @return the captured result, for further assertions
		 */
		public TestResult runAndAssert() {
			TestResult result = run();
			result.assertExpected();
			return result;
		}
	}
}
