package org.metricshub.adso;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Adso
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.io.PrintStream;
import org.metricshub.adso.frontend.ast.Program;
import org.metricshub.adso.jrt.AdsoRuntimeException;
import org.metricshub.adso.util.AdsoSettings;
import org.metricshub.adso.util.ScriptFileSource;

/**
 * Command-line interface for Adso: runs the program of the source file
 * given as the single positional argument.
 */
public final class Cli {

	private final AdsoSettings settings = new AdsoSettings();
	private final PrintStream out;

	private String sourceFile;
	private boolean dumpSyntaxTree;
	private boolean prettyPrint;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard output stream.
	 */
	public Cli() {
		this(System.out);
	}

	/**
	 * Creates a CLI instance using the supplied stream.
	 *
	 * @param out stream where program output is written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out) {
		this.out = out;
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link AdsoSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public AdsoSettings getSettings() {
		return settings;
	}

	public String getSourceFile() {
		return sourceFile;
	}

	public boolean isDumpSyntaxTree() {
		return dumpSyntaxTree;
	}

	public boolean isPrettyPrint() {
		return prettyPrint;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 * @throws IllegalArgumentException if the arguments do not name exactly one source file
	 */
	public void parse(String[] args) {
		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				if (sourceFile != null) {
					throw new IllegalArgumentException("Only one source file is accepted, got " + sourceFile + " and " + arg);
				}
				sourceFile = arg;
			} else if (arg.equals("--dump-syntax")) {
				// --dump-syntax : print the syntax tree instead of running
				dumpSyntaxTree = true;
			} else if (arg.equals("--pretty")) {
				// --pretty : print the canonical source instead of running
				prettyPrint = true;
			} else if (arg.equals("--max-depth")) {
				checkParameterHasArgument(args, argIdx);
				String value = args[++argIdx];
				try {
					settings.setMaxCallDepth(Integer.parseInt(value));
				} catch (NumberFormatException ex) {
					throw new IllegalArgumentException("Invalid call depth: " + value, ex);
				}
			} else if (arg.equals("-h") || arg.equals("-?")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (sourceFile == null) {
			throw new IllegalArgumentException("Source file not provided.");
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws IOException if the source file cannot be read
	 */
	public void run() throws IOException {
		if (printUsage) {
			usage(out);
			return;
		}
		Adso adso = new Adso();
		Program program;
		try {
			program = adso.compile(new ScriptFileSource(sourceFile));
		} catch (IOException ex) {
			throw new IOException("failed to read " + sourceFile + ": " + ex.getMessage(), ex);
		}
		if (dumpSyntaxTree) {
			program.dump(out);
		}
		if (prettyPrint) {
			out.print(program.toSource());
		}
		if (dumpSyntaxTree || prettyPrint) {
			// If only dumping information, no need to run the program
			return;
		}
		adso.invoke(program, settings);
		out.flush();
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest.println("java -jar adso.jar [--dump-syntax] [--pretty] [--max-depth n] source-file");
		dest.println();
		dest.println(" --dump-syntax = Print the syntax tree instead of running the program.");
		dest.println(" --pretty = Print the program in canonical form instead of running it.");
		dest
				.println(
						" --max-depth n = Abort when more than n function calls are nested (default "
								+ AdsoSettings.DEFAULT_MAX_CALL_DEPTH
								+ ").");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses arguments, executes the CLI, and returns the process exit status.
	 * Errors are reported on the error stream.
	 *
	 * @param args command-line arguments
	 * @param out stream for program output
	 * @param err stream for diagnostic messages
	 * @return 0 on success, 1 on any error
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static int execute(String[] args, PrintStream out, PrintStream err) {
		try {
			Cli cli = new Cli(out);
			cli.parse(args);
			cli.run();
			return 0;
		} catch (AdsoRuntimeException e) {
			out.flush();
			if (e.getLineNumber() >= 0) {
				err.printf("%s (line %d): %s\n", e.getClass().getSimpleName(), e.getLineNumber(), e.getMessage());
			} else {
				err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			}
			return 1;
		} catch (IllegalArgumentException e) {
			err.println(e.getMessage());
			usage(err);
			return 1;
		} catch (IOException e) {
			err.println(e.getMessage());
			return 1;
		}
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	public static void main(String[] args) {
		System.exit(execute(args, System.out, System.err));
	}
}
