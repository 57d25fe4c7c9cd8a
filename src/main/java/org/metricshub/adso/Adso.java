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
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import org.metricshub.adso.backend.AdsoInterpreter;
import org.metricshub.adso.backend.Evaluator;
import org.metricshub.adso.ext.BuiltinFunction;
import org.metricshub.adso.ext.Builtins;
import org.metricshub.adso.frontend.AdsoParser;
import org.metricshub.adso.frontend.Lexer;
import org.metricshub.adso.frontend.ast.Program;
import org.metricshub.adso.util.AdsoLogger;
import org.metricshub.adso.util.AdsoSettings;
import org.metricshub.adso.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Entry point into the parsing and execution of an Adso program.
 * This entry point is used both when Adso is executed as a library and when
 * invoked from the command line.
 * <p>
 * The overall process to execute an Adso program is as follows:
 * <ul>
 * <li>Lex and parse the source text, producing an abstract syntax tree.
 * <li>Bind every function definition of the tree in the root scope of a
 * fresh {@link Evaluator}, then call the <code>main</code> function.
 * </ul>
 * Each invocation uses its own evaluator, so that independent executions
 * share no state. The only effect of a program is the output of the
 * <code>print</code> built-in, written to {@link AdsoSettings#getOutputStream()}.
 * <p>
 * Additional built-in functions can be provided through the constructors.
 *
 * @see org.metricshub.adso.backend.Evaluator
 */
public class Adso {

	private static final Logger LOG = AdsoLogger.getLogger(Adso.class);

	private final Map<String, BuiltinFunction> builtins;

	/**
	 * The last program produced by {@link #compile(ScriptSource)}.
	 */
	private Program lastProgram;

	/**
	 * Create a new instance of Adso with the default built-ins only.
	 */
	public Adso() {
		this(Collections.<BuiltinFunction>emptyList());
	}

	/**
	 * Create a new instance of Adso with additional built-in functions.
	 *
	 * @param builtins built-ins bound next to the default ones
	 */
	public Adso(Collection<BuiltinFunction> builtins) {
		this.builtins = Builtins.createTable(builtins);
	}

	/**
	 * Create a new instance of Adso with additional built-in functions.
	 *
	 * @param builtins built-ins bound next to the default ones
	 */
	public Adso(BuiltinFunction... builtins) {
		this(Arrays.asList(builtins));
	}

	/**
	 * Returns the last program produced by {@link #compile(ScriptSource)} or
	 * {@link #compile(String)}.
	 *
	 * @return the last {@link Program}, or {@code null} if nothing was compiled
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public Program getLastProgram() {
		return lastProgram;
	}

	/**
	 * Parses the specified source.
	 *
	 * @param source source of the program
	 * @return the syntax tree of the program
	 * @throws IOException if the source cannot be read
	 * @throws org.metricshub.adso.frontend.LexerException on an invalid character
	 * @throws org.metricshub.adso.frontend.ParserException on a syntax error
	 */
	public Program compile(ScriptSource source) throws IOException {
		Program program = compile(source.readText());
		LOG.debug("Parsed {} function definitions from {}", program.getFunctions().size(), source.getDescription());
		return program;
	}

	/**
	 * Parses the specified program text.
	 *
	 * @param script text of the program
	 * @return the syntax tree of the program
	 */
	public Program compile(String script) {
		lastProgram = new AdsoParser(new Lexer(script.trim())).parse();
		return lastProgram;
	}

	/**
	 * Runs a parsed program.
	 *
	 * @param program the program to run
	 * @param settings output stream and limits of the execution
	 */
	public void invoke(Program program, AdsoSettings settings) {
		AdsoInterpreter interpreter = new Evaluator(settings, builtins);
		interpreter.interpret(program);
	}

	/**
	 * Parses and runs the specified source.
	 *
	 * @param source source of the program
	 * @param settings output stream and limits of the execution
	 * @throws IOException if the source cannot be read
	 */
	public void invoke(ScriptSource source, AdsoSettings settings) throws IOException {
		invoke(compile(source), settings);
	}

	/**
	 * Parses and runs the specified program text.
	 *
	 * @param script text of the program
	 * @param settings output stream and limits of the execution
	 */
	public void invoke(String script, AdsoSettings settings) {
		invoke(compile(script), settings);
	}

	/**
	 * Runs the specified program and returns what it printed.
	 *
	 * @param script text of the program
	 * @return the output of the program
	 */
	public String run(String script) {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		run(script, out);
		try {
			return out.toString(StandardCharsets.UTF_8.name());
		} catch (UnsupportedEncodingException e) {
			throw new IllegalStateException(e);
		}
	}

	/**
	 * Runs the specified program, writing what it prints to the specified stream.
	 *
	 * @param script text of the program
	 * @param output destination of the output
	 */
	public void run(String script, OutputStream output) {
		AdsoSettings settings = new AdsoSettings();
		PrintStream printStream;
		try {
			printStream = new PrintStream(output, true, StandardCharsets.UTF_8.name());
		} catch (UnsupportedEncodingException e) {
			throw new IllegalStateException(e);
		}
		settings.setOutputStream(printStream);
		invoke(script, settings);
		printStream.flush();
	}
}
