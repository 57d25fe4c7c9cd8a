package org.metricshub.adso.jrt;

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

/**
 * Thrown when the argument of a call does not match the parameter the
 * callee declares: an argument is missing, unexpected, or of another type.
 * <p>
 * {@code expected} and {@code actual} are type names, or <code>none</code>
 * when no parameter or no argument is present.
 */
public class ArityOrTypeException extends AdsoRuntimeException {

	private static final long serialVersionUID = 1L;

	/** Stands for an absent parameter or argument. */
	public static final String NONE = "none";

	private final String expected;
	private final String actual;

	public ArityOrTypeException(int lineno, String function, String expected, String actual) {
		super(lineno, "Call to " + function + ": expected " + expected + " argument, got " + actual);
		this.expected = expected;
		this.actual = actual;
	}

	public String getExpected() {
		return expected;
	}

	public String getActual() {
		return actual;
	}
}
