package org.metricshub.adso.frontend;

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

import org.metricshub.adso.jrt.AdsoRuntimeException;

/**
 * Thrown when the token stream does not match the production being parsed.
 */
public class ParserException extends AdsoRuntimeException {

	private static final long serialVersionUID = 1L;

	private final String context;
	private final String expected;
	private final String found;
	private final int column;

	/**
	 * @param context name of the production being parsed, e.g. <code>FnDef</code>
	 * @param expected what the production required at this point
	 * @param found the offending token
	 */
	public ParserException(String context, String expected, Token found) {
		super(
				found.getLine(),
				"failed to parse " + context + ": expected " + expected + ", found " + found
						+ " at " + found.getLine() + ":" + found.getColumn());
		this.context = context;
		this.expected = expected;
		this.found = found.toString();
		this.column = found.getColumn();
	}

	/**
	 * Reports a construct nested too deeply for the parser to descend into.
	 *
	 * @param context name of the production being parsed
	 * @param line line where parsing stopped
	 * @param column column where parsing stopped
	 * @param cause the error that stopped the descent
	 */
	public ParserException(String context, int line, int column, Throwable cause) {
		super(
				line,
				"failed to parse " + context + ": nesting too deep at " + line + ":" + column,
				cause);
		this.context = context;
		this.expected = null;
		this.found = null;
		this.column = column;
	}

	public String getContext() {
		return context;
	}

	public String getExpected() {
		return expected;
	}

	public String getFound() {
		return found;
	}

	public int getColumn() {
		return column;
	}
}
