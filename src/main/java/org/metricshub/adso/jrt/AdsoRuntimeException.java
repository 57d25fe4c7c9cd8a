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
 * A runtime exception thrown by Adso. It is provided
 * to conveniently distinguish between Adso runtime
 * exceptions and other runtime exceptions.
 * <p>
 * Every failure of the lexer, the parser and the evaluator
 * is a subclass of this exception. None of them is recoverable.
 */
public class AdsoRuntimeException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int lineNumber;

	/**
	 * <p>
	 * Constructor for AdsoRuntimeException.
	 * </p>
	 *
	 * @param msg a {@link java.lang.String} object
	 */
	public AdsoRuntimeException(String msg) {
		super(msg);
		this.lineNumber = -1;
	}

	public AdsoRuntimeException(String msg, Throwable cause) {
		super(msg, cause);
		this.lineNumber = -1;
	}

	/**
	 * <p>
	 * Constructor for AdsoRuntimeException.
	 * </p>
	 *
	 * @param lineno line of the source the error relates to
	 * @param msg a {@link java.lang.String} object
	 */
	public AdsoRuntimeException(int lineno, String msg) {
		super(msg);
		this.lineNumber = lineno;
	}

	public AdsoRuntimeException(int lineno, String msg, Throwable cause) {
		super(msg, cause);
		this.lineNumber = lineno;
	}

	/**
	 * Returns the line number associated with this exception or {@code -1} if
	 * unavailable.
	 *
	 * @return the offending line number or {@code -1}
	 */
	public int getLineNumber() {
		return lineNumber;
	}
}
