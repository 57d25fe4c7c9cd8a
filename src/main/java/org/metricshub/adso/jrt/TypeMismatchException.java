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
 * Thrown when an operand of <code>if</code>, <code>*</code>, <code>-</code>,
 * <code>&lt;</code> has the wrong kind of value, or when a name used as an
 * operand does not resolve to a value.
 */
public class TypeMismatchException extends AdsoRuntimeException {

	private static final long serialVersionUID = 1L;

	private final String context;
	private final String expected;
	private final String actual;

	public TypeMismatchException(int lineno, String context, String expected, String actual) {
		super(lineno, context + ": expected " + expected + ", got " + actual);
		this.context = context;
		this.expected = expected;
		this.actual = actual;
	}

	/**
	 * @return the construct that was being evaluated, for instance <code>IfSt</code>
	 */
	public String getContext() {
		return context;
	}

	public String getExpected() {
		return expected;
	}

	public String getActual() {
		return actual;
	}
}
