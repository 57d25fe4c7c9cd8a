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
 * Thrown when the result of <code>*</code> or <code>-</code> does not fit in
 * a 64-bit integer.
 */
public class ArithmeticOverflowException extends AdsoRuntimeException {

	private static final long serialVersionUID = 1L;

	private final String operator;

	/**
	 * @param lineno line of the binary expression
	 * @param operator symbol of the operation, for instance <code>*</code>
	 * @param left left operand
	 * @param right right operand
	 * @param cause the overflow reported by the JVM
	 */
	public ArithmeticOverflowException(int lineno, String operator, long left, long right, ArithmeticException cause) {
		super(lineno, "BinExpr " + operator + ": integer overflow computing " + left + " " + operator + " " + right, cause);
		this.operator = operator;
	}

	public String getOperator() {
		return operator;
	}
}
