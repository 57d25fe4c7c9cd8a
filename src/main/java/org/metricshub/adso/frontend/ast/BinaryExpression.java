package org.metricshub.adso.frontend.ast;

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

import java.util.Objects;

/**
 * <code>left op right</code>. The left operand is always a number literal or
 * an identifier; only the right operand may be a compound expression, so
 * that <code>a - b - c</code> reads as <code>a - (b - c)</code>.
 */
public final class BinaryExpression extends Expression {

	private final Expression left;
	private final BinaryOperator operator;
	private final Expression right;

	public BinaryExpression(int lineNo, Expression left, BinaryOperator operator, Expression right) {
		super(lineNo);
		if (!left.isAtom()) {
			throw new IllegalArgumentException("Left operand of " + operator + " must be a number or an identifier: " + left);
		}
		this.left = left;
		this.operator = Objects.requireNonNull(operator, "operator");
		this.right = Objects.requireNonNull(right, "right");
	}

	public Expression getLeft() {
		return left;
	}

	public BinaryOperator getOperator() {
		return operator;
	}

	public Expression getRight() {
		return right;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitBinaryExpression(this);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof BinaryExpression)) {
			return false;
		}
		BinaryExpression other = (BinaryExpression) o;
		return left.equals(other.left) && operator == other.operator && right.equals(other.right);
	}

	@Override
	public int hashCode() {
		return Objects.hash(left, operator, right);
	}

	@Override
	public String toString() {
		return "BinExpr(" + left + " " + operator + " " + right + ")";
	}
}
