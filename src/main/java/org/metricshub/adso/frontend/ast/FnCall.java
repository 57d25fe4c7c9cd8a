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

/** <code>name(arg)</code>, where the argument is optional. */
public final class FnCall extends Expression {

	private final String name;
	private final Expression arg;

	/**
	 * @param lineNo line of the function name
	 * @param name called function
	 * @param arg argument expression, {@code null} for <code>name()</code>
	 */
	public FnCall(int lineNo, String name, Expression arg) {
		super(lineNo);
		this.name = Objects.requireNonNull(name, "name");
		this.arg = arg;
	}

	public String getName() {
		return name;
	}

	public Expression getArg() {
		return arg;
	}

	public boolean hasArg() {
		return arg != null;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitFnCall(this);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof FnCall)) {
			return false;
		}
		FnCall other = (FnCall) o;
		return name.equals(other.name) && Objects.equals(arg, other.arg);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, arg);
	}

	@Override
	public String toString() {
		return "FnCall(" + name + ", " + arg + ")";
	}
}
