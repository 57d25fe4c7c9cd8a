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

/** A call evaluated for its side effects: <code>f(x);</code> */
public final class FnCallStatement extends Statement {

	private final FnCall call;

	public FnCallStatement(FnCall call) {
		super(call.getLineNo());
		this.call = Objects.requireNonNull(call, "call");
	}

	public FnCall getCall() {
		return call;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitFnCallStatement(this);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof FnCallStatement && call.equals(((FnCallStatement) o).call);
	}

	@Override
	public int hashCode() {
		return call.hashCode();
	}

	@Override
	public String toString() {
		return "FnCallSt(" + call + ")";
	}
}
