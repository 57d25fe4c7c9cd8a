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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** <code>if (condition) { body }</code>, without else branch. */
public final class IfStatement extends Statement {

	private final Expression condition;
	private final List<Statement> body;

	public IfStatement(int lineNo, Expression condition, List<Statement> body) {
		super(lineNo);
		this.condition = Objects.requireNonNull(condition, "condition");
		this.body = Collections.unmodifiableList(new ArrayList<>(body));
	}

	public Expression getCondition() {
		return condition;
	}

	public List<Statement> getBody() {
		return body;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitIfStatement(this);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof IfStatement)) {
			return false;
		}
		IfStatement other = (IfStatement) o;
		return condition.equals(other.condition) && body.equals(other.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, body);
	}

	@Override
	public String toString() {
		return "IfSt(" + condition + ", " + body + ")";
	}
}
