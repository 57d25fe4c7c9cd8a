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

/**
 * A function definition: <code>returnType name(paramType paramName) { body }</code>,
 * where the parameter is optional.
 */
public final class FnDef extends AstNode {

	private final String returnType;
	private final String name;
	private final String paramType;
	private final String paramName;
	private final List<Statement> body;

	/**
	 * @param lineNo line of the return type
	 * @param returnType declared return type
	 * @param name name of the function
	 * @param paramType declared parameter type, {@code null} without parameter
	 * @param paramName parameter name, {@code null} without parameter
	 * @param body statements of the function
	 */
	public FnDef(int lineNo, String returnType, String name, String paramType, String paramName, List<Statement> body) {
		super(lineNo);
		if ((paramType == null) != (paramName == null)) {
			throw new IllegalArgumentException("Parameter type and name of " + name + " must be both present or both absent");
		}
		this.returnType = Objects.requireNonNull(returnType, "returnType");
		this.name = Objects.requireNonNull(name, "name");
		this.paramType = paramType;
		this.paramName = paramName;
		this.body = Collections.unmodifiableList(new ArrayList<>(body));
	}

	public String getReturnType() {
		return returnType;
	}

	public String getName() {
		return name;
	}

	public String getParamType() {
		return paramType;
	}

	public String getParamName() {
		return paramName;
	}

	public boolean hasParameter() {
		return paramName != null;
	}

	public List<Statement> getBody() {
		return body;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitFnDef(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof FnDef)) {
			return false;
		}
		FnDef other = (FnDef) o;
		return returnType.equals(other.returnType)
				&& name.equals(other.name)
				&& Objects.equals(paramType, other.paramType)
				&& Objects.equals(paramName, other.paramName)
				&& body.equals(other.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(returnType, name, paramType, paramName, body);
	}

	@Override
	public String toString() {
		return "FnDef(" + returnType + " " + name + "(" + (hasParameter() ? paramType + " " + paramName : "") + ") " + body + ")";
	}
}
