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

/**
 * Root of the tree: the function definitions of a source, in declaration order.
 */
public final class Program extends AstNode {

	private final List<FnDef> functions;

	public Program(List<FnDef> functions) {
		super(functions.isEmpty() ? -1 : functions.get(0).getLineNo());
		this.functions = Collections.unmodifiableList(new ArrayList<>(functions));
	}

	public List<FnDef> getFunctions() {
		return functions;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitProgram(this);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Program && functions.equals(((Program) o).functions);
	}

	@Override
	public int hashCode() {
		return functions.hashCode();
	}

	@Override
	public String toString() {
		return "Program" + functions;
	}
}
