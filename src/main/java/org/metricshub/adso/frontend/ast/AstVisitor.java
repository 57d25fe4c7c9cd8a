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

/**
 * Visitor over the closed set of Adso syntax tree nodes.
 *
 * @param <R> result type of the visit
 */
public interface AstVisitor<R> {
	R visitProgram(Program program);

	R visitFnDef(FnDef fnDef);

	R visitIfStatement(IfStatement statement);

	R visitReturnStatement(ReturnStatement statement);

	R visitFnCallStatement(FnCallStatement statement);

	R visitNumberLiteral(NumberLiteral literal);

	R visitIdentifier(Identifier identifier);

	R visitFnCall(FnCall call);

	R visitBinaryExpression(BinaryExpression expression);
}
