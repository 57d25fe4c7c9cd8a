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

import java.util.List;

/**
 * Renders a syntax tree back to Adso source code, with one statement per
 * line and tab indentation. Parsing the rendering yields an equal tree.
 */
public class SourcePrinter implements AstVisitor<Void> {

	private final StringBuilder out = new StringBuilder();
	private int depth;

	/**
	 * @param node root of the tree to render
	 * @return the source code
	 */
	public String print(AstNode node) {
		out.setLength(0);
		depth = 0;
		node.accept(this);
		return out.toString();
	}

	private void indent() {
		for (int i = 0; i < depth; i++) {
			out.append('\t');
		}
	}

	private void block(List<Statement> body) {
		out.append("{\n");
		depth++;
		for (Statement statement : body) {
			statement.accept(this);
		}
		depth--;
		indent();
		out.append('}');
	}

	@Override
	public Void visitProgram(Program program) {
		boolean first = true;
		for (FnDef fnDef : program.getFunctions()) {
			if (!first) {
				out.append('\n');
			}
			fnDef.accept(this);
			first = false;
		}
		return null;
	}

	@Override
	public Void visitFnDef(FnDef fnDef) {
		indent();
		out.append(fnDef.getReturnType()).append(' ').append(fnDef.getName()).append('(');
		if (fnDef.hasParameter()) {
			out.append(fnDef.getParamType()).append(' ').append(fnDef.getParamName());
		}
		out.append(") ");
		block(fnDef.getBody());
		out.append('\n');
		return null;
	}

	@Override
	public Void visitIfStatement(IfStatement statement) {
		indent();
		out.append("if (");
		statement.getCondition().accept(this);
		out.append(") ");
		block(statement.getBody());
		out.append('\n');
		return null;
	}

	@Override
	public Void visitReturnStatement(ReturnStatement statement) {
		indent();
		out.append("return ");
		statement.getValue().accept(this);
		out.append(";\n");
		return null;
	}

	@Override
	public Void visitFnCallStatement(FnCallStatement statement) {
		indent();
		statement.getCall().accept(this);
		out.append(";\n");
		return null;
	}

	@Override
	public Void visitNumberLiteral(NumberLiteral literal) {
		out.append(literal.getValue());
		return null;
	}

	@Override
	public Void visitIdentifier(Identifier identifier) {
		out.append(identifier.getName());
		return null;
	}

	@Override
	public Void visitFnCall(FnCall call) {
		out.append(call.getName()).append('(');
		if (call.hasArg()) {
			call.getArg().accept(this);
		}
		out.append(')');
		return null;
	}

	@Override
	public Void visitBinaryExpression(BinaryExpression expression) {
		expression.getLeft().accept(this);
		out.append(' ').append(expression.getOperator().getSymbol()).append(' ');
		expression.getRight().accept(this);
		return null;
	}
}
