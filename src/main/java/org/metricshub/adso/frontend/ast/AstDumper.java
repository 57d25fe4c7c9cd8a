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
 * Renders a syntax tree one node per line, children indented by one space
 * per level below their parent.
 */
public class AstDumper implements AstVisitor<Void> {

	private final StringBuilder out = new StringBuilder();
	private int lvl;

	/**
	 * @param node root of the tree to render
	 * @return the rendering, one line per node
	 */
	public String dump(AstNode node) {
		out.setLength(0);
		lvl = 0;
		node.accept(this);
		return out.toString();
	}

	private void line(String text) {
		for (int i = 0; i < lvl; i++) {
			out.append(' ');
		}
		out.append(text).append('\n');
	}

	private void children(List<? extends AstNode> nodes) {
		lvl++;
		for (AstNode node : nodes) {
			node.accept(this);
		}
		lvl--;
	}

	private void child(AstNode node) {
		lvl++;
		node.accept(this);
		lvl--;
	}

	@Override
	public Void visitProgram(Program program) {
		line("Program");
		children(program.getFunctions());
		return null;
	}

	@Override
	public Void visitFnDef(FnDef fnDef) {
		String param = fnDef.hasParameter() ? fnDef.getParamType() + " " + fnDef.getParamName() : "";
		line("FnDef " + fnDef.getReturnType() + " " + fnDef.getName() + "(" + param + ")");
		children(fnDef.getBody());
		return null;
	}

	@Override
	public Void visitIfStatement(IfStatement statement) {
		line("IfSt");
		child(statement.getCondition());
		children(statement.getBody());
		return null;
	}

	@Override
	public Void visitReturnStatement(ReturnStatement statement) {
		line("ReturnSt");
		child(statement.getValue());
		return null;
	}

	@Override
	public Void visitFnCallStatement(FnCallStatement statement) {
		line("FnCallSt");
		child(statement.getCall());
		return null;
	}

	@Override
	public Void visitNumberLiteral(NumberLiteral literal) {
		line("Number " + literal.getValue());
		return null;
	}

	@Override
	public Void visitIdentifier(Identifier identifier) {
		line("Ident " + identifier.getName());
		return null;
	}

	@Override
	public Void visitFnCall(FnCall call) {
		line("FnCall " + call.getName());
		if (call.hasArg()) {
			child(call.getArg());
		}
		return null;
	}

	@Override
	public Void visitBinaryExpression(BinaryExpression expression) {
		line("BinExpr " + expression.getOperator());
		child(expression.getLeft());
		child(expression.getRight());
		return null;
	}
}
