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

import java.io.PrintStream;

/**
 * Base class of all syntax tree nodes. Nodes are immutable once the parser
 * has built them.
 * <p>
 * The source line is kept for diagnostics only: it takes no part in
 * {@link #equals(Object)}, so that two trees parsed from differently laid
 * out sources compare equal when their structure is the same.
 */
public abstract class AstNode {

	private final int lineNo;

	protected AstNode(int lineNo) {
		this.lineNo = lineNo;
	}

	/**
	 * @return the line of the source where this node starts, or -1 if the node
	 *         was not produced by the parser
	 */
	public int getLineNo() {
		return lineNo;
	}

	public abstract <R> R accept(AstVisitor<R> visitor);

	/**
	 * Prints an indented representation of this tree.
	 *
	 * @param ps destination stream
	 */
	public void dump(PrintStream ps) {
		ps.print(new AstDumper().dump(this));
	}

	/**
	 * @return this tree rendered as Adso source code
	 */
	public String toSource() {
		return new SourcePrinter().print(this);
	}
}
