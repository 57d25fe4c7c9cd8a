package org.metricshub.adso.jrt;

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
 * Thrown when the nesting of function activations exceeds the configured
 * limit, typically because of unbounded recursion.
 */
public class CallDepthExceededException extends AdsoRuntimeException {

	private static final long serialVersionUID = 1L;

	private final int maxDepth;

	public CallDepthExceededException(int lineno, String function, int maxDepth) {
		super(lineno, "Call depth exceeded " + maxDepth + " while calling " + function);
		this.maxDepth = maxDepth;
	}

	/**
	 * Reports a Java stack exhausted before the configured limit was reached.
	 */
	public CallDepthExceededException(String function, int maxDepth, Throwable cause) {
		super(-1, "Stack exhausted before reaching call depth " + maxDepth + " in " + function, cause);
		this.maxDepth = maxDepth;
	}

	public int getMaxDepth() {
		return maxDepth;
	}
}
