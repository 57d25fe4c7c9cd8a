package org.metricshub.adso.backend;

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

import org.metricshub.adso.jrt.Value;

/**
 * Outcome of executing statements: either they ran to their end, or a
 * <code>return</code> statement ended the enclosing function with a value.
 */
final class Completion {

	static final Completion NORMAL = new Completion(null);

	private final Value returnValue;

	private Completion(Value returnValue) {
		this.returnValue = returnValue;
	}

	static Completion returned(Value value) {
		return new Completion(value);
	}

	boolean isReturn() {
		return returnValue != null;
	}

	Value getReturnValue() {
		return returnValue;
	}
}
