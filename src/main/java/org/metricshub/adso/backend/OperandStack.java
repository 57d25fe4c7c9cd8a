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

import java.util.ArrayDeque;
import java.util.Deque;
import org.metricshub.adso.jrt.Value;

/**
 * Operand stack used by the evaluator to hand the value of an expression
 * over to its consumer.
 */
class OperandStack {

	private final Deque<Value> operands = new ArrayDeque<Value>();

	void push(Value value) {
		operands.push(value);
	}

	/**
	 * @return the value on top of the stack, removed from it
	 * @throws IllegalStateException if the stack is empty
	 */
	Value pop() {
		Value value = operands.poll();
		if (value == null) {
			throw new IllegalStateException("Operand stack underflow");
		}
		return value;
	}

	int size() {
		return operands.size();
	}

	void clear() {
		operands.clear();
	}

	@Override
	public String toString() {
		return operands.toString();
	}
}
