package org.metricshub.adso.ext;

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

import java.util.Objects;
import org.metricshub.adso.jrt.Value;
import org.metricshub.adso.jrt.ValueType;
import org.metricshub.adso.util.AdsoSettings;

/**
 * A native function exposed to Adso programs without a definition in
 * the source.
 */
public final class BuiltinFunction {

	/**
	 * Native implementation of a built-in.
	 */
	@FunctionalInterface
	public interface Callback {
		/**
		 * @param argument the argument, already checked against the declared
		 *        parameter type, or {@code null} for a parameterless built-in
		 * @param settings settings of the running invocation
		 * @return the result of the call, or {@code null} if it yields no value
		 */
		Value invoke(Value argument, AdsoSettings settings);
	}

	private final String name;
	private final ValueType parameterType;
	private final Callback callback;

	/**
	 * @param name name under which the built-in is bound in the root scope
	 * @param parameterType required type of the argument, {@code null} if
	 *        the built-in takes no argument
	 * @param callback the native implementation
	 */
	public BuiltinFunction(String name, ValueType parameterType, Callback callback) {
		if (name == null || name.trim().isEmpty()) {
			throw new IllegalArgumentException("Built-in function must declare a non-empty name");
		}
		this.name = name;
		this.parameterType = parameterType;
		this.callback = Objects.requireNonNull(callback, "callback");
	}

	public String getName() {
		return name;
	}

	public ValueType getParameterType() {
		return parameterType;
	}

	public Value invoke(Value argument, AdsoSettings settings) {
		return callback.invoke(argument, settings);
	}

	@Override
	public String toString() {
		return "builtin " + name + "(" + (parameterType == null ? "" : parameterType.getTypeName()) + ")";
	}
}
