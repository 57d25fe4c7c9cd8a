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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.metricshub.adso.jrt.ValueType;

/**
 * The built-in functions every Adso program can call.
 */
public final class Builtins {

	/**
	 * <code>print(int)</code>: writes the decimal value of its argument
	 * on its own line.
	 */
	public static final BuiltinFunction PRINT = new BuiltinFunction(
			"print",
			ValueType.INT,
			(argument, settings) -> {
				settings.getOutputStream().println(argument.asInt());
				return null;
			});

	private Builtins() {}

	/**
	 * Builds the table of built-ins bound in the root scope: the default ones,
	 * then the specified additional ones, which may replace a default
	 * built-in of the same name.
	 *
	 * @param additional built-ins supplied by the caller, may be {@code null}
	 * @return an unmodifiable map of built-ins by name
	 * @throws IllegalArgumentException if two additional built-ins share a name
	 */
	public static Map<String, BuiltinFunction> createTable(Collection<BuiltinFunction> additional) {
		Map<String, BuiltinFunction> table = new LinkedHashMap<String, BuiltinFunction>();
		table.put(PRINT.getName(), PRINT);
		if (additional != null && !additional.isEmpty()) {
			Map<String, BuiltinFunction> supplied = new LinkedHashMap<String, BuiltinFunction>();
			for (BuiltinFunction builtin : additional) {
				if (builtin == null) {
					throw new IllegalArgumentException("Built-in function must not be null");
				}
				BuiltinFunction previous = supplied.putIfAbsent(builtin.getName(), builtin);
				if (previous != null) {
					throw new IllegalArgumentException(
							"Built-in '" + builtin.getName() + "' was provided multiple times");
				}
			}
			table.putAll(supplied);
		}
		return Collections.unmodifiableMap(table);
	}
}
