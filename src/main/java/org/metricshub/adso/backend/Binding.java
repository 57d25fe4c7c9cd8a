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

import java.util.Objects;
import org.metricshub.adso.ext.BuiltinFunction;
import org.metricshub.adso.frontend.ast.FnDef;
import org.metricshub.adso.jrt.Value;

/**
 * What a name is bound to in a scope: a value, a user function or a
 * built-in function.
 */
public final class Binding {

	/** Kinds of bindings. */
	public enum Kind {
		VALUE,
		FUNCTION,
		BUILTIN
	}

	private final Kind kind;
	private final Object target;

	private Binding(Kind kind, Object target) {
		this.kind = kind;
		this.target = Objects.requireNonNull(target);
	}

	public static Binding of(Value value) {
		return new Binding(Kind.VALUE, value);
	}

	public static Binding of(FnDef function) {
		return new Binding(Kind.FUNCTION, function);
	}

	public static Binding of(BuiltinFunction builtin) {
		return new Binding(Kind.BUILTIN, builtin);
	}

	public Kind getKind() {
		return kind;
	}

	public boolean isCallable() {
		return kind != Kind.VALUE;
	}

	public Value getValue() {
		return (Value) target;
	}

	public FnDef getFunction() {
		return (FnDef) target;
	}

	public BuiltinFunction getBuiltin() {
		return (BuiltinFunction) target;
	}

	/**
	 * @return the type of the bound value, or <code>function</code> for a callable
	 */
	public String describeType() {
		return kind == Kind.VALUE ? getValue().getType().getTypeName() : "function";
	}

	@Override
	public String toString() {
		return kind + "(" + target + ")";
	}
}
