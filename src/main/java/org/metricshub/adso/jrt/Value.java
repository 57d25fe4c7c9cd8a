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
 * An immutable Adso runtime value: either a 64-bit integer or a boolean.
 */
public final class Value {

	public static final Value TRUE = new Value(ValueType.BOOL, 1L);
	public static final Value FALSE = new Value(ValueType.BOOL, 0L);

	private final ValueType type;
	private final long bits;

	private Value(ValueType type, long bits) {
		this.type = type;
		this.bits = bits;
	}

	public static Value ofInt(long value) {
		return new Value(ValueType.INT, value);
	}

	public static Value ofBool(boolean value) {
		return value ? TRUE : FALSE;
	}

	public ValueType getType() {
		return type;
	}

	public boolean isInt() {
		return type == ValueType.INT;
	}

	public boolean isBool() {
		return type == ValueType.BOOL;
	}

	/**
	 * @return the integer held by this value
	 * @throws IllegalStateException if this is not an integer
	 */
	public long asInt() {
		if (type != ValueType.INT) {
			throw new IllegalStateException("Not an int: " + this);
		}
		return bits;
	}

	/**
	 * @return the boolean held by this value
	 * @throws IllegalStateException if this is not a boolean
	 */
	public boolean asBool() {
		if (type != ValueType.BOOL) {
			throw new IllegalStateException("Not a bool: " + this);
		}
		return bits != 0L;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Value)) {
			return false;
		}
		Value other = (Value) o;
		return type == other.type && bits == other.bits;
	}

	@Override
	public int hashCode() {
		return 31 * type.hashCode() + Long.hashCode(bits);
	}

	@Override
	public String toString() {
		return type == ValueType.INT ? Long.toString(bits) : Boolean.toString(bits != 0L);
	}
}
