package org.metricshub.vscript.runtime;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * VScript
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

/**
 * A value of the language: a number, a string or a time position.
 * There is no implicit conversion between the three kinds.
 */
public final class Value {

	/** The kinds of value. */
	public enum Type {
		NUMBER,
		STRING,
		TIME
	}

	private final Type type;
	private final int number;
	private final String string;
	private final TimePosition time;

	private Value(Type type, int number, String string, TimePosition time) {
		this.type = type;
		this.number = number;
		this.string = string;
		this.time = time;
	}

	public static Value number(int n) {
		return new Value(Type.NUMBER, n, null, null);
	}

	public static Value string(String s) {
		return new Value(Type.STRING, 0, Objects.requireNonNull(s), null);
	}

	public static Value time(TimePosition t) {
		return new Value(Type.TIME, 0, null, Objects.requireNonNull(t));
	}

	public Type getType() {
		return type;
	}

	public boolean isNumber() {
		return type == Type.NUMBER;
	}

	public boolean isString() {
		return type == Type.STRING;
	}

	public boolean isTime() {
		return type == Type.TIME;
	}

	/**
	 * @return the number held by this value
	 * @throws IllegalStateException if this value is not a number
	 */
	public int asNumber() {
		checkType(Type.NUMBER);
		return number;
	}

	/**
	 * @return the string held by this value
	 * @throws IllegalStateException if this value is not a string
	 */
	public String asString() {
		checkType(Type.STRING);
		return string;
	}

	/**
	 * @return the time position held by this value
	 * @throws IllegalStateException if this value is not a time position
	 */
	public TimePosition asTime() {
		checkType(Type.TIME);
		return time;
	}

	private void checkType(Type expected) {
		if (type != expected) {
			throw new IllegalStateException("Value is a " + type + ", not a " + expected);
		}
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Value)) {
			return false;
		}
		Value other = (Value) obj;
		return type == other.type
				&& number == other.number
				&& Objects.equals(string, other.string)
				&& Objects.equals(time, other.time);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, number, string, time);
	}

	@Override
	public String toString() {
		switch (type) {
		case NUMBER:
			return Integer.toString(number);
		case STRING:
			return string;
		default:
			return time.toString();
		}
	}
}
