package org.metricshub.vscript.frontend;

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
 * A lexical, syntactic or evaluation error, located in the script.
 */
public final class ScriptError {

	private final int line;
	private final int column;
	private final ErrorKind kind;
	private final String message;

	public ScriptError(int line, int column, ErrorKind kind, String message) {
		this.line = line;
		this.column = column;
		this.kind = Objects.requireNonNull(kind);
		this.message = message;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	public ErrorKind getKind() {
		return kind;
	}

	public String getMessage() {
		return message;
	}

	/**
	 * @return the diagnostic line, <code>Error at line L, col C: Kind - message</code>
	 */
	public String format() {
		return "Error at line " + line + ", col " + column + ": " + kind.getTag() + " - " + message;
	}

	@Override
	public String toString() {
		return format();
	}
}
