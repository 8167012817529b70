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

/**
 * A runtime exception thrown by VScript. It is provided
 * to conveniently distinguish between VScript runtime
 * exceptions and other runtime exceptions.
 */
public class VScriptRuntimeException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int lineNumber;
	private final int column;

	/**
	 * <p>
	 * Constructor for VScriptRuntimeException.
	 * </p>
	 *
	 * @param msg a {@link java.lang.String} object
	 */
	public VScriptRuntimeException(String msg) {
		super(msg);
		this.lineNumber = -1;
		this.column = -1;
	}

	public VScriptRuntimeException(String msg, Throwable cause) {
		super(msg, cause);
		this.lineNumber = -1;
		this.column = -1;
	}

	/**
	 * <p>
	 * Constructor for VScriptRuntimeException.
	 * </p>
	 *
	 * @param lineno the offending line
	 * @param column the offending column
	 * @param msg a {@link java.lang.String} object
	 */
	public VScriptRuntimeException(int lineno, int column, String msg) {
		super(msg);
		this.lineNumber = lineno;
		this.column = column;
	}

	/**
	 * Returns the line number associated with this exception or {@code -1} if
	 * unavailable.
	 *
	 * @return the offending line number or {@code -1}
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * Returns the 1-based column associated with this exception or {@code -1}
	 * if unavailable.
	 *
	 * @return the offending column or {@code -1}
	 */
	public int getColumn() {
		return column;
	}
}
