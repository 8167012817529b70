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

import org.metricshub.vscript.frontend.ErrorKind;
import org.metricshub.vscript.frontend.ScriptError;

/**
 * Raised when an expression cannot be reduced to a value: an identifier
 * without binding, or an operator applied to operands of the wrong kinds.
 * Evaluation stops at the first failure.
 */
public class EvaluationException extends VScriptRuntimeException {

	private static final long serialVersionUID = 1L;

	private final ErrorKind kind;

	public EvaluationException(ErrorKind kind, int lineno, int column, String msg) {
		super(lineno, column, msg);
		this.kind = kind;
	}

	public ErrorKind getKind() {
		return kind;
	}

	/**
	 * @return this failure as a diagnostic record
	 */
	public ScriptError toScriptError() {
		return new ScriptError(getLineNumber(), getColumn(), kind, getMessage());
	}
}
