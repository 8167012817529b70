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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.vscript.frontend.ast.ProgramStatement;
import org.metricshub.vscript.runtime.Environment;

/**
 * Output of {@link Parser#parse(List)}.
 */
public final class ParseResult {

	private final ProgramStatement program;
	private final Environment environment;
	private final List<ScriptError> errors;
	private final boolean aborted;

	ParseResult(ProgramStatement program, Environment environment, List<ScriptError> errors, boolean aborted) {
		this.program = program;
		this.environment = environment;
		this.errors = Collections.unmodifiableList(new ArrayList<ScriptError>(errors));
		this.aborted = aborted;
	}

	/**
	 * @return the tree; when the parse was aborted, it only holds the
	 *         statements parsed before the failure
	 */
	public ProgramStatement getProgram() {
		return program;
	}

	/**
	 * @return the bindings made by the <code>let</code> statements
	 */
	public Environment getEnvironment() {
		return environment;
	}

	public List<ScriptError> getErrors() {
		return errors;
	}

	public boolean hasErrors() {
		return !errors.isEmpty();
	}

	/**
	 * @return whether a binding error stopped the parse
	 *         (see {@link Parser#Parser(boolean)})
	 */
	public boolean isAborted() {
		return aborted;
	}
}
