package org.metricshub.vscript;

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
import org.metricshub.vscript.frontend.LexResult;
import org.metricshub.vscript.frontend.ParseResult;
import org.metricshub.vscript.frontend.ScriptError;
import org.metricshub.vscript.frontend.Token;
import org.metricshub.vscript.frontend.ast.ProgramStatement;
import org.metricshub.vscript.runtime.Environment;

/**
 * The result of lexing and parsing one script: its tokens, its syntax tree,
 * the bindings made while parsing, and every diagnostic, lexical ones first.
 */
public final class CompiledScript {

	private final String description;
	private final LexResult lexResult;
	private final ParseResult parseResult;
	private final List<ScriptError> errors;

	CompiledScript(String description, LexResult lexResult, ParseResult parseResult) {
		this.description = description;
		this.lexResult = lexResult;
		this.parseResult = parseResult;
		List<ScriptError> all = new ArrayList<ScriptError>(lexResult.getErrors());
		all.addAll(parseResult.getErrors());
		this.errors = Collections.unmodifiableList(all);
	}

	/**
	 * @return where the script comes from
	 */
	public String getDescription() {
		return description;
	}

	public List<Token> getTokens() {
		return lexResult.getTokens();
	}

	public ProgramStatement getProgram() {
		return parseResult.getProgram();
	}

	public Environment getEnvironment() {
		return parseResult.getEnvironment();
	}

	public List<ScriptError> getErrors() {
		return errors;
	}

	public boolean hasErrors() {
		return !errors.isEmpty();
	}

	/**
	 * @return whether parsing stopped at an evaluation error in a binding
	 */
	public boolean isAborted() {
		return parseResult.isAborted();
	}
}
