package org.metricshub.vscript.frontend.ast;

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

/**
 * Root of the tree: the top-level statements, in source order.
 */
public final class ProgramStatement extends Statement {

	private final List<Statement> statements;

	public ProgramStatement(List<Statement> statements) {
		super(1, 1);
		this.statements = Collections.unmodifiableList(new ArrayList<Statement>(statements));
	}

	public List<Statement> getStatements() {
		return statements;
	}

	@Override
	public List<Statement> getChildren() {
		return statements;
	}

	@Override
	public String getLabel() {
		return "program";
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitProgram(this);
	}
}
