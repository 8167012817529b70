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

import java.util.Collections;
import java.util.List;

/**
 * Node of the syntax tree. The tree is built once by the parser and never
 * modified afterwards; every node belongs to exactly one parent.
 * <p>
 * Backends walk the tree through {@link #accept(StatementVisitor)}, so adding a
 * kind of statement forces every walker to handle it.
 */
public abstract class Statement {

	private final int line;
	private final int column;

	protected Statement(int line, int column) {
		this.line = line;
		this.column = column;
	}

	public final int getLine() {
		return line;
	}

	public final int getColumn() {
		return column;
	}

	/**
	 * @return the statements owned by this node; only the program and
	 *         <code>if</code> own any
	 */
	public List<Statement> getChildren() {
		return Collections.emptyList();
	}

	/**
	 * @return the name of this kind of node, as shown in the structure dump
	 */
	public abstract String getLabel();

	public abstract <R> R accept(StatementVisitor<R> visitor);

	@Override
	public String toString() {
		return getLabel() + "@" + line + ":" + column;
	}
}
