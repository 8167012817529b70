package org.metricshub.vscript.backend;

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

import org.metricshub.vscript.backend.action.MediaAction;
import org.metricshub.vscript.frontend.ast.Statement;

/**
 * The outcome of walking one top-level statement: the realized action, if
 * any, and a short description.
 */
public final class PlanStep {

	private final Statement statement;
	private final MediaAction action;
	private final String description;

	PlanStep(Statement statement, MediaAction action, String description) {
		this.statement = statement;
		this.action = action;
		this.description = description;
	}

	/**
	 * @return the top-level statement this step comes from
	 */
	public Statement getStatement() {
		return statement;
	}

	/**
	 * @return the realized action, or {@code null} for a binding or an
	 *         <code>if</code> whose condition does not hold
	 */
	public MediaAction getAction() {
		return action;
	}

	public boolean hasAction() {
		return action != null;
	}

	public String getDescription() {
		return description;
	}

	@Override
	public String toString() {
		return description;
	}
}
