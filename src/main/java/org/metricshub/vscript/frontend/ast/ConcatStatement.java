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

import org.metricshub.vscript.frontend.Token;

/**
 * <code>concat first second to "destination";</code>
 */
public final class ConcatStatement extends Statement {

	private final Expression first;
	private final Expression second;
	private final String destination;

	public ConcatStatement(Token command, Expression first, Expression second, String destination) {
		super(command.getLine(), command.getColumn());
		this.first = first;
		this.second = second;
		this.destination = destination;
	}

	public Expression getFirst() {
		return first;
	}

	public Expression getSecond() {
		return second;
	}

	public String getDestination() {
		return destination;
	}

	@Override
	public String getLabel() {
		return "concat";
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitConcat(this);
	}
}
