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
 * <code>play source;</code> or <code>play source start end;</code>
 */
public final class PlayStatement extends Statement {

	private final Expression source;
	private final Expression start;
	private final Expression end;

	/**
	 * Play the whole clip.
	 */
	public PlayStatement(Token command, Expression source) {
		this(command, source, null, null);
	}

	/**
	 * Play between two bounds. Both bounds are given, or none.
	 */
	public PlayStatement(Token command, Expression source, Expression start, Expression end) {
		super(command.getLine(), command.getColumn());
		if ((start == null) != (end == null)) {
			throw new IllegalArgumentException("play needs both bounds or none");
		}
		this.source = source;
		this.start = start;
		this.end = end;
	}

	public Expression getSource() {
		return source;
	}

	/**
	 * @return the start bound, or {@code null} for the whole clip
	 */
	public Expression getStart() {
		return start;
	}

	/**
	 * @return the end bound, or {@code null} for the whole clip
	 */
	public Expression getEnd() {
		return end;
	}

	public boolean isBounded() {
		return start != null;
	}

	@Override
	public String getLabel() {
		return "play";
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitPlay(this);
	}
}
