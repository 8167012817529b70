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
 * <code>frame source index to "destination";</code>
 */
public final class FrameStatement extends Statement {

	private final Expression source;
	private final Expression frameIndex;
	private final String destination;

	public FrameStatement(Token command, Expression source, Expression frameIndex, String destination) {
		super(command.getLine(), command.getColumn());
		this.source = source;
		this.frameIndex = frameIndex;
		this.destination = destination;
	}

	public Expression getSource() {
		return source;
	}

	public Expression getFrameIndex() {
		return frameIndex;
	}

	public String getDestination() {
		return destination;
	}

	@Override
	public String getLabel() {
		return "frame";
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitFrame(this);
	}
}
