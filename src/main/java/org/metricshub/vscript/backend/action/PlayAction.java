package org.metricshub.vscript.backend.action;

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

import org.metricshub.vscript.frontend.ast.Statement;
import org.metricshub.vscript.runtime.TimePosition;

/**
 * Play a clip, whole or between two positions.
 */
public final class PlayAction extends MediaAction {

	private final String source;
	private final TimePosition start;
	private final TimePosition end;

	public PlayAction(Statement statement, String source, TimePosition start, TimePosition end) {
		super(statement);
		this.source = source;
		this.start = start;
		this.end = end;
	}

	public String getSource() {
		return source;
	}

	/**
	 * @return the start position, or {@code null} to play the whole clip
	 */
	public TimePosition getStart() {
		return start;
	}

	/**
	 * @return the end position, or {@code null} to play the whole clip
	 */
	public TimePosition getEnd() {
		return end;
	}

	public boolean isBounded() {
		return start != null;
	}

	@Override
	public <R> R accept(ActionVisitor<R> visitor) {
		return visitor.visitPlay(this);
	}
}
