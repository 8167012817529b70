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
 * Extract the audio track of a clip between two positions.
 */
public final class AudioAction extends MediaAction {

	private final String source;
	private final TimePosition start;
	private final TimePosition end;
	private final String destination;

	public AudioAction(Statement statement, String source, TimePosition start, TimePosition end, String destination) {
		super(statement);
		this.source = source;
		this.start = start;
		this.end = end;
		this.destination = destination;
	}

	public String getSource() {
		return source;
	}

	public TimePosition getStart() {
		return start;
	}

	public TimePosition getEnd() {
		return end;
	}

	public String getDestination() {
		return destination;
	}

	@Override
	public <R> R accept(ActionVisitor<R> visitor) {
		return visitor.visitAudio(this);
	}
}
