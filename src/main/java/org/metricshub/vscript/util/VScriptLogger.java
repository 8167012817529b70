package org.metricshub.vscript.util;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out the SLF4J loggers of the compiler and formats script positions
 * for log messages.
 * <p>
 * SLF4J is kept quiet about its own initialization: the CLI writes its
 * diagnostics and command lines to the same console.
 */
public final class VScriptLogger {
	static {
		System.setProperty("slf4j.internal.verbosity", "WARN");
	}

	private VScriptLogger() {}

	/**
	 * @param clazz class the logger is named after
	 * @return the SLF4J logger of <code>clazz</code>
	 */
	public static Logger getLogger(Class<?> clazz) {
		return LoggerFactory.getLogger(clazz);
	}

	/**
	 * Script position as a log argument. The text is only built if the
	 * message is actually logged.
	 *
	 * @param line 1-based line
	 * @param column 1-based column
	 * @return an object rendering as <code>line L, col C</code>
	 */
	public static Object at(final int line, final int column) {
		return new Object() {
			@Override
			public String toString() {
				return "line " + line + ", col " + column;
			}
		};
	}
}
