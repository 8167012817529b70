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

import java.io.IOException;
import java.io.Reader;

/**
 * Represents one VScript content source.
 * This is either a string given on the command line (or embedded by a caller),
 * or a script file given as a path with a "-f" command line switch.
 */
public class ScriptSource {

	/** Constant <code>DESCRIPTION_COMMAND_LINE_SCRIPT="&lt;command-line-supplied-script&gt;"</code> */
	public static final String DESCRIPTION_COMMAND_LINE_SCRIPT = "<command-line-supplied-script>";

	private static final int BUFFER_SIZE = 4096;

	private final String description;
	private final Reader reader;

	/**
	 * <p>
	 * Constructor for ScriptSource.
	 * </p>
	 *
	 * @param description a {@link java.lang.String} object
	 * @param reader a {@link java.io.Reader} object
	 */
	public ScriptSource(String description, Reader reader) {
		this.description = description;
		this.reader = reader;
	}

	/**
	 * <p>
	 * Getter for the field <code>description</code>.
	 * </p>
	 *
	 * @return a {@link java.lang.String} object
	 */
	public final String getDescription() {
		return description;
	}

	/**
	 * Obtain the {@link Reader} serving the script contents.
	 *
	 * @return The reader which contains the script contents.
	 * @throws java.io.IOException if any.
	 */
	public Reader getReader() throws IOException {
		return reader;
	}

	/**
	 * Reads the whole script. The lexer works on the complete text, so the
	 * reader is drained and closed.
	 *
	 * @return the script text
	 * @throws IOException if the underlying reader fails
	 */
	public String readFully() throws IOException {
		StringBuilder text = new StringBuilder();
		char[] buffer = new char[BUFFER_SIZE];
		try (Reader r = getReader()) {
			int count;
			while ((count = r.read(buffer)) >= 0) {
				text.append(buffer, 0, count);
			}
		}
		return text.toString();
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return getDescription();
	}
}
