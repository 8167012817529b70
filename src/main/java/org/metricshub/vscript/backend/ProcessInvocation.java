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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * An external program to run: the executable name and its ordered arguments.
 */
public final class ProcessInvocation {

	private static final Pattern NEEDS_QUOTES = Pattern.compile("[\\s'\"]");

	private final String executable;
	private final List<String> arguments;

	public ProcessInvocation(String executable, List<String> arguments) {
		this.executable = Objects.requireNonNull(executable);
		this.arguments = Collections.unmodifiableList(new ArrayList<String>(arguments));
	}

	public String getExecutable() {
		return executable;
	}

	public List<String> getArguments() {
		return arguments;
	}

	/**
	 * @return the executable followed by the arguments, as given to
	 *         {@link ProcessBuilder}
	 */
	public List<String> getCommand() {
		List<String> command = new ArrayList<String>(arguments.size() + 1);
		command.add(executable);
		command.addAll(arguments);
		return command;
	}

	/**
	 * @return the command as one line; arguments with blanks or quotes are
	 *         single-quoted
	 */
	public String getCommandLine() {
		StringBuilder line = new StringBuilder();
		for (String part : getCommand()) {
			if (line.length() > 0) {
				line.append(' ');
			}
			if (part.isEmpty() || NEEDS_QUOTES.matcher(part).find()) {
				line.append('\'').append(part.replace("'", "'\\''")).append('\'');
			} else {
				line.append(part);
			}
		}
		return line.toString();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof ProcessInvocation)) {
			return false;
		}
		ProcessInvocation other = (ProcessInvocation) obj;
		return executable.equals(other.executable) && arguments.equals(other.arguments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(executable, arguments);
	}

	@Override
	public String toString() {
		return getCommandLine();
	}
}
