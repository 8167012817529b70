package org.metricshub.vscript.frontend;

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

/**
 * Categories of the errors reported while scanning, parsing and evaluating
 * a script. The tag is the name shown in the diagnostics.
 */
public enum ErrorKind {
	UNTERMINATED_COMMENT("UnterminatedComment"),
	UNCLOSED_STRING("UnclosedString"),
	EMPTY_STRING("EmptyString"),
	INVALID_TIME("InvalidTime"),
	INVALID_NUMBER("InvalidNumber"),
	INVALID_CHARACTER("InvalidCharacter"),
	UNEXPECTED_TOKEN("UnexpectedToken"),
	INVALID_EXPRESSION("InvalidExpression"),
	INVALID_STATEMENT("InvalidStatement"),
	UNKNOWN_COMMAND("UnknownCommand"),
	UNKNOWN_IDENTIFIER("UnknownIdentifier"),
	TYPE_ERROR("TypeError");

	private final String tag;

	ErrorKind(String tag) {
		this.tag = tag;
	}

	public String getTag() {
		return tag;
	}

	@Override
	public String toString() {
		return tag;
	}
}
