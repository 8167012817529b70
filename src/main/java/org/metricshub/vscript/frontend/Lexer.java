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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.vscript.runtime.InvalidTimeException;
import org.metricshub.vscript.runtime.TimePosition;
import org.metricshub.vscript.util.VScriptLogger;
import org.slf4j.Logger;

/**
 * Converts the text of a script into a flat list of located tokens.
 * <p>
 * The scan never stops on an error: every lexical error is recorded
 * and the scan goes on, so that all of them can be reported at once.
 * A lexer instance holds the scan state and is meant for one call
 * to {@link #tokenize(String)} at a time.
 */
public class Lexer {

	private static final Logger LOGGER = VScriptLogger.getLogger(Lexer.class);

	/**
	 * Contains a mapping of the reserved words to their token values.
	 * Any other word is an identifier.
	 */
	private static final Map<String, TokenType> KEYWORDS = new HashMap<String, TokenType>();

	static {
		KEYWORDS.put("let", TokenType.LET);
		KEYWORDS.put("if", TokenType.IF);
		KEYWORDS.put("then", TokenType.THEN);
		KEYWORDS.put("to", TokenType.TO);
		KEYWORDS.put("print", TokenType.PRINT);

		// commands
		KEYWORDS.put("frame", TokenType.KEYWORD);
		KEYWORDS.put("concat", TokenType.KEYWORD);
		KEYWORDS.put("audio", TokenType.KEYWORD);
		KEYWORDS.put("play", TokenType.KEYWORD);
	}

	private String source;
	private int pos;
	private int line;
	private int column;
	private List<Token> tokens;
	private List<ScriptError> errors;

	/**
	 * Scans the specified script.
	 *
	 * @param text the script
	 * @return the tokens, terminated by an end-of-program token, and the
	 *         lexical errors
	 */
	public LexResult tokenize(String text) {
		source = text;
		pos = 0;
		line = 1;
		column = 1;
		tokens = new ArrayList<Token>();
		errors = new ArrayList<ScriptError>();

		while (pos < source.length()) {
			char c = source.charAt(pos);
			if (Character.isWhitespace(c)) {
				read();
			} else if (c == '#') {
				skipComment();
			} else if (isAsciiLetter(c)) {
				readWord();
			} else if (c == '"') {
				readQuoted();
			} else if (isAsciiDigit(c)) {
				readInteger();
			} else {
				readOperator(c);
			}
		}
		tokens.add(new Token(TokenType.END_OF_PROGRAM, "", line, column));

		if (LOGGER.isDebugEnabled()) {
			for (Token token : tokens) {
				LOGGER.debug("{} [{}] found at {}", token.getType(), token.getText(), VScriptLogger.at(token.getLine(), token.getColumn()));
			}
		}
		LOGGER.info("Scan completed with {} tokens and {} errors", tokens.size(), errors.size());

		return new LexResult(tokens, errors);
	}

	/**
	 * Consumes the current character, keeping the line and column up to date.
	 *
	 * @return the consumed character
	 */
	private char read() {
		char c = source.charAt(pos++);
		if (c == '\n') {
			line++;
			column = 1;
		} else {
			column++;
		}
		return c;
	}

	private boolean peek(int offset, char expected) {
		int index = pos + offset;
		return index < source.length() && source.charAt(index) == expected;
	}

	private void error(int errLine, int errColumn, ErrorKind kind, String message) {
		errors.add(new ScriptError(errLine, errColumn, kind, message));
	}

	// # line comment, ## block comment ##
	private void skipComment() {
		int startLine = line;
		int startColumn = column;
		read();
		if (peek(0, '#')) {
			read();
			while (pos < source.length()) {
				if (peek(0, '#') && peek(1, '#')) {
					read();
					read();
					return;
				}
				read();
			}
			error(startLine, startColumn, ErrorKind.UNTERMINATED_COMMENT, "Unterminated multi-line comment");
		} else {
			while (pos < source.length() && source.charAt(pos) != '\n') {
				read();
			}
		}
	}

	private void readWord() {
		int startColumn = column;
		StringBuilder word = new StringBuilder();
		while (pos < source.length() && isAsciiLetterOrDigit(source.charAt(pos))) {
			word.append(read());
		}
		String text = word.toString();
		TokenType type = KEYWORDS.get(text);
		tokens.add(new Token(type == null ? TokenType.IDENTIFIER : type, text, line, startColumn));
	}

	private void readQuoted() {
		int startLine = line;
		int startColumn = column;
		read();
		StringBuilder content = new StringBuilder();
		while (pos < source.length() && source.charAt(pos) != '"') {
			content.append(read());
		}
		if (pos >= source.length()) {
			error(startLine, startColumn, ErrorKind.UNCLOSED_STRING, "Unclosed string literal");
			return;
		}
		read();

		String text = content.toString();
		if (text.indexOf(':') >= 0) {
			try {
				TimePosition.parse(text);
				tokens.add(new Token(TokenType.TIME, text, startLine, startColumn));
			} catch (InvalidTimeException e) {
				error(startLine, startColumn, ErrorKind.INVALID_TIME, "Invalid time format: " + text);
			}
		} else if (text.isEmpty()) {
			error(startLine, startColumn, ErrorKind.EMPTY_STRING, "Empty string literal");
		} else {
			tokens.add(new Token(TokenType.STRING, text, startLine, startColumn));
		}
	}

	private void readInteger() {
		int startColumn = column;
		StringBuilder digits = new StringBuilder();
		while (pos < source.length() && isAsciiDigit(source.charAt(pos))) {
			digits.append(read());
		}
		String text = digits.toString();
		try {
			Integer.parseInt(text);
			tokens.add(new Token(TokenType.INT, text, line, startColumn));
		} catch (NumberFormatException e) {
			error(line, startColumn, ErrorKind.INVALID_NUMBER, "Integer literal out of range: " + text);
		}
	}

	private void readOperator(char c) {
		int startColumn = column;
		switch (c) {
		case '=':
			if (peek(1, '=')) {
				read();
				read();
				tokens.add(new Token(TokenType.EQUALS, "==", line, startColumn));
			} else {
				read();
				tokens.add(new Token(TokenType.ASSIGN, "=", line, startColumn));
			}
			return;
		case '+':
			single(TokenType.ADD, startColumn);
			return;
		case '*':
			single(TokenType.MULTIPLY, startColumn);
			return;
		case '(':
			single(TokenType.OPEN_PAREN, startColumn);
			return;
		case ')':
			single(TokenType.CLOSE_PAREN, startColumn);
			return;
		case ';':
			single(TokenType.SEMICOLON, startColumn);
			return;
		case '$':
			single(TokenType.END_OF_PROGRAM, startColumn);
			return;
		default:
			read();
			error(line, startColumn, ErrorKind.INVALID_CHARACTER, "Unexpected character: " + c);
		}
	}

	private void single(TokenType type, int startColumn) {
		char c = read();
		tokens.add(new Token(type, String.valueOf(c), line, startColumn));
	}

	private static boolean isAsciiLetter(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}

	private static boolean isAsciiDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isAsciiLetterOrDigit(char c) {
		return isAsciiLetter(c) || isAsciiDigit(c);
	}
}
