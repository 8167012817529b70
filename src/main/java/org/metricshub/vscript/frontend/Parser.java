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
import java.util.List;
import org.metricshub.vscript.frontend.ast.AudioStatement;
import org.metricshub.vscript.frontend.ast.ConcatStatement;
import org.metricshub.vscript.frontend.ast.ErrorStatement;
import org.metricshub.vscript.frontend.ast.Expression;
import org.metricshub.vscript.frontend.ast.FrameStatement;
import org.metricshub.vscript.frontend.ast.IfStatement;
import org.metricshub.vscript.frontend.ast.LetStatement;
import org.metricshub.vscript.frontend.ast.PlayStatement;
import org.metricshub.vscript.frontend.ast.ProgramStatement;
import org.metricshub.vscript.frontend.ast.Statement;
import org.metricshub.vscript.runtime.Environment;
import org.metricshub.vscript.runtime.EvaluationException;
import org.metricshub.vscript.runtime.ExpressionEvaluator;
import org.metricshub.vscript.util.VScriptLogger;
import org.slf4j.Logger;

/**
 * Converts the token list of a script into a syntax tree.
 * <p>
 * Grammar:
 *
 * <pre>
 * program    := statement* END
 * statement  := assign | if_stmt | command
 * assign     := LET ID ASSIGN expr SEMI
 * if_stmt    := IF expr EQUALS expr THEN statement
 * command    := 'frame' expr expr TO STRING SEMI
 *             | 'concat' expr expr TO STRING SEMI
 *             | 'audio'  expr expr expr TO STRING SEMI
 *             | 'play' expr SEMI
 *             | 'play' expr expr expr SEMI
 * expr       := primary (( '+' | '*' ) primary)*
 * primary    := '(' expr ')' | INT | STRING | TIME | ID
 * </pre>
 *
 * A grammar error replaces the current statement with an
 * {@link ErrorStatement} and the parser skips to the next statement
 * (panic mode): after the next <code>;</code>, or before the next
 * <code>let</code>, <code>if</code> or command.
 * <p>
 * <code>let</code> statements are evaluated as soon as they are parsed, and
 * the result is bound in the {@link Environment} of this parse. A later
 * statement can therefore use the name, an earlier one cannot.
 */
public class Parser {

	private static final Logger LOGGER = VScriptLogger.getLogger(Parser.class);

	private final boolean abortOnBindingError;

	private List<Token> tokens;
	private int pos;
	private Environment environment;
	private ExpressionEvaluator evaluator;
	private List<ScriptError> errors;

	/**
	 * Creates a parser that reports evaluation errors of <code>let</code>
	 * bindings and keeps parsing.
	 */
	public Parser() {
		this(false);
	}

	/**
	 * @param abortOnBindingError whether an evaluation error raised while
	 *        binding a <code>let</code> stops the parse
	 */
	public Parser(boolean abortOnBindingError) {
		this.abortOnBindingError = abortOnBindingError;
	}

	/**
	 * Parses the specified tokens, which must end with an end-of-program token.
	 *
	 * @param tokenList the output of the lexer
	 * @return the tree, the bindings and the errors of this parse
	 */
	public ParseResult parse(List<Token> tokenList) {
		if (tokenList.isEmpty() || !tokenList.get(tokenList.size() - 1).is(TokenType.END_OF_PROGRAM)) {
			throw new IllegalArgumentException("Token list must end with an end-of-program token");
		}
		tokens = tokenList;
		pos = 0;
		environment = new Environment();
		evaluator = new ExpressionEvaluator(environment);
		errors = new ArrayList<ScriptError>();

		List<Statement> statements = new ArrayList<Statement>();
		boolean aborted = false;
		try {
			while (!check(TokenType.END_OF_PROGRAM)) {
				statements.add(STATEMENT());
			}
		} catch (EvaluationException e) {
			LOGGER.error("Parse aborted by a binding error: {}", e.getMessage());
			errors.add(e.toScriptError());
			aborted = true;
		}

		LOGGER.info("Parse completed with {} statements and {} errors", statements.size(), errors.size());
		return new ParseResult(new ProgramStatement(statements), environment, errors, aborted);
	}

	// PANIC MODE

	private Token current() {
		return tokens.get(pos);
	}

	private boolean check(TokenType type) {
		return current().is(type);
	}

	private Token advance() {
		Token token = current();
		if (pos < tokens.size() - 1) {
			pos++;
		}
		return token;
	}

	private boolean atStatementStart() {
		return check(TokenType.LET) || check(TokenType.IF) || check(TokenType.KEYWORD);
	}

	/**
	 * Skips tokens until a semicolon has been consumed, or until the next
	 * statement (or the end of the program) is reached.
	 */
	private void synchronize() {
		while (!check(TokenType.END_OF_PROGRAM)) {
			if (check(TokenType.SEMICOLON)) {
				advance();
				return;
			}
			if (atStatementStart()) {
				return;
			}
			advance();
		}
	}

	private Token expect(TokenType type) throws ParserException {
		if (check(type)) {
			return advance();
		}
		Token found = current();
		throw parserException(
				found,
				ErrorKind.UNEXPECTED_TOKEN,
				"Expected " + type.name() + ", got " + describe(found));
	}

	private static String describe(Token token) {
		if (token.is(TokenType.END_OF_PROGRAM)) {
			return "end of program";
		}
		return token.getText();
	}

	private static ParserException parserException(Token token, ErrorKind kind, String msg) {
		return new ParserException(new ScriptError(token.getLine(), token.getColumn(), kind, msg));
	}

	// RECURSIVE DESCENT PARSER:
	// CHECKSTYLE.OFF: MethodName

	// STATEMENT : ASSIGN | IF_STATEMENT | COMMAND
	// A failed statement is recorded and replaced by an ErrorStatement
	private Statement STATEMENT() {
		try {
			if (check(TokenType.LET)) {
				return ASSIGN();
			} else if (check(TokenType.IF)) {
				return IF_STATEMENT();
			} else if (check(TokenType.KEYWORD)) {
				return COMMAND();
			}
			throw parserException(current(), ErrorKind.INVALID_STATEMENT, "Expected let, if, or command");
		} catch (ParserException e) {
			LOGGER.debug("Recovering from {}", e.getMessage());
			errors.add(e.getError());
			synchronize();
			return new ErrorStatement(e.getError());
		}
	}

	// ASSIGN : let ID = EXPRESSION ;
	private Statement ASSIGN() throws ParserException {
		Token let = expect(TokenType.LET);
		Token name = expect(TokenType.IDENTIFIER);
		expect(TokenType.ASSIGN);
		Expression expression = EXPRESSION();
		expect(TokenType.SEMICOLON);

		try {
			environment.bind(name.getText(), evaluator.evaluate(expression));
		} catch (EvaluationException e) {
			if (abortOnBindingError) {
				throw e;
			}
			ScriptError error = e.toScriptError();
			errors.add(error);
			return new ErrorStatement(error);
		}
		return new LetStatement(let, name.getText(), expression);
	}

	// IF_STATEMENT : if EXPRESSION == EXPRESSION then STATEMENT
	private Statement IF_STATEMENT() throws ParserException {
		Token ifToken = expect(TokenType.IF);
		Expression left = EXPRESSION();
		expect(TokenType.EQUALS);
		Expression right = EXPRESSION();
		expect(TokenType.THEN);
		return new IfStatement(ifToken, left, right, STATEMENT());
	}

	// COMMAND : frame | concat | audio | play
	private Statement COMMAND() throws ParserException {
		Token command = expect(TokenType.KEYWORD);
		switch (command.getText()) {
		case "frame": {
			Expression source = EXPRESSION();
			Expression frameIndex = EXPRESSION();
			String destination = DESTINATION();
			return new FrameStatement(command, source, frameIndex, destination);
		}
		case "concat": {
			Expression first = EXPRESSION();
			Expression second = EXPRESSION();
			String destination = DESTINATION();
			return new ConcatStatement(command, first, second, destination);
		}
		case "audio": {
			Expression source = EXPRESSION();
			Expression start = EXPRESSION();
			Expression end = EXPRESSION();
			String destination = DESTINATION();
			return new AudioStatement(command, source, start, end, destination);
		}
		case "play": {
			Expression source = EXPRESSION();
			if (check(TokenType.SEMICOLON)) {
				advance();
				return new PlayStatement(command, source);
			}
			Expression start = EXPRESSION();
			Expression end = EXPRESSION();
			expect(TokenType.SEMICOLON);
			return new PlayStatement(command, source, start, end);
		}
		default:
			throw parserException(command, ErrorKind.UNKNOWN_COMMAND, "Unknown command: " + command.getText());
		}
	}

	// DESTINATION : to STRING ;
	private String DESTINATION() throws ParserException {
		expect(TokenType.TO);
		Token destination = expect(TokenType.STRING);
		expect(TokenType.SEMICOLON);
		return destination.getText();
	}

	// EXPRESSION : PRIMARY ( ( + | * ) PRIMARY )*
	private Expression EXPRESSION() throws ParserException {
		List<Token> expressionTokens = new ArrayList<Token>();
		EXPRESSION(expressionTokens);
		return new Expression(expressionTokens);
	}

	private void EXPRESSION(List<Token> expressionTokens) throws ParserException {
		PRIMARY(expressionTokens);
		while (check(TokenType.ADD) || check(TokenType.MULTIPLY)) {
			expressionTokens.add(advance());
			PRIMARY(expressionTokens);
		}
	}

	// PRIMARY : ( EXPRESSION ) | INT | STRING | TIME | ID
	// Parentheses are resolved here and do not reach the evaluator
	private void PRIMARY(List<Token> expressionTokens) throws ParserException {
		if (check(TokenType.OPEN_PAREN)) {
			advance();
			EXPRESSION(expressionTokens);
			expect(TokenType.CLOSE_PAREN);
		} else if (check(TokenType.INT)
				|| check(TokenType.STRING)
				|| check(TokenType.TIME)
				|| check(TokenType.IDENTIFIER)) {
			expressionTokens.add(advance());
		} else {
			throw parserException(
					current(),
					ErrorKind.INVALID_EXPRESSION,
					"Expected number, string, time, or identifier");
		}
	}

	// CHECKSTYLE.ON: MethodName
}
