package org.metricshub.vscript.runtime;

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

import java.util.List;
import org.metricshub.vscript.frontend.ErrorKind;
import org.metricshub.vscript.frontend.Token;
import org.metricshub.vscript.frontend.TokenType;
import org.metricshub.vscript.frontend.ast.Expression;

/**
 * Reduces an expression to a single {@link Value}.
 * <p>
 * The tokens of an expression alternate operands and operators, and are
 * folded from left to right: <code>+</code> and <code>*</code> have the same
 * precedence. The rules are:
 * <ul>
 * <li>string <code>+</code> string: concatenation</li>
 * <li>time <code>+</code> time: sum</li>
 * <li>time <code>*</code> number, number <code>*</code> time: scaled time</li>
 * </ul>
 * Any other combination is a {@link ErrorKind#TYPE_ERROR}.
 */
public final class ExpressionEvaluator {

	private final Environment environment;

	/**
	 * @param environment bindings used to resolve identifiers
	 */
	public ExpressionEvaluator(Environment environment) {
		this.environment = environment;
	}

	/**
	 * @param expression the expression to evaluate
	 * @return its value
	 * @throws EvaluationException on an unbound identifier or on operands of the
	 *         wrong kinds
	 */
	public Value evaluate(Expression expression) {
		return evaluate(expression.getTokens());
	}

	/**
	 * @param tokens operand, then (operator, operand) pairs
	 * @return the folded value
	 * @throws EvaluationException on an unbound identifier or on operands of the
	 *         wrong kinds
	 */
	public Value evaluate(List<Token> tokens) {
		if (tokens.isEmpty()) {
			throw new IllegalArgumentException("Cannot evaluate an empty expression");
		}
		Value result = operand(tokens.get(0));
		for (int i = 1; i < tokens.size(); i += 2) {
			Token op = tokens.get(i);
			if (i + 1 >= tokens.size()) {
				throw new EvaluationException(
						ErrorKind.TYPE_ERROR,
						op.getLine(),
						op.getColumn(),
						"Missing operand after " + op.getText());
			}
			Value rhs = operand(tokens.get(i + 1));
			if (op.is(TokenType.ADD)) {
				result = add(op, result, rhs);
			} else if (op.is(TokenType.MULTIPLY)) {
				result = multiply(op, result, rhs);
			} else {
				throw new EvaluationException(
						ErrorKind.TYPE_ERROR,
						op.getLine(),
						op.getColumn(),
						"Not an operator: " + op.getText());
			}
		}
		return result;
	}

	private Value operand(Token token) {
		switch (token.getType()) {
		case INT:
			return Value.number(Integer.parseInt(token.getText()));
		case STRING:
			return Value.string(token.getText());
		case TIME:
			return Value.time(TimePosition.parse(token.getText()));
		case IDENTIFIER:
			Value value = environment.lookup(token.getText());
			if (value == null) {
				throw new EvaluationException(
						ErrorKind.UNKNOWN_IDENTIFIER,
						token.getLine(),
						token.getColumn(),
						"Unknown identifier: " + token.getText());
			}
			return value;
		default:
			throw new EvaluationException(
					ErrorKind.TYPE_ERROR,
					token.getLine(),
					token.getColumn(),
					"Not a value: " + token.getText());
		}
	}

	private static Value add(Token op, Value lhs, Value rhs) {
		if (lhs.isString() && rhs.isString()) {
			return Value.string(lhs.asString() + rhs.asString());
		}
		if (lhs.isTime() && rhs.isTime()) {
			try {
				return Value.time(lhs.asTime().add(rhs.asTime()));
			} catch (InvalidTimeException e) {
				throw outOfRange(op, e);
			}
		}
		throw new EvaluationException(
				ErrorKind.TYPE_ERROR,
				op.getLine(),
				op.getColumn(),
				"Invalid + operands: " + lhs.getType() + " + " + rhs.getType());
	}

	private static Value multiply(Token op, Value lhs, Value rhs) {
		try {
			if (lhs.isTime() && rhs.isNumber()) {
				return Value.time(lhs.asTime().scale(rhs.asNumber()));
			}
			if (lhs.isNumber() && rhs.isTime()) {
				return Value.time(rhs.asTime().scale(lhs.asNumber()));
			}
		} catch (InvalidTimeException e) {
			throw outOfRange(op, e);
		}
		throw new EvaluationException(
				ErrorKind.TYPE_ERROR,
				op.getLine(),
				op.getColumn(),
				"Multiplication only defined for time * number, got " + lhs.getType() + " * " + rhs.getType());
	}

	private static EvaluationException outOfRange(Token op, InvalidTimeException e) {
		return new EvaluationException(ErrorKind.TYPE_ERROR, op.getLine(), op.getColumn(), e.getMessage());
	}
}
