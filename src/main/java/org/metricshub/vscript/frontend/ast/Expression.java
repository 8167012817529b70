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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.vscript.frontend.Token;

/**
 * The raw, not yet evaluated tokens of one expression. Parentheses are
 * already resolved by the parser: the tokens alternate operands and
 * operators, and are folded strictly left to right.
 */
public final class Expression {

	private final List<Token> tokens;

	public Expression(List<Token> tokens) {
		if (tokens.isEmpty()) {
			throw new IllegalArgumentException("An expression needs at least one token");
		}
		this.tokens = Collections.unmodifiableList(new ArrayList<Token>(tokens));
	}

	public List<Token> getTokens() {
		return tokens;
	}

	public Token getFirstToken() {
		return tokens.get(0);
	}

	/**
	 * @return the token texts, separated by single spaces
	 */
	public String getText() {
		StringBuilder text = new StringBuilder();
		for (Token token : tokens) {
			if (text.length() > 0) {
				text.append(' ');
			}
			text.append(token.getText());
		}
		return text.toString();
	}

	@Override
	public String toString() {
		return getText();
	}
}
