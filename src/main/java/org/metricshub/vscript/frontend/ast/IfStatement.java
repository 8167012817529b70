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

import java.util.Collections;
import java.util.List;
import org.metricshub.vscript.frontend.Token;

/**
 * <code>if left == right then statement</code>
 * <p>
 * The guards are kept unevaluated; they are evaluated each time the node is
 * walked. There is no else branch.
 */
public final class IfStatement extends Statement {

	private final Expression left;
	private final Expression right;
	private final Statement thenStatement;

	public IfStatement(Token ifToken, Expression left, Expression right, Statement thenStatement) {
		super(ifToken.getLine(), ifToken.getColumn());
		this.left = left;
		this.right = right;
		this.thenStatement = thenStatement;
	}

	public Expression getLeft() {
		return left;
	}

	public Expression getRight() {
		return right;
	}

	public Statement getThenStatement() {
		return thenStatement;
	}

	@Override
	public List<Statement> getChildren() {
		return Collections.singletonList(thenStatement);
	}

	@Override
	public String getLabel() {
		return "if";
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitIf(this);
	}
}
