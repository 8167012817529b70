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

import org.metricshub.vscript.frontend.ast.AudioStatement;
import org.metricshub.vscript.frontend.ast.ConcatStatement;
import org.metricshub.vscript.frontend.ast.ErrorStatement;
import org.metricshub.vscript.frontend.ast.FrameStatement;
import org.metricshub.vscript.frontend.ast.IfStatement;
import org.metricshub.vscript.frontend.ast.LetStatement;
import org.metricshub.vscript.frontend.ast.PlayStatement;
import org.metricshub.vscript.frontend.ast.ProgramStatement;
import org.metricshub.vscript.frontend.ast.Statement;
import org.metricshub.vscript.frontend.ast.StatementVisitor;

/**
 * Dumps a syntax tree as a Python script building the same tree with
 * <code>anytree</code> nodes, for rendering by an external tool.
 * <p>
 * Nodes are declared in pre-order and named <code>node_0</code>,
 * <code>node_1</code>... Each statement is followed by one node per
 * argument (unevaluated expression text) and destination, then by its
 * nested statements.
 */
public class StructureDumper {

	static final String PREAMBLE = "from anytree import Node\n\n";

	/**
	 * @param program the tree to dump
	 * @return the text of the Python script
	 */
	public String dump(ProgramStatement program) {
		Walker walker = new Walker();
		walker.node(program, null);
		return walker.sb.toString();
	}

	/**
	 * State of one dump: the text produced so far and the next node number.
	 */
	private static final class Walker implements StatementVisitor<Void> {

		private final StringBuilder sb = new StringBuilder(PREAMBLE);
		private int counter;
		private String current;

		private void node(Statement statement, String parent) {
			String id = declare(statement.getLabel(), parent);
			String saved = current;
			current = id;
			statement.accept(this);
			for (Statement child : statement.getChildren()) {
				node(child, id);
			}
			current = saved;
		}

		private String declare(String label, String parent) {
			String id = "node_" + counter++;
			sb.append(id).append(" = Node(").append(PythonLiterals.quote(label));
			if (parent != null) {
				sb.append(", parent=").append(parent);
			}
			sb.append(")\n");
			return id;
		}

		private void field(String name, String text) {
			declare(name + ": " + text, current);
		}

		@Override
		public Void visitProgram(ProgramStatement program) {
			return null;
		}

		@Override
		public Void visitLet(LetStatement let) {
			field("var", let.getName());
			field("expr", let.getExpression().getText());
			return null;
		}

		@Override
		public Void visitIf(IfStatement ifStatement) {
			field("left", ifStatement.getLeft().getText());
			field("right", ifStatement.getRight().getText());
			return null;
		}

		@Override
		public Void visitFrame(FrameStatement frame) {
			field("arg1", frame.getSource().getText());
			field("arg2", frame.getFrameIndex().getText());
			field("dest", frame.getDestination());
			return null;
		}

		@Override
		public Void visitConcat(ConcatStatement concat) {
			field("arg1", concat.getFirst().getText());
			field("arg2", concat.getSecond().getText());
			field("dest", concat.getDestination());
			return null;
		}

		@Override
		public Void visitAudio(AudioStatement audio) {
			field("arg1", audio.getSource().getText());
			field("arg2", audio.getStart().getText());
			field("arg3", audio.getEnd().getText());
			field("dest", audio.getDestination());
			return null;
		}

		@Override
		public Void visitPlay(PlayStatement play) {
			field("arg1", play.getSource().getText());
			if (play.isBounded()) {
				field("arg2", play.getStart().getText());
				field("arg3", play.getEnd().getText());
			}
			return null;
		}

		@Override
		public Void visitError(ErrorStatement error) {
			return null;
		}
	}
}
