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
import java.util.List;
import org.metricshub.vscript.backend.action.AudioAction;
import org.metricshub.vscript.backend.action.ConcatAction;
import org.metricshub.vscript.backend.action.FrameAction;
import org.metricshub.vscript.backend.action.PlayAction;
import org.metricshub.vscript.frontend.ErrorKind;
import org.metricshub.vscript.frontend.Token;
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
import org.metricshub.vscript.frontend.ast.StatementVisitor;
import org.metricshub.vscript.runtime.Environment;
import org.metricshub.vscript.runtime.EvaluationException;
import org.metricshub.vscript.runtime.ExpressionEvaluator;
import org.metricshub.vscript.runtime.TimePosition;
import org.metricshub.vscript.runtime.Value;
import org.metricshub.vscript.util.VScriptLogger;
import org.slf4j.Logger;

/**
 * Walks a program and evaluates the arguments of its commands against the
 * bindings of the parse, producing an {@link ExecutionPlan}.
 * <p>
 * An <code>if</code> realizes its statement only when both guards are time
 * positions with the same number of seconds; otherwise it realizes nothing.
 * An evaluation error aborts the walk with an {@link EvaluationException}.
 */
public class ActionPlanner {

	private static final Logger LOGGER = VScriptLogger.getLogger(ActionPlanner.class);

	private final ExpressionEvaluator evaluator;

	/**
	 * @param environment the bindings produced while parsing the program
	 */
	public ActionPlanner(Environment environment) {
		this.evaluator = new ExpressionEvaluator(environment);
	}

	/**
	 * @param program a program parsed without errors
	 * @return one step per top-level statement
	 * @throws EvaluationException if an argument cannot be evaluated or has the
	 *         wrong kind
	 * @throws IllegalStateException if the program contains an error statement
	 */
	public ExecutionPlan plan(ProgramStatement program) {
		StepBuilder builder = new StepBuilder();
		List<PlanStep> steps = new ArrayList<PlanStep>();
		for (Statement statement : program.getStatements()) {
			steps.add(statement.accept(builder));
		}
		LOGGER.info("Planned {} statements", steps.size());
		return new ExecutionPlan(steps);
	}

	private String path(Expression expression, String role) {
		Value value = evaluator.evaluate(expression);
		if (!value.isString()) {
			throw typeError(expression, role + " must be a string, got " + value.getType());
		}
		return value.asString();
	}

	private int frameIndex(Expression expression) {
		Value value = evaluator.evaluate(expression);
		if (!value.isNumber()) {
			throw typeError(expression, "frame index must be a number, got " + value.getType());
		}
		return value.asNumber();
	}

	/**
	 * A bound is a time position, or a number of seconds.
	 */
	private TimePosition bound(Expression expression, String role) {
		Value value = evaluator.evaluate(expression);
		if (value.isTime()) {
			return value.asTime();
		}
		if (value.isNumber()) {
			return TimePosition.ofSeconds(value.asNumber());
		}
		throw typeError(expression, role + " must be a time, got " + value.getType());
	}

	private static EvaluationException typeError(Expression expression, String msg) {
		Token first = expression.getFirstToken();
		return new EvaluationException(ErrorKind.TYPE_ERROR, first.getLine(), first.getColumn(), msg);
	}

	private final class StepBuilder implements StatementVisitor<PlanStep> {

		@Override
		public PlanStep visitProgram(ProgramStatement program) {
			throw new IllegalStateException("A program cannot be nested in another statement");
		}

		@Override
		public PlanStep visitLet(LetStatement let) {
			return new PlanStep(let, null, "let " + let.getName() + " = " + let.getExpression().getText());
		}

		@Override
		public PlanStep visitIf(IfStatement ifStatement) {
			Value left = evaluator.evaluate(ifStatement.getLeft());
			Value right = evaluator.evaluate(ifStatement.getRight());
			String condition = ifStatement.getLeft().getText() + " == " + ifStatement.getRight().getText();
			if (left.isTime() && right.isTime() && left.asTime().equals(right.asTime())) {
				PlanStep inner = ifStatement.getThenStatement().accept(this);
				return new PlanStep(ifStatement, inner.getAction(), "if " + condition + ": " + inner.getDescription());
			}
			LOGGER.debug("Condition {} does not hold ({} vs {}), skipping statement at {}", condition, left, right, VScriptLogger.at(ifStatement.getLine(), ifStatement.getColumn()));
			return new PlanStep(ifStatement, null, "skipped: if " + condition);
		}

		@Override
		public PlanStep visitFrame(FrameStatement frame) {
			FrameAction action = new FrameAction(
					frame,
					path(frame.getSource(), "frame source"),
					frameIndex(frame.getFrameIndex()),
					frame.getDestination());
			return new PlanStep(
					frame,
					action,
					"frame " + action.getFrameIndex() + " of " + action.getSource() + " to " + action.getDestination());
		}

		@Override
		public PlanStep visitConcat(ConcatStatement concat) {
			ConcatAction action = new ConcatAction(
					concat,
					path(concat.getFirst(), "concat first clip"),
					path(concat.getSecond(), "concat second clip"),
					concat.getDestination());
			return new PlanStep(
					concat,
					action,
					"concat " + action.getFirst() + " and " + action.getSecond() + " to " + action.getDestination());
		}

		@Override
		public PlanStep visitAudio(AudioStatement audio) {
			AudioAction action = new AudioAction(
					audio,
					path(audio.getSource(), "audio source"),
					bound(audio.getStart(), "audio start"),
					bound(audio.getEnd(), "audio end"),
					audio.getDestination());
			return new PlanStep(
					audio,
					action,
					"audio of " + action.getSource() + " from " + action.getStart() + " to " + action.getEnd()
							+ " into " + action.getDestination());
		}

		@Override
		public PlanStep visitPlay(PlayStatement play) {
			String source = path(play.getSource(), "play source");
			if (!play.isBounded()) {
				return new PlanStep(play, new PlayAction(play, source, null, null), "play " + source);
			}
			PlayAction action = new PlayAction(
					play,
					source,
					bound(play.getStart(), "play start"),
					bound(play.getEnd(), "play end"));
			return new PlanStep(
					play,
					action,
					"play " + source + " from " + action.getStart() + " to " + action.getEnd());
		}

		@Override
		public PlanStep visitError(ErrorStatement error) {
			throw new IllegalStateException("Cannot plan a statement that failed to parse: " + error.getError());
		}
	}
}
