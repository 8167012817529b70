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
import java.util.Arrays;
import java.util.List;
import org.metricshub.vscript.backend.action.ActionVisitor;
import org.metricshub.vscript.backend.action.AudioAction;
import org.metricshub.vscript.backend.action.ConcatAction;
import org.metricshub.vscript.backend.action.FrameAction;
import org.metricshub.vscript.backend.action.PlayAction;
import org.metricshub.vscript.frontend.ast.AudioStatement;
import org.metricshub.vscript.frontend.ast.ConcatStatement;
import org.metricshub.vscript.frontend.ast.ErrorStatement;
import org.metricshub.vscript.frontend.ast.FrameStatement;
import org.metricshub.vscript.frontend.ast.IfStatement;
import org.metricshub.vscript.frontend.ast.LetStatement;
import org.metricshub.vscript.frontend.ast.PlayStatement;
import org.metricshub.vscript.frontend.ast.ProgramStatement;
import org.metricshub.vscript.frontend.ast.StatementVisitor;
import org.metricshub.vscript.util.VScriptLogger;
import org.metricshub.vscript.util.VScriptSettings;
import org.slf4j.Logger;

/**
 * Generates a standalone Python script equivalent to an
 * {@link ExecutionPlan}, using the <code>ffmpeg-python</code> package and
 * <code>subprocess</code>.
 * <p>
 * The script starts with its imports and has one block per top-level
 * statement, blocks being separated by a blank line. Statements that realize
 * nothing are rendered as comments. Nothing is run here.
 */
public class ScriptTranslator {

	private static final Logger LOGGER = VScriptLogger.getLogger(ScriptTranslator.class);

	static final String PREAMBLE = "import ffmpeg\nimport subprocess\n\n";

	private final VScriptSettings settings;
	private final BlockRenderer blockRenderer = new BlockRenderer();
	private final HeaderRenderer headerRenderer = new HeaderRenderer();

	public ScriptTranslator(VScriptSettings settings) {
		this.settings = settings;
	}

	/**
	 * @param plan the plan to translate
	 * @return the text of the Python script
	 */
	public String translate(ExecutionPlan plan) {
		StringBuilder sb = new StringBuilder(PREAMBLE);
		for (PlanStep step : plan.getSteps()) {
			String header = step.getStatement().accept(headerRenderer);
			if (header != null) {
				if (step.getStatement() instanceof IfStatement && !step.hasAction()) {
					header = "skipped: " + header;
				}
				sb.append("# ").append(PythonLiterals.comment(header)).append('\n');
			}
			if (step.hasAction()) {
				String block = step.getAction().accept(blockRenderer);
				LOGGER.debug("Line {}: {}", step.getStatement().getLine(), block);
				sb.append(block);
			}
			sb.append('\n');
		}
		return sb.toString();
	}

	/**
	 * Comment line introducing a block, if any.
	 */
	private static final class HeaderRenderer implements StatementVisitor<String> {

		@Override
		public String visitProgram(ProgramStatement program) {
			throw new IllegalStateException("A program cannot be nested in another statement");
		}

		@Override
		public String visitLet(LetStatement let) {
			return "let " + let.getName() + " = " + let.getExpression().getText();
		}

		@Override
		public String visitIf(IfStatement ifStatement) {
			return "if " + ifStatement.getLeft().getText() + " == " + ifStatement.getRight().getText();
		}

		@Override
		public String visitFrame(FrameStatement frame) {
			return null;
		}

		@Override
		public String visitConcat(ConcatStatement concat) {
			return null;
		}

		@Override
		public String visitAudio(AudioStatement audio) {
			return null;
		}

		@Override
		public String visitPlay(PlayStatement play) {
			return null;
		}

		@Override
		public String visitError(ErrorStatement error) {
			throw new IllegalStateException("Cannot translate a statement that failed to parse: " + error.getError());
		}
	}

	private final class BlockRenderer implements ActionVisitor<String> {

		@Override
		public String visitPlay(PlayAction play) {
			List<String> command = new ArrayList<String>();
			command.add(settings.getPlayerExecutable());
			command.add(play.getSource());
			if (play.isBounded()) {
				command.add("--start-time");
				command.add(Integer.toString(play.getStart().getTotalSeconds()));
				command.add("--stop-time");
				command.add(Integer.toString(play.getEnd().getTotalSeconds()));
			}
			return "subprocess.run(" + PythonLiterals.list(command) + ")\n";
		}

		@Override
		public String visitFrame(FrameAction frame) {
			return "ffmpeg.input(" + PythonLiterals.quote(frame.getSource()) + ")"
					+ ".filter(\"select\", " + PythonLiterals.quote("eq(n\\," + frame.getFrameIndex() + ")") + ")"
					+ ".output(" + PythonLiterals.quote(frame.getDestination()) + ", vframes=1)"
					+ ".run(overwrite_output=True)\n";
		}

		@Override
		public String visitConcat(ConcatAction concat) {
			String listFile = PythonLiterals.quote(settings.getConcatListFileName());
			StringBuilder sb = new StringBuilder();
			sb.append("# Convert inputs\n");
			sb.append(convert(concat.getFirst(), ExecutionBackend.CONVERTED_FIRST));
			sb.append(convert(concat.getSecond(), ExecutionBackend.CONVERTED_SECOND));
			sb.append('\n');
			sb.append("# Write concat file list\n");
			sb.append("with open(").append(listFile).append(", 'w') as f:\n");
			sb.append("    f.write(\"file '").append(ExecutionBackend.CONVERTED_FIRST).append("'\\n\")\n");
			sb.append("    f.write(\"file '").append(ExecutionBackend.CONVERTED_SECOND).append("'\\n\")\n");
			sb.append('\n');
			sb.append("# Concatenate with concat demuxer\n");
			List<String> command = Arrays.asList(
					settings.getTranscoderExecutable(),
					"-y",
					"-f",
					"concat",
					"-safe",
					"0",
					"-i",
					settings.getConcatListFileName(),
					"-c",
					"copy",
					concat.getDestination());
			sb.append("subprocess.run(").append(PythonLiterals.list(command)).append(")\n");
			return sb.toString();
		}

		private String convert(String source, String converted) {
			return "ffmpeg.input(" + PythonLiterals.quote(source) + ")"
					+ ".output(" + PythonLiterals.quote(converted) + ", vcodec='libx264', acodec='aac')"
					+ ".run(overwrite_output=True)\n";
		}

		@Override
		public String visitAudio(AudioAction audio) {
			return "ffmpeg.input(" + PythonLiterals.quote(audio.getSource())
					+ ", ss=" + PythonLiterals.quote(audio.getStart().toString())
					+ ", to=" + PythonLiterals.quote(audio.getEnd().toString()) + ")"
					+ ".output(" + PythonLiterals.quote(audio.getDestination()) + ", vn=None, acodec='libmp3lame')"
					+ ".run(overwrite_output=True)\n";
		}
	}
}
