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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.metricshub.vscript.backend.action.ActionVisitor;
import org.metricshub.vscript.backend.action.AudioAction;
import org.metricshub.vscript.backend.action.ConcatAction;
import org.metricshub.vscript.backend.action.FrameAction;
import org.metricshub.vscript.backend.action.MediaAction;
import org.metricshub.vscript.backend.action.PlayAction;
import org.metricshub.vscript.util.VScriptLogger;
import org.metricshub.vscript.util.VScriptSettings;
import org.slf4j.Logger;

/**
 * Turns the actions of an {@link ExecutionPlan} into invocations of the
 * media player and of the transcoder, and runs them one after the other
 * through a {@link ProcessRunner}.
 * <p>
 * A concatenation re-encodes both clips into the output directory, writes
 * the list file naming them, then joins them with the concat demuxer.
 */
public class ExecutionBackend {

	private static final Logger LOGGER = VScriptLogger.getLogger(ExecutionBackend.class);

	static final String CONVERTED_FIRST = "converted_0.mp4";
	static final String CONVERTED_SECOND = "converted_1.mp4";

	private final VScriptSettings settings;
	private final ProcessRunner runner;
	private final InvocationBuilder invocationBuilder = new InvocationBuilder();

	/**
	 * @param settings executables and output directory to use
	 * @param runner where the invocations are sent
	 */
	public ExecutionBackend(VScriptSettings settings, ProcessRunner runner) {
		this.settings = settings;
		this.runner = runner;
	}

	/**
	 * @param action a realized action
	 * @return the invocations realizing it, in the order they must run
	 */
	public List<ProcessInvocation> invocationsFor(MediaAction action) {
		return action.accept(invocationBuilder);
	}

	/**
	 * @param plan the plan to describe
	 * @return one command line per invocation the plan would run
	 */
	public List<String> describe(ExecutionPlan plan) {
		List<String> lines = new ArrayList<String>();
		for (MediaAction action : plan.getActions()) {
			for (ProcessInvocation invocation : invocationsFor(action)) {
				lines.add(invocation.getCommandLine());
			}
		}
		return lines;
	}

	/**
	 * Runs every invocation of the plan, in order, each to completion.
	 *
	 * @param plan the plan to run
	 * @return the number of invocations that exited with a non-zero status
	 * @throws IOException if the list file cannot be written or a program
	 *         cannot be run
	 */
	public int execute(ExecutionPlan plan) throws IOException {
		int failures = 0;
		for (MediaAction action : plan.getActions()) {
			if (action instanceof ConcatAction) {
				writeConcatList();
			}
			for (ProcessInvocation invocation : invocationsFor(action)) {
				LOGGER.info("Running {}", invocation.getCommandLine());
				int status = runner.run(invocation);
				if (status != 0) {
					LOGGER.warn("{} exited with status {} ({})", invocation.getExecutable(), status, VScriptLogger.at(action.getStatement().getLine(), action.getStatement().getColumn()));
					failures++;
				}
			}
		}
		return failures;
	}

	/**
	 * @return the list file read by the concat demuxer
	 */
	public Path getConcatListPath() {
		return settings.getOutputDirectory().resolve(settings.getConcatListFileName());
	}

	private void writeConcatList() throws IOException {
		Path listFile = getConcatListPath();
		Path parent = listFile.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		List<String> lines = Arrays.asList("file '" + CONVERTED_FIRST + "'", "file '" + CONVERTED_SECOND + "'");
		Files.write(listFile, lines, StandardCharsets.UTF_8);
		LOGGER.debug("Wrote {}", listFile);
	}

	private String outputPath(String fileName) {
		return settings.getOutputDirectory().resolve(fileName).toString();
	}

	private ProcessInvocation transcode(String... args) {
		return new ProcessInvocation(settings.getTranscoderExecutable(), Arrays.asList(args));
	}

	private final class InvocationBuilder implements ActionVisitor<List<ProcessInvocation>> {

		@Override
		public List<ProcessInvocation> visitPlay(PlayAction play) {
			List<String> args = new ArrayList<String>();
			args.add(play.getSource());
			if (play.isBounded()) {
				args.add("--start-time");
				args.add(Integer.toString(play.getStart().getTotalSeconds()));
				args.add("--stop-time");
				args.add(Integer.toString(play.getEnd().getTotalSeconds()));
			}
			return Collections.singletonList(new ProcessInvocation(settings.getPlayerExecutable(), args));
		}

		@Override
		public List<ProcessInvocation> visitFrame(FrameAction frame) {
			return Collections.singletonList(transcode(
					"-y",
					"-i",
					frame.getSource(),
					"-vf",
					"select=eq(n\\," + frame.getFrameIndex() + ")",
					"-vframes",
					"1",
					frame.getDestination()));
		}

		@Override
		public List<ProcessInvocation> visitConcat(ConcatAction concat) {
			List<ProcessInvocation> invocations = new ArrayList<ProcessInvocation>(3);
			invocations.add(transcode("-y", "-i", concat.getFirst(), "-c:v", "libx264", "-c:a", "aac", outputPath(CONVERTED_FIRST)));
			invocations.add(transcode("-y", "-i", concat.getSecond(), "-c:v", "libx264", "-c:a", "aac", outputPath(CONVERTED_SECOND)));
			invocations.add(transcode(
					"-y",
					"-f",
					"concat",
					"-safe",
					"0",
					"-i",
					getConcatListPath().toString(),
					"-c",
					"copy",
					concat.getDestination()));
			return invocations;
		}

		@Override
		public List<ProcessInvocation> visitAudio(AudioAction audio) {
			return Collections.singletonList(transcode(
					"-y",
					"-ss",
					audio.getStart().toString(),
					"-to",
					audio.getEnd().toString(),
					"-i",
					audio.getSource(),
					"-vn",
					"-acodec",
					"libmp3lame",
					audio.getDestination()));
		}
	}
}
