package org.metricshub.vscript;

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
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.metricshub.vscript.backend.ActionPlanner;
import org.metricshub.vscript.backend.ExecutionBackend;
import org.metricshub.vscript.backend.ExecutionPlan;
import org.metricshub.vscript.backend.ProcessBuilderRunner;
import org.metricshub.vscript.backend.ProcessRunner;
import org.metricshub.vscript.backend.ScriptTranslator;
import org.metricshub.vscript.backend.StructureDumper;
import org.metricshub.vscript.frontend.LexResult;
import org.metricshub.vscript.frontend.Lexer;
import org.metricshub.vscript.frontend.ParseResult;
import org.metricshub.vscript.frontend.Parser;
import org.metricshub.vscript.util.ScriptSource;
import org.metricshub.vscript.util.VScriptLogger;
import org.metricshub.vscript.util.VScriptSettings;
import org.slf4j.Logger;

/**
 * Entry point into the compilation and translation of a VScript script.
 * This entry point is used both when VScript is used as a library and when
 * invoked from the command line.
 * <p>
 * The overall process is as follows:
 * <ul>
 * <li>Lex and parse the script, producing a syntax tree and the bindings
 * made by its <code>let</code> statements. Diagnostics are collected, not
 * thrown.
 * <li>Walk the syntax tree once, evaluating the arguments of every command,
 * producing an {@link ExecutionPlan}.
 * <li>Render the plan as a Python script, and the syntax tree as an
 * <code>anytree</code> dump, <strong>and/or</strong> run the plan with the
 * media player and the transcoder.
 * </ul>
 *
 * @see VScriptSettings
 */
public class VScript {

	private static final Logger LOGGER = VScriptLogger.getLogger(VScript.class);

	private final VScriptSettings settings;

	/**
	 * Create a VScript instance with default settings.
	 */
	public VScript() {
		this(new VScriptSettings());
	}

	/**
	 * @param settings executables, output locations and error policy
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "settings are meant to be shared with the caller")
	public VScript(VScriptSettings settings) {
		this.settings = settings;
		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug("Settings: {}", settings.toDescriptionString());
		}
	}

	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "settings are meant to be shared with the caller")
	public VScriptSettings getSettings() {
		return settings;
	}

	/**
	 * Compiles a script given as text.
	 *
	 * @param script text of the script
	 * @return the compiled script, with its diagnostics
	 */
	public CompiledScript compile(String script) {
		try {
			return compile(new ScriptSource(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, new StringReader(script)));
		} catch (IOException e) {
			// a StringReader does not fail
			throw new IllegalStateException(e);
		}
	}

	/**
	 * Compiles a script read from the specified source.
	 *
	 * @param source where to read the script from
	 * @return the compiled script, with its diagnostics
	 * @throws IOException if the script cannot be read
	 */
	public CompiledScript compile(ScriptSource source) throws IOException {
		String text;
		try {
			text = source.readFully();
		} catch (UncheckedIOException e) {
			throw e.getCause();
		}
		LexResult lexResult = new Lexer().tokenize(text);
		ParseResult parseResult = new Parser(settings.isAbortOnBindingError()).parse(lexResult.getTokens());
		CompiledScript compiled = new CompiledScript(source.getDescription(), lexResult, parseResult);
		if (compiled.hasErrors()) {
			LOGGER.info("{}: {} errors", source.getDescription(), compiled.getErrors().size());
		}
		return compiled;
	}

	/**
	 * Evaluates the arguments of every command of a compiled script.
	 *
	 * @param compiled a script compiled without errors
	 * @return the plan shared by translation and execution
	 * @throws IllegalArgumentException if the script has errors
	 * @throws org.metricshub.vscript.runtime.EvaluationException if an
	 *         argument cannot be evaluated
	 */
	public ExecutionPlan plan(CompiledScript compiled) {
		if (compiled.hasErrors()) {
			throw new IllegalArgumentException(compiled.getDescription() + " has " + compiled.getErrors().size() + " errors");
		}
		return new ActionPlanner(compiled.getEnvironment()).plan(compiled.getProgram());
	}

	/**
	 * @param plan the plan to translate
	 * @return the text of the equivalent Python script
	 */
	public String translate(ExecutionPlan plan) {
		return new ScriptTranslator(settings).translate(plan);
	}

	/**
	 * @param compiled a compiled script
	 * @return the <code>anytree</code> dump of its syntax tree
	 */
	public String dumpStructure(CompiledScript compiled) {
		return new StructureDumper().dump(compiled.getProgram());
	}

	/**
	 * Writes the Python script and, unless disabled, the structure dump into
	 * the output directory.
	 *
	 * @param compiled a script compiled without errors
	 * @param plan its plan
	 * @return the files written
	 * @throws IOException if a file cannot be written
	 */
	public List<Path> writeArtifacts(CompiledScript compiled, ExecutionPlan plan) throws IOException {
		Path directory = settings.getOutputDirectory();
		Files.createDirectories(directory);
		List<Path> written = new ArrayList<Path>(2);
		if (settings.isWriteStructureDump()) {
			written.add(write(directory.resolve(settings.getTreeFileName()), dumpStructure(compiled)));
		}
		written.add(write(directory.resolve(settings.getScriptFileName()), translate(plan)));
		return written;
	}

	private static Path write(Path file, String content) throws IOException {
		Files.write(file, content.getBytes(StandardCharsets.UTF_8));
		LOGGER.info("Wrote {}", file);
		return file;
	}

	/**
	 * @param plan the plan to describe
	 * @return the command lines that {@link #execute(ExecutionPlan)} would run
	 */
	public List<String> describeExecution(ExecutionPlan plan) {
		return new ExecutionBackend(settings, new ProcessBuilderRunner()).describe(plan);
	}

	/**
	 * Runs the plan with real processes.
	 *
	 * @param plan the plan to run
	 * @return the number of processes that exited with a non-zero status
	 * @throws IOException if a process cannot be run
	 */
	public int execute(ExecutionPlan plan) throws IOException {
		return execute(plan, new ProcessBuilderRunner());
	}

	/**
	 * Runs the plan through the specified runner.
	 *
	 * @param plan the plan to run
	 * @param runner where the invocations are sent
	 * @return the number of invocations that exited with a non-zero status
	 * @throws IOException if an invocation cannot be run
	 */
	public int execute(ExecutionPlan plan, ProcessRunner runner) throws IOException {
		return new ExecutionBackend(settings, runner).execute(plan);
	}
}
