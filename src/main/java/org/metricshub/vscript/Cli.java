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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.metricshub.vscript.backend.ExecutionPlan;
import org.metricshub.vscript.backend.ProcessBuilderRunner;
import org.metricshub.vscript.backend.ProcessRunner;
import org.metricshub.vscript.frontend.ScriptError;
import org.metricshub.vscript.frontend.Token;
import org.metricshub.vscript.runtime.EvaluationException;
import org.metricshub.vscript.util.ScriptFileSource;
import org.metricshub.vscript.util.ScriptSource;
import org.metricshub.vscript.util.VScriptSettings;

/**
 * Command-line interface for VScript.
 */
public final class Cli {

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "VScript.jar";
		}
		JAR_NAME = myName;
	}

	private final VScriptSettings settings = new VScriptSettings();
	private final ProcessRunner runner;

	private ScriptSource scriptSource;
	private boolean dumpTokens;
	private boolean dumpSyntax;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard output and error streams,
	 * running real processes.
	 */
	public Cli() {
		this(System.out, System.err);
	}

	/**
	 * @param out stream where the generated files and command lines are
	 *        listed
	 * @param err stream where diagnostics are written
	 */
	public Cli(PrintStream out, PrintStream err) {
		this(out, err, new ProcessBuilderRunner());
	}

	/**
	 * @param out stream where the generated files and command lines are
	 *        listed
	 * @param err stream where diagnostics are written
	 * @param runner runs the plan when <code>-x</code> is given
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out, PrintStream err, ProcessRunner runner) {
		this.runner = runner;
		settings.setOutputStream(out);
		settings.setErrorStream(err);
	}

	/**
	 * Returns the mutable {@link VScriptSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public VScriptSettings getSettings() {
		return settings;
	}

	/**
	 * @return the script specified on the command line, or {@code null}
	 */
	public ScriptSource getScriptSource() {
		return scriptSource;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 * @throws IllegalArgumentException if the arguments cannot be understood
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// end of options: the script itself
				break;
			} else if (arg.equals("-")) {
				++argIdx;
				break;
			} else if (arg.equals("-f")) {
				// -f filename : load script from file
				checkParameterHasArgument(args, argIdx);
				if (scriptSource != null) {
					throw new IllegalArgumentException("Only one script can be specified.");
				}
				scriptSource = new ScriptFileSource(args[++argIdx]);
			} else if (arg.equals("-o")) {
				checkParameterHasArgument(args, argIdx);
				settings.setOutputDirectory(Paths.get(args[++argIdx]));
			} else if (arg.equals("--script-name")) {
				checkParameterHasArgument(args, argIdx);
				settings.setScriptFileName(args[++argIdx]);
			} else if (arg.equals("--tree-name")) {
				checkParameterHasArgument(args, argIdx);
				settings.setTreeFileName(args[++argIdx]);
			} else if (arg.equals("--no-tree")) {
				settings.setWriteStructureDump(false);
			} else if (arg.equals("-x") || arg.equals("--execute")) {
				settings.setExecute(true);
			} else if (arg.equals("--player")) {
				checkParameterHasArgument(args, argIdx);
				settings.setPlayerExecutable(args[++argIdx]);
			} else if (arg.equals("--transcoder")) {
				checkParameterHasArgument(args, argIdx);
				settings.setTranscoderExecutable(args[++argIdx]);
			} else if (arg.equals("--abort-on-binding-error")) {
				settings.setAbortOnBindingError(true);
			} else if (arg.equals("--dump-tokens")) {
				dumpTokens = true;
			} else if (arg.equals("--dump-syntax")) {
				dumpSyntax = true;
			} else if (arg.equals("-h") || arg.equals("-?")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (scriptSource == null) {
			if (argIdx >= args.length) {
				throw new IllegalArgumentException("VScript script not provided.");
			}
			scriptSource = new ScriptSource(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, new StringReader(args[argIdx++]));
		}
		if (argIdx < args.length) {
			throw new IllegalArgumentException("Unexpected argument: " + args[argIdx]);
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	/**
	 * Compiles the script, reports its diagnostics or writes the generated
	 * files, lists the command lines of the plan and runs them when asked to.
	 *
	 * @throws IOException if the script cannot be read, or a file written, or
	 *         a process run
	 * @throws ExitException if the script has errors
	 */
	public void run() throws IOException, ExitException {
		PrintStream out = settings.getOutputStream();
		PrintStream err = settings.getErrorStream();
		if (printUsage) {
			usage(out);
			return;
		}

		VScript vscript = new VScript(settings);
		CompiledScript compiled = vscript.compile(scriptSource);
		if (compiled.hasErrors()) {
			for (ScriptError error : compiled.getErrors()) {
				err.println(error.format());
			}
			throw new ExitException(
					ExitException.SCRIPT_ERROR,
					compiled.getDescription() + ": " + compiled.getErrors().size() + " errors");
		}

		if (dumpTokens) {
			for (Token token : compiled.getTokens()) {
				out.println(token.getLine() + ":" + token.getColumn() + " " + token);
			}
		}
		if (dumpSyntax) {
			out.print(vscript.dumpStructure(compiled));
		}

		ExecutionPlan plan;
		try {
			plan = vscript.plan(compiled);
		} catch (EvaluationException e) {
			err.println(e.toScriptError().format());
			throw new ExitException(ExitException.SCRIPT_ERROR, e.getMessage());
		}

		for (Path file : vscript.writeArtifacts(compiled, plan)) {
			out.println("Generated " + file);
		}
		List<String> commandLines = vscript.describeExecution(plan);
		for (String line : commandLines) {
			out.println(line);
		}
		if (settings.isExecute()) {
			int failures = vscript.execute(plan, runner);
			if (failures > 0) {
				err.println(failures + " of " + commandLines.size() + " commands exited with a non-zero status");
			}
		}
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-f script-filename]" +
								" [-o output-directory]" +
								" [--script-name filename]" +
								" [--tree-name filename]" +
								" [--no-tree]" +
								" [-x|--execute]" +
								" [--player executable]" +
								" [--transcoder executable]" +
								" [--abort-on-binding-error]" +
								" [--dump-tokens]" +
								" [--dump-syntax]" +
								" [script]");
		dest.println();
		dest.println(" -f filename = Use contents of filename for script.");
		dest.println(" -o directory = Write the generated files into directory (default: current directory).");
		dest.println(" --script-name filename = Name of the generated Python script (default: generated_video_script.py).");
		dest.println(" --tree-name filename = Name of the syntax tree dump (default: AST.py).");
		dest.println(" --no-tree = Do not write the syntax tree dump.");
		dest.println(" -x, --execute = Run the player and transcoder commands.");
		dest.println(" --player executable = Media player to run (default: vlc).");
		dest.println(" --transcoder executable = Transcoder to run (default: ffmpeg).");
		dest.println(" --abort-on-binding-error = Stop parsing at the first error in a let statement.");
		dest.println(" --dump-tokens = Print the tokens of the script.");
		dest.println(" --dump-syntax = Print the syntax tree.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param os output stream
	 * @param es error stream for diagnostic messages
	 * @param runner runs the plan when <code>-x</code> is given
	 * @return configured and executed CLI instance
	 * @throws IOException if a file or process fails
	 * @throws ExitException if the script has errors
	 */
	public static Cli create(String[] args, PrintStream os, PrintStream es, ProcessRunner runner)
			throws IOException,
			ExitException {
		Cli cli = new Cli(os, es, runner);
		cli.parse(args);
		cli.run();
		return cli;
	}
}
