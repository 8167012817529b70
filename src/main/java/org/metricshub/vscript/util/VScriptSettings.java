package org.metricshub.vscript.util;

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
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * A simple container for the parameters of a single VScript invocation.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking VScript programmatically, from within Java code.
 */
public class VScriptSettings {

	/**
	 * Executable used to play clips;
	 * <code>vlc</code> by default.
	 */
	private String playerExecutable = "vlc";

	/**
	 * Executable used to extract frames, audio and to join clips;
	 * <code>ffmpeg</code> by default.
	 */
	private String transcoderExecutable = "ffmpeg";

	/**
	 * Directory where the generated artifacts and the intermediate
	 * files of a concatenation are written.
	 */
	private Path outputDirectory = Paths.get(".");

	/**
	 * File name of the generated automation script.
	 */
	private String scriptFileName = "generated_video_script.py";

	/**
	 * File name of the structure dump.
	 */
	private String treeFileName = "AST.py";

	/**
	 * File name of the list consumed by the concat demuxer.
	 */
	private String concatListFileName = "files.txt";

	/**
	 * Whether an evaluation error raised while binding a <code>let</code>
	 * stops the whole parse; <code>false</code> by default, which means
	 * the failing binding is reported and parsing goes on.
	 */
	private boolean abortOnBindingError = false;

	/**
	 * Whether the structure dump is written next to the generated script;
	 * <code>true</code> by default.
	 */
	private boolean writeStructureDump = true;

	/**
	 * Whether the execution plan is actually run;
	 * <code>false</code> by default, the plan is only printed.
	 */
	private boolean execute = false;

	/**
	 * Output stream;
	 * <code>System.out</code> by default.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Stream receiving the diagnostics;
	 * <code>System.err</code> by default.
	 */
	private PrintStream errorStream = System.err;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("playerExecutable = ").append(getPlayerExecutable()).append(newLine);
		desc.append("transcoderExecutable = ").append(getTranscoderExecutable()).append(newLine);
		desc.append("outputDirectory = ").append(getOutputDirectory()).append(newLine);
		desc.append("scriptFileName = ").append(getScriptFileName()).append(newLine);
		desc.append("treeFileName = ").append(getTreeFileName()).append(newLine);
		desc.append("abortOnBindingError = ").append(isAbortOnBindingError()).append(newLine);
		desc.append("execute = ").append(isExecute()).append(newLine);

		return desc.toString();
	}

	public String getPlayerExecutable() {
		return playerExecutable;
	}

	public void setPlayerExecutable(String playerExecutable) {
		this.playerExecutable = playerExecutable;
	}

	public String getTranscoderExecutable() {
		return transcoderExecutable;
	}

	public void setTranscoderExecutable(String transcoderExecutable) {
		this.transcoderExecutable = transcoderExecutable;
	}

	public Path getOutputDirectory() {
		return outputDirectory;
	}

	public void setOutputDirectory(Path outputDirectory) {
		this.outputDirectory = outputDirectory;
	}

	public String getScriptFileName() {
		return scriptFileName;
	}

	public void setScriptFileName(String scriptFileName) {
		this.scriptFileName = scriptFileName;
	}

	public String getTreeFileName() {
		return treeFileName;
	}

	public void setTreeFileName(String treeFileName) {
		this.treeFileName = treeFileName;
	}

	public String getConcatListFileName() {
		return concatListFileName;
	}

	public void setConcatListFileName(String concatListFileName) {
		this.concatListFileName = concatListFileName;
	}

	/**
	 * Whether an evaluation error raised while binding a <code>let</code>
	 * aborts the whole parse.
	 *
	 * @return the abortOnBindingError
	 */
	public boolean isAbortOnBindingError() {
		return abortOnBindingError;
	}

	/**
	 * @param abortOnBindingError the abortOnBindingError to set
	 */
	public void setAbortOnBindingError(boolean abortOnBindingError) {
		this.abortOnBindingError = abortOnBindingError;
	}

	public boolean isWriteStructureDump() {
		return writeStructureDump;
	}

	public void setWriteStructureDump(boolean writeStructureDump) {
		this.writeStructureDump = writeStructureDump;
	}

	public boolean isExecute() {
		return execute;
	}

	public void setExecute(boolean execute) {
		this.execute = execute;
	}

	/**
	 * Output stream;
	 * <code>System.out</code> by default.
	 *
	 * @return the output stream
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "OutputStream reference is intentionally shared so callers can control output.")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * Sets the stream to print to (instead of System.out by default)
	 *
	 * @param pOutputStream stream to use for the plan and dumps
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Caller-supplied PrintStream must be used directly; no defensive copy possible.")
	public void setOutputStream(PrintStream pOutputStream) {
		outputStream = pOutputStream;
	}

	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "ErrorStream reference is intentionally shared so callers can control diagnostics.")
	public PrintStream getErrorStream() {
		return errorStream;
	}

	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Caller-supplied PrintStream must be used directly; no defensive copy possible.")
	public void setErrorStream(PrintStream pErrorStream) {
		errorStream = pErrorStream;
	}
}
