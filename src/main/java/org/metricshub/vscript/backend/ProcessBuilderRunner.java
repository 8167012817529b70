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
import java.io.InterruptedIOException;

/**
 * Spawns each program with {@link ProcessBuilder}, sharing the standard
 * streams of this JVM, and blocks until it exits. There is no timeout.
 */
public class ProcessBuilderRunner implements ProcessRunner {

	/** {@inheritDoc} */
	@Override
	public int run(ProcessInvocation invocation) throws IOException {
		ProcessBuilder pb = new ProcessBuilder(invocation.getCommand());
		pb.inheritIO();
		Process p = pb.start();
		try {
			return p.waitFor();
		} catch (InterruptedException e) {
			p.destroy();
			Thread.currentThread().interrupt();
			InterruptedIOException ioe = new InterruptedIOException("Interrupted while waiting for " + invocation.getExecutable());
			ioe.initCause(e);
			throw ioe;
		}
	}
}
