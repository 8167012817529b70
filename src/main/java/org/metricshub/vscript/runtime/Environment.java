package org.metricshub.vscript.runtime;

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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Variable bindings produced by the <code>let</code> statements of one parse.
 * A binding made later replaces an earlier one with the same name.
 */
public class Environment {

	private final Map<String, Value> bindings = new LinkedHashMap<String, Value>();

	public void bind(String name, Value value) {
		bindings.put(name, value);
	}

	/**
	 * @param name identifier
	 * @return the bound value, or {@code null} if the identifier is unbound
	 */
	public Value lookup(String name) {
		return bindings.get(name);
	}

	public boolean isBound(String name) {
		return bindings.containsKey(name);
	}
}
