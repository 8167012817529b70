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
import java.util.Collections;
import java.util.List;
import org.metricshub.vscript.backend.action.MediaAction;

/**
 * One step per top-level statement of a program, in source order.
 * Both the execution backend and the script translator consume the same
 * plan, so they always work on the same evaluated arguments.
 */
public final class ExecutionPlan {

	private final List<PlanStep> steps;

	ExecutionPlan(List<PlanStep> steps) {
		this.steps = Collections.unmodifiableList(new ArrayList<PlanStep>(steps));
	}

	public List<PlanStep> getSteps() {
		return steps;
	}

	/**
	 * @return the realized actions, in order
	 */
	public List<MediaAction> getActions() {
		List<MediaAction> actions = new ArrayList<MediaAction>();
		for (PlanStep step : steps) {
			if (step.hasAction()) {
				actions.add(step.getAction());
			}
		}
		return actions;
	}
}
