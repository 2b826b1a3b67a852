package org.metricshub.peek.ext;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Peek
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
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.metricshub.peek.PeekContext;
import org.metricshub.peek.PeekException;
import org.metricshub.peek.util.ScriptFileSource;

/**
 * <code>run 'file.es' [echo=true]</code>: runs the statements of a file.
 */
class RunFunction implements PeekFunction {

	private static final Map<String, String> OPTIONS = Collections
			.singletonMap("echo", "display each statement before running it");

	@Override
	public Object call(PeekContext context, List<Object> args, Map<String, Object> kwargs) throws IOException {
		CoreFunctions.checkOptions("run", kwargs, OPTIONS);
		if (args.size() != 1 || args.get(0) == null) {
			throw new PeekException("Function 'run' expects the file to run");
		}
		String text = new ScriptFileSource(args.get(0).toString()).readText();
		context.processInput(text, CoreFunctions.toBoolean(kwargs.get("echo")));
		return null;
	}

	@Override
	public Map<String, String> getOptions() {
		return OPTIONS;
	}
}
