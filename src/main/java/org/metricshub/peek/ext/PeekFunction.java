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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.metricshub.peek.PeekContext;

/**
 * A value that can be called by a function-call statement.
 */
@FunctionalInterface
public interface PeekFunction {

	/**
	 * Invokes the function.
	 *
	 * @param context the running session
	 * @param args evaluated positional arguments
	 * @param kwargs evaluated keyword arguments, in source order
	 * @return the result to display, or <code>null</code> for nothing
	 * @throws Exception any failure, reported to the display by the caller
	 */
	Object call(PeekContext context, List<Object> args, Map<String, Object> kwargs) throws Exception;

	/**
	 * @return the keyword options accepted by this function with a short
	 *         description of each, shown by <code>help</code>
	 */
	default Map<String, String> getOptions() {
		return Collections.emptyMap();
	}
}
