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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.peek.PeekException;

/**
 * The built-in functions of every session.
 */
public final class CoreFunctions {

	private CoreFunctions() {}

	/**
	 * @return new instances of the built-in functions, by name
	 */
	public static Map<String, PeekFunction> create() {
		Map<String, PeekFunction> functions = new LinkedHashMap<String, PeekFunction>();
		functions.put("connect", new ConnectFunction());
		functions.put("config", new ConfigFunction());
		functions.put("session", new SessionFunction());
		functions.put("run", new RunFunction());
		functions.put("history", new HistoryFunction());
		functions.put("help", new HelpFunction());
		return Collections.unmodifiableMap(functions);
	}

	/**
	 * @return the positional argument at the specified position, or
	 *         <code>null</code>
	 */
	static Object argument(List<Object> args, int position) {
		return position < args.size() ? args.get(position) : null;
	}

	static void checkMaxArgs(String function, List<Object> args, int max) {
		if (args.size() > max) {
			throw new PeekException(
					"Function '" + function + "' expects at most " + max + " positional argument(s), not " + args.size());
		}
	}

	/**
	 * Rejects the keyword arguments that are not declared by the function.
	 */
	static void checkOptions(String function, Map<String, Object> kwargs, Map<String, String> options) {
		for (String key : kwargs.keySet()) {
			if (!options.containsKey(key)) {
				throw new PeekException("Unknown option for '" + function + "': " + key);
			}
		}
	}

	static int toInt(Object value) {
		if (value instanceof Number) {
			return ((Number) value).intValue();
		}
		try {
			return Integer.parseInt(String.valueOf(value).trim());
		} catch (NumberFormatException e) {
			throw new PeekException("Expected a number, got " + value, e);
		}
	}

	static boolean toBoolean(Object value) {
		if (value instanceof Boolean) {
			return (Boolean) value;
		}
		if (value instanceof Number) {
			return ((Number) value).doubleValue() != 0;
		}
		return value != null && Boolean.parseBoolean(value.toString());
	}
}
