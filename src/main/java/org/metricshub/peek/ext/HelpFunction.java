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

import java.util.List;
import java.util.Map;
import org.metricshub.peek.PeekContext;
import org.metricshub.peek.PeekException;
import org.metricshub.peek.backend.NameRegistry;

/**
 * <code>help [function]</code>: lists the available names, or describes the
 * options of a function.
 */
class HelpFunction implements PeekFunction {

	@Override
	public Object call(PeekContext context, List<Object> args, Map<String, Object> kwargs) {
		CoreFunctions.checkMaxArgs("help", args, 1);
		NameRegistry names = context.getNames();
		Object function = CoreFunctions.argument(args, 0);
		if (function == null) {
			return String.join("\n", names.names());
		}
		for (String name : names.names()) {
			if (names.resolve(name) == function) {
				StringBuilder help = new StringBuilder(name);
				if (function instanceof PeekFunction) {
					for (Map.Entry<String, String> option : ((PeekFunction) function).getOptions().entrySet()) {
						help.append("\n  ").append(option.getKey()).append(": ").append(option.getValue());
					}
				}
				return help.toString();
			}
		}
		throw new PeekException("No such function: " + function);
	}
}
