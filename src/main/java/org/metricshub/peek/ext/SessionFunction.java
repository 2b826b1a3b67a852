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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.peek.PeekContext;
import org.metricshub.peek.client.ClientManager;

/**
 * <code>session [current] [current=...] [remove=...] [rename=...] [info=...]</code>:
 * manages the connections of the session.
 * <p>
 * Connections are designated by index (number) or by name (string).
 * Without <code>info</code>, returns the list of connections.
 */
class SessionFunction implements PeekFunction {

	private static final Map<String, String> OPTIONS = new LinkedHashMap<String, String>();

	static {
		OPTIONS.put("current", "connection to make current");
		OPTIONS.put("remove", "connection to remove");
		OPTIONS.put("rename", "new name of the current connection");
		OPTIONS.put("info", "connection to describe");
	}

	@Override
	public Object call(PeekContext context, List<Object> args, Map<String, Object> kwargs) {
		CoreFunctions.checkMaxArgs("session", args, 1);
		CoreFunctions.checkOptions("session", kwargs, OPTIONS);
		ClientManager clients = context.getClientManager();

		Object current = args.isEmpty() ? kwargs.get("current") : args.get(0);
		if (current instanceof String) {
			clients.setCurrent((String) current);
		} else if (current != null) {
			clients.setCurrent(CoreFunctions.toInt(current));
		}

		Object remove = kwargs.get("remove");
		if (remove instanceof String) {
			clients.remove((String) remove);
		} else if (remove != null) {
			clients.remove(CoreFunctions.toInt(remove));
		}

		Object rename = kwargs.get("rename");
		if (rename != null) {
			clients.current().setName(rename.toString());
		}

		Object info = kwargs.get("info");
		if (info instanceof String) {
			return clients.get((String) info).info();
		} else if (info != null) {
			return clients.get(CoreFunctions.toInt(info)).info();
		}
		return clients.toString();
	}

	@Override
	public Map<String, String> getOptions() {
		return OPTIONS;
	}
}
