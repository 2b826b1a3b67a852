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
 * <code>connect hosts='host:9200' username='user' ...</code>: opens a new
 * connection, which becomes current.
 */
class ConnectFunction implements PeekFunction {

	private static final Map<String, String> OPTIONS = new LinkedHashMap<String, String>();

	static {
		OPTIONS.put("hosts", "comma-separated host:port or URLs");
		OPTIONS.put("username", "user name for basic authentication");
		OPTIONS.put("password", "password for basic authentication");
		OPTIONS.put("api_key", "API key, as id:key");
		OPTIONS.put("use_ssl", "use https for hosts without a scheme");
		OPTIONS.put("name", "name of the connection");
	}

	@Override
	public Object call(PeekContext context, List<Object> args, Map<String, Object> kwargs) {
		CoreFunctions.checkMaxArgs("connect", args, 0);
		CoreFunctions.checkOptions("connect", kwargs, OPTIONS);
		ClientManager clients = context.getClientManager();
		clients.add(context.getClientFactory().create(kwargs, context.getSettings()));
		return clients.toString();
	}

	@Override
	public Map<String, String> getOptions() {
		return OPTIONS;
	}
}
