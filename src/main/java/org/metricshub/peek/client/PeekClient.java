package org.metricshub.peek.client;

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
import java.util.Map;

/**
 * A connection to a cluster, able to perform API calls.
 */
public interface PeekClient {

	/**
	 * Performs one request and waits for its response.
	 *
	 * @param method upper-case HTTP method
	 * @param path request path, query string included
	 * @param payload request body, <code>null</code> for none
	 * @param headers additional headers, <code>null</code> for none
	 * @return the response, handed as is to the display
	 * @throws RequestException when the cluster answers with an error
	 * @throws IOException when the cluster cannot be reached
	 */
	Object performRequest(String method, String path, String payload, Map<String, String> headers) throws IOException;

	/**
	 * @return user-assigned name of the connection, or <code>null</code>
	 */
	String getName();

	void setName(String name);

	/**
	 * @return description of the connection, shown by <code>session info=...</code>
	 */
	Map<String, Object> info();
}
