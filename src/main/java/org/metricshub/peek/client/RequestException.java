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

/**
 * An error response of the cluster.
 * <p>
 * When the response carries a body, the body is kept as the structured
 * {@link #getInfo() info} of the error, and the session displays it as a
 * regular result.
 */
public class RequestException extends IOException {

	private static final long serialVersionUID = 1L;

	private final int statusCode;

	private final transient Object info;

	/**
	 * @param statusCode HTTP status, or -1 when there is none
	 * @param info error payload, decoded when it is JSON, may be <code>null</code>
	 * @param message error message
	 */
	public RequestException(int statusCode, Object info, String message) {
		super(message);
		this.statusCode = statusCode;
		this.info = info;
	}

	public int getStatusCode() {
		return statusCode;
	}

	public Object getInfo() {
		return info;
	}

	/**
	 * @return whether this error has a status code and a payload to display
	 */
	public boolean hasInfo() {
		return statusCode >= 0 && info != null;
	}
}
