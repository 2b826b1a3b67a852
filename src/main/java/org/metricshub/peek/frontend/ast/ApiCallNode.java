package org.metricshub.peek.frontend.ast;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * An HTTP request to the cluster:
 *
 * <pre>
 * METHOD path [key=value ...]
 * [{payload}
 * ...]
 * </pre>
 *
 * Rendered as the method as written, the path and the options on one line,
 * then one line per payload block.
 */
public class ApiCallNode extends Node {

	private final String rawMethod;
	private final TextNode path;
	private final DictNode options;
	private final List<DictNode> payloads;

	public ApiCallNode(int offset, String rawMethod, TextNode path, DictNode options, List<DictNode> payloads) {
		super(offset);
		this.rawMethod = rawMethod;
		this.path = path;
		this.options = options;
		this.payloads = Collections.unmodifiableList(new ArrayList<DictNode>(payloads));
	}

	/**
	 * @return the HTTP method, upper case
	 */
	public String getMethod() {
		return rawMethod.toUpperCase(Locale.ROOT);
	}

	/**
	 * @return the method as written in the source
	 */
	public String getRawMethod() {
		return rawMethod;
	}

	public String getPath() {
		return path.getRaw();
	}

	public TextNode getPathNode() {
		return path;
	}

	public DictNode getOptions() {
		return options;
	}

	public List<DictNode> getPayloads() {
		return payloads;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.API_CALL;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(rawMethod).append(' ').append(path).append(' ').append(options).append('\n');
		for (DictNode payload : payloads) {
			sb.append(payload).append('\n');
		}
		return sb.toString();
	}
}
