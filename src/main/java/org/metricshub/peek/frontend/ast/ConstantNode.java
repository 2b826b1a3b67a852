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

/**
 * One of <code>true</code>, <code>false</code> or <code>null</code>.
 */
public class ConstantNode extends ValueNode {

	public ConstantNode(int offset, String raw) {
		super(offset, raw);
		if (!"true".equals(raw) && !"false".equals(raw) && !"null".equals(raw)) {
			throw new IllegalArgumentException("Not a constant: " + raw);
		}
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.CONSTANT;
	}

	/**
	 * @return {@link Boolean#TRUE}, {@link Boolean#FALSE} or <code>null</code>
	 */
	public Boolean getValue() {
		if ("null".equals(getRaw())) {
			return null;
		}
		return Boolean.valueOf(getRaw());
	}
}
