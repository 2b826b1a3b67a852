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
 * Base class of the Peek syntax tree.
 * <p>
 * Nodes are immutable. Their {@link #toString()} is the canonical rendering
 * of the source they were parsed from: re-parsing it produces an equivalent
 * tree.
 */
public abstract class Node {

	private final int offset;

	protected Node(int offset) {
		this.offset = offset;
	}

	/**
	 * @return the kind of this node
	 */
	public abstract NodeKind getKind();

	/**
	 * @return offset of the first character of this node in the parsed text
	 */
	public int getOffset() {
		return offset;
	}

	/**
	 * @return the canonical rendering of this node
	 */
	@Override
	public abstract String toString();
}
