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

import java.util.regex.Pattern;

/**
 * A bare identifier, possibly dotted (<code>a.b.c</code>).
 * <p>
 * As a dict key or a keyword argument name it stands for its own text. As a
 * value it is looked up among the names of the session.
 */
public class NameNode extends ValueNode {

	/**
	 * Shape of an identifier.
	 */
	public static final Pattern IDENTIFIER = Pattern
			.compile("[A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)*");

	public NameNode(int offset, String identifier) {
		super(offset, identifier);
		if (!isIdentifier(identifier)) {
			throw new IllegalArgumentException("Not an identifier: " + identifier);
		}
	}

	/**
	 * @param text text to check
	 * @return whether the text has the shape of an identifier
	 */
	public static boolean isIdentifier(String text) {
		return text != null && IDENTIFIER.matcher(text).matches();
	}

	public String getIdentifier() {
		return getRaw();
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.NAME;
	}
}
