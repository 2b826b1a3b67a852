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
 * A call to a named function: <code>name [arg ...] [key=value ...]</code>.
 */
public class FuncCallNode extends Node {

	private final NameNode name;
	private final ArrayNode args;
	private final DictNode kwargs;

	/**
	 * @param offset offset of the function name
	 * @param name function name
	 * @param args positional arguments
	 * @param kwargs keyword arguments, keyed by {@link NameNode}s
	 * @throws IllegalArgumentException if a keyword argument key is not a name
	 */
	public FuncCallNode(int offset, NameNode name, ArrayNode args, DictNode kwargs) {
		super(offset);
		for (DictNode.Entry entry : kwargs.getEntries()) {
			if (!(entry.getKey() instanceof NameNode)) {
				throw new IllegalArgumentException("Keyword argument name must be an identifier, got " + entry.getKey());
			}
		}
		this.name = name;
		this.args = args;
		this.kwargs = kwargs;
	}

	public String getName() {
		return name.getIdentifier();
	}

	public NameNode getNameNode() {
		return name;
	}

	public ArrayNode getArgs() {
		return args;
	}

	public DictNode getKwargs() {
		return kwargs;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.FUNC_CALL;
	}

	@Override
	public String toString() {
		return name + " " + args + " " + kwargs + "\n";
	}
}
