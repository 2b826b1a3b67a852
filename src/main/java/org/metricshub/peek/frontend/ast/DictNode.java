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

/**
 * An ordered sequence of key/value pairs: <code>{k:v,...}</code>.
 * <p>
 * Used for payload blocks, nested objects, API call options and keyword
 * arguments. Duplicate keys are kept in order, the last one wins at
 * evaluation.
 */
public class DictNode extends Node {

	/**
	 * One <code>key:value</code> pair.
	 */
	public static final class Entry {

		private final Node key;
		private final Node value;

		public Entry(Node key, Node value) {
			this.key = key;
			this.value = value;
		}

		public Node getKey() {
			return key;
		}

		public Node getValue() {
			return value;
		}

		@Override
		public String toString() {
			return key + ":" + value;
		}
	}

	private final List<Entry> entries;

	public DictNode(int offset, List<Entry> entries) {
		super(offset);
		this.entries = Collections.unmodifiableList(new ArrayList<Entry>(entries));
	}

	public List<Entry> getEntries() {
		return entries;
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.DICT;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("{");
		for (int i = 0; i < entries.size(); i++) {
			if (i > 0) {
				sb.append(',');
			}
			sb.append(entries.get(i));
		}
		return sb.append('}').toString();
	}
}
