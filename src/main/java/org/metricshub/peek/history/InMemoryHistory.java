package org.metricshub.peek.history;

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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * A {@link History} kept in memory for the duration of the session, holding
 * at most a given number of entries.
 */
public class InMemoryHistory implements History {

	private final int max;
	private final Deque<HistoryEntry> entries = new ArrayDeque<HistoryEntry>();
	private int lastIndex;

	/**
	 * @param max maximum number of entries kept, older ones are dropped
	 */
	public InMemoryHistory(int max) {
		if (max < 1) {
			throw new IllegalArgumentException("History must keep at least one entry, not " + max);
		}
		this.max = max;
	}

	@Override
	public void store(String text) {
		entries.addLast(new HistoryEntry(++lastIndex, text));
		while (entries.size() > max) {
			entries.removeFirst();
		}
	}

	@Override
	public List<HistoryEntry> loadRecent() {
		return new ArrayList<HistoryEntry>(entries);
	}

	@Override
	public HistoryEntry getEntry(int index) {
		for (HistoryEntry entry : entries) {
			if (entry.getIndex() == index) {
				return entry;
			}
		}
		return null;
	}
}
