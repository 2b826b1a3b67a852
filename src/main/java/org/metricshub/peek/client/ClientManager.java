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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.peek.PeekException;

/**
 * The connections of a session, one of them being current.
 * <p>
 * Connections are addressed by their 0-based position or by their name.
 */
public class ClientManager {

	private final List<PeekClient> clients = new ArrayList<PeekClient>();
	private int currentIndex = -1;

	/**
	 * Adds a connection, which becomes current.
	 *
	 * @param client connection to add
	 */
	public void add(PeekClient client) {
		clients.add(client);
		currentIndex = clients.size() - 1;
	}

	/**
	 * @return the current connection
	 * @throws PeekException if there is no connection
	 */
	public PeekClient current() {
		if (currentIndex < 0) {
			throw new PeekException("No connection is configured");
		}
		return clients.get(currentIndex);
	}

	public int getCurrentIndex() {
		return currentIndex;
	}

	/**
	 * @return read-only list of the connections
	 */
	public List<PeekClient> clients() {
		return Collections.unmodifiableList(clients);
	}

	public int size() {
		return clients.size();
	}

	public PeekClient get(int index) {
		return clients.get(checkIndex(index, "get"));
	}

	public PeekClient get(String name) {
		return clients.get(indexOf(name));
	}

	public void setCurrent(int index) {
		currentIndex = checkIndex(index, "set");
	}

	public void setCurrent(String name) {
		currentIndex = indexOf(name);
	}

	/**
	 * Removes a connection. The current connection stays current when it is
	 * not the one removed; otherwise the first connection becomes current.
	 *
	 * @param index position of the connection
	 * @throws PeekException if it is the last connection
	 */
	public void remove(int index) {
		if (clients.size() == 1) {
			throw new PeekException("Cannot delete the last connection");
		}
		clients.remove(checkIndex(index, "remove"));
		if (index < currentIndex) {
			currentIndex--;
		} else if (index == currentIndex) {
			currentIndex = 0;
		}
	}

	public void remove(String name) {
		remove(indexOf(name));
	}

	private int checkIndex(int index, String action) {
		if (index < 0 || index >= clients.size()) {
			throw new PeekException("Attempt to " + action + " connection at invalid index [" + index + "]");
		}
		return index;
	}

	private int indexOf(String name) {
		for (int i = 0; i < clients.size(); i++) {
			if (name.equals(clients.get(i).getName())) {
				return i;
			}
		}
		throw new PeekException("No connection named [" + name + "]");
	}

	/**
	 * @return one line per connection, the current one marked with a star
	 */
	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < clients.size(); i++) {
			if (i > 0) {
				sb.append('\n');
			}
			sb.append(String.format("%s %4s %s", i == currentIndex ? "*" : " ", "[" + i + "]", clients.get(i)));
		}
		return sb.toString();
	}
}
