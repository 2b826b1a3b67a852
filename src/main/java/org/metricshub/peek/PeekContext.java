package org.metricshub.peek;

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

import org.metricshub.peek.backend.NameRegistry;
import org.metricshub.peek.client.ClientManager;
import org.metricshub.peek.client.PeekClientFactory;
import org.metricshub.peek.display.Display;
import org.metricshub.peek.history.History;
import org.metricshub.peek.util.PeekSettings;

/**
 * What a function sees of the running session.
 */
public interface PeekContext {

	PeekSettings getSettings();

	Display getDisplay();

	History getHistory();

	ClientManager getClientManager();

	PeekClientFactory getClientFactory();

	NameRegistry getNames();

	/**
	 * Parses and runs the specified text, as if it was typed in.
	 *
	 * @param text Peek statements
	 * @param echo whether each statement is displayed before it runs
	 * @return <code>true</code> if the text parsed and every statement ran
	 *         without error
	 */
	boolean processInput(String text, boolean echo);
}
