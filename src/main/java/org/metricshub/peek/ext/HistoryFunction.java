package org.metricshub.peek.ext;

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

import java.util.List;
import java.util.Map;
import org.metricshub.peek.PeekContext;
import org.metricshub.peek.PeekException;
import org.metricshub.peek.history.HistoryEntry;

/**
 * <code>history [index]</code>: lists the recent inputs, or runs again the
 * input with the specified number.
 */
class HistoryFunction implements PeekFunction {

	@Override
	public Object call(PeekContext context, List<Object> args, Map<String, Object> kwargs) {
		CoreFunctions.checkMaxArgs("history", args, 1);
		Object index = CoreFunctions.argument(args, 0);
		if (index == null) {
			StringBuilder listing = new StringBuilder();
			for (HistoryEntry entry : context.getHistory().loadRecent()) {
				if (listing.length() > 0) {
					listing.append('\n');
				}
				listing.append(entry);
			}
			return listing.toString();
		}
		HistoryEntry entry = context.getHistory().getEntry(CoreFunctions.toInt(index));
		if (entry == null) {
			throw new PeekException("History not found for index: " + index);
		}
		context.processInput(entry.getText(), false);
		return null;
	}
}
