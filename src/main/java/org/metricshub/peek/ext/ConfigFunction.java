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
import org.metricshub.peek.util.PeekSettings;

/**
 * <code>config [key=value ...]</code>: without options, returns the
 * settings; otherwise merges the options into the settings. Dotted keys
 * address nested settings, e.g. <code>config display.pretty=false</code>.
 */
class ConfigFunction implements PeekFunction {

	@Override
	public Object call(PeekContext context, List<Object> args, Map<String, Object> kwargs) {
		CoreFunctions.checkMaxArgs("config", args, 0);
		PeekSettings settings = context.getSettings();
		if (kwargs.isEmpty()) {
			return settings.asMap();
		}
		settings.merge(kwargs);
		return null;
	}
}
