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

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.peek.ext.annotations.PeekExport;

/**
 * Base class of extensions written as plain Java methods.
 * <p>
 * Every method annotated with {@link PeekExport} becomes a function of the
 * session. For instance:
 *
 * <pre>
 * public class GreetingExtension extends AbstractExtension {
 * 	&#64;PeekExport("greet")
 * 	public String greet(String who) {
 * 		return "Hello, " + who;
 * 	}
 * }
 * </pre>
 */
public abstract class AbstractExtension implements PeekExtension {

	private Map<String, Object> exports;

	@Override
	public String getExtensionName() {
		return getClass().getSimpleName();
	}

	@Override
	public final synchronized Map<String, Object> getExports() {
		if (exports == null) {
			exports = Collections.unmodifiableMap(collectExports());
		}
		return exports;
	}

	/**
	 * Values exported next to the annotated methods.
	 *
	 * @return name to value map, empty by default
	 */
	protected Map<String, Object> getConstants() {
		return Collections.emptyMap();
	}

	private Map<String, Object> collectExports() {
		List<Method> methods = new ArrayList<Method>();
		for (Class<?> type = getClass(); type != null && type != AbstractExtension.class; type = type.getSuperclass()) {
			for (Method method : type.getDeclaredMethods()) {
				if (method.isAnnotationPresent(PeekExport.class)) {
					methods.add(method);
				}
			}
		}
		methods.sort(Comparator.comparing(m -> m.getAnnotation(PeekExport.class).value()));

		Map<String, Object> result = new LinkedHashMap<String, Object>();
		for (Method method : methods) {
			String name = method.getAnnotation(PeekExport.class).value();
			Object previous = result.putIfAbsent(name, new ExtensionFunction(name, this, method));
			if (previous != null) {
				throw new IllegalStateException(
						"Function '" + name + "' is exported more than once by " + getClass().getName());
			}
		}
		for (Map.Entry<String, Object> entry : getConstants().entrySet()) {
			if (result.putIfAbsent(entry.getKey(), entry.getValue()) != null) {
				throw new IllegalStateException(
						"Name '" + entry.getKey() + "' is exported more than once by " + getClass().getName());
			}
		}
		return result;
	}
}
