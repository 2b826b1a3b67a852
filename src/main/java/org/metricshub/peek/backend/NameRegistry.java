package org.metricshub.peek.backend;

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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.metricshub.peek.ext.PeekExtension;

/**
 * Names known to a session, in two tiers: built-in names first, then names
 * exported by extensions.
 * <p>
 * Lookups always go to the current content of the registry, so that
 * extensions enabled during a session are visible to the next statement.
 */
public class NameRegistry {

	private final Map<String, Object> builtins;
	private final Map<String, Object> extensionNames = new LinkedHashMap<String, Object>();
	private final Map<String, PeekExtension> extensions = new LinkedHashMap<String, PeekExtension>();

	/**
	 * @param builtins built-in names, in display order
	 */
	public NameRegistry(Map<String, ?> builtins) {
		this.builtins = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(builtins));
	}

	/**
	 * Looks up a name, built-in tier first.
	 *
	 * @param name name to look up
	 * @return the value, or <code>null</code> if the name is unknown
	 */
	public Object resolve(String name) {
		Object value = builtins.get(name);
		if (value != null) {
			return value;
		}
		return extensionNames.get(name);
	}

	/**
	 * @param name name to look up
	 * @return whether the name is known in either tier
	 */
	public boolean contains(String name) {
		return builtins.containsKey(name) || extensionNames.containsKey(name);
	}

	/**
	 * Adds the exports of the specified extensions to the extension tier. The
	 * whole batch is rejected if an extension is provided twice or if an
	 * export clashes with a name already provided by another extension.
	 *
	 * @param newExtensions extensions to add
	 * @throws IllegalArgumentException on a clash
	 */
	public void addExtensions(Collection<? extends PeekExtension> newExtensions) {
		Map<String, Object> names = new LinkedHashMap<String, Object>();
		Map<String, PeekExtension> instances = new LinkedHashMap<String, PeekExtension>();
		for (PeekExtension extension : newExtensions) {
			if (extension == null) {
				throw new IllegalArgumentException("Extension instance must not be null");
			}
			String className = extension.getClass().getName();
			if (extensions.containsKey(className) || instances.putIfAbsent(className, extension) != null) {
				throw new IllegalArgumentException("Extension class '" + className + "' was provided multiple times");
			}
			for (Map.Entry<String, Object> entry : extension.getExports().entrySet()) {
				String name = entry.getKey();
				if (extensionNames.containsKey(name) || names.putIfAbsent(name, entry.getValue()) != null) {
					throw new IllegalArgumentException("Name '" + name + "' already provided by another extension");
				}
			}
		}
		extensions.putAll(instances);
		extensionNames.putAll(names);
	}

	/**
	 * @return the built-in names and their values
	 */
	public Map<String, Object> getBuiltins() {
		return builtins;
	}

	/**
	 * @return the names exported by extensions and their values
	 */
	public Map<String, Object> getExtensionNames() {
		return Collections.unmodifiableMap(extensionNames);
	}

	/**
	 * @return the enabled extensions, keyed by class name
	 */
	public Map<String, PeekExtension> getExtensions() {
		return Collections.unmodifiableMap(extensions);
	}

	/**
	 * @return all the names, built-in first
	 */
	public Set<String> names() {
		Set<String> names = new LinkedHashSet<String>(builtins.keySet());
		names.addAll(extensionNames.keySet());
		return names;
	}
}
