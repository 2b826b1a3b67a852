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

import java.lang.reflect.InvocationTargetException;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.metricshub.peek.util.PeekLogger;
import org.slf4j.Logger;

/**
 * Registry of the extensions that can be enabled in a session, by name or
 * by class name.
 * <p>
 * Extension classes found on the class path are instantiated on first
 * lookup. Nothing is ever discovered by scanning the file system.
 */
public final class ExtensionRegistry {

	private static final Logger LOG = PeekLogger.getLogger(ExtensionRegistry.class);

	private static final ConcurrentMap<String, PeekExtension> REGISTERED = new ConcurrentHashMap<String, PeekExtension>();

	static {
		register(TextExtension.class.getSimpleName(), TextExtension.INSTANCE);
	}

	private ExtensionRegistry() {}

	/**
	 * Registers an extension instance under the supplied name.
	 *
	 * @param name identifying name
	 * @param extension extension instance
	 * @throws IllegalStateException if the name is taken by another extension
	 */
	public static void register(String name, PeekExtension extension) {
		Objects.requireNonNull(name, "Extension name must not be null");
		Objects.requireNonNull(extension, "Extension instance must not be null");
		if (name.isEmpty()) {
			throw new IllegalArgumentException("Extension name must not be empty");
		}
		PeekExtension existing = REGISTERED.putIfAbsent(name, extension);
		if (existing != null && existing != extension) {
			throw new IllegalStateException(
					"Extension name '" + name + "' already mapped to " + existing.getClass().getName());
		}
	}

	/**
	 * Returns a snapshot of all registered extensions sorted by name.
	 *
	 * @return immutable view of registered extensions
	 */
	public static Map<String, PeekExtension> listExtensions() {
		Map<String, PeekExtension> snapshot = new TreeMap<String, PeekExtension>(String.CASE_INSENSITIVE_ORDER);
		snapshot.putAll(REGISTERED);
		return Collections.unmodifiableMap(snapshot);
	}

	/**
	 * Resolves an extension name to the registered instance, ignoring case.
	 * Class names are also accepted: an extension class that is not registered
	 * yet is loaded, instantiated with its no-argument constructor and
	 * registered.
	 *
	 * @param name name or class name of the extension
	 * @return extension instance, or {@code null} when the name cannot be resolved
	 */
	public static PeekExtension resolve(String name) {
		if (name == null || name.isEmpty()) {
			return null;
		}
		PeekExtension extension = REGISTERED.get(name);
		if (extension != null) {
			return extension;
		}
		for (Map.Entry<String, PeekExtension> entry : REGISTERED.entrySet()) {
			Class<?> type = entry.getValue().getClass();
			if (entry.getKey().equalsIgnoreCase(name) || type.getName().equals(name)) {
				return entry.getValue();
			}
		}
		return instantiate(name);
	}

	private static PeekExtension instantiate(String className) {
		Class<?> clazz;
		try {
			clazz = Class.forName(className);
		} catch (ClassNotFoundException e) {
			LOG.debug("No extension class {}", className);
			return null;
		}
		if (!PeekExtension.class.isAssignableFrom(clazz)) {
			LOG.warn("{} is not a {}", className, PeekExtension.class.getSimpleName());
			return null;
		}
		PeekExtension created;
		try {
			created = clazz.asSubclass(PeekExtension.class).getDeclaredConstructor().newInstance();
		} catch (InstantiationException | IllegalAccessException | NoSuchMethodException e) {
			throw new IllegalStateException("Cannot instantiate extension " + className, e);
		} catch (InvocationTargetException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			throw new IllegalStateException("Cannot instantiate extension " + className, cause);
		}
		PeekExtension existing = REGISTERED.putIfAbsent(clazz.getSimpleName(), created);
		PeekExtension instance = existing == null ? created : existing;
		REGISTERED.putIfAbsent(className, instance);
		return instance;
	}
}
