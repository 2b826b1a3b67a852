package org.metricshub.peek.util;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;

/**
 * A simple container for the configuration of a Peek session.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or from within a session with the <code>config</code> function.
 * <p>
 * Settings are kept as a tree of ordered maps. Dotted keys such as
 * <code>connection.hosts</code> address nested entries.
 */
public class PeekSettings {

	private static final Logger LOG = PeekLogger.getLogger(PeekSettings.class);

	/** Hosts used by <code>connect</code> when none are specified */
	public static final String CONNECTION_HOSTS = "connection.hosts";

	/** Whether <code>connect</code> uses https by default */
	public static final String CONNECTION_USE_SSL = "connection.use_ssl";

	/** Whether JSON responses are pretty printed */
	public static final String DISPLAY_PRETTY = "display.pretty";

	/** Maximum number of history entries kept */
	public static final String HISTORY_MAX = "history.max";

	private final Map<String, Object> root = new LinkedHashMap<String, Object>();

	/**
	 * Creates settings holding the default values.
	 */
	public PeekSettings() {
		put(CONNECTION_HOSTS, "localhost:9200");
		put(CONNECTION_USE_SSL, Boolean.FALSE);
		put(DISPLAY_PRETTY, Boolean.TRUE);
		put(HISTORY_MAX, Integer.valueOf(10000));
	}

	/**
	 * Returns the value stored under the specified dotted key.
	 *
	 * @param key dotted key
	 * @return the value, a nested map for an intermediate key, or
	 *         <code>null</code>
	 */
	public Object get(String key) {
		Object current = root;
		for (String component : key.split("\\.")) {
			if (!(current instanceof Map)) {
				return null;
			}
			current = ((Map<?, ?>) current).get(component);
		}
		return current;
	}

	/**
	 * @param key dotted key
	 * @param defaultValue value returned when the key is absent
	 * @return the value as a String
	 */
	public String getString(String key, String defaultValue) {
		Object value = get(key);
		return value == null ? defaultValue : value.toString();
	}

	/**
	 * Interprets the value as a boolean. Strings such as <code>"true"</code>,
	 * <code>"yes"</code>, <code>"on"</code> and <code>"1"</code> are truthy.
	 *
	 * @param key dotted key
	 * @return the boolean value; <code>false</code> when absent
	 */
	public boolean asBool(String key) {
		Object value = get(key);
		if (value instanceof Boolean) {
			return (Boolean) value;
		}
		if (value instanceof Number) {
			return ((Number) value).doubleValue() != 0;
		}
		if (value == null) {
			return false;
		}
		String text = value.toString().trim().toLowerCase();
		return text.equals("true") || text.equals("yes") || text.equals("on") || text.equals("1");
	}

	/**
	 * @param key dotted key
	 * @param defaultValue value returned when the key is absent or not a number
	 * @return the value as an int
	 */
	public int asInt(String key, int defaultValue) {
		Object value = get(key);
		if (value instanceof Number) {
			return ((Number) value).intValue();
		}
		if (value != null) {
			try {
				return Integer.parseInt(value.toString().trim());
			} catch (NumberFormatException e) {
				LOG.warn("Config key [{}] is not a number: {}", key, value);
			}
		}
		return defaultValue;
	}

	/**
	 * Stores a value under the specified dotted key, creating the intermediate
	 * maps.
	 *
	 * @param key dotted key
	 * @param value value to store
	 * @return <code>true</code> if the value was stored, <code>false</code> if
	 *         an intermediate component holds a non-map value
	 */
	public boolean put(String key, Object value) {
		String[] components = key.split("\\.");
		Map<String, Object> parent = root;
		for (int i = 0; i < components.length - 1; i++) {
			Object child = parent.get(components[i]);
			if (child == null) {
				Map<String, Object> created = new LinkedHashMap<String, Object>();
				parent.put(components[i], created);
				parent = created;
			} else if (child instanceof Map) {
				@SuppressWarnings("unchecked")
				Map<String, Object> nested = (Map<String, Object>) child;
				parent = nested;
			} else {
				LOG
						.warn(
								"Config key [{}] conflicts. Value of [{}] is not a [dict], but [{}]",
								key,
								components[i],
								child.getClass().getSimpleName());
				return false;
			}
		}
		parent.put(components[components.length - 1], value);
		return true;
	}

	/**
	 * Merges the specified entries. Nested maps are merged recursively,
	 * dotted keys address nested entries.
	 *
	 * @param entries entries to merge
	 */
	public void merge(Map<String, ?> entries) {
		merge("", entries);
	}

	private void merge(String prefix, Map<String, ?> entries) {
		for (Map.Entry<String, ?> entry : entries.entrySet()) {
			String key = prefix + entry.getKey();
			if (entry.getValue() instanceof Map) {
				@SuppressWarnings("unchecked")
				Map<String, ?> nested = (Map<String, ?>) entry.getValue();
				merge(key + ".", nested);
			} else {
				put(key, entry.getValue());
			}
		}
	}

	/**
	 * @return read-only view of the whole settings tree
	 */
	public Map<String, Object> asMap() {
		return Collections.unmodifiableMap(root);
	}

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();
		describe(desc, "", root);
		return desc.toString();
	}

	private static void describe(StringBuilder desc, String prefix, Map<String, Object> map) {
		for (Map.Entry<String, Object> entry : map.entrySet()) {
			if (entry.getValue() instanceof Map) {
				@SuppressWarnings("unchecked")
				Map<String, Object> nested = (Map<String, Object>) entry.getValue();
				describe(desc, prefix + entry.getKey() + ".", nested);
			} else {
				desc.append(prefix).append(entry.getKey()).append(" = ").append(entry.getValue()).append('\n');
			}
		}
	}
}
