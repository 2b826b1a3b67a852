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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.metricshub.peek.ext.annotations.PeekExport;
import org.metricshub.peek.ext.annotations.PeekKeywordArgs;

/**
 * Small text utilities, available with <code>-l TextExtension</code>.
 *
 * <pre>
 * echo "index" 42 sep=":"
 * json {"query": {"match_all": {}}}
 * </pre>
 */
public class TextExtension extends AbstractExtension {

	/** Singleton instance registered in {@link ExtensionRegistry} */
	public static final TextExtension INSTANCE = new TextExtension();

	private static final ObjectMapper MAPPER = new ObjectMapper();

	@Override
	public String getExtensionName() {
		return "Text Utilities";
	}

	/**
	 * Joins the string values of the arguments.
	 *
	 * @param kwargs <code>sep</code>, the separator, a space by default
	 * @param values values to join
	 * @return the joined text
	 */
	@PeekExport("echo")
	public String echo(@PeekKeywordArgs Map<String, Object> kwargs, Object... values) {
		Object separator = kwargs.get("sep");
		StringBuilder result = new StringBuilder();
		for (int i = 0; i < values.length; i++) {
			if (i > 0) {
				result.append(separator == null ? " " : separator.toString());
			}
			result.append(values[i]);
		}
		return result.toString();
	}

	/**
	 * @param value any value
	 * @return the value as compact JSON
	 * @throws JsonProcessingException if the value cannot be serialized
	 */
	@PeekExport("json")
	public String json(Object value) throws JsonProcessingException {
		return MAPPER.writeValueAsString(value);
	}
}
