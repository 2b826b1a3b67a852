package org.metricshub.peek.display;

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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;
import java.util.Collection;
import java.util.Map;
import org.metricshub.peek.PeekException;
import org.metricshub.peek.util.PeekLogger;
import org.metricshub.peek.util.PeekSettings;
import org.slf4j.Logger;

/**
 * Prints results on one stream and errors on another.
 * <p>
 * JSON responses, maps and lists are printed as JSON, indented when
 * <code>display.pretty</code> is set.
 */
public class ConsoleDisplay implements Display {

	private static final Logger LOG = PeekLogger.getLogger(ConsoleDisplay.class);

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final PrintStream out;
	private final PrintStream err;
	private final PeekSettings settings;

	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "the streams are shared with the caller on purpose")
	public ConsoleDisplay(PrintStream out, PrintStream err, PeekSettings settings) {
		this.out = out;
		this.err = err;
		this.settings = settings;
	}

	@Override
	public void info(Object value) {
		if (value != null) {
			out.println(format(value));
		}
	}

	@Override
	public void error(Object value) {
		if (value instanceof Throwable) {
			Throwable throwable = (Throwable) value;
			LOG.debug("Error reported to the display", throwable);
			String message = throwable.getMessage();
			if (message == null) {
				message = throwable.getClass().getSimpleName();
			}
			if (throwable instanceof PeekException && ((PeekException) throwable).getLineNumber() >= 0) {
				message = "Line " + ((PeekException) throwable).getLineNumber() + ": " + message;
			}
			err.println(message);
		} else if (value != null) {
			err.println(format(value));
		}
	}

	/**
	 * @param value value to print
	 * @return the printed form of the value
	 */
	String format(Object value) {
		boolean pretty = settings.asBool(PeekSettings.DISPLAY_PRETTY);
		try {
			if (value instanceof String) {
				String text = ((String) value).trim();
				if (pretty && (text.startsWith("{") || text.startsWith("["))) {
					JsonNode tree = MAPPER.readTree(text);
					return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(tree);
				}
				return (String) value;
			}
			if (value instanceof Map || value instanceof Collection) {
				return pretty ?
						MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value) :
						MAPPER.writeValueAsString(value);
			}
		} catch (JsonProcessingException e) {
			LOG.debug("Not printed as JSON: {}", e.getOriginalMessage());
		}
		return String.valueOf(value);
	}
}
