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

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * A Peek script read from a file, given with <code>-f</code> or to the
 * <code>run</code> function. A leading <code>~/</code> stands for the user's
 * home directory.
 */
public class ScriptFileSource extends ScriptSource {

	private final Path path;

	/**
	 * @param filePath path of the script, as typed by the user
	 */
	public ScriptFileSource(String filePath) {
		super(filePath, null);
		this.path = expandHome(filePath);
	}

	static Path expandHome(String filePath) {
		if (filePath.equals("~") || filePath.startsWith("~/")) {
			return Paths.get(System.getProperty("user.home"), filePath.substring(1).replaceFirst("^/", ""));
		}
		return Paths.get(filePath);
	}

	/**
	 * @return the resolved path of the script
	 */
	public Path getPath() {
		return path;
	}

	/**
	 * Opens the file. Every call returns a new reader.
	 *
	 * @throws IOException when the file cannot be opened
	 */
	@Override
	public Reader getReader() throws IOException {
		return Files.newBufferedReader(path, StandardCharsets.UTF_8);
	}
}
