package org.metricshub.peek.frontend.ast;

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

/**
 * Thrown when the input does not follow the Peek grammar.
 * <p>
 * The message has the form
 * <code>Syntax error at Line L, Column C: Expect token of type ..., got ...</code>
 * with 1-based line and column of the offending token.
 */
public class ParserException extends IOException {

	private static final long serialVersionUID = 1L;

	private final int line;
	private final int column;
	private final String expected;
	private final String actual;

	/**
	 * @param line 1-based line of the offending token
	 * @param column 1-based column of the offending token
	 * @param expected description of the expected token types
	 * @param actual description of the token found
	 */
	public ParserException(int line, int column, String expected, String actual) {
		super("Syntax error at Line " + line + ", Column " + column + ": Expect token of type " + expected + ", got "
				+ actual);
		this.line = line;
		this.column = column;
		this.expected = expected;
		this.actual = actual;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	public String getExpected() {
		return expected;
	}

	public String getActual() {
		return actual;
	}
}
