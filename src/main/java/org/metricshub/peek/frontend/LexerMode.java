package org.metricshub.peek.frontend;

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

/**
 * Lexical contexts of the {@link PeekLexer}. The lexer keeps a stack of
 * them: entering a bracket, a quote or a statement pushes a mode, leaving it
 * pops back to the enclosing one.
 */
public enum LexerMode {
	/** Between statements */
	ROOT,
	/** After an API-call method, waiting for the path */
	API_PATH,
	/** After an API-call path, reading <code>key=value</code> options */
	API_OPTIONS,
	/** Between payload blocks of an API call */
	API_PAYLOAD,
	/** After a function name, reading arguments */
	FUNC_ARGS,
	/** After <code>=</code>, waiting for exactly one value */
	OPTION_VALUE,
	/** Payload block of an API call, closed by <code>}</code> */
	PAYLOAD,
	DICT,
	ARRAY,
	/** Brackets that do not belong to any statement */
	STRAY_BLOCK,
	SINGLE_QUOTED("'"),
	DOUBLE_QUOTED("\""),
	TRIPLE_SINGLE_QUOTED("'''"),
	TRIPLE_DOUBLE_QUOTED("\"\"\"");

	private final String delimiter;

	LexerMode() {
		this(null);
	}

	LexerMode(String delimiter) {
		this.delimiter = delimiter;
	}

	/**
	 * @return the quote delimiter of a string mode, <code>null</code> otherwise
	 */
	public String getDelimiter() {
		return delimiter;
	}

	/**
	 * @return <code>true</code> for the string modes that may span lines
	 */
	public boolean isMultiLine() {
		return this == TRIPLE_SINGLE_QUOTED || this == TRIPLE_DOUBLE_QUOTED;
	}
}
