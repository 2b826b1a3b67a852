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
 * Kinds of tokens produced by the {@link PeekLexer}. Each kind belongs to a
 * {@link Category}, which is what syntax errors report and what syntax
 * highlighters care about.
 */
public enum TokenKind {
	WHITESPACE(Category.WHITESPACE),
	COMMENT(Category.COMMENT),

	/** Text that cannot be part of the current construct, like a newline right after a method */
	TEXT(Category.TEXT),
	ERROR(Category.ERROR),
	EOF(Category.EOF),

	METHOD(Category.KEYWORD),
	PATH(Category.LITERAL),
	FUNC_NAME(Category.NAME),
	NAME(Category.NAME),

	NUMBER(Category.LITERAL),
	CONSTANT(Category.KEYWORD),

	/** Whole string literal, only produced by the {@link TokenNormalizer} */
	STRING(Category.LITERAL),
	QUOTE_OPEN(Category.LITERAL),
	STRING_CONTENT(Category.LITERAL),
	STRING_ESCAPE(Category.LITERAL),
	QUOTE_CLOSE(Category.LITERAL),

	/** Braces delimiting a payload block of an API call */
	PAYLOAD_OPEN(Category.PUNCTUATION),
	PAYLOAD_CLOSE(Category.PUNCTUATION),
	/** Braces delimiting a nested dict */
	CURLY_LEFT(Category.PUNCTUATION),
	CURLY_RIGHT(Category.PUNCTUATION),
	BRACKET_LEFT(Category.PUNCTUATION),
	BRACKET_RIGHT(Category.PUNCTUATION),
	COMMA(Category.PUNCTUATION),
	COLON(Category.PUNCTUATION),
	ASSIGN(Category.PUNCTUATION);

	/**
	 * Broad token categories.
	 */
	public enum Category {
		LITERAL,
		KEYWORD,
		NAME,
		PUNCTUATION,
		WHITESPACE,
		COMMENT,
		TEXT,
		ERROR,
		EOF
	}

	private final Category category;

	TokenKind(Category category) {
		this.category = category;
	}

	/**
	 * @return the category of this kind
	 */
	public Category getCategory() {
		return category;
	}

	/**
	 * @return <code>true</code> for tokens that the parser never sees
	 */
	public boolean isIgnorable() {
		return category == Category.WHITESPACE || category == Category.COMMENT;
	}

	/**
	 * @return <code>true</code> for the fragments of a string literal
	 */
	public boolean isStringFragment() {
		return this == QUOTE_OPEN || this == STRING_CONTENT || this == STRING_ESCAPE || this == QUOTE_CLOSE;
	}

	/**
	 * @return description used in syntax errors, e.g. <code>LITERAL (PATH)</code>
	 */
	public String describe() {
		return category.name() + " (" + name() + ")";
	}
}
