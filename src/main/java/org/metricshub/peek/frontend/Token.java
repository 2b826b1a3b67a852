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

import java.util.Objects;

/**
 * A positioned token. The offset is the absolute, 0-based index of the
 * first character of the token in the source text.
 */
public final class Token {

	private final int offset;
	private final TokenKind kind;
	private final String text;

	/**
	 * @param offset absolute 0-based offset in the source
	 * @param kind kind of the token
	 * @param text raw text of the token
	 */
	public Token(int offset, TokenKind kind, String text) {
		this.offset = offset;
		this.kind = Objects.requireNonNull(kind, "kind");
		this.text = Objects.requireNonNull(text, "text");
	}

	public int getOffset() {
		return offset;
	}

	public TokenKind getKind() {
		return kind;
	}

	public String getText() {
		return text;
	}

	/**
	 * @return offset of the first character after this token
	 */
	public int getEndOffset() {
		return offset + text.length();
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof Token)) {
			return false;
		}
		Token that = (Token) other;
		return offset == that.offset && kind == that.kind && text.equals(that.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(offset, kind, text);
	}

	@Override
	public String toString() {
		return "(" + offset + ", " + kind + ", '" + text + "')";
	}
}
