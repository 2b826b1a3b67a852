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

import java.math.BigInteger;
import org.metricshub.peek.PeekException;

/**
 * Decoding of string and number literals.
 */
public final class Literals {

	private Literals() {}

	/**
	 * Decodes a quoted string literal: the quotes are removed and the escape
	 * sequences are replaced with the characters they stand for.
	 * <p>
	 * Supported escapes are <code>\\ \' \" \n \t \r \a \b \f \v</code>,
	 * octal <code>\N \NN \NNN</code>, hexadecimal <code>\xNN</code>, Unicode
	 * <code>&#92;uXXXX</code> and <code>\UXXXXXXXX</code>, and a backslash
	 * followed by a newline, which is dropped. Any other escape is kept as
	 * written, backslash included.
	 *
	 * @param raw the literal as written, quotes included
	 * @return the decoded string
	 */
	public static String unescape(String raw) {
		int quoteLength;
		if (raw.length() >= 6 && (raw.startsWith("'''") || raw.startsWith("\"\"\""))) {
			quoteLength = 3;
		} else if (raw.length() >= 2) {
			quoteLength = 1;
		} else {
			throw new PeekException("Not a string literal: " + raw);
		}
		String body = raw.substring(quoteLength, raw.length() - quoteLength);

		StringBuilder string = new StringBuilder(body.length());
		int i = 0;
		while (i < body.length()) {
			char c = body.charAt(i++);
			if (c != '\\' || i >= body.length()) {
				string.append(c);
				continue;
			}
			c = body.charAt(i++);
			switch (c) {
			case '\\':
			case '\'':
			case '"':
				string.append(c);
				break;
			case '\n':
				break; // line continuation
			case 'n':
				string.append('\n');
				break;
			case 't':
				string.append('\t');
				break;
			case 'r':
				string.append('\r');
				break;
			case 'a':
				string.append('\007');
				break; // BEL 0x07
			case 'b':
				string.append('\010');
				break; // BS 0x08
			case 'f':
				string.append('\014');
				break; // FF 0x0C
			case 'v':
				string.append('\013');
				break; // VT 0x0B
			// Octal notation: \N \NN \NNN
			case '0':
			case '1':
			case '2':
			case '3':
			case '4':
			case '5':
			case '6':
			case '7': {
				int octalChar = c - '0';
				for (int n = 0; n < 2 && i < body.length() && body.charAt(i) >= '0' && body.charAt(i) <= '7'; n++) {
					octalChar = (octalChar << 3) + body.charAt(i++) - '0';
				}
				string.append((char) octalChar);
				break;
			}
			case 'x':
				i = appendHex(body, i, 2, 'x', string);
				break;
			case 'u':
				i = appendHex(body, i, 4, 'u', string);
				break;
			case 'U':
				i = appendHex(body, i, 8, 'U', string);
				break;
			default:
				string.append('\\').append(c);
				break;
			}
		}
		return string.toString();
	}

	/**
	 * Appends the code point made of exactly <code>digits</code> hexadecimal
	 * digits starting at <code>start</code>, or the escape as written if the
	 * digits are missing.
	 *
	 * @return index of the first character after the escape
	 */
	private static int appendHex(String body, int start, int digits, char letter, StringBuilder string) {
		int end = start + digits;
		if (end <= body.length()) {
			int codePoint = 0;
			boolean valid = true;
			for (int i = start; i < end; i++) {
				int digit = Character.digit(body.charAt(i), 16);
				if (digit < 0) {
					valid = false;
					break;
				}
				codePoint = (codePoint << 4) + digit;
			}
			if (valid && Character.isValidCodePoint(codePoint)) {
				string.appendCodePoint(codePoint);
				return end;
			}
		}
		string.append('\\').append(letter);
		return start;
	}

	/**
	 * Decodes a number literal.
	 *
	 * @param raw the literal as written
	 * @return a {@link Long} for an integer, a {@link BigInteger} for an integer
	 *         too large for a long, a {@link Double} otherwise
	 */
	public static Number parseNumber(String raw) {
		String text = raw.startsWith("+") ? raw.substring(1) : raw;
		try {
			if (text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0) {
				try {
					return Long.valueOf(text);
				} catch (NumberFormatException e) {
					return new BigInteger(text);
				}
			}
			return Double.valueOf(text);
		} catch (NumberFormatException e) {
			throw new PeekException("Not a number: " + raw, e);
		}
	}
}
