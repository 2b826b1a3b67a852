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

import java.util.ArrayList;
import java.util.List;

/**
 * Prepares the output of the {@link PeekLexer} for the parser.
 * <p>
 * Whitespace and comments are dropped. The fragments of a string literal
 * (opening quote, content and escapes, closing quote) are merged into a
 * single {@link TokenKind#STRING} token holding the raw source text. A string
 * that is never closed becomes a single {@link TokenKind#ERROR} token.
 */
public final class TokenNormalizer {

	private TokenNormalizer() {}

	/**
	 * @param tokens raw lexer output
	 * @return the significant tokens, in order
	 */
	public static List<Token> process(List<Token> tokens) {
		List<Token> result = new ArrayList<Token>(tokens.size());
		int i = 0;
		while (i < tokens.size()) {
			Token token = tokens.get(i);
			if (token.getKind().isIgnorable()) {
				i++;
			} else if (token.getKind() == TokenKind.QUOTE_OPEN) {
				StringBuilder raw = new StringBuilder(token.getText());
				int j = i + 1;
				while (j < tokens.size()
						&& (tokens.get(j).getKind() == TokenKind.STRING_CONTENT
								|| tokens.get(j).getKind() == TokenKind.STRING_ESCAPE)) {
					raw.append(tokens.get(j).getText());
					j++;
				}
				TokenKind kind = TokenKind.ERROR;
				if (j < tokens.size() && tokens.get(j).getKind() == TokenKind.QUOTE_CLOSE) {
					raw.append(tokens.get(j).getText());
					kind = TokenKind.STRING;
					j++;
				}
				result.add(new Token(token.getOffset(), kind, raw.toString()));
				i = j;
			} else {
				result.add(token);
				i++;
			}
		}
		return result;
	}
}
