package org.metricshub.peek.frontend;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.List;
import org.junit.Test;

public class TokenNormalizerTest {

	@Test
	public void testMergesStringsAndDropsWhitespace() {
		List<Token> tokens = Arrays
				.asList(
						new Token(0, TokenKind.QUOTE_OPEN, "\""),
						new Token(1, TokenKind.STRING_CONTENT, "str"),
						new Token(4, TokenKind.QUOTE_CLOSE, "\""),
						new Token(5, TokenKind.CURLY_LEFT, "{"),
						new Token(6, TokenKind.CURLY_LEFT, "{"),
						new Token(7, TokenKind.WHITESPACE, "   "),
						new Token(10, TokenKind.CURLY_RIGHT, "}"),
						new Token(11, TokenKind.COMMENT, "//"),
						new Token(13, TokenKind.CURLY_RIGHT, "}"),
						new Token(14, TokenKind.QUOTE_OPEN, "'"),
						new Token(15, TokenKind.STRING_CONTENT, "s"),
						new Token(16, TokenKind.STRING_ESCAPE, "\\n"),
						new Token(18, TokenKind.QUOTE_CLOSE, "'"));
		assertEquals(
				Arrays
						.asList(
								new Token(0, TokenKind.STRING, "\"str\""),
								new Token(5, TokenKind.CURLY_LEFT, "{"),
								new Token(6, TokenKind.CURLY_LEFT, "{"),
								new Token(10, TokenKind.CURLY_RIGHT, "}"),
								new Token(13, TokenKind.CURLY_RIGHT, "}"),
								new Token(14, TokenKind.STRING, "'s\\n'")),
				TokenNormalizer.process(tokens));
	}

	@Test
	public void testUnterminatedStringBecomesError() {
		List<Token> tokens = TokenNormalizer.process(new PeekLexer().tokenize("f 'abc\n"));
		assertEquals(
				Arrays
						.asList(
								new Token(0, TokenKind.FUNC_NAME, "f"),
								new Token(2, TokenKind.ERROR, "'abc")),
				tokens);
	}
}
