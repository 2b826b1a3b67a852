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
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.metricshub.peek.frontend.ast.ApiCallNode;
import org.metricshub.peek.frontend.ast.ArrayNode;
import org.metricshub.peek.frontend.ast.ConstantNode;
import org.metricshub.peek.frontend.ast.DictNode;
import org.metricshub.peek.frontend.ast.FuncCallNode;
import org.metricshub.peek.frontend.ast.NameNode;
import org.metricshub.peek.frontend.ast.Node;
import org.metricshub.peek.frontend.ast.NumberNode;
import org.metricshub.peek.frontend.ast.ParserException;
import org.metricshub.peek.frontend.ast.StringNode;
import org.metricshub.peek.frontend.ast.TextNode;

/**
 * Converts Peek source text into a list of statement nodes.
 * <p>
 * The text is scanned with a {@link PeekLexer}, cleaned up with the
 * {@link TokenNormalizer}, then parsed by recursive descent. The grammar is:
 *
 * <pre>
 * PROGRAM    : STATEMENT* EOF
 * STATEMENT  : API_CALL | FUNC_CALL
 * API_CALL   : METHOD PATH (NAME '=' VALUE)* PAYLOAD*
 * PAYLOAD    : PAYLOAD_OPEN [PAIR (',' PAIR)* [',']] PAYLOAD_CLOSE
 * FUNC_CALL  : FUNC_NAME (VALUE | NAME '=' VALUE)*
 * VALUE      : STRING | NUMBER | CONSTANT | NAME | ARRAY | DICT
 * ARRAY      : '[' [VALUE (',' VALUE)* [',']] ']'
 * DICT       : '{' [PAIR (',' PAIR)* [',']] '}'
 * PAIR       : VALUE ':' VALUE
 * </pre>
 *
 * Parsing stops at the first error with a {@link ParserException}, no
 * partial result is returned. A parser instance is not thread-safe.
 */
public class PeekParser {

	private static final Set<TokenKind> VALUE_START = EnumSet
			.of(
					TokenKind.STRING,
					TokenKind.NUMBER,
					TokenKind.CONSTANT,
					TokenKind.NAME,
					TokenKind.BRACKET_LEFT,
					TokenKind.CURLY_LEFT);

	private String text;
	private List<Token> tokens;
	private int index;
	private Token token;

	/**
	 * Parses a whole script.
	 *
	 * @param source script text
	 * @return the statements, in source order
	 * @throws ParserException on the first syntax error
	 */
	public List<Node> parse(String source) throws ParserException {
		start(source, new PeekLexer());
		return PROGRAM();
	}

	/**
	 * Parses a standalone value, such as <code>{"a": [1, 2]}</code> or
	 * <code>'text'</code>.
	 *
	 * @param source value text
	 * @return the value node
	 * @throws ParserException if the text is not exactly one value
	 */
	public Node parseValue(String source) throws ParserException {
		start(source, new PeekLexer(LexerMode.DICT));
		Node value = VALUE();
		lexer(TokenKind.EOF);
		return value;
	}

	private void start(String source, PeekLexer lexer) {
		text = source;
		tokens = TokenNormalizer.process(lexer.tokenize(source));
		tokens.add(new Token(source.length(), TokenKind.EOF, ""));
		index = 0;
		token = tokens.get(0);
	}

	// RECURSIVE DESCENT PARSER:
	// CHECKSTYLE.OFF: MethodName
	// PROGRAM : STATEMENT* EOF
	List<Node> PROGRAM() throws ParserException {
		List<Node> statements = new ArrayList<Node>();
		while (token.getKind() != TokenKind.EOF) {
			if (token.getKind() == TokenKind.METHOD) {
				statements.add(API_CALL());
			} else if (token.getKind() == TokenKind.FUNC_NAME) {
				statements.add(FUNC_CALL());
			} else {
				throw parserException(TokenKind.METHOD, TokenKind.FUNC_NAME);
			}
		}
		return statements;
	}

	// API_CALL : METHOD PATH (NAME '=' VALUE)* PAYLOAD*
	ApiCallNode API_CALL() throws ParserException {
		Token method = lexer(TokenKind.METHOD);
		Token path = lexer(TokenKind.PATH);
		List<DictNode.Entry> options = new ArrayList<DictNode.Entry>();
		int optionsOffset = token.getOffset();
		while (token.getKind() == TokenKind.NAME) {
			Token key = lexer();
			lexer(TokenKind.ASSIGN);
			options.add(new DictNode.Entry(new NameNode(key.getOffset(), key.getText()), VALUE()));
		}
		List<DictNode> payloads = new ArrayList<DictNode>();
		while (token.getKind() == TokenKind.PAYLOAD_OPEN) {
			Token open = lexer();
			payloads.add(DICT_BODY(open, TokenKind.PAYLOAD_CLOSE));
		}
		return new ApiCallNode(
				method.getOffset(),
				method.getText(),
				new TextNode(path.getOffset(), path.getText()),
				new DictNode(optionsOffset, options),
				payloads);
	}

	// FUNC_CALL : FUNC_NAME (VALUE | NAME '=' VALUE)*
	FuncCallNode FUNC_CALL() throws ParserException {
		Token name = lexer(TokenKind.FUNC_NAME);
		List<Node> args = new ArrayList<Node>();
		List<DictNode.Entry> kwargs = new ArrayList<DictNode.Entry>();
		int argsOffset = token.getOffset();
		while (VALUE_START.contains(token.getKind())) {
			if (token.getKind() == TokenKind.NAME && peek().getKind() == TokenKind.ASSIGN) {
				Token key = lexer();
				lexer(TokenKind.ASSIGN);
				kwargs.add(new DictNode.Entry(new NameNode(key.getOffset(), key.getText()), VALUE()));
			} else {
				args.add(VALUE());
			}
		}
		return new FuncCallNode(
				name.getOffset(),
				new NameNode(name.getOffset(), name.getText()),
				new ArrayNode(argsOffset, args),
				new DictNode(argsOffset, kwargs));
	}

	// VALUE : STRING | NUMBER | CONSTANT | NAME | ARRAY | DICT
	Node VALUE() throws ParserException {
		Token t = token;
		switch (t.getKind()) {
		case STRING:
			lexer();
			return new StringNode(t.getOffset(), t.getText());
		case NUMBER:
			lexer();
			return new NumberNode(t.getOffset(), t.getText());
		case CONSTANT:
			lexer();
			return new ConstantNode(t.getOffset(), t.getText());
		case NAME:
			lexer();
			return new NameNode(t.getOffset(), t.getText());
		case BRACKET_LEFT:
			return ARRAY();
		case CURLY_LEFT:
			return DICT_BODY(lexer(), TokenKind.CURLY_RIGHT);
		default:
			throw parserException(VALUE_START.toArray(new TokenKind[0]));
		}
	}

	// ARRAY : '[' [VALUE (',' VALUE)* [',']] ']'
	ArrayNode ARRAY() throws ParserException {
		Token open = lexer(TokenKind.BRACKET_LEFT);
		List<Node> values = new ArrayList<Node>();
		while (token.getKind() != TokenKind.BRACKET_RIGHT) {
			values.add(VALUE());
			if (token.getKind() == TokenKind.COMMA) {
				lexer();
			} else if (token.getKind() != TokenKind.BRACKET_RIGHT) {
				throw parserException(TokenKind.COMMA, TokenKind.BRACKET_RIGHT);
			}
		}
		lexer(TokenKind.BRACKET_RIGHT);
		return new ArrayNode(open.getOffset(), values);
	}

	// DICT : [PAIR (',' PAIR)* [',']] close, the opening brace already consumed
	DictNode DICT_BODY(Token open, TokenKind close) throws ParserException {
		List<DictNode.Entry> entries = new ArrayList<DictNode.Entry>();
		while (token.getKind() != close) {
			Node key = VALUE();
			lexer(TokenKind.COLON);
			Node value = VALUE();
			entries.add(new DictNode.Entry(key, value));
			if (token.getKind() == TokenKind.COMMA) {
				lexer();
			} else if (token.getKind() != close) {
				throw parserException(TokenKind.COMMA, close);
			}
		}
		lexer(close);
		return new DictNode(open.getOffset(), entries);
	}
	// CHECKSTYLE.ON: MethodName

	/**
	 * Consumes the current token.
	 *
	 * @return the consumed token
	 */
	private Token lexer() {
		Token consumed = token;
		if (index < tokens.size() - 1) {
			index++;
		}
		token = tokens.get(index);
		return consumed;
	}

	/**
	 * Consumes the current token, which must be of the specified kind.
	 */
	private Token lexer(TokenKind expected) throws ParserException {
		if (token.getKind() != expected) {
			throw parserException(expected);
		}
		return lexer();
	}

	private Token peek() {
		return tokens.get(Math.min(index + 1, tokens.size() - 1));
	}

	private ParserException parserException(TokenKind... expected) {
		int offset = Math.min(token.getOffset(), text.length());
		int line = 1;
		int lineStart = 0;
		for (int i = 0; i < offset; i++) {
			if (text.charAt(i) == '\n') {
				line++;
				lineStart = i + 1;
			}
		}
		StringBuilder expectation = new StringBuilder();
		for (int i = 0; i < expected.length; i++) {
			if (i > 0) {
				expectation.append(" or ");
			}
			expectation.append(expected[i].describe());
		}
		String actual = token.getKind().getCategory().name() + " (" + printable(token.getText()) + ")";
		return new ParserException(line, offset - lineStart + 1, expectation.toString(), actual);
	}

	private static String printable(String tokenText) {
		return tokenText.replace("\n", "\\n").replace("\t", "\\t");
	}
}
