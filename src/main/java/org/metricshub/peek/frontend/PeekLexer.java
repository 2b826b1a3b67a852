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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.peek.frontend.ast.NameNode;

/**
 * Converts Peek source text into a flat list of positioned tokens,
 * whitespace and comments included.
 * <p>
 * The lexer keeps a stack of {@link LexerMode}s. Entering a statement, a
 * bracket or a quote pushes a mode, leaving it pops back to the enclosing
 * one. This is what distinguishes a <code>{</code> opening the payload of an
 * API call from a <code>{</code> that does not belong to any statement.
 * <p>
 * Invalid characters never abort the scan: they are emitted as
 * {@link TokenKind#ERROR} tokens at their exact offset and the lexer carries
 * on, so that a syntax highlighter still gets tokens for the rest of the
 * input. Rejecting the input is the job of the {@link PeekParser}.
 * <p>
 * A lexer instance holds the state of one scan and is not thread-safe.
 */
public class PeekLexer {

	/**
	 * Words that start an API call when they begin a statement. Any other
	 * word starts a function call.
	 */
	private static final Set<String> METHODS = new HashSet<String>(
			Arrays.asList("GET", "POST", "PUT", "DELETE", "HEAD", "PATCH", "OPTIONS"));

	private static final Set<String> CONSTANTS = new HashSet<String>(Arrays.asList("true", "false", "null"));

	private static final Pattern NUMBER = Pattern.compile("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?");

	private final LexerMode[] initialModes;

	private String text;
	private int length;
	private int pos;
	private Deque<LexerMode> modes;
	private List<Token> tokens;
	private Matcher numberMatcher;
	private Matcher wordMatcher;

	/**
	 * Creates a lexer for whole Peek scripts.
	 */
	public PeekLexer() {
		this(LexerMode.ROOT);
	}

	/**
	 * Creates a lexer starting with the specified mode stack, e.g.
	 * {@link LexerMode#DICT} to scan a bare payload.
	 *
	 * @param initialModes modes to start with, bottom of the stack first
	 */
	public PeekLexer(LexerMode... initialModes) {
		if (initialModes == null || initialModes.length == 0) {
			throw new IllegalArgumentException("At least one initial lexer mode is required");
		}
		this.initialModes = initialModes.clone();
	}

	/**
	 * Scans the specified text.
	 *
	 * @param source text to scan
	 * @return all the tokens of the text, in order, covering every character
	 */
	public List<Token> tokenize(String source) {
		text = source;
		length = source.length();
		pos = 0;
		modes = new ArrayDeque<LexerMode>();
		for (LexerMode mode : initialModes) {
			modes.push(mode);
		}
		tokens = new ArrayList<Token>();
		numberMatcher = NUMBER.matcher(source);
		wordMatcher = NameNode.IDENTIFIER.matcher(source);

		while (pos < length) {
			LexerMode mode = modes.peek();
			switch (mode) {
			case ROOT:
				scanRoot();
				break;
			case API_PATH:
				scanApiPath();
				break;
			case API_OPTIONS:
				scanApiOptions();
				break;
			case API_PAYLOAD:
				scanApiPayload();
				break;
			case FUNC_ARGS:
				scanFuncArgs();
				break;
			case OPTION_VALUE:
				scanOptionValue();
				break;
			case DICT:
			case PAYLOAD:
			case ARRAY:
				scanContainer(mode);
				break;
			case STRAY_BLOCK:
				scanStrayBlock();
				break;
			default:
				scanString(mode);
				break;
			}
		}
		List<Token> result = tokens;
		tokens = null;
		return result;
	}

	// statement level

	private void scanRoot() {
		char c = text.charAt(pos);
		if (isWhitespace(c) || c == '\n') {
			emitWhitespace(true);
		} else if (isCommentStart()) {
			emitComment();
		} else if (matchWord()) {
			String word = wordMatcher.group();
			if (METHODS.contains(word.toUpperCase(Locale.ROOT))) {
				emit(TokenKind.METHOD, pos + word.length());
				modes.push(LexerMode.API_PATH);
			} else {
				emit(TokenKind.FUNC_NAME, pos + word.length());
				modes.push(LexerMode.FUNC_ARGS);
			}
		} else if (c == '{' || c == '[') {
			emit(TokenKind.ERROR, pos + 1);
			modes.push(LexerMode.STRAY_BLOCK);
		} else {
			int end = pos + 1;
			while (end < length && !isWhitespace(text.charAt(end)) && text.charAt(end) != '\n'
					&& "{[".indexOf(text.charAt(end)) < 0) {
				end++;
			}
			emit(TokenKind.ERROR, end);
		}
	}

	private void scanStrayBlock() {
		char c = text.charAt(pos);
		if (isWhitespace(c) || c == '\n') {
			emitWhitespace(true);
		} else if (isCommentStart()) {
			emitComment();
		} else if (c == '{' || c == '[') {
			emit(TokenKind.ERROR, pos + 1);
			modes.push(LexerMode.STRAY_BLOCK);
		} else if (c == '}' || c == ']') {
			emit(TokenKind.ERROR, pos + 1);
			popMode();
		} else {
			emit(TokenKind.ERROR, pos + 1);
		}
	}

	private void scanApiPath() {
		char c = text.charAt(pos);
		if (isWhitespace(c)) {
			emitWhitespace(false);
		} else if (c == '\n') {
			// the method is not followed by a path: let the parser report it here
			emit(TokenKind.TEXT, pos + 1);
			popMode();
		} else {
			int end = pos;
			while (end < length && !isWhitespace(text.charAt(end)) && text.charAt(end) != '\n') {
				end++;
			}
			emit(TokenKind.PATH, end);
			replaceMode(LexerMode.API_OPTIONS);
		}
	}

	private void scanApiOptions() {
		char c = text.charAt(pos);
		if (isWhitespace(c)) {
			emitWhitespace(false);
		} else if (isCommentStart()) {
			emitComment();
		} else if (c == '\n') {
			emit(TokenKind.WHITESPACE, pos + 1);
			if (payloadFollows(pos)) {
				replaceMode(LexerMode.API_PAYLOAD);
			} else {
				popMode();
			}
		} else if (c == '{') {
			emit(TokenKind.PAYLOAD_OPEN, pos + 1);
			replaceMode(LexerMode.API_PAYLOAD);
			modes.push(LexerMode.PAYLOAD);
		} else if (c == '=') {
			emit(TokenKind.ASSIGN, pos + 1);
			modes.push(LexerMode.OPTION_VALUE);
		} else if (matchWord()) {
			int end = wordMatcher.end();
			// an option name must be followed by '='
			int next = end;
			while (next < length && isWhitespace(text.charAt(next))) {
				next++;
			}
			boolean isOption = next < length && text.charAt(next) == '=';
			emit(isOption ? TokenKind.NAME : TokenKind.ERROR, end);
		} else {
			emit(TokenKind.ERROR, pos + 1);
		}
	}

	private void scanApiPayload() {
		char c = text.charAt(pos);
		if (isWhitespace(c)) {
			emitWhitespace(false);
		} else if (isCommentStart()) {
			emitComment();
		} else if (c == '\n') {
			emit(TokenKind.WHITESPACE, pos + 1);
			if (!payloadFollows(pos)) {
				popMode();
			}
		} else if (c == '{') {
			emit(TokenKind.PAYLOAD_OPEN, pos + 1);
			modes.push(LexerMode.PAYLOAD);
		} else {
			emit(TokenKind.ERROR, pos + 1);
		}
	}

	/**
	 * Looks ahead from the start of a line for another payload block of the
	 * current API call. Lines holding only a comment are skipped, a blank
	 * line or anything other than <code>{</code> ends the statement.
	 */
	private boolean payloadFollows(int from) {
		int p = from;
		while (true) {
			while (p < length && isWhitespace(text.charAt(p))) {
				p++;
			}
			if (p >= length) {
				return false;
			}
			if (text.startsWith("//", p)) {
				while (p < length && text.charAt(p) != '\n') {
					p++;
				}
				if (p >= length) {
					return false;
				}
				p++;
				continue;
			}
			return text.charAt(p) == '{';
		}
	}

	private void scanFuncArgs() {
		char c = text.charAt(pos);
		if (isWhitespace(c)) {
			emitWhitespace(false);
		} else if (isCommentStart()) {
			emitComment();
		} else if (c == '\n') {
			emit(TokenKind.WHITESPACE, pos + 1);
			popMode();
		} else if (c == '=') {
			emit(TokenKind.ASSIGN, pos + 1);
			modes.push(LexerMode.OPTION_VALUE);
		} else if (c == '[') {
			emit(TokenKind.BRACKET_LEFT, pos + 1);
			modes.push(LexerMode.ARRAY);
		} else if (c == '{') {
			emit(TokenKind.CURLY_LEFT, pos + 1);
			modes.push(LexerMode.DICT);
		} else if (!scanScalar()) {
			emit(TokenKind.ERROR, pos + 1);
		}
	}

	private void scanOptionValue() {
		char c = text.charAt(pos);
		if (isWhitespace(c)) {
			emitWhitespace(false);
		} else if (c == '\n' || isCommentStart()) {
			// no value: the enclosing mode deals with the end of line
			popMode();
		} else if (c == '[') {
			emit(TokenKind.BRACKET_LEFT, pos + 1);
			replaceMode(LexerMode.ARRAY);
		} else if (c == '{') {
			emit(TokenKind.CURLY_LEFT, pos + 1);
			replaceMode(LexerMode.DICT);
		} else if (isQuote(c)) {
			popMode();
			startString();
		} else {
			if (!scanScalar()) {
				emit(TokenKind.ERROR, pos + 1);
			}
			popMode();
		}
	}

	// payload content

	private void scanContainer(LexerMode mode) {
		char c = text.charAt(pos);
		if (isWhitespace(c) || c == '\n') {
			emitWhitespace(true);
		} else if (isCommentStart()) {
			emitComment();
		} else if (c == '{') {
			emit(TokenKind.CURLY_LEFT, pos + 1);
			modes.push(LexerMode.DICT);
		} else if (c == '[') {
			emit(TokenKind.BRACKET_LEFT, pos + 1);
			modes.push(LexerMode.ARRAY);
		} else if (c == '}' && mode == LexerMode.DICT) {
			emit(TokenKind.CURLY_RIGHT, pos + 1);
			popMode();
		} else if (c == '}' && mode == LexerMode.PAYLOAD) {
			emit(TokenKind.PAYLOAD_CLOSE, pos + 1);
			popMode();
		} else if (c == ']' && mode == LexerMode.ARRAY) {
			emit(TokenKind.BRACKET_RIGHT, pos + 1);
			popMode();
		} else if (c == ',') {
			emit(TokenKind.COMMA, pos + 1);
		} else if (c == ':' && mode != LexerMode.ARRAY) {
			emit(TokenKind.COLON, pos + 1);
		} else if (!scanScalar()) {
			emit(TokenKind.ERROR, pos + 1);
		}
	}

	/**
	 * Scans a string, a number, a constant or a name.
	 *
	 * @return <code>false</code> if no scalar starts at the current position
	 */
	private boolean scanScalar() {
		char c = text.charAt(pos);
		if (isQuote(c)) {
			startString();
			return true;
		}
		numberMatcher.region(pos, length);
		if (numberMatcher.lookingAt()) {
			emit(TokenKind.NUMBER, numberMatcher.end());
			return true;
		}
		if (matchWord()) {
			String word = wordMatcher.group();
			emit(CONSTANTS.contains(word) ? TokenKind.CONSTANT : TokenKind.NAME, wordMatcher.end());
			return true;
		}
		return false;
	}

	// strings

	private void startString() {
		LexerMode mode;
		if (text.startsWith("'''", pos)) {
			mode = LexerMode.TRIPLE_SINGLE_QUOTED;
		} else if (text.startsWith("\"\"\"", pos)) {
			mode = LexerMode.TRIPLE_DOUBLE_QUOTED;
		} else if (text.charAt(pos) == '\'') {
			mode = LexerMode.SINGLE_QUOTED;
		} else {
			mode = LexerMode.DOUBLE_QUOTED;
		}
		emit(TokenKind.QUOTE_OPEN, pos + mode.getDelimiter().length());
		modes.push(mode);
	}

	private void scanString(LexerMode mode) {
		String delimiter = mode.getDelimiter();
		char c = text.charAt(pos);
		if (text.startsWith(delimiter, pos)) {
			emit(TokenKind.QUOTE_CLOSE, pos + delimiter.length());
			popMode();
		} else if (c == '\\') {
			if (pos + 1 < length) {
				emit(TokenKind.STRING_ESCAPE, pos + 2);
			} else {
				emit(TokenKind.ERROR, pos + 1);
			}
		} else if (c == '\n' && !mode.isMultiLine()) {
			// unterminated: the enclosing mode still ends the statement here
			popMode();
		} else {
			int end = pos;
			while (end < length) {
				char e = text.charAt(end);
				if (e == '\\' || (e == '\n' && !mode.isMultiLine()) || text.startsWith(delimiter, end)) {
					break;
				}
				end++;
			}
			emit(TokenKind.STRING_CONTENT, end);
		}
	}

	// helpers

	private boolean matchWord() {
		wordMatcher.region(pos, length);
		return wordMatcher.lookingAt();
	}

	private boolean isCommentStart() {
		return text.startsWith("//", pos);
	}

	private static boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\r' || c == '\f';
	}

	private static boolean isQuote(char c) {
		return c == '"' || c == '\'';
	}

	private void emitWhitespace(boolean includeNewlines) {
		int end = pos;
		while (end < length && (isWhitespace(text.charAt(end)) || (includeNewlines && text.charAt(end) == '\n'))) {
			end++;
		}
		emit(TokenKind.WHITESPACE, end);
	}

	private void emitComment() {
		int end = pos;
		while (end < length && text.charAt(end) != '\n') {
			end++;
		}
		emit(TokenKind.COMMENT, end);
	}

	private void emit(TokenKind kind, int end) {
		tokens.add(new Token(pos, kind, text.substring(pos, end)));
		pos = end;
	}

	private void popMode() {
		// the bottom mode stays
		if (modes.size() > 1) {
			modes.pop();
		}
	}

	private void replaceMode(LexerMode mode) {
		modes.pop();
		modes.push(mode);
	}
}
