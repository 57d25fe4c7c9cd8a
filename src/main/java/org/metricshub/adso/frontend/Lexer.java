package org.metricshub.adso.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Adso
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
 * Converts a character buffer into positioned {@link Token}s.
 * <p>
 * Besides {@link #next()}, the lexer exposes the raw character under the
 * cursor ({@link #peek()}) so that the parser can look ahead one character
 * once whitespace has been skipped.
 */
public class Lexer {

	/** Returned by {@link #peek()} at the end of the buffer. */
	public static final int EOF = -1;

	private final String text;
	private int pos;
	private int line = 1;
	private int column = 1;

	public Lexer(String text) {
		this.text = text;
	}

	/**
	 * @return the character under the cursor, or {@link #EOF}
	 */
	public int peek() {
		return atEnd() ? EOF : text.charAt(pos);
	}

	public boolean atEnd() {
		return pos >= text.length();
	}

	/**
	 * @return line of the cursor, starting at 1
	 */
	public int getLine() {
		return line;
	}

	/**
	 * @return column of the cursor, starting at 1
	 */
	public int getColumn() {
		return column;
	}

	private char read() {
		column++;
		return text.charAt(pos++);
	}

	/**
	 * Skip spaces, tabs and line breaks, keeping track of the line and
	 * column of the cursor.
	 */
	public void skipWhitespace() {
		while (!atEnd()) {
			char c = text.charAt(pos);
			if (c == '\n') {
				read();
				line++;
				column = 1;
			} else if (c == ' ' || c == '\t' || c == '\r') {
				read();
			} else {
				return;
			}
		}
	}

	/**
	 * Reads the next token. Once the buffer is exhausted, every call
	 * returns a {@link TokenKind#EOF} token.
	 *
	 * @return the next token
	 * @throws LexerException on a character that starts no token
	 */
	public Token next() {
		skipWhitespace();
		int startLine = line;
		int startColumn = column;
		if (atEnd()) {
			return new Token(TokenKind.EOF, "eof", 0L, startLine, startColumn);
		}
		char c = text.charAt(pos);
		TokenKind symbol = TokenKind.forSymbol(c);
		if (symbol != null) {
			read();
			return new Token(symbol, String.valueOf(c), 0L, startLine, startColumn);
		}
		if (isDigit(c)) {
			String digits = scan(true);
			long value;
			try {
				value = Long.parseLong(digits);
			} catch (NumberFormatException nfe) {
				throw new LexerException("can't parse " + digits + " as a number", startLine, startColumn);
			}
			return new Token(TokenKind.NUMBER, digits, value, startLine, startColumn);
		}
		if (isLetter(c)) {
			String ident = scan(false);
			TokenKind kind;
			if ("if".equals(ident)) {
				kind = TokenKind.KW_IF;
			} else if ("return".equals(ident)) {
				kind = TokenKind.KW_RETURN;
			} else {
				kind = TokenKind.IDENT;
			}
			return new Token(kind, ident, 0L, startLine, startColumn);
		}
		throw new LexerException("Invalid lexical element starting with " + c, startLine, startColumn);
	}

	private String scan(boolean digits) {
		int start = pos;
		while (!atEnd() && (digits ? isDigit(text.charAt(pos)) : isLetter(text.charAt(pos)))) {
			read();
		}
		return text.substring(start, pos);
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isLetter(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}
}
