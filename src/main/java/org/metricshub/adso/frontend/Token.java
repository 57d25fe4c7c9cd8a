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

import java.util.Objects;

/**
 * A lexical token with the position (1-based line and column) of its
 * first character.
 */
public final class Token {

	private final TokenKind kind;
	private final String text;
	private final long number;
	private final int line;
	private final int column;

	Token(TokenKind kind, String text, long number, int line, int column) {
		this.kind = kind;
		this.text = text;
		this.number = number;
		this.line = line;
		this.column = column;
	}

	public TokenKind getKind() {
		return kind;
	}

	/**
	 * @return the lexeme as it appears in the source
	 */
	public String getText() {
		return text;
	}

	/**
	 * @return the literal value of a {@link TokenKind#NUMBER} token
	 */
	public long getNumber() {
		return number;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	public boolean is(TokenKind expected) {
		return kind == expected;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Token)) {
			return false;
		}
		Token other = (Token) o;
		return kind == other.kind
				&& number == other.number
				&& line == other.line
				&& column == other.column
				&& Objects.equals(text, other.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, text, number, line, column);
	}

	@Override
	public String toString() {
		switch (kind) {
		case IDENT:
		case NUMBER:
			return kind.getDisplay() + "(" + text + ")";
		case EOF:
			return kind.getDisplay();
		default:
			return "'" + text + "'";
		}
	}
}
