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

/** Lexer token kinds. */
public enum TokenKind {
	EOF("eof"),
	IDENT("ident"),
	NUMBER("number"),

	KW_IF("if"),
	KW_RETURN("return"),

	OPEN_PAREN("("),
	CLOSE_PAREN(")"),
	OPEN_BRACE("{"),
	CLOSE_BRACE("}"),
	SEMICOLON(";"),
	LT("<"),
	MULT("*"),
	MINUS("-");

	private final String display;

	TokenKind(String display) {
		this.display = display;
	}

	/**
	 * @return the symbol or keyword itself, or the class name for
	 *         identifiers, numbers and end of input
	 */
	public String getDisplay() {
		return display;
	}

	/**
	 * Returns the kind of the single-character symbol, if it is one.
	 *
	 * @param c a character
	 * @return the symbol kind, or {@code null}
	 */
	static TokenKind forSymbol(char c) {
		switch (c) {
		case '(':
			return OPEN_PAREN;
		case ')':
			return CLOSE_PAREN;
		case '{':
			return OPEN_BRACE;
		case '}':
			return CLOSE_BRACE;
		case ';':
			return SEMICOLON;
		case '<':
			return LT;
		case '*':
			return MULT;
		case '-':
			return MINUS;
		default:
			return null;
		}
	}
}
