package org.metricshub.adso.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;

public class LexerTest {

	private static List<TokenKind> kinds(String text) {
		Lexer lexer = new Lexer(text);
		List<TokenKind> kinds = new ArrayList<>();
		Token token;
		do {
			token = lexer.next();
			kinds.add(token.getKind());
		} while (!token.is(TokenKind.EOF));
		return kinds;
	}

	@Test
	public void testIfStatementTokens() {
		assertEquals(
				Arrays
						.asList(
								TokenKind.KW_IF,
								TokenKind.OPEN_PAREN,
								TokenKind.IDENT,
								TokenKind.LT,
								TokenKind.NUMBER,
								TokenKind.CLOSE_PAREN,
								TokenKind.OPEN_BRACE,
								TokenKind.KW_RETURN,
								TokenKind.NUMBER,
								TokenKind.SEMICOLON,
								TokenKind.CLOSE_BRACE,
								TokenKind.EOF),
				kinds("if (n < 1) { return 1; }"));
	}

	@Test
	public void testAllSymbols() {
		assertEquals(
				Arrays
						.asList(
								TokenKind.OPEN_PAREN,
								TokenKind.CLOSE_PAREN,
								TokenKind.OPEN_BRACE,
								TokenKind.CLOSE_BRACE,
								TokenKind.SEMICOLON,
								TokenKind.LT,
								TokenKind.MULT,
								TokenKind.MINUS,
								TokenKind.EOF),
				kinds("(){};<*-"));
	}

	@Test
	public void testIdentifiersAndNumbers() {
		Lexer lexer = new Lexer("fact 120 iff returned n-1");
		Token fact = lexer.next();
		assertEquals(TokenKind.IDENT, fact.getKind());
		assertEquals("fact", fact.getText());
		Token number = lexer.next();
		assertEquals(TokenKind.NUMBER, number.getKind());
		assertEquals(120L, number.getNumber());
		assertEquals("keywords must match exactly", TokenKind.IDENT, lexer.next().getKind());
		assertEquals("keywords must match exactly", TokenKind.IDENT, lexer.next().getKind());
		assertEquals("n", lexer.next().getText());
		assertEquals(TokenKind.MINUS, lexer.next().getKind());
		assertEquals(1L, lexer.next().getNumber());
	}

	@Test
	public void testDigitsAndLettersSplit() {
		assertEquals(Arrays.asList(TokenKind.NUMBER, TokenKind.IDENT, TokenKind.NUMBER, TokenKind.EOF), kinds("12ab3"));
	}

	@Test
	public void testPositions() {
		Lexer lexer = new Lexer("int x\n\t  foo");
		Token first = lexer.next();
		assertEquals(1, first.getLine());
		assertEquals(1, first.getColumn());
		Token second = lexer.next();
		assertEquals(1, second.getLine());
		assertEquals(5, second.getColumn());
		Token third = lexer.next();
		assertEquals(2, third.getLine());
		assertEquals(4, third.getColumn());
	}

	@Test
	public void testCarriageReturnIsWhitespace() {
		Lexer lexer = new Lexer("int x\r\n  foo");
		lexer.next();
		lexer.next();
		Token third = lexer.next();
		assertEquals(TokenKind.IDENT, third.getKind());
		assertEquals(2, third.getLine());
		assertEquals(3, third.getColumn());
		assertEquals(TokenKind.EOF, lexer.next().getKind());
	}

	@Test
	public void testEofIsRepeated() {
		Lexer lexer = new Lexer("  \n ");
		assertEquals(TokenKind.EOF, lexer.next().getKind());
		assertEquals(TokenKind.EOF, lexer.next().getKind());
		assertEquals(TokenKind.EOF, lexer.next().getKind());
		assertTrue(lexer.atEnd());
		assertEquals(Lexer.EOF, lexer.peek());
	}

	@Test
	public void testPeekDoesNotConsume() {
		Lexer lexer = new Lexer("f  (");
		lexer.next();
		assertEquals(' ', lexer.peek());
		lexer.skipWhitespace();
		assertEquals('(', lexer.peek());
		assertFalse(lexer.atEnd());
		assertEquals(TokenKind.OPEN_PAREN, lexer.next().getKind());
	}

	@Test
	public void testInvalidCharacter() {
		Lexer lexer = new Lexer("int main() { @ }");
		for (int i = 0; i < 5; i++) {
			lexer.next();
		}
		LexerException e = assertThrows(LexerException.class, lexer::next);
		assertEquals(1, e.getLineNumber());
		assertEquals(14, e.getColumn());
		assertTrue(e.getMessage(), e.getMessage().contains("@"));
	}

	@Test
	public void testNumberOverflow() {
		LexerException e = assertThrows(LexerException.class, () -> new Lexer("99999999999999999999").next());
		assertTrue(e.getMessage(), e.getMessage().contains("99999999999999999999"));
	}

	@Test
	public void testTokenToString() {
		Lexer lexer = new Lexer("n 5 ;");
		assertEquals("ident(n)", lexer.next().toString());
		assertEquals("number(5)", lexer.next().toString());
		assertEquals("';'", lexer.next().toString());
		assertEquals("eof", lexer.next().toString());
	}
}
