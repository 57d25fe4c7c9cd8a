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

import java.util.ArrayList;
import java.util.List;
import org.metricshub.adso.frontend.ast.BinaryExpression;
import org.metricshub.adso.frontend.ast.BinaryOperator;
import org.metricshub.adso.frontend.ast.Expression;
import org.metricshub.adso.frontend.ast.FnCall;
import org.metricshub.adso.frontend.ast.FnCallStatement;
import org.metricshub.adso.frontend.ast.FnDef;
import org.metricshub.adso.frontend.ast.Identifier;
import org.metricshub.adso.frontend.ast.IfStatement;
import org.metricshub.adso.frontend.ast.NumberLiteral;
import org.metricshub.adso.frontend.ast.Program;
import org.metricshub.adso.frontend.ast.ReturnStatement;
import org.metricshub.adso.frontend.ast.Statement;

/**
 * Recursive descent parser of Adso programs.
 * <p>
 * Grammar:
 *
 * <pre>
 * program     := fn_def+
 * fn_def      := ident ident '(' (ident ident)? ')' '{' stmt* '}'
 * stmt        := if_st | return_st | fn_call ';'
 * if_st       := 'if' '(' expr ')' '{' stmt* '}'
 * return_st   := 'return' expr ';'
 * fn_call     := ident '(' expr? ')'
 * expr        := (number | ident) [ fn_call_tail | bin_op_tail ]
 * bin_op_tail := ('*'|'-'|'&lt;') expr
 * </pre>
 *
 * Once an atom of an expression has been read, the next raw character
 * (after whitespace) decides how the expression continues. The parser never
 * backtracks: the first token that does not fit raises a
 * {@link ParserException} naming the production being parsed.
 */
public class AdsoParser {

	private final Lexer lexer;

	public AdsoParser(Lexer lexer) {
		this.lexer = lexer;
	}

	/**
	 * Parses the whole token stream.
	 *
	 * @return the syntax tree
	 * @throws LexerException on an invalid character
	 * @throws ParserException on the first token that does not fit the grammar,
	 *         or when expressions or <code>if</code> bodies nest deeper than the
	 *         thread stack allows
	 */
	public Program parse() {
		try {
			return PROGRAM();
		} catch (StackOverflowError e) {
			throw new ParserException("Program", lexer.getLine(), lexer.getColumn(), e);
		}
	}

	/**
	 * @return the next raw character after whitespace, or {@link Lexer#EOF}
	 */
	private int peek() {
		lexer.skipWhitespace();
		return lexer.peek();
	}

	private Token eat(String context, TokenKind expected) {
		Token token = lexer.next();
		if (!token.is(expected)) {
			throw new ParserException(context, expected.getDisplay(), token);
		}
		return token;
	}

	private String ident(String context) {
		return eat(context, TokenKind.IDENT).getText();
	}

	private List<Statement> statementsUntilCloseBrace() {
		List<Statement> statements = new ArrayList<>();
		while (peek() != '}') {
			statements.add(STATEMENT());
		}
		return statements;
	}

	// RECURSIVE DECENT PARSER:
	// CHECKSTYLE.OFF: MethodName
	// PROGRAM : FN_DEF+ Token.EOF
	Program PROGRAM() {
		List<FnDef> functions = new ArrayList<>();
		do {
			functions.add(FN_DEF());
		} while (peek() != Lexer.EOF);
		return new Program(functions);
	}

	// FN_DEF : ident ident ( [ident ident] ) { STATEMENT* }
	FnDef FN_DEF() {
		Token returnType = eat("FnDef", TokenKind.IDENT);
		String name = ident("FnDef");
		eat("FnDef", TokenKind.OPEN_PAREN);
		String paramType = null;
		String paramName = null;
		if (peek() != ')') {
			paramType = ident("FnDef");
			paramName = ident("FnDef");
		}
		eat("FnDef", TokenKind.CLOSE_PAREN);
		eat("FnDef", TokenKind.OPEN_BRACE);
		List<Statement> body = statementsUntilCloseBrace();
		eat("FnDef", TokenKind.CLOSE_BRACE);
		return new FnDef(returnType.getLine(), returnType.getText(), name, paramType, paramName, body);
	}

	// STATEMENT : IF_STATEMENT | RETURN_STATEMENT | FN_CALL ;
	Statement STATEMENT() {
		Token token = lexer.next();
		switch (token.getKind()) {
		case KW_IF:
			return IF_STATEMENT(token);
		case KW_RETURN:
			return RETURN_STATEMENT(token);
		case IDENT:
			FnCall call = FN_CALL(token);
			eat("St", TokenKind.SEMICOLON);
			return new FnCallStatement(call);
		default:
			throw new ParserException("St", "statement", token);
		}
	}

	// IF_STATEMENT : if ( EXPRESSION ) { STATEMENT* }
	IfStatement IF_STATEMENT(Token keyword) {
		eat("IfSt", TokenKind.OPEN_PAREN);
		Expression condition = EXPRESSION();
		eat("IfSt", TokenKind.CLOSE_PAREN);
		eat("IfSt", TokenKind.OPEN_BRACE);
		List<Statement> body = statementsUntilCloseBrace();
		eat("IfSt", TokenKind.CLOSE_BRACE);
		return new IfStatement(keyword.getLine(), condition, body);
	}

	// RETURN_STATEMENT : return EXPRESSION ;
	ReturnStatement RETURN_STATEMENT(Token keyword) {
		Expression value = EXPRESSION();
		eat("ReturnSt", TokenKind.SEMICOLON);
		return new ReturnStatement(keyword.getLine(), value);
	}

	// FN_CALL : name ( [EXPRESSION] )
	FnCall FN_CALL(Token name) {
		eat("FnCall", TokenKind.OPEN_PAREN);
		Expression arg = null;
		if (peek() != ')') {
			arg = EXPRESSION();
		}
		eat("FnCall", TokenKind.CLOSE_PAREN);
		return new FnCall(name.getLine(), name.getText(), arg);
	}

	// EXPRESSION : (number | ident) [ FN_CALL tail | BIN_EXPRESSION tail ]
	Expression EXPRESSION() {
		Token token = lexer.next();
		Expression atom;
		if (token.is(TokenKind.IDENT)) {
			if (peek() == '(') {
				return FN_CALL(token);
			}
			atom = new Identifier(token.getLine(), token.getText());
		} else if (token.is(TokenKind.NUMBER)) {
			atom = new NumberLiteral(token.getLine(), token.getNumber());
		} else {
			throw new ParserException("Expr", "expression", token);
		}
		int c = peek();
		if (c == '*' || c == '-' || c == '<') {
			return BIN_EXPRESSION(atom);
		}
		return atom;
	}

	// BIN_EXPRESSION : atom (* | - | <) EXPRESSION
	BinaryExpression BIN_EXPRESSION(Expression left) {
		Token token = lexer.next();
		BinaryOperator operator;
		switch (token.getKind()) {
		case MULT:
			operator = BinaryOperator.MULT;
			break;
		case MINUS:
			operator = BinaryOperator.MINUS;
			break;
		case LT:
			operator = BinaryOperator.LT;
			break;
		default:
			throw new ParserException("BinExpr", "operator", token);
		}
		return new BinaryExpression(left.getLineNo(), left, operator, EXPRESSION());
	}
	// CHECKSTYLE.ON MethodName
}
