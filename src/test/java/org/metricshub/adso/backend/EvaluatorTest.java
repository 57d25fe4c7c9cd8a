package org.metricshub.adso.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import org.junit.Before;
import org.junit.Test;
import org.metricshub.adso.ext.Builtins;
import org.metricshub.adso.frontend.AdsoParser;
import org.metricshub.adso.frontend.Lexer;
import org.metricshub.adso.frontend.ast.BinaryExpression;
import org.metricshub.adso.frontend.ast.BinaryOperator;
import org.metricshub.adso.frontend.ast.FnCall;
import org.metricshub.adso.frontend.ast.FnCallStatement;
import org.metricshub.adso.frontend.ast.Identifier;
import org.metricshub.adso.frontend.ast.IfStatement;
import org.metricshub.adso.frontend.ast.NumberLiteral;
import org.metricshub.adso.frontend.ast.ReturnStatement;
import org.metricshub.adso.frontend.ast.Statement;
import org.metricshub.adso.jrt.TypeMismatchException;
import org.metricshub.adso.jrt.UnboundNameException;
import org.metricshub.adso.jrt.Value;
import org.metricshub.adso.util.AdsoSettings;

public class EvaluatorTest {

	private ByteArrayOutputStream out;
	private Evaluator evaluator;

	@Before
	public void setUp() {
		out = new ByteArrayOutputStream();
		AdsoSettings settings = new AdsoSettings();
		settings.setOutputStream(new PrintStream(out, true));
		evaluator = new Evaluator(settings, Builtins.createTable(null));
	}

	private String output() {
		return new String(out.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
	}

	private static NumberLiteral num(long value) {
		return new NumberLiteral(1, value);
	}

	@Test
	public void testArithmetic() {
		assertEquals(Value.ofInt(42), evaluator.evalValue(new BinaryExpression(1, num(6), BinaryOperator.MULT, num(7))));
		assertEquals(Value.ofInt(-3), evaluator.evalValue(new BinaryExpression(1, num(2), BinaryOperator.MINUS, num(5))));
		assertSame(Value.TRUE, evaluator.evalValue(new BinaryExpression(1, num(2), BinaryOperator.LT, num(5))));
		assertSame(Value.FALSE, evaluator.evalValue(new BinaryExpression(1, num(5), BinaryOperator.LT, num(5))));
	}

	@Test
	public void testComparisonOnTheRightIsNotAnInt() {
		BinaryExpression nested = new BinaryExpression(
				3,
				num(1),
				BinaryOperator.MULT,
				new BinaryExpression(3, num(2), BinaryOperator.LT, num(3)));
		TypeMismatchException e = assertThrows(TypeMismatchException.class, () -> evaluator.evalValue(nested));
		assertEquals("BinExpr *", e.getContext());
		assertEquals("int", e.getExpected());
		assertEquals("bool", e.getActual());
		assertEquals(3, e.getLineNumber());
	}

	@Test
	public void testUnboundIdentifier() {
		UnboundNameException e = assertThrows(
				UnboundNameException.class,
				() -> evaluator.evalValue(new Identifier(4, "ghost")));
		assertEquals("ghost", e.getName());
		assertEquals(4, e.getLineNumber());
	}

	@Test
	public void testFunctionIsNotAValue() {
		TypeMismatchException e = assertThrows(
				TypeMismatchException.class,
				() -> evaluator.evalValue(new Identifier(1, "print")));
		assertEquals("value", e.getExpected());
		assertEquals("function", e.getActual());
	}

	@Test
	public void testReturnShortCircuitsEnclosingStatements() {
		Statement printOne = new FnCallStatement(new FnCall(1, "print", num(1)));
		Statement printTwo = new FnCallStatement(new FnCall(1, "print", num(2)));
		Statement nestedReturn = new IfStatement(
				1,
				new BinaryExpression(1, num(1), BinaryOperator.LT, num(2)),
				Arrays.asList(printOne, new ReturnStatement(1, num(9)), printTwo));

		Completion completion = evaluator.execStatements(Arrays.asList(nestedReturn, printTwo));

		assertTrue(completion.isReturn());
		assertEquals(Value.ofInt(9), completion.getReturnValue());
		assertEquals("1\n", output());
	}

	@Test
	public void testFallThroughCompletesNormally() {
		Statement skipped = new IfStatement(
				1,
				new BinaryExpression(1, num(2), BinaryOperator.LT, num(1)),
				Collections.<Statement>singletonList(new ReturnStatement(1, num(1))));
		Completion completion = evaluator.execStatements(Collections.singletonList(skipped));
		assertFalse(completion.isReturn());
		assertSame(Completion.NORMAL, completion);
	}

	@Test
	public void testIfConditionMustBeBool() {
		Statement statement = new IfStatement(2, num(1), Collections.<Statement>emptyList());
		TypeMismatchException e = assertThrows(TypeMismatchException.class, () -> evaluator.execStatement(statement));
		assertEquals("IfSt", e.getContext());
		assertEquals("bool", e.getExpected());
		assertEquals("int", e.getActual());
	}

	@Test
	public void testInterpretProgram() {
		evaluator
				.interpret(
						new AdsoParser(
								new Lexer(
										"int fact(int n){ if(n<1){return 1;} return n*fact(n-1); }\n"
												+ "void main(){ print(fact(5)); print(fact(0)); }"))
								.parse());
		assertEquals("120\n1\n", output());
	}
}
