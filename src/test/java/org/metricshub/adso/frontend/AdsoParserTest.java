package org.metricshub.adso.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;
import org.metricshub.adso.frontend.ast.BinaryExpression;
import org.metricshub.adso.frontend.ast.BinaryOperator;
import org.metricshub.adso.frontend.ast.FnCall;
import org.metricshub.adso.frontend.ast.FnCallStatement;
import org.metricshub.adso.frontend.ast.FnDef;
import org.metricshub.adso.frontend.ast.Identifier;
import org.metricshub.adso.frontend.ast.IfStatement;
import org.metricshub.adso.frontend.ast.NumberLiteral;
import org.metricshub.adso.frontend.ast.Program;
import org.metricshub.adso.frontend.ast.ReturnStatement;

public class AdsoParserTest {

	private static final String FACTORIAL = "int fact(int n){ if(n<1){return 1;} return n*fact(n-1); }\n"
			+ "void main(){ print(fact(5)); }";

	private static Program parse(String text) {
		return new AdsoParser(new Lexer(text)).parse();
	}

	@Test
	public void testFactorialTree() {
		Program program = parse(FACTORIAL);
		assertEquals(2, program.getFunctions().size());

		FnDef fact = program.getFunctions().get(0);
		assertEquals("int", fact.getReturnType());
		assertEquals("fact", fact.getName());
		assertEquals("int", fact.getParamType());
		assertEquals("n", fact.getParamName());
		assertEquals(2, fact.getBody().size());

		IfStatement ifSt = (IfStatement) fact.getBody().get(0);
		assertEquals(
				new BinaryExpression(-1, new Identifier(-1, "n"), BinaryOperator.LT, new NumberLiteral(-1, 1)),
				ifSt.getCondition());
		assertEquals(Collections.singletonList(new ReturnStatement(-1, new NumberLiteral(-1, 1))), ifSt.getBody());

		ReturnStatement ret = (ReturnStatement) fact.getBody().get(1);
		BinaryExpression product = (BinaryExpression) ret.getValue();
		assertEquals(BinaryOperator.MULT, product.getOperator());
		assertEquals(new Identifier(-1, "n"), product.getLeft());
		FnCall recursive = (FnCall) product.getRight();
		assertEquals("fact", recursive.getName());
		assertEquals(
				new BinaryExpression(-1, new Identifier(-1, "n"), BinaryOperator.MINUS, new NumberLiteral(-1, 1)),
				recursive.getArg());

		FnDef main = program.getFunctions().get(1);
		assertFalse(main.hasParameter());
		assertNull(main.getParamType());
		assertEquals(2, main.getLineNo());
		FnCallStatement print = (FnCallStatement) main.getBody().get(0);
		assertEquals("print", print.getCall().getName());
	}

	@Test
	public void testBinaryExpressionNestsToTheRight() {
		Program program = parse("void main() { print(10 - 3 - 2); }");
		FnCallStatement st = (FnCallStatement) program.getFunctions().get(0).getBody().get(0);
		BinaryExpression outer = (BinaryExpression) st.getCall().getArg();
		assertEquals(new NumberLiteral(-1, 10), outer.getLeft());
		assertEquals(
				new BinaryExpression(-1, new NumberLiteral(-1, 3), BinaryOperator.MINUS, new NumberLiteral(-1, 2)),
				outer.getRight());
	}

	@Test
	public void testLeftOperandMustBeAtom() {
		assertThrows(
				IllegalArgumentException.class,
				() -> new BinaryExpression(
						-1,
						new FnCall(-1, "f", null),
						BinaryOperator.MULT,
						new NumberLiteral(-1, 2)));
	}

	@Test
	public void testParameterTypeAndNameGoTogether() {
		assertThrows(
				IllegalArgumentException.class,
				() -> new FnDef(-1, "int", "f", "int", null, Collections.emptyList()));
	}

	@Test
	public void testLookaheadSkipsWhitespace() {
		Program compact = parse("void main(){print(f(n*2));}");
		Program spaced = parse("void main ( ) {\n\tprint (\n f  (n\n *\t2 ) ) ;\n}\n");
		assertEquals(compact, spaced);
		FnCall print = ((FnCallStatement) spaced.getFunctions().get(0).getBody().get(0)).getCall();
		assertTrue(print.getArg() instanceof FnCall);
	}

	@Test
	public void testEmptyCall() {
		Program program = parse("void main() { hello(); }");
		FnCall call = ((FnCallStatement) program.getFunctions().get(0).getBody().get(0)).getCall();
		assertEquals("hello", call.getName());
		assertFalse(call.hasArg());
	}

	@Test
	public void testRoundTrip() {
		Program program = parse(FACTORIAL);
		String source = program.toSource();
		assertEquals(
				"int fact(int n) {\n"
						+ "\tif (n < 1) {\n"
						+ "\t\treturn 1;\n"
						+ "\t}\n"
						+ "\treturn n * fact(n - 1);\n"
						+ "}\n"
						+ "\n"
						+ "void main() {\n"
						+ "\tprint(fact(5));\n"
						+ "}\n",
				source);
		assertEquals(program, parse(source));
	}

	@Test
	public void testRoundTripOfNestedStatements() {
		for (String text : Arrays
				.asList(
						"bool f(int x) { if (x < 3) { if (1 < x) { g(x * x - 1); } return x < 2; } }",
						"void main() { a(); b(c(d(1))); return 7 - x * y < z; }",
						"int a() { } int b(bool z) { if (z) { } }")) {
			Program program = parse(text);
			assertEquals(text, program, parse(program.toSource()));
		}
	}

	@Test
	public void testDump() {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		parse("void main() { print(n < 1); }").dump(new PrintStream(out, true));
		assertEquals(
				"Program\n FnDef void main()\n  FnCallSt\n   FnCall print\n    BinExpr <\n     Ident n\n     Number 1\n",
				new String(out.toByteArray(), StandardCharsets.UTF_8));
	}

	private static ParserException parseError(String text) {
		return assertThrows(ParserException.class, () -> parse(text));
	}

	private static String repeat(String text, int count) {
		StringBuilder sb = new StringBuilder(text.length() * count);
		for (int i = 0; i < count; i++) {
			sb.append(text);
		}
		return sb.toString();
	}

	@Test
	public void testDeepExpressionNesting() {
		ParserException e = parseError("void main() { print(" + repeat("1-", 200000) + "1); }");
		assertEquals("Program", e.getContext());
		assertEquals(1, e.getLineNumber());
		assertTrue(e.getMessage(), e.getMessage().startsWith("failed to parse Program: nesting too deep at 1:"));
		assertTrue(e.getCause() instanceof StackOverflowError);
	}

	@Test
	public void testDeepIfNesting() {
		ParserException e = parseError("void main() {\n" + repeat("if (1 < 2) { ", 200000) + repeat("} ", 200000) + "}");
		assertEquals("Program", e.getContext());
		assertEquals(2, e.getLineNumber());
	}

	@Test
	public void testEmptyProgram() {
		ParserException e = parseError("");
		assertEquals("FnDef", e.getContext());
		assertEquals("ident", e.getExpected());
		assertEquals("eof", e.getFound());
	}

	@Test
	public void testFnDefError() {
		ParserException e = parseError("int f( { }");
		assertEquals("FnDef", e.getContext());
		assertEquals("ident", e.getExpected());
		assertEquals("'{'", e.getFound());
		assertEquals(1, e.getLineNumber());
		assertEquals(8, e.getColumn());
	}

	@Test
	public void testIfStError() {
		ParserException e = parseError("void main() {\n  if n { }\n}");
		assertEquals("IfSt", e.getContext());
		assertEquals("(", e.getExpected());
		assertEquals("ident(n)", e.getFound());
		assertEquals(2, e.getLineNumber());
		assertEquals(6, e.getColumn());
	}

	@Test
	public void testReturnStError() {
		ParserException e = parseError("int main() { return 1 }");
		assertEquals("ReturnSt", e.getContext());
		assertEquals(";", e.getExpected());
		assertEquals("'}'", e.getFound());
	}

	@Test
	public void testStatementError() {
		assertEquals("St", parseError("void main() { 5; }").getContext());
		assertEquals("St", parseError("void main() { print(1) }").getContext());
		assertEquals("St", parseError("void main() { print(1);").getContext());
	}

	@Test
	public void testFnCallError() {
		ParserException e = parseError("void main() { print(5 6); }");
		assertEquals("FnCall", e.getContext());
		assertEquals(")", e.getExpected());
		assertEquals("number(6)", e.getFound());
		assertEquals("a number cannot be called", "FnCall", parseError("void main() { print(5(1)); }").getContext());
	}

	@Test
	public void testExpressionError() {
		ParserException e = parseError("void main() { print(*); }");
		assertEquals("Expr", e.getContext());
		assertEquals("'*'", e.getFound());
	}

	@Test
	public void testLexerErrorPropagates() {
		assertThrows(LexerException.class, () -> parse("void main() { print(1 + 2); }"));
	}
}
