package org.metricshub.adso.backend;

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

import java.util.List;
import java.util.Map;
import org.metricshub.adso.ext.BuiltinFunction;
import org.metricshub.adso.frontend.ast.AstVisitor;
import org.metricshub.adso.frontend.ast.BinaryExpression;
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
import org.metricshub.adso.jrt.ArithmeticOverflowException;
import org.metricshub.adso.jrt.ArityOrTypeException;
import org.metricshub.adso.jrt.CallDepthExceededException;
import org.metricshub.adso.jrt.NotCallableException;
import org.metricshub.adso.jrt.TypeMismatchException;
import org.metricshub.adso.jrt.Value;
import org.metricshub.adso.jrt.ValueType;
import org.metricshub.adso.util.AdsoLogger;
import org.metricshub.adso.util.AdsoSettings;
import org.slf4j.Logger;

/**
 * Tree-walking evaluator of Adso programs.
 * <p>
 * Expressions leave exactly one value on the operand stack. Statements
 * report whether a <code>return</code> ended the enclosing function
 * through a {@link Completion}, which the call that runs the function body
 * consumes. Each call runs in its own scope whose parent is the root scope,
 * and the body of a taken <code>if</code> in a child of the current scope.
 * <p>
 * An evaluator holds the state of one execution and is not thread-safe.
 */
public class Evaluator implements AdsoInterpreter {

	private static final Logger LOG = AdsoLogger.getLogger(Evaluator.class);

	private final AdsoSettings settings;
	private final ScopeChain scopes = new ScopeChain();
	private final OperandStack stack = new OperandStack();
	private final ExpressionVisitor expressionVisitor = new ExpressionVisitor();
	private final StatementVisitor statementVisitor = new StatementVisitor();
	private int callDepth;

	/**
	 * @param settings output stream and limits of the execution
	 * @param builtins built-in functions to bind in the root scope, by name
	 */
	public Evaluator(AdsoSettings settings, Map<String, BuiltinFunction> builtins) {
		this.settings = settings;
		for (BuiltinFunction builtin : builtins.values()) {
			scopes.define(builtin.getName(), Binding.of(builtin));
		}
	}

	/** {@inheritDoc} */
	@Override
	public void interpret(Program program) {
		for (FnDef fnDef : program.getFunctions()) {
			scopes.define(fnDef.getName(), Binding.of(fnDef));
		}
		LOG.debug("Bound {} function definitions, calling {}", program.getFunctions().size(), settings.getEntryPoint());
		if (LOG.isDebugEnabled()) {
			LOG.debug("Settings:\n{}", settings.toDescriptionString());
		}

		FnCall entryCall = new FnCall(-1, settings.getEntryPoint(), null);
		try {
			call(entryCall);
		} catch (StackOverflowError e) {
			throw new CallDepthExceededException(entryCall.getName(), settings.getMaxCallDepth(), e);
		} finally {
			stack.clear();
		}
		LOG.debug("{} completed", entryCall.getName());
	}

	/**
	 * Evaluates an expression and pushes its value on the operand stack.
	 */
	void evalExpr(Expression expression) {
		expression.accept(expressionVisitor);
	}

	/**
	 * Evaluates an expression and returns its value.
	 */
	Value evalValue(Expression expression) {
		evalExpr(expression);
		return stack.pop();
	}

	Completion execStatement(Statement statement) {
		return statement.accept(statementVisitor);
	}

	/**
	 * Executes statements in order, stopping at the first <code>return</code>.
	 */
	Completion execStatements(List<Statement> statements) {
		for (Statement statement : statements) {
			Completion completion = execStatement(statement);
			if (completion.isReturn()) {
				return completion;
			}
		}
		return Completion.NORMAL;
	}

	/**
	 * Calls a user function or a built-in.
	 *
	 * @param fnCall the call
	 * @return the result of the call, or {@code null} if it yields no value
	 */
	Value call(FnCall fnCall) {
		String name = fnCall.getName();
		int line = fnCall.getLineNo();
		Binding callee = scopes.lookup(name, line);
		if (!callee.isCallable()) {
			throw new NotCallableException(line, name);
		}
		Value argument = fnCall.hasArg() ? evalValue(fnCall.getArg()) : null;
		String parameterType;
		if (callee.getKind() == Binding.Kind.FUNCTION) {
			parameterType = callee.getFunction().getParamType();
		} else {
			ValueType type = callee.getBuiltin().getParameterType();
			parameterType = type == null ? null : type.getTypeName();
		}
		checkArgument(line, name, parameterType, argument);

		if (callDepth >= settings.getMaxCallDepth()) {
			throw new CallDepthExceededException(line, name, settings.getMaxCallDepth());
		}
		callDepth++;
		LOG.trace("Calling {} with {} at depth {} ({} scopes)", name, argument, callDepth, scopes.depth());
		scopes.pushCallScope();
		try {
			if (callee.getKind() == Binding.Kind.BUILTIN) {
				return callee.getBuiltin().invoke(argument, settings);
			}
			FnDef function = callee.getFunction();
			if (argument != null) {
				scopes.define(function.getParamName(), Binding.of(argument));
			}
			Completion completion = execStatements(function.getBody());
			return completion.isReturn() ? completion.getReturnValue() : null;
		} finally {
			scopes.pop();
			callDepth--;
		}
	}

	private static void checkArgument(int line, String function, String parameterType, Value argument) {
		String actual = argument == null ? ArityOrTypeException.NONE : argument.getType().getTypeName();
		if (parameterType == null) {
			if (argument != null) {
				throw new ArityOrTypeException(line, function, ArityOrTypeException.NONE, actual);
			}
		} else if (!parameterType.equals(actual)) {
			throw new ArityOrTypeException(line, function, parameterType, actual);
		}
	}

	private static long intOperand(int line, String context, Value value) {
		if (!value.isInt()) {
			throw new TypeMismatchException(line, context, ValueType.INT.getTypeName(), value.getType().getTypeName());
		}
		return value.asInt();
	}

	/**
	 * Pushes the value of each expression on the operand stack.
	 */
	private final class ExpressionVisitor implements AstVisitor<Void> {

		@Override
		public Void visitNumberLiteral(NumberLiteral literal) {
			stack.push(Value.ofInt(literal.getValue()));
			return null;
		}

		@Override
		public Void visitIdentifier(Identifier identifier) {
			Binding binding = scopes.lookup(identifier.getName(), identifier.getLineNo());
			if (binding.isCallable()) {
				throw new TypeMismatchException(identifier.getLineNo(), "Ident " + identifier.getName(), "value", binding.describeType());
			}
			stack.push(binding.getValue());
			return null;
		}

		@Override
		public Void visitFnCall(FnCall fnCall) {
			Value result = call(fnCall);
			if (result == null) {
				throw new TypeMismatchException(fnCall.getLineNo(), "FnCall " + fnCall.getName(), "value", "void");
			}
			stack.push(result);
			return null;
		}

		@Override
		public Void visitBinaryExpression(BinaryExpression expression) {
			int line = expression.getLineNo();
			String context = "BinExpr " + expression.getOperator().getSymbol();
			long left = intOperand(line, context, evalValue(expression.getLeft()));
			long right = intOperand(line, context, evalValue(expression.getRight()));
			try {
				switch (expression.getOperator()) {
				case LT:
					stack.push(Value.ofBool(left < right));
					break;
				case MULT:
					stack.push(Value.ofInt(Math.multiplyExact(left, right)));
					break;
				case MINUS:
					stack.push(Value.ofInt(Math.subtractExact(left, right)));
					break;
				default:
					throw new IllegalStateException("Unknown operator " + expression.getOperator());
				}
			} catch (ArithmeticException e) {
				throw new ArithmeticOverflowException(line, expression.getOperator().getSymbol(), left, right, e);
			}
			return null;
		}

		@Override
		public Void visitProgram(Program program) {
			throw new IllegalStateException("Not an expression: " + program);
		}

		@Override
		public Void visitFnDef(FnDef fnDef) {
			throw new IllegalStateException("Not an expression: " + fnDef);
		}

		@Override
		public Void visitIfStatement(IfStatement statement) {
			throw new IllegalStateException("Not an expression: " + statement);
		}

		@Override
		public Void visitReturnStatement(ReturnStatement statement) {
			throw new IllegalStateException("Not an expression: " + statement);
		}

		@Override
		public Void visitFnCallStatement(FnCallStatement statement) {
			throw new IllegalStateException("Not an expression: " + statement);
		}
	}

	/**
	 * Executes statements.
	 */
	private final class StatementVisitor implements AstVisitor<Completion> {

		@Override
		public Completion visitIfStatement(IfStatement statement) {
			Value condition = evalValue(statement.getCondition());
			if (!condition.isBool()) {
				throw new TypeMismatchException(statement.getLineNo(), "IfSt", ValueType.BOOL.getTypeName(), condition.getType().getTypeName());
			}
			if (condition.asBool()) {
				scopes.pushChild();
				try {
					return execStatements(statement.getBody());
				} finally {
					scopes.pop();
				}
			}
			return Completion.NORMAL;
		}

		@Override
		public Completion visitReturnStatement(ReturnStatement statement) {
			return Completion.returned(evalValue(statement.getValue()));
		}

		@Override
		public Completion visitFnCallStatement(FnCallStatement statement) {
			call(statement.getCall());
			return Completion.NORMAL;
		}

		@Override
		public Completion visitProgram(Program program) {
			throw new IllegalStateException("Not a statement: " + program);
		}

		@Override
		public Completion visitFnDef(FnDef fnDef) {
			throw new IllegalStateException("Not a statement: " + fnDef);
		}

		@Override
		public Completion visitNumberLiteral(NumberLiteral literal) {
			throw new IllegalStateException("Not a statement: " + literal);
		}

		@Override
		public Completion visitIdentifier(Identifier identifier) {
			throw new IllegalStateException("Not a statement: " + identifier);
		}

		@Override
		public Completion visitFnCall(FnCall fnCall) {
			throw new IllegalStateException("Not a statement: " + fnCall);
		}

		@Override
		public Completion visitBinaryExpression(BinaryExpression expression) {
			throw new IllegalStateException("Not a statement: " + expression);
		}
	}
}
