package org.metricshub.adso.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.metricshub.adso.jrt.Value;

public class OperandStackTest {

	@Test
	public void testLastInFirstOut() {
		OperandStack stack = new OperandStack();
		stack.push(Value.ofInt(1));
		stack.push(Value.TRUE);
		assertEquals(2, stack.size());
		assertEquals(Value.TRUE, stack.pop());
		assertEquals(Value.ofInt(1), stack.pop());
		assertEquals(0, stack.size());
	}

	@Test
	public void testUnderflow() {
		OperandStack stack = new OperandStack();
		IllegalStateException e = assertThrows(IllegalStateException.class, stack::pop);
		assertEquals("Operand stack underflow", e.getMessage());
	}

	@Test
	public void testClear() {
		OperandStack stack = new OperandStack();
		stack.push(Value.ofInt(3));
		stack.push(Value.ofInt(4));
		stack.clear();
		assertEquals(0, stack.size());
	}
}
