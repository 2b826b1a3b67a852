package org.metricshub.peek.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;

public class ConsumerStackTest {

	@Test
	public void testValuesGoToTheTopTarget() {
		ConsumerStack stack = new ConsumerStack();
		List<Object> outer = new ArrayList<Object>();
		List<Object> inner = new ArrayList<Object>();
		stack.push(outer::add);
		stack.consume("a");
		stack.push(inner::add);
		stack.consume(1L);
		stack.consume(null);
		stack.pop();
		stack.consume(inner);
		stack.pop();
		assertEquals(Arrays.<Object>asList("a", Arrays.asList(1L, null)), outer);
	}

	@Test
	public void testNoTarget() {
		ConsumerStack stack = new ConsumerStack();
		stack.push(value -> {});
		stack.pop();
		IllegalStateException e = assertThrows(IllegalStateException.class, () -> stack.consume("lost"));
		assertEquals("No target for value lost", e.getMessage());
	}
}
