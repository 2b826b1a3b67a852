package org.metricshub.peek.ext;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;
import org.junit.Test;
import org.metricshub.peek.PeekTestSupport;
import org.metricshub.peek.ext.annotations.PeekExport;
import org.metricshub.peek.ext.annotations.PeekKeywordArgs;

/**
 * Tests the integration of {@link PeekExtension} implementations with the
 * session.
 */
public class ExtensionTest {

	/** Keyword arguments must be received as a map */
	public static class InvalidExtension extends AbstractExtension {
		@PeekExport("invalid")
		public String invalid(@PeekKeywordArgs String kwargs) {
			return kwargs;
		}
	}

	@Test
	public void testExports() {
		TestExtension extension = new TestExtension();
		Map<String, Object> exports = extension.getExports();
		assertEquals(
				Arrays.asList("add", "concat", "count_connections", "explode", "answer"),
				new ArrayList<String>(exports.keySet()));
		assertEquals("<function add of TestExtension>", exports.get("add").toString());
		ExtensionFunction concat = (ExtensionFunction) exports.get("concat");
		assertEquals(0, concat.getArity());
		assertTrue(concat.isVarArgs());
	}

	@Test
	public void testInvocation() {
		PeekTestSupport
				.peekTest("extension invocation")
				.withExtensions(new TestExtension())
				.connections(2)
				.script("add 40 2\nconcat 'a' \"b\" prefix='>'\nconcat\ncount_connections")
				.expectInfo(Long.valueOf(42), ">ab", "", Integer.valueOf(2))
				.runAndAssert();
	}

	@Test
	public void testArgumentCountIsVerified() {
		PeekTestSupport
				.peekTest("argument count")
				.withExtensions(new TestExtension())
				.script("add 1\nexplode 1")
				.expectErrors("Function 'add' expects 2 argument(s), not 1", "Function 'explode' expects 0 argument(s), not 1")
				.runAndAssert();
	}

	@Test
	public void testKeywordArgumentsMustBeAccepted() {
		PeekTestSupport
				.peekTest("keyword arguments")
				.withExtensions(new TestExtension())
				.script("add 1 2 x=1")
				.expectErrors("Function 'add' does not accept keyword arguments: [x]")
				.runAndAssert();
	}

	@Test
	public void testArgumentTypesAreVerified() {
		PeekTestSupport
				.peekTest("argument types")
				.withExtensions(new TestExtension())
				.script("add 'a' 2\nconcat 'a' 1\nadd null 1")
				.expectErrors(
						"Argument 0 passed to 'add' must be a long, not a String",
						"Argument 1 passed to 'concat' must be a String, not a Long",
						"Argument 0 passed to 'add' must not be null")
				.runAndAssert();
	}

	@Test
	public void testTextExtension() {
		PeekTestSupport
				.peekTest("text extension")
				.withExtensions(TextExtension.INSTANCE)
				.script("echo 1 'two' [3] sep=\", \"\necho\njson {\"a\": [1, 'x', null]}")
				.expectInfo("1, two, [3]", "", "{\"a\":[1,\"x\",null]}")
				.runAndAssert();
	}

	@Test
	public void testInvalidKeywordArgumentsParameter() {
		assertThrows(IllegalStateException.class, () -> new InvalidExtension().getExports());
	}
}
