package org.metricshub.peek.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.math.BigInteger;
import java.net.ConnectException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import org.metricshub.peek.Peek;
import org.metricshub.peek.PeekException;
import org.metricshub.peek.PeekTestSupport;
import org.metricshub.peek.PeekTestSupport.PeekResult;
import org.metricshub.peek.PeekTestSupport.Request;
import org.metricshub.peek.client.RequestException;
import org.metricshub.peek.ext.PeekFunction;
import org.metricshub.peek.ext.TestExtension;
import org.metricshub.peek.ext.TextExtension;

public class PeekVMTest {

	@Test
	public void testApiCallWithoutPayload() {
		PeekResult result = PeekTestSupport.peekTest("plain get").script("get /abc?v").expectInfo("GET /abc?v").run();
		result.assertExpected();
		Request request = result.client(0).lastRequest();
		assertEquals("GET", request.method());
		assertEquals("/abc?v", request.path());
		assertNull(request.payload());
		assertNull(request.headers());
	}

	@Test
	public void testPayloadIsSentAsJsonLines() {
		PeekResult result = PeekTestSupport
				.peekTest("bulk payload")
				.script("post _bulk\n{\"index\": {\"_id\": 1}}\n{'f': \"a\\tb\", n: [1, 2.5, true, null]}\n")
				.respond("{\"errors\":false}")
				.expectInfo("{\"errors\":false}")
				.run();
		result.assertExpected();
		assertEquals(
				"{\"index\":{\"_id\":1}}\n{\"f\":\"a\\tb\",\"n\":[1,2.5,true,null]}\n",
				result.client(0).lastRequest().payload());
	}

	@Test
	public void testEmptyPayload() {
		PeekResult result = PeekTestSupport.peekTest("empty payload").script("put idx\n{}").run();
		result.assertExpected();
		assertEquals("{}\n", result.client(0).lastRequest().payload());
	}

	@Test
	public void testRunasOptionBecomesHeader() {
		PeekResult result = PeekTestSupport.peekTest("runas").script("get / runas=\"bob\"").run();
		result.assertExpected();
		assertEquals(
				Collections.singletonMap(PeekVM.RUNAS_HEADER, "bob"),
				result.client(0).lastRequest().headers());
	}

	@Test
	public void testConnOptionSelectsConnection() {
		PeekResult result = PeekTestSupport
				.peekTest("conn option")
				.connections(3)
				.script("get /first conn=0\nget /current")
				.expectInfo("GET /first", "GET /current")
				.run();
		result.assertExpected();
		assertEquals(1, result.client(0).requests().size());
		assertTrue(result.client(1).requests().isEmpty());
		assertEquals("/current", result.client(2).lastRequest().path());
		// the option does not change the current connection
		assertEquals(2, result.peek().getClientManager().getCurrentIndex());
	}

	@Test
	public void testInvalidConnOption() {
		PeekTestSupport
				.peekTest("invalid conn option")
				.script("get / conn=5")
				.expectErrors("Attempt to get connection at invalid index [5]")
				.expectFailure()
				.runAndAssert();
	}

	@Test
	public void testUnknownOptionsAreRejected() {
		PeekResult result = PeekTestSupport
				.peekTest("unknown option")
				.script("get / foo=1 bar=\"x\"")
				.expectErrors("Unknown options: {foo=1, bar=x}")
				.expectFailure()
				.run();
		result.assertExpected();
		assertTrue(result.client(0).requests().isEmpty());
	}

	@Test
	public void testErrorResponseWithBodyIsDisplayedAsResult() {
		Map<String, Object> body = new LinkedHashMap<String, Object>();
		body.put("status", 404);
		PeekTestSupport
				.peekTest("error response")
				.script("get /missing")
				.respond(new RequestException(404, body, "not found"))
				.expectInfo(body)
				.runAndAssert();
	}

	@Test
	public void testTransportErrorsAreDisplayed() {
		PeekTestSupport
				.peekTest("transport errors")
				.script("get /a\nget /b\nget /c")
				.respond(new RequestException(500, null, "empty error"), new ConnectException("refused"))
				.expectInfo("GET /c")
				.expectErrors("empty error", "refused")
				.runAndAssert();
	}

	@Test
	public void testNoConnection() {
		PeekTestSupport
				.peekTest("no connection")
				.connections(0)
				.script("get /")
				.expectErrors("No connection is configured")
				.expectFailure()
				.runAndAssert();
	}

	@Test
	public void testUnknownFunctionDoesNotStopNextStatements() {
		PeekTestSupport
				.peekTest("unknown function")
				.script("nope 1\nget /after")
				.expectInfo("GET /after")
				.expectErrors("Unknown name: 'nope'")
				.expectFailure()
				.runAndAssert();
	}

	@Test
	public void testConstantIsNotCallable() {
		PeekTestSupport
				.peekTest("not callable")
				.withExtensions(new TestExtension())
				.script("answer")
				.expectErrors("'answer' is not a callable, but a Long")
				.expectFailure()
				.runAndAssert();
	}

	@Test
	public void testUnknownNameAsArgument() {
		PeekTestSupport
				.peekTest("unknown name argument")
				.withExtensions(TextExtension.INSTANCE)
				.script("echo missing")
				.expectErrors("Unknown name: 'missing'")
				.expectFailure()
				.runAndAssert();
	}

	@Test
	public void testNamesResolveToTheirValues() {
		PeekTestSupport
				.peekTest("names as values")
				.withExtensions(new TestExtension(), TextExtension.INSTANCE)
				.script("add answer 8\necho answer sep=answer")
				.expectInfo(Long.valueOf(50), "42")
				.runAndAssert();
	}

	@Test
	public void testFunctionErrorsAreDisplayed() {
		PeekTestSupport
				.peekTest("function error")
				.withExtensions(new TestExtension())
				.script("explode\nadd 1 2")
				.expectInfo(Long.valueOf(3))
				.expectErrors("exploded")
				.runAndAssert();
	}

	@Test
	public void testEvaluate() throws Exception {
		Peek peek = PeekTestSupport.peekTest("evaluate").run().peek();
		Map<String, Object> expected = new LinkedHashMap<String, Object>();
		expected.put("1", "a");
		expected.put("b", Arrays.<Object>asList(Boolean.TRUE, Double.valueOf(1000), Long.valueOf(-7)));
		expected.put("big", new BigInteger("123456789012345678901234567890"));
		assertEquals(expected, peek.eval("{1: 'a', b: [true, 1e3, -7], \"big\": 123456789012345678901234567890}"));
		assertEquals("line\nbreak", peek.eval("'''line\\nbreak'''"));
		assertNull(peek.eval("null"));
	}

	@Test
	public void testEvaluateFunctionName() throws Exception {
		Peek peek = PeekTestSupport.peekTest("evaluate function").run().peek();
		List<?> values = (List<?>) peek.eval("[connect, help]");
		assertEquals(2, values.size());
		assertTrue(values.get(0) instanceof PeekFunction);
		assertThrows(PeekException.class, () -> peek.eval("[nothing]"));
	}
}
