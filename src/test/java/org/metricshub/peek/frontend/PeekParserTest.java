package org.metricshub.peek.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.List;
import org.junit.Test;
import org.metricshub.peek.frontend.ast.ApiCallNode;
import org.metricshub.peek.frontend.ast.ArrayNode;
import org.metricshub.peek.frontend.ast.ConstantNode;
import org.metricshub.peek.frontend.ast.DictNode;
import org.metricshub.peek.frontend.ast.FuncCallNode;
import org.metricshub.peek.frontend.ast.NameNode;
import org.metricshub.peek.frontend.ast.Node;
import org.metricshub.peek.frontend.ast.NodeKind;
import org.metricshub.peek.frontend.ast.ParserException;
import org.metricshub.peek.frontend.ast.StringNode;

public class PeekParserTest {

	private final PeekParser parser = new PeekParser();

	@Test
	public void testSingleApiCall() throws Exception {
		List<Node> nodes = parser.parse("get /abc");
		assertEquals(1, nodes.size());
		ApiCallNode call = (ApiCallNode) nodes.get(0);
		assertEquals("GET", call.getMethod());
		assertEquals("get", call.getRawMethod());
		assertEquals("/abc", call.getPath());
		assertTrue(call.getOptions().isEmpty());
		assertTrue(call.getPayloads().isEmpty());
	}

	@Test
	public void testMultipleStatements() throws Exception {
		String text = "get abc\n"
				+ "\n"
				+ "post abc/_doc\n"
				+ "{ \"foo\":\n"
				+ "         \"bar\"\n"
				+ "}\n"
				+ "\n"
				+ "conn foo=bar  // comment\n"
				+ "get abc\n"
				+ "post xyz/_doc\n"
				+ "{\"index\": \"asfa\"}\n"
				+ "// comment\n"
				+ "{\"again\": [{\"ok\": 1}]}\n"
				+ "get xyz/_doc/1 // comment\n"
				+ "conn\n"
				+ "get foo\n";
		List<Node> nodes = parser.parse(text);
		assertEquals(8, nodes.size());
		assertEquals(NodeKind.FUNC_CALL, nodes.get(2).getKind());
		assertEquals(2, ((ApiCallNode) nodes.get(4)).getPayloads().size());
		assertEquals("conn [] {}\n", nodes.get(6).toString());
	}

	@Test
	public void testEmptyScript() throws Exception {
		assertTrue(parser.parse("").isEmpty());
		assertTrue(parser.parse("  // nothing to do\n\n").isEmpty());
	}

	@Test
	public void testNormalPayload() throws Exception {
		String text = "// Comment\n"
				+ "    pUt /somewhere //here\n"
				+ "{\n"
				+ "    \"foo\": \"bar\", // a comment\n"
				+ "    \"hello\": 1.0,\n"
				+ "    \"world\": [2.0, true, null, false], // more comment\n"
				+ "    \"nested\": {\n"
				+ "        \"this is it\": \"orly?\",\n"
				+ "        \"the end\": [42, 'the', 'end', 'of', 'it']\n"
				+ "    }\n"
				+ "}";
		List<Node> nodes = parser.parse(text);
		assertEquals(1, nodes.size());
		ApiCallNode call = (ApiCallNode) nodes.get(0);
		assertEquals("PUT", call.getMethod());
		assertEquals("/somewhere", call.getPath());
		assertEquals(1, call.getPayloads().size());
		assertEquals(
				"pUt /somewhere {}\n"
				+ "{\"foo\":\"bar\",\"hello\":1.0,\"world\":[2.0,true,null,false],\"nested\":{\"this is it\":\"orly?\",\"the end\":[42,'the','end','of','it']}}\n",
				call.toString());
	}

	@Test
	public void testNumberFormsAreKeptRaw() throws Exception {
		String text = "post /numbers\n"
				+ "{\n"
				+ "    \"forms\": [42, 4.2, .42, -42e+1],\n"
				+ "    \"signed\": +1,\n"
				+ "    \"upper\": 4.2E-1,\n"
				+ "    \"trailing\": 1.\n"
				+ "}";
		ApiCallNode call = (ApiCallNode) parser.parse(text).get(0);
		assertEquals(
				"post /numbers {}\n"
				+ "{\"forms\":[42,4.2,.42,-42e+1],\"signed\":+1,\"upper\":4.2E-1,\"trailing\":1.}\n",
				call.toString());
	}

	@Test
	public void testStringEscapesAreKeptRaw() throws Exception {
		String text = "geT out\n"
				+ "{\n"
				+ "    \"'hello\\tworld'\": '\"hello\\tworld\"',\n"
				+ "    \"foo\\\\\\t\\nbar\": 'foo\\\\\\t\\nbar',\n"
				+ "    \"magic\\\\'\\\"\": 'magic\\\\\"\\''\n"
				+ "}";
		List<Node> nodes = parser.parse(text);
		assertEquals(1, nodes.size());
		ApiCallNode call = (ApiCallNode) nodes.get(0);
		assertEquals("GET", call.getMethod());
		assertEquals("out", call.getPath());
		assertEquals(1, call.getPayloads().size());
		assertEquals(
				"geT out {}\n"
				+ "{\"'hello\\tworld'\":'\"hello\\tworld\"',\"foo\\\\\\t\\nbar\":'foo\\\\\\t\\nbar',\"magic\\\\'\\\"\":'magic\\\\\"\\''}\n",
				call.toString());
	}

	@Test
	public void testTripleDoubleQuotedStrings() throws Exception {
		String text = "post /away\n"
				+ "    {\n"
				+ "        \"'hello\\tworld'\": \"\"\"\"hello\\t\n"
				+ "world\\\"\"\"\",\n"
				+ "        \"foo\\\\\\t\\nbar\": \"\"\"foo\\\\\n"
				+ "\\t\\nbar\"\"\",\n"
				+ "        \"magic\\\\'\\\"\": \"\"\"magic\\\\\"\\''\"\"\"\n"
				+ "    }";
		List<Node> nodes = parser.parse(text);
		assertEquals(1, nodes.size());
		ApiCallNode call = (ApiCallNode) nodes.get(0);
		assertEquals("POST", call.getMethod());
		assertEquals("/away", call.getPath());
		assertEquals(1, call.getPayloads().size());
		assertEquals(
				"post /away {}\n"
				+ "{\"'hello\\tworld'\":\"\"\"\"hello\\t\n"
				+ "world\\\"\"\"\",\"foo\\\\\\t\\nbar\":\"\"\"foo\\\\\n"
				+ "\\t\\nbar\"\"\",\"magic\\\\'\\\"\":\"\"\"magic\\\\\"\\''\"\"\"}\n",
				call.toString());
	}

	@Test
	public void testTripleSingleQuotedStrings() throws Exception {
		String text = "delete it\n"
				+ "{\n"
				+ "        \"'hello\\tworld'\": ''''hello\\t\n"
				+ "world\\'''',\n"
				+ "        \"foo\\\\\\t\\nbar\": '''foo\\\\\n"
				+ "\\t\\nbar''',\n"
				+ "        \"magic\\\\'\\\"\": '''magic\\\\\"\\'\"'''\n"
				+ "    }";
		List<Node> nodes = parser.parse(text);
		assertEquals(1, nodes.size());
		ApiCallNode call = (ApiCallNode) nodes.get(0);
		assertEquals("DELETE", call.getMethod());
		assertEquals("it", call.getPath());
		assertEquals(1, call.getPayloads().size());
		assertEquals(
				"delete it {}\n"
				+ "{\"'hello\\tworld'\":''''hello\\t\n"
				+ "world\\'''',\"foo\\\\\\t\\nbar\":'''foo\\\\\n"
				+ "\\t\\nbar''',\"magic\\\\'\\\"\":'''magic\\\\\"\\'\"'''}\n",
				call.toString());
	}

	@Test
	public void testBulkPayloads() throws Exception {
		String text = "PUT _bulk\n"
				+ "{ \"index\" : { \"_index\" : \"test\", \"_id\" : \"1\" } }\n"
				+ "{ \"field1\" : \"value1\" }\n"
				+ "{ \"delete\" : { \"_index\" : \"test\", \"_id\" : \"2\" } }\n"
				+ "{ \"create\" : { \"_index\" : \"test\", \"_id\" : \"3\" } }\n"
				+ "{ \"field1\" : \"value3\" }\n"
				+ "{ \"update\" : {\"_id\" : \"1\", \"_index\" : \"test\"} }\n"
				+ "{ \"doc\" : {\"field2\" : \"value2\"} }\n";
		List<Node> nodes = parser.parse(text);
		assertEquals(1, nodes.size());
		ApiCallNode call = (ApiCallNode) nodes.get(0);
		assertEquals("PUT", call.getMethod());
		assertEquals("_bulk", call.getPath());
		assertEquals(7, call.getPayloads().size());
		assertEquals(
				"PUT _bulk {}\n"
				+ "{\"index\":{\"_index\":\"test\",\"_id\":\"1\"}}\n"
				+ "{\"field1\":\"value1\"}\n"
				+ "{\"delete\":{\"_index\":\"test\",\"_id\":\"2\"}}\n"
				+ "{\"create\":{\"_index\":\"test\",\"_id\":\"3\"}}\n"
				+ "{\"field1\":\"value3\"}\n"
				+ "{\"update\":{\"_id\":\"1\",\"_index\":\"test\"}}\n"
				+ "{\"doc\":{\"field2\":\"value2\"}}\n",
				call.toString());
	}

	@Test
	public void testApiCallOptions() throws Exception {
		ApiCallNode call = (ApiCallNode) parser.parse("get _cat/indices v=true h=[index,health] runas=\"bob\"").get(0);
		List<DictNode.Entry> options = call.getOptions().getEntries();
		assertEquals(3, options.size());
		assertEquals("v", ((NameNode) options.get(0).getKey()).getIdentifier());
		assertEquals(Boolean.TRUE, ((ConstantNode) options.get(0).getValue()).getValue());
		assertEquals(NodeKind.ARRAY, options.get(1).getValue().getKind());
		assertEquals("\"bob\"", ((StringNode) options.get(2).getValue()).getRaw());
		assertEquals("get _cat/indices {v:true,h:[index,health],runas:\"bob\"}\n", call.toString());
	}

	@Test
	public void testFunctionCallArguments() throws Exception {
		FuncCallNode call = (FuncCallNode) parser.parse("session 1 'x' current=2 info=true\n").get(0);
		assertEquals("session", call.getName());
		ArrayNode args = call.getArgs();
		assertEquals(2, args.getValues().size());
		assertEquals(NodeKind.NUMBER, args.getValues().get(0).getKind());
		assertEquals(NodeKind.STRING, args.getValues().get(1).getKind());
		assertEquals(2, call.getKwargs().getEntries().size());
		assertEquals("session [1,'x'] {current:2,info:true}\n", call.toString());
	}

	@Test
	public void testFunctionCallNestedValues() throws Exception {
		FuncCallNode call = (FuncCallNode) parser
				.parse("echo [1, [2, {\"a\": null}],] {'k': x.y} sep=\"-\"")
				.get(0);
		assertEquals("echo [[1,[2,{\"a\":null}]],{'k':x.y}] {sep:\"-\"}\n", call.toString());
		DictNode dict = (DictNode) call.getArgs().getValues().get(1);
		assertEquals("x.y", ((NameNode) dict.getEntries().get(0).getValue()).getIdentifier());
	}

	@Test
	public void testParseValue() throws Exception {
		Node value = parser.parseValue("{\"a\": [1, 2.5, -3], 'b': null}");
		assertEquals(NodeKind.DICT, value.getKind());
		assertEquals("{\"a\":[1,2.5,-3],'b':null}", value.toString());
		ConstantNode constant = (ConstantNode) parser.parseValue("null");
		assertNull(constant.getValue());
		assertThrows(ParserException.class, () -> parser.parseValue("1 2"));
	}

	@Test
	public void testMissingComma() {
		ParserException e = assertThrows(
				ParserException.class,
				() -> parser.parse("get abc\n{\"a\": 1 2,\n \"b\": 5 }"));
		assertEquals(2, e.getLine());
		assertEquals(9, e.getColumn());
		assertTrue(e.getMessage().startsWith("Syntax error at Line 2, Column 9"));
		assertEquals("PUNCTUATION (COMMA) or PUNCTUATION (PAYLOAD_CLOSE)", e.getExpected());

		e = assertThrows(ParserException.class, () -> parser.parse("get abc\n{\"a\": [ 3 4 ]}"));
		assertTrue(e.getMessage().startsWith("Syntax error at Line 2, Column 11"));
		assertEquals("PUNCTUATION (COMMA) or PUNCTUATION (BRACKET_RIGHT)", e.getExpected());
	}

	@Test
	public void testIncompleteApiCall() {
		ParserException e = assertThrows(ParserException.class, () -> parser.parse("get\n"));
		assertEquals(
				"Syntax error at Line 1, Column 4: Expect token of type LITERAL (PATH), got TEXT (\\n)",
				e.getMessage());
	}

	@Test
	public void testMissingDictValue() {
		ParserException e = assertThrows(ParserException.class, () -> parser.parse("f x={\"a\":}"));
		assertEquals(1, e.getLine());
		assertEquals(10, e.getColumn());
		assertTrue(e.getActual().startsWith("PUNCTUATION"));
	}

	@Test
	public void testStrayPayloadIsRejected() {
		ParserException e = assertThrows(ParserException.class, () -> parser.parse("get /abc\n\n{}\n"));
		assertEquals(3, e.getLine());
		assertEquals(1, e.getColumn());
		assertEquals("KEYWORD (METHOD) or NAME (FUNC_NAME)", e.getExpected());
	}

	@Test
	public void testUnterminatedString() {
		ParserException e = assertThrows(ParserException.class, () -> parser.parse("f 'abc\ng 1"));
		assertEquals(1, e.getLine());
		assertEquals(3, e.getColumn());
		assertEquals("ERROR ('abc)", e.getActual());
	}
}
