package org.metricshub.peek.display;

import static org.junit.Assert.assertEquals;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.Before;
import org.junit.Test;
import org.metricshub.peek.PeekException;
import org.metricshub.peek.util.PeekSettings;

public class ConsoleDisplayTest {

	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();
	private PeekSettings settings;
	private ConsoleDisplay display;

	@Before
	public void setUp() {
		settings = new PeekSettings();
		display = new ConsoleDisplay(
				new PrintStream(out, true, StandardCharsets.UTF_8),
				new PrintStream(err, true, StandardCharsets.UTF_8),
				settings);
	}

	private String out() {
		return new String(out.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
	}

	private String err() {
		return new String(err.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
	}

	@Test
	public void testPrettyJsonResponse() {
		String pretty = display.format("{\"a\":[1,2]}");
		assertEquals(display.format(pretty), pretty);
		assertEquals("{\n  \"a\" : [ 1, 2 ]\n}", pretty.replace("\r\n", "\n"));
	}

	@Test
	public void testCompactOutput() {
		settings.put(PeekSettings.DISPLAY_PRETTY, Boolean.FALSE);
		Map<String, Object> map = new LinkedHashMap<String, Object>();
		map.put("k", Arrays.asList(1, "v"));
		display.info(map);
		display.info("{\"a\": 1}");
		assertEquals("{\"k\":[1,\"v\"]}\n{\"a\": 1}\n", out());
	}

	@Test
	public void testPlainText() {
		display.info("GET / {not json");
		display.info(null);
		display.info(Long.valueOf(42));
		assertEquals("GET / {not json\n42\n", out());
	}

	@Test
	public void testErrors() {
		display.error(new PeekException("Unknown name: 'x'"));
		display.error(new IOException());
		display.error("plain");
		assertEquals("Unknown name: 'x'\nIOException\nplain\n", err());
		assertEquals("", out());
	}

	@Test
	public void testErrorWithLineNumber() {
		display.error(new PeekException(3, "Unknown options: {bad=1}"));
		display.error(new PeekException(2, null, new IllegalStateException()));
		assertEquals("Line 3: Unknown options: {bad=1}\nLine 2: PeekException\n", err());
	}
}
