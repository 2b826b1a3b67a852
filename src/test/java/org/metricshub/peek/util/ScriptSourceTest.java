package org.metricshub.peek.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import java.io.StringReader;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.Test;
import org.metricshub.peek.PeekTestSupport;

public class ScriptSourceTest {

	@Test
	public void testReadText() throws Exception {
		ScriptSource source = new ScriptSource(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, new StringReader("get /\n"));
		assertEquals("get /\n", source.readText());
		assertEquals("<command-line-supplied-script>", source.toString());
	}

	@Test
	public void testReadFile() throws Exception {
		Path file = PeekTestSupport.scriptFile("get /é\n");
		ScriptFileSource source = new ScriptFileSource(file.toString());
		assertEquals("get /é\n", source.readText());
		assertEquals(file.toString(), source.getDescription());
	}

	@Test
	public void testMissingFile() {
		ScriptFileSource source = new ScriptFileSource("/nonexistent/script.peek");
		assertThrows(IOException.class, source::readText);
	}

	@Test
	public void testHomeExpansion() {
		String home = System.getProperty("user.home");
		assertEquals(Paths.get(home, "scripts/a.peek"), new ScriptFileSource("~/scripts/a.peek").getPath());
		assertEquals(Paths.get(home), new ScriptFileSource("~").getPath());
		assertEquals(Paths.get("a/~b"), new ScriptFileSource("a/~b").getPath());
	}
}
