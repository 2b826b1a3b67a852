package org.metricshub.peek.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import org.junit.Test;
import org.metricshub.peek.ext.AbstractExtension;
import org.metricshub.peek.ext.ClashingExtension;
import org.metricshub.peek.ext.TestExtension;
import org.metricshub.peek.ext.annotations.PeekExport;

public class NameRegistryTest {

	/** Exports a name that is also a built-in */
	public static class ShadowingExtension extends AbstractExtension {
		@PeekExport("builtin")
		public String builtin() {
			return "shadow";
		}
	}

	@Test
	public void testBuiltinsComeFirst() {
		Object builtin = new Object();
		NameRegistry names = new NameRegistry(Collections.singletonMap("builtin", builtin));
		names.addExtensions(Arrays.asList(new ShadowingExtension(), new TestExtension()));
		assertSame(builtin, names.resolve("builtin"));
		assertEquals(Long.valueOf(42), names.resolve("answer"));
		assertTrue(names.contains("add"));
		assertFalse(names.contains("nothing"));
		assertNull(names.resolve("nothing"));
		assertEquals(
				new LinkedHashSet<String>(
						Arrays.asList("builtin", "add", "concat", "count_connections", "explode", "answer")),
				names.names());
		assertEquals(2, names.getExtensions().size());
	}

	@Test
	public void testClashingExtensionsAreRejected() {
		NameRegistry names = new NameRegistry(Collections.<String, Object>emptyMap());
		IllegalArgumentException e = assertThrows(
				IllegalArgumentException.class,
				() -> names.addExtensions(Arrays.asList(new TestExtension(), new ClashingExtension())));
		assertEquals("Name 'add' already provided by another extension", e.getMessage());
		// nothing was added
		assertTrue(names.getExtensionNames().isEmpty());

		names.addExtensions(Collections.singletonList(new TestExtension()));
		assertThrows(
				IllegalArgumentException.class,
				() -> names.addExtensions(Collections.singletonList(new ClashingExtension())));
	}

	@Test
	public void testSameExtensionTwice() {
		NameRegistry names = new NameRegistry(Collections.<String, Object>emptyMap());
		IllegalArgumentException e = assertThrows(
				IllegalArgumentException.class,
				() -> names.addExtensions(Arrays.asList(new TestExtension(), new TestExtension())));
		assertTrue(e.getMessage().contains("was provided multiple times"));
	}
}
