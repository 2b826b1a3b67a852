package org.metricshub.peek.ext;

import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Map;
import org.junit.Test;

public class ExtensionRegistryTest {

	@Test
	public void testTextExtensionIsRegistered() {
		Map<String, PeekExtension> extensions = ExtensionRegistry.listExtensions();
		assertSame(TextExtension.INSTANCE, extensions.get("TextExtension"));
		assertSame(TextExtension.INSTANCE, extensions.get("textextension"));
	}

	@Test
	public void testResolve() {
		assertSame(TextExtension.INSTANCE, ExtensionRegistry.resolve("TextExtension"));
		assertSame(TextExtension.INSTANCE, ExtensionRegistry.resolve("TEXTEXTENSION"));
		assertSame(TextExtension.INSTANCE, ExtensionRegistry.resolve(TextExtension.class.getName()));
		assertNull(ExtensionRegistry.resolve(""));
		assertNull(ExtensionRegistry.resolve("org.metricshub.peek.ext.NoSuchExtension"));
		assertNull(ExtensionRegistry.resolve(String.class.getName()));
	}

	@Test
	public void testResolveByClassName() {
		PeekExtension loaded = ExtensionRegistry.resolve(ClashingExtension.class.getName());
		assertTrue(loaded instanceof ClashingExtension);
		assertSame(loaded, ExtensionRegistry.resolve(ClashingExtension.class.getName()));
		assertSame(loaded, ExtensionRegistry.resolve("ClashingExtension"));
	}

	@Test
	public void testNameConflict() {
		ExtensionRegistry.register("RegistryTestName", TextExtension.INSTANCE);
		ExtensionRegistry.register("RegistryTestName", TextExtension.INSTANCE);
		assertThrows(
				IllegalStateException.class,
				() -> ExtensionRegistry.register("RegistryTestName", new TestExtension()));
		assertThrows(IllegalArgumentException.class, () -> ExtensionRegistry.register("", TextExtension.INSTANCE));
	}
}
