package org.metricshub.peek.history;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;

import java.util.List;
import org.junit.Test;

public class InMemoryHistoryTest {

	@Test
	public void testEntriesAreNumbered() {
		InMemoryHistory history = new InMemoryHistory(10);
		history.store("get /");
		history.store("session 1");
		List<HistoryEntry> entries = history.loadRecent();
		assertEquals(2, entries.size());
		assertEquals(1, entries.get(0).getIndex());
		assertEquals("session 1", history.getEntry(2).getText());
		assertNull(history.getEntry(3));
	}

	@Test
	public void testOldestEntriesAreDropped() {
		InMemoryHistory history = new InMemoryHistory(2);
		history.store("a");
		history.store("b");
		history.store("c");
		assertNull(history.getEntry(1));
		assertEquals(2, history.loadRecent().size());
		assertEquals(3, history.loadRecent().get(1).getIndex());
	}

	@Test
	public void testEntryText() {
		assertEquals("    12 'get \\'x\\'\\n{\"a\": \"\\\\\"}'", new HistoryEntry(12, "get 'x'\n{\"a\": \"\\\"}").toString());
	}

	@Test
	public void testInvalidSize() {
		assertThrows(IllegalArgumentException.class, () -> new InMemoryHistory(0));
	}
}
