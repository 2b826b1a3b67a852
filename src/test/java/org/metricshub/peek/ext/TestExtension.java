package org.metricshub.peek.ext;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;
import org.metricshub.peek.PeekContext;
import org.metricshub.peek.ext.annotations.PeekExport;
import org.metricshub.peek.ext.annotations.PeekKeywordArgs;

/**
 * Test extension used by the unit tests to exercise the annotation-based
 * extension infrastructure.
 */
public class TestExtension extends AbstractExtension {

	@Override
	public String getExtensionName() {
		return "TestExtension";
	}

	@Override
	protected Map<String, Object> getConstants() {
		return Collections.<String, Object>singletonMap("answer", Long.valueOf(42));
	}

	@PeekExport("add")
	public long add(long a, long b) {
		return a + b;
	}

	/**
	 * @return the number of connections of the session
	 */
	@PeekExport("count_connections")
	public int countConnections(PeekContext context) {
		return context.getClientManager().size();
	}

	@PeekExport("concat")
	public String concat(@PeekKeywordArgs Map<String, Object> kwargs, String... parts) {
		Object prefix = kwargs.get("prefix");
		StringBuilder result = new StringBuilder(prefix == null ? "" : prefix.toString());
		for (String part : parts) {
			result.append(part);
		}
		return result.toString();
	}

	@PeekExport("explode")
	public void explode() throws IOException {
		throw new IOException("exploded");
	}
}
