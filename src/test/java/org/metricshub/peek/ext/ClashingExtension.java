package org.metricshub.peek.ext;

import org.metricshub.peek.ext.annotations.PeekExport;

/**
 * Exports a name already exported by {@link TestExtension}.
 */
public class ClashingExtension extends AbstractExtension {

	@PeekExport("add")
	public String add(String a, String b) {
		return a + b;
	}
}
