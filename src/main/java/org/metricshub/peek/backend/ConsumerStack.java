package org.metricshub.peek.backend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Peek
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;

/**
 * Stack of value targets used by the {@link PeekVM}.
 * <p>
 * Evaluating a node delivers its value to the target on top of the stack.
 * A container node pushes its own accumulator while its children are
 * evaluated, then pops it and delivers the assembled container.
 */
class ConsumerStack {

	private final Deque<Consumer<Object>> consumers = new ArrayDeque<Consumer<Object>>();

	void push(Consumer<Object> consumer) {
		consumers.push(consumer);
	}

	void pop() {
		consumers.pop();
	}

	/**
	 * Delivers a value, possibly <code>null</code>, to the current target.
	 */
	void consume(Object value) {
		Consumer<Object> consumer = consumers.peek();
		if (consumer == null) {
			throw new IllegalStateException("No target for value " + value);
		}
		consumer.accept(value);
	}
}
