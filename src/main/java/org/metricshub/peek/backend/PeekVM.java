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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.peek.PeekContext;
import org.metricshub.peek.PeekException;
import org.metricshub.peek.client.PeekClient;
import org.metricshub.peek.client.RequestException;
import org.metricshub.peek.display.Display;
import org.metricshub.peek.ext.PeekFunction;
import org.metricshub.peek.frontend.ast.ApiCallNode;
import org.metricshub.peek.frontend.ast.ArrayNode;
import org.metricshub.peek.frontend.ast.ConstantNode;
import org.metricshub.peek.frontend.ast.DictNode;
import org.metricshub.peek.frontend.ast.FuncCallNode;
import org.metricshub.peek.frontend.ast.NameNode;
import org.metricshub.peek.frontend.ast.Node;
import org.metricshub.peek.frontend.ast.NumberNode;
import org.metricshub.peek.frontend.ast.StringNode;
import org.metricshub.peek.frontend.ast.TextNode;
import org.metricshub.peek.util.PeekLogger;
import org.slf4j.Logger;

/**
 * Peek virtual machine: executes statement nodes.
 * <p>
 * An API call is turned into a request sent through the current
 * connection. A function call resolves its name among the session names
 * and invokes the function. In both cases the outcome goes to the
 * {@link Display}.
 * <p>
 * Values are evaluated in a single walk of the tree. Each node delivers its
 * value to the target on top of a {@link ConsumerStack}; dicts and arrays
 * push their own accumulator while their children are evaluated.
 * Evaluation results use plain Java types: <code>null</code>,
 * {@link Boolean}, {@link Long}, {@link java.math.BigInteger},
 * {@link Double}, {@link String}, {@link LinkedHashMap} and
 * {@link ArrayList}.
 */
public class PeekVM {

	private static final Logger LOG = PeekLogger.getLogger(PeekVM.class);

	/** Header carrying the <code>runas</code> option of an API call */
	public static final String RUNAS_HEADER = "es-security-runas-user";

	/** Option running the request as another user */
	public static final String RUNAS_OPTION = "runas";

	/** Option selecting the connection by index */
	public static final String CONN_OPTION = "conn";

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final PeekContext context;
	private final ConsumerStack consumers = new ConsumerStack();

	/**
	 * @param context session providing names, connections and display
	 */
	public PeekVM(PeekContext context) {
		this.context = context;
	}

	/**
	 * Executes one statement.
	 *
	 * @param node an {@link ApiCallNode} or a {@link FuncCallNode}
	 * @throws PeekException when the statement cannot be executed: unknown
	 *         name or option, value that is not callable, invalid connection
	 */
	public void execute(Node node) {
		switch (node.getKind()) {
		case API_CALL:
			executeApiCall((ApiCallNode) node);
			break;
		case FUNC_CALL:
			executeFuncCall((FuncCallNode) node);
			break;
		default:
			throw new PeekException("Not a statement: " + node);
		}
	}

	void executeApiCall(ApiCallNode node) {
		Map<String, Object> options = evaluateDict(node.getOptions());

		String payload = null;
		if (!node.getPayloads().isEmpty()) {
			StringBuilder body = new StringBuilder();
			for (DictNode block : node.getPayloads()) {
				body.append(toJson(evaluate(block))).append('\n');
			}
			payload = body.toString();
		}

		Map<String, String> headers = new LinkedHashMap<String, String>();
		if (options.get(RUNAS_OPTION) != null) {
			headers.put(RUNAS_HEADER, String.valueOf(options.remove(RUNAS_OPTION)));
		}
		PeekClient client;
		if (options.get(CONN_OPTION) != null) {
			client = context.getClientManager().get(toIndex(options.remove(CONN_OPTION)));
		} else {
			client = context.getClientManager().current();
		}
		if (!options.isEmpty()) {
			throw new PeekException("Unknown options: " + options);
		}

		Display display = context.getDisplay();
		try {
			display.info(client.performRequest(node.getMethod(), node.getPath(), payload, headers.isEmpty() ? null : headers));
		} catch (RequestException e) {
			if (e.hasInfo()) {
				display.info(e.getInfo());
			} else {
				display.error(e);
			}
		} catch (IOException e) {
			display.error(e);
		}
	}

	void executeFuncCall(FuncCallNode node) {
		String name = node.getName();
		Object value = context.getNames().resolve(name);
		if (value == null) {
			throw new PeekException("Unknown name: '" + name + "'");
		}
		if (!(value instanceof PeekFunction)) {
			throw new PeekException("'" + name + "' is not a callable, but a " + value.getClass().getSimpleName());
		}

		@SuppressWarnings("unchecked")
		List<Object> args = (List<Object>) evaluate(node.getArgs());
		Map<String, Object> kwargs = evaluateDict(node.getKwargs());
		LOG.debug("Calling {} with {} {}", name, args, kwargs);

		Display display = context.getDisplay();
		try {
			display.info(((PeekFunction) value).call(context, args, kwargs));
		} catch (Exception e) {
			display.error(e);
		}
	}

	/**
	 * Evaluates a value node.
	 *
	 * @param node value node
	 * @return the value, in plain Java types
	 */
	public Object evaluate(Node node) {
		Object[] result = new Object[1];
		consumers.push(value -> result[0] = value);
		try {
			visit(node);
		} finally {
			consumers.pop();
		}
		return result[0];
	}

	@SuppressWarnings("unchecked")
	private Map<String, Object> evaluateDict(DictNode node) {
		return (Map<String, Object>) evaluate(node);
	}

	private void visit(Node node) {
		switch (node.getKind()) {
		case DICT:
			visitDict((DictNode) node);
			break;
		case ARRAY:
			List<Object> values = new ArrayList<Object>();
			consumers.push(values::add);
			try {
				for (Node element : ((ArrayNode) node).getValues()) {
					visit(element);
				}
			} finally {
				consumers.pop();
			}
			consumers.consume(values);
			break;
		case STRING:
			consumers.consume(Literals.unescape(((StringNode) node).getRaw()));
			break;
		case NUMBER:
			consumers.consume(Literals.parseNumber(((NumberNode) node).getRaw()));
			break;
		case CONSTANT:
			consumers.consume(((ConstantNode) node).getValue());
			break;
		case NAME:
			String identifier = ((NameNode) node).getIdentifier();
			Object resolved = context.getNames().resolve(identifier);
			if (resolved == null) {
				throw new PeekException("Unknown name: '" + identifier + "'");
			}
			consumers.consume(resolved);
			break;
		case TEXT:
			consumers.consume(((TextNode) node).getRaw());
			break;
		case API_CALL:
		case FUNC_CALL:
		default:
			throw new PeekException("A statement cannot be used as a value: " + node);
		}
	}

	private void visitDict(DictNode node) {
		Map<String, Object> map = new LinkedHashMap<String, Object>();
		List<Object> key = new ArrayList<Object>(1);
		for (DictNode.Entry entry : node.getEntries()) {
			key.clear();
			consumers.push(key::add);
			try {
				if (entry.getKey() instanceof NameNode) {
					// bare keys stand for their own text
					consumers.consume(((NameNode) entry.getKey()).getIdentifier());
				} else {
					visit(entry.getKey());
				}
			} finally {
				consumers.pop();
			}
			String keyText = String.valueOf(key.get(0));
			consumers.push(value -> map.put(keyText, value));
			try {
				visit(entry.getValue());
			} finally {
				consumers.pop();
			}
		}
		consumers.consume(map);
	}

	private static int toIndex(Object value) {
		if (value instanceof Number) {
			return ((Number) value).intValue();
		}
		try {
			return Integer.parseInt(value.toString().trim());
		} catch (NumberFormatException e) {
			throw new PeekException("Connection index must be a number, not " + value, e);
		}
	}

	private static String toJson(Object value) {
		try {
			return MAPPER.writeValueAsString(value);
		} catch (JsonProcessingException e) {
			throw new PeekException("Cannot serialize payload: " + e.getOriginalMessage(), e);
		}
	}
}
