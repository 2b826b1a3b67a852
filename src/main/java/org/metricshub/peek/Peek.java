package org.metricshub.peek;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.metricshub.peek.backend.NameRegistry;
import org.metricshub.peek.backend.PeekVM;
import org.metricshub.peek.client.ClientManager;
import org.metricshub.peek.client.HttpPeekClient;
import org.metricshub.peek.client.PeekClientFactory;
import org.metricshub.peek.display.ConsoleDisplay;
import org.metricshub.peek.display.Display;
import org.metricshub.peek.ext.CoreFunctions;
import org.metricshub.peek.ext.ExtensionRegistry;
import org.metricshub.peek.ext.PeekExtension;
import org.metricshub.peek.frontend.PeekParser;
import org.metricshub.peek.frontend.ast.Node;
import org.metricshub.peek.frontend.ast.ParserException;
import org.metricshub.peek.history.History;
import org.metricshub.peek.history.InMemoryHistory;
import org.metricshub.peek.util.PeekLogger;
import org.metricshub.peek.util.PeekSettings;
import org.metricshub.peek.util.ScriptSource;
import org.slf4j.Logger;

/**
 * A Peek session.
 * <p>
 * Input text goes through the following steps:
 * <ul>
 * <li>Tokenize and parse the whole text, producing a list of statements.
 * A syntax error anywhere is displayed and nothing runs.
 * <li>Execute each statement in turn with the {@link PeekVM}: API calls are
 * sent through the current connection, function calls invoke the built-in
 * functions or the functions of the enabled extensions.
 * </ul>
 * An error while executing a statement is displayed, and the next
 * statement runs.
 * <p>
 * The session does not enable any extensions automatically. Extensions can be
 * provided programmatically via the {@link Peek#Peek(Collection)} constructors
 * or via the command line when using the CLI entry point.
 *
 * @see org.metricshub.peek.backend.PeekVM
 */
public class Peek implements PeekContext {

	private static final Logger LOG = PeekLogger.getLogger(Peek.class);

	private final PeekSettings settings;
	private final Display display;
	private final History history;
	private final ClientManager clientManager = new ClientManager();
	private final PeekClientFactory clientFactory;
	private final NameRegistry names;
	private final PeekVM vm;
	private final PeekParser parser = new PeekParser();

	/**
	 * Create a new session printing to the standard streams, without
	 * extensions.
	 */
	public Peek() {
		this(Collections.<PeekExtension>emptyList());
	}

	/**
	 * Create a new session printing to the standard streams, with the
	 * specified extension instances.
	 *
	 * @param extensions extension instances implementing {@link PeekExtension}
	 */
	public Peek(Collection<? extends PeekExtension> extensions) {
		this(new PeekSettings(), null, HttpPeekClient::create, extensions);
	}

	/**
	 * Create a new session printing to the standard streams, with the
	 * specified extension instances.
	 *
	 * @param extensions extension instances implementing {@link PeekExtension}
	 */
	public Peek(PeekExtension... extensions) {
		this(Arrays.asList(extensions));
	}

	/**
	 * Create a new session.
	 *
	 * @param settings configuration of the session
	 * @param display where results and errors go, <code>null</code> for the
	 *        standard streams
	 * @param clientFactory creates the connections of the session
	 * @param extensions extension instances implementing {@link PeekExtension}
	 * @throws IllegalArgumentException if two extensions export the same name
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "settings are shared with the caller on purpose")
	public Peek(
			PeekSettings settings,
			Display display,
			PeekClientFactory clientFactory,
			Collection<? extends PeekExtension> extensions) {
		this.settings = settings;
		this.display = display != null ? display : new ConsoleDisplay(System.out, System.err, settings);
		this.history = new InMemoryHistory(settings.asInt(PeekSettings.HISTORY_MAX, 10000));
		this.clientFactory = clientFactory;
		this.names = new NameRegistry(CoreFunctions.create());
		this.names.addExtensions(extensions);
		this.vm = new PeekVM(this);
	}

	/**
	 * Lists the extensions that can be enabled, see {@link ExtensionRegistry}.
	 *
	 * @return extensions by name
	 */
	public static Map<String, PeekExtension> listAvailableExtensions() {
		return ExtensionRegistry.listExtensions();
	}

	/**
	 * Opens a connection with the session's client factory and makes it
	 * current.
	 *
	 * @param options connection options, as for the <code>connect</code>
	 *        function
	 */
	public void connect(Map<String, Object> options) {
		clientManager.add(clientFactory.create(options, settings));
	}

	/**
	 * Parses statements without running them.
	 *
	 * @param text Peek statements
	 * @return the statements
	 * @throws ParserException on a syntax error
	 */
	public List<Node> parse(String text) throws ParserException {
		return parser.parse(text);
	}

	/**
	 * Evaluates a single value, such as <code>{"size": 10}</code>.
	 *
	 * @param valueText value to evaluate
	 * @return the value in plain Java types
	 * @throws ParserException if the text is not a single value
	 */
	public Object eval(String valueText) throws ParserException {
		return vm.evaluate(parser.parseValue(valueText));
	}

	/**
	 * Runs one parsed statement.
	 *
	 * @param statement an API call or a function call
	 * @throws PeekException when the statement cannot be executed
	 */
	public void execute(Node statement) {
		vm.execute(statement);
	}

	@Override
	public boolean processInput(String text, boolean echo) {
		List<Node> statements;
		try {
			statements = parser.parse(text);
		} catch (ParserException e) {
			LOG.debug("Cannot parse input", e);
			display.error(e);
			return false;
		}
		boolean success = true;
		for (Node statement : statements) {
			if (echo) {
				display.info(statement.toString().trim());
			}
			try {
				vm.execute(statement);
			} catch (RuntimeException e) {
				LOG.debug("Statement failed: {}", statement, e);
				display.error(atLine(e, lineOf(text, statement.getOffset())));
				success = false;
			}
		}
		return success;
	}

	/**
	 * @return the 1-based line of the specified offset
	 */
	static int lineOf(String text, int offset) {
		int line = 1;
		int end = Math.min(offset, text.length());
		for (int i = 0; i < end; i++) {
			if (text.charAt(i) == '\n') {
				line++;
			}
		}
		return line;
	}

	private static PeekException atLine(RuntimeException e, int line) {
		if (e instanceof PeekException && ((PeekException) e).getLineNumber() >= 0) {
			return (PeekException) e;
		}
		return new PeekException(line, e.getMessage(), e);
	}

	/**
	 * Reads and runs a script.
	 *
	 * @param source script to run
	 * @param echo whether each statement is displayed before it runs
	 * @return <code>true</code> if the script parsed and every statement ran
	 *         without error
	 * @throws IOException when the script cannot be read
	 */
	public boolean processInput(ScriptSource source, boolean echo) throws IOException {
		LOG.debug("Running {}", source);
		return processInput(source.readText(), echo);
	}

	@Override
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "settings are shared on purpose")
	public PeekSettings getSettings() {
		return settings;
	}

	@Override
	public Display getDisplay() {
		return display;
	}

	@Override
	public History getHistory() {
		return history;
	}

	@Override
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "functions manage the connections")
	public ClientManager getClientManager() {
		return clientManager;
	}

	@Override
	public PeekClientFactory getClientFactory() {
		return clientFactory;
	}

	@Override
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "functions read the names")
	public NameRegistry getNames() {
		return names;
	}
}
