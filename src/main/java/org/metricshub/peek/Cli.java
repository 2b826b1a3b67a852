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
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.peek.client.HttpPeekClient;
import org.metricshub.peek.display.ConsoleDisplay;
import org.metricshub.peek.ext.ExtensionRegistry;
import org.metricshub.peek.ext.PeekExtension;
import org.metricshub.peek.frontend.ast.Node;
import org.metricshub.peek.util.PeekSettings;
import org.metricshub.peek.util.ScriptFileSource;
import org.metricshub.peek.util.ScriptSource;

/**
 * Command-line interface for Peek.
 * <p>
 * With scripts (<code>-f</code>, <code>-e</code> or file operands), runs them
 * and exits. Without, reads statements from the input: the text typed so far
 * is submitted on an empty line or at the end of the input.
 */
public final class Cli {

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "peek.jar";
		}
		JAR_NAME = myName;
	}

	private static final Pattern CONFIG_PATTERN = Pattern.compile("([_a-zA-Z][_0-9a-zA-Z.]*)=(.*)");

	private final PeekSettings settings = new PeekSettings();
	private final InputStream in;
	private final PrintStream out;
	private final PrintStream err;

	private final List<ScriptSource> scriptSources = new ArrayList<ScriptSource>();
	private final List<String> extensionNames = new ArrayList<String>();
	private final Map<String, Object> connectOptions = new LinkedHashMap<String, Object>();
	private boolean listExtensions;
	private boolean dumpSyntaxTree;
	private boolean echo;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard input and output streams.
	 */
	public Cli() {
		this(System.in, System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param in stream from which interactive input is read
	 * @param out stream where results are written
	 * @param err stream where errors are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out, PrintStream err) {
		this.in = in;
		this.out = out;
		this.err = err;
	}

	/**
	 * Returns the {@link PeekSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PeekSettings getSettings() {
		return settings;
	}

	/**
	 * Returns the list of script sources specified on the command line.
	 *
	 * @return a copy of the script sources list
	 */
	public List<ScriptSource> getScriptSources() {
		return new ArrayList<ScriptSource>(scriptSources);
	}

	/**
	 * @return the connection options given on the command line
	 */
	public Map<String, Object> getConnectOptions() {
		return new LinkedHashMap<String, Object>(connectOptions);
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {
		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// end of options: remaining args are script files
				break;
			} else if (arg.equals("-")) {
				++argIdx;
				break;
			} else if (arg.equals("-f")) {
				// -f filename : load script from file
				checkParameterHasArgument(args, argIdx);
				scriptSources.add(new ScriptFileSource(args[++argIdx]));
			} else if (arg.equals("-e")) {
				// -e text : statements to run
				checkParameterHasArgument(args, argIdx);
				scriptSources
						.add(new ScriptSource(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, new StringReader(args[++argIdx])));
			} else if (arg.equals("-c")) {
				// -c key=value : configuration
				checkParameterHasArgument(args, argIdx);
				addConfig(settings, args[++argIdx]);
			} else if (arg.equals("-l") || arg.equals("--load")) {
				// -l/--load extension : load extension
				checkParameterHasArgument(args, argIdx);
				extensionNames.add(args[++argIdx]);
			} else if (arg.equals("--list-ext")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When listing extensions, we do not accept other arguments.");
				}
				listExtensions = true;
				return;
			} else if (arg.equals("--hosts")) {
				checkParameterHasArgument(args, argIdx);
				connectOptions.put("hosts", args[++argIdx]);
			} else if (arg.equals("--username")) {
				checkParameterHasArgument(args, argIdx);
				connectOptions.put("username", args[++argIdx]);
			} else if (arg.equals("--password")) {
				checkParameterHasArgument(args, argIdx);
				connectOptions.put("password", args[++argIdx]);
			} else if (arg.equals("--api-key")) {
				checkParameterHasArgument(args, argIdx);
				connectOptions.put("api_key", args[++argIdx]);
			} else if (arg.equals("--use-ssl")) {
				connectOptions.put("use_ssl", Boolean.TRUE);
			} else if (arg.equals("--echo")) {
				echo = true;
			} else if (arg.equals("--dump-syntax")) {
				// --dump-syntax : print the parsed statements without running them
				dumpSyntaxTree = true;
			} else if (arg.equals("-h") || arg.equals("-?")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		while (argIdx < args.length) {
			scriptSources.add(new ScriptFileSource(args[argIdx++]));
		}
		if (dumpSyntaxTree && scriptSources.isEmpty()) {
			throw new IllegalArgumentException("--dump-syntax requires a script.");
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	/**
	 * Parses a setting passed via <code>-c</code> and stores it in the provided
	 * settings instance. Numbers and booleans are converted.
	 *
	 * @param settings settings to mutate
	 * @param keyValue string of the form {@code key=value}
	 */
	private static void addConfig(PeekSettings settings, String keyValue) {
		Matcher m = CONFIG_PATTERN.matcher(keyValue);
		if (!m.matches()) {
			throw new IllegalArgumentException("keyValue \"" + keyValue + "\" must be of the form \"key=value\"");
		}
		String valueString = m.group(2);
		Object value;
		if (valueString.equals("true") || valueString.equals("false")) {
			value = Boolean.valueOf(valueString);
		} else {
			try {
				value = Integer.parseInt(valueString);
			} catch (NumberFormatException nfe) {
				try {
					value = Double.parseDouble(valueString);
				} catch (NumberFormatException nfe2) {
					value = valueString;
				}
			}
		}
		if (!settings.put(m.group(1), value)) {
			throw new IllegalArgumentException("Config key \"" + m.group(1) + "\" conflicts with an existing value");
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @return the exit code: 0 if every statement ran, 1 otherwise
	 * @throws IOException if a script cannot be read
	 */
	public int run() throws IOException {
		if (printUsage) {
			usage(out);
			return 0;
		}
		if (listExtensions) {
			Map<String, PeekExtension> available = ExtensionRegistry.listExtensions();
			for (Entry<String, PeekExtension> entry : available.entrySet()) {
				out.println(entry.getKey() + " - " + entry.getValue().getClass().getName());
			}
			return 0;
		}

		List<PeekExtension> extensions = new ArrayList<PeekExtension>();
		for (String extensionName : extensionNames) {
			PeekExtension extension = ExtensionRegistry.resolve(extensionName);
			if (extension == null) {
				throw new IllegalArgumentException("Unknown extension '" + extensionName + "'");
			}
			extensions.add(extension);
		}

		Peek peek = new Peek(settings, new ConsoleDisplay(out, err, settings), HttpPeekClient::create, extensions);
		if (dumpSyntaxTree) {
			for (ScriptSource source : scriptSources) {
				for (Node statement : peek.parse(source.readText())) {
					out.print(statement);
				}
			}
			return 0;
		}

		peek.connect(connectOptions);
		if (!scriptSources.isEmpty()) {
			boolean success = true;
			for (ScriptSource source : scriptSources) {
				success &= peek.processInput(source, echo);
			}
			return success ? 0 : 1;
		}
		repl(peek);
		return 0;
	}

	/**
	 * Reads statements until the end of the input. Each submission is stored in
	 * the history, then run.
	 */
	private void repl(Peek peek) throws IOException {
		BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
		StringBuilder buffer = new StringBuilder();
		String line;
		while ((line = reader.readLine()) != null) {
			if (line.trim().isEmpty()) {
				submit(peek, buffer);
			} else {
				buffer.append(line).append('\n');
			}
		}
		submit(peek, buffer);
	}

	private void submit(Peek peek, StringBuilder buffer) {
		if (buffer.length() == 0) {
			return;
		}
		String text = buffer.toString();
		buffer.setLength(0);
		peek.getHistory().store(text);
		peek.processInput(text, echo);
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [--hosts hosts]" +
								" [--username user]" +
								" [--password password]" +
								" [--api-key id:key]" +
								" [--use-ssl]" +
								" [-c key=value]..." +
								" [-l extension]..." +
								" [--echo]" +
								" [--dump-syntax]" +
								" [-f script-filename | -e statements]..." +
								" [script-filename]...");
		dest.println();
		dest.println("java -jar " + JAR_NAME + " --list-ext");
		dest.println();
		dest.println(" -f filename = Run the statements of filename.");
		dest.println(" -e statements = Run the specified statements.");
		dest.println(" -c key=value = Set a configuration value, e.g. display.pretty=false.");
		dest.println(" -l extension = Load an extension by extension name or class name.");
		dest.println(" --load extension = Same as -l.");
		dest.println("                      Extensions must already be on the class path before loading them.");
		dest.println(" --hosts hosts = Comma-separated hosts of the initial connection.");
		dest.println(" --username user, --password password = Basic authentication of the initial connection.");
		dest.println(" --api-key id:key = API key authentication of the initial connection.");
		dest.println(" --use-ssl = Use https for hosts without a scheme.");
		dest.println(" --echo = Display each statement before running it.");
		dest.println(" --dump-syntax = Print the parsed statements without running them.");
		dest.println(" --list-ext = List available extensions.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
		dest.println();
		dest.println("Without script, statements are read from the standard input; an empty line runs them.");
	}

	/**
	 * Parses arguments, executes the CLI, and returns its exit code.
	 *
	 * @param args command-line arguments
	 * @param is input stream for interactive input
	 * @param os output stream for results
	 * @param es error stream for errors
	 * @return the exit code
	 * @throws IOException if a script cannot be read
	 */
	public static int create(String[] args, InputStream is, PrintStream os, PrintStream es) throws IOException {
		Cli cli = new Cli(is, os, es);
		cli.parse(args);
		return cli.run();
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		try {
			Cli cli = new Cli();
			cli.parse(args);
			System.exit(cli.run());
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			e.printStackTrace(System.err);
			System.exit(1);
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		}
	}
}
