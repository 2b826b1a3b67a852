package org.metricshub.peek.client;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.junit.Assume.assumeTrue;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.metricshub.peek.PeekException;
import org.metricshub.peek.backend.PeekVM;
import org.metricshub.peek.util.PeekSettings;

public class HttpPeekClientTest {

	/** What the server received */
	private static final class Received {
		final String method;
		final String uri;
		final String contentType;
		final String authorization;
		final String runas;
		final String body;

		Received(HttpExchange exchange, String body) {
			this.method = exchange.getRequestMethod();
			this.uri = exchange.getRequestURI().toString();
			this.contentType = exchange.getRequestHeaders().getFirst("Content-Type");
			this.authorization = exchange.getRequestHeaders().getFirst("Authorization");
			this.runas = exchange.getRequestHeaders().getFirst(PeekVM.RUNAS_HEADER);
			this.body = body;
		}
	}

	private HttpServer server;
	private final List<Received> received = new CopyOnWriteArrayList<Received>();
	private String host;

	@Before
	public void startServer() throws IOException {
		server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
		server.createContext("/", exchange -> {
			String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
			received.add(new Received(exchange, body));
			String path = exchange.getRequestURI().getPath();
			if (path.startsWith("/missing")) {
				respond(exchange, 404, "{\"error\":{\"type\":\"index_not_found_exception\"},\"status\":404}");
			} else if (path.startsWith("/broken")) {
				respond(exchange, 500, "internal trouble");
			} else {
				respond(exchange, 200, "{\"acknowledged\":true}");
			}
		});
		server.start();
		host = "127.0.0.1:" + server.getAddress().getPort();
	}

	private static void respond(HttpExchange exchange, int status, String text) throws IOException {
		byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
		exchange.sendResponseHeaders(status, bytes.length);
		try (OutputStream out = exchange.getResponseBody()) {
			out.write(bytes);
		}
	}

	@After
	public void stopServer() {
		server.stop(0);
	}

	private static Map<String, Object> options(Object... keyValues) {
		Map<String, Object> options = new LinkedHashMap<String, Object>();
		for (int i = 0; i < keyValues.length; i += 2) {
			options.put((String) keyValues[i], keyValues[i + 1]);
		}
		return options;
	}

	@Test
	public void testHostUrls() {
		HttpPeekClient client = HttpPeekClient
				.create(options("hosts", "a:9200, https://b:9243/,", "name", "main"), new PeekSettings());
		assertEquals(Arrays.asList("http://a:9200", "https://b:9243"), client.getHostUrls());
		assertEquals("main ( @ http://a:9200,https://b:9243)", client.toString());

		client = HttpPeekClient.create(options("hosts", "a:9200", "use_ssl", Boolean.TRUE), new PeekSettings());
		assertEquals(Collections.singletonList("https://a:9200"), client.getHostUrls());
	}

	@Test
	public void testDefaultsFromSettings() {
		PeekSettings settings = new PeekSettings();
		settings.put(PeekSettings.CONNECTION_HOSTS, "x:1,y:2");
		settings.put(PeekSettings.CONNECTION_USE_SSL, Boolean.TRUE);
		HttpPeekClient client = HttpPeekClient.create(options(), settings);
		assertEquals(Arrays.asList("https://x:1", "https://y:2"), client.getHostUrls());
		assertNull(client.getName());
	}

	@Test
	public void testInfo() {
		HttpPeekClient client = HttpPeekClient
				.create(options("hosts", "a:9200", "username", "elastic", "password", "secret"), new PeekSettings());
		Map<String, Object> info = client.info();
		assertEquals("a:9200", info.get("hosts"));
		assertEquals("elastic", info.get("username"));
		assertEquals(Boolean.FALSE, info.get("use_ssl"));
		assertEquals("Basic", info.get("auth"));
		assertFalse(info.toString().contains("secret"));
		assertEquals("elastic @ http://a:9200", client.toString());

		client.setName("renamed");
		assertEquals("renamed", client.info().get("name"));
	}

	@Test
	public void testIncompleteCredentials() {
		PeekException e = assertThrows(
				PeekException.class,
				() -> HttpPeekClient.create(options("password", "secret"), new PeekSettings()));
		assertEquals("Username is required for userpass authentication", e.getMessage());

		assumeTrue(System.getenv(HttpPeekClient.PASSWORD_VARIABLE) == null);
		e = assertThrows(
				PeekException.class,
				() -> HttpPeekClient.create(options("username", "elastic"), new PeekSettings()));
		assertEquals("Password is not found and password prompt is disabled", e.getMessage());
	}

	@Test
	public void testRequestWithBasicAuthentication() throws IOException {
		HttpPeekClient client = HttpPeekClient
				.create(options("hosts", host, "username", "elastic", "password", "secret"), new PeekSettings());
		Object response = client
				.performRequest("PUT", "/idx?pretty", "{\"a\":1}\n", Collections.singletonMap(PeekVM.RUNAS_HEADER, "bob"));
		assertEquals("{\"acknowledged\":true}", response);

		Received request = received.get(0);
		assertEquals("PUT", request.method);
		assertEquals("/idx?pretty", request.uri);
		assertEquals("application/json", request.contentType);
		assertEquals("Basic ZWxhc3RpYzpzZWNyZXQ=", request.authorization);
		assertEquals("bob", request.runas);
		assertEquals("{\"a\":1}\n", request.body);
	}

	@Test
	public void testMultiLinePayloadIsNdjson() throws IOException {
		HttpPeekClient client = HttpPeekClient.create(options("hosts", host, "api_key", "id:key"), new PeekSettings());
		client.performRequest("POST", "_bulk", "{\"index\":{}}\n{\"f\":1}\n", null);

		Received request = received.get(0);
		assertEquals("/_bulk", request.uri);
		assertEquals("application/x-ndjson", request.contentType);
		assertEquals("ApiKey aWQ6a2V5", request.authorization);
		assertNull(request.runas);
	}

	@Test
	public void testErrorStatus() {
		HttpPeekClient client = HttpPeekClient.create(options("hosts", host), new PeekSettings());

		RequestException e = assertThrows(
				RequestException.class,
				() -> client.performRequest("GET", "/missing", null, null));
		assertEquals(404, e.getStatusCode());
		assertTrue(e.hasInfo());
		assertEquals(Integer.valueOf(404), ((Map<?, ?>) e.getInfo()).get("status"));
		assertNull(received.get(0).contentType);

		e = assertThrows(RequestException.class, () -> client.performRequest("GET", "/broken", null, null));
		assertEquals(500, e.getStatusCode());
		assertEquals("internal trouble", e.getInfo());
	}

	@Test
	public void testPathWithCharactersToQuote() throws IOException {
		HttpPeekClient client = HttpPeekClient.create(options("hosts", host), new PeekSettings());
		client.performRequest("GET", "_cat/indices?h=index|health", null, null);
		client.performRequest("GET", "/idx/_doc/a b", null, null);
		assertEquals("/_cat/indices?h=index%7Chealth", received.get(0).uri);
		assertEquals("/idx/_doc/a%20b", received.get(1).uri);
	}

	@Test
	public void testRequestUri() throws IOException {
		assertEquals("http://a:9200/_search?q=x%3Ay", HttpPeekClient.toUri("http://a:9200", "_search?q=x%3Ay").toString());
		assertEquals("https://a/prefix/x%7Cy", HttpPeekClient.toUri("https://a/prefix", "x|y").toString());

		RequestException e = assertThrows(RequestException.class, () -> HttpPeekClient.toUri("http://[bad", "/x"));
		assertEquals(-1, e.getStatusCode());
		assertFalse(e.hasInfo());
	}

	@Test
	public void testFailover() throws IOException {
		HttpPeekClient client = HttpPeekClient.create(options("hosts", "127.0.0.1:1," + host), new PeekSettings());
		assertEquals("{\"acknowledged\":true}", client.performRequest("GET", "/", null, null));
		assertEquals(1, received.size());
	}

	@Test
	public void testUnreachable() {
		HttpPeekClient client = HttpPeekClient.create(options("hosts", "127.0.0.1:1"), new PeekSettings());
		IOException e = assertThrows(IOException.class, () -> client.performRequest("GET", "/", null, null));
		assertFalse(e instanceof RequestException);
	}
}
