package org.metricshub.peek.client;

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
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.peek.PeekException;
import org.metricshub.peek.util.PeekLogger;
import org.metricshub.peek.util.PeekSettings;
import org.slf4j.Logger;

/**
 * A {@link PeekClient} talking HTTP to the REST API of a cluster.
 * <p>
 * Hosts are tried in order: when a host cannot be reached, the next one is
 * used. Authentication is either basic (<code>username</code> and
 * <code>password</code>) or by API key (<code>api_key</code>, as
 * <code>id:key</code>).
 */
public class HttpPeekClient implements PeekClient {

	private static final Logger LOG = PeekLogger.getLogger(HttpPeekClient.class);

	private static final ObjectMapper MAPPER = new ObjectMapper();

	/** Environment variable holding the password when only a username is given */
	public static final String PASSWORD_VARIABLE = "PEEK_PASSWORD";

	private final List<String> hosts;
	private final String username;
	private final String authorization;
	private final boolean useSsl;
	private final HttpClient httpClient;
	private String name;

	/**
	 * @param hosts <code>host:port</code> or full URLs
	 * @param useSsl whether https is used for hosts without a scheme
	 * @param username user name, for display, may be <code>null</code>
	 * @param authorization value of the Authorization header, may be
	 *        <code>null</code>
	 * @param name name of the connection, may be <code>null</code>
	 */
	public HttpPeekClient(List<String> hosts, boolean useSsl, String username, String authorization, String name) {
		if (hosts.isEmpty()) {
			throw new IllegalArgumentException("At least one host is required");
		}
		this.hosts = Collections.unmodifiableList(new ArrayList<String>(hosts));
		this.useSsl = useSsl;
		this.username = username;
		this.authorization = authorization;
		this.name = name;
		this.httpClient = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).build();
	}

	/**
	 * Creates a client from the options of the <code>connect</code> function.
	 * This is the default {@link PeekClientFactory}.
	 *
	 * @param options <code>hosts</code> (comma-separated), <code>username</code>,
	 *        <code>password</code>, <code>api_key</code>, <code>use_ssl</code>,
	 *        <code>name</code>
	 * @param settings provides <code>connection.hosts</code> and
	 *        <code>connection.use_ssl</code> defaults
	 * @return the new client
	 * @throws PeekException when the credentials are incomplete
	 */
	public static HttpPeekClient create(Map<String, Object> options, PeekSettings settings) {
		String hostList = stringOption(options, "hosts");
		if (hostList == null) {
			hostList = settings.getString(PeekSettings.CONNECTION_HOSTS, "localhost:9200");
		}
		List<String> hosts = new ArrayList<String>();
		for (String host : hostList.split(",")) {
			if (!host.trim().isEmpty()) {
				hosts.add(host.trim());
			}
		}

		boolean useSsl;
		Object useSslOption = options.get("use_ssl");
		if (useSslOption == null) {
			useSsl = settings.asBool(PeekSettings.CONNECTION_USE_SSL);
		} else if (useSslOption instanceof Boolean) {
			useSsl = (Boolean) useSslOption;
		} else {
			useSsl = Boolean.parseBoolean(useSslOption.toString());
		}

		String username = stringOption(options, "username");
		String password = stringOption(options, "password");
		String apiKey = stringOption(options, "api_key");
		String authorization = null;
		if (apiKey != null) {
			LOG.debug("Connecting with API key");
			authorization = "ApiKey " + base64(apiKey);
		} else {
			if (username == null && password != null) {
				throw new PeekException("Username is required for userpass authentication");
			}
			if (username != null && password == null) {
				password = System.getenv(PASSWORD_VARIABLE);
				if (password == null) {
					throw new PeekException("Password is not found and password prompt is disabled");
				}
			}
			if (username != null) {
				authorization = "Basic " + base64(username + ":" + password);
			}
		}
		return new HttpPeekClient(hosts, useSsl, username, authorization, stringOption(options, "name"));
	}

	private static String stringOption(Map<String, Object> options, String key) {
		Object value = options.get(key);
		return value == null ? null : value.toString();
	}

	private static String base64(String text) {
		return Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
	}

	@Override
	public Object performRequest(String method, String path, String payload, Map<String, String> headers)
			throws IOException {
		LOG.debug("Performing request: {} {} {}", method, path, payload);
		IOException failure = null;
		for (String host : getHostUrls()) {
			try {
				return send(toUri(host, path), method, payload, headers);
			} catch (RequestException e) {
				throw e;
			} catch (InterruptedIOException e) {
				throw e;
			} catch (IOException e) {
				LOG.warn("Cannot reach {}: {}", host, e.getMessage());
				failure = e;
			}
		}
		throw failure;
	}

	/**
	 * Builds the URI of a request. Characters that are not legal in a URI,
	 * such as <code>|</code> in <code>_cat/indices?h=index|health</code>, are
	 * quoted.
	 *
	 * @param host host URL, with its scheme
	 * @param path path and query, as typed
	 * @return the request URI
	 * @throws RequestException when no URI can be built
	 */
	static URI toUri(String host, String path) throws RequestException {
		String absolutePath = path.startsWith("/") ? path : "/" + path;
		try {
			return URI.create(host + absolutePath);
		} catch (IllegalArgumentException e) {
			LOG.debug("Quoting request URI {}{}: {}", host, absolutePath, e.getMessage());
		}
		try {
			URI base = URI.create(host);
			int question = absolutePath.indexOf('?');
			String pathPart = question < 0 ? absolutePath : absolutePath.substring(0, question);
			String query = question < 0 ? null : absolutePath.substring(question + 1);
			String basePath = base.getPath() == null ? "" : base.getPath();
			return new URI(base.getScheme(), base.getAuthority(), basePath + pathPart, query, null);
		} catch (URISyntaxException | IllegalArgumentException e) {
			throw new RequestException(-1, null, "Invalid request URI " + host + absolutePath + ": " + e.getMessage());
		}
	}

	private String send(URI uri, String method, String payload, Map<String, String> headers) throws IOException {
		HttpRequest.Builder builder = HttpRequest
				.newBuilder(uri)
				.method(
						method,
						payload == null ?
								HttpRequest.BodyPublishers.noBody() :
								HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8));
		if (payload != null) {
			int firstNewline = payload.indexOf('\n');
			boolean multiline = firstNewline >= 0 && firstNewline < payload.length() - 1;
			builder.header("Content-Type", multiline ? "application/x-ndjson" : "application/json");
		}
		if (authorization != null) {
			builder.header("Authorization", authorization);
		}
		if (headers != null) {
			for (Map.Entry<String, String> header : headers.entrySet()) {
				builder.header(header.getKey(), header.getValue());
			}
		}

		HttpResponse<String> response;
		try {
			response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new InterruptedIOException("Interrupted while waiting for " + uri);
		}
		LOG.debug("Response status {} from {}", response.statusCode(), uri);
		if (response.statusCode() >= 400) {
			throw new RequestException(
					response.statusCode(),
					decode(response.body()),
					"Request " + method + " " + uri + " failed with status " + response.statusCode());
		}
		return response.body();
	}

	private static Object decode(String body) {
		if (body == null || body.isEmpty()) {
			return null;
		}
		try {
			return MAPPER.readValue(body, Object.class);
		} catch (JsonProcessingException e) {
			LOG.debug("Error response is not JSON: {}", e.getOriginalMessage());
			return body;
		}
	}

	/**
	 * @return the hosts with their scheme
	 */
	public List<String> getHostUrls() {
		List<String> urls = new ArrayList<String>();
		for (String host : hosts) {
			if (host.startsWith("https://") || host.startsWith("http://")) {
				urls.add(host.endsWith("/") ? host.substring(0, host.length() - 1) : host);
			} else {
				urls.add((useSsl ? "https://" : "http://") + host);
			}
		}
		return urls;
	}

	public String getUsername() {
		return username;
	}

	@Override
	public String getName() {
		return name;
	}

	@Override
	public void setName(String name) {
		this.name = name;
	}

	@Override
	public Map<String, Object> info() {
		Map<String, Object> info = new LinkedHashMap<String, Object>();
		info.put("name", name);
		info.put("hosts", String.join(",", hosts));
		info.put("username", username);
		info.put("use_ssl", useSsl);
		info.put("auth", authorization == null ? null : authorization.substring(0, authorization.indexOf(' ')));
		return info;
	}

	@Override
	public String toString() {
		String description = (username == null ? "" : username) + " @ " + String.join(",", getHostUrls());
		return name == null ? description : name + " (" + description + ")";
	}
}
