package org.springaicommunity.release.resolver;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link JdkApiClient} against an in-process HTTP server.
 */
@DisplayName("JdkApiClient Tests")
class JdkApiClientTest {

	private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

	private HttpServer server;

	private final Map<String, String> receivedHeaders = new ConcurrentHashMap<>();

	private JdkApiClient client;

	private String baseUrl;

	@BeforeEach
	void setUp() throws IOException {
		server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
		server.createContext("/ok", exchange -> {
			receivedHeaders.put("User-Agent", exchange.getRequestHeaders().getFirst("User-Agent"));
			String accept = exchange.getRequestHeaders().getFirst("Accept");
			if (accept != null) {
				receivedHeaders.put("Accept", accept);
			}
			exchange.getResponseHeaders().add("ETag", "\"abc\"");
			exchange.getResponseHeaders().add("X-RateLimit-Limit", "60");
			exchange.getResponseHeaders().add("X-RateLimit-Remaining", "59");
			exchange.getResponseHeaders().add("X-RateLimit-Reset", String.valueOf(NOW.getEpochSecond() + 3600));
			exchange.getResponseHeaders().add("X-RateLimit-Used", "1");
			respond(exchange, 200, "{\"tag_name\":\"v1.0.0\"}");
		});
		server.createContext("/conditional", exchange -> {
			if ("\"abc\"".equals(exchange.getRequestHeaders().getFirst("If-None-Match"))) {
				exchange.sendResponseHeaders(304, -1);
				exchange.close();
			}
			else {
				respond(exchange, 200, "fresh");
			}
		});
		server.createContext("/missing", exchange -> respond(exchange, 404, "{\"message\":\"Not Found\"}"));
		server.createContext("/unauthorized", exchange -> respond(exchange, 401, "{}"));
		server.createContext("/broken", exchange -> respond(exchange, 502, "bad gateway"));
		server.createContext("/throttled", exchange -> {
			exchange.getResponseHeaders().add("Retry-After", "7");
			respond(exchange, 429, "slow down");
		});
		server.createContext("/exhausted", exchange -> {
			exchange.getResponseHeaders().add("X-RateLimit-Remaining", "0");
			exchange.getResponseHeaders().add("X-RateLimit-Reset", String.valueOf(NOW.getEpochSecond() + 120));
			respond(exchange, 403, "{\"message\":\"API rate limit exceeded\"}");
		});
		server.createContext("/forbidden", exchange -> respond(exchange, 403, "{\"message\":\"Forbidden\"}"));
		server.start();

		baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
		client = new JdkApiClient(HttpClient.newHttpClient(), "release-resolver-test", Duration.ofSeconds(5),
				Clock.fixed(NOW, ZoneOffset.UTC));
	}

	@AfterEach
	void tearDown() {
		server.stop(0);
	}

	private static void respond(HttpExchange exchange, int status, String body) throws IOException {
		byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
		exchange.sendResponseHeaders(status, bytes.length);
		try (OutputStream out = exchange.getResponseBody()) {
			out.write(bytes);
		}
	}

	@Nested
	@DisplayName("Success Tests")
	class SuccessTest {

		@Test
		@DisplayName("Should return body, ETag and rate limit of a 200 response")
		void shouldReturnSuccessfulResponse() {
			ApiResponse response = client.get(baseUrl + "/ok", Map.of("Accept", "application/json"));

			assertThat(response.statusCode()).isEqualTo(200);
			assertThat(response.body()).contains("v1.0.0");
			assertThat(response.etag()).isEqualTo("\"abc\"");
			assertThat(response.rateLimit()).isNotNull();
			assertThat(response.rateLimit().remaining()).isEqualTo(59);
			assertThat(response.rateLimit().resetAt()).isEqualTo(NOW.plusSeconds(3600));
			assertThat(client.getLastRateLimitInfo()).isEqualTo(response.rateLimit());
		}

		@Test
		@DisplayName("Should send the user agent and request headers")
		void shouldSendHeaders() {
			client.get(baseUrl + "/ok", Map.of("Accept", "application/vnd.github+json"));

			assertThat(receivedHeaders).containsEntry("User-Agent", "release-resolver-test")
				.containsEntry("Accept", "application/vnd.github+json");
		}

		@Test
		@DisplayName("Should return 304 responses as not modified")
		void shouldReturnNotModified() {
			ApiResponse response = client.get(baseUrl + "/conditional", Map.of("If-None-Match", "\"abc\""));

			assertThat(response.isNotModified()).isTrue();
			assertThat(response.body()).isEmpty();
		}

	}

	@Nested
	@DisplayName("Error Classification Tests")
	class ErrorClassificationTest {

		@Test
		@DisplayName("Should classify 404 as permanent not-found")
		void shouldClassifyNotFound() {
			assertThatThrownBy(() -> client.get(baseUrl + "/missing", Map.of()))
				.isInstanceOfSatisfying(PermanentProviderException.class, e -> {
					assertThat(e.getStatusCode()).isEqualTo(404);
					assertThat(e.isNotFound()).isTrue();
				});
		}

		@Test
		@DisplayName("Should classify 401 as permanent")
		void shouldClassifyUnauthorized() {
			assertThatThrownBy(() -> client.get(baseUrl + "/unauthorized", Map.of()))
				.isInstanceOf(PermanentProviderException.class)
				.hasMessageContaining("Unauthorized");
		}

		@Test
		@DisplayName("Should classify 403 with remaining quota as permanent")
		void shouldClassifyForbidden() {
			assertThatThrownBy(() -> client.get(baseUrl + "/forbidden", Map.of()))
				.isInstanceOf(PermanentProviderException.class);
		}

		@Test
		@DisplayName("Should classify 5xx as transient")
		void shouldClassifyServerError() {
			assertThatThrownBy(() -> client.get(baseUrl + "/broken", Map.of()))
				.isInstanceOfSatisfying(TransientProviderException.class,
						e -> assertThat(e.getStatusCode()).isEqualTo(502));
		}

		@Test
		@DisplayName("Should classify 429 as transient with the Retry-After hint")
		void shouldClassifyTooManyRequests() {
			assertThatThrownBy(() -> client.get(baseUrl + "/throttled", Map.of()))
				.isInstanceOfSatisfying(TransientProviderException.class, e -> {
					assertThat(e.isRateLimited()).isTrue();
					assertThat(e.getRetryAfter()).isEqualTo(Duration.ofSeconds(7));
				});
		}

		@Test
		@DisplayName("Should derive the retry hint from the rate limit reset time")
		void shouldDeriveRetryHintFromReset() {
			assertThatThrownBy(() -> client.get(baseUrl + "/exhausted", Map.of()))
				.isInstanceOfSatisfying(TransientProviderException.class,
						e -> assertThat(e.getRetryAfter()).isEqualTo(Duration.ofSeconds(121)));
		}

		@Test
		@DisplayName("Should classify connection failures as transient")
		void shouldClassifyConnectionFailure() throws IOException {
			int closedPort;
			try (ServerSocket socket = new ServerSocket(0)) {
				closedPort = socket.getLocalPort();
			}

			assertThatThrownBy(() -> client.get("http://127.0.0.1:" + closedPort + "/ok", Map.of()))
				.isInstanceOf(TransientProviderException.class);
		}

	}

}
