package org.springaicommunity.release.resolver;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * {@link ApiClient} on top of the Java 11+ {@link HttpClient}.
 *
 * <p>
 * Extracts rate limit headers from all responses and makes them available via
 * {@link #getLastRateLimitInfo()}. Status codes map to the engine's error taxonomy:
 * <ul>
 * <li>2xx and 304: returned</li>
 * <li>429, and 403 with no remaining rate limit: transient, with a retry-after hint from
 * {@code Retry-After} or {@code X-RateLimit-Reset}</li>
 * <li>5xx, I/O errors and timeouts: transient</li>
 * <li>any other 4xx: permanent</li>
 * </ul>
 */
public class JdkApiClient implements ApiClient {

	private static final Logger logger = LoggerFactory.getLogger(JdkApiClient.class);

	private final HttpClient httpClient;

	private final String userAgent;

	private final Duration requestTimeout;

	private final Clock clock;

	@Nullable
	private volatile RateLimitInfo lastRateLimitInfo;

	public JdkApiClient(String userAgent, Duration connectTimeout, Duration requestTimeout) {
		this(HttpClient.newBuilder()
			.connectTimeout(connectTimeout)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build(), userAgent, requestTimeout, Clock.systemUTC());
	}

	JdkApiClient(HttpClient httpClient, String userAgent, Duration requestTimeout, Clock clock) {
		this.httpClient = httpClient;
		this.userAgent = userAgent;
		this.requestTimeout = requestTimeout;
		this.clock = clock;
	}

	@Override
	@Nullable
	public RateLimitInfo getLastRateLimitInfo() {
		return lastRateLimitInfo;
	}

	@Override
	public ApiResponse get(String url, Map<String, String> headers) {
		logger.debug("GET {}", url);
		long start = System.currentTimeMillis();

		HttpRequest.Builder builder = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.timeout(requestTimeout)
			.header("User-Agent", userAgent)
			.GET();
		headers.forEach(builder::header);

		try {
			ApiResponse response = executeRequest(builder.build());
			logger.debug("GET {} completed in {}ms ({}, {} bytes)", url, System.currentTimeMillis() - start,
					response.statusCode(), response.body().length());
			return response;
		}
		catch (RuntimeException e) {
			logger.debug("GET {} failed after {}ms: {}", url, System.currentTimeMillis() - start, e.getMessage());
			throw e;
		}
	}

	private ApiResponse executeRequest(HttpRequest request) {
		HttpResponse<String> response;
		try {
			response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
		}
		catch (HttpTimeoutException e) {
			throw new TransientProviderException("Request timed out: " + request.uri(), e);
		}
		catch (IOException e) {
			logger.warn("HTTP request failed: {}", e.getMessage());
			throw new TransientProviderException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new CancellationException("HTTP request interrupted: " + request.uri());
		}

		// Extract rate limit headers from ALL responses (2xx included)
		int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
		long reset = parseLongHeader(response, "X-RateLimit-Reset", -1);
		int limit = parseIntHeader(response, "X-RateLimit-Limit", -1);
		int used = parseIntHeader(response, "X-RateLimit-Used", -1);

		RateLimitInfo rateLimit = null;
		if (remaining >= 0) {
			rateLimit = RateLimitInfo.fromHeaders(limit, remaining, reset, used);
			this.lastRateLimitInfo = rateLimit;
			if (rateLimit.isLow()) {
				logger.info("Rate limit low for {}: {}/{} remaining, resets at epoch {}", request.uri().getHost(),
						remaining, limit, reset);
			}
			else {
				logger.debug("Rate limit: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
			}
		}

		int statusCode = response.statusCode();
		String etag = response.headers().firstValue("ETag").orElse(null);
		if ((statusCode >= 200 && statusCode < 300) || statusCode == 304) {
			return new ApiResponse(statusCode, response.body(), etag, rateLimit);
		}
		else if (statusCode == 429 || (statusCode == 403 && remaining == 0)) {
			throw new TransientProviderException("Rate limited (" + statusCode + ") by " + request.uri().getHost(),
					statusCode, retryAfter(response, reset));
		}
		else if (statusCode >= 500) {
			throw new TransientProviderException("Server error " + statusCode + " from " + request.uri(), statusCode,
					retryAfter(response, reset));
		}
		else if (statusCode == 401) {
			throw new PermanentProviderException("Unauthorized: bad credentials for " + request.uri().getHost(),
					statusCode);
		}
		else if (statusCode == 404 || statusCode == 410) {
			throw new PermanentProviderException("Not found: " + request.uri(), statusCode);
		}
		else {
			throw new PermanentProviderException("Request to " + request.uri() + " failed with status " + statusCode,
					statusCode);
		}
	}

	@Nullable
	private Duration retryAfter(HttpResponse<?> response, long resetEpochSeconds) {
		long retryAfterSeconds = parseLongHeader(response, "Retry-After", -1);
		if (retryAfterSeconds >= 0) {
			return Duration.ofSeconds(retryAfterSeconds);
		}
		if (resetEpochSeconds > 0) {
			long waitSeconds = resetEpochSeconds - clock.instant().getEpochSecond() + 1; // +1s buffer
			if (waitSeconds > 0) {
				return Duration.ofSeconds(waitSeconds);
			}
		}
		return null;
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Integer.parseInt(v.trim());
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v.trim());
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

}
