package org.springaicommunity.release.resolver;

import java.util.Map;

import org.jspecify.annotations.Nullable;

/**
 * Interface for the HTTP GET calls providers make.
 *
 * <p>
 * Provides abstraction over the transport, enabling testability with mocks. Failures are
 * classified at this boundary: implementations throw {@link TransientProviderException}
 * for retryable conditions and {@link PermanentProviderException} for the rest.
 */
public interface ApiClient {

	/**
	 * Execute a GET request.
	 * @param url absolute URL
	 * @param headers request headers, e.g. Accept, Authorization, If-None-Match
	 * @return the response; status is 2xx or 304
	 * @throws TransientProviderException for network errors, 5xx and rate limiting
	 * @throws PermanentProviderException for other 4xx responses
	 */
	ApiResponse get(String url, Map<String, String> headers);

	/**
	 * Get the rate limit information from the most recent API response. Returns null if
	 * no rate limit headers have been observed yet.
	 * @return last observed RateLimitInfo, or null
	 */
	@Nullable
	default RateLimitInfo getLastRateLimitInfo() {
		return null;
	}

}
