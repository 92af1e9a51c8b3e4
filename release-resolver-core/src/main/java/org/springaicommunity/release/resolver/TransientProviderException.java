package org.springaicommunity.release.resolver;

import java.time.Duration;

import org.jspecify.annotations.Nullable;

/**
 * A retryable provider failure: timeout, network error, 5xx or rate limiting. Retried by
 * {@link FetchGate}; callers only see it once retries are exhausted.
 */
public class TransientProviderException extends ResolutionException {

	private final int statusCode;

	@Nullable
	private final Duration retryAfter;

	public TransientProviderException(String message, int statusCode, @Nullable Duration retryAfter) {
		super(message);
		this.statusCode = statusCode;
		this.retryAfter = retryAfter;
	}

	public TransientProviderException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = -1;
		this.retryAfter = null;
	}

	/**
	 * HTTP status code, or -1 when the failure happened below HTTP.
	 */
	public int getStatusCode() {
		return statusCode;
	}

	/**
	 * How long the provider asked us to wait, if it said so.
	 */
	@Nullable
	public Duration getRetryAfter() {
		return retryAfter;
	}

	public boolean isRateLimited() {
		return statusCode == 429 || statusCode == 403;
	}

}
