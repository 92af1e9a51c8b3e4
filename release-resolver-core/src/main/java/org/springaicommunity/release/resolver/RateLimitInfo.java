package org.springaicommunity.release.resolver;

import java.time.Instant;

import org.jspecify.annotations.Nullable;

/**
 * Request allowance a provider reports through {@code X-RateLimit-*} headers. Fed back
 * into the provider's {@link TokenBucket} so pacing follows the provider's own count.
 *
 * @param limit requests allowed per window, -1 if not reported
 * @param remaining requests left in the current window
 * @param resetAt start of the next window, if reported
 * @param used requests spent in the current window, -1 if not reported
 */
public record RateLimitInfo(int limit, int remaining, @Nullable Instant resetAt, int used) {

	private static final int LOW_WATERMARK = 100;

	/**
	 * Build from raw header values.
	 * @param limit {@code X-RateLimit-Limit}, -1 when absent
	 * @param remaining {@code X-RateLimit-Remaining}
	 * @param resetEpochSeconds {@code X-RateLimit-Reset}, -1 when absent
	 * @param used {@code X-RateLimit-Used}, -1 when absent
	 * @return the rate limit
	 */
	public static RateLimitInfo fromHeaders(int limit, int remaining, long resetEpochSeconds, int used) {
		Instant resetAt = resetEpochSeconds > 0 ? Instant.ofEpochSecond(resetEpochSeconds) : null;
		return new RateLimitInfo(limit, remaining, resetAt, used);
	}

	public boolean isExhausted() {
		return remaining <= 0;
	}

	public boolean isLow() {
		return remaining < LOW_WATERMARK;
	}

	/**
	 * Whether requests must wait for the next window at {@code now}.
	 */
	public boolean blocksAt(Instant now) {
		return isExhausted() && resetAt != null && resetAt.isAfter(now);
	}

}
