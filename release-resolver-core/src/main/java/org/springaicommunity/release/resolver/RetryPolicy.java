package org.springaicommunity.release.resolver;

import java.time.Duration;

/**
 * Bounded exponential backoff for {@link TransientProviderException}s.
 *
 * @param maxAttempts total number of producer invocations, including the first
 * @param initialDelay delay before the first retry, doubled for every further retry
 * @param maxDelay upper bound of the computed backoff
 * @param maxRetryAfter longest provider-supplied retry-after hint that is honored; longer
 * hints fall back to the computed backoff
 */
public record RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay, Duration maxRetryAfter) {

	public RetryPolicy {
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts must be at least 1");
		}
		if (initialDelay.isNegative() || maxDelay.isNegative() || maxRetryAfter.isNegative()) {
			throw new IllegalArgumentException("delays must not be negative");
		}
	}

	public static RetryPolicy defaults() {
		return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), Duration.ofMinutes(5));
	}

	/**
	 * Delay to wait after a failed attempt.
	 * @param failedAttempt 1-based number of the attempt that just failed
	 * @param failure the failure
	 * @return how long to wait before the next attempt
	 */
	public Duration delayAfter(int failedAttempt, TransientProviderException failure) {
		Duration hint = failure.getRetryAfter();
		if (hint != null && !hint.isNegative() && hint.compareTo(maxRetryAfter) <= 0) {
			return hint;
		}
		Duration delay = initialDelay;
		for (int i = 1; i < failedAttempt && delay.compareTo(maxDelay) < 0; i++) {
			delay = delay.multipliedBy(2);
		}
		return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
	}

}
