package org.springaicommunity.release.resolver;

import java.time.Duration;

/**
 * Request budget a provider declares for itself: at most {@code permits} requests per
 * {@code per}, and never two requests closer than {@code minSpacing}.
 *
 * @param permits bucket capacity, also the burst size
 * @param per window in which the bucket refills completely
 * @param minSpacing minimum delay between two consecutive requests
 */
public record RateBudget(int permits, Duration per, Duration minSpacing) {

	public RateBudget {
		if (permits <= 0) {
			throw new IllegalArgumentException("permits must be positive");
		}
		if (per.isNegative() || per.isZero()) {
			throw new IllegalArgumentException("per must be positive");
		}
		if (minSpacing.isNegative()) {
			throw new IllegalArgumentException("minSpacing must not be negative");
		}
	}

	public static RateBudget perMinute(int permits, Duration minSpacing) {
		return new RateBudget(permits, Duration.ofMinutes(1), minSpacing);
	}

	public static RateBudget perHour(int permits, Duration minSpacing) {
		return new RateBudget(permits, Duration.ofHours(1), minSpacing);
	}

}
