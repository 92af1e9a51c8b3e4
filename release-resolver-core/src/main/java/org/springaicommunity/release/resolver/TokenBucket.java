package org.springaicommunity.release.resolver;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Token bucket pacing the requests to one provider. Holds {@link RateBudget#permits()}
 * tokens, refills them linearly over {@link RateBudget#per()} and additionally keeps
 * {@link RateBudget#minSpacing()} between two grants. Rate limits reported by the provider
 * ({@link #observe(RateLimitInfo)}) lower the available tokens and, once exhausted, hold
 * every grant until the provider's reset time.
 *
 * <p>
 * Waiters are served in arrival order: the fair lock is held while a waiter sleeps, so a
 * later caller cannot overtake it.
 */
public class TokenBucket {

	private static final Logger logger = LoggerFactory.getLogger(TokenBucket.class);

	private final String name;

	private final RateBudget budget;

	private final Clock clock;

	private final Sleeper sleeper;

	private final ReentrantLock lock = new ReentrantLock(true);

	private double tokens;

	private Instant lastRefill;

	@Nullable
	private Instant lastGrant;

	@Nullable
	private Instant blockedUntil;

	public TokenBucket(String name, RateBudget budget, Clock clock, Sleeper sleeper) {
		this.name = name;
		this.budget = budget;
		this.clock = clock;
		this.sleeper = sleeper;
		this.tokens = budget.permits();
		this.lastRefill = clock.instant();
	}

	/**
	 * Take one token, waiting as long as needed.
	 * @throws InterruptedException if interrupted while waiting
	 */
	public void acquire() throws InterruptedException {
		lock.lockInterruptibly();
		try {
			while (true) {
				Instant now = clock.instant();
				refill(now);
				Duration wait = waitTime(now);
				if (wait.isZero()) {
					tokens -= 1;
					lastGrant = now;
					return;
				}
				logger.debug("Pacing requests to {}: waiting {}ms", name, wait.toMillis());
				sleeper.sleep(wait);
			}
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Align the bucket with the rate limit the provider reported.
	 * @param info rate limit from the latest response
	 */
	public void observe(RateLimitInfo info) {
		lock.lock();
		try {
			Instant now = clock.instant();
			refill(now);
			tokens = Math.min(tokens, Math.max(info.remaining(), 0));
			if (info.blocksAt(now)) {
				blockedUntil = info.resetAt();
				logger.warn("{} rate limit exhausted, holding requests until {}", name, blockedUntil);
			}
		}
		finally {
			lock.unlock();
		}
	}

	double availableTokens() {
		lock.lock();
		try {
			refill(clock.instant());
			return tokens;
		}
		finally {
			lock.unlock();
		}
	}

	private void refill(Instant now) {
		long elapsedNanos = Duration.between(lastRefill, now).toNanos();
		if (elapsedNanos > 0) {
			double added = (double) elapsedNanos * budget.permits() / budget.per().toNanos();
			tokens = Math.min(budget.permits(), tokens + added);
			lastRefill = now;
		}
	}

	private Duration waitTime(Instant now) {
		if (blockedUntil != null) {
			if (blockedUntil.isAfter(now)) {
				return Duration.between(now, blockedUntil);
			}
			blockedUntil = null;
			tokens = Math.max(tokens, 1);
		}
		Duration spacingWait = Duration.ZERO;
		if (lastGrant != null) {
			Instant next = lastGrant.plus(budget.minSpacing());
			if (next.isAfter(now)) {
				spacingWait = Duration.between(now, next);
			}
		}
		Duration tokenWait = Duration.ZERO;
		if (tokens < 1) {
			double missing = 1 - tokens;
			long nanos = (long) Math.ceil(missing * budget.per().toNanos() / budget.permits());
			tokenWait = Duration.ofNanos(Math.max(nanos, 1));
		}
		return spacingWait.compareTo(tokenWait) >= 0 ? spacingWait : tokenWait;
	}

}
