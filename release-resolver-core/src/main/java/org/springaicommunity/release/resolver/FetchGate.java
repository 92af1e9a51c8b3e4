package org.springaicommunity.release.resolver;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for every outbound provider request: caches responses, paces
 * requests per provider and retries transient failures.
 *
 * <p>
 * Behavior of {@link #fetch(CacheKey, RateBudget, FetchProducer)}:
 * <ul>
 * <li>An entry younger than the TTL is returned without calling the producer</li>
 * <li>At most one producer runs per key; concurrent callers for the same key wait for its
 * result</li>
 * <li>Each producer invocation first takes a permit from the provider's
 * {@link TokenBucket}; rate limits reported with a response adjust that bucket</li>
 * <li>The producer gets the freshness token of the expired entry; a not-modified answer
 * keeps the old payload with a new timestamp</li>
 * <li>{@link TransientProviderException}s are retried per {@link RetryPolicy}; once
 * retries are exhausted the last failure propagates and the expired entry stays as it
 * was. It is served instead only when stale fallback was enabled.</li>
 * <li>Any other exception propagates immediately</li>
 * <li>An interrupted fetch writes nothing; callers waiting on it start a fetch of their
 * own</li>
 * </ul>
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * FetchGate gate = FetchGate.builder()
 *     .ttl(Duration.ofMinutes(30))
 *     .retryPolicy(new RetryPolicy(5, Duration.ofSeconds(2), Duration.ofSeconds(30), Duration.ofMinutes(5)))
 *     .build();
 *
 * JsonNode releases = gate.fetch(new CacheKey("github", "owner/repo", "releases?page=1"), budget,
 *         token -> FetchGate.FetchResult.of(download(token), etag));
 * }
 * </pre>
 */
public final class FetchGate {

	private static final Logger logger = LoggerFactory.getLogger(FetchGate.class);

	/**
	 * Performs the actual request for one cache key.
	 */
	@FunctionalInterface
	public interface FetchProducer {

		/**
		 * Fetch the payload.
		 * @param freshnessToken token of the cached entry being refreshed, or null
		 * @return the fetched payload, or a not-modified result
		 * @throws TransientProviderException for retryable failures
		 */
		FetchResult fetch(@Nullable String freshnessToken);

	}

	/**
	 * Outcome of one producer invocation.
	 *
	 * @param payload fetched payload, null when the provider answered not-modified
	 * @param freshnessToken token to send on the next refresh, if any
	 * @param rateLimit rate limit the provider reported with the response, if any
	 */
	public record FetchResult(@Nullable JsonNode payload, @Nullable String freshnessToken,
			@Nullable RateLimitInfo rateLimit) {

		public static FetchResult of(JsonNode payload, @Nullable String freshnessToken) {
			return new FetchResult(payload, freshnessToken, null);
		}

		public static FetchResult notModified(@Nullable String freshnessToken) {
			return new FetchResult(null, freshnessToken, null);
		}

		public FetchResult withRateLimit(@Nullable RateLimitInfo rateLimit) {
			return new FetchResult(payload, freshnessToken, rateLimit);
		}

		public boolean isNotModified() {
			return payload == null;
		}

	}

	private final ResponseCache cache;

	private final RetryPolicy retryPolicy;

	private final Duration ttl;

	private final boolean allowStaleOnFailure;

	private final Clock clock;

	private final Sleeper sleeper;

	private final ConcurrentMap<CacheKey, CompletableFuture<JsonNode>> inFlight = new ConcurrentHashMap<>();

	private final ConcurrentMap<String, TokenBucket> buckets = new ConcurrentHashMap<>();

	private FetchGate(Builder builder) {
		this.cache = builder.cache;
		this.retryPolicy = builder.retryPolicy;
		this.ttl = builder.ttl;
		this.allowStaleOnFailure = builder.allowStaleOnFailure;
		this.clock = builder.clock;
		this.sleeper = builder.sleeper;
	}

	public static Builder builder() {
		return new Builder();
	}

	public ResponseCache cache() {
		return cache;
	}

	public Duration ttl() {
		return ttl;
	}

	/**
	 * Drop cached entries fetched longer ago than {@code maxAge}.
	 * @param maxAge age limit
	 * @return number of entries dropped
	 */
	public int evictOlderThan(Duration maxAge) {
		return cache.purgeExpired(clock.instant(), maxAge);
	}

	/**
	 * Return the payload for {@code key}, from cache or from {@code producer}.
	 * @param key cache key; its provider selects the token bucket
	 * @param budget request budget of the provider, used when its bucket is created
	 * @param producer performs the request
	 * @return the payload
	 * @throws TransientProviderException when all attempts failed and no stale fallback
	 * applies
	 * @throws CancellationException when the calling thread is interrupted
	 */
	public JsonNode fetch(CacheKey key, RateBudget budget, FetchProducer producer) {
		while (true) {
			CacheEntry cached = cache.get(key);
			if (cached != null && cached.isFresh(clock.instant(), ttl)) {
				logger.debug("Cache hit for {}", key);
				return cached.payload();
			}

			CompletableFuture<JsonNode> mine = new CompletableFuture<>();
			CompletableFuture<JsonNode> existing = inFlight.putIfAbsent(key, mine);
			if (existing != null) {
				logger.debug("Joining in-flight fetch of {}", key);
				JsonNode joined = await(key, existing);
				if (joined != null) {
					return joined;
				}
				continue;
			}

			try {
				JsonNode payload = load(key, budget, producer);
				mine.complete(payload);
				return payload;
			}
			catch (RuntimeException e) {
				mine.completeExceptionally(e);
				throw e;
			}
			finally {
				inFlight.remove(key, mine);
			}
		}
	}

	/**
	 * Wait for another caller's fetch. Returns null when that fetch was canceled, so the
	 * caller should try again.
	 */
	@Nullable
	private JsonNode await(CacheKey key, CompletableFuture<JsonNode> existing) {
		try {
			return existing.get();
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new CancellationException("Interrupted while waiting for " + key);
		}
		catch (CancellationException e) {
			// a future completed with a CancellationException rethrows it unwrapped
			logger.debug("In-flight fetch of {} was canceled, retrying", key);
			return null;
		}
		catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof CancellationException) {
				logger.debug("In-flight fetch of {} was canceled, retrying", key);
				return null;
			}
			if (cause instanceof RuntimeException runtime) {
				throw runtime;
			}
			throw new ResolutionException("Fetch of " + key + " failed", cause);
		}
	}

	private JsonNode load(CacheKey key, RateBudget budget, FetchProducer producer) {
		CacheEntry stale = cache.get(key);
		if (stale != null && stale.isFresh(clock.instant(), ttl)) {
			return stale.payload();
		}
		TokenBucket bucket = buckets.computeIfAbsent(key.provider(),
				provider -> new TokenBucket(provider, budget, clock, sleeper));
		String token = stale != null ? stale.freshnessToken() : null;

		TransientProviderException lastFailure = null;
		int maxAttempts = retryPolicy.maxAttempts();
		for (int attempt = 1; attempt <= maxAttempts; attempt++) {
			acquire(bucket, key);
			try {
				FetchResult result = producer.fetch(token);
				if (result.rateLimit() != null) {
					bucket.observe(result.rateLimit());
				}
				return store(key, stale, result);
			}
			catch (TransientProviderException e) {
				lastFailure = e;
				if (attempt < maxAttempts) {
					Duration wait = retryPolicy.delayAfter(attempt, e);
					logger.warn("Fetch of {} failed (attempt {}/{}): {}. Waiting {}ms...", key, attempt, maxAttempts,
							e.getMessage(), wait.toMillis());
					sleep(wait, key);
				}
			}
		}

		logger.error("Fetch of {} failed after {} attempts", key, maxAttempts);
		if (allowStaleOnFailure && stale != null) {
			logger.warn("Serving stale response for {} fetched at {}", key, stale.fetchedAt());
			return stale.payload();
		}
		throw lastFailure;
	}

	private JsonNode store(CacheKey key, @Nullable CacheEntry stale, FetchResult result) {
		if (Thread.currentThread().isInterrupted()) {
			throw new CancellationException("Fetch of " + key + " was interrupted");
		}
		if (result.isNotModified()) {
			if (stale == null) {
				throw new PermanentProviderException("Not-modified response for " + key + " without a cached entry",
						304);
			}
			logger.debug("{} not modified, keeping cached payload", key);
			cache.put(stale.revalidated(clock.instant(), result.freshnessToken()));
			return stale.payload();
		}
		JsonNode payload = result.payload();
		cache.put(new CacheEntry(key, payload, clock.instant(), result.freshnessToken()));
		return payload;
	}

	private void acquire(TokenBucket bucket, CacheKey key) {
		try {
			bucket.acquire();
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new CancellationException("Interrupted while waiting for a rate permit for " + key);
		}
	}

	private void sleep(Duration wait, CacheKey key) {
		try {
			sleeper.sleep(wait);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new CancellationException("Retry of " + key + " interrupted");
		}
	}

	/**
	 * Builder for {@link FetchGate}.
	 *
	 * <p>
	 * Defaults:
	 * <ul>
	 * <li>ttl: 1 hour</li>
	 * <li>retryPolicy: {@link RetryPolicy#defaults()}</li>
	 * <li>allowStaleOnFailure: false</li>
	 * </ul>
	 */
	public static class Builder {

		private ResponseCache cache = new ResponseCache();

		private RetryPolicy retryPolicy = RetryPolicy.defaults();

		private Duration ttl = Duration.ofHours(1);

		private boolean allowStaleOnFailure = false;

		private Clock clock = Clock.systemUTC();

		private Sleeper sleeper = Sleeper.SYSTEM;

		private Builder() {
		}

		public Builder cache(ResponseCache cache) {
			this.cache = cache;
			return this;
		}

		public Builder retryPolicy(RetryPolicy retryPolicy) {
			this.retryPolicy = retryPolicy;
			return this;
		}

		/**
		 * Set how long a cached response is served without asking the provider.
		 * @param ttl time-to-live (default: 1 hour)
		 * @return this builder
		 */
		public Builder ttl(Duration ttl) {
			this.ttl = ttl;
			return this;
		}

		/**
		 * Serve an expired entry when all attempts to refresh it failed.
		 * @param allowStaleOnFailure true to enable degraded mode (default: false)
		 * @return this builder
		 */
		public Builder allowStaleOnFailure(boolean allowStaleOnFailure) {
			this.allowStaleOnFailure = allowStaleOnFailure;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		/**
		 * Build the FetchGate.
		 * @return configured FetchGate
		 * @throws IllegalStateException if the TTL is negative
		 */
		public FetchGate build() {
			if (ttl.isNegative()) {
				throw new IllegalStateException("ttl must not be negative");
			}
			return new FetchGate(this);
		}

	}

}
