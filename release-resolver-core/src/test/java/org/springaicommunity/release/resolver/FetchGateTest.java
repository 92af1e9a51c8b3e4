package org.springaicommunity.release.resolver;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link FetchGate}: caching, conditional refresh, retries, stale
 * fallback, single flight and cancellation.
 */
@DisplayName("FetchGate Tests")
class FetchGateTest {

	private static final CacheKey KEY = new CacheKey("github", "owner/repo", "releases?page=1");

	private static final RateBudget GENEROUS = RateBudget.perMinute(1000, Duration.ZERO);

	private MutableClock clock;

	private List<Duration> sleeps;

	private FetchGate gate;

	@BeforeEach
	void setUp() {
		clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
		sleeps = new CopyOnWriteArrayList<>();
		gate = gateBuilder().build();
	}

	private FetchGate.Builder gateBuilder() {
		return FetchGate.builder()
			.ttl(Duration.ofHours(1))
			.retryPolicy(new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), Duration.ofMinutes(5)))
			.clock(clock)
			.sleeper(duration -> {
				sleeps.add(duration);
				clock.advance(duration);
			});
	}

	private static TransientProviderException serverError() {
		return new TransientProviderException("503 Service Unavailable", 503, null);
	}

	@Nested
	@DisplayName("Cache Tests")
	class CacheTest {

		@Test
		@DisplayName("Should serve a fresh entry without calling the producer")
		void shouldServeFreshEntry() {
			AtomicInteger calls = new AtomicInteger();
			FetchGate.FetchProducer producer = token -> {
				calls.incrementAndGet();
				return FetchGate.FetchResult.of(TextNode.valueOf("v1"), "\"e1\"");
			};

			JsonNode first = gate.fetch(KEY, GENEROUS, producer);
			clock.advance(Duration.ofMinutes(59));
			JsonNode second = gate.fetch(KEY, GENEROUS, producer);

			assertThat(first.asText()).isEqualTo("v1");
			assertThat(second).isSameAs(first);
			assertThat(calls).hasValue(1);
		}

		@Test
		@DisplayName("Should refresh an expired entry, passing its freshness token")
		void shouldRefreshExpiredEntry() {
			List<String> tokens = new ArrayList<>();
			gate.fetch(KEY, GENEROUS, token -> FetchGate.FetchResult.of(TextNode.valueOf("v1"), "\"e1\""));
			clock.advance(Duration.ofHours(2));

			JsonNode refreshed = gate.fetch(KEY, GENEROUS, token -> {
				tokens.add(token);
				return FetchGate.FetchResult.of(TextNode.valueOf("v2"), "\"e2\"");
			});

			assertThat(tokens).containsExactly("\"e1\"");
			assertThat(refreshed.asText()).isEqualTo("v2");
			assertThat(gate.cache().get(KEY).freshnessToken()).isEqualTo("\"e2\"");
		}

		@Test
		@DisplayName("Should keep the payload and renew the timestamp on not-modified")
		void shouldRevalidateOnNotModified() {
			JsonNode original = gate.fetch(KEY, GENEROUS,
					token -> FetchGate.FetchResult.of(TextNode.valueOf("v1"), "\"e1\""));
			clock.advance(Duration.ofHours(2));

			JsonNode revalidated = gate.fetch(KEY, GENEROUS, token -> FetchGate.FetchResult.notModified(null));

			assertThat(revalidated).isSameAs(original);
			CacheEntry entry = gate.cache().get(KEY);
			assertThat(entry.fetchedAt()).isEqualTo(clock.instant());
			assertThat(entry.freshnessToken()).isEqualTo("\"e1\"");
		}

		@Test
		@DisplayName("Should reject not-modified when nothing is cached")
		void shouldRejectNotModifiedWithoutEntry() {
			assertThatThrownBy(() -> gate.fetch(KEY, GENEROUS, token -> FetchGate.FetchResult.notModified(null)))
				.isInstanceOf(PermanentProviderException.class);
			assertThat(gate.cache().size()).isZero();
		}

		@Test
		@DisplayName("Should keep keys apart")
		void shouldKeepKeysApart() {
			CacheKey other = new CacheKey("github", "owner/repo", "tags?page=1");

			gate.fetch(KEY, GENEROUS, token -> FetchGate.FetchResult.of(TextNode.valueOf("releases"), null));
			JsonNode tags = gate.fetch(other, GENEROUS, token -> FetchGate.FetchResult.of(TextNode.valueOf("tags"), null));

			assertThat(tags.asText()).isEqualTo("tags");
			assertThat(gate.cache().size()).isEqualTo(2);
		}

	}

	@Nested
	@DisplayName("Retry Tests")
	class RetryTest {

		@Test
		@DisplayName("Should retry transient failures with backoff until success")
		void shouldRetryUntilSuccess() {
			AtomicInteger calls = new AtomicInteger();

			JsonNode payload = gate.fetch(KEY, GENEROUS, token -> {
				if (calls.incrementAndGet() < 3) {
					throw serverError();
				}
				return FetchGate.FetchResult.of(TextNode.valueOf("ok"), null);
			});

			assertThat(payload.asText()).isEqualTo("ok");
			assertThat(calls).hasValue(3);
			assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
		}

		@Test
		@DisplayName("Should invoke the producer exactly maxAttempts times, then propagate")
		void shouldStopAfterMaxAttempts() {
			AtomicInteger calls = new AtomicInteger();

			assertThatThrownBy(() -> gate.fetch(KEY, GENEROUS, token -> {
				calls.incrementAndGet();
				throw serverError();
			})).isInstanceOf(TransientProviderException.class).hasMessageContaining("503");

			assertThat(calls).hasValue(3);
			assertThat(gate.cache().size()).isZero();
		}

		@Test
		@DisplayName("Should honor the provider's retry-after hint")
		void shouldHonorRetryAfter() {
			AtomicInteger calls = new AtomicInteger();

			gate.fetch(KEY, GENEROUS, token -> {
				if (calls.incrementAndGet() == 1) {
					throw new TransientProviderException("rate limited", 429, Duration.ofSeconds(17));
				}
				return FetchGate.FetchResult.of(TextNode.valueOf("ok"), null);
			});

			assertThat(sleeps).containsExactly(Duration.ofSeconds(17));
		}

		@Test
		@DisplayName("Should not retry permanent failures")
		void shouldNotRetryPermanentFailures() {
			AtomicInteger calls = new AtomicInteger();

			assertThatThrownBy(() -> gate.fetch(KEY, GENEROUS, token -> {
				calls.incrementAndGet();
				throw new PermanentProviderException("401 Unauthorized", 401);
			})).isInstanceOf(PermanentProviderException.class);

			assertThat(calls).hasValue(1);
			assertThat(sleeps).isEmpty();
		}

		@Test
		@DisplayName("Should leave the expired entry untouched when retries are exhausted")
		void shouldLeaveExpiredEntryOnFailure() {
			gate.fetch(KEY, GENEROUS, token -> FetchGate.FetchResult.of(TextNode.valueOf("old"), "\"e1\""));
			CacheEntry before = gate.cache().get(KEY);
			clock.advance(Duration.ofHours(2));

			assertThatThrownBy(() -> gate.fetch(KEY, GENEROUS, token -> {
				throw serverError();
			})).isInstanceOf(TransientProviderException.class);

			assertThat(gate.cache().get(KEY)).isEqualTo(before);
		}

		@Test
		@DisplayName("Should serve the expired entry when stale fallback is enabled")
		void shouldServeStaleWhenEnabled() {
			FetchGate lenient = gateBuilder().allowStaleOnFailure(true).build();
			lenient.fetch(KEY, GENEROUS, token -> FetchGate.FetchResult.of(TextNode.valueOf("old"), null));
			clock.advance(Duration.ofHours(2));

			JsonNode payload = lenient.fetch(KEY, GENEROUS, token -> {
				throw serverError();
			});

			assertThat(payload.asText()).isEqualTo("old");
		}

		@Test
		@DisplayName("Should still fail with stale fallback when nothing is cached")
		void shouldFailWithoutStaleEntry() {
			FetchGate lenient = gateBuilder().allowStaleOnFailure(true).build();

			assertThatThrownBy(() -> lenient.fetch(KEY, GENEROUS, token -> {
				throw serverError();
			})).isInstanceOf(TransientProviderException.class);
		}

	}

	@Nested
	@DisplayName("Pacing Tests")
	class PacingTest {

		@Test
		@DisplayName("Should share one rate budget across keys of the same provider")
		void shouldShareBudgetPerProvider() {
			RateBudget onePerMinute = RateBudget.perMinute(1, Duration.ZERO);

			gate.fetch(new CacheKey("github", "a/b", "releases"), onePerMinute,
					token -> FetchGate.FetchResult.of(TextNode.valueOf("ab"), null));
			gate.fetch(new CacheKey("pypi", "requests", "json"), onePerMinute,
					token -> FetchGate.FetchResult.of(TextNode.valueOf("requests"), null));
			gate.fetch(new CacheKey("github", "c/d", "releases"), onePerMinute,
					token -> FetchGate.FetchResult.of(TextNode.valueOf("cd"), null));

			assertThat(sleeps).containsExactly(Duration.ofMinutes(1));
		}

		@Test
		@DisplayName("Should pause the provider when a response reports its limit exhausted")
		void shouldPauseOnExhaustedRateLimit() {
			RateLimitInfo exhausted = new RateLimitInfo(60, 0, clock.instant().plus(Duration.ofMinutes(5)), 60);

			gate.fetch(new CacheKey("github", "a/b", "releases"), GENEROUS,
					token -> FetchGate.FetchResult.of(TextNode.valueOf("ab"), null).withRateLimit(exhausted));
			gate.fetch(new CacheKey("pypi", "requests", "json"), GENEROUS,
					token -> FetchGate.FetchResult.of(TextNode.valueOf("requests"), null));
			assertThat(sleeps).isEmpty();

			gate.fetch(new CacheKey("github", "c/d", "releases"), GENEROUS,
					token -> FetchGate.FetchResult.of(TextNode.valueOf("cd"), null));

			assertThat(sleeps).containsExactly(Duration.ofMinutes(5));
		}

		@Test
		@DisplayName("Should not take a permit for cache hits")
		void shouldNotPaceCacheHits() {
			RateBudget onePerMinute = RateBudget.perMinute(1, Duration.ZERO);
			FetchGate.FetchProducer producer = token -> FetchGate.FetchResult.of(TextNode.valueOf("ab"), null);

			gate.fetch(KEY, onePerMinute, producer);
			gate.fetch(KEY, onePerMinute, producer);
			gate.fetch(KEY, onePerMinute, producer);

			assertThat(sleeps).isEmpty();
		}

	}

	@Nested
	@DisplayName("Concurrency Tests")
	class ConcurrencyTest {

		@Test
		@DisplayName("Should run one producer for concurrent callers of the same key")
		void shouldRunSingleFlight() throws Exception {
			FetchGate realTime = FetchGate.builder().build();
			AtomicInteger calls = new AtomicInteger();
			CountDownLatch started = new CountDownLatch(1);
			CountDownLatch release = new CountDownLatch(1);
			FetchGate.FetchProducer producer = token -> {
				calls.incrementAndGet();
				started.countDown();
				try {
					release.await(5, TimeUnit.SECONDS);
				}
				catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
				return FetchGate.FetchResult.of(TextNode.valueOf("shared"), null);
			};

			ExecutorService executor = Executors.newFixedThreadPool(8);
			try {
				List<Future<JsonNode>> results = new ArrayList<>();
				for (int i = 0; i < 8; i++) {
					results.add(executor.submit(() -> realTime.fetch(KEY, GENEROUS, producer)));
				}
				assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
				release.countDown();

				for (Future<JsonNode> result : results) {
					assertThat(result.get(5, TimeUnit.SECONDS).asText()).isEqualTo("shared");
				}
			}
			finally {
				executor.shutdownNow();
			}
			assertThat(calls).hasValue(1);
		}

		@Test
		@DisplayName("Should free the in-flight slot when the producer fails")
		void shouldFreeSlotAfterFailure() throws Exception {
			FetchGate realTime = FetchGate.builder().build();
			CountDownLatch started = new CountDownLatch(1);
			CountDownLatch release = new CountDownLatch(1);
			AtomicInteger calls = new AtomicInteger();
			FetchGate.FetchProducer producer = token -> {
				calls.incrementAndGet();
				started.countDown();
				try {
					release.await(5, TimeUnit.SECONDS);
				}
				catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
				throw new PermanentProviderException("410 Gone", 410);
			};

			ExecutorService executor = Executors.newSingleThreadExecutor();
			try {
				Future<JsonNode> owner = executor.submit(() -> realTime.fetch(KEY, GENEROUS, producer));
				assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
				release.countDown();

				assertThatThrownBy(() -> owner.get(5, TimeUnit.SECONDS))
					.hasCauseInstanceOf(PermanentProviderException.class);
			}
			finally {
				executor.shutdownNow();
			}
			assertThat(calls).hasValue(1);

			JsonNode retried = realTime.fetch(KEY, GENEROUS, token -> FetchGate.FetchResult.of(TextNode.valueOf("back"), null));
			assertThat(retried.asText()).isEqualTo("back");
		}

		@Test
		@DisplayName("Should write nothing when the fetching thread is interrupted")
		void shouldWriteNothingWhenInterrupted() {
			try {
				assertThatThrownBy(() -> gate.fetch(KEY, GENEROUS, token -> {
					Thread.currentThread().interrupt();
					return FetchGate.FetchResult.of(TextNode.valueOf("late"), null);
				})).isInstanceOf(CancellationException.class);

				assertThat(gate.cache().get(KEY)).isNull();
			}
			finally {
				Thread.interrupted();
			}
		}

		@Test
		@DisplayName("Should fetch again after a canceled fetch")
		void shouldFetchAgainAfterCancellation() {
			try {
				assertThatThrownBy(() -> gate.fetch(KEY, GENEROUS, token -> {
					Thread.currentThread().interrupt();
					return FetchGate.FetchResult.of(TextNode.valueOf("late"), null);
				})).isInstanceOf(CancellationException.class);
			}
			finally {
				Thread.interrupted();
			}

			JsonNode payload = gate.fetch(KEY, GENEROUS, token -> FetchGate.FetchResult.of(TextNode.valueOf("v1"), null));

			assertThat(payload.asText()).isEqualTo("v1");
		}

		@Test
		@DisplayName("Should let a waiting caller fetch itself when the fetch it joined is canceled")
		void shouldRefetchForWaiterWhenJoinedFetchIsCanceled() throws Exception {
			FetchGate realTime = FetchGate.builder().build();
			CountDownLatch firstStarted = new CountDownLatch(1);
			CountDownLatch releaseFirst = new CountDownLatch(1);
			AtomicInteger secondCalls = new AtomicInteger();
			FetchGate.FetchProducer blocking = token -> {
				firstStarted.countDown();
				try {
					releaseFirst.await(5, TimeUnit.SECONDS);
				}
				catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
				return FetchGate.FetchResult.of(TextNode.valueOf("first"), null);
			};
			FetchGate.FetchProducer own = token -> {
				secondCalls.incrementAndGet();
				return FetchGate.FetchResult.of(TextNode.valueOf("second"), null);
			};

			ExecutorService executor = Executors.newFixedThreadPool(2);
			try {
				Future<JsonNode> first = executor.submit(() -> realTime.fetch(KEY, GENEROUS, blocking));
				assertThat(firstStarted.await(5, TimeUnit.SECONDS)).isTrue();
				Future<JsonNode> second = executor.submit(() -> realTime.fetch(KEY, GENEROUS, own));
				Thread.sleep(200);

				first.cancel(true);
				releaseFirst.countDown();

				assertThat(second.get(5, TimeUnit.SECONDS).asText()).isEqualTo("second");
			}
			finally {
				executor.shutdownNow();
			}
			assertThat(secondCalls).hasValue(1);
			assertThat(realTime.cache().get(KEY).payload().asText()).isEqualTo("second");
		}

	}

}
