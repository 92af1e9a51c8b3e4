package org.springaicommunity.release.resolver;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RetryPolicy Tests")
class RetryPolicyTest {

	private final RetryPolicy policy = new RetryPolicy(5, Duration.ofSeconds(1), Duration.ofSeconds(5),
			Duration.ofMinutes(1));

	private static TransientProviderException failure(Duration retryAfter) {
		return new TransientProviderException("boom", 503, retryAfter);
	}

	@Test
	@DisplayName("Should double the delay per failed attempt up to the cap")
	void shouldBackOffExponentially() {
		assertThat(policy.delayAfter(1, failure(null))).isEqualTo(Duration.ofSeconds(1));
		assertThat(policy.delayAfter(2, failure(null))).isEqualTo(Duration.ofSeconds(2));
		assertThat(policy.delayAfter(3, failure(null))).isEqualTo(Duration.ofSeconds(4));
		assertThat(policy.delayAfter(4, failure(null))).isEqualTo(Duration.ofSeconds(5));
		assertThat(policy.delayAfter(60, failure(null))).isEqualTo(Duration.ofSeconds(5));
	}

	@Test
	@DisplayName("Should honor a reasonable retry-after hint")
	void shouldHonorRetryAfter() {
		assertThat(policy.delayAfter(1, failure(Duration.ofSeconds(42)))).isEqualTo(Duration.ofSeconds(42));
	}

	@Test
	@DisplayName("Should ignore a retry-after hint beyond the limit")
	void shouldIgnoreExcessiveRetryAfter() {
		assertThat(policy.delayAfter(2, failure(Duration.ofHours(1)))).isEqualTo(Duration.ofSeconds(2));
	}

	@Test
	@DisplayName("Should use three attempts by default")
	void shouldDefaultToThreeAttempts() {
		assertThat(RetryPolicy.defaults().maxAttempts()).isEqualTo(3);
	}

	@Test
	@DisplayName("Should reject fewer than one attempt")
	void shouldRejectZeroAttempts() {
		assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO, Duration.ZERO))
			.isInstanceOf(IllegalArgumentException.class);
	}

}
