package org.springaicommunity.release.resolver;

import java.time.Duration;
import java.time.Instant;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * A provider response held by {@link ResponseCache}. Entries are replaced wholesale on
 * refresh; the payload is never modified after the entry is stored.
 *
 * @param key cache key
 * @param payload raw provider payload
 * @param fetchedAt when the payload was last confirmed current
 * @param freshnessToken conditional-fetch token (ETag), if the provider supplied one
 */
public record CacheEntry(CacheKey key, JsonNode payload, Instant fetchedAt, @Nullable String freshnessToken) {

	public boolean isFresh(Instant now, Duration ttl) {
		return fetchedAt.plus(ttl).isAfter(now);
	}

	/**
	 * Copy of this entry confirmed current at {@code now}, e.g. after a 304 response.
	 * @param now confirmation time
	 * @param newToken token from the confirming response, or null to keep the current one
	 * @return the replacement entry
	 */
	public CacheEntry revalidated(Instant now, @Nullable String newToken) {
		return new CacheEntry(key, payload, now, newToken != null ? newToken : freshnessToken);
	}

}
