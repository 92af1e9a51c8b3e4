package org.springaicommunity.release.resolver;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory store of provider responses, shared by all resolutions of one
 * {@link ResolverContext}. Thread-safe; expiry is decided by the reader against its TTL.
 */
public class ResponseCache {

	private static final Logger logger = LoggerFactory.getLogger(ResponseCache.class);

	private final ConcurrentMap<CacheKey, CacheEntry> entries = new ConcurrentHashMap<>();

	@Nullable
	public CacheEntry get(CacheKey key) {
		return entries.get(key);
	}

	public void put(CacheEntry entry) {
		entries.put(entry.key(), entry);
	}

	public void putAll(Collection<CacheEntry> loaded) {
		loaded.forEach(this::put);
	}

	public void invalidate(CacheKey key) {
		entries.remove(key);
	}

	/**
	 * Drop every entry of one provider.
	 * @param providerId provider id
	 * @return number of entries removed
	 */
	public int invalidateProvider(String providerId) {
		int before = entries.size();
		entries.keySet().removeIf(key -> key.provider().equals(providerId));
		int removed = before - entries.size();
		logger.debug("Invalidated {} cache entries of provider {}", removed, providerId);
		return removed;
	}

	public void invalidateAll() {
		entries.clear();
	}

	/**
	 * Remove entries that are no longer fresh.
	 * @param now current time
	 * @param ttl time-to-live
	 * @return number of entries removed
	 */
	public int purgeExpired(Instant now, Duration ttl) {
		int before = entries.size();
		entries.values().removeIf(entry -> !entry.isFresh(now, ttl));
		return before - entries.size();
	}

	public List<CacheEntry> snapshot() {
		return List.copyOf(entries.values());
	}

	public int size() {
		return entries.size();
	}

}
