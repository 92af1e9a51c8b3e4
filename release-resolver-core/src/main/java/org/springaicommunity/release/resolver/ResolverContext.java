package org.springaicommunity.release.resolver;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owner of everything a process shares between resolutions: the response cache and rate
 * gate, the worker executor and the optional cache persistence. Created by
 * {@link ReleaseResolverBuilder#buildContext()}; closing it saves the cache and stops the
 * executor.
 */
public class ResolverContext implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(ResolverContext.class);

	/**
	 * Entries older than this many TTLs are not written back to the cache file.
	 */
	static final int RETAINED_TTLS = 10;

	static final Duration MIN_RETENTION = Duration.ofDays(1);

	private final FetchGate gate;

	private final ProviderRegistry registry;

	private final ReleaseResolver resolver;

	private final ExecutorService executor;

	@Nullable
	private final CacheStore cacheStore;

	private volatile boolean closed;

	ResolverContext(FetchGate gate, ProviderRegistry registry, ReleaseResolver resolver, ExecutorService executor,
			@Nullable CacheStore cacheStore) {
		this.gate = gate;
		this.registry = registry;
		this.resolver = resolver;
		this.executor = executor;
		this.cacheStore = cacheStore;
		if (cacheStore != null) {
			gate.cache().putAll(cacheStore.load());
		}
	}

	public ReleaseResolver resolver() {
		return resolver;
	}

	public ProviderRegistry registry() {
		return registry;
	}

	public FetchGate gate() {
		return gate;
	}

	public ResponseCache cache() {
		return gate.cache();
	}

	public boolean isClosed() {
		return closed;
	}

	private Duration retention() {
		Duration retention = gate.ttl().multipliedBy(RETAINED_TTLS);
		return retention.compareTo(MIN_RETENTION) < 0 ? MIN_RETENTION : retention;
	}

	@Override
	public void close() {
		if (closed) {
			return;
		}
		closed = true;
		executor.shutdownNow();
		try {
			if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
				logger.warn("Resolver workers did not stop within 5 seconds");
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
		if (cacheStore != null) {
			int evicted = gate.evictOlderThan(retention());
			if (evicted > 0) {
				logger.debug("Dropped {} cache entries older than {}", evicted, retention());
			}
			cacheStore.save(gate.cache().snapshot());
		}
		logger.debug("Resolver context closed");
	}

}
