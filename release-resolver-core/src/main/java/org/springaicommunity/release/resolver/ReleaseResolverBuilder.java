package org.springaicommunity.release.resolver;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

/**
 * Builder for creating a {@link ResolverContext} without Spring dependencies.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Simple usage with environment variable
 * try (ResolverContext context = ReleaseResolverBuilder.create().tokenFromEnv().buildContext()) {
 *     ReleaseRecord latest = context.resolver().resolve("mautic/mautic", SelectionPolicy.defaults());
 * }
 *
 * // With custom configuration
 * ResolverProperties props = new ResolverProperties();
 * props.setCacheFile(".release-cache.json");
 * props.setAllowStaleOnFailure(true);
 *
 * ResolverContext context = ReleaseResolverBuilder.create()
 *     .token("ghp_xxxxx")
 *     .properties(props)
 *     .buildContext();
 *
 * // For testing with mock HTTP client
 * ApiClient mockClient = mock(ApiClient.class);
 * ResolverContext testContext = ReleaseResolverBuilder.create()
 *     .apiClient(mockClient)
 *     .sleeper(duration -> { })
 *     .buildContext();
 * }
 * </pre>
 */
public class ReleaseResolverBuilder {

	@Nullable
	private String token;

	private ResolverProperties properties;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private ApiClient apiClient;

	private Clock clock = Clock.systemUTC();

	private Sleeper sleeper = Sleeper.SYSTEM;

	@Nullable
	private CacheStore cacheStore;

	@Nullable
	private Function<FetchGate, List<ReleaseProvider>> providerFactory;

	private VersionParser parser = VersionParser.standard();

	private ReleaseResolverBuilder() {
		this.properties = new ResolverProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new ReleaseResolverBuilder
	 */
	public static ReleaseResolverBuilder create() {
		return new ReleaseResolverBuilder();
	}

	/**
	 * Set the GitHub token directly.
	 * @param token GitHub personal access token
	 * @return this builder
	 */
	public ReleaseResolverBuilder token(@Nullable String token) {
		this.token = token;
		return this;
	}

	/**
	 * Read the GitHub token from {@code GITHUB_TOKEN}, falling back to
	 * {@code GITHUB_API_TOKEN}. Without either, GitHub is queried anonymously.
	 * @return this builder
	 */
	public ReleaseResolverBuilder tokenFromEnv() {
		this.token = EnvironmentSupport.firstOf("GITHUB_TOKEN", "GITHUB_API_TOKEN");
		return this;
	}

	/**
	 * Set configuration properties.
	 * @param properties resolver properties
	 * @return this builder
	 */
	public ReleaseResolverBuilder properties(ResolverProperties properties) {
		this.properties = properties;
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper
	 * @return this builder
	 */
	public ReleaseResolverBuilder objectMapper(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom HTTP client (useful for testing).
	 * @param apiClient HTTP client implementation
	 * @return this builder
	 */
	public ReleaseResolverBuilder apiClient(ApiClient apiClient) {
		this.apiClient = apiClient;
		return this;
	}

	public ReleaseResolverBuilder clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Set how backoff and pacing waits are performed (useful for testing).
	 * @param sleeper sleeper
	 * @return this builder
	 */
	public ReleaseResolverBuilder sleeper(Sleeper sleeper) {
		this.sleeper = sleeper;
		return this;
	}

	/**
	 * Set the cache persistence. Overrides {@link ResolverProperties#getCacheFile()}.
	 * @param cacheStore cache store
	 * @return this builder
	 */
	public ReleaseResolverBuilder cacheStore(CacheStore cacheStore) {
		this.cacheStore = cacheStore;
		return this;
	}

	/**
	 * Replace the standard providers.
	 * @param providerFactory creates the providers, in preference order, from the
	 * context's fetch gate
	 * @return this builder
	 */
	public ReleaseResolverBuilder providers(Function<FetchGate, List<ReleaseProvider>> providerFactory) {
		this.providerFactory = providerFactory;
		return this;
	}

	public ReleaseResolverBuilder versionParser(VersionParser parser) {
		this.parser = parser;
		return this;
	}

	/**
	 * Build the fetch gate configured by the properties.
	 * @return configured FetchGate
	 */
	public FetchGate buildGate() {
		return FetchGate.builder()
			.ttl(properties.getCacheTtl())
			.retryPolicy(new RetryPolicy(properties.getMaxAttempts(), properties.getInitialBackoff(),
					properties.getMaxBackoff(), properties.getMaxRetryAfter()))
			.allowStaleOnFailure(properties.isAllowStaleOnFailure())
			.clock(clock)
			.sleeper(sleeper)
			.build();
	}

	/**
	 * Build the standard providers, in the order they are consulted: wikipedia, github,
	 * pypi, git, html.
	 * @param gate fetch gate the providers share
	 * @return providers
	 */
	public List<ReleaseProvider> buildProviders(FetchGate gate) {
		ObjectMapper mapper = getOrCreateObjectMapper();
		ProviderHttp http = new ProviderHttp(getOrCreateApiClient(), gate, mapper);
		List<ReleaseProvider> standard = new ArrayList<>();
		standard.add(new WikipediaReleaseProvider(http, parser, properties));
		standard.add(new GitHubReleaseProvider(http, parser, properties, token));
		standard.add(new PyPiReleaseProvider(http, parser, properties));
		standard.add(new GitTagsReleaseProvider(gate, mapper, parser));
		standard.add(new HtmlPageReleaseProvider(http, parser, properties));
		return standard;
	}

	/**
	 * Build a ResolverContext. The caller owns it and must close it.
	 * @return configured ResolverContext
	 */
	public ResolverContext buildContext() {
		FetchGate gate = buildGate();
		ProviderRegistry registry = new ProviderRegistry(
				providerFactory != null ? providerFactory.apply(gate) : buildProviders(gate));
		ExecutorService executor = Executors.newCachedThreadPool(daemonThreads());
		ReleaseResolver resolver = new ReleaseResolver(registry, new ReleaseSelector(), executor,
				properties.getResolutionTimeout());
		return new ResolverContext(gate, registry, resolver, executor, getOrCreateCacheStore());
	}

	private ObjectMapper getOrCreateObjectMapper() {
		if (objectMapper == null) {
			objectMapper = ObjectMapperFactory.create();
		}
		return objectMapper;
	}

	private ApiClient getOrCreateApiClient() {
		if (apiClient == null) {
			apiClient = new JdkApiClient(properties.getUserAgent(), properties.getConnectTimeout(),
					properties.getRequestTimeout());
		}
		return apiClient;
	}

	@Nullable
	private CacheStore getOrCreateCacheStore() {
		if (cacheStore == null && properties.getCacheFile() != null) {
			cacheStore = new FileSystemCacheStore(Path.of(properties.getCacheFile()), getOrCreateObjectMapper());
		}
		return cacheStore;
	}

	private static ThreadFactory daemonThreads() {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, "release-resolver-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}

}
