package org.springaicommunity.release.resolver;

import java.time.Duration;

import org.jspecify.annotations.Nullable;

/**
 * Configuration properties for release resolution.
 *
 * <p>
 * Properties can be set directly via setters or passed to {@link ReleaseResolverBuilder}.
 * Default values are provided for all properties and are suitable for most use cases.
 */
public class ResolverProperties {

	/**
	 * How long a provider response is served from cache without asking the provider again.
	 */
	private Duration cacheTtl = Duration.ofHours(1);

	/**
	 * Total number of attempts for a request failing with a transient error.
	 */
	private int maxAttempts = 3;

	/**
	 * Delay before the first retry, doubled for every further retry.
	 */
	private Duration initialBackoff = Duration.ofSeconds(1);

	/**
	 * Upper bound of the computed retry delay.
	 */
	private Duration maxBackoff = Duration.ofSeconds(30);

	/**
	 * Longest provider-supplied retry-after hint that is honored.
	 */
	private Duration maxRetryAfter = Duration.ofMinutes(5);

	/**
	 * Wall-clock budget of one resolution.
	 */
	private Duration resolutionTimeout = Duration.ofSeconds(60);

	/**
	 * HTTP connect timeout.
	 */
	private Duration connectTimeout = Duration.ofSeconds(10);

	/**
	 * HTTP request timeout.
	 */
	private Duration requestTimeout = Duration.ofSeconds(30);

	/**
	 * GitHub request budget per hour (authenticated default).
	 */
	private int githubRequestsPerHour = 5000;

	/**
	 * Minimum delay between two GitHub requests.
	 */
	private Duration githubMinSpacing = Duration.ZERO;

	/**
	 * Maximum number of release pages fetched from GitHub (100 releases each).
	 */
	private int githubMaxPages = 3;

	/**
	 * Base URL of the GitHub REST API.
	 */
	private String githubApiUrl = "https://api.github.com";

	/**
	 * Base URL of the Python package index.
	 */
	private String pypiUrl = "https://pypi.org";

	/**
	 * Base URL of Wikipedia.
	 */
	private String wikipediaUrl = "https://en.wikipedia.org";

	/**
	 * Request budget per minute for scraped web pages (Wikipedia, download pages).
	 */
	private int scrapeRequestsPerMinute = 30;

	/**
	 * Minimum delay between two scraped page requests.
	 */
	private Duration scrapeMinSpacing = Duration.ofMillis(500);

	/**
	 * User-Agent header sent with every request.
	 */
	private String userAgent = "release-resolver/1.0";

	/**
	 * Serve an expired cache entry when refreshing it fails after all retries.
	 */
	private boolean allowStaleOnFailure = false;

	/**
	 * File the response cache is loaded from on start and saved to on close; null keeps the cache in memory only.
	 */
	@Nullable
	private String cacheFile = null;

	public Duration getCacheTtl() {
		return cacheTtl;
	}

	public void setCacheTtl(Duration cacheTtl) {
		this.cacheTtl = cacheTtl;
	}

	public int getMaxAttempts() {
		return maxAttempts;
	}

	public void setMaxAttempts(int maxAttempts) {
		this.maxAttempts = maxAttempts;
	}

	public Duration getInitialBackoff() {
		return initialBackoff;
	}

	public void setInitialBackoff(Duration initialBackoff) {
		this.initialBackoff = initialBackoff;
	}

	public Duration getMaxBackoff() {
		return maxBackoff;
	}

	public void setMaxBackoff(Duration maxBackoff) {
		this.maxBackoff = maxBackoff;
	}

	public Duration getMaxRetryAfter() {
		return maxRetryAfter;
	}

	public void setMaxRetryAfter(Duration maxRetryAfter) {
		this.maxRetryAfter = maxRetryAfter;
	}

	public Duration getResolutionTimeout() {
		return resolutionTimeout;
	}

	public void setResolutionTimeout(Duration resolutionTimeout) {
		this.resolutionTimeout = resolutionTimeout;
	}

	public Duration getConnectTimeout() {
		return connectTimeout;
	}

	public void setConnectTimeout(Duration connectTimeout) {
		this.connectTimeout = connectTimeout;
	}

	public Duration getRequestTimeout() {
		return requestTimeout;
	}

	public void setRequestTimeout(Duration requestTimeout) {
		this.requestTimeout = requestTimeout;
	}

	public int getGithubRequestsPerHour() {
		return githubRequestsPerHour;
	}

	public void setGithubRequestsPerHour(int githubRequestsPerHour) {
		this.githubRequestsPerHour = githubRequestsPerHour;
	}

	public Duration getGithubMinSpacing() {
		return githubMinSpacing;
	}

	public void setGithubMinSpacing(Duration githubMinSpacing) {
		this.githubMinSpacing = githubMinSpacing;
	}

	public int getGithubMaxPages() {
		return githubMaxPages;
	}

	public void setGithubMaxPages(int githubMaxPages) {
		this.githubMaxPages = githubMaxPages;
	}

	public String getGithubApiUrl() {
		return githubApiUrl;
	}

	public void setGithubApiUrl(String githubApiUrl) {
		this.githubApiUrl = githubApiUrl;
	}

	public String getPypiUrl() {
		return pypiUrl;
	}

	public void setPypiUrl(String pypiUrl) {
		this.pypiUrl = pypiUrl;
	}

	public String getWikipediaUrl() {
		return wikipediaUrl;
	}

	public void setWikipediaUrl(String wikipediaUrl) {
		this.wikipediaUrl = wikipediaUrl;
	}

	public int getScrapeRequestsPerMinute() {
		return scrapeRequestsPerMinute;
	}

	public void setScrapeRequestsPerMinute(int scrapeRequestsPerMinute) {
		this.scrapeRequestsPerMinute = scrapeRequestsPerMinute;
	}

	public Duration getScrapeMinSpacing() {
		return scrapeMinSpacing;
	}

	public void setScrapeMinSpacing(Duration scrapeMinSpacing) {
		this.scrapeMinSpacing = scrapeMinSpacing;
	}

	public String getUserAgent() {
		return userAgent;
	}

	public void setUserAgent(String userAgent) {
		this.userAgent = userAgent;
	}

	public boolean isAllowStaleOnFailure() {
		return allowStaleOnFailure;
	}

	public void setAllowStaleOnFailure(boolean allowStaleOnFailure) {
		this.allowStaleOnFailure = allowStaleOnFailure;
	}

	@Nullable
	public String getCacheFile() {
		return cacheFile;
	}

	public void setCacheFile(@Nullable String cacheFile) {
		this.cacheFile = cacheFile;
	}

}
