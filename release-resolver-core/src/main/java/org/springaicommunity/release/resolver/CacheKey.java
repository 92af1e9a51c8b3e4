package org.springaicommunity.release.resolver;

/**
 * Identity of a cached provider response.
 *
 * @param provider provider id, e.g. "github"
 * @param project canonical project name on that provider
 * @param query shape of the request, e.g. "releases?page=1"
 */
public record CacheKey(String provider, String project, String query) {

	@Override
	public String toString() {
		return provider + ":" + project + "/" + query;
	}

}
