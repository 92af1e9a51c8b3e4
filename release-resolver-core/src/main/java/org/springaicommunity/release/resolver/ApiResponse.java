package org.springaicommunity.release.resolver;

import org.jspecify.annotations.Nullable;

/**
 * A successful (2xx) or not-modified (304) HTTP response.
 *
 * @param statusCode HTTP status
 * @param body response body, empty for 304
 * @param etag value of the ETag header, if present
 * @param rateLimit rate limit headers, if present
 */
public record ApiResponse(int statusCode, String body, @Nullable String etag, @Nullable RateLimitInfo rateLimit) {

	public static ApiResponse ok(String body) {
		return new ApiResponse(200, body, null, null);
	}

	public boolean isNotModified() {
		return statusCode == 304;
	}

}
