package org.springaicommunity.release.resolver;

/**
 * A non-retryable provider failure, e.g. 401, 404 or a malformed response.
 */
public class PermanentProviderException extends ResolutionException {

	private final int statusCode;

	public PermanentProviderException(String message, int statusCode) {
		super(message);
		this.statusCode = statusCode;
	}

	public PermanentProviderException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = -1;
	}

	/**
	 * HTTP status code, or -1 when the failure is not an HTTP status.
	 */
	public int getStatusCode() {
		return statusCode;
	}

	public boolean isNotFound() {
		return statusCode == 404 || statusCode == 410;
	}

}
