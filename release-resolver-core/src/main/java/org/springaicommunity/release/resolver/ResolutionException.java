package org.springaicommunity.release.resolver;

/**
 * Base class of every failure the resolution engine reports to its callers.
 */
public class ResolutionException extends RuntimeException {

	public ResolutionException(String message) {
		super(message);
	}

	public ResolutionException(String message, Throwable cause) {
		super(message, cause);
	}

}
