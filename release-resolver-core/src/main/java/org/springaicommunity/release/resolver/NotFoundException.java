package org.springaicommunity.release.resolver;

/**
 * The provider reports that no such project exists. Never retried.
 */
public class NotFoundException extends ResolutionException {

	private final String identifier;

	public NotFoundException(String identifier, String message) {
		super(message);
		this.identifier = identifier;
	}

	public NotFoundException(String identifier, String message, Throwable cause) {
		super(message, cause);
		this.identifier = identifier;
	}

	public String getIdentifier() {
		return identifier;
	}

}
