package org.springaicommunity.release.resolver;

import java.time.Duration;

/**
 * The resolution did not finish within its wall-clock budget.
 */
public class ResolutionTimeoutException extends ResolutionException {

	private final Duration timeout;

	public ResolutionTimeoutException(String input, Duration timeout) {
		super("Resolution of '" + input + "' did not complete within " + timeout.toMillis() + "ms");
		this.timeout = timeout;
	}

	public Duration getTimeout() {
		return timeout;
	}

}
