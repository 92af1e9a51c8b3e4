package org.springaicommunity.release.resolver;

import java.time.Duration;

/**
 * Blocking wait used for backoff and pacing. Replaced in tests to keep them fast.
 */
@FunctionalInterface
public interface Sleeper {

	Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

	void sleep(Duration duration) throws InterruptedException;

}
