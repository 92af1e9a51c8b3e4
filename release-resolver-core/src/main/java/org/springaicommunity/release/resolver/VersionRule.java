package org.springaicommunity.release.resolver;

import org.jspecify.annotations.Nullable;

/**
 * One step of the {@link VersionParser} chain. A rule either recognizes the normalized tag
 * and returns a version, or returns {@code null} to let the next rule try.
 */
public interface VersionRule {

	/**
	 * Name reported by {@link Version#rule()} for versions this rule produces.
	 */
	String name();

	@Nullable
	Version apply(TagNormalizer.NormalizedTag tag);

}
