package org.springaicommunity.release.resolver;

/**
 * Where the prerelease flag of a {@link ReleaseRecord} came from.
 */
public enum PrereleaseSource {

	/** The provider reported the flag explicitly. */
	DECLARED,

	/** The provider had no flag; it was derived from the tag's pre-release marker. */
	INFERRED

}
