package org.springaicommunity.release.resolver;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of a successful resolution.
 *
 * @param project the project the input resolved to
 * @param release the selected release
 * @param candidates number of releases the provider reported before filtering
 * @param sourceUrl download URL of the release's source archive, if the provider knows one
 */
public record Resolution(ProjectIdentifier project, ReleaseRecord release, int candidates,
		@Nullable String sourceUrl) {

	public Resolution(ProjectIdentifier project, ReleaseRecord release, int candidates) {
		this(project, release, candidates, null);
	}

}
