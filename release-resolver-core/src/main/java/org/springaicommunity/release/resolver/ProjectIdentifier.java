package org.springaicommunity.release.resolver;

import org.jspecify.annotations.Nullable;

/**
 * Canonical reference to a project on one provider, e.g. {@code github} +
 * {@code spring-projects/spring-ai}.
 *
 * @param provider id of the provider that resolved the project
 * @param canonical provider-specific canonical name (owner/repo, package name, remote URL)
 * @param webUrl human-facing URL of the project, if known
 */
public record ProjectIdentifier(String provider, String canonical, @Nullable String webUrl) {

	@Override
	public String toString() {
		return provider + ":" + canonical;
	}

}
