package org.springaicommunity.release.resolver;

import java.util.List;

/**
 * The identifier matches several projects and nothing disambiguates them. The caller has
 * to pass a more specific identifier, e.g. {@code owner/name} instead of {@code name}.
 */
public class AmbiguousIdentifierException extends ResolutionException {

	private final String identifier;

	private final List<String> candidates;

	public AmbiguousIdentifierException(String identifier, List<String> candidates) {
		super("Identifier '" + identifier + "' is ambiguous, candidates: " + String.join(", ", candidates));
		this.identifier = identifier;
		this.candidates = List.copyOf(candidates);
	}

	public String getIdentifier() {
		return identifier;
	}

	public List<String> getCandidates() {
		return candidates;
	}

}
