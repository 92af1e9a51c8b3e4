package org.springaicommunity.release.resolver;

import org.jspecify.annotations.Nullable;

/**
 * One resolution: what to resolve, how to select, and optionally where to look.
 *
 * @param input project identifier as typed by the user
 * @param policy selection policy
 * @param provider id of the provider to use instead of detecting one, or null
 */
public record ResolveRequest(String input, SelectionPolicy policy, @Nullable String provider) {

	public ResolveRequest {
		if (input.isBlank()) {
			throw new IllegalArgumentException("Project identifier must not be blank");
		}
	}

	public static ResolveRequest of(String input, SelectionPolicy policy) {
		return new ResolveRequest(input.trim(), policy, null);
	}

}
