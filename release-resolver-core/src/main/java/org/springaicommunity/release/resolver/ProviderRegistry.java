package org.springaicommunity.release.resolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.jspecify.annotations.Nullable;

/**
 * The providers known to a {@link ResolverContext}, in preference order.
 */
public class ProviderRegistry {

	private final List<ReleaseProvider> providers;

	public ProviderRegistry(List<ReleaseProvider> providers) {
		List<String> ids = new ArrayList<>();
		for (ReleaseProvider provider : providers) {
			if (ids.contains(provider.id())) {
				throw new IllegalArgumentException("Duplicate provider id: " + provider.id());
			}
			ids.add(provider.id());
		}
		this.providers = List.copyOf(providers);
	}

	public List<ReleaseProvider> providers() {
		return providers;
	}

	public List<String> ids() {
		return providers.stream().map(ReleaseProvider::id).collect(Collectors.toList());
	}

	public Optional<ReleaseProvider> find(String id) {
		return providers.stream().filter(provider -> provider.id().equals(id)).findFirst();
	}

	/**
	 * Providers to try for an input, in order: the hinted provider alone; otherwise the
	 * first provider claiming the input; otherwise every provider accepting it as a bare
	 * name.
	 * @param input identifier as typed by the user
	 * @param hint provider id the caller insists on, or null
	 * @return providers to try, possibly empty
	 * @throws IllegalArgumentException if the hint names no known provider
	 */
	public List<ReleaseProvider> candidatesFor(String input, @Nullable String hint) {
		if (hint != null) {
			ReleaseProvider provider = find(hint).orElseThrow(() -> new IllegalArgumentException(
					"Unknown provider '" + hint + "', known providers: " + String.join(", ", ids())));
			return List.of(provider);
		}
		for (ReleaseProvider provider : providers) {
			if (provider.claims(input)) {
				return List.of(provider);
			}
		}
		return providers.stream().filter(provider -> provider.acceptsBareName(input)).collect(Collectors.toList());
	}

}
