package org.springaicommunity.release.resolver;

import java.util.List;
import java.util.Locale;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * A place releases are published: a git forge, a package index, a git remote or a web
 * page. Implementations are independent of each other; the {@link ProviderRegistry}
 * picks one by the shape of the identifier.
 *
 * <p>
 * All network access goes through the {@link FetchGate}, so implementations see
 * {@link TransientProviderException}s only after retries are exhausted.
 */
public interface ReleaseProvider {

	List<String> SOURCE_ARCHIVE_SUFFIXES = List.of(".tar.gz", ".tgz", ".tar.xz", ".tar.bz2", ".zip");

	/**
	 * Stable provider id, also used as cache key prefix and for {@code --at} hints.
	 */
	String id();

	ProviderCapabilities capabilities();

	/**
	 * Request budget this provider allows.
	 */
	RateBudget rateBudget();

	/**
	 * Whether the input has a shape only this provider understands, e.g. a URL of its
	 * host. Must not touch the network.
	 * @param input identifier as typed by the user
	 * @return true to claim the input
	 */
	boolean claims(String input);

	/**
	 * Whether the provider should be tried for a bare name nobody claimed.
	 * @param name bare project name
	 * @return true to take part in the fallback search
	 */
	default boolean acceptsBareName(String name) {
		return capabilities().bareNameLookup();
	}

	/**
	 * Map the input to the provider's canonical project reference.
	 * @param input identifier as typed by the user
	 * @return the canonical identifier
	 * @throws NotFoundException if the provider has no such project
	 * @throws AmbiguousIdentifierException if several projects match
	 */
	ProjectIdentifier resolveIdentifier(String input);

	/**
	 * Fetch the raw release items of a project, in provider-specific form.
	 * @param project canonical identifier
	 * @return release items, possibly empty
	 */
	List<JsonNode> listReleases(ProjectIdentifier project);

	/**
	 * Normalize one raw item.
	 * @param item element of {@link #listReleases(ProjectIdentifier)}
	 * @return the release record
	 */
	ReleaseRecord toReleaseRecord(JsonNode item);

	/**
	 * Download URL of the source archive of a release. The default picks the first
	 * attached source-like archive ({@code .tar.gz}, {@code .tgz}, {@code .tar.xz},
	 * {@code .tar.bz2}, {@code .zip}).
	 * @param project canonical identifier
	 * @param release a release of {@code project}
	 * @return the URL, or null if there is none
	 */
	@Nullable
	default String sourceUrl(ProjectIdentifier project, ReleaseRecord release) {
		for (ReleaseAsset asset : release.assets()) {
			String name = asset.name().toLowerCase(Locale.ROOT);
			if (SOURCE_ARCHIVE_SUFFIXES.stream().anyMatch(name::endsWith)) {
				return asset.downloadUrl();
			}
		}
		return null;
	}

}
