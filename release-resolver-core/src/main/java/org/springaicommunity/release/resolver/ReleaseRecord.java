package org.springaicommunity.release.resolver;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * One release as reported by a provider, normalized.
 *
 * @param tag the source tag exactly as the provider reported it
 * @param version the parsed version of {@code tag}
 * @param publishedAt publish time, if the provider reports one
 * @param prerelease whether the release is a prerelease (declared or inferred)
 * @param draft whether the provider marks the release as not publicly finalized
 * @param formal whether the provider has a release object for the tag, as opposed to a
 * bare tag
 * @param assets files attached to the release
 * @param prereleaseSource where {@code prerelease} came from
 */
public record ReleaseRecord(String tag, Version version, @Nullable Instant publishedAt, boolean prerelease,
		boolean draft, boolean formal, List<ReleaseAsset> assets, PrereleaseSource prereleaseSource) {

	/**
	 * Orders releases by version, then by publish time (unknown first), then by tag text.
	 * The maximum under this order is the latest release.
	 */
	public static final Comparator<ReleaseRecord> ORDER = Comparator.comparing(ReleaseRecord::version)
		.thenComparing(ReleaseRecord::publishedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
		.thenComparing(ReleaseRecord::tag);

	public ReleaseRecord {
		assets = List.copyOf(assets);
	}

	/**
	 * Build a record, deciding the prerelease flag. A flag declared by the provider is
	 * authoritative; without one the flag is inferred from the version's pre-release
	 * marker.
	 * @param tag source tag
	 * @param version parsed version
	 * @param publishedAt publish time or null
	 * @param declaredPrerelease provider flag, or null when the provider has none
	 * @param draft draft flag
	 * @param formal whether a release object exists
	 * @param assets attached assets
	 * @return the record
	 */
	public static ReleaseRecord create(String tag, Version version, @Nullable Instant publishedAt,
			@Nullable Boolean declaredPrerelease, boolean draft, boolean formal, List<ReleaseAsset> assets) {
		if (declaredPrerelease != null) {
			return new ReleaseRecord(tag, version, publishedAt, declaredPrerelease, draft, formal, assets,
					PrereleaseSource.DECLARED);
		}
		return new ReleaseRecord(tag, version, publishedAt, version.isPrerelease(), draft, formal, assets,
				PrereleaseSource.INFERRED);
	}

	/**
	 * Returns true if the tag is written with a leading {@code v}, e.g. {@code v1.2.3}.
	 */
	public boolean hasVPrefix() {
		return tag.length() > 1 && (tag.charAt(0) == 'v' || tag.charAt(0) == 'V') && Character.isDigit(tag.charAt(1));
	}

}
