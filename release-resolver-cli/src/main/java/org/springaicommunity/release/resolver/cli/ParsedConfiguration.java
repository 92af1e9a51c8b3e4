package org.springaicommunity.release.resolver.cli;

import org.springaicommunity.release.resolver.SelectionPolicy;
import org.springaicommunity.release.resolver.TextFilter;
import org.springaicommunity.release.resolver.Version;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// What to resolve
	public String project;

	public String provider = null; // null = detect from the identifier

	// Selection
	public boolean includePrereleases = false;

	public String major = null;

	public String only = null; // version constraint or tag filter

	public String exclude = null;

	public String havingAsset = null;

	public boolean even = false;

	public boolean formal = false;

	// Output
	public String format = "version"; // version/tag/json/assets

	public Version newerThan = null;

	// Engine settings
	public Integer timeoutSeconds = null; // null = properties default

	public boolean allowStale = false;

	public String cacheFile = null;

	public boolean verbose = false;

	public boolean helpRequested = false;

	/**
	 * Selection policy described by the selection options.
	 * @return the policy
	 */
	public SelectionPolicy toPolicy() {
		SelectionPolicy.Builder builder = SelectionPolicy.builder()
			.includePrereleases(includePrereleases)
			.majorFilter(major)
			.onlyFilter(only)
			.evenMinorOnly(even)
			.formalOnly(formal);
		if (exclude != null) {
			builder.excludePattern(TextFilter.parse(exclude));
		}
		if (havingAsset != null) {
			builder.requiredAssetPattern(TextFilter.parseExact(havingAsset));
		}
		return builder.build();
	}

}
