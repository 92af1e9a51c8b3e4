package org.springaicommunity.release.resolver;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.jspecify.annotations.Nullable;

/**
 * Which releases may be selected.
 *
 * @param includePrereleases allow releases flagged as prereleases
 * @param majorFilter leading release components that must match, e.g. {@code "2"} or
 * {@code "2.7"}
 * @param requiredAssetPattern at least one asset name must match
 * @param onlyFilter a {@link VersionConstraint} such as {@code >=1.2,<2}, or otherwise a
 * {@link TextFilter} on the tag
 * @param excludePattern tags matching this filter are dropped
 * @param evenMinorOnly only versions with an even minor component (stable branches of
 * projects using odd minors for development)
 * @param formalOnly only releases the provider reports as release objects, no bare tags
 * @param includeUnparseable allow tags that could not be parsed as versions
 */
public record SelectionPolicy(boolean includePrereleases, @Nullable String majorFilter,
		@Nullable TextFilter requiredAssetPattern, @Nullable String onlyFilter, @Nullable TextFilter excludePattern,
		boolean evenMinorOnly, boolean formalOnly, boolean includeUnparseable) {

	private static final Pattern MAJOR = Pattern.compile("^\\d+(?:\\.\\d+)*$");

	private static final SelectionPolicy DEFAULTS = builder().build();

	public SelectionPolicy {
		if (majorFilter != null && !MAJOR.matcher(majorFilter).matches()) {
			throw new IllegalArgumentException("Major filter must be numeric components like 2 or 2.7: " + majorFilter);
		}
		if (onlyFilter != null && onlyFilter.isBlank()) {
			throw new IllegalArgumentException("Only filter must not be blank");
		}
	}

	/**
	 * Stable, parseable releases of any version.
	 */
	public static SelectionPolicy defaults() {
		return DEFAULTS;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Components of {@link #majorFilter()}, empty when there is none.
	 */
	public List<Long> majorComponents() {
		List<Long> components = new ArrayList<>();
		if (majorFilter != null) {
			for (String part : majorFilter.split("\\.")) {
				components.add(Long.parseLong(part));
			}
		}
		return components;
	}

	public Builder toBuilder() {
		return new Builder().includePrereleases(includePrereleases)
			.majorFilter(majorFilter)
			.requiredAssetPattern(requiredAssetPattern)
			.onlyFilter(onlyFilter)
			.excludePattern(excludePattern)
			.evenMinorOnly(evenMinorOnly)
			.formalOnly(formalOnly)
			.includeUnparseable(includeUnparseable);
	}

	/**
	 * Builder for {@link SelectionPolicy}. Everything is off by default.
	 */
	public static class Builder {

		private boolean includePrereleases;

		@Nullable
		private String majorFilter;

		@Nullable
		private TextFilter requiredAssetPattern;

		@Nullable
		private String onlyFilter;

		@Nullable
		private TextFilter excludePattern;

		private boolean evenMinorOnly;

		private boolean formalOnly;

		private boolean includeUnparseable;

		private Builder() {
		}

		public Builder includePrereleases(boolean includePrereleases) {
			this.includePrereleases = includePrereleases;
			return this;
		}

		public Builder majorFilter(@Nullable String majorFilter) {
			this.majorFilter = majorFilter;
			return this;
		}

		public Builder requiredAssetPattern(@Nullable TextFilter requiredAssetPattern) {
			this.requiredAssetPattern = requiredAssetPattern;
			return this;
		}

		/**
		 * Require an asset, given as an exact name, {@code ~regex} or {@code *}.
		 * @param expression asset expression
		 * @return this builder
		 */
		public Builder requiredAsset(String expression) {
			this.requiredAssetPattern = TextFilter.parseExact(expression);
			return this;
		}

		public Builder onlyFilter(@Nullable String onlyFilter) {
			this.onlyFilter = onlyFilter;
			return this;
		}

		public Builder excludePattern(@Nullable TextFilter excludePattern) {
			this.excludePattern = excludePattern;
			return this;
		}

		/**
		 * Exclude tags matching a {@link TextFilter} expression.
		 * @param expression filter expression
		 * @return this builder
		 */
		public Builder exclude(String expression) {
			this.excludePattern = TextFilter.parse(expression);
			return this;
		}

		public Builder evenMinorOnly(boolean evenMinorOnly) {
			this.evenMinorOnly = evenMinorOnly;
			return this;
		}

		public Builder formalOnly(boolean formalOnly) {
			this.formalOnly = formalOnly;
			return this;
		}

		public Builder includeUnparseable(boolean includeUnparseable) {
			this.includeUnparseable = includeUnparseable;
			return this;
		}

		/**
		 * Build the policy.
		 * @return the policy
		 * @throws IllegalArgumentException if a filter value is malformed
		 */
		public SelectionPolicy build() {
			if (onlyFilter != null && VersionConstraint.tryParse(onlyFilter).isEmpty()) {
				TextFilter.parse(onlyFilter);
			}
			return new SelectionPolicy(includePrereleases, majorFilter, requiredAssetPattern, onlyFilter,
					excludePattern, evenMinorOnly, formalOnly, includeUnparseable);
		}

	}

}
