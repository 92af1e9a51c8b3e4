package org.springaicommunity.release.resolver;

/**
 * Pre-release marker of a {@link Version}, e.g. the {@code rc1} in {@code 2.0.0-rc1}.
 *
 * <p>
 * Ordering is by {@link Kind} first, then by the trailing number. A marker without a
 * number sorts as number zero, so {@code beta} and {@code beta0} are equal.
 *
 * @param kind the marker kind
 * @param number the marker number, zero when the tag had none
 */
public record PreRelease(Kind kind, long number) implements Comparable<PreRelease> {

	/**
	 * Pre-release kinds from least to most mature.
	 */
	public enum Kind {

		DEV("dev"), ALPHA("alpha"), BETA("beta"), MILESTONE("M"), PREVIEW("preview"), RC("rc");

		private final String label;

		Kind(String label) {
			this.label = label;
		}

		public String label() {
			return label;
		}

		/**
		 * Map a lower-case marker as it appears in tags to its kind.
		 * @param marker marker text such as "b", "beta", "cr" or "snapshot"
		 * @return the kind
		 * @throws IllegalArgumentException for unknown markers
		 */
		public static Kind fromMarker(String marker) {
			return switch (marker) {
				case "dev", "devel", "snapshot" -> DEV;
				case "alpha", "a" -> ALPHA;
				case "beta", "b" -> BETA;
				case "milestone", "m" -> MILESTONE;
				case "preview", "pre" -> PREVIEW;
				case "rc", "c", "cr" -> RC;
				default -> throw new IllegalArgumentException("Unknown pre-release marker: " + marker);
			};
		}

	}

	@Override
	public int compareTo(PreRelease other) {
		int byKind = kind.compareTo(other.kind);
		return byKind != 0 ? byKind : Long.compare(number, other.number);
	}

	@Override
	public String toString() {
		return number == 0 ? kind.label() : kind.label() + number;
	}

}
