package org.springaicommunity.release.resolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.jspecify.annotations.Nullable;

/**
 * A release tag decomposed into a totally ordered version value.
 *
 * <p>
 * Comparison order:
 * <ol>
 * <li>parseable versions rank above unparseable ones</li>
 * <li>epoch</li>
 * <li>release components, the shorter sequence padded with zeros ({@code 1.2 == 1.2.0})</li>
 * <li>pre-release marker, where no marker ranks above any marker</li>
 * <li>post-release number, where no number ranks below any number</li>
 * </ol>
 * Local/build metadata never takes part in comparison or equality. Two unparseable
 * versions compare by their raw tag text.
 *
 * <p>
 * Instances are created by {@link VersionParser}; {@link #parse(String)} uses the
 * standard rule chain.
 */
public final class Version implements Comparable<Version> {

	private static final Pattern URL_OR_PROJECT = Pattern.compile("^(https?://.*|[^\\s/]+/[^\\s/]+)$");

	/**
	 * How the version was recognized.
	 */
	public enum Kind {

		SEMANTIC, DATE, UNPARSEABLE

	}

	/**
	 * How much of the tag had to be discarded or guessed to produce the version.
	 */
	public enum Confidence {

		/** The tag was a clean version, at most a {@code v} prefix was dropped. */
		HIGH,
		/** Prefixes or known qualifiers were stripped. */
		MEDIUM,
		/** Unrecognized text was left over, or nothing numeric was found. */
		LOW

	}

	private final String raw;

	private final int epoch;

	private final List<Long> release;

	@Nullable
	private final PreRelease preRelease;

	@Nullable
	private final Long postRelease;

	@Nullable
	private final String local;

	private final Kind kind;

	private final String rule;

	private final Confidence confidence;

	Version(String raw, int epoch, List<Long> release, @Nullable PreRelease preRelease, @Nullable Long postRelease,
			@Nullable String local, Kind kind, String rule, Confidence confidence) {
		this.raw = raw;
		this.epoch = epoch;
		this.release = List.copyOf(release);
		this.preRelease = preRelease;
		this.postRelease = postRelease;
		this.local = local;
		this.kind = kind;
		this.rule = rule;
		this.confidence = confidence;
	}

	static Version unparseable(String raw, String rule) {
		return new Version(raw, 0, List.of(), null, null, null, Kind.UNPARSEABLE, rule, Confidence.LOW);
	}

	/**
	 * Parse a tag with the standard rule chain. Never fails.
	 * @param raw tag or label text
	 * @return the parsed version, possibly {@link Kind#UNPARSEABLE}
	 */
	public static Version parse(String raw) {
		return VersionParser.standard().parse(raw);
	}

	/**
	 * Parse a version supplied by a user, e.g. the current version to compare against.
	 * Inputs that look like a URL or an {@code owner/repo} reference are rejected, as are
	 * inputs without any numeric component.
	 * @param value user input
	 * @return the parsed version, or empty if the input is not a usable version
	 */
	public static Optional<Version> parseUserVersion(String value) {
		String trimmed = value.trim();
		if (trimmed.isEmpty() || URL_OR_PROJECT.matcher(trimmed).matches()) {
			return Optional.empty();
		}
		Version version = parse(trimmed);
		return version.isParseable() ? Optional.of(version) : Optional.empty();
	}

	public String raw() {
		return raw;
	}

	public int epoch() {
		return epoch;
	}

	public List<Long> release() {
		return release;
	}

	/**
	 * Release component at the given index, zero when the version has fewer components.
	 * @param index zero-based component index
	 * @return the component value
	 */
	public long component(int index) {
		return index < release.size() ? release.get(index) : 0L;
	}

	public long major() {
		return component(0);
	}

	public long minor() {
		return component(1);
	}

	@Nullable
	public PreRelease preRelease() {
		return preRelease;
	}

	@Nullable
	public Long postRelease() {
		return postRelease;
	}

	@Nullable
	public String local() {
		return local;
	}

	public Kind kind() {
		return kind;
	}

	/**
	 * Name of the parsing rule that produced this version.
	 * @return rule name, e.g. "numeric" or "date"
	 */
	public String rule() {
		return rule;
	}

	public Confidence confidence() {
		return confidence;
	}

	public boolean isParseable() {
		return kind != Kind.UNPARSEABLE;
	}

	/**
	 * Returns true if the tag carries a pre-release marker (dev, alpha, beta, milestone,
	 * preview, rc).
	 */
	public boolean isPrerelease() {
		return preRelease != null;
	}

	@Override
	public int compareTo(Version other) {
		if (!isParseable() || !other.isParseable()) {
			if (isParseable()) {
				return 1;
			}
			if (other.isParseable()) {
				return -1;
			}
			return raw.compareTo(other.raw);
		}
		int result = Integer.compare(epoch, other.epoch);
		if (result != 0) {
			return result;
		}
		int length = Math.max(release.size(), other.release.size());
		for (int i = 0; i < length; i++) {
			result = Long.compare(component(i), other.component(i));
			if (result != 0) {
				return result;
			}
		}
		result = comparePreRelease(preRelease, other.preRelease);
		if (result != 0) {
			return result;
		}
		return comparePostRelease(postRelease, other.postRelease);
	}

	private static int comparePreRelease(@Nullable PreRelease left, @Nullable PreRelease right) {
		if (left == null) {
			return right == null ? 0 : 1;
		}
		return right == null ? -1 : left.compareTo(right);
	}

	private static int comparePostRelease(@Nullable Long left, @Nullable Long right) {
		if (left == null) {
			return right == null ? 0 : -1;
		}
		return right == null ? 1 : Long.compare(left, right);
	}

	public boolean isNewerThan(Version other) {
		return compareTo(other) > 0;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Version other)) {
			return false;
		}
		if (!isParseable() || !other.isParseable()) {
			return !isParseable() && !other.isParseable() && raw.equals(other.raw);
		}
		return epoch == other.epoch && trimmedRelease().equals(other.trimmedRelease())
				&& Objects.equals(preRelease, other.preRelease) && Objects.equals(postRelease, other.postRelease);
	}

	@Override
	public int hashCode() {
		if (!isParseable()) {
			return raw.hashCode();
		}
		return Objects.hash(epoch, trimmedRelease(), preRelease, postRelease);
	}

	private List<Long> trimmedRelease() {
		int end = release.size();
		while (end > 0 && release.get(end - 1) == 0L) {
			end--;
		}
		return end == release.size() ? release : Collections.unmodifiableList(new ArrayList<>(release.subList(0, end)));
	}

	/**
	 * Canonical text form: {@code [epoch!]1.2.3[-rc1][.post2]}. Unparseable versions
	 * render as their raw tag.
	 */
	@Override
	public String toString() {
		if (!isParseable()) {
			return raw;
		}
		StringBuilder text = new StringBuilder();
		if (epoch != 0) {
			text.append(epoch).append('!');
		}
		text.append(release.stream().map(String::valueOf).collect(Collectors.joining(".")));
		if (preRelease != null) {
			text.append('-').append(preRelease);
		}
		if (postRelease != null) {
			text.append(".post").append(postRelease);
		}
		return text.toString();
	}

}
