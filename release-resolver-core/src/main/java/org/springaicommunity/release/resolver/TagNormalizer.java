package org.springaicommunity.release.resolver;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jspecify.annotations.Nullable;

/**
 * Strips the parts of a tag that never carry version information: ref prefixes, build
 * metadata after {@code +}, leading project names or words, and trailing stable qualifiers
 * such as {@code .Final} or {@code -GA}.
 */
public final class TagNormalizer {

	private static final Pattern PROJECT_PREFIX = Pattern.compile("^[a-z]{2,}[a-z0-9]*[-_](?=\\d)");

	private static final Pattern STABLE_QUALIFIER = Pattern.compile("[._-]?(final|ga|release|stable|lts)$");

	private TagNormalizer() {
	}

	/**
	 * Result of normalizing a tag.
	 *
	 * @param raw the tag as received
	 * @param text lower-case candidate version text, empty if no digit was found
	 * @param buildMetadata text after {@code +}, if any
	 * @param altered true if anything beyond a {@code v} prefix was removed
	 */
	public record NormalizedTag(String raw, String text, @Nullable String buildMetadata, boolean altered) {
	}

	public static NormalizedTag normalize(String raw) {
		String trimmed = raw.trim();
		String text = trimmed.toLowerCase(Locale.ROOT);
		boolean altered = false;

		if (text.startsWith("refs/tags/")) {
			text = text.substring("refs/tags/".length());
		}

		String buildMetadata = null;
		int plus = text.indexOf('+');
		if (plus >= 0) {
			buildMetadata = trimmed.substring(trimmed.indexOf('+') + 1);
			text = text.substring(0, plus);
		}

		Matcher prefix = PROJECT_PREFIX.matcher(text);
		if (prefix.find()) {
			text = text.substring(prefix.end());
			altered = true;
		}

		int firstDigit = indexOfFirstDigit(text);
		if (firstDigit < 0) {
			return new NormalizedTag(raw, "", buildMetadata, true);
		}
		if (firstDigit > 0) {
			String dropped = text.substring(0, firstDigit);
			if (!dropped.equals("v")) {
				altered = true;
			}
			text = text.substring(firstDigit);
		}

		Matcher qualifier = STABLE_QUALIFIER.matcher(text);
		if (qualifier.find() && qualifier.start() > 0) {
			text = text.substring(0, qualifier.start());
			altered = true;
		}

		return new NormalizedTag(raw, text, buildMetadata, altered);
	}

	private static int indexOfFirstDigit(String text) {
		for (int i = 0; i < text.length(); i++) {
			if (Character.isDigit(text.charAt(i))) {
				return i;
			}
		}
		return -1;
	}

}
