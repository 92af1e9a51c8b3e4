package org.springaicommunity.release.resolver;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jspecify.annotations.Nullable;

/**
 * The general case: numeric groups separated by {@code .}, {@code -} or {@code _},
 * optionally followed by a pre-release marker ({@code dev}, {@code alpha}/{@code a},
 * {@code beta}/{@code b}, {@code milestone}/{@code m}, {@code preview}/{@code pre},
 * {@code rc}/{@code c}/{@code cr}, {@code snapshot}) with an optional number, and by a
 * post-release marker ({@code post}, {@code p}, {@code pl}, {@code patch}, {@code rev},
 * {@code r}) with a mandatory number. Whatever is left is kept as local metadata and
 * lowers the confidence.
 */
public class NumericVersionRule implements VersionRule {

	private static final int MAX_COMPONENT_DIGITS = 18;

	private static final Pattern NUMERIC = Pattern.compile("^(\\d+(?:[._-]\\d+)*)"
			+ "(?:[._-]?(devel|dev|snapshot|alpha|a|beta|b|milestone|m|preview|pre|rc|cr|c)(?:[._-]?(\\d+))?(?=$|[._+-]))?"
			+ "(?:[._-]?(post|patch|pl|p|rev|r)[._-]?(\\d+)(?=$|[._+-]))?" + "(.*)$");

	private static final Pattern SEPARATOR = Pattern.compile("[._-]");

	@Override
	public String name() {
		return "numeric";
	}

	@Override
	@Nullable
	public Version apply(TagNormalizer.NormalizedTag tag) {
		Matcher matcher = NUMERIC.matcher(tag.text());
		if (!matcher.matches()) {
			return null;
		}

		List<Long> release = new ArrayList<>();
		for (String part : SEPARATOR.split(matcher.group(1))) {
			if (part.length() > MAX_COMPONENT_DIGITS) {
				return null;
			}
			release.add(Long.parseLong(part));
		}

		PreRelease preRelease = null;
		if (matcher.group(2) != null) {
			long number = matcher.group(3) != null ? parseNumber(matcher.group(3)) : 0L;
			preRelease = new PreRelease(PreRelease.Kind.fromMarker(matcher.group(2)), number);
		}

		Long postRelease = matcher.group(5) != null ? parseNumber(matcher.group(5)) : null;

		String leftover = trimSeparators(matcher.group(6));
		String local = tag.buildMetadata();
		Version.Confidence confidence = tag.altered() ? Version.Confidence.MEDIUM : Version.Confidence.HIGH;
		if (!leftover.isEmpty()) {
			local = local == null ? leftover : leftover + "+" + local;
			confidence = Version.Confidence.LOW;
		}

		return new Version(tag.raw(), 0, release, preRelease, postRelease, local, Version.Kind.SEMANTIC, name(),
				confidence);
	}

	private static long parseNumber(String digits) {
		String trimmed = digits.length() > MAX_COMPONENT_DIGITS ? digits.substring(0, MAX_COMPONENT_DIGITS) : digits;
		return Long.parseLong(trimmed);
	}

	private static String trimSeparators(String text) {
		int start = 0;
		int end = text.length();
		while (start < end && "._-+".indexOf(text.charAt(start)) >= 0) {
			start++;
		}
		while (end > start && "._-+".indexOf(text.charAt(end - 1)) >= 0) {
			end--;
		}
		return text.substring(start, end);
	}

}
