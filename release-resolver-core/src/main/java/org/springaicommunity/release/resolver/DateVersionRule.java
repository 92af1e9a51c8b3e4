package org.springaicommunity.release.resolver;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jspecify.annotations.Nullable;

/**
 * Recognizes date-shaped tags: {@code YYYY.MM.DD}, {@code YYYY-MM-DD}, {@code YYYY_MM_DD}
 * (optionally followed by a serial number) and compact {@code YYYYMMDD}. The result is
 * always {@code [year, month, day(, serial)]}, so both spellings of a date compare
 * equal.
 */
public class DateVersionRule implements VersionRule {

	private static final Pattern SEPARATED = Pattern
		.compile("^((?:19|20)\\d{2})[._-](\\d{1,2})[._-](\\d{1,2})(?:[._-](\\d{1,9}))?$");

	private static final Pattern COMPACT = Pattern.compile("^((?:19|20)\\d{2})(\\d{2})(\\d{2})$");

	@Override
	public String name() {
		return "date";
	}

	@Override
	@Nullable
	public Version apply(TagNormalizer.NormalizedTag tag) {
		Matcher matcher = SEPARATED.matcher(tag.text());
		if (!matcher.matches()) {
			matcher = COMPACT.matcher(tag.text());
			if (!matcher.matches()) {
				return null;
			}
		}
		long year = Long.parseLong(matcher.group(1));
		long month = Long.parseLong(matcher.group(2));
		long day = Long.parseLong(matcher.group(3));
		if (month < 1 || month > 12 || day < 1 || day > 31) {
			return null;
		}
		List<Long> components = new ArrayList<>(List.of(year, month, day));
		if (matcher.groupCount() >= 4 && matcher.group(4) != null) {
			components.add(Long.parseLong(matcher.group(4)));
		}
		Version.Confidence confidence = tag.altered() ? Version.Confidence.MEDIUM : Version.Confidence.HIGH;
		return new Version(tag.raw(), 0, components, null, null, tag.buildMetadata(), Version.Kind.DATE, name(),
				confidence);
	}

}
