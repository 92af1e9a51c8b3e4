package org.springaicommunity.release.resolver;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jspecify.annotations.Nullable;

/**
 * Recognizes an explicit epoch in front of a version, written {@code 2!1.0} (PEP 440) or
 * {@code 2:1.0} (RPM/Debian). The remainder is handed to the numeric rule.
 */
public class EpochVersionRule implements VersionRule {

	private static final Pattern EPOCH = Pattern.compile("^(\\d{1,9})[!:](\\d.*)$");

	private final NumericVersionRule numeric;

	public EpochVersionRule(NumericVersionRule numeric) {
		this.numeric = numeric;
	}

	@Override
	public String name() {
		return "epoch";
	}

	@Override
	@Nullable
	public Version apply(TagNormalizer.NormalizedTag tag) {
		Matcher matcher = EPOCH.matcher(tag.text());
		if (!matcher.matches()) {
			return null;
		}
		int epoch = Integer.parseInt(matcher.group(1));
		Version rest = numeric.apply(
				new TagNormalizer.NormalizedTag(tag.raw(), matcher.group(2), tag.buildMetadata(), tag.altered()));
		if (rest == null) {
			return null;
		}
		return new Version(tag.raw(), epoch, rest.release(), rest.preRelease(), rest.postRelease(), rest.local(),
				Version.Kind.SEMANTIC, name(), rest.confidence());
	}

}
