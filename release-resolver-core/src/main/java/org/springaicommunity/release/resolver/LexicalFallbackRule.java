package org.springaicommunity.release.resolver;

/**
 * Last rule of every chain: accepts anything and marks it unparseable. Such versions only
 * order among themselves, by raw tag text.
 */
public class LexicalFallbackRule implements VersionRule {

	@Override
	public String name() {
		return "lexical";
	}

	@Override
	public Version apply(TagNormalizer.NormalizedTag tag) {
		return Version.unparseable(tag.raw(), name());
	}

}
