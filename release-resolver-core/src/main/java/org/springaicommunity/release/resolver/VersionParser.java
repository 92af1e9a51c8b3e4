package org.springaicommunity.release.resolver;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses tags into {@link Version}s by normalizing them with {@link TagNormalizer} and
 * running an ordered chain of {@link VersionRule}s. The first rule that recognizes the
 * tag wins; {@link LexicalFallbackRule} always closes the chain, so parsing never fails.
 *
 * <p>
 * Standard chain: date-shaped, epoch-prefixed, numeric, lexical fallback.
 */
public final class VersionParser {

	private static final VersionParser STANDARD = createStandard();

	private final List<VersionRule> rules;

	private final LexicalFallbackRule fallback = new LexicalFallbackRule();

	public VersionParser(List<VersionRule> rules) {
		this.rules = List.copyOf(rules);
	}

	public static VersionParser standard() {
		return STANDARD;
	}

	private static VersionParser createStandard() {
		NumericVersionRule numeric = new NumericVersionRule();
		List<VersionRule> rules = new ArrayList<>();
		rules.add(new DateVersionRule());
		rules.add(new EpochVersionRule(numeric));
		rules.add(numeric);
		return new VersionParser(rules);
	}

	public List<VersionRule> rules() {
		return rules;
	}

	public Version parse(String raw) {
		TagNormalizer.NormalizedTag tag = TagNormalizer.normalize(raw);
		if (!tag.text().isEmpty()) {
			for (VersionRule rule : rules) {
				Version version = rule.apply(tag);
				if (version != null) {
					return version;
				}
			}
		}
		return fallback.apply(tag);
	}

}
