package org.springaicommunity.release.resolver;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Filters candidate releases by a {@link SelectionPolicy} and picks the latest.
 *
 * <p>
 * Filters run in a fixed order and every dropped release is counted against the first
 * filter that rejected it: {@value #DRAFT}, {@value #UNPARSEABLE}, {@value #PRERELEASE},
 * {@value #FORMAL}, {@value #MAJOR}, {@value #EVEN}, {@value #EXCLUDE}, {@value #ONLY},
 * {@value #ASSET}. The latest of the survivors is the maximum under
 * {@link ReleaseRecord#ORDER}.
 */
public class ReleaseSelector {

	private static final Logger logger = LoggerFactory.getLogger(ReleaseSelector.class);

	public static final String DRAFT = "draft";

	public static final String UNPARSEABLE = "unparseable";

	public static final String PRERELEASE = "prerelease";

	public static final String FORMAL = "formal";

	public static final String MAJOR = "major";

	public static final String EVEN = "even";

	public static final String EXCLUDE = "exclude";

	public static final String ONLY = "only";

	public static final String ASSET = "asset";

	private record Filter(String name, Predicate<ReleaseRecord> keep) {
	}

	/**
	 * Select the latest release satisfying the policy.
	 * @param project project name for error messages
	 * @param candidates releases reported by the provider
	 * @param policy selection policy
	 * @return the selected release
	 * @throws NoMatchingReleaseException if no candidate survives the filters
	 */
	public ReleaseRecord select(String project, List<ReleaseRecord> candidates, SelectionPolicy policy) {
		Map<String, Integer> dropped = new LinkedHashMap<>();
		List<ReleaseRecord> eligible = filter(candidates, policy, dropped);
		Optional<ReleaseRecord> latest = eligible.stream().max(ReleaseRecord.ORDER);
		if (latest.isEmpty()) {
			logger.info("No release of {} matches: {} candidates, dropped {}", project, candidates.size(), dropped);
			throw new NoMatchingReleaseException(project, candidates.size(), dropped);
		}
		logger.debug("Selected {} of {} from {} eligible releases", latest.get().tag(), project, eligible.size());
		return latest.get();
	}

	/**
	 * Apply the policy's filters.
	 * @param candidates releases to filter
	 * @param policy selection policy
	 * @param dropped receives the number of releases each filter removed
	 * @return the releases that passed every filter, in input order
	 */
	public List<ReleaseRecord> filter(List<ReleaseRecord> candidates, SelectionPolicy policy,
			Map<String, Integer> dropped) {
		List<Filter> filters = filtersFor(policy);
		List<ReleaseRecord> eligible = new ArrayList<>();
		for (ReleaseRecord candidate : candidates) {
			String rejectedBy = null;
			for (Filter filter : filters) {
				if (!filter.keep().test(candidate)) {
					rejectedBy = filter.name();
					break;
				}
			}
			if (rejectedBy == null) {
				eligible.add(candidate);
			}
			else {
				dropped.merge(rejectedBy, 1, Integer::sum);
				logger.trace("{} dropped by {} filter", candidate.tag(), rejectedBy);
			}
		}
		return eligible;
	}

	private static List<Filter> filtersFor(SelectionPolicy policy) {
		List<Filter> filters = new ArrayList<>();
		filters.add(new Filter(DRAFT, release -> !release.draft()));
		if (!policy.includeUnparseable()) {
			filters.add(new Filter(UNPARSEABLE, release -> release.version().isParseable()));
		}
		if (!policy.includePrereleases()) {
			filters.add(new Filter(PRERELEASE, release -> !release.prerelease()));
		}
		if (policy.formalOnly()) {
			filters.add(new Filter(FORMAL, ReleaseRecord::formal));
		}
		List<Long> major = policy.majorComponents();
		if (!major.isEmpty()) {
			filters.add(new Filter(MAJOR, release -> matchesMajor(release.version(), major)));
		}
		if (policy.evenMinorOnly()) {
			filters.add(new Filter(EVEN,
					release -> release.version().isParseable() && release.version().minor() % 2 == 0));
		}
		TextFilter exclude = policy.excludePattern();
		if (exclude != null) {
			filters.add(new Filter(EXCLUDE, release -> !exclude.matches(release.tag())));
		}
		String only = policy.onlyFilter();
		if (only != null) {
			filters.add(new Filter(ONLY, onlyPredicate(only)));
		}
		TextFilter asset = policy.requiredAssetPattern();
		if (asset != null) {
			filters.add(new Filter(ASSET,
					release -> release.assets().stream().anyMatch(candidate -> asset.matches(candidate.name()))));
		}
		return filters;
	}

	private static Predicate<ReleaseRecord> onlyPredicate(String only) {
		Optional<VersionConstraint> constraint = VersionConstraint.tryParse(only);
		if (constraint.isPresent()) {
			VersionConstraint versions = constraint.get();
			return release -> versions.matches(release.version());
		}
		TextFilter text = TextFilter.parse(only);
		return release -> text.matches(release.tag());
	}

	private static boolean matchesMajor(Version version, List<Long> major) {
		if (!version.isParseable()) {
			return false;
		}
		for (int i = 0; i < major.size(); i++) {
			if (version.component(i) != major.get(i)) {
				return false;
			}
		}
		return true;
	}

}
