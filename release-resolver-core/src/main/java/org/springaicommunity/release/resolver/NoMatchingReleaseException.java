package org.springaicommunity.release.resolver;

import java.util.Map;

/**
 * The project exists and has releases, but none of them satisfies the selection policy.
 */
public class NoMatchingReleaseException extends ResolutionException {

	private final String project;

	private final int candidates;

	private final Map<String, Integer> droppedBy;

	public NoMatchingReleaseException(String project, int candidates, Map<String, Integer> droppedBy) {
		super(describe(project, candidates, droppedBy));
		this.project = project;
		this.candidates = candidates;
		this.droppedBy = Map.copyOf(droppedBy);
	}

	private static String describe(String project, int candidates, Map<String, Integer> droppedBy) {
		if (candidates == 0) {
			return "No releases found for " + project;
		}
		return "None of the " + candidates + " releases of " + project + " matches the selection policy (dropped: "
				+ droppedBy + ")";
	}

	public String getProject() {
		return project;
	}

	/**
	 * Number of releases the provider reported before filtering.
	 */
	public int getCandidates() {
		return candidates;
	}

	/**
	 * Number of releases each filter removed, keyed by filter name.
	 */
	public Map<String, Integer> getDroppedBy() {
		return droppedBy;
	}

}
