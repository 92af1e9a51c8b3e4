package org.springaicommunity.release.resolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Comma-separated version comparisons that must all hold, e.g. {@code >=1.2,<2}.
 * Supported operators: {@code >=}, {@code <=}, {@code >}, {@code <}, {@code ==}
 * (or {@code =}) and {@code !=}.
 */
public final class VersionConstraint {

	private static final Pattern CLAUSE = Pattern.compile("^(>=|<=|==|!=|>|<|=)\\s*(\\S+)$");

	private record Clause(String operator, Version version) {

		boolean test(Version candidate) {
			int comparison = candidate.compareTo(version);
			return switch (operator) {
				case ">=" -> comparison >= 0;
				case "<=" -> comparison <= 0;
				case ">" -> comparison > 0;
				case "<" -> comparison < 0;
				case "!=" -> comparison != 0;
				default -> comparison == 0;
			};
		}

	}

	private final String expression;

	private final List<Clause> clauses;

	private VersionConstraint(String expression, List<Clause> clauses) {
		this.expression = expression;
		this.clauses = List.copyOf(clauses);
	}

	/**
	 * Parse a constraint expression.
	 * @param expression e.g. {@code >=1.2,<2}
	 * @return the constraint, or empty if the text is not a constraint expression
	 */
	public static Optional<VersionConstraint> tryParse(String expression) {
		List<Clause> clauses = new ArrayList<>();
		for (String part : expression.split(",")) {
			Matcher matcher = CLAUSE.matcher(part.trim());
			if (!matcher.matches()) {
				return Optional.empty();
			}
			Version version = Version.parse(matcher.group(2));
			if (!version.isParseable()) {
				return Optional.empty();
			}
			clauses.add(new Clause(matcher.group(1), version));
		}
		return clauses.isEmpty() ? Optional.empty() : Optional.of(new VersionConstraint(expression.trim(), clauses));
	}

	public boolean matches(Version version) {
		if (!version.isParseable()) {
			return false;
		}
		for (Clause clause : clauses) {
			if (!clause.test(version)) {
				return false;
			}
		}
		return true;
	}

	@Override
	public String toString() {
		return expression;
	}

}
