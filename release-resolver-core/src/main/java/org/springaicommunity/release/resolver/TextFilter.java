package org.springaicommunity.release.resolver;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.jspecify.annotations.Nullable;

/**
 * Match condition on a tag or asset name.
 *
 * <p>
 * Expression syntax:
 * <ul>
 * <li>{@code text}: the name contains {@code text} ({@link #parse}) or equals it
 * ({@link #parseExact})</li>
 * <li>{@code ~regex}: the regular expression is found in the name</li>
 * <li>{@code *}: anything matches</li>
 * <li>{@code !} in front of any of the above: negation</li>
 * </ul>
 */
public final class TextFilter {

	public enum Mode {

		CONTAINS, EXACT, REGEX, ANY

	}

	private final String expression;

	private final Mode mode;

	private final String value;

	@Nullable
	private final Pattern pattern;

	private final boolean negated;

	private TextFilter(String expression, Mode mode, String value, @Nullable Pattern pattern, boolean negated) {
		this.expression = expression;
		this.mode = mode;
		this.value = value;
		this.pattern = pattern;
		this.negated = negated;
	}

	/**
	 * Parse an expression whose plain form means "contains".
	 * @param expression filter expression
	 * @return the filter
	 * @throws IllegalArgumentException if the expression is empty or the regex is invalid
	 */
	public static TextFilter parse(String expression) {
		return parse(expression, Mode.CONTAINS);
	}

	/**
	 * Parse an expression whose plain form means "equals", as used for asset names.
	 * @param expression filter expression
	 * @return the filter
	 * @throws IllegalArgumentException if the expression is empty or the regex is invalid
	 */
	public static TextFilter parseExact(String expression) {
		return parse(expression, Mode.EXACT);
	}

	private static TextFilter parse(String expression, Mode plainMode) {
		String text = expression.trim();
		boolean negated = text.startsWith("!");
		if (negated) {
			text = text.substring(1);
		}
		if (text.isEmpty()) {
			throw new IllegalArgumentException("Empty filter expression: '" + expression + "'");
		}
		if (text.equals("*")) {
			return new TextFilter(expression, Mode.ANY, text, null, negated);
		}
		if (text.startsWith("~")) {
			String regex = text.substring(1);
			try {
				return new TextFilter(expression, Mode.REGEX, regex, Pattern.compile(regex), negated);
			}
			catch (PatternSyntaxException e) {
				throw new IllegalArgumentException("Invalid regular expression '" + regex + "': " + e.getDescription(),
						e);
			}
		}
		return new TextFilter(expression, plainMode, text, null, negated);
	}

	public boolean matches(String text) {
		boolean matched = switch (mode) {
			case ANY -> true;
			case CONTAINS -> text.contains(value);
			case EXACT -> text.equals(value);
			case REGEX -> Objects.requireNonNull(pattern).matcher(text).find();
		};
		return matched != negated;
	}

	public Mode mode() {
		return mode;
	}

	public boolean isNegated() {
		return negated;
	}

	public String expression() {
		return expression;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof TextFilter other && expression.equals(other.expression) && mode == other.mode;
	}

	@Override
	public int hashCode() {
		return Objects.hash(expression, mode);
	}

	@Override
	public String toString() {
		return expression;
	}

}
