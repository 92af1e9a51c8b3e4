package org.springaicommunity.release.resolver;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static helpers for navigating provider payloads.
 */
public final class JsonNodeUtils {

	private static final Logger logger = LoggerFactory.getLogger(JsonNodeUtils.class);

	private JsonNodeUtils() {
	}

	public static Optional<String> getString(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		return target.isMissingNode() || target.isNull() ? Optional.empty() : Optional.of(target.asText());
	}

	/**
	 * Boolean at the path, empty if the field is absent or not a boolean.
	 */
	public static Optional<Boolean> getBoolean(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		return target.isBoolean() ? Optional.of(target.booleanValue()) : Optional.empty();
	}

	/**
	 * Timestamp at the path. Accepts ISO-8601 instants, offset date-times, local
	 * date-times (taken as UTC) and plain dates.
	 */
	public static Optional<Instant> getInstant(JsonNode node, String... path) {
		return getString(node, path).flatMap(JsonNodeUtils::parseInstant);
	}

	public static Optional<Instant> parseInstant(String text) {
		String value = text.trim();
		if (value.isEmpty()) {
			return Optional.empty();
		}
		try {
			if (value.length() == 10) {
				return Optional.of(LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant());
			}
			if (value.endsWith("Z") || value.matches(".*[+-]\\d{2}:\\d{2}$")) {
				return Optional.of(OffsetDateTime.parse(value).toInstant());
			}
			return Optional.of(LocalDateTime.parse(value).toInstant(ZoneOffset.UTC));
		}
		catch (DateTimeParseException e) {
			logger.warn("Failed to parse timestamp: {}", value);
			return Optional.empty();
		}
	}

	public static List<JsonNode> getArray(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		if (target.isArray()) {
			List<JsonNode> result = new ArrayList<>();
			target.forEach(result::add);
			return result;
		}
		return List.of();
	}

	private static JsonNode navigate(JsonNode node, String... path) {
		JsonNode target = node;
		for (String p : path) {
			target = target.path(p);
		}
		return target;
	}

}
