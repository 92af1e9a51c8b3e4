package org.springaicommunity.release.resolver;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File system implementation of {@link CacheStore}: one JSON document holding all
 * entries. Writes go to a temporary file that is then moved over the target, so a crash
 * never leaves a truncated cache behind.
 */
public class FileSystemCacheStore implements CacheStore {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemCacheStore.class);

	private static final int FORMAT_VERSION = 1;

	private final Path file;

	private final ObjectMapper objectMapper;

	public FileSystemCacheStore(Path file, ObjectMapper objectMapper) {
		this.file = file;
		this.objectMapper = objectMapper;
	}

	public Path getFile() {
		return file;
	}

	@Override
	public List<CacheEntry> load() {
		if (!Files.exists(file)) {
			logger.debug("No cache file at {}", file);
			return List.of();
		}
		JsonNode root;
		try {
			root = objectMapper.readTree(file.toFile());
		}
		catch (IOException e) {
			// corrupt cache: start empty
			logger.warn("Ignoring unreadable cache file {}: {}", file, e.getMessage());
			return List.of();
		}
		if (root == null || root.path("format_version").asInt() != FORMAT_VERSION) {
			logger.warn("Ignoring cache file {} with unsupported format", file);
			return List.of();
		}

		List<CacheEntry> entries = new ArrayList<>();
		for (JsonNode node : root.path("entries")) {
			try {
				entries.add(fromJson(node));
			}
			catch (IllegalArgumentException | DateTimeParseException e) {
				logger.warn("Skipping malformed cache entry in {}: {}", file, e.getMessage());
			}
		}
		logger.info("Loaded {} cache entries from {}", entries.size(), file);
		return entries;
	}

	@Override
	public void save(Collection<CacheEntry> entries) {
		ObjectNode root = objectMapper.createObjectNode();
		root.put("format_version", FORMAT_VERSION);
		ArrayNode array = root.putArray("entries");
		entries.forEach(entry -> array.add(toJson(entry)));

		Path temp = null;
		try {
			Path parent = file.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
			objectMapper.writeValue(temp.toFile(), root);
			Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			logger.info("Saved {} cache entries to {}", entries.size(), file);
		}
		catch (IOException e) {
			if (temp != null) {
				deleteAfterFailure(temp, e);
			}
			throw new ResolutionException("Failed to save cache file " + file, e);
		}
	}

	private static void deleteAfterFailure(Path temp, IOException failure) {
		try {
			Files.deleteIfExists(temp);
		}
		catch (IOException e) {
			failure.addSuppressed(e);
		}
	}

	private ObjectNode toJson(CacheEntry entry) {
		ObjectNode node = objectMapper.createObjectNode();
		node.put("provider", entry.key().provider());
		node.put("project", entry.key().project());
		node.put("query", entry.key().query());
		node.put("fetched_at", entry.fetchedAt().toString());
		if (entry.freshnessToken() != null) {
			node.put("freshness_token", entry.freshnessToken());
		}
		node.set("payload", entry.payload());
		return node;
	}

	private static CacheEntry fromJson(JsonNode node) {
		CacheKey key = new CacheKey(requiredText(node, "provider"), requiredText(node, "project"),
				requiredText(node, "query"));
		Instant fetchedAt = Instant.parse(requiredText(node, "fetched_at"));
		JsonNode token = node.get("freshness_token");
		JsonNode payload = node.get("payload");
		if (payload == null) {
			throw new IllegalArgumentException("missing payload for " + key);
		}
		return new CacheEntry(key, payload, fetchedAt, token != null && token.isTextual() ? token.asText() : null);
	}

	private static String requiredText(JsonNode node, String field) {
		JsonNode value = node.get(field);
		if (value == null || !value.isTextual()) {
			throw new IllegalArgumentException("missing field " + field);
		}
		return value.asText();
	}

}
