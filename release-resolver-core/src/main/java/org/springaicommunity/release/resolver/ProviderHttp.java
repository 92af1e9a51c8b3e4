package org.springaicommunity.release.resolver;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.jspecify.annotations.Nullable;

/**
 * HTTP access for providers: every request goes through the {@link FetchGate}, sends the
 * cached ETag as {@code If-None-Match} and parses the body.
 */
public class ProviderHttp {

	private final ApiClient apiClient;

	private final FetchGate gate;

	private final ObjectMapper objectMapper;

	public ProviderHttp(ApiClient apiClient, FetchGate gate, ObjectMapper objectMapper) {
		this.apiClient = apiClient;
		this.gate = gate;
		this.objectMapper = objectMapper;
	}

	public FetchGate gate() {
		return gate;
	}

	public ObjectMapper objectMapper() {
		return objectMapper;
	}

	/**
	 * GET a JSON document.
	 * @param key cache key of the document
	 * @param budget request budget of the calling provider
	 * @param url absolute URL
	 * @param headers extra request headers
	 * @return the parsed document
	 * @throws PermanentProviderException if the body is not valid JSON
	 */
	public JsonNode getJson(CacheKey key, RateBudget budget, String url, Map<String, String> headers) {
		return gate.fetch(key, budget, token -> {
			ApiResponse response = apiClient.get(url, withFreshnessToken(headers, token));
			if (response.isNotModified()) {
				return FetchGate.FetchResult.notModified(response.etag()).withRateLimit(response.rateLimit());
			}
			return FetchGate.FetchResult.of(parse(url, response.body()), response.etag())
				.withRateLimit(response.rateLimit());
		});
	}

	/**
	 * GET a text document such as an HTML page.
	 * @param key cache key of the document
	 * @param budget request budget of the calling provider
	 * @param url absolute URL
	 * @param headers extra request headers
	 * @return the body text
	 */
	public String getText(CacheKey key, RateBudget budget, String url, Map<String, String> headers) {
		JsonNode node = gate.fetch(key, budget, token -> {
			ApiResponse response = apiClient.get(url, withFreshnessToken(headers, token));
			if (response.isNotModified()) {
				return FetchGate.FetchResult.notModified(response.etag()).withRateLimit(response.rateLimit());
			}
			return FetchGate.FetchResult.of(TextNode.valueOf(response.body()), response.etag())
				.withRateLimit(response.rateLimit());
		});
		return node.asText();
	}

	private static Map<String, String> withFreshnessToken(Map<String, String> headers, @Nullable String token) {
		if (token == null) {
			return headers;
		}
		Map<String, String> conditional = new LinkedHashMap<>(headers);
		conditional.put("If-None-Match", token);
		return conditional;
	}

	private JsonNode parse(String url, String body) {
		try {
			return objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			throw new PermanentProviderException("Malformed JSON from " + url + ": " + e.getOriginalMessage(), e);
		}
	}

}
