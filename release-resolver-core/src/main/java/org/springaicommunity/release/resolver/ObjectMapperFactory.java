package org.springaicommunity.release.resolver;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * The {@link ObjectMapper} shared by providers, the cache file and the CLI's JSON output.
 *
 * <p>
 * Keys are snake_case as in the provider APIs (e.g.&nbsp;{@code published_at}),
 * timestamps are ISO-8601 text and unknown properties in provider payloads are ignored.
 * Scraped pages are cached as single JSON strings, so the string length limit is raised
 * above Jackson's default.
 */
public final class ObjectMapperFactory {

	static final int MAX_STRING_LENGTH = 64 * 1024 * 1024;

	private ObjectMapperFactory() {
	}

	/**
	 * Create a new mapper.
	 * @return configured ObjectMapper
	 */
	public static ObjectMapper create() {
		JsonFactory factory = JsonFactory.builder()
			.streamReadConstraints(StreamReadConstraints.builder().maxStringLength(MAX_STRING_LENGTH).build())
			.build();
		ObjectMapper mapper = new ObjectMapper(factory);
		mapper.registerModule(new JavaTimeModule());
		mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
		mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
		mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
		return mapper;
	}

}
