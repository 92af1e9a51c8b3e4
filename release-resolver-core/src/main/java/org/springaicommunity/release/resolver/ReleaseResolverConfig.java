package org.springaicommunity.release.resolver;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration exposing the resolution engine as beans. The context bean is
 * closed with the application context, which saves the response cache if a cache file is
 * configured.
 */
@Configuration
public class ReleaseResolverConfig {

	@Value("${GITHUB_TOKEN:}")
	private String githubToken;

	@Bean
	public ResolverProperties resolverProperties() {
		return new ResolverProperties();
	}

	@Bean
	public ObjectMapper objectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean(destroyMethod = "close")
	public ResolverContext resolverContext(ResolverProperties resolverProperties, ObjectMapper objectMapper) {
		return ReleaseResolverBuilder.create()
			.token(githubToken.isBlank() ? null : githubToken)
			.properties(resolverProperties)
			.objectMapper(objectMapper)
			.buildContext();
	}

	@Bean
	public ReleaseResolver releaseResolver(ResolverContext resolverContext) {
		return resolverContext.resolver();
	}

}
