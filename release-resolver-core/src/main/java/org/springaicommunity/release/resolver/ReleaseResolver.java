package org.springaicommunity.release.resolver;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a project identifier to its latest release.
 *
 * <p>
 * Pipeline: pick candidate providers ({@link ProviderRegistry#candidatesFor}), resolve the
 * identifier with the first provider that knows the project, list and normalize its
 * releases, and select one with {@link ReleaseSelector}. Every call runs on the context's
 * executor under a wall-clock timeout; when it expires the work is interrupted and
 * {@link ResolutionTimeoutException} is thrown.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * try (ResolverContext context = ReleaseResolverBuilder.create().tokenFromEnv().buildContext()) {
 *     ReleaseRecord latest = context.resolver().resolve("spring-projects/spring-ai", SelectionPolicy.defaults());
 *     System.out.println(latest.version());
 * }
 * }
 * </pre>
 */
public class ReleaseResolver {

	private static final Logger logger = LoggerFactory.getLogger(ReleaseResolver.class);

	private final ProviderRegistry registry;

	private final ReleaseSelector selector;

	private final ExecutorService executor;

	private final Duration timeout;

	public ReleaseResolver(ProviderRegistry registry, ReleaseSelector selector, ExecutorService executor,
			Duration timeout) {
		this.registry = registry;
		this.selector = selector;
		this.executor = executor;
		this.timeout = timeout;
	}

	public ProviderRegistry registry() {
		return registry;
	}

	/**
	 * Resolve the latest release of a project.
	 * @param input project identifier (owner/repo, package name, URL, ...)
	 * @param policy selection policy
	 * @return the selected release
	 * @throws NotFoundException if no provider knows the project
	 * @throws AmbiguousIdentifierException if the identifier is underspecified
	 * @throws NoMatchingReleaseException if no release satisfies the policy
	 * @throws TransientProviderException if the provider kept failing
	 * @throws PermanentProviderException if the provider refused the request
	 * @throws ResolutionTimeoutException if the resolution took too long
	 */
	public ReleaseRecord resolve(String input, SelectionPolicy policy) {
		return resolve(ResolveRequest.of(input, policy)).release();
	}

	/**
	 * Resolve a request, reporting the resolved project along with the release.
	 * @param request the request
	 * @return the resolution
	 * @see #resolve(String, SelectionPolicy)
	 */
	public Resolution resolve(ResolveRequest request) {
		Future<Resolution> future = executor.submit(() -> resolveNow(request));
		try {
			return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
		}
		catch (TimeoutException e) {
			future.cancel(true);
			logger.warn("Resolution of {} timed out after {}ms", request.input(), timeout.toMillis());
			throw new ResolutionTimeoutException(request.input(), timeout);
		}
		catch (InterruptedException e) {
			future.cancel(true);
			Thread.currentThread().interrupt();
			throw new CancellationException("Resolution of " + request.input() + " interrupted");
		}
		catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException runtime) {
				throw runtime;
			}
			throw new ResolutionException("Resolution of " + request.input() + " failed", cause);
		}
	}

	/**
	 * Resolve the latest release and report it only if it is newer than the given one.
	 * @param input project identifier
	 * @param current version the caller already has
	 * @param policy selection policy
	 * @return the newer release, or empty if {@code current} is up to date
	 */
	public Optional<ReleaseRecord> hasUpdate(String input, Version current, SelectionPolicy policy) {
		ReleaseRecord latest = resolve(input, policy);
		if (latest.version().isNewerThan(current)) {
			logger.info("{}: {} is newer than {}", input, latest.version(), current);
			return Optional.of(latest);
		}
		logger.info("{}: {} is up to date (latest {})", input, current, latest.version());
		return Optional.empty();
	}

	Resolution resolveNow(ResolveRequest request) {
		String input = request.input();
		List<ReleaseProvider> providers = registry.candidatesFor(input, request.provider());
		if (providers.isEmpty()) {
			throw new NotFoundException(input, "No provider recognizes '" + input + "'");
		}

		List<String> tried = new ArrayList<>();
		AmbiguousIdentifierException ambiguity = null;
		NotFoundException notFound = null;
		for (ReleaseProvider provider : providers) {
			ProjectIdentifier project;
			try {
				project = provider.resolveIdentifier(input);
			}
			catch (NotFoundException e) {
				logger.debug("{} does not know {}: {}", provider.id(), input, e.getMessage());
				tried.add(provider.id());
				notFound = e;
				continue;
			}
			catch (AmbiguousIdentifierException e) {
				logger.debug("{} finds {} ambiguous: {}", provider.id(), input, e.getCandidates());
				tried.add(provider.id());
				if (ambiguity == null) {
					ambiguity = e;
				}
				continue;
			}
			return resolveProject(provider, project, request.policy());
		}

		if (ambiguity != null) {
			throw ambiguity;
		}
		if (providers.size() == 1 && notFound != null) {
			throw notFound;
		}
		throw new NotFoundException(input, "Project '" + input + "' not found (tried " + String.join(", ", tried)
				+ ")");
	}

	private Resolution resolveProject(ReleaseProvider provider, ProjectIdentifier project, SelectionPolicy policy) {
		List<JsonNode> items = provider.listReleases(project);
		List<ReleaseRecord> records = new ArrayList<>(items.size());
		for (JsonNode item : items) {
			records.add(provider.toReleaseRecord(item));
		}
		ReleaseRecord release = selector.select(project.toString(), records, policy);
		logger.info("Resolved {} to {} (tag {}, {} candidates)", project, release.version(), release.tag(),
				records.size());
		return new Resolution(project, release, records.size(), provider.sourceUrl(project, release));
	}

}
