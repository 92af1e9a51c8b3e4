package org.springaicommunity.release.resolver.cli;

import java.io.PrintStream;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.release.resolver.AmbiguousIdentifierException;
import org.springaicommunity.release.resolver.NoMatchingReleaseException;
import org.springaicommunity.release.resolver.NotFoundException;
import org.springaicommunity.release.resolver.ObjectMapperFactory;
import org.springaicommunity.release.resolver.ReleaseResolverBuilder;
import org.springaicommunity.release.resolver.Resolution;
import org.springaicommunity.release.resolver.ResolutionException;
import org.springaicommunity.release.resolver.ResolveRequest;
import org.springaicommunity.release.resolver.ResolverContext;
import org.springaicommunity.release.resolver.ResolverProperties;
import org.springaicommunity.release.resolver.SelectionPolicy;

/**
 * Release Resolver CLI Application
 *
 * Plain Java command-line application that prints the latest release of a project. No
 * Spring dependencies - uses ReleaseResolverBuilder for service wiring. The result goes to
 * standard output, logs and errors to standard error.
 *
 * Usage: java -jar release-resolver-cli.jar PROJECT [OPTIONS]
 *
 * Environment Variables: GITHUB_TOKEN - GitHub personal access token (optional)
 */
public class ReleaseResolverCli {

	public static final int EXIT_OK = 0;

	public static final int EXIT_ERROR = 1;

	public static final int EXIT_NO_UPDATE = 2;

	public static final int EXIT_NOT_FOUND = 3;

	/** System property read by logback.xml for the level of the resolver's loggers. */
	static final String LOG_LEVEL_PROPERTY = "release.resolver.log.level";

	private final Logger logger = LoggerFactory.getLogger(ReleaseResolverCli.class);

	private final ReleaseResolverBuilder builder;

	private final PrintStream out;

	private final PrintStream err;

	public ReleaseResolverCli(ReleaseResolverBuilder builder, PrintStream out, PrintStream err) {
		this.builder = builder;
		this.out = out;
		this.err = err;
	}

	public static void main(String[] args) {
		// logback reads the level when the first logger is created
		if (ArgumentParser.isVerboseRequested(args)) {
			System.setProperty(LOG_LEVEL_PROPERTY, "DEBUG");
		}
		int exitCode = new ReleaseResolverCli(ReleaseResolverBuilder.create().tokenFromEnv(), System.out, System.err)
			.run(args);
		if (exitCode != EXIT_OK) {
			System.exit(exitCode);
		}
	}

	/**
	 * Run one resolution.
	 * @param args command-line arguments
	 * @return the process exit code
	 */
	public int run(String[] args) {
		ResolverProperties properties = new ResolverProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			out.println(argumentParser.generateHelpText());
			return EXIT_OK;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			err.println("Error: " + e.getMessage());
			err.println("Use --help for usage information");
			return EXIT_ERROR;
		}

		applyTo(config, properties);
		logConfiguration(config);

		SelectionPolicy policy = config.toPolicy();
		try (ResolverContext context = builder.properties(properties).buildContext()) {
			Resolution resolution = context.resolver().resolve(new ResolveRequest(config.project, policy, config.provider));
			logger.info("Resolved {} to {} ({} candidates)", resolution.project(), resolution.release().tag(),
					resolution.candidates());

			if (config.newerThan != null && !resolution.release().version().isNewerThan(config.newerThan)) {
				logger.info("{} is not newer than {}", resolution.release().version(), config.newerThan);
				return EXIT_NO_UPDATE;
			}

			ReleaseFormatter formatter = new ReleaseFormatter(ObjectMapperFactory.create());
			String text = formatter.format(resolution, config.format, policy.requiredAssetPattern());
			if (!text.isEmpty()) {
				out.println(text);
			}
			return EXIT_OK;
		}
		catch (AmbiguousIdentifierException e) {
			err.println("Error: " + e.getMessage());
			err.println("Candidates: " + String.join(", ", e.getCandidates()));
			return EXIT_ERROR;
		}
		catch (NotFoundException | NoMatchingReleaseException e) {
			err.println(e.getMessage());
			return EXIT_NOT_FOUND;
		}
		catch (ResolutionException e) {
			logger.debug("Resolution of {} failed", config.project, e);
			err.println("Error: " + e.getMessage());
			return EXIT_ERROR;
		}
		catch (IllegalArgumentException e) {
			err.println("Error: " + e.getMessage());
			return EXIT_ERROR;
		}
	}

	private static void applyTo(ParsedConfiguration config, ResolverProperties properties) {
		if (config.timeoutSeconds != null) {
			properties.setResolutionTimeout(Duration.ofSeconds(config.timeoutSeconds));
		}
		if (config.allowStale) {
			properties.setAllowStaleOnFailure(true);
		}
		if (config.cacheFile != null) {
			properties.setCacheFile(config.cacheFile);
		}
	}

	private void logConfiguration(ParsedConfiguration config) {
		if (!config.verbose) {
			return;
		}
		logger.info("Project: {}", config.project);
		logger.info("Provider: {}", config.provider != null ? config.provider : "auto");
		logger.info("Include prereleases: {}", config.includePrereleases);
		if (config.major != null) {
			logger.info("Major: {}", config.major);
		}
		if (config.only != null) {
			logger.info("Only: {}", config.only);
		}
		if (config.exclude != null) {
			logger.info("Exclude: {}", config.exclude);
		}
		if (config.havingAsset != null) {
			logger.info("Having asset: {}", config.havingAsset);
		}
		logger.info("Even minor only: {}, formal only: {}", config.even, config.formal);
		logger.info("Format: {}", config.format);
		if (config.cacheFile != null) {
			logger.info("Cache file: {}", config.cacheFile);
		}
	}

}
