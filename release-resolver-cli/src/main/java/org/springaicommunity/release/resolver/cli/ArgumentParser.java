package org.springaicommunity.release.resolver.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springaicommunity.release.resolver.ResolverProperties;
import org.springaicommunity.release.resolver.Version;

/**
 * Command-line argument parser for the release resolver. Pure Java implementation with
 * no Spring dependencies for maximum testability.
 */
public class ArgumentParser {

	static final List<String> FORMATS = List.of("version", "tag", "json", "assets", "source");

	private final ResolverProperties defaultProperties;

	public ArgumentParser(ResolverProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "--pre":
					config.includePrereleases = true;
					break;

				case "--major":
					config.major = getRequiredValue(args, i, "major");
					i++;
					break;

				case "--only":
					config.only = getRequiredValue(args, i, "only");
					i++;
					break;

				case "--exclude":
					config.exclude = getRequiredValue(args, i, "exclude");
					i++;
					break;

				case "--having-asset":
					config.havingAsset = getRequiredValue(args, i, "having-asset");
					i++;
					break;

				case "--at":
					config.provider = getRequiredValue(args, i, "at").toLowerCase(Locale.ROOT);
					i++;
					break;

				case "--even":
					config.even = true;
					break;

				case "--formal":
					config.formal = true;
					break;

				case "--format":
					String format = getRequiredValue(args, i, "format").toLowerCase(Locale.ROOT);
					if (!FORMATS.contains(format)) {
						throw new IllegalArgumentException(
								"Invalid format '" + format + "': must be one of " + String.join(", ", FORMATS));
					}
					config.format = format;
					i++;
					break;

				case "--newer-than":
					String current = getRequiredValue(args, i, "newer-than");
					config.newerThan = Version.parseUserVersion(current)
						.orElseThrow(() -> new IllegalArgumentException("Invalid version '" + current + "'"));
					i++;
					break;

				case "--timeout":
					String timeoutStr = getRequiredValue(args, i, "timeout");
					try {
						config.timeoutSeconds = Integer.parseInt(timeoutStr);
						if (config.timeoutSeconds <= 0) {
							throw new IllegalArgumentException("Timeout must be positive: " + config.timeoutSeconds);
						}
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid timeout '" + timeoutStr + "': must be a positive number of seconds");
					}
					i++;
					break;

				case "--allow-stale":
					config.allowStale = true;
					break;

				case "--cache-file":
					config.cacheFile = getRequiredValue(args, i, "cache-file");
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					if (config.project != null) {
						throw new IllegalArgumentException(
								"Only one project may be given, got '" + config.project + "' and '" + arg + "'");
					}
					config.project = arg;
					break;
			}
		}

		// Validate configuration
		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Check if verbose output is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if verbose output is requested
	 */
	public static boolean isVerboseRequested(String[] args) {
		for (String arg : args) {
			if ("-v".equals(arg) || "--verbose".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: release-resolver <PROJECT> [OPTIONS]\n");
		help.append("\n");
		help.append("Find the latest release of a project on GitHub, PyPI, a git remote, Wikipedia or a download page.\n");
		help.append("\n");
		help.append("PROJECT:\n");
		help.append("    owner/repo, a GitHub, PyPI, Wikipedia or git URL, a local git clone,\n");
		help.append("    a download page URL, or a bare name (ubuntu, requests, ...)\n");
		help.append("\n");
		help.append("SELECTION OPTIONS:\n");
		help.append("    --pre                   Include prereleases\n");
		help.append("    --major VERSION         Only versions starting with VERSION, e.g. 2 or 2.7\n");
		help.append("    --only FILTER           Only versions matching a constraint (>=1.2,<2) or tags matching FILTER\n");
		help.append("    --exclude FILTER        Skip tags matching FILTER\n");
		help.append("    --having-asset NAME     Only releases with an asset named NAME (~regex, * for any asset)\n");
		help.append("    --even                  Only versions with an even minor number\n");
		help.append("    --formal                Only formal releases, no bare tags\n");
		help.append("    --at PROVIDER           Use PROVIDER: wikipedia, github, pypi, git, html\n");
		help.append("\n");
		help.append("    FILTER is a substring, ~regex, or either prefixed with ! to negate\n");
		help.append("\n");
		help.append("OUTPUT OPTIONS:\n");
		help.append("    --format FORMAT         Output: version, tag, json, assets, source\n");
		help.append("    --newer-than VERSION    Exit with 2 unless the latest release is newer than VERSION\n");
		help.append("\n");
		help.append("ENGINE OPTIONS:\n");
		help.append("    --timeout SECONDS       Give up after SECONDS (default: ")
			.append(defaultProperties.getResolutionTimeout().toSeconds())
			.append(")\n");
		help.append("    --cache-file PATH       Keep provider responses in PATH between runs\n");
		help.append("    --allow-stale           Use expired cached responses when a provider keeps failing\n");
		help.append("    -v, --verbose           Enable verbose logging\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("\n");
		help.append("EXIT CODES:\n");
		help.append("    0  success\n");
		help.append("    1  error\n");
		help.append("    2  no release newer than --newer-than\n");
		help.append("    3  project not found or no release matches\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITHUB_TOKEN           GitHub personal access token (optional, raises the rate limit)\n");
		help.append("    GITHUB_API_TOKEN       Alternative name for GITHUB_TOKEN\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    release-resolver spring-projects/spring-ai\n");
		help.append("    release-resolver nginx/nginx --even --format tag\n");
		help.append("    release-resolver requests --at pypi --major 2\n");
		help.append("    release-resolver gohugoio/hugo --having-asset \"~linux-amd64\\.tar\\.gz$\" --format assets\n");
		help.append("    release-resolver ubuntu --format json\n");
		help.append("    release-resolver mautic/mautic --newer-than 5.0.0 && echo update available\n");
		help.append("\n");
		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.project == null || config.project.trim().isEmpty()) {
			errors.add("Project cannot be empty");
		}

		try {
			config.toPolicy();
		}
		catch (IllegalArgumentException e) {
			errors.add(e.getMessage());
		}

		if (!errors.isEmpty()) {
			throw new IllegalArgumentException("Configuration errors: " + String.join(", ", errors));
		}
	}

}
