package org.springaicommunity.release.resolver;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Releases and tags of a GitHub repository, read through the REST API.
 *
 * <p>
 * Accepts {@code owner/repo}, {@code https://github.com/owner/repo/...},
 * {@code git@github.com:owner/repo.git} and, through repository search, bare repository
 * names. Release pages are merged with the repository's tags, so tags that never got a
 * release object still take part in selection (as non-formal records).
 */
public class GitHubReleaseProvider implements ReleaseProvider {

	private static final Logger logger = LoggerFactory.getLogger(GitHubReleaseProvider.class);

	public static final String ID = "github";

	private static final int PAGE_SIZE = 100;

	private static final int UNAUTHENTICATED_REQUESTS_PER_HOUR = 60;

	private static final Pattern URL = Pattern
		.compile("^(?:https?://)?(?:www\\.)?github\\.com/([A-Za-z0-9_.-]+)/([A-Za-z0-9_.-]+?)(?:\\.git)?(?:[/#?].*)?$");

	private static final Pattern SSH = Pattern.compile("^git@github\\.com:([A-Za-z0-9_.-]+)/([A-Za-z0-9_.-]+?)(?:\\.git)?$");

	private static final Pattern OWNER_REPO = Pattern.compile("^([A-Za-z0-9_-][A-Za-z0-9_.-]*)/([A-Za-z0-9_.-]+)$");

	private static final Pattern BARE_NAME = Pattern.compile("^[A-Za-z0-9_.-]+$");

	private static final ProviderCapabilities CAPABILITIES = new ProviderCapabilities(true, true, true, true, true);

	private final ProviderHttp http;

	private final VersionParser parser;

	private final String apiUrl;

	private final int maxPages;

	@Nullable
	private final String token;

	private final RateBudget rateBudget;

	public GitHubReleaseProvider(ProviderHttp http, VersionParser parser, ResolverProperties properties,
			@Nullable String token) {
		this.http = http;
		this.parser = parser;
		this.apiUrl = stripTrailingSlash(properties.getGithubApiUrl());
		this.maxPages = Math.max(1, properties.getGithubMaxPages());
		this.token = token;
		int perHour = token != null ? properties.getGithubRequestsPerHour() : UNAUTHENTICATED_REQUESTS_PER_HOUR;
		this.rateBudget = RateBudget.perHour(perHour, properties.getGithubMinSpacing());
	}

	@Override
	public String id() {
		return ID;
	}

	@Override
	public ProviderCapabilities capabilities() {
		return CAPABILITIES;
	}

	@Override
	public RateBudget rateBudget() {
		return rateBudget;
	}

	@Override
	public boolean claims(String input) {
		return parseRepository(input.trim()) != null;
	}

	@Override
	public ProjectIdentifier resolveIdentifier(String input) {
		String trimmed = input.trim();
		String fullName = parseRepository(trimmed);
		if (fullName == null) {
			if (!BARE_NAME.matcher(trimmed).matches()) {
				throw new NotFoundException(trimmed, "Not a GitHub repository reference: " + trimmed);
			}
			fullName = searchByName(trimmed);
		}

		JsonNode repository;
		try {
			repository = http.getJson(key(fullName, "repository"), rateBudget, apiUrl + "/repos/" + fullName,
					headers());
		}
		catch (PermanentProviderException e) {
			if (e.isNotFound()) {
				throw new NotFoundException(trimmed, "No GitHub repository " + fullName, e);
			}
			throw e;
		}

		String canonical = JsonNodeUtils.getString(repository, "full_name").orElse(fullName);
		if (!canonical.equalsIgnoreCase(fullName)) {
			logger.info("GitHub repository {} is now {}", fullName, canonical);
		}
		String webUrl = JsonNodeUtils.getString(repository, "html_url").orElse("https://github.com/" + canonical);
		return new ProjectIdentifier(ID, canonical, webUrl);
	}

	@Override
	public List<JsonNode> listReleases(ProjectIdentifier project) {
		String base = apiUrl + "/repos/" + project.canonical();
		List<JsonNode> items = new ArrayList<>();
		Set<String> releaseTags = new HashSet<>();

		for (int page = 1; page <= maxPages; page++) {
			JsonNode releases = http.getJson(key(project.canonical(), "releases?page=" + page), rateBudget,
					base + "/releases?per_page=" + PAGE_SIZE + "&page=" + page, headers());
			int count = 0;
			for (JsonNode release : releases) {
				count++;
				items.add(withAssets(project, release));
				JsonNodeUtils.getString(release, "tag_name").ifPresent(releaseTags::add);
			}
			if (count < PAGE_SIZE) {
				break;
			}
		}

		int tagOnly = 0;
		for (int page = 1; page <= maxPages; page++) {
			JsonNode tags = http.getJson(key(project.canonical(), "tags?page=" + page), rateBudget,
					base + "/tags?per_page=" + PAGE_SIZE + "&page=" + page, headers());
			int count = 0;
			for (JsonNode tag : tags) {
				count++;
				String name = JsonNodeUtils.getString(tag, "name").orElse(null);
				if (name != null && releaseTags.add(name)) {
					ObjectNode item = http.objectMapper().createObjectNode();
					item.put("tag_name", name);
					item.put("tag_only", true);
					items.add(item);
					tagOnly++;
				}
			}
			if (count < PAGE_SIZE) {
				break;
			}
		}

		logger.debug("{}: {} releases, {} tags without release", project, items.size() - tagOnly, tagOnly);
		return items;
	}

	@Override
	public ReleaseRecord toReleaseRecord(JsonNode item) {
		String tag = JsonNodeUtils.getString(item, "tag_name")
			.orElseThrow(() -> new PermanentProviderException("GitHub release without tag_name", -1));
		boolean tagOnly = item.path("tag_only").asBoolean(false);

		List<ReleaseAsset> assets = new ArrayList<>();
		for (JsonNode asset : JsonNodeUtils.getArray(item, "assets")) {
			String name = JsonNodeUtils.getString(asset, "name").orElse(null);
			String url = JsonNodeUtils.getString(asset, "browser_download_url").orElse(null);
			if (name != null && url != null) {
				assets.add(new ReleaseAsset(name, url));
			}
		}

		return ReleaseRecord.create(tag, parser.parse(tag),
				JsonNodeUtils.getInstant(item, "published_at")
					.or(() -> JsonNodeUtils.getInstant(item, "created_at"))
					.orElse(null),
				tagOnly ? null : JsonNodeUtils.getBoolean(item, "prerelease").orElse(null),
				JsonNodeUtils.getBoolean(item, "draft").orElse(false), !tagOnly, assets);
	}

	/**
	 * GitHub serves a source tarball for every tag.
	 */
	@Override
	public String sourceUrl(ProjectIdentifier project, ReleaseRecord release) {
		String webUrl = project.webUrl() != null ? stripTrailingSlash(project.webUrl())
				: "https://github.com/" + project.canonical();
		return webUrl + "/archive/refs/tags/" + URLEncoder.encode(release.tag(), StandardCharsets.UTF_8) + ".tar.gz";
	}

	private String searchByName(String name) {
		String query = URLEncoder.encode(name + " in:name", StandardCharsets.UTF_8);
		JsonNode result = http.getJson(key(name, "search"), rateBudget,
				apiUrl + "/search/repositories?q=" + query + "&per_page=20", headers());

		List<String> matches = new ArrayList<>();
		for (JsonNode item : JsonNodeUtils.getArray(result, "items")) {
			if (name.equalsIgnoreCase(JsonNodeUtils.getString(item, "name").orElse(""))) {
				JsonNodeUtils.getString(item, "full_name").ifPresent(matches::add);
			}
		}
		if (matches.isEmpty()) {
			throw new NotFoundException(name, "No GitHub repository named " + name);
		}
		if (matches.size() == 1) {
			return matches.get(0);
		}
		for (String match : matches) {
			if (match.equalsIgnoreCase(name + "/" + name)) {
				return match;
			}
		}
		throw new AmbiguousIdentifierException(name, matches);
	}

	/**
	 * Fill in the asset list of a release that came without one. A failure leaves the
	 * release without assets.
	 */
	private JsonNode withAssets(ProjectIdentifier project, JsonNode release) {
		if (release.path("assets").isArray() || !(release instanceof ObjectNode object)) {
			return release;
		}
		String assetsUrl = JsonNodeUtils.getString(release, "assets_url").orElse(null);
		ObjectNode copy = object.deepCopy();
		if (assetsUrl == null) {
			copy.putArray("assets");
			return copy;
		}
		String releaseId = JsonNodeUtils.getString(release, "id").orElse(assetsUrl);
		try {
			JsonNode assets = http.getJson(key(project.canonical(), "assets/" + releaseId), rateBudget, assetsUrl,
					headers());
			copy.set("assets", assets.isArray() ? assets : http.objectMapper().createArrayNode());
		}
		catch (ResolutionException e) {
			logger.warn("Could not fetch assets of {} {}, treating it as having none: {}", project,
					JsonNodeUtils.getString(release, "tag_name").orElse("?"), e.getMessage());
			copy.putArray("assets");
		}
		return copy;
	}

	private Map<String, String> headers() {
		Map<String, String> headers = new LinkedHashMap<>();
		headers.put("Accept", "application/vnd.github+json");
		headers.put("X-GitHub-Api-Version", "2022-11-28");
		if (token != null) {
			headers.put("Authorization", "Bearer " + token);
		}
		return headers;
	}

	private static CacheKey key(String project, String query) {
		return new CacheKey(ID, project.toLowerCase(Locale.ROOT), query);
	}

	@Nullable
	static String parseRepository(String input) {
		for (Pattern pattern : List.of(URL, SSH, OWNER_REPO)) {
			Matcher matcher = pattern.matcher(input);
			if (matcher.matches()) {
				return matcher.group(1) + "/" + matcher.group(2);
			}
		}
		return null;
	}

	private static String stripTrailingSlash(String url) {
		return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
	}

}
