package org.springaicommunity.release.resolver;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback for any other web page: releases are derived from the archive links on the
 * page, e.g. {@code nginx-1.25.3.tar.gz} and {@code nginx-1.25.3.zip} form release
 * {@code 1.25.3} with two assets.
 */
public class HtmlPageReleaseProvider implements ReleaseProvider {

	private static final Logger logger = LoggerFactory.getLogger(HtmlPageReleaseProvider.class);

	public static final String ID = "html";

	private static final Pattern WEB_URL = Pattern.compile("^https?://[^\\s/]+.*$", Pattern.CASE_INSENSITIVE);

	private static final Pattern HREF = Pattern.compile("href\\s*=\\s*[\"']([^\"'#]+)[\"']", Pattern.CASE_INSENSITIVE);

	private static final Pattern ARCHIVE = Pattern.compile(
			"^(.+?)\\.(tar\\.gz|tgz|tar\\.xz|txz|tar\\.bz2|tbz2?|tar\\.zst|zip|7z|exe|msi|dmg|pkg|deb|rpm|jar|whl|appimage)$",
			Pattern.CASE_INSENSITIVE);

	private static final ProviderCapabilities CAPABILITIES = new ProviderCapabilities(false, false, true, false,
			false);

	private final ProviderHttp http;

	private final VersionParser parser;

	private final RateBudget rateBudget;

	public HtmlPageReleaseProvider(ProviderHttp http, VersionParser parser, ResolverProperties properties) {
		this.http = http;
		this.parser = parser;
		this.rateBudget = RateBudget.perMinute(properties.getScrapeRequestsPerMinute(),
				properties.getScrapeMinSpacing());
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
		return WEB_URL.matcher(input.trim()).matches();
	}

	@Override
	public ProjectIdentifier resolveIdentifier(String input) {
		String url = input.trim();
		if (!claims(url)) {
			throw new NotFoundException(url, "Not a web page URL: " + url);
		}
		ProjectIdentifier project = new ProjectIdentifier(ID, url, url);
		fetchPage(project);
		return project;
	}

	@Override
	public List<JsonNode> listReleases(ProjectIdentifier project) {
		String html = fetchPage(project);
		URI base = URI.create(project.canonical());

		Map<Version, ObjectNode> byVersion = new LinkedHashMap<>();
		Matcher href = HREF.matcher(html);
		while (href.find()) {
			String link = href.group(1).trim();
			String fileName = fileName(link);
			Matcher archive = ARCHIVE.matcher(fileName);
			if (!archive.matches()) {
				continue;
			}
			String stem = archive.group(1);
			Version version = parser.parse(stem);
			if (!version.isParseable()) {
				continue;
			}
			String absolute = resolve(base, link);
			if (absolute == null) {
				continue;
			}
			ObjectNode item = byVersion.computeIfAbsent(version, v -> {
				ObjectNode node = http.objectMapper().createObjectNode();
				node.put("tag", stem);
				node.putArray("assets");
				return node;
			});
			if (stem.length() < item.path("tag").asText().length()) {
				item.put("tag", stem);
			}
			((ArrayNode) item.get("assets")).addObject()
				.put("name", fileName)
				.put("url", absolute);
		}
		logger.debug("{}: {} versions among archive links", project, byVersion.size());
		return new ArrayList<>(byVersion.values());
	}

	@Override
	public ReleaseRecord toReleaseRecord(JsonNode item) {
		String tag = JsonNodeUtils.getString(item, "tag")
			.orElseThrow(() -> new PermanentProviderException("Download link item without tag", -1));
		List<ReleaseAsset> assets = new ArrayList<>();
		for (JsonNode asset : JsonNodeUtils.getArray(item, "assets")) {
			assets.add(new ReleaseAsset(asset.path("name").asText(), asset.path("url").asText()));
		}
		return ReleaseRecord.create(tag, parser.parse(tag), null, null, false, false, assets);
	}

	private String fetchPage(ProjectIdentifier project) {
		try {
			return http.getText(new CacheKey(ID, project.canonical(), "page"), rateBudget, project.canonical(),
					Map.of("Accept", "text/html"));
		}
		catch (PermanentProviderException e) {
			if (e.isNotFound()) {
				throw new NotFoundException(project.canonical(), "No page at " + project.canonical(), e);
			}
			throw e;
		}
	}

	private static String fileName(String link) {
		String path = link;
		int query = path.indexOf('?');
		if (query >= 0) {
			path = path.substring(0, query);
		}
		int slash = path.lastIndexOf('/');
		return slash >= 0 ? path.substring(slash + 1) : path;
	}

	@Nullable
	private static String resolve(URI base, String link) {
		try {
			return base.resolve(new URI(link.replace(" ", "%20"))).toString();
		}
		catch (URISyntaxException | IllegalArgumentException e) {
			logger.debug("Skipping malformed link {}: {}", link, e.getMessage());
			return null;
		}
	}

}
