package org.springaicommunity.release.resolver;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;

/**
 * Versions of a package on the Python Package Index, read from its JSON API.
 *
 * <p>
 * The index has no prerelease flag, so prereleases are inferred from the version.
 * Versions whose files were all yanked are reported as drafts and are never selected.
 */
public class PyPiReleaseProvider implements ReleaseProvider {

	public static final String ID = "pypi";

	private static final Pattern URL = Pattern
		.compile("^https?://(?:pypi\\.org/project|pypi\\.python\\.org/pypi)/([A-Za-z0-9._-]+)/?.*$");

	private static final Pattern PACKAGE_NAME = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]*$");

	private static final Pattern NAME_SEPARATORS = Pattern.compile("[-_.]+");

	private static final ProviderCapabilities CAPABILITIES = new ProviderCapabilities(false, true, true, true, true);

	private static final RateBudget RATE_BUDGET = RateBudget.perMinute(120, Duration.ZERO);

	private final ProviderHttp http;

	private final VersionParser parser;

	private final String baseUrl;

	public PyPiReleaseProvider(ProviderHttp http, VersionParser parser, ResolverProperties properties) {
		this.http = http;
		this.parser = parser;
		String url = properties.getPypiUrl();
		this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
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
		return RATE_BUDGET;
	}

	@Override
	public boolean claims(String input) {
		return URL.matcher(input.trim()).matches();
	}

	@Override
	public boolean acceptsBareName(String name) {
		return PACKAGE_NAME.matcher(name).matches();
	}

	@Override
	public ProjectIdentifier resolveIdentifier(String input) {
		String name = packageName(input.trim());
		if (name == null) {
			throw new NotFoundException(input, "Not a PyPI package name: " + input);
		}
		JsonNode document = fetchDocument(input, name);
		String canonical = JsonNodeUtils.getString(document, "info", "name").orElse(name);
		String webUrl = JsonNodeUtils.getString(document, "info", "package_url")
			.orElse(baseUrl + "/project/" + canonical + "/");
		return new ProjectIdentifier(ID, canonical, webUrl);
	}

	@Override
	public List<JsonNode> listReleases(ProjectIdentifier project) {
		JsonNode document = fetchDocument(project.canonical(), project.canonical());
		List<JsonNode> items = new ArrayList<>();
		Iterator<Map.Entry<String, JsonNode>> releases = document.path("releases").fields();
		while (releases.hasNext()) {
			Map.Entry<String, JsonNode> release = releases.next();
			ObjectNode item = http.objectMapper().createObjectNode();
			item.put("version", release.getKey());
			item.set("files", release.getValue());
			items.add(item);
		}
		return items;
	}

	@Override
	public ReleaseRecord toReleaseRecord(JsonNode item) {
		String version = JsonNodeUtils.getString(item, "version")
			.orElseThrow(() -> new PermanentProviderException("PyPI release without version", -1));

		List<JsonNode> files = JsonNodeUtils.getArray(item, "files");
		List<ReleaseAsset> assets = new ArrayList<>();
		Instant publishedAt = null;
		boolean allYanked = !files.isEmpty();
		for (JsonNode file : files) {
			String filename = JsonNodeUtils.getString(file, "filename").orElse(null);
			String url = JsonNodeUtils.getString(file, "url").orElse(null);
			if (filename != null && url != null) {
				assets.add(new ReleaseAsset(filename, url));
			}
			Instant uploaded = JsonNodeUtils.getInstant(file, "upload_time_iso_8601")
				.or(() -> JsonNodeUtils.getInstant(file, "upload_time"))
				.orElse(null);
			if (uploaded != null && (publishedAt == null || uploaded.isBefore(publishedAt))) {
				publishedAt = uploaded;
			}
			allYanked &= file.path("yanked").asBoolean(false);
		}

		return ReleaseRecord.create(version, parser.parse(version), publishedAt, null, allYanked, true, assets);
	}

	private JsonNode fetchDocument(String input, String name) {
		String normalized = normalize(name);
		try {
			return http.getJson(new CacheKey(ID, normalized, "json"), RATE_BUDGET,
					baseUrl + "/pypi/" + normalized + "/json", Map.of("Accept", "application/json"));
		}
		catch (PermanentProviderException e) {
			if (e.isNotFound()) {
				throw new NotFoundException(input, "No PyPI package " + name, e);
			}
			throw e;
		}
	}

	@Nullable
	private static String packageName(String input) {
		Matcher url = URL.matcher(input);
		if (url.matches()) {
			return url.group(1);
		}
		return PACKAGE_NAME.matcher(input).matches() ? input : null;
	}

	/**
	 * Normalized package name: lower case, runs of {@code -_.} collapsed to {@code -}.
	 */
	static String normalize(String name) {
		return NAME_SEPARATORS.matcher(name.toLowerCase(Locale.ROOT)).replaceAll("-");
	}

}
