package org.springaicommunity.release.resolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Latest releases of well-known products (operating systems mostly) that publish no
 * machine-readable release feed, read from the infobox of their Wikipedia article.
 *
 * <p>
 * The "Stable release" / "Latest release" row and, when present, the "Preview release"
 * row each yield one release.
 */
public class WikipediaReleaseProvider implements ReleaseProvider {

	private static final Logger logger = LoggerFactory.getLogger(WikipediaReleaseProvider.class);

	public static final String ID = "wikipedia";

	static final Map<String, String> KNOWN_ARTICLES = Map.of("rocky", "Rocky_Linux", "fedora",
			"Fedora_(operating_system)", "rhel", "Red_Hat_Enterprise_Linux", "redhat", "Red_Hat_Enterprise_Linux",
			"almalinux", "AlmaLinux", "ios", "IOS", "ubuntu", "Ubuntu", "debian", "Debian", "android",
			"Android_(operating_system)", "windows", "Microsoft_Windows");

	private static final Pattern ARTICLE_URL = Pattern
		.compile("^(https?://[a-z-]+\\.(?:m\\.)?wikipedia\\.org)/wiki/([^?#]+).*$");

	private static final Pattern RELEASE_ROW = Pattern.compile(
			"<th[^>]*>((?:(?!</th>).)*?(?:latest|stable|preview) release(?:(?!</th>).)*?)</th>\\s*"
					+ "<td[^>]*class=\"[^\"]*infobox-data[^\"]*\"[^>]*>((?:(?!</td>).)*)</td>",
			Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

	private static final Pattern PUBLISHED = Pattern.compile("class=\"[^\"]*\\bpublished\\b[^\"]*\"[^>]*>([^<]+)<");

	private static final Pattern SUP = Pattern.compile("<sup[^>]*>.*?</sup>", Pattern.DOTALL);

	private static final Pattern INNER_SPAN = Pattern.compile("<span[^>]*>[^<]*</span>");

	private static final Pattern TAG = Pattern.compile("<[^>]+>");

	private static final Set<String> DEVELOPMENT_WORDS = Set.of("dev", "devel", "test");

	private static final Pattern POST_NUMBER = Pattern.compile("^p(\\d+)$");

	private static final ProviderCapabilities CAPABILITIES = new ProviderCapabilities(false, false, false, true,
			true);

	private final ProviderHttp http;

	private final VersionParser parser;

	private final String baseUrl;

	private final RateBudget rateBudget;

	public WikipediaReleaseProvider(ProviderHttp http, VersionParser parser, ResolverProperties properties) {
		this.http = http;
		this.parser = parser;
		String url = properties.getWikipediaUrl();
		this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
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
		return ARTICLE_URL.matcher(input.trim()).matches();
	}

	@Override
	public boolean acceptsBareName(String name) {
		return KNOWN_ARTICLES.containsKey(name.toLowerCase(Locale.ROOT));
	}

	@Override
	public ProjectIdentifier resolveIdentifier(String input) {
		String trimmed = input.trim();
		String site = baseUrl;
		String article;
		Matcher url = ARTICLE_URL.matcher(trimmed);
		if (url.matches()) {
			site = url.group(1);
			article = url.group(2);
		}
		else {
			article = KNOWN_ARTICLES.get(trimmed.toLowerCase(Locale.ROOT));
			if (article == null) {
				throw new NotFoundException(trimmed, "No known Wikipedia article for " + trimmed);
			}
		}
		ProjectIdentifier project = new ProjectIdentifier(ID, article, site + "/wiki/" + article);
		fetchArticle(trimmed, project);
		return project;
	}

	@Override
	public List<JsonNode> listReleases(ProjectIdentifier project) {
		String html = fetchArticle(project.canonical(), project);
		List<JsonNode> items = new ArrayList<>();
		Matcher row = RELEASE_ROW.matcher(html);
		while (row.find()) {
			boolean preview = row.group(1).toLowerCase(Locale.ROOT).contains("preview");
			String data = row.group(2);
			Matcher published = PUBLISHED.matcher(data);
			String date = published.find() ? published.group(1).trim() : null;
			String version = versionText(data);
			if (version.isEmpty()) {
				logger.debug("No version in infobox row of {}: {}", project, data);
				continue;
			}
			ObjectNode item = http.objectMapper().createObjectNode();
			item.put("version", version);
			item.put("preview", preview);
			if (date != null) {
				item.put("published", date);
			}
			items.add(item);
		}
		logger.debug("{}: {} releases in infobox", project, items.size());
		return items;
	}

	@Override
	public ReleaseRecord toReleaseRecord(JsonNode item) {
		String version = JsonNodeUtils.getString(item, "version")
			.orElseThrow(() -> new PermanentProviderException("Infobox release without version", -1));
		boolean preview = item.path("preview").asBoolean(false);
		return ReleaseRecord.create(version, parser.parse(version),
				JsonNodeUtils.getInstant(item, "published").orElse(null), preview ? Boolean.TRUE : null, false, true,
				List.of());
	}

	private String fetchArticle(String input, ProjectIdentifier project) {
		String url = project.webUrl() != null ? project.webUrl() : baseUrl + "/wiki/" + project.canonical();
		try {
			return http.getText(new CacheKey(ID, project.canonical(), "article"), rateBudget, url,
					Map.of("Accept", "text/html"));
		}
		catch (PermanentProviderException e) {
			if (e.isNotFound()) {
				throw new NotFoundException(input, "No Wikipedia article " + project.canonical(), e);
			}
			throw e;
		}
	}

	/**
	 * Version text of an infobox cell such as {@code 9.4[1] / 2 May 2024}: references and
	 * hidden spans removed, the part before {@code /}, purely alphabetic words dropped and
	 * the rest joined with {@code -}.
	 */
	static String versionText(String cellHtml) {
		String text = SUP.matcher(cellHtml).replaceAll("");
		String previous;
		do {
			previous = text;
			text = INNER_SPAN.matcher(text).replaceAll("");
		}
		while (!text.equals(previous));
		text = TAG.matcher(text).replaceAll(" ")
			.replace("&#160;", " ")
			.replace("&nbsp;", " ")
			.replace("&amp;", "&");
		int slash = text.indexOf('/');
		if (slash >= 0) {
			text = text.substring(0, slash);
		}
		List<String> words = new ArrayList<>();
		for (String word : text.trim().split("\\s+")) {
			if (DEVELOPMENT_WORDS.contains(word.toLowerCase(Locale.ROOT))) {
				words.add("dev0");
				continue;
			}
			if (word.isEmpty() || word.chars().allMatch(Character::isLetter)) {
				continue;
			}
			Matcher post = POST_NUMBER.matcher(word);
			words.add(post.matches() ? "post" + post.group(1) : word);
		}
		return String.join("-", words);
	}

}
