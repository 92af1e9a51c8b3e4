package org.springaicommunity.release.resolver.cli;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.springaicommunity.release.resolver.ReleaseAsset;
import org.springaicommunity.release.resolver.ReleaseRecord;
import org.springaicommunity.release.resolver.Resolution;
import org.springaicommunity.release.resolver.ResolutionException;
import org.springaicommunity.release.resolver.TextFilter;

/**
 * Renders a resolution in one of the output formats accepted by {@code --format}.
 */
public class ReleaseFormatter {

	private final ObjectMapper objectMapper;

	public ReleaseFormatter(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * Render the resolution.
	 * @param resolution resolved project and release
	 * @param format one of version, tag, json, assets, source
	 * @param assetFilter limits the listed assets, null lists all of them
	 * @return text to print
	 * @throws ResolutionException for {@code source} when no source archive is known
	 */
	public String format(Resolution resolution, String format, @Nullable TextFilter assetFilter) {
		ReleaseRecord release = resolution.release();
		switch (format) {
			case "tag":
				return release.tag();
			case "json":
				return toJson(resolution);
			case "source":
				if (resolution.sourceUrl() == null) {
					throw new ResolutionException("No source archive known for " + resolution.project() + " "
							+ release.tag());
				}
				return resolution.sourceUrl();
			case "assets":
				return assets(release, assetFilter).stream()
					.map(ReleaseAsset::downloadUrl)
					.collect(Collectors.joining(System.lineSeparator()));
			default:
				return release.version().toString();
		}
	}

	private String toJson(Resolution resolution) {
		ReleaseRecord release = resolution.release();
		ObjectNode root = objectMapper.createObjectNode();
		root.put("project", resolution.project().canonical());
		root.put("provider", resolution.project().provider());
		if (resolution.project().webUrl() != null) {
			root.put("web_url", resolution.project().webUrl());
		}
		root.put("from", resolution.project().webUrl() != null ? resolution.project().webUrl()
				: resolution.project().canonical());
		root.put("tag", release.tag());
		root.put("version", release.version().toString());
		root.put("version_kind", release.version().kind().name().toLowerCase(Locale.ROOT));
		if (release.publishedAt() != null) {
			root.put("published_at", release.publishedAt().toString());
		}
		root.put("prerelease", release.prerelease());
		root.put("prerelease_source", release.prereleaseSource().name().toLowerCase(Locale.ROOT));
		root.put("formal", release.formal());
		root.put("v_prefix", release.hasVPrefix());
		root.put("candidates", resolution.candidates());
		if (resolution.sourceUrl() != null) {
			root.put("source_url", resolution.sourceUrl());
		}
		ArrayNode assets = root.putArray("assets");
		for (ReleaseAsset asset : release.assets()) {
			assets.addObject().put("name", asset.name()).put("url", asset.downloadUrl());
		}
		try {
			return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
		}
		catch (JsonProcessingException e) {
			throw new ResolutionException("Failed to render " + release.tag() + " as JSON", e);
		}
	}

	private static List<ReleaseAsset> assets(ReleaseRecord release, @Nullable TextFilter assetFilter) {
		if (assetFilter == null) {
			return release.assets();
		}
		return release.assets().stream().filter(asset -> assetFilter.matches(asset.name())).toList();
	}

}
