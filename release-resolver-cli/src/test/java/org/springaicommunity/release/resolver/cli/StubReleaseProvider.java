package org.springaicommunity.release.resolver.cli;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springaicommunity.release.resolver.AmbiguousIdentifierException;
import org.springaicommunity.release.resolver.NotFoundException;
import org.springaicommunity.release.resolver.ObjectMapperFactory;
import org.springaicommunity.release.resolver.ProjectIdentifier;
import org.springaicommunity.release.resolver.ProviderCapabilities;
import org.springaicommunity.release.resolver.RateBudget;
import org.springaicommunity.release.resolver.ReleaseAsset;
import org.springaicommunity.release.resolver.ReleaseProvider;
import org.springaicommunity.release.resolver.ReleaseRecord;
import org.springaicommunity.release.resolver.TransientProviderException;
import org.springaicommunity.release.resolver.Version;

/**
 * Provider serving a fixed catalogue, so CLI runs never touch the network. Every tag gets
 * a {@code .tar.gz} and a {@code .zip} asset.
 */
class StubReleaseProvider implements ReleaseProvider {

	private final ObjectMapper objectMapper = ObjectMapperFactory.create();

	private final Map<String, List<String>> catalogue;

	StubReleaseProvider(Map<String, List<String>> catalogue) {
		this.catalogue = catalogue;
	}

	@Override
	public String id() {
		return "stub";
	}

	@Override
	public ProviderCapabilities capabilities() {
		return new ProviderCapabilities(false, false, true, true, true);
	}

	@Override
	public RateBudget rateBudget() {
		return RateBudget.perMinute(1000, Duration.ZERO);
	}

	@Override
	public boolean claims(String input) {
		return false;
	}

	@Override
	public ProjectIdentifier resolveIdentifier(String input) {
		if (input.equals("flaky/tool")) {
			throw new TransientProviderException("Service unavailable", 503, null);
		}
		if (input.equals("tool")) {
			throw new AmbiguousIdentifierException(input, List.of("acme/tool", "other/tool"));
		}
		if (!catalogue.containsKey(input)) {
			throw new NotFoundException(input, "Project '" + input + "' not found");
		}
		return new ProjectIdentifier(id(), input, "https://stub.example/" + input);
	}

	@Override
	public List<JsonNode> listReleases(ProjectIdentifier project) {
		List<JsonNode> items = new ArrayList<>();
		for (String tag : catalogue.get(project.canonical())) {
			items.add(objectMapper.createObjectNode().put("tag", tag));
		}
		return items;
	}

	@Override
	public ReleaseRecord toReleaseRecord(JsonNode item) {
		String tag = item.path("tag").asText();
		String base = "https://stub.example/download/" + tag;
		return ReleaseRecord.create(tag, Version.parse(tag), Instant.parse("2024-03-01T12:00:00Z"), null, false,
				true, List.of(new ReleaseAsset("tool-" + tag + "-linux.tar.gz", base + "/tool-linux.tar.gz"),
						new ReleaseAsset("tool-" + tag + "-windows.zip", base + "/tool-windows.zip")));
	}

}
