package org.springaicommunity.release.resolver;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.api.errors.InvalidRemoteException;
import org.eclipse.jgit.api.errors.TransportException;
import org.eclipse.jgit.lib.Ref;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tags of any git repository, listed with {@code git ls-remote --tags} semantics through
 * JGit. Works for remote URLs and local clones; no clone is made.
 *
 * <p>
 * Plain tags carry no flags, dates or files: every record is non-formal and its
 * prerelease flag is inferred from the tag.
 */
public class GitTagsReleaseProvider implements ReleaseProvider {

	private static final Logger logger = LoggerFactory.getLogger(GitTagsReleaseProvider.class);

	public static final String ID = "git";

	private static final String TAG_PREFIX = "refs/tags/";

	private static final Pattern REMOTE = Pattern
		.compile("^(?:(?:git|ssh|git\\+ssh|file)://.+|[A-Za-z0-9_.-]+@[A-Za-z0-9_.-]+:.+|https?://.+\\.git/?)$");

	private static final ProviderCapabilities CAPABILITIES = new ProviderCapabilities(false, false, false, false,
			false);

	private static final RateBudget RATE_BUDGET = RateBudget.perMinute(30, Duration.ofMillis(200));

	private final FetchGate gate;

	private final ObjectMapper objectMapper;

	private final VersionParser parser;

	public GitTagsReleaseProvider(FetchGate gate, ObjectMapper objectMapper, VersionParser parser) {
		this.gate = gate;
		this.objectMapper = objectMapper;
		this.parser = parser;
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
		String trimmed = input.trim();
		return REMOTE.matcher(trimmed).matches() || isLocalRepository(trimmed);
	}

	@Override
	public ProjectIdentifier resolveIdentifier(String input) {
		String trimmed = input.trim();
		if (isLocalRepository(trimmed)) {
			String path = Path.of(trimmed).toAbsolutePath().normalize().toString();
			return new ProjectIdentifier(ID, path, null);
		}
		if (!REMOTE.matcher(trimmed).matches()) {
			throw new NotFoundException(trimmed, "Not a git remote or local repository: " + trimmed);
		}
		String webUrl = trimmed.startsWith("http") ? trimmed.replaceAll("\\.git/?$", "") : null;
		return new ProjectIdentifier(ID, trimmed, webUrl);
	}

	@Override
	public List<JsonNode> listReleases(ProjectIdentifier project) {
		JsonNode tags = gate.fetch(new CacheKey(ID, project.canonical(), "ls-remote --tags"), RATE_BUDGET,
				token -> FetchGate.FetchResult.of(lsRemoteTags(project.canonical()), null));
		List<JsonNode> items = new ArrayList<>();
		tags.forEach(items::add);
		return items;
	}

	@Override
	public ReleaseRecord toReleaseRecord(JsonNode item) {
		String tag = JsonNodeUtils.getString(item, "tag")
			.orElseThrow(() -> new PermanentProviderException("Git tag item without name", -1));
		return ReleaseRecord.create(tag, parser.parse(tag), null, null, false, false, List.of());
	}

	private ArrayNode lsRemoteTags(String remote) {
		Collection<Ref> refs;
		try {
			refs = Git.lsRemoteRepository().setRemote(remote).setTags(true).setHeads(false).call();
		}
		catch (InvalidRemoteException e) {
			throw new NotFoundException(remote, "No git repository at " + remote, e);
		}
		catch (TransportException e) {
			String message = String.valueOf(e.getMessage()).toLowerCase(Locale.ROOT);
			if (message.contains("not found") || message.contains("does not appear to be a git repository")) {
				throw new NotFoundException(remote, "No git repository at " + remote, e);
			}
			if (message.contains("not authorized") || message.contains("authentication")) {
				throw new PermanentProviderException("Access to " + remote + " denied: " + e.getMessage(), e);
			}
			throw new TransientProviderException("Listing tags of " + remote + " failed: " + e.getMessage(), e);
		}
		catch (GitAPIException e) {
			throw new PermanentProviderException("Listing tags of " + remote + " failed: " + e.getMessage(), e);
		}

		ArrayNode tags = objectMapper.createArrayNode();
		for (Ref ref : refs) {
			String name = ref.getName();
			if (name.startsWith(TAG_PREFIX) && !name.endsWith("^{}")) {
				tags.addObject()
					.put("tag", name.substring(TAG_PREFIX.length()))
					.put("object_id", ref.getPeeledObjectId() == null ? ref.getObjectId().name()
							: ref.getPeeledObjectId().name());
			}
		}
		logger.debug("{} has {} tags", remote, tags.size());
		return tags;
	}

	private static boolean isLocalRepository(String input) {
		if (input.isEmpty() || input.contains("://")) {
			return false;
		}
		try {
			Path path = Path.of(input);
			return Files.isDirectory(path.resolve(".git"))
					|| (Files.isRegularFile(path.resolve("HEAD")) && Files.isDirectory(path.resolve("refs")));
		}
		catch (InvalidPathException e) {
			return false;
		}
	}

}
