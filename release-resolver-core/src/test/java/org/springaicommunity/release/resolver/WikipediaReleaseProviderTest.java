package org.springaicommunity.release.resolver;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("WikipediaReleaseProvider Tests")
@ExtendWith(MockitoExtension.class)
class WikipediaReleaseProviderTest {

	private static final String ARTICLE = """
			<table class="infobox vevent">
			<tr><th scope="row" class="infobox-label">Developer</th><td class="infobox-data">Rocky Enterprise Software Foundation</td></tr>
			<tr><th scope="row" class="infobox-label"><a href="/wiki/Software_release_life_cycle">Latest release</a></th>
			<td class="infobox-data">9.4<sup id="cite_ref-1" class="reference"><a href="#cite_note-1">[1]</a></sup> / 9 May 2024<span style="display:none">&#160;(<span class="bday dtstart published updated">2024-05-09</span>)</span></td></tr>
			<tr><th scope="row" class="infobox-label"><a href="/wiki/Software_release_life_cycle">Preview release</a></th>
			<td class="infobox-data">10.0 beta / 2 June 2025<span style="display:none">&#160;(<span class="bday dtstart published updated">2025-06-02</span>)</span></td></tr>
			</table>
			""";

	@Mock
	private ApiClient apiClient;

	private WikipediaReleaseProvider provider;

	@BeforeEach
	void setUp() {
		FetchGate gate = FetchGate.builder().sleeper(duration -> {
		}).build();
		provider = new WikipediaReleaseProvider(new ProviderHttp(apiClient, gate, ObjectMapperFactory.create()),
				VersionParser.standard(), new ResolverProperties());
	}

	@ParameterizedTest(name = "{0} -> {1}")
	@CsvSource(delimiter = '|', value = { "9.4<sup class=\"reference\">[1]</sup> / 9 May 2024 | 9.4",
			"24.04 LTS | 24.04", "13.2 dev | 13.2-dev0", "8.9 p2 | 8.9-post2", "Windows 11 23H2 | 11-23H2",
			"<a href=\"/wiki/X\">7.1</a>&#160;Update | 7.1" })
	@DisplayName("Should extract the version text of an infobox cell")
	void shouldExtractVersionText(String cell, String expected) {
		assertThat(WikipediaReleaseProvider.versionText(cell)).isEqualTo(expected);
	}

	@Test
	@DisplayName("Should accept only known product names")
	void shouldAcceptKnownNames() {
		assertThat(provider.acceptsBareName("Ubuntu")).isTrue();
		assertThat(provider.acceptsBareName("requests")).isFalse();
		assertThat(provider.claims("https://en.wikipedia.org/wiki/Rocky_Linux")).isTrue();
		assertThat(provider.claims("https://github.com/rocky-linux/rocky")).isFalse();
	}

	@Test
	@DisplayName("Should read latest and preview releases from the infobox")
	void shouldReadInfoboxReleases() {
		when(apiClient.get(eq("https://en.wikipedia.org/wiki/Rocky_Linux"), anyMap()))
			.thenReturn(ApiResponse.ok(ARTICLE));

		ProjectIdentifier project = provider.resolveIdentifier("rocky");
		List<ReleaseRecord> records = provider.listReleases(project).stream().map(provider::toReleaseRecord).toList();

		verify(apiClient, times(1)).get(anyString(), anyMap());
		assertThat(project.canonical()).isEqualTo("Rocky_Linux");
		assertThat(records).extracting(ReleaseRecord::tag).containsExactly("9.4", "10.0");

		ReleaseRecord latest = records.get(0);
		assertThat(latest.prerelease()).isFalse();
		assertThat(latest.publishedAt()).isEqualTo(Instant.parse("2024-05-09T00:00:00Z"));
		assertThat(latest.formal()).isTrue();

		ReleaseRecord preview = records.get(1);
		assertThat(preview.prerelease()).isTrue();
		assertThat(preview.prereleaseSource()).isEqualTo(PrereleaseSource.DECLARED);
	}

	@Test
	@DisplayName("Should pick the stable row over a newer preview")
	void shouldPickStableOverPreview() {
		when(apiClient.get(eq("https://en.wikipedia.org/wiki/Rocky_Linux"), anyMap()))
			.thenReturn(ApiResponse.ok(ARTICLE));
		ProjectIdentifier project = provider.resolveIdentifier("rocky");
		List<ReleaseRecord> records = provider.listReleases(project).stream().map(provider::toReleaseRecord).toList();

		assertThat(new ReleaseSelector().select("rocky", records, SelectionPolicy.defaults()).tag()).isEqualTo("9.4");
	}

	@Test
	@DisplayName("Should resolve article URLs on any language edition")
	void shouldResolveArticleUrls() {
		when(apiClient.get(eq("https://de.wikipedia.org/wiki/Debian"), anyMap())).thenReturn(ApiResponse.ok(ARTICLE));

		ProjectIdentifier project = provider.resolveIdentifier("https://de.wikipedia.org/wiki/Debian");

		assertThat(project.canonical()).isEqualTo("Debian");
		assertThat(project.webUrl()).isEqualTo("https://de.wikipedia.org/wiki/Debian");
	}

	@Test
	@DisplayName("Should report an unknown name or missing article as not found")
	void shouldReportNotFound() {
		when(apiClient.get(eq("https://en.wikipedia.org/wiki/No_Such_OS"), anyMap()))
			.thenThrow(new PermanentProviderException("Not found", 404));

		assertThatThrownBy(() -> provider.resolveIdentifier("plan9")).isInstanceOf(NotFoundException.class);
		assertThatThrownBy(() -> provider.resolveIdentifier("https://en.wikipedia.org/wiki/No_Such_OS"))
			.isInstanceOf(NotFoundException.class);
	}

}
