package org.springaicommunity.release.resolver;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link Version} parsing and ordering with the standard rule chain.
 */
@DisplayName("Version Tests")
class VersionTest {

	@Nested
	@DisplayName("Parsing Tests")
	class ParsingTest {

		@Test
		@DisplayName("Should parse a plain semantic version")
		void shouldParsePlainVersion() {
			Version version = Version.parse("v1.2.3");

			assertThat(version.kind()).isEqualTo(Version.Kind.SEMANTIC);
			assertThat(version.release()).containsExactly(1L, 2L, 3L);
			assertThat(version.preRelease()).isNull();
			assertThat(version.postRelease()).isNull();
			assertThat(version.confidence()).isEqualTo(Version.Confidence.HIGH);
			assertThat(version.rule()).isEqualTo("numeric");
			assertThat(version.raw()).isEqualTo("v1.2.3");
			assertThat(version).hasToString("1.2.3");
		}

		@ParameterizedTest(name = "{0} -> {1}{2}")
		@CsvSource({ "2.0.0-rc1, RC, 1", "1.0.0a1, ALPHA, 1", "1.0b2, BETA, 2", "1.2.3-beta.2, BETA, 2",
				"6.1.0-M1, MILESTONE, 1", "3.0.0.RC2, RC, 2", "1.0-preview3, PREVIEW, 3", "1.0.0-SNAPSHOT, DEV, 0",
				"1.0.dev4, DEV, 4", "2.0a, ALPHA, 0", "1.0-cr1, RC, 1" })
		@DisplayName("Should recognize pre-release markers")
		void shouldRecognizePreReleaseMarkers(String tag, PreRelease.Kind kind, long number) {
			Version version = Version.parse(tag);

			assertThat(version.isPrerelease()).isTrue();
			assertThat(version.preRelease()).isEqualTo(new PreRelease(kind, number));
		}

		@Test
		@DisplayName("Should parse a post-release number")
		void shouldParsePostRelease() {
			Version version = Version.parse("1.0.post2");

			assertThat(version.release()).containsExactly(1L, 0L);
			assertThat(version.postRelease()).isEqualTo(2L);
			assertThat(version.isPrerelease()).isFalse();
			assertThat(version).hasToString("1.0.post2");
		}

		@Test
		@DisplayName("Should parse an explicit epoch in both notations")
		void shouldParseEpoch() {
			assertThat(Version.parse("1!2.0").epoch()).isEqualTo(1);
			assertThat(Version.parse("2:1.0").epoch()).isEqualTo(2);
			assertThat(Version.parse("1!2.0")).hasToString("1!2.0");
			assertThat(Version.parse("1!2.0").rule()).isEqualTo("epoch");
		}

		@Test
		@DisplayName("Should parse date-shaped tags into year, month, day")
		void shouldParseDates() {
			Version separated = Version.parse("2024.01.15");
			Version compact = Version.parse("20240115");

			assertThat(separated.kind()).isEqualTo(Version.Kind.DATE);
			assertThat(separated.release()).containsExactly(2024L, 1L, 15L);
			assertThat(compact.kind()).isEqualTo(Version.Kind.DATE);
			assertThat(compact).isEqualTo(separated);
		}

		@Test
		@DisplayName("Should not treat an impossible date as a date")
		void shouldRejectImpossibleDate() {
			Version version = Version.parse("2024.13.40");

			assertThat(version.kind()).isEqualTo(Version.Kind.SEMANTIC);
			assertThat(version.release()).containsExactly(2024L, 13L, 40L);
		}

		@Test
		@DisplayName("Should keep build metadata as local part outside equality")
		void shouldKeepBuildMetadataOutsideEquality() {
			Version withBuild = Version.parse("1.0.0+build.5");

			assertThat(withBuild.local()).isEqualTo("build.5");
			assertThat(withBuild).isEqualTo(Version.parse("1.0.0"));
			assertThat(withBuild.compareTo(Version.parse("1.0.0"))).isZero();
		}

		@Test
		@DisplayName("Should lower confidence for leftover text")
		void shouldLowerConfidenceForLeftovers() {
			assertThat(Version.parse("nginx-1.25.3").confidence()).isEqualTo(Version.Confidence.MEDIUM);
			assertThat(Version.parse("1.0-custom").confidence()).isEqualTo(Version.Confidence.LOW);
			assertThat(Version.parse("1.0-custom").local()).isEqualTo("custom");
		}

		@ParameterizedTest
		@ValueSource(strings = { "latest", "nightly", "", "stable-branch" })
		@DisplayName("Should mark tags without numbers unparseable")
		void shouldMarkUnparseable(String tag) {
			Version version = Version.parse(tag);

			assertThat(version.isParseable()).isFalse();
			assertThat(version.kind()).isEqualTo(Version.Kind.UNPARSEABLE);
			assertThat(version.confidence()).isEqualTo(Version.Confidence.LOW);
			assertThat(version).hasToString(tag);
		}

		@Test
		@DisplayName("Should not overflow on very long numeric components")
		void shouldNotOverflowOnLongComponents() {
			Version version = Version.parse("1.1234567890123456789012345");

			assertThat(version.isParseable()).isFalse();
		}

	}

	@Nested
	@DisplayName("Ordering Tests")
	class OrderingTest {

		@Test
		@DisplayName("Should order pre-release kinds below the final release")
		void shouldOrderPreReleaseKinds() {
			List<String> ascending = List.of("1.0.0-dev1", "1.0.0-alpha1", "1.0.0-beta1", "1.0.0-M1",
					"1.0.0-preview1", "1.0.0-rc1", "1.0.0-rc2", "1.0.0", "1.0.0.post1", "1.0.1");

			for (int i = 1; i < ascending.size(); i++) {
				Version lower = Version.parse(ascending.get(i - 1));
				Version higher = Version.parse(ascending.get(i));
				assertThat(higher.isNewerThan(lower)).as("%s > %s", higher.raw(), lower.raw()).isTrue();
			}
		}

		@Test
		@DisplayName("Should compare components numerically, not lexically")
		void shouldCompareNumerically() {
			assertThat(Version.parse("1.10.0").isNewerThan(Version.parse("1.9.0"))).isTrue();
			assertThat(Version.parse("10.0").isNewerThan(Version.parse("9.99.99"))).isTrue();
		}

		@Test
		@DisplayName("Should pad the shorter release with zeros")
		void shouldPadWithZeros() {
			assertThat(Version.parse("1.2")).isEqualTo(Version.parse("1.2.0"));
			assertThat(Version.parse("1.2").hashCode()).isEqualTo(Version.parse("1.2.0").hashCode());
			assertThat(Version.parse("1.2.0.1").isNewerThan(Version.parse("1.2"))).isTrue();
		}

		@Test
		@DisplayName("Should let the epoch dominate the release components")
		void shouldLetEpochDominate() {
			assertThat(Version.parse("1!1.0").isNewerThan(Version.parse("2024.1"))).isTrue();
		}

		@Test
		@DisplayName("Should rank any parseable version above unparseable ones")
		void shouldRankParseableAboveUnparseable() {
			Version unparseable = Version.parse("zzz-nightly");

			assertThat(Version.parse("0.0.1").isNewerThan(unparseable)).isTrue();
			assertThat(unparseable.compareTo(Version.parse("0.0.1"))).isNegative();
		}

		@Test
		@DisplayName("Should order unparseable versions by raw text")
		void shouldOrderUnparseableByRawText() {
			assertThat(Version.parse("beta").isNewerThan(Version.parse("alpha"))).isTrue();
			assertThat(Version.parse("latest")).isEqualTo(Version.parse("latest"));
		}

		@Test
		@DisplayName("Should sort a mixed list")
		void shouldSortMixedList() {
			List<Version> versions = new ArrayList<>();
			for (String tag : List.of("v2.0.0", "1.10", "latest", "v2.0.0-rc1", "1.9.9", "2.0.0.post1")) {
				versions.add(Version.parse(tag));
			}

			versions.sort(null);

			assertThat(versions).extracting(Version::raw)
				.containsExactly("latest", "1.9.9", "1.10", "v2.0.0-rc1", "v2.0.0", "2.0.0.post1");
		}

	}

	@Nested
	@DisplayName("User Version Tests")
	class UserVersionTest {

		@Test
		@DisplayName("Should accept a plain version")
		void shouldAcceptPlainVersion() {
			assertThat(Version.parseUserVersion("1.2.3")).contains(Version.parse("1.2.3"));
			assertThat(Version.parseUserVersion(" v5.0 ")).isPresent();
		}

		@ParameterizedTest
		@ValueSource(strings = { "owner/repo", "https://github.com/owner/repo", "latest", " " })
		@DisplayName("Should reject inputs that are not versions")
		void shouldRejectNonVersions(String input) {
			assertThat(Version.parseUserVersion(input)).isEmpty();
		}

	}

}
