package dev.pinakes.version;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class SemanticVersionTest {

  // --- Parsing ---

  @ParameterizedTest
  @ValueSource(
      strings = {
        "v1.2.3",
        "v0.0.0",
        "v1.0.0-alpha",
        "v1.0.0-alpha.1",
        "v1.0.0-0.3.7",
        "v1.0.0-x.7.z.92",
        "v1.0.0+20130313144700",
        "v2.0.0+incompatible",
        "v1",
        "v1.2"
      })
  void acceptsValidVersions(String version) {
    assertThat(SemanticVersion.isValid(version)).isTrue();
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "",
        "1.2.3",
        "v",
        "v1.",
        "v1.2.",
        "v01.2.3",
        "v1.02.3",
        "v1.2.3-",
        "v1.2.3-01",
        "v1.2.3-a..b",
        "v1.2.3+",
        "v1.2.3-a_b",
        "go1.21",
        "vx.y.z",
        "vv1.0.0",
        "v 1.0.0",
        "v1-pre"
      })
  void rejectsInvalidVersions(String version) {
    assertThat(SemanticVersion.isValid(version)).isFalse();
  }

  @Test
  void shorthandVersionsAreCanonicalized() {
    assertThat(SemanticVersion.parse("v1").orElseThrow().canonical()).isEqualTo("v1.0.0");
    assertThat(SemanticVersion.parse("v1.2").orElseThrow().canonical()).isEqualTo("v1.2.0");
    assertThat(SemanticVersion.parse("v1.2.3-rc.1+meta").orElseThrow().canonical())
        .isEqualTo("v1.2.3-rc.1");
  }

  @Test
  void parseExposesComponents() {
    SemanticVersion v = SemanticVersion.parse("v3.14.159-beta.2+build.7").orElseThrow();

    assertThat(v.major()).isEqualTo(3);
    assertThat(v.minor()).isEqualTo(14);
    assertThat(v.patch()).isEqualTo(159);
    assertThat(v.prerelease()).isEqualTo("beta.2");
    assertThat(v.build()).isEqualTo("build.7");
    assertThat(v.isPrerelease()).isTrue();
  }

  // --- Ordering ---

  @Test
  void precedenceFollowsSemverRules() {
    List<String> ordered =
        List.of(
            "v1.0.0-alpha",
            "v1.0.0-alpha.1",
            "v1.0.0-alpha.beta",
            "v1.0.0-beta",
            "v1.0.0-beta.2",
            "v1.0.0-beta.11",
            "v1.0.0-rc.1",
            "v1.0.0",
            "v1.0.1",
            "v1.10.0",
            "v2.0.0",
            "v10.0.0");
    List<String> shuffled = new ArrayList<>(ordered);
    Collections.reverse(shuffled);

    shuffled.sort(SemanticVersion::compare);

    assertThat(shuffled).containsExactlyElementsOf(ordered);
  }

  @Test
  void buildMetadataIsIgnoredForPrecedence() {
    assertThat(SemanticVersion.compare("v1.0.0+a", "v1.0.0+b")).isZero();
    assertThat(SemanticVersion.compare("v2.0.0+incompatible", "v2.0.0")).isZero();
  }

  @Test
  void invalidVersionsSortBeforeValidOnesAndByText() {
    assertThat(SemanticVersion.compare("bogus", "v0.0.1")).isNegative();
    assertThat(SemanticVersion.compare("v0.0.1", "bogus")).isPositive();
    assertThat(SemanticVersion.compare("bogus", "other")).isNegative();
    assertThat(SemanticVersion.compare("other", "bogus")).isPositive();
  }

  @Test
  void standardLibraryTagsCompareAsTheVersionsTheyStandFor() {
    List<String> ordered =
        List.of("go1.9", "go1.9.2", "go1.21beta1", "go1.21rc2", "go1.21.0", "go1.21.3", "go1.22");
    List<String> shuffled = new ArrayList<>(ordered);
    Collections.reverse(shuffled);

    shuffled.sort(SemanticVersion::compare);

    assertThat(shuffled).containsExactlyElementsOf(ordered);
    assertThat(SemanticVersion.compare("go1.21", "go1.21.0")).isZero();
  }

  @ParameterizedTest
  @CsvSource({
    "go1, v1.0.0",
    "go1.21, v1.21.0",
    "go1.21.3, v1.21.3",
    "go1.22rc1, v1.22.0-rc.1",
    "go1.22beta2, v1.22.0-beta.2"
  })
  void goTagsMapToSemanticVersions(String tag, String expected) {
    assertThat(SemanticVersion.forGoTag(tag)).contains(expected);
  }

  @Test
  void laterIsStrict() {
    assertThat(SemanticVersion.later("v1.0.1", "v1.0.0")).isTrue();
    assertThat(SemanticVersion.later("v1.0.0", "v1.0.0")).isFalse();
    assertThat(SemanticVersion.later("v1.0.0-rc.1", "v1.0.0")).isFalse();
  }

  @Test
  void componentsBeyondIntRangeAreInvalid() {
    assertThat(SemanticVersion.isValid("v99999999999999999999.0.0")).isFalse();
    assertThat(SemanticVersion.isValid("v2147483647.0.0")).isTrue();
  }

  // --- Classification ---

  @ParameterizedTest
  @ValueSource(
      strings = {
        "v0.0.0-20190311183353-d8887717615a",
        "v1.2.4-0.20190311183353-d8887717615a",
        "v1.2.3-pre.0.20190311183353-d8887717615a",
        "v2.0.1-0.20190311183353-d8887717615a+incompatible"
      })
  void recognizesPseudoVersions(String version) {
    assertThat(SemanticVersion.isPseudo(version)).isTrue();
  }

  @ParameterizedTest
  @ValueSource(strings = {"v1.2.3", "v1.2.3-rc.1", "v0.0.0-2019-abc", "not-a-version"})
  void rejectsNonPseudoVersions(String version) {
    assertThat(SemanticVersion.isPseudo(version)).isFalse();
  }

  @Test
  void incompatibleIsDetectedFromBuildSuffix() {
    assertThat(SemanticVersion.isIncompatible("v2.0.0+incompatible")).isTrue();
    assertThat(SemanticVersion.isIncompatible("v2.0.0")).isFalse();
    assertThat(SemanticVersion.isIncompatible(null)).isFalse();
  }

  // --- Sort keys ---

  @ParameterizedTest
  @CsvSource({
    "v1.2.3, '1,2,3~'",
    "v1, '1,0,0~'",
    "v10.0.0, 'a10,0,0~'",
    "v1.2.3-rc.20150901.-, '1,2,3,~rc,g20150901,~-'",
    "v1.2.3-alpha.789+build, '1,2,3,~alpha,b789'",
    "v2.0.0+incompatible, '2,0,0~'"
  })
  void forSortingProducesLexicallyOrderedKeys(String version, String expected) {
    assertThat(SemanticVersion.forSorting(version)).isEqualTo(expected);
  }

  @Test
  void forSortingReturnsInvalidInputUnchanged() {
    assertThat(SemanticVersion.forSorting("master")).isEqualTo("master");
  }

  @Test
  void forSortingKeysGoTagsLikeTheirVersions() {
    assertThat(SemanticVersion.forSorting("go1.21.0")).isEqualTo("1,a21,0~");
    assertThat(SemanticVersion.forSorting("go1.21rc2"))
        .isLessThan(SemanticVersion.forSorting("go1.21.0"));
  }

  @Test
  void numericPrefixEncodesDigitCountBeyondTwentySix() {
    StringBuilder sb = new StringBuilder();

    SemanticVersion.appendNumericPrefix(sb, 30);

    assertThat(sb).hasToString("zc");
  }
}
