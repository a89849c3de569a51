package de.ialistannen.stevedore.tag;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.semver4j.Semver;

class TagParserTest {

  static Stream<Arguments> knownTags() {
    return Stream.of(
      Arguments.of("r21_0_1", TagKind.RELEASE, "Release r21.0.1", "21.0.1", null),
      Arguments.of("r22_0_0_rc1", TagKind.RELEASE_CANDIDATE, "Release Candidate r22.0.0-rc1", "22.0.0-rc1", null),
      Arguments.of("w_2021_22", TagKind.WEEKLY, "Weekly 2021_22", "2021.22.0", null),
      Arguments.of("w_2021_03", TagKind.WEEKLY, "Weekly 2021_03", "2021.3.0", null),
      Arguments.of("d_2021_05_27", TagKind.DAILY, "Daily 2021_05_27", "2021.5.27", null),
      Arguments.of("r170", TagKind.RELEASE, "Release r17.0.0", "17.0.0", null),
      Arguments.of(
        "r21_0_1_c0020.001", TagKind.RELEASE, "Release r21.0.1_c0020.001", "21.0.1+c0020.001", 20
      ),
      Arguments.of(
        "w_2021_22_csal0019.002", TagKind.WEEKLY, "Weekly 2021_22_csal0019.002", "2021.22.0+csal0019.002", 19
      ),
      Arguments.of(
        "d_2021_05_27_20210527", TagKind.DAILY, "Daily 2021_05_27_20210527", "2021.5.27+20210527", null
      ),
      Arguments.of(
        "d_2021_05_27_c0020.001_20210527",
        TagKind.DAILY,
        "Daily 2021_05_27_c0020.001_20210527",
        "2021.5.27+c0020.001.20210527",
        20
      ),
      Arguments.of(
        "r22_0_0_rc1_c0020.001", TagKind.RELEASE_CANDIDATE, "Release Candidate r22.0.0-rc1_c0020.001",
        "22.0.0-rc1+c0020.001", 20
      )
    );
  }

  @ParameterizedTest
  @MethodSource("knownTags")
  void classifiesVersionedTags(String raw, TagKind kind, String displayName, String version, Integer cycle) {
    ClassifiedTag tag = TagParser.parse(raw);

    assertThat(tag.rawTag()).isEqualTo(raw);
    assertThat(tag.kind()).isEqualTo(kind);
    assertThat(tag.displayName()).isEqualTo(displayName);
    assertThat(tag.semanticVersion().map(Semver::getVersion)).contains(version);
    assertThat(tag.cycle()).isEqualTo(Optional.ofNullable(cycle));
  }

  @Test
  void releaseCandidateIsNotAReleaseWithRemainder() {
    ClassifiedTag tag = TagParser.parse("r23_0_0_rc1");

    assertThat(tag.kind()).isEqualTo(TagKind.RELEASE_CANDIDATE);
    assertThat(tag.semanticVersion().orElseThrow().getPreRelease()).containsExactly("rc1");
  }

  @Test
  void experimentalTagsNameTheirInnerTag() {
    assertThat(TagParser.parse("exp_random").displayName()).isEqualTo("Experimental random");
    assertThat(TagParser.parse("exp_w_2021_22").displayName()).isEqualTo("Experimental Weekly 2021_22");

    ClassifiedTag tag = TagParser.parse("exp_w_2021_22");
    assertThat(tag.kind()).isEqualTo(TagKind.EXPERIMENTAL);
    assertThat(tag.semanticVersion()).isEmpty();
    assertThat(tag.cycle()).isEmpty();
  }

  @Test
  void aliasesAreTitleCased() {
    ClassifiedTag tag = TagParser.parse("latest_weekly", Set.of("latest_weekly"));

    assertThat(tag.kind()).isEqualTo(TagKind.ALIAS);
    assertThat(tag.displayName()).isEqualTo("Latest Weekly");
    assertThat(tag.semanticVersion()).isEmpty();
  }

  @Test
  void aliasesTakePrecedenceOverVersionRules() {
    assertThat(TagParser.parse("r21_0_1", Set.of("r21_0_1")).kind()).isEqualTo(TagKind.ALIAS);
  }

  @Test
  void latestIsOnlyAnAliasIfConfigured() {
    assertThat(TagParser.parse("latest").kind()).isEqualTo(TagKind.UNKNOWN);
    assertThat(TagParser.parse("latest", Set.of("latest")).displayName()).isEqualTo("Latest");
  }

  @Test
  void emptyTagIsTheDefaultTag() {
    assertThat(TagParser.parse("").rawTag()).isEqualTo("latest");
    assertThat(TagParser.parse(null, Set.of("latest")).kind()).isEqualTo(TagKind.ALIAS);
  }

  @Test
  void mixedCaseIsUnknownEvenIfAliased() {
    ClassifiedTag tag = TagParser.parse("Latest", Set.of("Latest"));

    assertThat(tag.kind()).isEqualTo(TagKind.UNKNOWN);
    assertThat(tag.displayName()).isEqualTo("Latest");
  }

  @Test
  void unmatchedTagsAreUnknown() {
    ClassifiedTag tag = TagParser.parse("not_a_version");

    assertThat(tag.kind()).isEqualTo(TagKind.UNKNOWN);
    assertThat(tag.displayName()).isEqualTo("not_a_version");
    assertThat(tag.semanticVersion()).isEmpty();
  }

  @Test
  void overflowingNumbersDoNotFail() {
    ClassifiedTag tag = TagParser.parse("r99999999999_0_0");

    assertThat(tag.kind()).isEqualTo(TagKind.RELEASE);
    assertThat(tag.displayName()).isEqualTo("Release r99999999999.0.0");
    assertThat(tag.semanticVersion()).isEmpty();
  }

  @Test
  void emptyRemainderIsIgnored() {
    ClassifiedTag tag = TagParser.parse("w_2021_22_");

    assertThat(tag.displayName()).isEqualTo("Weekly 2021_22");
    assertThat(tag.semanticVersion().map(Semver::getVersion)).contains("2021.22.0");
  }

  @Test
  void titleCasesWords() {
    assertThat(TagParser.titleCase("release_candidate")).isEqualTo("Release Candidate");
    assertThat(TagParser.titleCase("recommended")).isEqualTo("Recommended");
  }
}
