package de.ialistannen.stevedore.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.collect.ImmutableSet;
import de.ialistannen.stevedore.cache.CachedImage;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class RegistryTagStrategyTest {

  private static final String LAB = "registry.hub.docker.com/lsstsqre/sciplat-lab";

  private static RegistryTagStrategyConfig config(int releases, int weeklies, int dailies) {
    return new RegistryTagStrategyConfig(
      null, "lsstsqre/sciplat-lab", "recommended", null, releases, weeklies, dailies, null
    );
  }

  private static RegistryTagStrategy strategy(FakeImageRegistry registry, RegistryTagStrategyConfig config) {
    return new RegistryTagStrategy(registry, config, Duration.ofMinutes(5));
  }

  @Test
  void recommendedComesFirstAndIsNamedAfterItsRelease() throws Exception {
    FakeImageRegistry registry = new FakeImageRegistry()
      .tag("recommended", "sha256:r21")
      .tag("r21_0_0", "sha256:r21")
      .tag("w_2021_03", "sha256:w03")
      .tag("d_2021_01_13", "sha256:d13");

    DesiredImages images = strategy(registry, config(1, 1, 1)).desiredImages(List.of());

    assertThat(images.priority()).containsExactly(
      new DesiredImage(LAB + ":recommended", "sha256:r21", "Recommended (Release r21.0.0)"),
      new DesiredImage(LAB + ":r21_0_0", "sha256:r21", "Release r21.0.0"),
      new DesiredImage(LAB + ":w_2021_03", "sha256:w03", "Weekly 2021_03"),
      new DesiredImage(LAB + ":d_2021_01_13", "sha256:d13", "Daily 2021_01_13")
    );
  }

  @Test
  void selectsNewestOfEachKind() throws Exception {
    FakeImageRegistry registry = new FakeImageRegistry()
      .tag("r20_0_0", "sha256:r20")
      .tag("r21_0_0", "sha256:r21")
      .tag("r21_0_1_rc1", "sha256:rc")
      .tag("w_2021_9", "sha256:w09")
      .tag("w_2021_10", "sha256:w10")
      .tag("w_2021_08", "sha256:w08")
      .tag("d_2021_01_13", "sha256:d13")
      .tag("exp_foo", "sha256:exp");

    DesiredImages images = strategy(registry, config(1, 2, 0)).desiredImages(List.of());

    assertThat(images.priority()).extracting(DesiredImage::imageUrl).containsExactly(
      LAB + ":r21_0_0",
      LAB + ":w_2021_10",
      LAB + ":w_2021_9"
    );
    assertThat(registry.digestRequests()).containsExactlyInAnyOrder("r21_0_0", "w_2021_10", "w_2021_9");
  }

  @Test
  void allListsEveryTagInReverseLexicalOrder() throws Exception {
    FakeImageRegistry registry = new FakeImageRegistry()
      .tag("d_2021_01_13", "sha256:d13")
      .tag("recommended", "sha256:r21")
      .tag("r21_0_0", "sha256:r21")
      .tag("w_2021_03", "sha256:w03");

    DesiredImages images = strategy(registry, config(0, 0, 0)).desiredImages(List.of());

    assertThat(images.all()).extracting(DesiredImage::displayName)
      .containsExactly("w_2021_03", "recommended", "r21_0_0", "d_2021_01_13");
    assertThat(images.all()).allMatch(it -> it.digest() == null);
    // Nothing else was selected or cached, so there is nothing to name it after
    assertThat(images.priority()).extracting(DesiredImage::displayName).containsExactly("Recommended");
  }

  @Test
  void aliasIsNamedAfterCachedTags() throws Exception {
    FakeImageRegistry registry = new FakeImageRegistry()
      .tag("recommended", "sha256:w03")
      .tag("w_2021_03", "sha256:w03");
    List<CachedImage> cache = List.of(
      new CachedImage(LAB + ":recommended", "sha256:w03", ImmutableSet.of("w_2021_03", "latest"))
    );

    DesiredImages images = strategy(registry, config(0, 0, 0)).desiredImages(cache);

    assertThat(images.priority()).singleElement()
      .extracting(DesiredImage::displayName)
      .isEqualTo("Recommended (Weekly 2021_03)");
  }

  @Test
  void aliasWithoutOtherNamesIsJustTitleCased() throws Exception {
    FakeImageRegistry registry = new FakeImageRegistry()
      .tag("recommended", "sha256:a")
      .tag("latest_weekly", "sha256:b");
    RegistryTagStrategyConfig config = new RegistryTagStrategyConfig(
      "ts-dockerhub.lsst.org", "lsstsqre/sciplat-lab", "recommended", List.of("latest_weekly"), 0, 0, 0, null
    );

    DesiredImages images = strategy(registry, config).desiredImages(List.of());

    assertThat(images.priority()).containsExactly(
      new DesiredImage("ts-dockerhub.lsst.org/lsstsqre/sciplat-lab:recommended", "sha256:a", "Recommended"),
      new DesiredImage("ts-dockerhub.lsst.org/lsstsqre/sciplat-lab:latest_weekly", "sha256:b", "Latest Weekly")
    );
  }

  @Test
  void missingRecommendedTagIsSkipped() throws Exception {
    FakeImageRegistry registry = new FakeImageRegistry().tag("r21_0_0", "sha256:r21");

    DesiredImages images = strategy(registry, config(1, 0, 0)).desiredImages(List.of());

    assertThat(images.priority()).extracting(DesiredImage::imageUrl).containsExactly(LAB + ":r21_0_0");
  }

  @Test
  void cycleFiltersVersionedTags() throws Exception {
    FakeImageRegistry registry = new FakeImageRegistry()
      .tag("recommended", "sha256:rec")
      .tag("w_2021_10_c0021.001", "sha256:w10")
      .tag("w_2021_09_c0020.001", "sha256:w09")
      .tag("w_2021_08", "sha256:w08");
    RegistryTagStrategyConfig config = new RegistryTagStrategyConfig(
      null, "lsstsqre/sciplat-lab", "recommended", null, 0, 5, 0, 20
    );

    DesiredImages images = strategy(registry, config).desiredImages(List.of());

    assertThat(images.priority()).extracting(DesiredImage::imageUrl)
      .containsExactly(LAB + ":recommended", LAB + ":w_2021_09_c0020.001");
    assertThat(images.all()).extracting(DesiredImage::displayName)
      .containsExactly("w_2021_09_c0020.001", "recommended");
  }

  @Test
  void digestsAreCached() throws Exception {
    FakeImageRegistry registry = new FakeImageRegistry().tag("r21_0_0", "sha256:r21");
    RegistryTagStrategy strategy = strategy(registry, config(1, 0, 0));

    strategy.desiredImages(List.of());
    strategy.desiredImages(List.of());

    assertThat(registry.digestRequests()).containsExactly("r21_0_0");
  }

  @Test
  void invalidConfigIsRejected() {
    RegistryTagStrategyConfig missingRepo = new RegistryTagStrategyConfig(null, null, null, null, 1, 1, 1, null);
    RegistryTagStrategyConfig negative = new RegistryTagStrategyConfig(null, "repo", null, null, -1, 1, 1, null);
    RegistryTagStrategyConfig missingCount = new RegistryTagStrategyConfig(null, "repo", null, null, 1, null, 1, null);

    assertThatThrownBy(() -> strategy(new FakeImageRegistry(), missingRepo))
      .isInstanceOf(StrategyConfigurationException.class)
      .hasMessageContaining("repo");
    assertThatThrownBy(() -> strategy(new FakeImageRegistry(), negative))
      .isInstanceOf(StrategyConfigurationException.class)
      .hasMessageContaining("num_releases");
    assertThatThrownBy(() -> strategy(new FakeImageRegistry(), missingCount))
      .isInstanceOf(StrategyConfigurationException.class)
      .hasMessageContaining("num_weeklies");
  }
}
