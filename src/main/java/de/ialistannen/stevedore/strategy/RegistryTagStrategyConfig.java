package de.ialistannen.stevedore.strategy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import de.ialistannen.stevedore.registry.ImageRepository;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Configuration of a {@link RegistryTagStrategy}.
 *
 * @param registryUrl the registry host. Defaults to {@value #DEFAULT_REGISTRY}
 * @param repo the repository, e.g. {@code lsstsqre/sciplat-lab}
 * @param recommendedTag the tag of the recommended image, if any. Always cached first.
 * @param aliasTags further tags that point to other tags, e.g. {@code latest_weekly}
 * @param numReleases how many of the newest releases to cache
 * @param numWeeklies how many of the newest weeklies to cache
 * @param numDailies how many of the newest dailies to cache
 * @param cycle only consider images built for this XML cycle, if set
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RegistryTagStrategyConfig(
  @JsonProperty("registry_url") String registryUrl,
  @JsonProperty("repo") String repo,
  @JsonProperty("recommended_tag") String recommendedTag,
  @JsonProperty("alias_tags") List<String> aliasTags,
  @JsonProperty("num_releases") Integer numReleases,
  @JsonProperty("num_weeklies") Integer numWeeklies,
  @JsonProperty("num_dailies") Integer numDailies,
  @JsonProperty("cycle") Integer cycle
) {

  public static final String DEFAULT_REGISTRY = "registry.hub.docker.com";

  public RegistryTagStrategyConfig {
    registryUrl = Strings.isNullOrEmpty(registryUrl) ? DEFAULT_REGISTRY : registryUrl;
    aliasTags = aliasTags == null ? List.of() : ImmutableList.copyOf(aliasTags);
  }

  /**
   * Ensures all required values are present and sensible.
   *
   * @return this config
   * @throws StrategyConfigurationException if the config is invalid
   */
  public RegistryTagStrategyConfig validate() {
    if (Strings.isNullOrEmpty(repo)) {
      throw new StrategyConfigurationException("'repo' is required");
    }
    requireCount("num_releases", numReleases);
    requireCount("num_weeklies", numWeeklies);
    requireCount("num_dailies", numDailies);
    if (cycle != null && cycle < 0) {
      throw new StrategyConfigurationException("'cycle' must not be negative, was " + cycle);
    }
    return this;
  }

  public ImageRepository repository() {
    return new ImageRepository(registryUrl, repo);
  }

  public Optional<String> recommended() {
    return Optional.ofNullable(Strings.emptyToNull(recommendedTag));
  }

  public Optional<Integer> cycleFilter() {
    return Optional.ofNullable(cycle);
  }

  /**
   * @return the recommended tag followed by all other alias tags
   */
  public Set<String> allAliases() {
    Set<String> aliases = new LinkedHashSet<>();
    recommended().ifPresent(aliases::add);
    aliases.addAll(aliasTags);
    return aliases;
  }

  static void requireCount(String name, Integer value) {
    if (value == null) {
      throw new StrategyConfigurationException("'" + name + "' is required");
    }
    if (value < 0) {
      throw new StrategyConfigurationException("'" + name + "' must not be negative, was " + value);
    }
  }
}
