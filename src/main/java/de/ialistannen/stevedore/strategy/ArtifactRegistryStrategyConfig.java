package de.ialistannen.stevedore.strategy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Configuration of an {@link ArtifactRegistryStrategy}.
 *
 * @param projectId the Google Cloud project hosting the repository
 * @param location the region of the repository, e.g. {@code us-central1}
 * @param garRepository the name of the Artifact Registry repository
 * @param image the image inside the repository. Defaults to {@value #DEFAULT_IMAGE}
 * @param recommendedTag the tag of the recommended image, if any. Always cached first.
 * @param aliasTags further tags that point to other tags
 * @param numReleases how many of the newest releases to cache
 * @param numWeeklies how many of the newest weeklies to cache
 * @param numDailies how many of the newest dailies to cache
 * @param cycle only consider images built for this XML cycle, if set
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ArtifactRegistryStrategyConfig(
  @JsonProperty("project_id") String projectId,
  @JsonProperty("location") String location,
  @JsonProperty("gar_repository") String garRepository,
  @JsonProperty("image") String image,
  @JsonProperty("recommended_tag") String recommendedTag,
  @JsonProperty("alias_tags") List<String> aliasTags,
  @JsonProperty("num_releases") Integer numReleases,
  @JsonProperty("num_weeklies") Integer numWeeklies,
  @JsonProperty("num_dailies") Integer numDailies,
  @JsonProperty("cycle") Integer cycle
) {

  public static final String DEFAULT_IMAGE = "sciplat-lab";

  public ArtifactRegistryStrategyConfig {
    image = Strings.isNullOrEmpty(image) ? DEFAULT_IMAGE : image;
    aliasTags = aliasTags == null ? List.of() : ImmutableList.copyOf(aliasTags);
  }

  /**
   * Ensures all required values are present and sensible.
   *
   * @return this config
   * @throws StrategyConfigurationException if the config is invalid
   */
  public ArtifactRegistryStrategyConfig validate() {
    requireText("project_id", projectId);
    requireText("location", location);
    requireText("gar_repository", garRepository);
    RegistryTagStrategyConfig.requireCount("num_releases", numReleases);
    RegistryTagStrategyConfig.requireCount("num_weeklies", numWeeklies);
    RegistryTagStrategyConfig.requireCount("num_dailies", numDailies);
    if (cycle != null && cycle < 0) {
      throw new StrategyConfigurationException("'cycle' must not be negative, was " + cycle);
    }
    return this;
  }

  /**
   * @return the resource name of the repository, as the Artifact Registry API expects it
   */
  public String parent() {
    return "projects/" + projectId + "/locations/" + location + "/repositories/" + garRepository;
  }

  /**
   * @return the image reference without tag or digest, e.g.
   *   {@code us-central1-docker.pkg.dev/project/sciplat/sciplat-lab}
   */
  public String imageBase() {
    return location + "-docker.pkg.dev/" + projectId + "/" + garRepository + "/" + image;
  }

  public Optional<Integer> cycleFilter() {
    return Optional.ofNullable(cycle);
  }

  /**
   * @return the recommended tag followed by all other alias tags
   */
  public Set<String> allAliases() {
    Set<String> aliases = new LinkedHashSet<>();
    if (!Strings.isNullOrEmpty(recommendedTag)) {
      aliases.add(recommendedTag);
    }
    aliases.addAll(aliasTags);
    return aliases;
  }

  private static void requireText(String name, String value) {
    if (Strings.isNullOrEmpty(value)) {
      throw new StrategyConfigurationException("'" + name + "' is required");
    }
  }
}
