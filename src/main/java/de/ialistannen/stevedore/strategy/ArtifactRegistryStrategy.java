package de.ialistannen.stevedore.strategy;

import com.google.api.gax.rpc.ApiException;
import com.google.common.collect.HashMultimap;
import com.google.common.collect.SetMultimap;
import com.google.devtools.artifactregistry.v1.ArtifactRegistryClient;
import com.google.devtools.artifactregistry.v1.DockerImage;
import com.google.devtools.artifactregistry.v1.ListDockerImagesRequest;
import de.ialistannen.stevedore.cache.CachedImage;
import de.ialistannen.stevedore.strategy.TagSelector.TagSource;
import de.ialistannen.stevedore.tag.TagParser;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks images from a Google Artifact Registry repository. Works like the {@link RegistryTagStrategy}, but a single
 * listing returns every image with its digest and tags, so no digest needs to be resolved separately.
 */
public class ArtifactRegistryStrategy implements DesiredImageStrategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactRegistryStrategy.class);

  public static final String TYPE = "google-artifact-registry";

  private final Supplier<ArtifactRegistryClient> client;
  private final ArtifactRegistryStrategyConfig config;
  private final Set<String> aliases;
  private final TagSelector selector;

  /**
   * @param client creates the client on first use, as creating it needs cloud credentials
   * @param config the strategy configuration
   */
  public ArtifactRegistryStrategy(Supplier<ArtifactRegistryClient> client, ArtifactRegistryStrategyConfig config) {
    this.client = client;
    this.config = config.validate();
    this.aliases = config.allAliases();
    this.selector = new TagSelector(
      aliases,
      config.numReleases(),
      config.numWeeklies(),
      config.numDailies(),
      config.cycleFilter()
    );
  }

  @Override
  public DesiredImages desiredImages(List<CachedImage> commonCache) throws IOException, InterruptedException {
    String imageBase = config.imageBase();
    String digestPrefix = imageBase + "@";

    Map<String, String> digestByTag = new HashMap<>();
    SetMultimap<String, String> tagsByDigest = HashMultimap.create();
    for (DockerImage image : listImages()) {
      if (!image.getUri().startsWith(digestPrefix)) {
        LOGGER.debug("Ignoring '{}' as it is not an image of '{}'", image.getUri(), imageBase);
        continue;
      }
      String digest = image.getUri().substring(digestPrefix.length());
      for (String tag : image.getTagsList()) {
        digestByTag.put(tag, digest);
        tagsByDigest.put(digest, tag);
      }
    }

    // Reverse lexical order puts the most recent builds first
    List<String> tags = new ArrayList<>(digestByTag.keySet());
    tags.sort(Comparator.reverseOrder());
    LOGGER.debug("Artifact registry returned tags for '{}': {}", imageBase, tags);

    TagSource source = new TagSource() {
      @Override
      public String imageUrl(String tag) {
        return imageBase + ":" + tag;
      }

      @Override
      public String digest(String tag) {
        return digestByTag.get(tag);
      }
    };
    DesiredImages images = selector.select(
      tags,
      source,
      alias -> isInCycle(tagsByDigest.get(digestByTag.get(alias))),
      commonCache
    );

    LOGGER.info(
      "Desired images for '{}': {}",
      imageBase,
      images.priority().stream().map(DesiredImage::displayName).toList()
    );
    return images;
  }

  /**
   * An alias carries no cycle itself, so it is in the cycle if another tag of the same image is.
   */
  private boolean isInCycle(Set<String> imageTags) {
    if (config.cycleFilter().isEmpty()) {
      return true;
    }
    return imageTags.stream()
      .filter(tag -> !aliases.contains(tag))
      .anyMatch(tag -> selector.matchesCycle(TagParser.parse(tag, aliases)));
  }

  private List<DockerImage> listImages() throws IOException {
    ListDockerImagesRequest request = ListDockerImagesRequest.newBuilder()
      .setParent(config.parent())
      .build();

    List<DockerImage> images = new ArrayList<>();
    try {
      client.get().listDockerImages(request).iterateAll().forEach(images::add);
    } catch (UncheckedIOException e) {
      throw e.getCause();
    } catch (ApiException e) {
      throw new IOException("Could not list images in '" + config.parent() + "'", e);
    }
    return images;
  }
}
