package de.ialistannen.stevedore.strategy;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import de.ialistannen.stevedore.cache.CachedImage;
import de.ialistannen.stevedore.registry.ImageRegistry;
import de.ialistannen.stevedore.registry.ImageRepository;
import de.ialistannen.stevedore.strategy.TagSelector.TagSource;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks images from the tags of a registry repository: the recommended tag first, followed by the other aliases and
 * the newest releases, weeklies and dailies.
 */
public class RegistryTagStrategy implements DesiredImageStrategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(RegistryTagStrategy.class);

  public static final String TYPE = "registry-tags";

  private final ImageRegistry registry;
  private final ImageRepository repository;
  private final TagSelector selector;
  private final Cache<String, String> digests;

  /**
   * @param registry the registry to query
   * @param config the strategy configuration
   * @param digestLifetime how long a resolved digest is reused
   */
  public RegistryTagStrategy(ImageRegistry registry, RegistryTagStrategyConfig config, Duration digestLifetime) {
    config.validate();
    this.registry = registry;
    this.repository = config.repository();
    this.selector = new TagSelector(
      config.allAliases(),
      config.numReleases(),
      config.numWeeklies(),
      config.numDailies(),
      config.cycleFilter()
    );
    this.digests = Caffeine.newBuilder()
      .expireAfterWrite(digestLifetime)
      .build();
  }

  @Override
  public DesiredImages desiredImages(List<CachedImage> commonCache) throws IOException, InterruptedException {
    // Reverse lexical order puts the most recent builds first
    List<String> tags = new ArrayList<>(registry.listTags(repository));
    tags.sort(Comparator.reverseOrder());
    LOGGER.debug("Registry returned tags for '{}': {}", repository, tags);

    TagSource source = new TagSource() {
      @Override
      public String imageUrl(String tag) {
        return repository.imageUrl(tag);
      }

      @Override
      public String digest(String tag) throws IOException, InterruptedException {
        return getDigest(tag);
      }
    };
    DesiredImages images = selector.select(tags, source, alias -> true, commonCache);

    LOGGER.info(
      "Desired images for '{}': {}",
      repository,
      images.priority().stream().map(DesiredImage::displayName).toList()
    );
    return images;
  }

  private String getDigest(String tag) throws IOException, InterruptedException {
    String cached = digests.getIfPresent(tag);
    if (cached != null) {
      return cached;
    }
    String digest = registry.getDigest(repository, tag);
    digests.put(tag, digest);
    return digest;
  }
}
