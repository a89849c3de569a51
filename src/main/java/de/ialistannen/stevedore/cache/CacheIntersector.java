package de.ialistannen.stevedore.cache;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the images that are cached on <em>every</em> node matching a label selector.
 */
public class CacheIntersector {

  private static final Logger LOGGER = LoggerFactory.getLogger(CacheIntersector.class);

  private static final Set<String> PLACEHOLDER_NAMES = Set.of("<none>@<none>", "<none>:<none>");

  /**
   * Intersects the image caches of all nodes matching the selector.
   *
   * @param nodes all nodes in the cluster
   * @param selector the selector nodes must match
   * @return all images present with the same url and digest on every matching node. Empty if no node matches.
   */
  public List<CachedImage> intersect(List<ClusterNode> nodes, LabelSelector selector) {
    List<CachedImage> commonCache = null;

    for (ClusterNode node : nodes) {
      if (!selector.matches(node.labels())) {
        LOGGER.debug("Node '{}' with labels {} does not match {}", node.name(), node.labels(), selector);
        continue;
      }
      if (!node.acceptsPullJobs()) {
        LOGGER.debug("Node '{}' matches {} but will not receive pull jobs", node.name(), selector);
      }

      List<CachedImage> nodeImages = imagesOnNode(node);
      LOGGER.debug("Node '{}' has {} cached images", node.name(), nodeImages.size());

      commonCache = commonCache == null ? nodeImages : retainCommon(commonCache, nodeImages);
    }

    if (commonCache == null) {
      return List.of();
    }
    return ImmutableList.copyOf(commonCache);
  }

  private static List<CachedImage> retainCommon(List<CachedImage> commonCache, List<CachedImage> nodeImages) {
    List<CachedImage> result = new ArrayList<>();

    for (CachedImage common : commonCache) {
      for (CachedImage nodeImage : nodeImages) {
        if (!common.isSameImage(nodeImage)) {
          continue;
        }
        // Different nodes may have pulled the image by different tags
        Set<String> tags = new LinkedHashSet<>(common.tags());
        tags.addAll(nodeImage.tags());
        result.add(new CachedImage(common.imageUrl(), common.digest(), ImmutableSet.copyOf(tags)));
      }
    }

    return result;
  }

  private static List<CachedImage> imagesOnNode(ClusterNode node) {
    List<CachedImage> images = new ArrayList<>();
    for (List<String> names : node.imageNameGroups()) {
      images.addAll(imagesForGroup(node.name(), names));
    }
    return images;
  }

  /**
   * Converts the names of a single image to cached images. An image is known by one {@code repository@digest} name
   * and any number of {@code repository:tag} names per repository it was pulled from.
   */
  private static List<CachedImage> imagesForGroup(String nodeName, List<String> names) {
    Map<String, RepositoryEntry> entries = new LinkedHashMap<>();

    for (String name : names) {
      if (PLACEHOLDER_NAMES.contains(name)) {
        continue;
      }
      int digestSeparator = name.indexOf('@');
      if (digestSeparator >= 0) {
        entries.computeIfAbsent(name.substring(0, digestSeparator), ignored -> new RepositoryEntry())
          .digest = name.substring(digestSeparator + 1);
        continue;
      }

      Optional<Integer> tagSeparator = tagSeparator(name);
      if (tagSeparator.isEmpty()) {
        LOGGER.warn("Image name '{}' on node '{}' has neither tag nor digest, ignoring it", name, nodeName);
        continue;
      }
      entries.computeIfAbsent(name.substring(0, tagSeparator.get()), ignored -> new RepositoryEntry())
        .tags
        .add(name.substring(tagSeparator.get() + 1));
    }

    List<CachedImage> images = new ArrayList<>();
    for (Map.Entry<String, RepositoryEntry> entry : entries.entrySet()) {
      RepositoryEntry repositoryEntry = entry.getValue();
      if (repositoryEntry.digest == null && !repositoryEntry.tags.isEmpty()) {
        LOGGER.warn(
          "Image group {} on node '{}' has tags for '{}' but no digest, skipping the group",
          names,
          nodeName,
          entry.getKey()
        );
        return List.of();
      }

      for (String tag : repositoryEntry.tags) {
        Set<String> otherTags = new LinkedHashSet<>(repositoryEntry.tags);
        otherTags.remove(tag);
        images.add(new CachedImage(
          entry.getKey() + ":" + tag,
          repositoryEntry.digest,
          ImmutableSet.copyOf(otherTags)
        ));
      }
    }

    return images;
  }

  /**
   * Finds the colon separating repository and tag. Registry hosts may carry a port ({@code host:5000/repo:tag}), so
   * only a colon after the last slash counts.
   */
  private static Optional<Integer> tagSeparator(String name) {
    int lastColon = name.lastIndexOf(':');
    if (lastColon < 0 || lastColon < name.lastIndexOf('/')) {
      return Optional.empty();
    }
    return Optional.of(lastColon);
  }

  private static class RepositoryEntry {

    private String digest;
    private final Set<String> tags = new LinkedHashSet<>();
  }
}
