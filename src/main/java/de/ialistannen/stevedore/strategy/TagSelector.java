package de.ialistannen.stevedore.strategy;

import de.ialistannen.stevedore.cache.CachedImage;
import de.ialistannen.stevedore.tag.ClassifiedTag;
import de.ialistannen.stevedore.tag.TagKind;
import de.ialistannen.stevedore.tag.TagParser;
import de.ialistannen.stevedore.tag.TagRanking;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Picks the desired images out of the tags of one repository: the recommended tag first, followed by the other
 * aliases and the newest releases, weeklies and dailies. Shared by the strategies that differ only in where their tags
 * and digests come from.
 */
final class TagSelector {

  private final Set<String> aliases;
  private final int numReleases;
  private final int numWeeklies;
  private final int numDailies;
  private final Predicate<ClassifiedTag> cycleFilter;

  /**
   * @param aliases the recommended tag followed by the other alias tags
   * @param numReleases how many of the newest releases to select
   * @param numWeeklies how many of the newest weeklies to select
   * @param numDailies how many of the newest dailies to select
   * @param cycle only select versioned tags built for this cycle, if set
   */
  TagSelector(Set<String> aliases, int numReleases, int numWeeklies, int numDailies, Optional<Integer> cycle) {
    this.aliases = aliases;
    this.numReleases = numReleases;
    this.numWeeklies = numWeeklies;
    this.numDailies = numDailies;
    this.cycleFilter = cycle
      .<Predicate<ClassifiedTag>>map(it -> tag -> tag.hasCycle(it))
      .orElse(tag -> true);
  }

  /**
   * @param tags all tags of the repository, newest first
   * @param source resolves tags to image urls and digests
   * @param aliasAllowed whether an alias present in the tags may be selected
   * @param commonCache the images cached on all nodes, used to name aliases
   * @return the selected images
   * @throws IOException if a digest could not be resolved
   * @throws InterruptedException if interrupted while resolving a digest
   */
  DesiredImages select(
    List<String> tags,
    TagSource source,
    Predicate<String> aliasAllowed,
    List<CachedImage> commonCache
  ) throws IOException, InterruptedException {
    List<ClassifiedTag> classified = tags.stream()
      .map(tag -> TagParser.parse(tag, aliases))
      .toList();
    TagRanking ranking = TagRanking.of(classified);

    List<ClassifiedTag> versioned = new ArrayList<>();
    versioned.addAll(ranking.newest(TagKind.RELEASE, numReleases, cycleFilter));
    versioned.addAll(ranking.newest(TagKind.WEEKLY, numWeeklies, cycleFilter));
    versioned.addAll(ranking.newest(TagKind.DAILY, numDailies, cycleFilter));

    List<DesiredImage> versionedImages = new ArrayList<>();
    for (ClassifiedTag tag : versioned) {
      versionedImages.add(new DesiredImage(
        source.imageUrl(tag.rawTag()),
        source.digest(tag.rawTag()),
        tag.displayName()
      ));
    }

    List<DesiredImage> priority = new ArrayList<>();
    for (String alias : aliases) {
      if (!tags.contains(alias) || !aliasAllowed.test(alias)) {
        continue;
      }
      String digest = source.digest(alias);
      priority.add(new DesiredImage(
        source.imageUrl(alias),
        digest,
        aliasName(alias, digest, versionedImages, commonCache)
      ));
    }
    priority.addAll(versionedImages);

    List<DesiredImage> all = classified.stream()
      .filter(tag -> tag.kind() == TagKind.ALIAS || cycleFilter.test(tag))
      .map(tag -> new DesiredImage(source.imageUrl(tag.rawTag()), null, tag.rawTag()))
      .toList();

    return new DesiredImages(priority, all);
  }

  boolean matchesCycle(ClassifiedTag tag) {
    return cycleFilter.test(tag);
  }

  /**
   * Names an alias after the other tags pointing to the same image, e.g. {@code Recommended (Release r21.0.0)}. The
   * other tags are taken from the images selected this round and from the images already cached on the nodes, as
   * those were pulled by some tag.
   */
  private String aliasName(
    String alias,
    String digest,
    List<DesiredImage> versionedImages,
    List<CachedImage> commonCache
  ) {
    Set<String> alsoKnownAs = new LinkedHashSet<>();

    for (DesiredImage image : versionedImages) {
      if (digest.equals(image.digest())) {
        alsoKnownAs.add(image.displayName());
      }
    }
    for (CachedImage image : commonCache) {
      if (!digest.equals(image.digest())) {
        continue;
      }
      List<String> cachedTags = new ArrayList<>();
      cachedTags.add(image.imageUrl().substring(image.imageUrl().lastIndexOf(':') + 1));
      cachedTags.addAll(image.tags());

      for (String cachedTag : cachedTags) {
        ClassifiedTag classified = TagParser.parse(cachedTag, aliases);
        if (classified.kind() != TagKind.ALIAS && classified.kind() != TagKind.UNKNOWN) {
          alsoKnownAs.add(classified.displayName());
        }
      }
    }

    String name = TagParser.titleCase(alias);
    if (alsoKnownAs.isEmpty()) {
      return name;
    }
    return name + " (" + String.join(", ", alsoKnownAs) + ")";
  }

  /**
   * Where the tags of a repository point to.
   */
  interface TagSource {

    String imageUrl(String tag);

    String digest(String tag) throws IOException, InterruptedException;
  }
}
