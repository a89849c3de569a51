package de.ialistannen.stevedore.tag;

import java.util.Optional;
import org.semver4j.Semver;

/**
 * An image tag together with everything the {@link TagParser} could extract from it.
 *
 * @param rawTag the tag as found in the registry, e.g. {@code w_2021_13}
 * @param kind the kind of the tag
 * @param displayName a human-readable name, e.g. {@code Weekly 2021_13}
 * @param semanticVersion the version, only present for dailies, weeklies, releases and release candidates
 * @param cycle the XML cycle of the image, if the tag names one
 */
public record ClassifiedTag(
  String rawTag,
  TagKind kind,
  String displayName,
  Optional<Semver> semanticVersion,
  Optional<Integer> cycle
) {

  /**
   * Compares this tag to another one. Tags of different kinds are never comparable, neither are two different alias
   * or unknown tags.
   *
   * @param other the tag to compare to
   * @return the result of the comparison
   */
  public TagComparison compare(ClassifiedTag other) {
    if (kind != other.kind) {
      return TagComparison.incomparable(
        "Tag '%s' of kind %s cannot be compared to '%s' of kind %s".formatted(rawTag, kind, other.rawTag, other.kind)
      );
    }
    if (semanticVersion.isPresent() && other.semanticVersion.isPresent()) {
      return TagComparison.ordered(
        withoutBuild(semanticVersion.get()).compareTo(withoutBuild(other.semanticVersion.get()))
      );
    }
    if (kind == TagKind.EXPERIMENTAL) {
      return TagComparison.ordered(rawTag.compareTo(other.rawTag));
    }
    // Aliases, unknown tags and versioned kinds whose numbers did not fit into a version
    if (rawTag.equals(other.rawTag)) {
      return TagComparison.ordered(0);
    }
    return TagComparison.incomparable("Tag '%s' cannot be compared to '%s'".formatted(rawTag, other.rawTag));
  }

  /**
   * @param other the other tag
   * @return {@link #compare(ClassifiedTag)} as an int
   * @throws IncomparableTagException if the tags are incomparable
   */
  public int compareOrThrow(ClassifiedTag other) {
    return compare(other).orElseThrow();
  }

  /**
   * @param other the other tag
   * @return true if this tag is strictly newer than the other one
   * @throws IncomparableTagException if the tags are incomparable
   */
  public boolean isNewerThan(ClassifiedTag other) {
    return compareOrThrow(other) > 0;
  }

  /**
   * @param other the other tag
   * @return true if this tag is strictly older than the other one
   * @throws IncomparableTagException if the tags are incomparable
   */
  public boolean isOlderThan(ClassifiedTag other) {
    return compareOrThrow(other) < 0;
  }

  /**
   * @param other the other tag
   * @return true if both tags denote the same version
   * @throws IncomparableTagException if the tags are incomparable
   */
  public boolean isSameVersion(ClassifiedTag other) {
    return compareOrThrow(other) == 0;
  }

  /**
   * @param wantedCycle the cycle to check for
   * @return true if this tag has the given cycle
   */
  public boolean hasCycle(int wantedCycle) {
    return cycle.map(it -> it == wantedCycle).orElse(false);
  }

  private static Semver withoutBuild(Semver version) {
    // Build metadata does not take part in precedence
    StringBuilder result = new StringBuilder()
      .append(version.getMajor())
      .append('.')
      .append(version.getMinor())
      .append('.')
      .append(version.getPatch());
    if (!version.getPreRelease().isEmpty()) {
      result.append('-').append(String.join(".", version.getPreRelease()));
    }
    return new Semver(result.toString());
  }
}
