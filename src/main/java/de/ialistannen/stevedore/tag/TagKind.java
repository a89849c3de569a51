package de.ialistannen.stevedore.tag;

import java.util.Locale;

/**
 * The kinds of image tags the {@link TagParser} can recognize.
 */
public enum TagKind {
  DAILY,
  WEEKLY,
  RELEASE,
  RELEASE_CANDIDATE,
  EXPERIMENTAL,
  ALIAS,
  UNKNOWN;

  /**
   * @return the human-readable name of this kind, e.g. {@code "Release Candidate"}
   */
  public String title() {
    return TagParser.titleCase(name().toLowerCase(Locale.ROOT));
  }

  /**
   * @return true if tags of this kind carry a semantic version
   */
  public boolean hasSemanticVersion() {
    return this == DAILY || this == WEEKLY || this == RELEASE || this == RELEASE_CANDIDATE;
  }

  /**
   * @return true if any two tags of this kind can be ordered
   */
  public boolean isOrderable() {
    return hasSemanticVersion() || this == EXPERIMENTAL;
  }
}
