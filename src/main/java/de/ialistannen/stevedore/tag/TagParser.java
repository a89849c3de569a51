package de.ialistannen.stevedore.tag;

import com.google.common.base.Strings;
import com.google.common.primitives.Ints;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.semver4j.Semver;
import org.semver4j.SemverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies image tags of the form {@code r22_0_1}, {@code r23_0_0_rc1}, {@code w_2021_13}, {@code d_2021_05_13} and
 * {@code exp_<anything>}, each optionally followed by a cycle ({@code _c0020.001} or {@code _csal0020.001}) and a
 * free-form remainder ({@code _20210513}).
 * <p>
 * The rules are tried top to bottom and the first full match wins. Release candidates <em>must</em> be tried before
 * releases, as {@code r23_0_0_rc1} is also a release {@code r23_0_0} with the remainder {@code rc1}.
 */
public final class TagParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(TagParser.class);

  /**
   * The tag a registry assumes if none is given.
   */
  public static final String DEFAULT_TAG = "latest";

  private static final String SUFFIXES = "(?:_(?<ctag>c|csal)(?<cycle>\\d+\\.\\d+))?(?:_(?<rest>.*))?";
  private static final String RELEASE = "r(?<major>\\d+)_(?<minor>\\d+)_(?<patch>\\d+)";
  private static final String RELEASE_CANDIDATE = RELEASE + "_rc(?<pre>\\d+)";

  private static final List<TagRule> RULES = List.of(
    new TagRule(
      TagKind.RELEASE_CANDIDATE,
      Pattern.compile(RELEASE_CANDIDATE + SUFFIXES),
      (tag, matcher) -> release(tag, TagKind.RELEASE_CANDIDATE, matcher)
    ),
    new TagRule(
      TagKind.RELEASE,
      Pattern.compile(RELEASE + SUFFIXES),
      (tag, matcher) -> release(tag, TagKind.RELEASE, matcher)
    ),
    // Obsolete format, e.g. r170. There are no new ones and they never have suffixes.
    new TagRule(
      TagKind.RELEASE,
      Pattern.compile("r(?<major>\\d\\d)(?<minor>\\d)"),
      TagParser::legacyRelease
    ),
    new TagRule(
      TagKind.WEEKLY,
      Pattern.compile("w_(?<year>\\d+)_(?<week>\\d+)" + SUFFIXES),
      TagParser::weekly
    ),
    new TagRule(
      TagKind.DAILY,
      Pattern.compile("d_(?<year>\\d+)_(?<month>\\d+)_(?<day>\\d+)" + SUFFIXES),
      TagParser::daily
    ),
    new TagRule(
      TagKind.EXPERIMENTAL,
      Pattern.compile("exp_(?<rest>.*)"),
      TagParser::experimental
    )
  );

  private TagParser() {
    throw new UnsupportedOperationException("No instantiation");
  }

  /**
   * Classifies a tag without any known aliases.
   *
   * @param tag the tag to classify
   * @return the classified tag
   * @see #parse(String, Set)
   */
  public static ClassifiedTag parse(String tag) {
    return parse(tag, Set.of());
  }

  /**
   * Classifies a tag. This never fails, tags that match no rule are {@link TagKind#UNKNOWN}.
   *
   * @param tag the tag to classify. An empty or null tag is treated as {@value #DEFAULT_TAG}
   * @param aliasTags tags that are aliases for other tags. These take precedence over all other rules.
   * @return the classified tag
   */
  public static ClassifiedTag parse(String tag, Set<String> aliasTags) {
    if (Strings.isNullOrEmpty(tag)) {
      tag = DEFAULT_TAG;
    }
    if (!tag.equals(tag.toLowerCase(Locale.ROOT))) {
      LOGGER.debug("Tag '{}' is not lower case, classifying it as unknown", tag);
      return unknown(tag);
    }
    if (aliasTags.contains(tag)) {
      return new ClassifiedTag(tag, TagKind.ALIAS, titleCase(tag), Optional.empty(), Optional.empty());
    }

    for (TagRule rule : RULES) {
      Matcher matcher = rule.pattern().matcher(tag);
      if (matcher.matches()) {
        ClassifiedTag result = rule.extractor().extract(tag, matcher);
        LOGGER.debug(
          "Classified '{}' as {}: '{}' | version {} | cycle {}",
          tag,
          result.kind(),
          result.displayName(),
          result.semanticVersion().map(Semver::getVersion).orElse("-"),
          result.cycle().map(String::valueOf).orElse("-")
        );
        return result;
      }
    }

    LOGGER.debug("Tag '{}' did not match any rule, classifying it as unknown", tag);
    return unknown(tag);
  }

  /**
   * Turns a (possibly underscore separated) tag into title case, e.g. {@code latest_weekly} into
   * {@code Latest Weekly}.
   *
   * @param tag the tag
   * @return the title cased tag
   */
  public static String titleCase(String tag) {
    String spaced = tag.replace('_', ' ');
    StringBuilder result = new StringBuilder(spaced.length());
    boolean previousWasLetter = false;
    for (char c : spaced.toCharArray()) {
      if (Character.isLetter(c)) {
        result.append(previousWasLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
        previousWasLetter = true;
      } else {
        result.append(c);
        previousWasLetter = false;
      }
    }
    return result.toString();
  }

  private static ClassifiedTag unknown(String tag) {
    return new ClassifiedTag(tag, TagKind.UNKNOWN, tag, Optional.empty(), Optional.empty());
  }

  private static ClassifiedTag release(String tag, TagKind kind, Matcher matcher) {
    String major = matcher.group("major");
    String minor = matcher.group("minor");
    String patch = matcher.group("patch");
    String preRelease = kind == TagKind.RELEASE_CANDIDATE ? "rc" + matcher.group("pre") : null;

    String versionName = "r" + number(major) + "." + number(minor) + "." + number(patch);
    if (preRelease != null) {
      versionName += "-" + preRelease;
    }

    return versioned(tag, kind, new VersionParts(major, minor, patch, preRelease), versionName, Suffix.of(matcher));
  }

  private static ClassifiedTag legacyRelease(String tag, Matcher matcher) {
    String major = matcher.group("major");
    String minor = matcher.group("minor");

    return versioned(
      tag,
      TagKind.RELEASE,
      new VersionParts(major, minor, "0", null),
      "r" + number(major) + "." + number(minor) + ".0",
      Suffix.NONE
    );
  }

  private static ClassifiedTag weekly(String tag, Matcher matcher) {
    String year = matcher.group("year");
    String week = matcher.group("week");

    // The display name keeps the original zero padding
    return versioned(
      tag,
      TagKind.WEEKLY,
      new VersionParts(year, week, "0", null),
      year + "_" + week,
      Suffix.of(matcher)
    );
  }

  private static ClassifiedTag daily(String tag, Matcher matcher) {
    String year = matcher.group("year");
    String month = matcher.group("month");
    String day = matcher.group("day");

    return versioned(
      tag,
      TagKind.DAILY,
      new VersionParts(year, month, day, null),
      year + "_" + month + "_" + day,
      Suffix.of(matcher)
    );
  }

  private static ClassifiedTag experimental(String tag, Matcher matcher) {
    // Experimental builds are usually named exp_<some other valid tag>
    ClassifiedTag inner = parse(matcher.group("rest"));

    return new ClassifiedTag(
      tag,
      TagKind.EXPERIMENTAL,
      "Experimental " + inner.displayName(),
      Optional.empty(),
      Optional.empty()
    );
  }

  private static ClassifiedTag versioned(
    String tag,
    TagKind kind,
    VersionParts parts,
    String versionName,
    Suffix suffix
  ) {
    String displayName = kind.title() + " " + versionName + suffix.displaySuffix();

    return new ClassifiedTag(
      tag,
      kind,
      displayName,
      parts.toSemver(tag, suffix.buildMetadata()),
      suffix.cycleNumber()
    );
  }

  private static String number(String digits) {
    Integer parsed = Ints.tryParse(digits);
    return parsed == null ? digits : parsed.toString();
  }

  @FunctionalInterface
  private interface Extractor {

    ClassifiedTag extract(String tag, Matcher matcher);
  }

  private record TagRule(TagKind kind, Pattern pattern, Extractor extractor) {

  }

  private record VersionParts(String major, String minor, String patch, String preRelease) {

    Optional<Semver> toSemver(String tag, String build) {
      Integer majorNumber = Ints.tryParse(major);
      Integer minorNumber = Ints.tryParse(minor);
      Integer patchNumber = Ints.tryParse(patch);
      if (majorNumber == null || minorNumber == null || patchNumber == null) {
        LOGGER.warn("Could not build a version for '{}', a component is out of range", tag);
        return Optional.empty();
      }

      String version = majorNumber + "." + minorNumber + "." + patchNumber;
      if (preRelease != null) {
        version += "-" + preRelease;
      }
      if (build != null) {
        version += "+" + build;
      }

      try {
        return Optional.of(new Semver(version));
      } catch (SemverException e) {
        LOGGER.warn("Could not build a version for '{}' from '{}'", tag, version, e);
        return Optional.empty();
      }
    }
  }

  /**
   * The optional cycle and free-form remainder following the version part of a tag.
   *
   * @param cyclePrefix {@code c} or {@code csal}, if a cycle is present
   * @param cycle the cycle and its build, e.g. {@code 0020.001}
   * @param rest the remainder
   */
  private record Suffix(String cyclePrefix, String cycle, String rest) {

    static final Suffix NONE = new Suffix(null, null, null);

    static Suffix of(Matcher matcher) {
      return new Suffix(matcher.group("ctag"), matcher.group("cycle"), matcher.group("rest"));
    }

    String displaySuffix() {
      String result = "";
      if (!Strings.isNullOrEmpty(cycle)) {
        result += "_" + cyclePrefix + cycle;
      }
      if (!Strings.isNullOrEmpty(rest)) {
        result += "_" + rest;
      }
      return result;
    }

    Optional<Integer> cycleNumber() {
      if (Strings.isNullOrEmpty(cycle)) {
        return Optional.empty();
      }
      return Optional.ofNullable(Ints.tryParse(cycle.substring(0, cycle.indexOf('.'))));
    }

    /**
     * @return the cycle and remainder as dot separated alphanumeric identifiers, or null if there are none
     */
    String buildMetadata() {
      String combined = Strings.nullToEmpty(rest);
      if (!Strings.isNullOrEmpty(cycle)) {
        // The cycle always precedes the remainder
        combined = combined.isEmpty() ? cyclePrefix + cycle : cyclePrefix + cycle + "_" + combined;
      }

      String build = Arrays.stream(combined.replace('_', '.').replaceAll("[^A-Za-z0-9.]", "").split("\\."))
        .filter(it -> !it.isEmpty())
        .collect(Collectors.joining("."));

      return build.isEmpty() ? null : build;
    }
  }
}
