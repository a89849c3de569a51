package de.ialistannen.stevedore.cluster;

import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Information about the pod this service runs in, as exposed by the kubernetes downward API. Pull jobs inherit the
 * labels and annotations and are owned by the pod, so they are cleaned up with it.
 *
 * @param labels the pod labels
 * @param annotations the pod annotations
 * @param name the pod name, if known
 * @param uid the pod uid, if known
 */
public record PodInfo(
  ImmutableMap<String, String> labels,
  ImmutableMap<String, String> annotations,
  Optional<String> name,
  Optional<String> uid
) {

  private static final Logger LOGGER = LoggerFactory.getLogger(PodInfo.class);

  public static final PodInfo EMPTY = new PodInfo(ImmutableMap.of(), ImmutableMap.of(), Optional.empty(), Optional.empty());

  /**
   * Reads the pod info from a downward API volume. Missing files are skipped.
   *
   * @param directory the directory containing the {@code labels}, {@code annotations}, {@code name} and {@code uid}
   *   files
   * @return the read info
   * @throws IOException if a file exists but could not be read
   */
  public static PodInfo load(Path directory) throws IOException {
    if (!Files.isDirectory(directory)) {
      LOGGER.warn("Pod info directory '{}' does not exist, pull jobs will not be owned by this pod", directory);
      return EMPTY;
    }

    return new PodInfo(
      readMap(directory.resolve("labels")),
      readMap(directory.resolve("annotations")),
      readValue(directory.resolve("name")),
      readValue(directory.resolve("uid"))
    );
  }

  /**
   * @return true if an owner reference can be built from this info
   */
  public boolean isOwnerKnown() {
    return name.isPresent() && uid.isPresent();
  }

  /**
   * Parses the downward API format, one {@code key="value"} pair per line.
   *
   * @param content the file content
   * @return the parsed pairs
   */
  static ImmutableMap<String, String> parseMap(String content) {
    Map<String, String> result = new LinkedHashMap<>();
    for (String line : content.split("\n")) {
      if (line.isBlank()) {
        continue;
      }
      int separator = line.indexOf('=');
      if (separator < 0) {
        LOGGER.warn("Skipping malformed pod info line '{}'", line);
        continue;
      }
      // Quotes are not allowed in labels or annotations
      result.put(line.substring(0, separator).strip(), line.substring(separator + 1).replace("\"", "").strip());
    }
    return ImmutableMap.copyOf(result);
  }

  private static ImmutableMap<String, String> readMap(Path file) throws IOException {
    return readValue(file).map(PodInfo::parseMap).orElse(ImmutableMap.of());
  }

  private static Optional<String> readValue(Path file) throws IOException {
    if (!Files.isRegularFile(file)) {
      LOGGER.debug("Pod info file '{}' does not exist", file);
      return Optional.empty();
    }
    return Optional.of(Files.readString(file).strip()).filter(it -> !it.isEmpty());
  }
}
