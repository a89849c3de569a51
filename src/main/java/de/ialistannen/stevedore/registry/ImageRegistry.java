package de.ialistannen.stevedore.registry;

import java.io.IOException;
import java.util.List;

/**
 * A registry images can be pulled from.
 */
public interface ImageRegistry {

  /**
   * Lists all tags in a repository.
   *
   * @param repository the repository
   * @return all tags, in the order the registry returned them
   * @throws IOException if an error occurs
   * @throws InterruptedException ?
   * @throws RegistryException if the registry refused the request
   */
  List<String> listTags(ImageRepository repository) throws IOException, InterruptedException;

  /**
   * Resolves a tag to the digest of its manifest.
   *
   * @param repository the repository
   * @param tag the tag
   * @return the digest, e.g. {@code sha256:abcdef...}
   * @throws IOException if an error occurs
   * @throws InterruptedException ?
   * @throws RegistryException if the registry refused the request
   */
  String getDigest(ImageRepository repository, String tag) throws IOException, InterruptedException;
}
