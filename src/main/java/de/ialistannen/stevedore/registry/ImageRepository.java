package de.ialistannen.stevedore.registry;

/**
 * A repository in a docker registry.
 *
 * @param host the registry host, optionally with a port, e.g. {@code registry.hub.docker.com}
 * @param name the repository name, e.g. {@code lsstsqre/sciplat-lab}
 */
public record ImageRepository(String host, String name) {

  /**
   * @param tag the tag
   * @return the full image url for the tag, e.g. {@code registry.hub.docker.com/lsstsqre/sciplat-lab:w_2021_13}
   */
  public String imageUrl(String tag) {
    return host + "/" + name + ":" + tag;
  }

  /**
   * @return the base url of the registry api, without a trailing slash
   */
  public String registryUrl() {
    return "https://" + host;
  }

  @Override
  public String toString() {
    return host + "/" + name;
  }
}
