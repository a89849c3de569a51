package de.ialistannen.stevedore.cache;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableSet;

/**
 * An image that is present on a node (or on all nodes of a target).
 *
 * @param imageUrl the image with its tag, e.g. {@code registry.hub.docker.com/lsstsqre/sciplat-lab:recommended}
 * @param digest the digest of the image, e.g. {@code sha256:be4...}
 * @param tags the <em>other</em> tags the same digest is known by in this repository
 */
public record CachedImage(
  @JsonProperty("image_url") String imageUrl,
  @JsonProperty("image_hash") String digest,
  @JsonProperty("tags") ImmutableSet<String> tags
) {

  /**
   * @param imageUrl the image url to check
   * @param digest the digest to check. Null matches any digest.
   * @return true if this image has the given url and digest
   */
  public boolean matches(String imageUrl, String digest) {
    return this.imageUrl.equals(imageUrl) && (digest == null || digest.equals(this.digest));
  }

  /**
   * @param other the other image
   * @return true if both images have the same url and digest
   */
  public boolean isSameImage(CachedImage other) {
    return imageUrl.equals(other.imageUrl) && digest.equals(other.digest);
  }
}
