package de.ialistannen.stevedore.strategy;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An image that should be cached.
 *
 * @param imageUrl the image with its tag
 * @param digest the digest the cached image must have. Null if any digest is fine.
 * @param displayName a human-readable name for the image
 */
public record DesiredImage(
  @JsonProperty("image_url") String imageUrl,
  @JsonProperty("image_hash") String digest,
  @JsonProperty("name") String displayName
) {

}
