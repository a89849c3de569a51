package de.ialistannen.stevedore.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.ialistannen.stevedore.strategy.DesiredImage;
import java.util.List;

/**
 * A list of images together with every image the strategies know about.
 *
 * @param images the images
 * @param all every known image
 */
public record ImageListResponse(
  @JsonProperty("images") List<DesiredImage> images,
  @JsonProperty("all") List<DesiredImage> all
) {

}
