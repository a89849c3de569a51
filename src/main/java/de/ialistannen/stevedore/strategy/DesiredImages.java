package de.ialistannen.stevedore.strategy;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * The images a strategy wants cached.
 *
 * @param priority the images to cache, most important first
 * @param all every image the strategy knows about, for display
 */
public record DesiredImages(
  @JsonProperty("images") List<DesiredImage> priority,
  @JsonProperty("all") List<DesiredImage> all
) {

  public static final DesiredImages EMPTY = new DesiredImages(List.of(), List.of());

  public DesiredImages {
    priority = ImmutableList.copyOf(priority);
    all = ImmutableList.copyOf(all);
  }
}
