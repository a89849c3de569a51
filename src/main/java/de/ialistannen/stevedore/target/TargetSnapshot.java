package de.ialistannen.stevedore.target;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import de.ialistannen.stevedore.cache.CachedImage;
import de.ialistannen.stevedore.strategy.DesiredImage;
import java.util.List;
import java.util.Map;

/**
 * The state of a target after its last poll.
 *
 * @param name the target name
 * @param labels the labels selecting the nodes of the target
 * @param commonCache the images cached on all nodes
 * @param available the desired images that are cached on all nodes
 * @param desired all desired images, in priority order
 * @param all every image the strategies know about
 * @param missing the desired images that still need to be pulled, in priority order
 * @param state whether a pull job is running
 */
public record TargetSnapshot(
  @JsonProperty("name") String name,
  @JsonProperty("labels") Map<String, String> labels,
  @JsonProperty("common_cache") List<CachedImage> commonCache,
  @JsonProperty("available") List<DesiredImage> available,
  @JsonProperty("desired") List<DesiredImage> desired,
  @JsonIgnore List<DesiredImage> all,
  @JsonProperty("missing") List<DesiredImage> missing,
  @JsonProperty("state") PullState state
) {

  public TargetSnapshot {
    commonCache = ImmutableList.copyOf(commonCache);
    available = ImmutableList.copyOf(available);
    desired = ImmutableList.copyOf(desired);
    all = ImmutableList.copyOf(all);
    missing = ImmutableList.copyOf(missing);
  }

  /**
   * @param target the target
   * @return the snapshot of a target that was never polled
   */
  public static TargetSnapshot initial(Target target) {
    return new TargetSnapshot(
      target.name(),
      target.selector().labels(),
      List.of(),
      List.of(),
      List.of(),
      List.of(),
      List.of(),
      PullState.IDLE
    );
  }
}
