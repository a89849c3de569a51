package de.ialistannen.stevedore.target;

import com.google.common.collect.ImmutableList;
import de.ialistannen.stevedore.cache.LabelSelector;
import de.ialistannen.stevedore.strategy.DesiredImageStrategy;
import java.util.List;

/**
 * A set of nodes that should cache the images some strategies want.
 *
 * @param name the unique name of the target. Also the name of its pull job.
 * @param selector selects the nodes of this target
 * @param strategies the strategies, in priority order
 */
public record Target(String name, LabelSelector selector, List<DesiredImageStrategy> strategies) {

  public Target {
    strategies = ImmutableList.copyOf(strategies);
  }
}
