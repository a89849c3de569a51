package de.ialistannen.stevedore.target;

import com.fasterxml.jackson.databind.node.ObjectNode;
import de.ialistannen.stevedore.cache.LabelSelector;
import de.ialistannen.stevedore.strategy.DesiredImageStrategy;
import de.ialistannen.stevedore.strategy.StrategyConfigurationException;
import de.ialistannen.stevedore.strategy.StrategyFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Validates target definitions and builds their strategies.
 */
public class TargetFactory {

  // Target names become DaemonSet names, so they must be valid DNS labels
  private static final Pattern NAME_PATTERN = Pattern.compile("[a-z0-9]([-a-z0-9]*[a-z0-9])?");
  private static final int MAX_NAME_LENGTH = 63;

  private final StrategyFactory strategyFactory;

  public TargetFactory(StrategyFactory strategyFactory) {
    this.strategyFactory = strategyFactory;
  }

  /**
   * @param name the name of the target
   * @param labels the labels selecting the nodes
   * @param strategies the strategy configurations, in priority order
   * @return the built target
   * @throws InvalidTargetException if the definition is invalid
   * @throws de.ialistannen.stevedore.strategy.UnknownStrategyException if a strategy type is unknown
   */
  public Target create(String name, Map<String, String> labels, List<ObjectNode> strategies) {
    if (name == null || name.length() > MAX_NAME_LENGTH || !NAME_PATTERN.matcher(name).matches()) {
      throw new InvalidTargetException(
        "Target name must be a lowercase DNS label of at most " + MAX_NAME_LENGTH + " characters, got '" + name + "'"
      );
    }
    if (strategies == null || strategies.isEmpty()) {
      throw new InvalidTargetException("Target '" + name + "' needs at least one strategy");
    }
    Map<String, String> selectorLabels = labels == null ? Map.of() : labels;
    if (selectorLabels.entrySet().stream().anyMatch(it -> it.getKey() == null || it.getValue() == null)) {
      throw new InvalidTargetException("Labels of target '" + name + "' must not contain null");
    }

    List<DesiredImageStrategy> built = new ArrayList<>();
    for (ObjectNode config : strategies) {
      if (config == null) {
        throw new InvalidTargetException("Strategy of target '" + name + "' must be an object");
      }
      try {
        built.add(strategyFactory.create(config));
      } catch (StrategyConfigurationException e) {
        throw new InvalidTargetException(e.getMessage(), e);
      }
    }

    return new Target(name, LabelSelector.of(selectorLabels), built);
  }
}
