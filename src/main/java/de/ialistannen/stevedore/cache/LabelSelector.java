package de.ialistannen.stevedore.cache;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Objects;

/**
 * Selects nodes whose labels contain all given key/value pairs. An empty selector matches every node.
 *
 * @param labels the required labels
 */
public record LabelSelector(ImmutableMap<String, String> labels) {

  public static LabelSelector of(Map<String, String> labels) {
    return new LabelSelector(ImmutableMap.copyOf(labels));
  }

  /**
   * @param nodeLabels the labels of a node
   * @return true if every label of this selector is present with the same value
   */
  public boolean matches(Map<String, String> nodeLabels) {
    return labels.entrySet().stream()
      .allMatch(entry -> Objects.equals(nodeLabels.get(entry.getKey()), entry.getValue()));
  }

  @Override
  public String toString() {
    return labels.toString();
  }
}
