package de.ialistannen.stevedore.cache;

import java.util.List;
import java.util.Map;

/**
 * The parts of a cluster node relevant for caching.
 *
 * @param name the name of the node
 * @param labels the node labels
 * @param unschedulable whether the node is cordoned
 * @param taints the taints of the node
 * @param imageNameGroups one entry per image on the node, each listing all names the image is known by. A name is
 *   either {@code repository@digest} or {@code repository:tag}.
 */
public record ClusterNode(
  String name,
  Map<String, String> labels,
  boolean unschedulable,
  List<Taint> taints,
  List<List<String>> imageNameGroups
) {

  /**
   * @return true if a pull job without tolerations can be scheduled on this node
   */
  public boolean acceptsPullJobs() {
    return !unschedulable && taints.stream().noneMatch(Taint::preventsScheduling);
  }

  public record Taint(String key, String value, String effect) {

    public boolean preventsScheduling() {
      return "NoSchedule".equals(effect) || "NoExecute".equals(effect);
    }
  }
}
