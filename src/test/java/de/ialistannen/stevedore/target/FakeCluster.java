package de.ialistannen.stevedore.target;

import de.ialistannen.stevedore.cache.ClusterNode;
import de.ialistannen.stevedore.cache.LabelSelector;
import de.ialistannen.stevedore.cluster.Cluster;
import de.ialistannen.stevedore.cluster.PullJobNotFoundException;
import de.ialistannen.stevedore.cluster.PullJobSpec;
import de.ialistannen.stevedore.cluster.PullJobStatus;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An in-memory cluster. A pull job reports itself as running on its first status check and pulls its image onto all
 * schedulable matching nodes on the second one.
 */
class FakeCluster implements Cluster {

  private final List<ClusterNode> nodes = new ArrayList<>();
  private final Map<String, String> registryDigests = new HashMap<>();
  private final Map<String, PullJobSpec> jobs = new LinkedHashMap<>();
  private final Map<String, Integer> statusChecks = new HashMap<>();
  private final List<PullJobSpec> created = new ArrayList<>();
  private final List<String> deleted = new ArrayList<>();

  FakeCluster node(String name, Map<String, String> labels, boolean unschedulable, String... images) {
    List<List<String>> groups = new ArrayList<>();
    for (String image : images) {
      groups.add(nameGroup(image));
    }
    nodes.add(new ClusterNode(name, labels, unschedulable, List.of(), groups));
    return this;
  }

  /**
   * Declares the digest pulling an image url will result in.
   */
  FakeCluster digest(String imageUrl, String digest) {
    registryDigests.put(imageUrl, digest);
    return this;
  }

  /**
   * Adds a job that was not created through this fake, e.g. by a previous run.
   */
  void existingJob(PullJobSpec spec) {
    jobs.put(spec.name(), spec);
  }

  void removeJobs() {
    jobs.clear();
  }

  List<PullJobSpec> created() {
    return created;
  }

  List<String> deleted() {
    return deleted;
  }

  boolean hasJob(String name) {
    return jobs.containsKey(name);
  }

  private List<String> nameGroup(String imageUrl) {
    String repository = imageUrl.substring(0, imageUrl.lastIndexOf(':'));
    String digest = registryDigests.getOrDefault(imageUrl, "sha256:" + imageUrl.hashCode());
    return new ArrayList<>(List.of(repository + "@" + digest, imageUrl));
  }

  @Override
  public synchronized List<ClusterNode> listNodes() {
    List<ClusterNode> copy = new ArrayList<>();
    for (ClusterNode node : nodes) {
      List<List<String>> groups = new ArrayList<>();
      node.imageNameGroups().forEach(group -> groups.add(List.copyOf(group)));
      copy.add(new ClusterNode(node.name(), node.labels(), node.unschedulable(), node.taints(), groups));
    }
    return copy;
  }

  @Override
  public synchronized void createPullJob(PullJobSpec spec) {
    if (jobs.containsKey(spec.name())) {
      throw new IllegalStateException("Job " + spec.name() + " already exists");
    }
    jobs.put(spec.name(), spec);
    created.add(spec);
  }

  @Override
  public synchronized PullJobStatus pullJobStatus(String name) throws PullJobNotFoundException {
    PullJobSpec spec = jobs.get(name);
    if (spec == null) {
      throw new PullJobNotFoundException(name);
    }
    List<ClusterNode> targets = nodes.stream()
      .filter(node -> LabelSelector.of(spec.nodeSelector()).matches(node.labels()))
      .filter(ClusterNode::acceptsPullJobs)
      .toList();

    int checks = statusChecks.merge(name, 1, Integer::sum);
    if (checks < 2) {
      return new PullJobStatus(spec.imageUrl(), targets.size(), 0);
    }

    List<String> group = nameGroup(spec.imageUrl());
    for (ClusterNode node : targets) {
      if (!node.imageNameGroups().contains(group)) {
        node.imageNameGroups().add(group);
      }
    }
    return new PullJobStatus(spec.imageUrl(), targets.size(), targets.size());
  }

  @Override
  public synchronized void deletePullJob(String name) {
    jobs.remove(name);
    statusChecks.remove(name);
    deleted.add(name);
  }
}
