package de.ialistannen.stevedore.cluster;

/**
 * Thrown when a pull job does not exist (anymore).
 */
public class PullJobNotFoundException extends ClusterException {

  public PullJobNotFoundException(String name) {
    super("Pull job '" + name + "' does not exist");
  }
}
