package de.ialistannen.stevedore.cluster;

/**
 * Thrown when the cluster API could not be queried or refused a request.
 */
public class ClusterException extends Exception {

  public ClusterException(String message) {
    super(message);
  }

  public ClusterException(String message, Throwable cause) {
    super(message, cause);
  }
}
