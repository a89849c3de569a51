package de.ialistannen.stevedore.registry;

/**
 * Thrown when a registry could not be queried, e.g. because authentication failed or it returned an unexpected
 * status.
 */
public class RegistryException extends RuntimeException {

  public RegistryException(String message) {
    super(message);
  }

  public RegistryException(String message, Throwable cause) {
    super(message, cause);
  }
}
