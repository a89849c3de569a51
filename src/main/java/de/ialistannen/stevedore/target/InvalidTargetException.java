package de.ialistannen.stevedore.target;

/**
 * Thrown when a target definition is invalid.
 */
public class InvalidTargetException extends RuntimeException {

  public InvalidTargetException(String message) {
    super(message);
  }

  public InvalidTargetException(String message, Throwable cause) {
    super(message, cause);
  }
}
