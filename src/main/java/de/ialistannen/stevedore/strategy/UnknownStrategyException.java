package de.ialistannen.stevedore.strategy;

/**
 * Thrown when a target names a strategy type that does not exist.
 */
public class UnknownStrategyException extends RuntimeException {

  public UnknownStrategyException(String type) {
    super("Unknown strategy type '" + type + "'");
  }
}
