package de.ialistannen.stevedore.strategy;

/**
 * Thrown when the configuration of a strategy is invalid.
 */
public class StrategyConfigurationException extends RuntimeException {

  public StrategyConfigurationException(String message) {
    super(message);
  }

  public StrategyConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
