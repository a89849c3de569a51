package de.ialistannen.stevedore.target;

public class TargetNotFoundException extends RuntimeException {

  public TargetNotFoundException(String name) {
    super("Target '" + name + "' does not exist");
  }
}
