package de.ialistannen.stevedore.tag;

/**
 * Thrown when two tags have no meaningful order, e.g. because they are of a different {@link TagKind}.
 */
public class IncomparableTagException extends RuntimeException {

  public IncomparableTagException(String message) {
    super(message);
  }
}
