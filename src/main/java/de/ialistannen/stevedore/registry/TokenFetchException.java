package de.ialistannen.stevedore.registry;

public class TokenFetchException extends RegistryException {

  public TokenFetchException(String message) {
    super(message);
  }

  public TokenFetchException(String message, Throwable cause) {
    super(message, cause);
  }
}
