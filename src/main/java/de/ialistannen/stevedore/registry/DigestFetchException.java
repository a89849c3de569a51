package de.ialistannen.stevedore.registry;

public class DigestFetchException extends RegistryException {

  public DigestFetchException(String imageTag, int statusCode) {
    super("Error fetching digest for '" + imageTag + "', got status code " + statusCode);
  }

  public DigestFetchException(String message) {
    super(message);
  }
}
