package de.ialistannen.stevedore.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map.Entry;
import java.util.Optional;

/**
 * Credentials for a single registry, as stored in a docker config json.
 *
 * @param url the registry, e.g. {@code registry.hub.docker.com} or {@code https://index.docker.io/v1/}
 * @param encodedAuth the base64 encoded {@code username:password}
 */
public record DockerRegistryAuth(String url, String encodedAuth) {

  /**
   * Loads the docker authentications from a given config file.
   *
   * @param pathToConfig the path to the docker config
   * @return the stored authentications
   * @throws IOException if an error occurs
   */
  public static List<DockerRegistryAuth> loadAuthentications(Path pathToConfig) throws IOException {
    ObjectNode root = new ObjectMapper().readValue(Files.readString(pathToConfig), ObjectNode.class);

    JsonNode auths = root.get("auths");
    if (!(auths instanceof ObjectNode authsNode)) {
      return List.of();
    }
    return fromJson(authsNode);
  }

  /**
   * Extracts the stored registry authentications from the "auths" part of the config file.
   *
   * @param authsNode the auths node
   * @return the found docker registry authentications
   */
  private static List<DockerRegistryAuth> fromJson(ObjectNode authsNode) {
    List<DockerRegistryAuth> auths = new ArrayList<>();

    var iterator = authsNode.fields();
    while (iterator.hasNext()) {
      Entry<String, JsonNode> entry = iterator.next();
      JsonNode auth = entry.getValue().get("auth");
      // Entries can also only name a credential helper
      if (auth != null) {
        auths.add(new DockerRegistryAuth(entry.getKey(), auth.asText()));
      }
    }

    return auths;
  }

  /**
   * Finds the credentials for a registry host.
   *
   * @param auths all known credentials
   * @param host the registry host, optionally with a port
   * @return the credentials, if any
   */
  public static Optional<DockerRegistryAuth> forHost(List<DockerRegistryAuth> auths, String host) {
    return auths.stream()
      .filter(auth -> auth.matchesHost(host))
      .findFirst();
  }

  /**
   * @param host the registry host, optionally with a port
   * @return true if these credentials are meant for the given host
   */
  public boolean matchesHost(String host) {
    if (url.equalsIgnoreCase(host)) {
      return true;
    }
    try {
      URI uri = new URI(url.contains("://") ? url : "https://" + url);
      String dockerFormatHost = uri.getHost();
      if (uri.getPort() >= 0) {
        dockerFormatHost += ":" + uri.getPort();
      }
      return host.equalsIgnoreCase(dockerFormatHost);
    } catch (URISyntaxException e) {
      return false;
    }
  }

  /**
   * @return the username stored in these credentials
   */
  public String username() {
    String decoded = new String(Base64.getDecoder().decode(encodedAuth), StandardCharsets.UTF_8);
    int separator = decoded.indexOf(':');
    return separator < 0 ? decoded : decoded.substring(0, separator);
  }
}
