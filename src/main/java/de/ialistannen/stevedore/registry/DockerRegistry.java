package de.ialistannen.stevedore.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import de.ialistannen.stevedore.auth.DockerRegistryAuth;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists tags and fetches digests using the v2 registry API. Registries answering with a {@code 401} are authenticated
 * against once (Basic or Bearer) and the request is retried.
 */
public class DockerRegistry implements ImageRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(DockerRegistry.class);

  private static final Pattern REALM_PATTERN = Pattern.compile("realm=\"(.+?)\"");
  private static final Pattern SERVICE_PATTERN = Pattern.compile("service=\"(.+?)\"");
  private static final Pattern SCOPE_PATTERN = Pattern.compile("scope=\"(.+?)\"");
  private static final Pattern NEXT_LINK_PATTERN = Pattern.compile("<(.+?)>\\s*;\\s*rel=\"?next\"?");

  private static final List<String> MANIFEST_TYPES = List.of(
    "application/vnd.docker.distribution.manifest.list.v2+json",
    "application/vnd.docker.distribution.manifest.v2+json",
    "application/vnd.docker.distribution.manifest.v1+json",
    "application/vnd.oci.image.index.v1+json",
    "application/vnd.oci.image.manifest.v1+json"
  );

  private final HttpClient client;
  private final ObjectMapper objectMapper;
  private final List<DockerRegistryAuth> registryAuths;
  private final Cache<ImageRepository, String> authHeaders;

  public DockerRegistry(HttpClient client, List<DockerRegistryAuth> registryAuths) {
    this(client, registryAuths, Duration.ofSeconds(240));
  }

  /**
   * @param client the client to use
   * @param registryAuths all known registry credentials
   * @param authLifetime how long obtained authorization headers are reused. Docker hub tokens live 300 seconds.
   */
  public DockerRegistry(HttpClient client, List<DockerRegistryAuth> registryAuths, Duration authLifetime) {
    this.client = client;
    this.registryAuths = registryAuths;

    this.objectMapper = new ObjectMapper();
    this.authHeaders = Caffeine.newBuilder()
      .expireAfterWrite(authLifetime)
      .build();
  }

  @Override
  public List<String> listTags(ImageRepository repository) throws IOException, InterruptedException {
    LOGGER.debug("Listing tags for '{}'", repository);

    List<String> tags = new ArrayList<>();
    Set<URI> visited = new HashSet<>();
    URI nextPage = URI.create(repository.registryUrl() + "/v2/%s/tags/list".formatted(repository.name()));

    while (nextPage != null) {
      URI page = nextPage;
      if (!visited.add(page)) {
        LOGGER.warn("Registry for '{}' links back to already fetched page {}, stopping", repository, page);
        break;
      }
      HttpResponse<String> response = send(
        repository,
        auth -> withAuth(HttpRequest.newBuilder(page).GET(), auth).build(),
        BodyHandlers.ofString()
      );
      if (response.statusCode() != 200) {
        LOGGER.info(
          "Failed to list tags for '{}' ({}): {}",
          repository,
          response.statusCode(),
          response.body()
        );
        throw new RegistryException(
          "Error listing tags for '" + repository + "', got status code " + response.statusCode()
        );
      }

      LOGGER.debug("Received tag page: '{}'", response.body());
      JsonNode tagsNode = objectMapper.readValue(response.body(), ObjectNode.class).get("tags");
      if (tagsNode != null) {
        tagsNode.forEach(tag -> tags.add(tag.asText()));
      }

      nextPage = nextPage(page, response).orElse(null);
    }

    return tags;
  }

  /**
   * Fetches the image digest for a given tag. The digest is taken from the received HEADER, as that does not seem to
   * count against the API request limit.
   * <p>
   * The manifest digest is NOT the image ID, but can be found in the local image manifest as "{@code RepoDigests}".
   */
  @Override
  public String getDigest(ImageRepository repository, String tag) throws IOException, InterruptedException {
    LOGGER.debug("Fetching digest for '{}':'{}'", repository, tag);

    URI url = URI.create(repository.registryUrl() + "/v2/%s/manifests/%s".formatted(repository.name(), tag));

    HttpResponse<Void> response = send(
      repository,
      auth -> {
        HttpRequest.Builder builder = HttpRequest.newBuilder(url).method("HEAD", BodyPublishers.noBody());
        // We compare manifest digests, so this must be the same the container runtime uses.
        for (String type : MANIFEST_TYPES) {
          builder.header("Accept", type);
        }
        return withAuth(builder, auth).build();
      },
      BodyHandlers.discarding()
    );

    if (response.statusCode() != 200) {
      LOGGER.info("Failed to fetch image digest for '{}':'{}' ({})", repository, tag, response.statusCode());
      throw new DigestFetchException(repository.imageUrl(tag), response.statusCode());
    }
    return response.headers()
      .firstValue("docker-content-digest")
      .orElseThrow(() -> new DigestFetchException("No digest header for '" + repository.imageUrl(tag) + "'"));
  }

  /**
   * Sends a request, authenticating and retrying exactly once if the registry asks for it.
   *
   * @param repository the repository the request is for
   * @param requestFactory builds the request from the authorization header to use, if any
   * @param bodyHandler the body handler
   * @return the response of the last attempt
   */
  private <T> HttpResponse<T> send(
    ImageRepository repository,
    Function<Optional<String>, HttpRequest> requestFactory,
    HttpResponse.BodyHandler<T> bodyHandler
  ) throws IOException, InterruptedException {
    Optional<String> cachedAuth = Optional.ofNullable(authHeaders.getIfPresent(repository));

    HttpRequest request = requestFactory.apply(cachedAuth);
    LOGGER.debug("Sending request to {} ({})", request.uri(), request.method());
    HttpResponse<T> response = client.send(request, bodyHandler);

    if (response.statusCode() != 401) {
      return response;
    }

    LOGGER.debug("Got challenged by {}: {}", request.uri(), response.headers().map());
    String authHeader = getAuthHeader(repository, response);
    authHeaders.put(repository, authHeader);

    return client.send(requestFactory.apply(Optional.of(authHeader)), bodyHandler);
  }

  /**
   * Returns the value of the {@code "Authorization"} header to use for communicating with a registry.
   *
   * @param repository the repository to get it for
   * @param challengeResponse the response containing the challenge
   * @return the header
   * @throws IOException if an error occurs
   * @throws InterruptedException ?
   * @throws TokenFetchException if fetching failed
   */
  private String getAuthHeader(ImageRepository repository, HttpResponse<?> challengeResponse)
    throws IOException, InterruptedException {
    String header = challengeResponse.headers()
      .firstValue("www-authenticate")
      .orElseThrow(() -> new TokenFetchException("Could not find www-authenticate header"));

    LOGGER.debug("Received header: '{}'", header);

    String challengeType = header.strip().split("\\s+", 2)[0].toLowerCase(Locale.ROOT);

    if (challengeType.equals("basic")) {
      LOGGER.info("Authenticating to '{}' with basic auth", repository.host());
      return "Basic " + getAuthForRegistry(repository.host())
        .map(DockerRegistryAuth::encodedAuth)
        .orElseThrow(() -> new TokenFetchException("Did not have credentials for '" + repository.host() + "'"));
    }
    if (!challengeType.equals("bearer")) {
      throw new TokenFetchException("Unknown challenge type: '" + header + "'");
    }

    String realm = getFromAuthenticateHeader(header, REALM_PATTERN)
      .orElseThrow(() -> new TokenFetchException("Could not find realm in header '" + header + "'"));
    String service = getFromAuthenticateHeader(header, SERVICE_PATTERN).orElse(repository.host());
    String scope = getFromAuthenticateHeader(header, SCOPE_PATTERN)
      .orElse("repository:" + repository.name() + ":pull");

    URI authUrl = URI.create(
      realm + "?service=" + urlEncode(service) + "&scope=" + urlEncode(scope)
    );
    LOGGER.debug("Built auth URL '{}' for '{}'", authUrl, repository);

    return getBearerHeader(authUrl, repository.host());
  }

  private String getBearerHeader(URI authUrl, String host) throws IOException, InterruptedException {
    var requestBuilder = HttpRequest.newBuilder(authUrl).GET();
    Optional<DockerRegistryAuth> auth = getAuthForRegistry(host);
    auth.ifPresent(it -> requestBuilder.header("Authorization", "Basic " + it.encodedAuth()));

    LOGGER.info(
      "Obtaining bearer token for '{}' {}",
      host,
      auth.map(it -> "as '" + it.username() + "'").orElse("anonymously")
    );

    HttpResponse<String> response = client.send(requestBuilder.build(), BodyHandlers.ofString());
    if (response.statusCode() != 200) {
      LOGGER.error(
        "Unsuccessful request to registry at {} with status {}. Body: {}, header: {}",
        authUrl, response.statusCode(), response.body(), response.headers().map()
      );
      throw new TokenFetchException("Could not fetch token as response returned status " + response.statusCode());
    }
    String body = response.body();
    ObjectNode root;
    try {
      root = objectMapper.readValue(body, ObjectNode.class);
    } catch (JsonProcessingException e) {
      LOGGER.error("Registry auth response at {} is no json object: {}", authUrl, body);
      throw new TokenFetchException("Could not fetch token as response is not a json object", e);
    }
    JsonNode tokenNode = root.has("token") ? root.get("token") : root.get("access_token");
    if (tokenNode == null) {
      LOGGER.error(
        "Weird response to registry auth request at {} with status {}. Body: {}, header: {}",
        authUrl, response.statusCode(), body, response.headers().map()
      );
      throw new TokenFetchException("Could not fetch token as response does not contain a valid token");
    }

    return "Bearer " + tokenNode.asText();
  }

  private Optional<DockerRegistryAuth> getAuthForRegistry(String host) {
    return DockerRegistryAuth.forHost(registryAuths, host);
  }

  private static Optional<URI> nextPage(URI currentPage, HttpResponse<?> response) {
    return response.headers()
      .firstValue("link")
      .map(NEXT_LINK_PATTERN::matcher)
      .filter(Matcher::find)
      // Registries usually send a path relative to the registry root
      .map(matcher -> currentPage.resolve(matcher.group(1)));
  }

  private static HttpRequest.Builder withAuth(HttpRequest.Builder builder, Optional<String> authHeader) {
    builder.header("User-Agent", "Stevedore");
    authHeader.ifPresent(header -> builder.header("Authorization", header));
    return builder;
  }

  private static Optional<String> getFromAuthenticateHeader(String input, Pattern regex) {
    Matcher matcher = regex.matcher(input);
    if (!matcher.find()) {
      return Optional.empty();
    }
    return Optional.of(matcher.group(1));
  }

  private static String urlEncode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
