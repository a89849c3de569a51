package de.ialistannen.stevedore;

import com.google.common.base.Suppliers;
import com.google.devtools.artifactregistry.v1.ArtifactRegistryClient;
import de.ialistannen.stevedore.api.ManagementServer;
import de.ialistannen.stevedore.auth.DockerRegistryAuth;
import de.ialistannen.stevedore.cache.CacheIntersector;
import de.ialistannen.stevedore.cli.CliArguments;
import de.ialistannen.stevedore.cli.CliArgumentsParser;
import de.ialistannen.stevedore.cluster.Cluster;
import de.ialistannen.stevedore.cluster.KubernetesCluster;
import de.ialistannen.stevedore.cluster.PodInfo;
import de.ialistannen.stevedore.registry.DockerRegistry;
import de.ialistannen.stevedore.strategy.StrategyFactory;
import de.ialistannen.stevedore.target.TargetController;
import de.ialistannen.stevedore.target.TargetFactory;
import de.ialistannen.stevedore.target.TargetRegistry;
import de.ialistannen.stevedore.timing.Sleeper;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.apis.AppsV1Api;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.util.Config;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {

  private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

  private static final Path SERVICE_ACCOUNT_NAMESPACE = Path.of(
    "/var/run/secrets/kubernetes.io/serviceaccount/namespace"
  );
  private static final Duration DIGEST_LIFETIME = Duration.ofMinutes(5);

  public static void main(String[] args) throws IOException {
    CliArguments arguments = new CliArgumentsParser().parseOrExit(args);

    int port = arguments.port().orElse(8080);
    String basePath = arguments.basePath().orElse("/stevedore");
    Duration pollInterval = Duration.ofSeconds(arguments.pollIntervalSeconds().orElse(60));
    Duration pullSleep = Duration.ofSeconds(arguments.pullSleepSeconds().orElse(1200));
    if (pollInterval.isNegative() || pollInterval.isZero()) {
      throw die("Poll interval must be positive");
    }
    if (pullSleep.compareTo(pollInterval) <= 0) {
      LOGGER.warn("Pull jobs sleep for {} but targets only poll every {}", pullSleep, pollInterval);
    }

    HttpClient httpClient = HttpClient.newBuilder()
      .followRedirects(HttpClient.Redirect.NORMAL)
      .build();
    DockerRegistry dockerRegistry = new DockerRegistry(httpClient, authsFromArgs(arguments));
    Supplier<ArtifactRegistryClient> artifactRegistry = Suppliers.memoize(Main::createArtifactRegistryClient);
    StrategyFactory strategyFactory = new StrategyFactory(dockerRegistry, DIGEST_LIFETIME, artifactRegistry);

    Cluster cluster = buildCluster(arguments, pullSleep);
    CacheIntersector intersector = new CacheIntersector();

    TargetRegistry targetRegistry = new TargetRegistry(
      target -> new TargetController(target, cluster, intersector, pollInterval, Sleeper.THREAD_SLEEP)
    );

    ManagementServer server = new ManagementServer(
      port,
      basePath,
      targetRegistry,
      new TargetFactory(strategyFactory)
    );

    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      LOGGER.info("Shutting down");
      server.stop();
      try {
        targetRegistry.shutdown(Duration.ofSeconds(10));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }, "shutdown"));

    server.start();
  }

  private static ArtifactRegistryClient createArtifactRegistryClient() {
    LOGGER.info("Connecting to Google Artifact Registry");
    try {
      return ArtifactRegistryClient.create();
    } catch (IOException e) {
      throw new UncheckedIOException("Could not create artifact registry client", e);
    }
  }

  private static Cluster buildCluster(CliArguments arguments, Duration pullSleep) throws IOException {
    ApiClient apiClient;
    try {
      apiClient = Config.defaultClient();
    } catch (IOException e) {
      LOGGER.error("Could not connect to kubernetes", e);
      throw die("Could not connect to kubernetes");
    }

    String namespace = arguments.namespace().isPresent()
      ? arguments.namespace().get()
      : ownNamespace();
    LOGGER.info("Creating pull jobs in namespace '{}'", namespace);

    return new KubernetesCluster(
      new CoreV1Api(apiClient),
      new AppsV1Api(apiClient),
      namespace,
      arguments.pullSecret(),
      PodInfo.load(Path.of(arguments.podInfoPath().orElse("/etc/podinfo"))),
      pullSleep
    );
  }

  private static String ownNamespace() throws IOException {
    if (!Files.isReadable(SERVICE_ACCOUNT_NAMESPACE)) {
      return "default";
    }
    return Files.readString(SERVICE_ACCOUNT_NAMESPACE).strip();
  }

  private static RuntimeException die(String msg) {
    LOGGER.error(msg);
    System.exit(1);

    return new RuntimeException();
  }

  private static List<DockerRegistryAuth> authsFromArgs(CliArguments arguments) throws IOException {
    Path pathToFile = Path.of(arguments.dockerConfigPath().orElse("/etc/secrets/.dockerconfigjson"));

    if (!Files.exists(pathToFile)) {
      LOGGER.info("No docker config at '{}', accessing registries anonymously", pathToFile);
      return Collections.emptyList();
    }

    LOGGER.info("Loading auth from '{}'", pathToFile);
    return DockerRegistryAuth.loadAuthentications(pathToFile);
  }
}
