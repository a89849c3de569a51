package de.ialistannen.stevedore.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.devtools.artifactregistry.v1.ArtifactRegistryClient;
import de.ialistannen.stevedore.registry.ImageRegistry;
import java.time.Duration;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Builds strategies from their JSON configuration. The {@code type} property selects the strategy.
 */
public class StrategyFactory {

  private final ObjectMapper objectMapper;
  private final Map<String, StrategyBuilder> builders;

  /**
   * @param registry the registry the registry tag strategy queries
   * @param digestLifetime how long resolved digests are reused
   * @param artifactRegistry the client the artifact registry strategy queries, created on first use
   */
  public StrategyFactory(
    ImageRegistry registry,
    Duration digestLifetime,
    Supplier<ArtifactRegistryClient> artifactRegistry
  ) {
    this.objectMapper = new ObjectMapper();
    this.builders = Map.of(
      RegistryTagStrategy.TYPE,
      config -> new RegistryTagStrategy(
        registry,
        objectMapper.treeToValue(config, RegistryTagStrategyConfig.class),
        digestLifetime
      ),
      ArtifactRegistryStrategy.TYPE,
      config -> new ArtifactRegistryStrategy(
        artifactRegistry,
        objectMapper.treeToValue(config, ArtifactRegistryStrategyConfig.class)
      )
    );
  }

  /**
   * @param config the strategy configuration, including its {@code type}
   * @return the built strategy
   * @throws UnknownStrategyException if the type is not known
   * @throws StrategyConfigurationException if the configuration is invalid
   */
  public DesiredImageStrategy create(ObjectNode config) {
    JsonNode typeNode = config.get("type");
    if (typeNode == null || !typeNode.isTextual()) {
      throw new StrategyConfigurationException("Strategy is missing its 'type'");
    }
    String type = typeNode.asText();

    StrategyBuilder builder = builders.get(type);
    if (builder == null) {
      throw new UnknownStrategyException(type);
    }

    try {
      return builder.build(config);
    } catch (JsonProcessingException e) {
      throw new StrategyConfigurationException(
        "Invalid configuration for strategy '" + type + "': " + e.getOriginalMessage(),
        e
      );
    }
  }

  @FunctionalInterface
  private interface StrategyBuilder {

    DesiredImageStrategy build(ObjectNode config) throws JsonProcessingException;
  }
}
