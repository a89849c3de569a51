package de.ialistannen.stevedore.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class StrategyFactoryTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final StrategyFactory factory = new StrategyFactory(
    new FakeImageRegistry(),
    Duration.ofMinutes(1),
    () -> {
      throw new AssertionError("Artifact registry client must only be created when polling");
    }
  );

  private ObjectNode json(String json) throws Exception {
    return objectMapper.readValue(json, ObjectNode.class);
  }

  @Test
  void buildsRegistryTagStrategy() throws Exception {
    DesiredImageStrategy strategy = factory.create(json("""
      {
        "type": "registry-tags",
        "repo": "lsstsqre/sciplat-lab",
        "recommended_tag": "recommended",
        "num_releases": 1,
        "num_weeklies": 2,
        "num_dailies": 3
      }
      """));

    assertThat(strategy).isInstanceOf(RegistryTagStrategy.class);
  }

  @Test
  void buildsArtifactRegistryStrategy() throws Exception {
    DesiredImageStrategy strategy = factory.create(json("""
      {
        "type": "google-artifact-registry",
        "project_id": "rubin-shared-services",
        "location": "us-central1",
        "gar_repository": "sciplat",
        "recommended_tag": "recommended",
        "num_releases": 1,
        "num_weeklies": 1,
        "num_dailies": 1
      }
      """));

    assertThat(strategy).isInstanceOf(ArtifactRegistryStrategy.class);
  }

  @Test
  void artifactRegistryStrategyNeedsItsRepository() {
    assertThatThrownBy(() -> factory.create(json("""
      {"type": "google-artifact-registry", "project_id": "p", "location": "l", "num_releases": 1,
       "num_weeklies": 1, "num_dailies": 1}
      """)))
      .isInstanceOf(StrategyConfigurationException.class)
      .hasMessageContaining("gar_repository");
  }

  @Test
  void unknownTypeIsRejected() {
    assertThatThrownBy(() -> factory.create(json("{\"type\": \"static-list\"}")))
      .isInstanceOf(UnknownStrategyException.class)
      .hasMessageContaining("static-list");
  }

  @Test
  void missingTypeIsRejected() {
    assertThatThrownBy(() -> factory.create(json("{\"repo\": \"lsstsqre/sciplat-lab\"}")))
      .isInstanceOf(StrategyConfigurationException.class);
  }

  @Test
  void missingRequiredValueIsRejected() {
    assertThatThrownBy(() -> factory.create(json("{\"type\": \"registry-tags\", \"repo\": \"lsstsqre/sciplat-lab\"}")))
      .isInstanceOf(StrategyConfigurationException.class)
      .hasMessageContaining("num_releases");
  }

  @Test
  void wronglyTypedValueIsRejected() {
    assertThatThrownBy(() -> factory.create(json("""
      {"type": "registry-tags", "repo": "lab", "num_releases": "many", "num_weeklies": 1, "num_dailies": 1}
      """)))
      .isInstanceOf(StrategyConfigurationException.class)
      .hasMessageContaining("registry-tags");
  }
}
