package de.ialistannen.stevedore.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Map;

/**
 * The body of a request creating or replacing a target.
 *
 * @param name the name of the target
 * @param labels the labels selecting its nodes
 * @param strategies the strategy configurations, each with its {@code type}
 */
public record TargetRequest(
  @JsonProperty("name") String name,
  @JsonProperty("labels") Map<String, String> labels,
  @JsonProperty("strategies") List<ObjectNode> strategies
) {

}
