/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Utility class for loading streaming configuration from YAML files. Parses aggregation
 * configurations and parameters.
 */
public class ConfigLoader {
  /**
   * Loads streaming configuration from a YAML file.
   *
   * @param configFilePath path to the YAML configuration file
   * @return parsed streaming configuration
   * @throws IOException if file reading or parsing fails
   */
  public static StreamingConfig loadConfig(String configFilePath) throws IOException {
    String yamlContent =
        new String(Files.readAllBytes(Paths.get(configFilePath)), StandardCharsets.UTF_8);
    return parseConfig(yamlContent);
  }

  /**
   * Parses streaming configuration from YAML text.
   *
   * @param yamlContent the YAML document
   * @return parsed streaming configuration
   * @throws IOException if the text is not valid YAML
   * @throws IllegalArgumentException if a required field is missing
   */
  public static StreamingConfig parseConfig(String yamlContent) throws IOException {
    ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    JsonNode rootNode = mapper.readTree(yamlContent);
    if (rootNode == null || !rootNode.has("aggregations")) {
      throw new IllegalArgumentException("Configuration has no 'aggregations' list");
    }

    List<AggregationConfig> aggregationConfigs = new ArrayList<>();
    for (JsonNode node : rootNode.get("aggregations")) {
      AggregationConfig config = new AggregationConfig();
      config.aggregationId = required(node, "aggregationId").asInt();
      config.aggregationType = required(node, "aggregationType").asText();
      config.aggregationSubType = required(node, "aggregationSubType").asText();
      config.aggregationPackage = node.path("aggregationPackage").asText("aggregates");

      Map<String, String> parameters = new HashMap<>();
      if (node.has("parameters")) {
        node.get("parameters")
            .fields()
            .forEachRemaining(entry -> parameters.put(entry.getKey(), entry.getValue().asText()));
      }
      config.parameters = parameters;

      config.tumblingWindowSize = required(node, "tumblingWindowSize").asInt();
      if (node.hasNonNull("statistic")) {
        config.statistic = node.get("statistic").asText();
      }

      config.setOriginalYaml(node.toString());
      aggregationConfigs.add(config);
    }

    StreamingConfig streamingConfig = new StreamingConfig();
    streamingConfig.aggregationConfigs = aggregationConfigs;
    return streamingConfig;
  }

  private static JsonNode required(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new IllegalArgumentException("Aggregation is missing required field '" + field + "'");
    }
    return value;
  }
}
