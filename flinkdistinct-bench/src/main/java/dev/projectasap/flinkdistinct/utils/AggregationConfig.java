/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.flinkdistinct.datamodel.DataPoint;
import dev.projectasap.flinkdistinct.datamodel.Summary;
import java.io.Serializable;
import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.apache.flink.api.common.functions.AggregateFunction;

/**
 * Configuration for a single aggregation. Names the aggregate class, its subtype and parameters,
 * and the window it runs over.
 */
public class AggregationConfig implements Serializable {
  private static final long serialVersionUID = 1L;

  static final String BASE_PACKAGE = "dev.projectasap.flinkdistinct";

  public Integer aggregationId;
  public String aggregationType;
  public String aggregationSubType;
  public String aggregationPackage;
  public Map<String, String> parameters;
  public int tumblingWindowSize;
  public String statistic;

  private String originalYaml;

  public void setOriginalYaml(String originalYaml) {
    this.originalYaml = originalYaml;
  }

  public byte[] serializeToBytes() {
    return originalYaml == null ? new byte[0] : originalYaml.getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Serializes the aggregation configuration to JSON.
   *
   * @return JsonNode containing the configuration details
   */
  public JsonNode serializeToJson() {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode jsonNode = objectMapper.createObjectNode();

    jsonNode.put("aggregationId", this.aggregationId);
    jsonNode.put("aggregationType", this.aggregationType);
    jsonNode.put("aggregationSubType", this.aggregationSubType);
    jsonNode.put("aggregationPackage", this.aggregationPackage);
    jsonNode.putPOJO("parameters", this.parameters);
    jsonNode.put("tumblingWindowSize", this.tumblingWindowSize);
    if (this.statistic != null) {
      jsonNode.put("statistic", this.statistic);
    }

    return jsonNode;
  }

  /**
   * Instantiates the aggregation function named by this configuration. The class is looked up as
   * {@code dev.projectasap.flinkdistinct.<aggregationPackage>.<aggregationType>} and must offer a
   * {@code (String subType, Map parameters)} constructor.
   *
   * @return the instantiated aggregation function
   * @throws IllegalArgumentException if the class does not produce a {@link Summary}
   * @throws RuntimeException if function instantiation fails
   */
  @SuppressWarnings("unchecked")
  public AggregateFunction<DataPoint, ?, Summary> getAggregationFunction() {
    Class<?> clazz;
    try {
      clazz = Class.forName(BASE_PACKAGE + "." + aggregationPackage + "." + aggregationType);
    } catch (ClassNotFoundException e) {
      throw new IllegalArgumentException(
          "Unknown aggregation " + aggregationPackage + "." + aggregationType, e);
    }
    if (!AggregateFunction.class.isAssignableFrom(clazz) || !producesSummary(clazz)) {
      throw new IllegalArgumentException(
          aggregationType + " does not produce a windowed summary and cannot run in this job");
    }

    try {
      return (AggregateFunction<DataPoint, ?, Summary>)
          clazz.getConstructor(String.class, Map.class).newInstance(aggregationSubType, parameters);
    } catch (ReflectiveOperationException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw new RuntimeException(
          "Failed to create aggregation function " + aggregationType + ": " + cause.getMessage(),
          cause);
    }
  }

  private static boolean producesSummary(Class<?> clazz) {
    for (Method method : clazz.getMethods()) {
      if ("getResult".equals(method.getName()) && !method.isBridge()) {
        return Summary.class.isAssignableFrom(method.getReturnType());
      }
    }
    return false;
  }
}
