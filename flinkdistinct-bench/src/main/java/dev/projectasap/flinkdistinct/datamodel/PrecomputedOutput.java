/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.datamodel;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.flinkdistinct.utils.AggregationConfig;
import dev.projectasap.flinkdistinct.utils.OutputStrategy;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Result of one aggregation window: the summary plus the window bounds, the group key, and the
 * configuration that produced it.
 */
public class PrecomputedOutput {
  @JsonProperty("start_timestamp")
  public Long startTimestamp;

  @JsonProperty("end_timestamp")
  public Long endTimestamp;

  public Summary precompute;
  public AggregationConfig config;
  public String key;
  private OutputStrategy outputStrategy;
  private ObjectNode cachedQueryResults;

  /**
   * Constructs a PrecomputedOutput.
   *
   * @param startTimestamp the window start timestamp
   * @param endTimestamp the window end timestamp
   * @param precompute the aggregated summary
   * @param config the aggregation configuration
   * @param key the group key (null once parallel partials are merged)
   * @param pipeline the pipeline mode (e.g., "insertion", "insertion_querying")
   * @param outputMode the output mode (e.g., "summary", "query", "memory")
   * @param verbose whether to enable verbose output
   */
  public PrecomputedOutput(
      Long startTimestamp,
      Long endTimestamp,
      Summary precompute,
      AggregationConfig config,
      String key,
      String pipeline,
      String outputMode,
      boolean verbose) {
    this.startTimestamp = startTimestamp;
    this.endTimestamp = endTimestamp;
    this.precompute = precompute;
    this.config = config;
    this.key = key;
    this.outputStrategy = new OutputStrategy(pipeline, outputMode, verbose);
    this.cachedQueryResults = null;
  }

  public void setCachedQueryResults(ObjectNode queryResults) {
    this.cachedQueryResults = queryResults;
  }

  public ObjectNode getCachedQueryResults() {
    return cachedQueryResults;
  }

  /**
   * Serializes the output to bytes. Each variable-length part carries a big-endian int length
   * prefix.
   *
   * @return config, window bounds, key and summary payload
   */
  public byte[] serializeToBytes() {
    byte[] precomputeBytes = this.precompute.serializeToBytes();
    byte[] configBytes = this.config.serializeToBytes();
    byte[] keyBytes =
        this.key == null ? new byte[0] : this.key.getBytes(StandardCharsets.UTF_8);

    ByteBuffer buffer =
        ByteBuffer.allocate(
            Integer.BYTES
                + configBytes.length
                + Long.BYTES
                + Long.BYTES
                + Integer.BYTES
                + keyBytes.length
                + Integer.BYTES
                + precomputeBytes.length);
    buffer.putInt(configBytes.length);
    buffer.put(configBytes);
    buffer.putLong(this.startTimestamp);
    buffer.putLong(this.endTimestamp);
    buffer.putInt(keyBytes.length);
    buffer.put(keyBytes);
    buffer.putInt(precomputeBytes.length);
    buffer.put(precomputeBytes);
    return buffer.array();
  }

  /**
   * Serializes the output to JSON, with the parts selected by the output mode.
   *
   * @return JsonNode with window metadata and the selected parts
   */
  public JsonNode serializeToJson() {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode jsonNode = objectMapper.createObjectNode();

    jsonNode.set("config", this.config.serializeToJson());
    jsonNode.put("start_timestamp", this.startTimestamp);
    jsonNode.put("end_timestamp", this.endTimestamp);
    jsonNode.put("key", this.key);
    jsonNode.put("pipeline", this.outputStrategy.getPipeline());
    jsonNode.put("output_mode", this.outputStrategy.getOutputMode());

    jsonNode.setAll(
        this.outputStrategy.buildOutput(this.precompute, this.cachedQueryResults, objectMapper));
    return jsonNode;
  }

  public OutputStrategy getOutputStrategy() {
    return this.outputStrategy;
  }
}
