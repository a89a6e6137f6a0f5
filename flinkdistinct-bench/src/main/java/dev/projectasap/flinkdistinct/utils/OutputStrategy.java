/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.flinkdistinct.datamodel.Summary;
import java.io.Serializable;

/**
 * Decides what a window result carries when written out, and runs the finalizing query. The
 * pipeline mode says whether queries run in the window function; the output mode lists the parts
 * to emit, joined by underscores (e.g. "query_memory").
 */
public class OutputStrategy implements Serializable {
  private static final long serialVersionUID = 1L;

  public static final String PIPELINE_INSERTION = "insertion";
  public static final String PIPELINE_INSERTION_QUERYING = "insertion_querying";

  private final String pipeline;
  private final String outputMode;
  private final boolean verbose;

  public OutputStrategy(String pipeline, String outputMode, boolean verbose) {
    this.pipeline = pipeline;
    this.outputMode = outputMode;
    this.verbose = verbose;
  }

  public String getPipeline() {
    return pipeline;
  }

  public String getOutputMode() {
    return outputMode;
  }

  public boolean isVerbose() {
    return verbose;
  }

  /** Parse output mode flags (e.g., "query_memory" -> ["query", "memory"]). */
  public OutputModeFlags parseOutputMode() {
    boolean includeSummary = false;
    boolean includeQuery = false;
    boolean includeMemory = false;

    for (String flag : this.outputMode.split("_")) {
      switch (flag) {
        case "summary":
          includeSummary = true;
          break;
        case "query":
          includeQuery = true;
          break;
        case "memory":
          includeMemory = true;
          break;
        default:
          throw new IllegalArgumentException(
              "Unknown output mode '" + flag + "' in '" + outputMode + "'");
      }
    }

    return new OutputModeFlags(includeSummary, includeQuery, includeMemory);
  }

  /** Queries run in the window function only for the insertion_querying pipeline. */
  public boolean shouldExecuteQueries() {
    return PIPELINE_INSERTION_QUERYING.equals(pipeline);
  }

  /**
   * Finalizes a summary.
   *
   * @param precompute the summary to query
   * @param statistic "count", "values", or null for the summary's default
   * @return the query result
   */
  public static ObjectNode executeQuery(Summary<?> precompute, String statistic) {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode params = objectMapper.createObjectNode();
    if (statistic != null && !statistic.isEmpty()) {
      params.put("statistic", statistic);
    }
    JsonNode result = precompute.query(params);
    ObjectNode combinedResults = objectMapper.createObjectNode();
    combinedResults.setAll((ObjectNode) result);
    return combinedResults;
  }

  /**
   * Build the JSON output based on the output strategy configuration.
   *
   * @param precompute the summary to serialize
   * @param cachedQueryResults query results from window function (can be null)
   * @param objectMapper Jackson ObjectMapper for JSON construction
   * @return ObjectNode with the appropriate output fields
   */
  public ObjectNode buildOutput(
      Summary<?> precompute, ObjectNode cachedQueryResults, ObjectMapper objectMapper) {
    ObjectNode outputNode = objectMapper.createObjectNode();
    if (!this.verbose) {
      return outputNode;
    }
    OutputModeFlags flags = parseOutputMode();

    if (flags.includeSummary) {
      outputNode.set("summary", precompute.serializeToJson());
    }

    if (flags.includeQuery) {
      if (cachedQueryResults != null) {
        outputNode.set("query", cachedQueryResults);
      } else {
        outputNode.put(
            "query_error",
            "Query results not available - queries should be executed in window function");
      }
    }

    if (flags.includeMemory) {
      outputNode.put("memory_bytes", precompute.get_memory());
    }

    return outputNode;
  }

  /** Flags indicating which output components to include. */
  public static class OutputModeFlags {
    public final boolean includeSummary;
    public final boolean includeQuery;
    public final boolean includeMemory;

    public OutputModeFlags(boolean includeSummary, boolean includeQuery, boolean includeMemory) {
      this.includeSummary = includeSummary;
      this.includeQuery = includeQuery;
      this.includeMemory = includeMemory;
    }
  }
}
