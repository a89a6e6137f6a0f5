/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.datamodel;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Interface for aggregate outputs that travel through the pipeline: mergeable partial results
 * that can be queried and written to sinks. Uses self-referential generic type T to ensure
 * type-safe merge operations.
 */
public interface Summary<T extends Summary<T>> {

  /**
   * Execute a query on the accumulated data.
   *
   * @param params Query parameters as JsonNode, or null. Distinct aggregates return
   *     {"distinct_count": n} by default and {"distinct_values": [...]} for {"statistic":
   *     "values"}
   * @return Query result as JsonNode
   */
  JsonNode query(JsonNode params);

  /**
   * Get the memory footprint of this accumulator in bytes, counting the raw buffers only.
   *
   * @return Memory usage in bytes
   */
  long get_memory();

  /**
   * Merge another accumulator of the same type into this one. This operation must be commutative
   * and associative for correct parallel processing.
   *
   * @param other The accumulator to merge with
   * @return the merged accumulator
   */
  T merge(T other);

  byte[] serializeToBytes();

  JsonNode serializeToJson();

  default String serializeToString() {
    // Default to JSON string
    return serializeToJson().toString();
  }
}
