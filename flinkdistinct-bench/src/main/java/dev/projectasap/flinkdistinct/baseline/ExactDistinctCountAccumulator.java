/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.baseline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.flinkdistinct.datamodel.Summary;
import dev.projectasap.flinkdistinct.types.ElementType;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Hash-set accumulator used as the reference for distinct aggregation. Values are normalized
 * through the element type's encoding so that, for example, an Integer and a Long holding the same
 * number count once.
 */
public class ExactDistinctCountAccumulator implements Summary<ExactDistinctCountAccumulator> {
  public ElementType elementType;
  public Set<Number> distinctValues;

  public ExactDistinctCountAccumulator(ElementType elementType) {
    this.elementType = elementType;
    this.distinctValues = new HashSet<>();
  }

  public void add(Number value) {
    if (value != null) {
      distinctValues.add(elementType.decode(elementType.encode(value)));
    }
  }

  @Override
  public ExactDistinctCountAccumulator merge(ExactDistinctCountAccumulator other) {
    ExactDistinctCountAccumulator merged = new ExactDistinctCountAccumulator(elementType);
    merged.distinctValues.addAll(this.distinctValues);
    merged.distinctValues.addAll(other.distinctValues);
    return merged;
  }

  public long count() {
    return distinctValues.size();
  }

  /** Values in the same order the distinct set reports them. */
  public List<Number> toSortedList() {
    List<byte[]> encoded = new ArrayList<>(distinctValues.size());
    for (Number value : distinctValues) {
      encoded.add(elementType.encode(value));
    }
    encoded.sort(Arrays::compareUnsigned);
    List<Number> values = new ArrayList<>(encoded.size());
    for (byte[] bytes : encoded) {
      values.add(elementType.decode(bytes));
    }
    return values;
  }

  @Override
  public byte[] serializeToBytes() {
    int itemSize = elementType.itemSize();
    ByteBuffer buffer = ByteBuffer.allocate(Integer.BYTES + distinctValues.size() * itemSize);
    buffer.putInt(distinctValues.size());
    for (Number value : distinctValues) {
      buffer.put(elementType.encode(value));
    }
    return buffer.array();
  }

  @Override
  public String serializeToString() {
    return "Distinct count: " + distinctValues.size();
  }

  @Override
  public JsonNode serializeToJson() {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode jsonNode = objectMapper.createObjectNode();
    jsonNode.put("element_type", elementType.typeName());
    jsonNode.put("distinct_count", distinctValues.size());
    return jsonNode;
  }

  /**
   * Returns the exact distinct count, or the sorted values for {"statistic": "values"}.
   *
   * @param params JsonNode containing query parameters (optional)
   */
  @Override
  public JsonNode query(JsonNode params) {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode queryResult = objectMapper.createObjectNode();

    if (params != null && "values".equals(params.path("statistic").asText())) {
      ArrayNode values = queryResult.putArray("distinct_values");
      for (Number value : toSortedList()) {
        if (value instanceof Float || value instanceof Double) {
          values.add(value.doubleValue());
        } else {
          values.add(value.longValue());
        }
      }
      return queryResult;
    }

    queryResult.put("distinct_count", distinctValues.size());
    return queryResult;
  }

  /** Payload bytes only, ignoring hash set overhead. */
  @Override
  public long get_memory() {
    return (long) distinctValues.size() * elementType.itemSize();
  }
}
