/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.aggregates;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.flinkdistinct.datamodel.Summary;
import dev.projectasap.flinkdistinct.distinct.DistinctSet;
import dev.projectasap.flinkdistinct.distinct.DistinctSetCodec;
import dev.projectasap.flinkdistinct.distinct.DistinctSetOptions;
import dev.projectasap.flinkdistinct.exceptions.InvariantViolationException;
import dev.projectasap.flinkdistinct.memory.GroupArena;
import dev.projectasap.flinkdistinct.types.ElementArray;
import dev.projectasap.flinkdistinct.types.ElementType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulator for exact distinct aggregation over fixed-width values. Holds at most one {@link
 * DistinctSet}; a group that has only seen nulls has no set at all ("absent") rather than an empty
 * one. The set and its buffers live in a per-accumulator {@link GroupArena}.
 */
public class DistinctCountAccumulator implements Summary<DistinctCountAccumulator> {
  private final ElementType elementType;
  private final DistinctSetOptions options;
  private GroupArena arena;
  private DistinctSet set;
  private byte[] scratch;

  public DistinctCountAccumulator(ElementType elementType, DistinctSetOptions options) {
    this.elementType = elementType;
    this.options = options;
  }

  /**
   * Rebuilds an accumulator from {@link #serializeToBytes()} output. An empty payload stands for
   * the absent state.
   */
  public static DistinctCountAccumulator fromBytes(
      ElementType elementType, DistinctSetOptions options, byte[] payload) {
    DistinctCountAccumulator accumulator = new DistinctCountAccumulator(elementType, options);
    if (payload.length > 0) {
      accumulator.set = DistinctSetCodec.deserialize(payload, accumulator.arena(), options);
      if (accumulator.set.itemSize() != elementType.itemSize()) {
        int itemSize = accumulator.set.itemSize();
        accumulator.release();
        throw new InvariantViolationException(
            "Serialized set stores " + itemSize + " byte items, " + elementType.typeName()
                + " needs " + elementType.itemSize());
      }
    }
    return accumulator;
  }

  /** Adds one value. Nulls leave the state untouched. */
  public void add(Number value) {
    if (value == null) {
      return;
    }
    DistinctSet target = ensureSet();
    if (scratch == null) {
      scratch = new byte[target.itemSize()];
    }
    elementType.encode(value, scratch, 0);
    target.append(scratch, 0);
  }

  /** Adds every non-null element of an array. Null arrays and null elements are skipped. */
  public void addAll(ElementArray array) {
    if (array == null) {
      return;
    }
    if (array.elementType() != elementType) {
      throw new IllegalArgumentException(
          "Array of " + array.elementType().typeName() + " fed to a "
              + elementType.typeName() + " aggregate");
    }
    array.forEachNonNull((source, offset) -> ensureSet().append(source, offset));
  }

  public void addAll(Number... values) {
    if (values == null) {
      return;
    }
    addAll(ElementArray.of(elementType, values));
  }

  @Override
  public DistinctCountAccumulator merge(DistinctCountAccumulator other) {
    if (other == null || other == this || other.set == null) {
      return this;
    }
    if (other.elementType != elementType) {
      throw new InvariantViolationException(
          "Cannot merge distinct aggregates over "
              + elementType.typeName()
              + " and "
              + other.elementType.typeName());
    }
    if (set == null) {
      set = other.set.copy(arena());
    } else {
      set.combine(other.set);
    }
    return this;
  }

  /** Exact number of distinct values seen, 0 when absent. */
  public long count() {
    return set == null ? 0 : set.count();
  }

  /** Distinct values in ascending order, empty when absent. */
  public List<Number> toSortedList() {
    if (set == null) {
      return Collections.emptyList();
    }
    List<Number> values = new ArrayList<>(set.count());
    for (byte[] element : set.sortedElements()) {
      values.add(elementType.decode(element));
    }
    return values;
  }

  public boolean isAbsent() {
    return set == null;
  }

  public ElementType getElementType() {
    return elementType;
  }

  public DistinctSetOptions getOptions() {
    return options;
  }

  /** The underlying set, or null when absent. */
  public DistinctSet getSet() {
    return set;
  }

  /** Deep copy backed by its own arena. */
  public DistinctCountAccumulator copy() {
    DistinctCountAccumulator copy = new DistinctCountAccumulator(elementType, options);
    if (set != null) {
      copy.set = set.copy(copy.arena());
    }
    return copy;
  }

  /** Frees the set and tears down the arena. The accumulator reverts to the absent state. */
  public void release() {
    if (set != null) {
      set.release();
      set = null;
    }
    if (arena != null) {
      arena.close();
      arena = null;
    }
  }

  /** Serialized set, or an empty array for the absent state. Compacts pending values. */
  @Override
  public byte[] serializeToBytes() {
    if (set == null) {
      return new byte[0];
    }
    return DistinctSetCodec.serialize(set);
  }

  @Override
  public String serializeToString() {
    return "Distinct count: " + count();
  }

  @Override
  public JsonNode serializeToJson() {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode jsonNode = objectMapper.createObjectNode();
    jsonNode.put("element_type", elementType.typeName());
    jsonNode.put("distinct_count", count());
    jsonNode.put("capacity_bytes", get_memory());
    return jsonNode;
  }

  /**
   * Execute query operations on the distinct set. Returns the exact distinct count, or the sorted
   * distinct values when params carry {"statistic": "values"}.
   *
   * @param params JsonNode containing query parameters (optional)
   */
  @Override
  public JsonNode query(JsonNode params) {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode queryResult = objectMapper.createObjectNode();

    if (params != null
        && params.has("statistic")
        && "values".equals(params.get("statistic").asText())) {
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

    queryResult.put("distinct_count", count());
    return queryResult;
  }

  @Override
  public long get_memory() {
    return set == null ? 0 : set.capacityBytes();
  }

  private DistinctSet ensureSet() {
    if (set == null) {
      // rejects unsupported types before anything is stored
      set = new DistinctSet(elementType.itemSize(), arena(), options);
    }
    return set;
  }

  private GroupArena arena() {
    if (arena == null) {
      arena = new GroupArena("distinct-" + elementType.typeName());
    }
    return arena;
  }

  @Override
  public String toString() {
    return "DistinctCountAccumulator{"
        + "elementType="
        + elementType
        + ", set="
        + set
        + '}';
  }
}
