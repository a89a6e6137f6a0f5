/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.datamodel;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Arrays;

/**
 * A single input record: event timestamp, grouping key, and either one value or an array of
 * values. Nulls are allowed for the value, the array, and array elements; distinct aggregates
 * skip them.
 */
@JsonPropertyOrder({"timestamp", "key", "value", "values"})
public class DataPoint {
  public Long timestamp;
  public String key;
  public Number value;
  public Number[] values;

  /** Default constructor initializing all fields to default values. */
  public DataPoint() {
    this.timestamp = 0L;
    this.key = "";
    this.value = null;
    this.values = null;
  }

  /**
   * Constructs a DataPoint carrying a single value.
   *
   * @param timestamp the event timestamp
   * @param key the grouping key
   * @param value the value, may be null
   */
  public DataPoint(Long timestamp, String key, Number value) {
    this.timestamp = timestamp;
    this.key = key;
    this.value = value;
    this.values = null;
  }

  /**
   * Constructs a DataPoint carrying an array of values.
   *
   * @param timestamp the event timestamp
   * @param key the grouping key
   * @param values the array, may be null or contain nulls
   */
  public static DataPoint ofValues(Long timestamp, String key, Number... values) {
    DataPoint point = new DataPoint(timestamp, key, null);
    point.values = values;
    return point;
  }

  @Override
  public String toString() {
    return "DataPoint{"
        + "timestamp="
        + timestamp
        + ", key='"
        + key
        + '\''
        + ", value="
        + value
        + ", values="
        + Arrays.toString(values)
        + '}';
  }
}
