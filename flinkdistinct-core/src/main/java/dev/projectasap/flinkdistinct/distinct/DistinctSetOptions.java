/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.distinct;

import java.io.Serializable;
import java.util.Map;

/**
 * Sizing options of a {@link DistinctSet}: the initial buffer capacity and the crossover point of
 * the two-regime growth policy. Buffers below the large allocation threshold double, larger ones
 * grow by a quarter.
 */
public final class DistinctSetOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  public static final String INITIAL_CAPACITY = "initialCapacity";
  public static final String LARGE_ALLOCATION_THRESHOLD = "largeAllocationThreshold";

  public static final int DEFAULT_INITIAL_CAPACITY = 32;
  public static final int DEFAULT_LARGE_ALLOCATION_THRESHOLD = 8192;

  /** A compaction asked to reserve space grows the buffer when less than this is free. */
  public static final double MIN_FREE_FRACTION = 0.2;

  // Largest array size most JVMs hand out
  static final int MAX_BUFFER_SIZE = Integer.MAX_VALUE - 8;

  private static final DistinctSetOptions DEFAULTS =
      new DistinctSetOptions(DEFAULT_INITIAL_CAPACITY, DEFAULT_LARGE_ALLOCATION_THRESHOLD);

  private final int initialCapacityBytes;
  private final int largeAllocationThreshold;

  public DistinctSetOptions(int initialCapacityBytes, int largeAllocationThreshold) {
    if (initialCapacityBytes <= 0) {
      throw new IllegalArgumentException(
          "Initial capacity (" + initialCapacityBytes + ") must be positive");
    }
    if (largeAllocationThreshold < 0) {
      throw new IllegalArgumentException(
          "Large allocation threshold (" + largeAllocationThreshold + ") cannot be negative");
    }
    this.initialCapacityBytes = initialCapacityBytes;
    this.largeAllocationThreshold = largeAllocationThreshold;
  }

  public static DistinctSetOptions defaults() {
    return DEFAULTS;
  }

  /**
   * Reads options from aggregation parameters, falling back to defaults for missing keys.
   *
   * @param parameters aggregation parameters, may contain "initialCapacity" and
   *     "largeAllocationThreshold"
   * @return the parsed options
   */
  public static DistinctSetOptions fromParameters(Map<String, String> parameters) {
    if (parameters == null) {
      return DEFAULTS;
    }
    int initialCapacity =
        parseInt(parameters, INITIAL_CAPACITY, DEFAULT_INITIAL_CAPACITY);
    int threshold =
        parseInt(parameters, LARGE_ALLOCATION_THRESHOLD, DEFAULT_LARGE_ALLOCATION_THRESHOLD);
    return new DistinctSetOptions(initialCapacity, threshold);
  }

  private static int parseInt(Map<String, String> parameters, String key, int defaultValue) {
    String value = parameters.get(key);
    if (value == null || value.trim().isEmpty()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "Parameter '" + key + "' must be an integer, got '" + value + "'", e);
    }
  }

  public int initialCapacityBytes() {
    return initialCapacityBytes;
  }

  public int largeAllocationThreshold() {
    return largeAllocationThreshold;
  }

  /**
   * Next capacity of a buffer that needs to grow. Always strictly larger than the current one.
   *
   * @param capacityBytes current capacity
   * @return grown capacity
   */
  public int grownCapacity(int capacityBytes) {
    if (capacityBytes >= MAX_BUFFER_SIZE) {
      throw new IllegalStateException(
          "Distinct set buffer cannot grow beyond " + MAX_BUFFER_SIZE + " bytes");
    }
    double scaled = capacityBytes / (1.0 - MIN_FREE_FRACTION);
    long grown;
    if (scaled < largeAllocationThreshold) {
      grown = 2L * capacityBytes;
    } else {
      grown = (long) scaled;
    }
    grown = Math.max(grown, capacityBytes + 1L);
    return (int) Math.min(grown, MAX_BUFFER_SIZE);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DistinctSetOptions)) {
      return false;
    }
    DistinctSetOptions that = (DistinctSetOptions) o;
    return initialCapacityBytes == that.initialCapacityBytes
        && largeAllocationThreshold == that.largeAllocationThreshold;
  }

  @Override
  public int hashCode() {
    return 31 * initialCapacityBytes + largeAllocationThreshold;
  }

  @Override
  public String toString() {
    return "DistinctSetOptions{"
        + "initialCapacityBytes="
        + initialCapacityBytes
        + ", largeAllocationThreshold="
        + largeAllocationThreshold
        + '}';
  }
}
