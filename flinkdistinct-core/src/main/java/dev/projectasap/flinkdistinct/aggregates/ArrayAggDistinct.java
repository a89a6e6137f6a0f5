/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.aggregates;

import java.util.List;
import java.util.Map;

/**
 * Aggregate function collecting the distinct values of a group in ascending order. Groups that
 * only saw nulls produce an empty list.
 */
public class ArrayAggDistinct extends DistinctAggregateFunction<List<Number>> {

  public ArrayAggDistinct(String aggregationSubType, Map<String, String> parameters) {
    super(aggregationSubType, parameters);
  }

  @Override
  public List<Number> getResult(DistinctCountAccumulator acc) {
    return acc.toSortedList();
  }
}
