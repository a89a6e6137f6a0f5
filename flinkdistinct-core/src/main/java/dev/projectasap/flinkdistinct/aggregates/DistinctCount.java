/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.aggregates;

import dev.projectasap.flinkdistinct.datamodel.Summary;
import java.util.Map;

/**
 * Aggregate function for exact distinct counting. The result is the accumulator itself, queried
 * for {"distinct_count": n} downstream; groups that only saw nulls count 0.
 */
public class DistinctCount extends DistinctAggregateFunction<Summary> {

  public DistinctCount(String aggregationSubType, Map<String, String> parameters) {
    super(aggregationSubType, parameters);
  }

  @Override
  public Summary getResult(DistinctCountAccumulator acc) {
    return acc;
  }
}
