/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.baseline;

import dev.projectasap.flinkdistinct.aggregates.DistinctAggregateFunction;
import dev.projectasap.flinkdistinct.datamodel.DataPoint;
import dev.projectasap.flinkdistinct.datamodel.Summary;
import dev.projectasap.flinkdistinct.types.ElementType;
import java.util.Map;
import org.apache.flink.api.common.functions.AggregateFunction;

/**
 * Exact distinct count backed by a {@link java.util.HashSet}. Takes the same subtypes and
 * parameters as {@link dev.projectasap.flinkdistinct.aggregates.DistinctCount}, for comparing
 * results and memory against it.
 */
public class ExactDistinctCount
    implements AggregateFunction<DataPoint, ExactDistinctCountAccumulator, Summary> {
  private final boolean perArrayElement;
  private final ElementType elementType;

  public ExactDistinctCount(String aggregationSubType, Map<String, String> parameters) {
    if (!DistinctAggregateFunction.SUBTYPE_ELEMENT.equals(aggregationSubType)
        && !DistinctAggregateFunction.SUBTYPE_ELEMENTS.equals(aggregationSubType)) {
      throw new IllegalArgumentException(
          "Unknown aggregation subtype '" + aggregationSubType + "'");
    }
    if (parameters == null || !parameters.containsKey(DistinctAggregateFunction.ELEMENT_TYPE)) {
      throw new IllegalArgumentException(
          "Missing required parameter '" + DistinctAggregateFunction.ELEMENT_TYPE + "'");
    }
    this.perArrayElement = DistinctAggregateFunction.SUBTYPE_ELEMENTS.equals(aggregationSubType);
    this.elementType =
        ElementType.fromName(parameters.get(DistinctAggregateFunction.ELEMENT_TYPE));
    this.elementType.checkSupported();
  }

  @Override
  public ExactDistinctCountAccumulator createAccumulator() {
    return new ExactDistinctCountAccumulator(elementType);
  }

  @Override
  public ExactDistinctCountAccumulator add(DataPoint value, ExactDistinctCountAccumulator acc) {
    if (perArrayElement) {
      if (value.values != null) {
        for (Number element : value.values) {
          acc.add(element);
        }
      }
    } else {
      acc.add(value.value);
    }
    return acc;
  }

  @Override
  public ExactDistinctCountAccumulator merge(
      ExactDistinctCountAccumulator a, ExactDistinctCountAccumulator b) {
    return a.merge(b);
  }

  @Override
  public Summary getResult(ExactDistinctCountAccumulator acc) {
    return acc;
  }
}
