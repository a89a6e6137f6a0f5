/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.aggregates;

import dev.projectasap.flinkdistinct.datamodel.DataPoint;
import dev.projectasap.flinkdistinct.distinct.DistinctSetOptions;
import dev.projectasap.flinkdistinct.types.ElementArray;
import dev.projectasap.flinkdistinct.types.ElementType;
import java.util.Map;
import org.apache.flink.api.common.functions.AggregateFunction;

/**
 * Shared transition and combine logic of the exact distinct aggregates. The sub-type selects the
 * input: "element" aggregates {@link DataPoint#value}, "elements" aggregates every element of
 * {@link DataPoint#values}.
 *
 * @param <OUT> the final result type
 */
public abstract class DistinctAggregateFunction<OUT>
    implements AggregateFunction<DataPoint, DistinctCountAccumulator, OUT> {
  public static final String SUBTYPE_ELEMENT = "element";
  public static final String SUBTYPE_ELEMENTS = "elements";
  public static final String ELEMENT_TYPE = "elementType";

  private final boolean perArrayElement;
  private final ElementType elementType;
  private final DistinctSetOptions options;

  /**
   * Constructs the aggregate.
   *
   * @param aggregationSubType "element" or "elements"
   * @param parameters configuration parameters including "elementType" and optionally
   *     "initialCapacity" and "largeAllocationThreshold"
   */
  protected DistinctAggregateFunction(String aggregationSubType, Map<String, String> parameters) {
    if (SUBTYPE_ELEMENT.equals(aggregationSubType)) {
      this.perArrayElement = false;
    } else if (SUBTYPE_ELEMENTS.equals(aggregationSubType)) {
      this.perArrayElement = true;
    } else {
      throw new IllegalArgumentException(
          "Aggregation subtype must be '"
              + SUBTYPE_ELEMENT
              + "' or '"
              + SUBTYPE_ELEMENTS
              + "', got '"
              + aggregationSubType
              + "'");
    }
    if (parameters == null || !parameters.containsKey(ELEMENT_TYPE)) {
      throw new IllegalArgumentException("Missing required parameter '" + ELEMENT_TYPE + "'");
    }
    this.elementType = ElementType.fromName(parameters.get(ELEMENT_TYPE));
    this.options = DistinctSetOptions.fromParameters(parameters);
  }

  public ElementType getElementType() {
    return elementType;
  }

  public boolean isPerArrayElement() {
    return perArrayElement;
  }

  @Override
  public DistinctCountAccumulator createAccumulator() {
    return new DistinctCountAccumulator(elementType, options);
  }

  @Override
  public DistinctCountAccumulator add(DataPoint value, DistinctCountAccumulator acc) {
    if (perArrayElement) {
      if (value.values != null) {
        acc.addAll(ElementArray.of(elementType, value.values));
      }
    } else {
      acc.add(value.value);
    }
    return acc;
  }

  @Override
  public DistinctCountAccumulator merge(DistinctCountAccumulator a, DistinctCountAccumulator b) {
    return a.merge(b);
  }
}
