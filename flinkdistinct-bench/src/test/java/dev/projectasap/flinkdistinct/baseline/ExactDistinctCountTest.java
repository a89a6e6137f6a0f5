/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.baseline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.projectasap.flinkdistinct.aggregates.ArrayAggDistinct;
import dev.projectasap.flinkdistinct.aggregates.DistinctCount;
import dev.projectasap.flinkdistinct.aggregates.DistinctCountAccumulator;
import dev.projectasap.flinkdistinct.datamodel.DataPoint;
import dev.projectasap.flinkdistinct.exceptions.UnsupportedElementTypeException;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExactDistinctCountTest {

  private static Map<String, String> params(String elementType) {
    Map<String, String> params = new HashMap<>();
    params.put("elementType", elementType);
    return params;
  }

  @Test
  @DisplayName("should agree with the distinct set on arrays with nulls")
  void shouldAgreeWithDistinctSetOnArrays() {
    ExactDistinctCount baseline = new ExactDistinctCount("elements", params("int4"));
    DistinctCount distinct = new DistinctCount("elements", params("int4"));
    ArrayAggDistinct arrayAgg = new ArrayAggDistinct("elements", params("int4"));
    ExactDistinctCountAccumulator expected = baseline.createAccumulator();
    DistinctCountAccumulator actual = distinct.createAccumulator();
    DistinctCountAccumulator values = arrayAgg.createAccumulator();

    Random random = new Random(99);
    for (int i = 0; i < 5_000; i++) {
      Number[] array = new Number[random.nextInt(4)];
      for (int j = 0; j < array.length; j++) {
        array[j] = random.nextInt(10) == 0 ? null : random.nextInt(800) - 400;
      }
      DataPoint point = DataPoint.ofValues((long) i, "k", array);
      expected = baseline.add(point, expected);
      actual = distinct.add(point, actual);
      values = arrayAgg.add(point, values);
    }

    assertThat(actual.count()).isEqualTo(expected.count());
    assertThat(arrayAgg.getResult(values)).isEqualTo(expected.toSortedList());
  }

  @Test
  @DisplayName("should count an int and a long of the same value once")
  void shouldNormalizeBoxedTypes() {
    ExactDistinctCountAccumulator acc =
        new ExactDistinctCount("element", params("int8")).createAccumulator();

    acc.add(5);
    acc.add(5L);
    acc.add(null);

    assertThat(acc.count()).isEqualTo(1);
    assertThat(acc.get_memory()).isEqualTo(8);
  }

  @Test
  @DisplayName("should keep both signed zeros apart like the distinct set")
  void shouldKeepSignedZerosApart() {
    ExactDistinctCountAccumulator acc =
        new ExactDistinctCount("element", params("float8")).createAccumulator();

    acc.add(0.0);
    acc.add(-0.0);

    assertThat(acc.count()).isEqualTo(2);
    assertThat(acc.toSortedList()).containsExactly(-0.0, 0.0);
  }

  @Test
  @DisplayName("should merge without touching its inputs")
  void shouldMergeIntoNewAccumulator() {
    ExactDistinctCount function = new ExactDistinctCount("element", params("int4"));
    ExactDistinctCountAccumulator a = function.createAccumulator();
    ExactDistinctCountAccumulator b = function.createAccumulator();
    a.add(1);
    b.add(2);

    ExactDistinctCountAccumulator merged = function.merge(a, b);

    assertThat(merged.count()).isEqualTo(2);
    assertThat(a.count()).isEqualTo(1);
  }

  @Test
  @DisplayName("should reject unsupported element types up front")
  void shouldRejectUnsupportedTypes() {
    assertThatThrownBy(() -> new ExactDistinctCount("element", params("text")))
        .isInstanceOf(UnsupportedElementTypeException.class);
    assertThatThrownBy(() -> new ExactDistinctCount("histogram", params("int4")))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
