/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct;

import static org.assertj.core.api.Assertions.assertThat;

import dev.projectasap.flinkdistinct.datamodel.DataPoint;
import dev.projectasap.flinkdistinct.datamodel.PrecomputedOutput;
import dev.projectasap.flinkdistinct.utils.AggregationConfig;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.util.CloseableIterator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DataStreamJobTest {

  private static DataStreamJob.DataGenSettings settings(int arrayLength, double nullFraction) {
    return new DataStreamJob.DataGenSettings(
        4, 10_000, 2, 50, arrayLength, nullFraction, "uniform");
  }

  private static AggregationConfig distinctCount(String aggregationPackage, String type) {
    AggregationConfig config = new AggregationConfig();
    config.aggregationId = 1;
    config.aggregationPackage = aggregationPackage;
    config.aggregationType = type;
    config.aggregationSubType = "element";
    config.tumblingWindowSize = 10;
    Map<String, String> parameters = new HashMap<>();
    parameters.put("elementType", "int8");
    config.parameters = parameters;
    return config;
  }

  @Test
  @DisplayName("should advance one window every itemsPerWindow records")
  void shouldAdvanceWindows() {
    Random random = new Random(1);

    DataPoint first = DataStreamJob.generateDataPoint(0, settings(0, 0.0), random);
    DataPoint fourth = DataStreamJob.generateDataPoint(3, settings(0, 0.0), random);
    DataPoint fifth = DataStreamJob.generateDataPoint(4, settings(0, 0.0), random);

    assertThat(fourth.timestamp).isEqualTo(first.timestamp);
    assertThat(fifth.timestamp - first.timestamp).isEqualTo(10_000L);
    assertThat(first.key).isEqualTo("key1");
    assertThat(fifth.key).isEqualTo("key1");
    assertThat(first.value.longValue()).isBetween(1L, 50L);
  }

  @Test
  @DisplayName("should generate arrays and nulls on request")
  void shouldGenerateArraysAndNulls() {
    Random random = new Random(2);

    DataPoint array = DataStreamJob.generateDataPoint(0, settings(5, 0.0), random);
    DataPoint nulls = DataStreamJob.generateDataPoint(1, settings(0, 1.0), random);

    assertThat(array.value).isNull();
    assertThat(array.values).hasSize(5).doesNotContainNull();
    assertThat(nulls.value).isNull();
  }

  @Test
  @DisplayName("should merge partition partials into the exact window count")
  void shouldMergePartitionPartials() throws Exception {
    List<DataPoint> points = new ArrayList<>();
    Set<Long> expected = new HashSet<>();
    Random random = new Random(3);
    for (int i = 0; i < 2_000; i++) {
      long value = random.nextInt(700);
      expected.add(value);
      points.add(new DataPoint(1_000L + i, "key" + (i % 3), value));
    }

    StreamExecutionEnvironment env = StreamExecutionEnvironment.createLocalEnvironment(2);
    DataStreamJob.registerSerializers(env.getConfig());
    DataStream<DataPoint> input =
        env.fromCollection(points)
            .assignTimestampsAndWatermarks(
                WatermarkStrategy.<DataPoint>forMonotonousTimestamps()
                    .withTimestampAssigner((event, timestamp) -> event.timestamp));

    DataStream<PrecomputedOutput> output =
        DataStreamJob.buildAggregation(
            input,
            distinctCount("aggregates", "DistinctCount"),
            DataStreamJob.GROUP_BY_PARTITION,
            2,
            true,
            "insertion",
            "summary",
            false);

    List<PrecomputedOutput> results = new ArrayList<>();
    try (CloseableIterator<PrecomputedOutput> iterator = output.executeAndCollect()) {
      iterator.forEachRemaining(results::add);
    }

    assertThat(results).hasSize(1);
    assertThat(results.get(0).precompute.query(null).get("distinct_count").asLong())
        .isEqualTo(expected.size());
  }

  @Test
  @DisplayName("should emit one result per key when grouping by key")
  void shouldGroupByKey() throws Exception {
    List<DataPoint> points = new ArrayList<>();
    Map<String, Set<Long>> expected = new HashMap<>();
    for (int i = 0; i < 300; i++) {
      String key = "key" + (i % 3);
      long value = i % 40;
      expected.computeIfAbsent(key, k -> new HashSet<>()).add(value);
      points.add(new DataPoint(1_000L + i, key, value));
    }

    StreamExecutionEnvironment env = StreamExecutionEnvironment.createLocalEnvironment(2);
    DataStreamJob.registerSerializers(env.getConfig());
    DataStream<DataPoint> input =
        env.fromCollection(points)
            .assignTimestampsAndWatermarks(
                WatermarkStrategy.<DataPoint>forMonotonousTimestamps()
                    .withTimestampAssigner((event, timestamp) -> event.timestamp));

    DataStream<PrecomputedOutput> output =
        DataStreamJob.buildAggregation(
            input,
            distinctCount("baseline", "ExactDistinctCount"),
            DataStreamJob.GROUP_BY_KEY,
            2,
            true,
            "insertion",
            "summary",
            false);

    Map<String, Long> counts = new HashMap<>();
    try (CloseableIterator<PrecomputedOutput> iterator = output.executeAndCollect()) {
      while (iterator.hasNext()) {
        PrecomputedOutput result = iterator.next();
        counts.put(result.key, result.precompute.query(null).get("distinct_count").asLong());
      }
    }

    assertThat(counts).hasSize(3);
    for (Map.Entry<String, Set<Long>> entry : expected.entrySet()) {
      assertThat(counts.get(entry.getKey())).isEqualTo((long) entry.getValue().size());
    }
  }
}
