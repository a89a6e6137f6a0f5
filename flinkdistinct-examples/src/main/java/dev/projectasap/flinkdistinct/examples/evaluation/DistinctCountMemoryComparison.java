/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.examples.evaluation;

import dev.projectasap.flinkdistinct.datamodel.DataPoint;
import dev.projectasap.flinkdistinct.datamodel.PrecomputedOutput;
import dev.projectasap.flinkdistinct.examples.utils.MemoryComparator;
import dev.projectasap.flinkdistinct.serialization.DistinctCountAccumulatorSerializer;
import dev.projectasap.flinkdistinct.utils.AggregationConfig;
import dev.projectasap.flinkdistinct.windowfunctions.KeyedWindowProcessor;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.streaming.api.windowing.assigners.TumblingEventTimeWindows;
import org.apache.flink.streaming.api.windowing.time.Time;
import org.apache.flink.util.CloseableIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the distinct set aggregate and the hash set baseline over the same windows and prints, per
 * window, both counts and the memory each one holds.
 */
public class DistinctCountMemoryComparison {
  private static final Logger LOG = LoggerFactory.getLogger(DistinctCountMemoryComparison.class);

  private static final int WINDOWS = 3;
  private static final int ITEMS_PER_WINDOW = 50_000;
  private static final int VALUE_CARDINALITY = 20_000;
  private static final long WINDOW_SECONDS = 10;

  private static AggregationConfig config(int id, String aggregationPackage, String type) {
    AggregationConfig config = new AggregationConfig();
    config.aggregationId = id;
    config.aggregationPackage = aggregationPackage;
    config.aggregationType = type;
    config.aggregationSubType = "element";
    config.tumblingWindowSize = (int) WINDOW_SECONDS;
    Map<String, String> parameters = new HashMap<>();
    parameters.put("elementType", "int8");
    config.parameters = parameters;
    return config;
  }

  private static DataStream<PrecomputedOutput> aggregate(
      DataStream<DataPoint> input, AggregationConfig config) {
    return input
        .keyBy(item -> "all")
        .window(TumblingEventTimeWindows.of(Time.seconds(WINDOW_SECONDS)))
        .aggregate(
            config.getAggregationFunction(),
            new KeyedWindowProcessor(config, "insertion", "summary", false));
  }

  public static void main(String[] args) throws Exception {
    StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
    DistinctCountAccumulatorSerializer.registerWith(env.getConfig());
    env.setParallelism(1);

    Random random = new Random(40L);
    List<DataPoint> points = new ArrayList<>();
    for (int window = 0; window < WINDOWS; window++) {
      long timestamp = window * WINDOW_SECONDS * 1000;
      for (int i = 0; i < ITEMS_PER_WINDOW; i++) {
        points.add(new DataPoint(timestamp, "all", (long) random.nextInt(VALUE_CARDINALITY)));
      }
    }

    DataStream<DataPoint> input =
        env.fromCollection(points)
            .assignTimestampsAndWatermarks(
                WatermarkStrategy.<DataPoint>forMonotonousTimestamps()
                    .withTimestampAssigner((event, timestamp) -> event.timestamp));

    DataStream<PrecomputedOutput> results =
        aggregate(input, config(1, "aggregates", "DistinctCount"))
            .union(aggregate(input, config(2, "baseline", "ExactDistinctCount")));

    Map<Long, PrecomputedOutput> distinct = new TreeMap<>();
    Map<Long, PrecomputedOutput> baseline = new TreeMap<>();
    try (CloseableIterator<PrecomputedOutput> iterator = results.executeAndCollect()) {
      while (iterator.hasNext()) {
        PrecomputedOutput output = iterator.next();
        (output.config.aggregationId == 1 ? distinct : baseline).put(output.startTimestamp, output);
      }
    }

    int windowNumber = 1;
    for (Map.Entry<Long, PrecomputedOutput> entry : distinct.entrySet()) {
      PrecomputedOutput reference = baseline.get(entry.getKey());
      if (reference == null) {
        LOG.warn("No baseline result for window starting at {}", entry.getKey());
        continue;
      }
      System.out.println(
          new MemoryComparator(entry.getValue(), reference).compareMemory(windowNumber++));
    }
  }
}
