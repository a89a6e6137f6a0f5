/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.examples.quickstart;

import dev.projectasap.flinkdistinct.aggregates.DistinctCount;
import dev.projectasap.flinkdistinct.datamodel.DataPoint;
import dev.projectasap.flinkdistinct.datamodel.PrecomputedOutput;
import dev.projectasap.flinkdistinct.serialization.DistinctCountAccumulatorSerializer;
import dev.projectasap.flinkdistinct.utils.AggregationConfig;
import dev.projectasap.flinkdistinct.windowfunctions.KeyedWindowProcessor;
import java.util.HashMap;
import java.util.Map;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.streaming.api.windowing.assigners.TumblingEventTimeWindows;
import org.apache.flink.streaming.api.windowing.time.Time;

/** Quick start example: exact count of distinct values per key over a tumbling window. */
public class QuickStart {
  public static void main(String[] args) throws Exception {
    StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
    DistinctCountAccumulatorSerializer.registerWith(env.getConfig());

    // null values are skipped, repeats count once
    DataStream<DataPoint> dataStream =
        env.fromElements(
            new DataPoint(1L, "apple", 5),
            new DataPoint(2L, "banana", 3),
            new DataPoint(3L, "apple", 3),
            new DataPoint(4L, "apple", 5),
            new DataPoint(5L, "banana", null),
            new DataPoint(6L, "apple", 1),
            new DataPoint(7L, "banana", 3),
            new DataPoint(8L, "apple", 3));

    dataStream =
        dataStream.assignTimestampsAndWatermarks(
            WatermarkStrategy.<DataPoint>forMonotonousTimestamps()
                .withTimestampAssigner((event, timestamp) -> event.timestamp));

    Map<String, String> params = new HashMap<>();
    params.put("elementType", "int4");

    AggregationConfig config = new AggregationConfig();
    config.aggregationType = "DistinctCount";
    config.aggregationSubType = "element";
    config.parameters = params;

    DataStream<PrecomputedOutput> outputStream =
        dataStream
            .keyBy(item -> item.key)
            .window(TumblingEventTimeWindows.of(Time.seconds(5)))
            .aggregate(
                new DistinctCount("element", params),
                new KeyedWindowProcessor(config, "insertion", "summary", false));

    // apple -> 3 distinct values (1, 3, 5), banana -> 1 (3)
    outputStream
        .map(result -> result.key + ": " + result.precompute.query(null).get("distinct_count"))
        .print();

    env.execute("Quick Start - Exact Distinct Count");
  }
}
