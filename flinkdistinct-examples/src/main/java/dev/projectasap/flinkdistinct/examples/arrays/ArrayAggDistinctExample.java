/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.examples.arrays;

import dev.projectasap.flinkdistinct.aggregates.ArrayAggDistinct;
import dev.projectasap.flinkdistinct.datamodel.DataPoint;
import dev.projectasap.flinkdistinct.serialization.DistinctCountAccumulatorSerializer;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.streaming.api.windowing.assigners.TumblingEventTimeWindows;
import org.apache.flink.streaming.api.windowing.time.Time;

/**
 * Collects the sorted distinct elements of array values per key. Null arrays and null elements
 * are ignored; a key that only ever saw nulls yields an empty list.
 */
public class ArrayAggDistinctExample {
  public static void main(String[] args) throws Exception {
    StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
    DistinctCountAccumulatorSerializer.registerWith(env.getConfig());

    DataStream<DataPoint> dataStream =
        env.fromElements(
            DataPoint.ofValues(1L, "sensor-a", 1.5, 2.0),
            DataPoint.ofValues(2L, "sensor-a", 2.0, null, -0.5),
            DataPoint.ofValues(3L, "sensor-b", (Number[]) null),
            DataPoint.ofValues(4L, "sensor-b", null, null),
            DataPoint.ofValues(5L, "sensor-a", 1.5));

    dataStream =
        dataStream.assignTimestampsAndWatermarks(
            WatermarkStrategy.<DataPoint>forMonotonousTimestamps()
                .withTimestampAssigner((event, timestamp) -> event.timestamp));

    Map<String, String> params = new HashMap<>();
    params.put("elementType", "float8");

    DataStream<List<Number>> values =
        dataStream
            .keyBy(item -> item.key)
            .window(TumblingEventTimeWindows.of(Time.seconds(5)))
            .aggregate(new ArrayAggDistinct("elements", params));

    // sensor-a -> [-0.5, 1.5, 2.0]
    values.map(list -> list.toString()).print();

    env.execute("Array Aggregation of Distinct Elements");
  }
}
