/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.windowfunctions;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.flinkdistinct.datamodel.PrecomputedOutput;
import dev.projectasap.flinkdistinct.datamodel.Summary;
import dev.projectasap.flinkdistinct.utils.AggregationConfig;
import dev.projectasap.flinkdistinct.utils.OutputStrategy;
import org.apache.flink.streaming.api.functions.windowing.ProcessWindowFunction;
import org.apache.flink.streaming.api.windowing.windows.TimeWindow;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps the summary of one group and window into a {@link PrecomputedOutput}, running the
 * finalizing query when the pipeline asks for it.
 */
public class KeyedWindowProcessor
    extends ProcessWindowFunction<Summary, PrecomputedOutput, String, TimeWindow> {
  private static final Logger logger = LoggerFactory.getLogger(KeyedWindowProcessor.class);

  private final AggregationConfig config;
  private final String pipeline;
  private final String outputMode;
  private final boolean verbose;

  public KeyedWindowProcessor(
      AggregationConfig config, String pipeline, String outputMode, boolean verbose) {
    this.config = config;
    this.pipeline = pipeline;
    this.outputMode = outputMode;
    this.verbose = verbose;
  }

  @Override
  public void process(
      String key, Context context, Iterable<Summary> elements, Collector<PrecomputedOutput> out) {
    Summary result = elements.iterator().next();
    long start = context.window().getStart();
    long end = context.window().getEnd();

    PrecomputedOutput output =
        new PrecomputedOutput(start, end, result, config, key, pipeline, outputMode, verbose);

    if (output.getOutputStrategy().shouldExecuteQueries()) {
      ObjectNode queryResults = OutputStrategy.executeQuery(result, config.statistic);
      output.setCachedQueryResults(queryResults);
    }

    if (logger.isDebugEnabled()) {
      logger.debug(
          "Window [{}, {}) key={} memory_bytes={}", start, end, key, result.get_memory());
    }
    out.collect(output);
  }
}
