/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.sinks;

import dev.projectasap.flinkdistinct.datamodel.PrecomputedOutput;
import java.time.Duration;
import org.apache.flink.api.connector.sink2.Sink;
import org.apache.flink.configuration.MemorySize;
import org.apache.flink.connector.file.sink.FileSink;
import org.apache.flink.core.fs.Path;
import org.apache.flink.streaming.api.functions.sink.filesystem.rollingpolicies.DefaultRollingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Builds the file sink that window results are written to. */
public class SinkBuilder {
  private static final Logger logger = LoggerFactory.getLogger(SinkBuilder.class);

  /**
   * Builds a row-format file sink.
   *
   * @param outputFormat "byte" or "json"
   * @param outputPath directory the part files are written to
   * @return the configured Flink sink
   */
  public static Sink<PrecomputedOutput> buildSink(String outputFormat, String outputPath) {
    logger.info("Building {} file sink at {}", outputFormat, outputPath);

    return FileSink.forRowFormat(new Path(outputPath), new PrecomputedOutputEncoder(outputFormat))
        .withRollingPolicy(
            DefaultRollingPolicy.builder()
                .withRolloverInterval(Duration.ofMinutes(15))
                .withInactivityInterval(Duration.ofMinutes(1))
                .withMaxPartSize(MemorySize.ofMebiBytes(1024))
                .build())
        .build();
  }
}
