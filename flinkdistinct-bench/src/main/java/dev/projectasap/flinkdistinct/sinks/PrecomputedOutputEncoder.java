/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.sinks;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.projectasap.flinkdistinct.datamodel.PrecomputedOutput;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import org.apache.flink.api.common.serialization.Encoder;

/** Writes window results either as raw bytes or as one JSON document per line. */
public class PrecomputedOutputEncoder implements Encoder<PrecomputedOutput> {
  private static final long serialVersionUID = 1L;

  public static final String FORMAT_BYTE = "byte";
  public static final String FORMAT_JSON = "json";

  private final String outputFormat;
  private transient ObjectMapper objectMapper;

  public PrecomputedOutputEncoder(String outputFormat) {
    if (!FORMAT_BYTE.equals(outputFormat) && !FORMAT_JSON.equals(outputFormat)) {
      throw new IllegalArgumentException("Invalid output format: " + outputFormat);
    }
    this.outputFormat = outputFormat;
  }

  @Override
  public void encode(PrecomputedOutput data, OutputStream stream) throws IOException {
    if (FORMAT_BYTE.equals(outputFormat)) {
      stream.write(data.serializeToBytes());
      return;
    }
    if (objectMapper == null) {
      objectMapper = new ObjectMapper();
    }
    stream.write(objectMapper.writeValueAsBytes(data.serializeToJson()));
    stream.write("\n".getBytes(StandardCharsets.UTF_8));
  }
}
