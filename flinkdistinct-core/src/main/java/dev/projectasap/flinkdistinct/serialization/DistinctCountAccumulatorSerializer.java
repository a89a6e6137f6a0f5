/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.serialization;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.Serializer;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import dev.projectasap.flinkdistinct.aggregates.DistinctCountAccumulator;
import dev.projectasap.flinkdistinct.distinct.DistinctSetOptions;
import dev.projectasap.flinkdistinct.exceptions.CorruptStateException;
import dev.projectasap.flinkdistinct.types.ElementType;
import java.io.Serializable;
import org.apache.flink.api.common.ExecutionConfig;

/**
 * Kryo serializer moving distinct accumulators between Flink tasks and into state. Frames the
 * set payload with the element type, the sizing options and a length prefix; a zero length
 * stands for the absent state.
 *
 * <p>Jobs call {@link #registerWith(ExecutionConfig)} before building the pipeline.
 */
public class DistinctCountAccumulatorSerializer extends Serializer<DistinctCountAccumulator>
    implements Serializable {
  private static final long serialVersionUID = 1L;

  public static void registerWith(ExecutionConfig config) {
    config.registerTypeWithKryoSerializer(
        DistinctCountAccumulator.class, DistinctCountAccumulatorSerializer.class);
  }

  @Override
  public void write(Kryo kryo, Output output, DistinctCountAccumulator accumulator) {
    DistinctSetOptions options = accumulator.getOptions();
    byte[] payload = accumulator.serializeToBytes();

    output.writeString(accumulator.getElementType().name());
    output.writeInt(options.initialCapacityBytes());
    output.writeInt(options.largeAllocationThreshold());
    output.writeInt(payload.length);
    output.writeBytes(payload);
  }

  @Override
  public DistinctCountAccumulator read(
      Kryo kryo, Input input, Class<DistinctCountAccumulator> type) {
    String typeName = input.readString();
    ElementType elementType;
    try {
      elementType = ElementType.valueOf(typeName);
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new CorruptStateException("Unknown element type '" + typeName + "' in state", e);
    }

    DistinctSetOptions options;
    try {
      options = new DistinctSetOptions(input.readInt(), input.readInt());
    } catch (IllegalArgumentException e) {
      throw new CorruptStateException("Invalid distinct set options in state", e);
    }

    int length = input.readInt();
    if (length < 0) {
      throw new CorruptStateException("Negative distinct set payload length " + length);
    }
    byte[] payload = input.readBytes(length);
    return DistinctCountAccumulator.fromBytes(elementType, options, payload);
  }

  @Override
  public DistinctCountAccumulator copy(Kryo kryo, DistinctCountAccumulator original) {
    return original.copy();
  }
}
