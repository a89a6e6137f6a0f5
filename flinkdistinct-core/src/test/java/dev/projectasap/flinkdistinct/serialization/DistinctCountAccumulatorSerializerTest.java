/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import dev.projectasap.flinkdistinct.aggregates.DistinctCountAccumulator;
import dev.projectasap.flinkdistinct.distinct.DistinctSetOptions;
import dev.projectasap.flinkdistinct.exceptions.CorruptStateException;
import dev.projectasap.flinkdistinct.types.ElementType;
import java.io.ByteArrayOutputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DistinctCountAccumulatorSerializerTest {
  private Kryo kryo;

  @BeforeEach
  void setUp() {
    kryo = new Kryo();
    kryo.register(DistinctCountAccumulator.class, new DistinctCountAccumulatorSerializer());
  }

  private byte[] write(DistinctCountAccumulator accumulator) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    Output output = new Output(bytes);
    kryo.writeObject(output, accumulator);
    output.close();
    return bytes.toByteArray();
  }

  private DistinctCountAccumulator read(byte[] bytes) {
    return kryo.readObject(new Input(bytes), DistinctCountAccumulator.class);
  }

  @Test
  @DisplayName("should carry values, type and options through Kryo")
  void shouldRoundTripThroughKryo() {
    DistinctSetOptions options = new DistinctSetOptions(64, 1024);
    DistinctCountAccumulator accumulator =
        new DistinctCountAccumulator(ElementType.TIMESTAMP, options);
    accumulator.addAll(30L, 10L, 20L, 10L);

    DistinctCountAccumulator restored = read(write(accumulator));

    assertThat(restored.getElementType()).isEqualTo(ElementType.TIMESTAMP);
    assertThat(restored.getOptions()).isEqualTo(options);
    assertThat(restored.toSortedList()).containsExactly(10L, 20L, 30L);
  }

  @Test
  @DisplayName("should carry the absent state through Kryo")
  void shouldRoundTripAbsentState() {
    DistinctCountAccumulator absent =
        new DistinctCountAccumulator(ElementType.INT2, DistinctSetOptions.defaults());

    DistinctCountAccumulator restored = read(write(absent));

    assertThat(restored.isAbsent()).isTrue();
    assertThat(restored.count()).isZero();
  }

  @Test
  @DisplayName("should make independent copies")
  void shouldMakeIndependentCopies() {
    DistinctCountAccumulator accumulator =
        new DistinctCountAccumulator(ElementType.INT4, DistinctSetOptions.defaults());
    accumulator.addAll(1, 2);

    DistinctCountAccumulator copy = kryo.copy(accumulator);
    accumulator.add(3);

    assertThat(copy.toSortedList()).containsExactly(1, 2);
  }

  @Test
  @DisplayName("should fail on an unknown element type")
  void shouldFailOnUnknownType() {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    Output output = new Output(bytes);
    output.writeString("BLOB");
    output.writeInt(32);
    output.writeInt(8192);
    output.writeInt(0);
    output.close();

    DistinctCountAccumulatorSerializer serializer = new DistinctCountAccumulatorSerializer();
    Input input = new Input(bytes.toByteArray());

    assertThatThrownBy(() -> serializer.read(kryo, input, DistinctCountAccumulator.class))
        .isInstanceOf(CorruptStateException.class)
        .hasMessageContaining("BLOB");
  }
}
