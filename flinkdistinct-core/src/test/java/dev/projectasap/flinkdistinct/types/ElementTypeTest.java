/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.types;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.projectasap.flinkdistinct.exceptions.UnsupportedElementTypeException;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ElementTypeTest {

  private static void assertAscending(ElementType type, Number... values) {
    for (int i = 1; i < values.length; i++) {
      byte[] lower = type.encode(values[i - 1]);
      byte[] higher = type.encode(values[i]);
      assertThat(Arrays.compareUnsigned(lower, higher))
          .as("%s < %s as %s", values[i - 1], values[i], type)
          .isNegative();
    }
  }

  @Test
  @DisplayName("should preserve numeric order for integer types")
  void shouldPreserveIntegerOrder() {
    assertAscending(ElementType.INT2, Short.MIN_VALUE, -1, 0, 1, Short.MAX_VALUE);
    assertAscending(ElementType.INT4, Integer.MIN_VALUE, -5, 0, 3, Integer.MAX_VALUE);
    assertAscending(ElementType.INT8, Long.MIN_VALUE, -1L, 0L, 1L << 40, Long.MAX_VALUE);
  }

  @Test
  @DisplayName("should preserve numeric order for floating point types")
  void shouldPreserveFloatOrder() {
    assertAscending(
        ElementType.FLOAT8,
        Double.NEGATIVE_INFINITY,
        -2.5,
        -1.0,
        -0.0,
        0.0,
        1.5,
        Double.POSITIVE_INFINITY);
    assertAscending(ElementType.FLOAT4, -3.25f, -0.5f, 0.0f, 0.5f, 100f);
  }

  @Test
  @DisplayName("should decode back to the encoded value")
  void shouldDecodeEncodedValues() {
    assertThat(ElementType.INT2.decode(ElementType.INT2.encode(-300))).isEqualTo((short) -300);
    assertThat(ElementType.INT4.decode(ElementType.INT4.encode(-7))).isEqualTo(-7);
    assertThat(ElementType.INT8.decode(ElementType.INT8.encode(1L << 50))).isEqualTo(1L << 50);
    assertThat(ElementType.FLOAT4.decode(ElementType.FLOAT4.encode(-1.5f))).isEqualTo(-1.5f);
    assertThat(ElementType.FLOAT8.decode(ElementType.FLOAT8.encode(Math.PI))).isEqualTo(Math.PI);
    assertThat(ElementType.DATE.decode(ElementType.DATE.encode(19000))).isEqualTo(19000);
    assertThat(ElementType.TIMESTAMP.decode(ElementType.TIMESTAMP.encode(1_700_000_000_000_000L)))
        .isEqualTo(1_700_000_000_000_000L);
  }

  @Test
  @DisplayName("should keep negative and positive zero apart")
  void shouldKeepZerosApart() {
    assertThat(ElementType.FLOAT8.encode(-0.0)).isNotEqualTo(ElementType.FLOAT8.encode(0.0));
    Number decoded = ElementType.FLOAT8.decode(ElementType.FLOAT8.encode(-0.0));
    assertThat(Double.doubleToRawLongBits(decoded.doubleValue()))
        .isEqualTo(Double.doubleToRawLongBits(-0.0));
  }

  @Test
  @DisplayName("should reject values out of range for the type")
  void shouldRejectOutOfRangeValues() {
    assertThatThrownBy(() -> ElementType.INT2.encode(70_000))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ElementType.INT4.encode(1L << 33))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("should refuse variable length and by-reference types")
  void shouldRefuseUnsupportedTypes() {
    assertThat(ElementType.INT8.isSupported()).isTrue();
    assertThat(ElementType.TEXT.isSupported()).isFalse();
    assertThat(ElementType.UUID.isFixedWidth()).isTrue();
    assertThat(ElementType.UUID.isSupported()).isFalse();

    assertThatThrownBy(ElementType.TEXT::itemSize)
        .isInstanceOf(UnsupportedElementTypeException.class)
        .hasMessageContaining("variable length");
    assertThatThrownBy(() -> ElementType.UUID.encode(1))
        .isInstanceOf(UnsupportedElementTypeException.class)
        .hasMessageContaining("passed by reference");
    assertThatThrownBy(ElementType.NUMERIC::checkSupported)
        .isInstanceOf(UnsupportedElementTypeException.class);
  }

  @Test
  @DisplayName("should resolve type names and aliases")
  void shouldResolveNames() {
    assertThat(ElementType.fromName("int4")).isEqualTo(ElementType.INT4);
    assertThat(ElementType.fromName("INTEGER")).isEqualTo(ElementType.INT4);
    assertThat(ElementType.fromName(" bigint ")).isEqualTo(ElementType.INT8);
    assertThat(ElementType.fromName("double precision")).isEqualTo(ElementType.FLOAT8);
    assertThat(ElementType.fromName("varchar")).isEqualTo(ElementType.TEXT);
    assertThatThrownBy(() -> ElementType.fromName("blob"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ElementType.fromName(null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
