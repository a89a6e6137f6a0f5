/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.distinct;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DistinctSetOptionsTest {

  @Test
  @DisplayName("should fall back to defaults for missing parameters")
  void shouldFallBackToDefaults() {
    DistinctSetOptions options = DistinctSetOptions.fromParameters(Map.of("elementType", "int4"));

    assertThat(options).isEqualTo(DistinctSetOptions.defaults());
    assertThat(options.initialCapacityBytes()).isEqualTo(32);
    assertThat(options.largeAllocationThreshold()).isEqualTo(8192);
  }

  @Test
  @DisplayName("should read sizing parameters")
  void shouldReadSizingParameters() {
    DistinctSetOptions options =
        DistinctSetOptions.fromParameters(
            Map.of(
                DistinctSetOptions.INITIAL_CAPACITY, "256",
                DistinctSetOptions.LARGE_ALLOCATION_THRESHOLD, "1024"));

    assertThat(options.initialCapacityBytes()).isEqualTo(256);
    assertThat(options.largeAllocationThreshold()).isEqualTo(1024);
  }

  @Test
  @DisplayName("should reject malformed and out of range parameters")
  void shouldRejectBadParameters() {
    Map<String, String> malformed = Map.of(DistinctSetOptions.INITIAL_CAPACITY, "x");

    assertThatThrownBy(() -> DistinctSetOptions.fromParameters(malformed))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("must be an integer");
    assertThatThrownBy(() -> new DistinctSetOptions(0, 8192))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new DistinctSetOptions(32, -1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("should double small buffers and grow large ones by a quarter")
  void shouldFollowGrowthPolicy() {
    DistinctSetOptions options = DistinctSetOptions.defaults();

    assertThat(options.grownCapacity(32)).isEqualTo(64);
    assertThat(options.grownCapacity(4096)).isEqualTo(8192);
    assertThat(options.grownCapacity(8192)).isEqualTo(10240);
    assertThat(options.grownCapacity(10240)).isEqualTo(12800);
  }

  @Test
  @DisplayName("should always grow by at least one byte")
  void shouldAlwaysGrow() {
    DistinctSetOptions options = new DistinctSetOptions(1, 0);

    assertThat(options.grownCapacity(1)).isEqualTo(2);
    assertThat(options.grownCapacity(3)).isEqualTo(4);
    assertThat(options.grownCapacity(Integer.MAX_VALUE - 100))
        .isEqualTo(DistinctSetOptions.MAX_BUFFER_SIZE);
    assertThatThrownBy(() -> options.grownCapacity(DistinctSetOptions.MAX_BUFFER_SIZE))
        .isInstanceOf(IllegalStateException.class);
  }
}
