/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.utils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.flinkdistinct.aggregates.DistinctCountAccumulator;
import dev.projectasap.flinkdistinct.distinct.DistinctSetOptions;
import dev.projectasap.flinkdistinct.types.ElementType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OutputStrategyTest {
  private final ObjectMapper objectMapper = new ObjectMapper();

  private static DistinctCountAccumulator summaryOf(long... values) {
    DistinctCountAccumulator acc =
        new DistinctCountAccumulator(ElementType.INT8, DistinctSetOptions.defaults());
    for (long value : values) {
      acc.add(value);
    }
    return acc;
  }

  @Test
  @DisplayName("should parse combined output modes")
  void shouldParseCombinedModes() {
    OutputStrategy.OutputModeFlags flags =
        new OutputStrategy("insertion", "query_memory", true).parseOutputMode();

    assertThat(flags.includeSummary).isFalse();
    assertThat(flags.includeQuery).isTrue();
    assertThat(flags.includeMemory).isTrue();
  }

  @Test
  @DisplayName("should reject unknown output modes")
  void shouldRejectUnknownModes() {
    OutputStrategy strategy = new OutputStrategy("insertion", "summary_histogram", true);

    assertThatThrownBy(strategy::parseOutputMode)
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("histogram");
  }

  @Test
  @DisplayName("should run queries only for the querying pipeline")
  void shouldRunQueriesOnlyWhenQuerying() {
    assertThat(new OutputStrategy("insertion", "summary", true).shouldExecuteQueries()).isFalse();
    assertThat(new OutputStrategy("insertion_querying", "query", true).shouldExecuteQueries())
        .isTrue();
  }

  @Test
  @DisplayName("should finalize to a count or to sorted values")
  void shouldFinalizeSummary() {
    DistinctCountAccumulator summary = summaryOf(9, 4, 9);

    assertThat(OutputStrategy.executeQuery(summary, null).get("distinct_count").asLong())
        .isEqualTo(2);
    assertThat(OutputStrategy.executeQuery(summary, "values").get("distinct_values").toString())
        .isEqualTo("[4,9]");
  }

  @Test
  @DisplayName("should emit the selected parts when verbose")
  void shouldEmitSelectedParts() {
    DistinctCountAccumulator summary = summaryOf(1, 2);
    ObjectNode query = OutputStrategy.executeQuery(summary, "count");

    ObjectNode output =
        new OutputStrategy("insertion_querying", "summary_query_memory", true)
            .buildOutput(summary, query, objectMapper);

    assertThat(output.get("summary").get("distinct_count").asLong()).isEqualTo(2);
    assertThat(output.get("query").get("distinct_count").asLong()).isEqualTo(2);
    assertThat(output.get("memory_bytes").asLong()).isEqualTo(32);
  }

  @Test
  @DisplayName("should flag missing query results and stay empty when not verbose")
  void shouldHandleMissingQueriesAndQuietMode() {
    DistinctCountAccumulator summary = summaryOf(1);

    ObjectNode missing =
        new OutputStrategy("insertion", "query", true).buildOutput(summary, null, objectMapper);
    ObjectNode quiet =
        new OutputStrategy("insertion", "summary", false).buildOutput(summary, null, objectMapper);

    assertThat(missing.has("query_error")).isTrue();
    assertThat(quiet.isEmpty()).isTrue();
  }
}
