/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.utils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Paths;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConfigLoaderTest {

  @Test
  @DisplayName("should load aggregations from a YAML file")
  void shouldLoadAggregationsFromFile() throws Exception {
    String path =
        Paths.get(getClass().getResource("/configs/test_config.yaml").toURI()).toString();

    StreamingConfig config = ConfigLoader.loadConfig(path);

    assertThat(config.aggregationConfigs).hasSize(2);
    AggregationConfig first = config.aggregationConfigs.get(0);
    assertThat(first.aggregationId).isEqualTo(7);
    assertThat(first.aggregationType).isEqualTo("DistinctCount");
    assertThat(first.aggregationSubType).isEqualTo("element");
    assertThat(first.aggregationPackage).isEqualTo("aggregates");
    assertThat(first.tumblingWindowSize).isEqualTo(60);
    assertThat(first.statistic).isEqualTo("values");
    assertThat(first.parameters)
        .containsEntry("elementType", "float8")
        .containsEntry("initialCapacity", "64");

    AggregationConfig second = config.aggregationConfigs.get(1);
    assertThat(second.aggregationPackage).isEqualTo("baseline");
    assertThat(second.statistic).isNull();
  }

  @Test
  @DisplayName("should keep the original aggregation text for byte output")
  void shouldKeepOriginalText() throws Exception {
    StreamingConfig config =
        ConfigLoader.parseConfig(
            "aggregations:\n"
                + "  - aggregationId: 1\n"
                + "    aggregationType: DistinctCount\n"
                + "    aggregationSubType: element\n"
                + "    tumblingWindowSize: 5\n");

    AggregationConfig aggregation = config.aggregationConfigs.get(0);
    assertThat(aggregation.parameters).isEmpty();
    assertThat(new String(aggregation.serializeToBytes(), "UTF-8")).contains("DistinctCount");
  }

  @Test
  @DisplayName("should name the missing field")
  void shouldNameMissingField() {
    String yaml =
        "aggregations:\n"
            + "  - aggregationId: 1\n"
            + "    aggregationSubType: element\n"
            + "    tumblingWindowSize: 5\n";

    assertThatThrownBy(() -> ConfigLoader.parseConfig(yaml))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("aggregationType");
  }

  @Test
  @DisplayName("should reject a document without aggregations")
  void shouldRejectDocumentWithoutAggregations() {
    assertThatThrownBy(() -> ConfigLoader.parseConfig("other: 1\n"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
