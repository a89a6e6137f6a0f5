/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.examples.utils;

import dev.projectasap.flinkdistinct.datamodel.PrecomputedOutput;
import dev.projectasap.flinkdistinct.datamodel.Summary;

/**
 * Compares one window's distinct set result against the hash set baseline: memory of the raw
 * buffers and whether both report the same distinct count.
 */
public class MemoryComparator {

  private final PrecomputedOutput baselineOutput;
  private final PrecomputedOutput distinctOutput;

  public MemoryComparator(PrecomputedOutput distinct, PrecomputedOutput baseline) {
    this.baselineOutput = baseline;
    this.distinctOutput = distinct;
  }

  public MemoryComparisonResult compareMemory() {
    return compareMemory(-1);
  }

  /**
   * Compares memory and counts of the two outputs.
   *
   * @param windowNumber the window number (1-indexed), or -1 when unknown
   * @return MemoryComparisonResult containing memory metrics and both counts
   */
  public MemoryComparisonResult compareMemory(int windowNumber) {
    Summary<?> baseline = baselineOutput.precompute;
    Summary<?> distinct = distinctOutput.precompute;

    return new MemoryComparisonResult(
        baseline.get_memory(),
        distinct.get_memory(),
        distinctCount(baseline),
        distinctCount(distinct),
        windowNumber);
  }

  private static long distinctCount(Summary<?> summary) {
    return summary.query(null).path("distinct_count").asLong(-1);
  }

  /** Result class containing memory comparison metrics. */
  public static class MemoryComparisonResult {
    public final long baselineMemoryBytes;
    public final long distinctMemoryBytes;
    public final long baselineCount;
    public final long distinctCount;
    public final double bufferOverhead;
    public final int windowNumber;

    public MemoryComparisonResult(
        long baselineMemoryBytes,
        long distinctMemoryBytes,
        long baselineCount,
        long distinctCount,
        int windowNumber) {
      this.baselineMemoryBytes = baselineMemoryBytes;
      this.distinctMemoryBytes = distinctMemoryBytes;
      this.baselineCount = baselineCount;
      this.distinctCount = distinctCount;
      this.windowNumber = windowNumber;
      this.bufferOverhead =
          baselineMemoryBytes > 0 ? (double) distinctMemoryBytes / baselineMemoryBytes : 0.0;
    }

    public boolean countsMatch() {
      return baselineCount == distinctCount;
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      sb.append("\n========== MEMORY COMPARISON ==========\n");
      if (windowNumber >= 0) {
        sb.append(String.format("Window:                  #%d\n", windowNumber));
      }
      sb.append(
          String.format(
              "Distinct count:          %,d (baseline %,d)%s\n",
              distinctCount, baselineCount, countsMatch() ? "" : "  MISMATCH"));
      sb.append(
          String.format(
              "Element payload:         %,d bytes (%.2f KB)\n",
              baselineMemoryBytes, baselineMemoryBytes / 1024.0));
      sb.append(
          String.format(
              "Distinct set buffer:     %,d bytes (%.2f KB)\n",
              distinctMemoryBytes, distinctMemoryBytes / 1024.0));
      sb.append(String.format("Buffer / payload:        %.2fx\n", bufferOverhead));
      sb.append("=======================================");

      return sb.toString();
    }
  }
}
