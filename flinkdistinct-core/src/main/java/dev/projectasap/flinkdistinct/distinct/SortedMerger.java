/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.distinct;

import dev.projectasap.flinkdistinct.exceptions.InvariantViolationException;
import dev.projectasap.flinkdistinct.memory.ElementBuffer;

/**
 * Two-way merge of sorted, duplicate-free element runs into a sorted, duplicate-free output.
 * Shared by compaction (prefix with freshly sorted suffix) and by combining partial results.
 */
final class SortedMerger {

  private SortedMerger() {}

  /**
   * Merges {@code left[leftFrom, leftTo)} and {@code right[rightFrom, rightTo)} into target
   * starting at element 0. Both runs must be strictly increasing. Equal heads are written once.
   *
   * @return number of elements written to target
   */
  static int mergeUnique(
      ElementBuffer left,
      int leftFrom,
      int leftTo,
      ElementBuffer right,
      int rightFrom,
      int rightTo,
      ElementBuffer target) {
    int worstCase = (leftTo - leftFrom) + (rightTo - rightFrom);
    if (worstCase > target.capacityElements()) {
      throw new InvariantViolationException(
          "Merge target holds "
              + target.capacityElements()
              + " elements, inputs may need "
              + worstCase);
    }

    int a = leftFrom;
    int b = rightFrom;
    int written = 0;
    while (a < leftTo && b < rightTo) {
      int cmp = left.compare(a, right, b);
      if (cmp == 0) {
        left.copyTo(a, target, written, 1);
        a++;
        b++;
      } else if (cmp < 0) {
        left.copyTo(a, target, written, 1);
        a++;
      } else {
        right.copyTo(b, target, written, 1);
        b++;
      }
      written++;
    }

    // at most one side has a remainder
    if (a < leftTo) {
      left.copyTo(a, target, written, leftTo - a);
      written += leftTo - a;
    } else if (b < rightTo) {
      right.copyTo(b, target, written, rightTo - b);
      written += rightTo - b;
    }

    return written;
  }
}
