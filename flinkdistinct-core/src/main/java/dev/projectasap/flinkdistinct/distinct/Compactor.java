/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.distinct;

import dev.projectasap.flinkdistinct.exceptions.InvariantViolationException;
import dev.projectasap.flinkdistinct.memory.ElementBuffer;
import org.apache.flink.runtime.operators.sort.QuickSort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds the unsorted suffix of a {@link DistinctSet} into its sorted prefix: sort the suffix in
 * place, drop adjacent duplicates, then merge with the prefix. Optionally grows the buffer
 * afterwards so the next appends have room.
 */
final class Compactor {
  private static final Logger LOG = LoggerFactory.getLogger(Compactor.class);

  private static final QuickSort SORTER = new QuickSort();

  private Compactor() {}

  static void compact(DistinctSet set, boolean reserveSpace) {
    checkCounts(set);

    if (set.totalCount > set.sortedCount) {
      int unique = sortAndDeduplicateSuffix(set);
      if (set.sortedCount == 0) {
        set.totalCount = unique;
        set.sortedCount = unique;
      } else {
        mergeSuffixIntoPrefix(set, unique);
      }
    }

    if (reserveSpace) {
      reserveSpace(set);
    }
  }

  /**
   * Grows the buffer when less than {@link DistinctSetOptions#MIN_FREE_FRACTION} of it, or less
   * than one element, is free. Never called with an unsorted suffix.
   */
  static void reserveSpace(DistinctSet set) {
    ElementBuffer buffer = set.buffer;
    int itemSize = set.itemSize();
    int capacity = buffer.capacityBytes();
    long used = (long) set.totalCount * itemSize;
    double freeFraction = capacity == 0 ? 0.0 : (capacity - used) * 1.0 / capacity;

    if (freeFraction >= DistinctSetOptions.MIN_FREE_FRACTION && capacity - used >= itemSize) {
      return;
    }

    int grown = set.options().grownCapacity(capacity);
    while (grown - used < itemSize) {
      grown = set.options().grownCapacity(grown);
    }
    set.buffer = set.allocator().reallocate(buffer, grown);

    if (LOG.isDebugEnabled()) {
      LOG.debug(
          "Grew distinct set buffer: bytes={} item={} all={} sorted={}",
          grown,
          itemSize,
          set.totalCount,
          set.sortedCount);
    }
  }

  private static int sortAndDeduplicateSuffix(DistinctSet set) {
    ElementBuffer buffer = set.buffer;
    int from = set.sortedCount;
    int to = set.totalCount;

    SORTER.sort(new ElementSortable(buffer, to), from, to);

    int last = from;
    for (int i = from + 1; i < to; i++) {
      if (buffer.compare(last, i) != 0) {
        last++;
        if (last != i) {
          buffer.copyTo(i, buffer, last, 1);
        }
      }
    }
    return last - from + 1;
  }

  private static void mergeSuffixIntoPrefix(DistinctSet set, int suffixLength) {
    ElementBuffer source = set.buffer;
    int prefixLength = set.sortedCount;
    ElementBuffer merged = set.allocator().allocate(set.itemSize(), source.capacityBytes());

    int written =
        SortedMerger.mergeUnique(
            source, 0, prefixLength, source, prefixLength, prefixLength + suffixLength, merged);

    set.allocator().release(source);
    set.buffer = merged;
    set.sortedCount = written;
    set.totalCount = written;
  }

  private static void checkCounts(DistinctSet set) {
    if (set.totalCount <= 0) {
      throw new InvariantViolationException("Cannot compact an empty distinct set");
    }
    if (set.sortedCount > set.totalCount) {
      throw new InvariantViolationException(
          "Sorted count " + set.sortedCount + " exceeds total count " + set.totalCount);
    }
    if ((long) set.totalCount * set.itemSize() > set.buffer.capacityBytes()) {
      throw new InvariantViolationException(
          set.totalCount
              + " elements of "
              + set.itemSize()
              + " bytes overflow a "
              + set.buffer.capacityBytes()
              + " byte buffer");
    }
  }
}
