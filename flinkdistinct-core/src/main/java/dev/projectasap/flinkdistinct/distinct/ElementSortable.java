/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.distinct;

import dev.projectasap.flinkdistinct.memory.ElementBuffer;
import org.apache.flink.runtime.operators.sort.IndexedSortable;

/**
 * Exposes the elements of a single buffer to Flink's in-place sorters. The whole buffer is one
 * segment; segment coordinates are mapped back to element indexes.
 */
final class ElementSortable implements IndexedSortable {
  private final ElementBuffer buffer;
  private final int size;
  private final int itemSize;
  private final int recordsPerSegment;
  private final byte[] scratch;

  ElementSortable(ElementBuffer buffer, int size) {
    this.buffer = buffer;
    this.size = size;
    this.itemSize = buffer.itemSize();
    this.recordsPerSegment = Math.max(1, buffer.capacityElements());
    this.scratch = new byte[itemSize];
  }

  @Override
  public int compare(int i, int j) {
    return buffer.compare(i, j);
  }

  @Override
  public int compare(
      int segmentNumberI, int segmentOffsetI, int segmentNumberJ, int segmentOffsetJ) {
    return buffer.compare(
        index(segmentNumberI, segmentOffsetI), index(segmentNumberJ, segmentOffsetJ));
  }

  @Override
  public void swap(int i, int j) {
    buffer.swap(i, j, scratch);
  }

  @Override
  public void swap(
      int segmentNumberI, int segmentOffsetI, int segmentNumberJ, int segmentOffsetJ) {
    buffer.swap(
        index(segmentNumberI, segmentOffsetI), index(segmentNumberJ, segmentOffsetJ), scratch);
  }

  @Override
  public int size() {
    return size;
  }

  @Override
  public int recordSize() {
    return itemSize;
  }

  @Override
  public int recordsPerSegment() {
    return recordsPerSegment;
  }

  private int index(int segmentNumber, int segmentOffset) {
    return segmentNumber * recordsPerSegment + segmentOffset / itemSize;
  }
}
