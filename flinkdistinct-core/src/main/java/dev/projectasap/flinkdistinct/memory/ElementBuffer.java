/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.memory;

import org.apache.flink.core.memory.MemorySegment;

/**
 * Flat byte region holding a contiguous sequence of fixed-width elements. Element {@code i}
 * occupies bytes {@code [i * itemSize, (i + 1) * itemSize)}. Buffers are obtained from a {@link
 * BufferAllocator} and never resized in place; callers re-derive positions from element indexes
 * after any operation that may have swapped the buffer.
 */
public final class ElementBuffer {
  private final MemorySegment segment;
  private final int itemSize;

  ElementBuffer(MemorySegment segment, int itemSize) {
    if (itemSize <= 0) {
      throw new IllegalArgumentException("Item size (" + itemSize + ") must be positive");
    }
    this.segment = segment;
    this.itemSize = itemSize;
  }

  public int itemSize() {
    return itemSize;
  }

  public int capacityBytes() {
    return segment.size();
  }

  /** Number of whole elements that fit into this buffer. */
  public int capacityElements() {
    return segment.size() / itemSize;
  }

  public boolean isReleased() {
    return segment.isFreed();
  }

  public void put(int index, byte[] source, int sourceOffset) {
    segment.put(index * itemSize, source, sourceOffset, itemSize);
  }

  public void get(int index, byte[] target, int targetOffset) {
    segment.get(index * itemSize, target, targetOffset, itemSize);
  }

  public byte[] get(int index) {
    byte[] element = new byte[itemSize];
    get(index, element, 0);
    return element;
  }

  /** Unsigned byte-wise comparison of elements {@code i} and {@code j} of this buffer. */
  public int compare(int i, int j) {
    return segment.compare(segment, i * itemSize, j * itemSize, itemSize);
  }

  /** Unsigned byte-wise comparison of element {@code i} here with element {@code j} of other. */
  public int compare(int i, ElementBuffer other, int j) {
    return segment.compare(other.segment, i * itemSize, j * itemSize, itemSize);
  }

  public void swap(int i, int j, byte[] scratch) {
    segment.swapBytes(scratch, segment, i * itemSize, j * itemSize, itemSize);
  }

  /** Copies {@code count} consecutive elements starting at {@code fromIndex} into target. */
  public void copyTo(int fromIndex, ElementBuffer target, int targetIndex, int count) {
    if (count == 0) {
      return;
    }
    segment.copyTo(fromIndex * itemSize, target.segment, targetIndex * itemSize, count * itemSize);
  }

  MemorySegment segment() {
    return segment;
  }
}
