/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.distinct;

import dev.projectasap.flinkdistinct.exceptions.InvariantViolationException;
import dev.projectasap.flinkdistinct.memory.BufferAllocator;
import dev.projectasap.flinkdistinct.memory.ElementBuffer;
import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Exact set of distinct fixed-width elements.
 *
 * <p>The buffer is split into a sorted, duplicate-free prefix {@code [0, sortedCount)} and an
 * unsorted suffix {@code [sortedCount, totalCount)} of elements appended since the last
 * compaction. Appends only write to the suffix; when the buffer fills up the suffix is sorted,
 * deduplicated and merged into the prefix, and the buffer grows if it is still mostly full. This
 * keeps appends O(1) amortized and avoids any per-element hashing.
 *
 * <p>Elements are compared as unsigned byte strings. Instances are not thread-safe and must be
 * owned by a single aggregation group.
 */
public final class DistinctSet {
  private final int itemSize;
  private final BufferAllocator allocator;
  private final DistinctSetOptions options;

  // mutated by Compactor
  ElementBuffer buffer;
  int sortedCount;
  int totalCount;

  private int modifications;
  private boolean released;

  /**
   * Creates an empty set with the initial capacity from options.
   *
   * @param itemSize width in bytes of every element
   * @param allocator allocator of the owning group, used for every buffer of this set
   * @param options buffer sizing options
   */
  public DistinctSet(int itemSize, BufferAllocator allocator, DistinctSetOptions options) {
    this(itemSize, allocator, options, null, 0, 0);
    this.buffer = allocator.allocate(itemSize, options.initialCapacityBytes());
  }

  private DistinctSet(
      int itemSize,
      BufferAllocator allocator,
      DistinctSetOptions options,
      ElementBuffer buffer,
      int sortedCount,
      int totalCount) {
    if (itemSize <= 0) {
      throw new IllegalArgumentException("Item size (" + itemSize + ") must be positive");
    }
    this.itemSize = itemSize;
    this.allocator = allocator;
    this.options = options;
    this.buffer = buffer;
    this.sortedCount = sortedCount;
    this.totalCount = totalCount;
  }

  /** Wraps an already sorted and deduplicated buffer, as produced by deserialization. */
  static DistinctSet ofSortedBuffer(
      ElementBuffer buffer, int count, BufferAllocator allocator, DistinctSetOptions options) {
    return new DistinctSet(buffer.itemSize(), allocator, options, buffer, count, count);
  }

  /**
   * Appends one element. The element lands in the unsorted suffix; duplicates are removed at the
   * next compaction.
   *
   * @param value exactly {@code itemSize} bytes
   */
  public void append(byte[] value) {
    if (value.length != itemSize) {
      throw new IllegalArgumentException(
          "Element has " + value.length + " bytes, this set stores " + itemSize + " byte items");
    }
    append(value, 0);
  }

  /** Appends the {@code itemSize} bytes of source starting at offset. */
  public void append(byte[] source, int offset) {
    ensureLive();
    if (offset < 0 || source.length - offset < itemSize) {
      throw new IllegalArgumentException(
          "Need " + itemSize + " bytes at offset " + offset + " of a " + source.length
              + " byte array");
    }
    if ((long) itemSize * (totalCount + 1) > buffer.capacityBytes()) {
      if (totalCount == 0) {
        Compactor.reserveSpace(this);
      } else {
        Compactor.compact(this, true);
      }
    }
    buffer.put(totalCount, source, offset);
    totalCount++;
    modifications++;
  }

  /**
   * Sorts and deduplicates pending appends into the sorted prefix. Without {@code reserveSpace}
   * this is idempotent; with it the buffer may additionally grow.
   */
  public void compact(boolean reserveSpace) {
    ensureLive();
    if (totalCount == 0) {
      return;
    }
    if (sortedCount != totalCount || reserveSpace) {
      Compactor.compact(this, reserveSpace);
      modifications++;
    }
  }

  /**
   * Merges other into this set. Both sets are compacted first; the result is the sorted distinct
   * union and replaces this set's buffer. Other keeps its logical contents.
   *
   * @param other a set with the same item size
   */
  public void combine(DistinctSet other) {
    ensureLive();
    other.ensureLive();
    if (other == this) {
      compact(false);
      return;
    }
    if (itemSize != other.itemSize) {
      throw new InvariantViolationException(
          "Cannot combine distinct sets of "
              + itemSize
              + " and "
              + other.itemSize
              + " byte items");
    }

    compact(false);
    other.compact(false);
    if (other.totalCount == 0) {
      return;
    }

    long worstCase = ((long) totalCount + other.totalCount) * itemSize;
    if (worstCase > DistinctSetOptions.MAX_BUFFER_SIZE) {
      throw new IllegalStateException(
          "Combined distinct set would need " + worstCase + " bytes");
    }
    ElementBuffer merged = allocator.allocate(itemSize, (int) worstCase);
    int written =
        SortedMerger.mergeUnique(
            buffer, 0, totalCount, other.buffer, 0, other.totalCount, merged);

    allocator.release(buffer);
    buffer = merged;
    sortedCount = written;
    totalCount = written;
    modifications++;
  }

  /** Number of distinct elements. Compacts pending appends. */
  public int count() {
    compact(false);
    return totalCount;
  }

  /**
   * Distinct elements in ascending byte order. Compacts pending appends; the returned iterable
   * can be traversed repeatedly until the set is modified.
   */
  public Iterable<byte[]> sortedElements() {
    compact(false);
    return () -> new SortedIterator(modifications);
  }

  public List<byte[]> toSortedList() {
    List<byte[]> elements = new ArrayList<>(count());
    for (byte[] element : sortedElements()) {
      elements.add(element);
    }
    return elements;
  }

  /**
   * Deep copy of this set whose buffers come from another allocator. Pending appends are copied
   * as they are.
   */
  public DistinctSet copy(BufferAllocator targetAllocator) {
    ensureLive();
    ElementBuffer target = targetAllocator.allocate(itemSize, buffer.capacityBytes());
    buffer.copyTo(0, target, 0, totalCount);
    return new DistinctSet(itemSize, targetAllocator, options, target, sortedCount, totalCount);
  }

  /** Returns this set's buffer to its allocator. The set is unusable afterwards. */
  public void release() {
    if (released) {
      return;
    }
    released = true;
    modifications++;
    allocator.release(buffer);
    buffer = null;
  }

  public boolean isReleased() {
    return released;
  }

  public int itemSize() {
    return itemSize;
  }

  public int sortedCount() {
    return sortedCount;
  }

  public int totalCount() {
    return totalCount;
  }

  public int capacityBytes() {
    ensureLive();
    return buffer.capacityBytes();
  }

  public boolean isCompacted() {
    return sortedCount == totalCount;
  }

  public DistinctSetOptions options() {
    return options;
  }

  BufferAllocator allocator() {
    return allocator;
  }

  /** Copies element {@code index} of the sorted prefix into target. */
  void readSorted(int index, byte[] target, int targetOffset) {
    if (index < 0 || index >= sortedCount) {
      throw new IndexOutOfBoundsException(
          "Index " + index + " outside the " + sortedCount + " sorted elements");
    }
    buffer.get(index, target, targetOffset);
  }

  private void ensureLive() {
    if (released) {
      throw new IllegalStateException("Distinct set has already been released");
    }
  }

  @Override
  public String toString() {
    return "DistinctSet{"
        + "itemSize="
        + itemSize
        + ", sortedCount="
        + sortedCount
        + ", totalCount="
        + totalCount
        + ", capacityBytes="
        + (released ? "released" : String.valueOf(buffer.capacityBytes()))
        + '}';
  }

  private final class SortedIterator implements Iterator<byte[]> {
    private final int expectedModifications;
    private int next;

    SortedIterator(int expectedModifications) {
      this.expectedModifications = expectedModifications;
    }

    @Override
    public boolean hasNext() {
      checkUnmodified();
      return next < sortedCount;
    }

    @Override
    public byte[] next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return buffer.get(next++);
    }

    private void checkUnmodified() {
      if (modifications != expectedModifications) {
        throw new ConcurrentModificationException("Distinct set modified during iteration");
      }
    }
  }
}
