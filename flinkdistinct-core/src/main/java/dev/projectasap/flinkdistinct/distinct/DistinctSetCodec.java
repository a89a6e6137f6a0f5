/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.distinct;

import dev.projectasap.flinkdistinct.exceptions.CorruptStateException;
import dev.projectasap.flinkdistinct.memory.BufferAllocator;
import dev.projectasap.flinkdistinct.memory.ElementBuffer;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Binary form of a compacted {@link DistinctSet}, used to ship partial results between workers.
 *
 * <pre>
 * [item_size:u32][sorted_count:u32][total_count:u32][capacity_bytes:u32][elements]
 * </pre>
 *
 * <p>The header is little-endian, the elements follow in ascending order, {@code total_count *
 * item_size} bytes in all. Any length framing belongs to the transport.
 */
public final class DistinctSetCodec {
  public static final int HEADER_SIZE = 4 * Integer.BYTES;

  private DistinctSetCodec() {}

  /**
   * Serializes a set, compacting it first.
   *
   * @param set a non-empty set
   * @return header followed by the sorted elements
   */
  public static byte[] serialize(DistinctSet set) {
    set.compact(false);
    if (set.totalCount() == 0) {
      throw new IllegalArgumentException("An empty distinct set has no serialized form");
    }

    int itemSize = set.itemSize();
    int count = set.totalCount();
    ByteBuffer buffer =
        ByteBuffer.allocate(HEADER_SIZE + count * itemSize).order(ByteOrder.LITTLE_ENDIAN);
    buffer.putInt(itemSize);
    buffer.putInt(set.sortedCount());
    buffer.putInt(count);
    buffer.putInt(set.capacityBytes());

    byte[] out = buffer.array();
    for (int i = 0; i < count; i++) {
      set.readSorted(i, out, HEADER_SIZE + i * itemSize);
    }
    return out;
  }

  /**
   * Rebuilds a set from its serialized form. The buffer is sized to hold exactly the stored
   * elements, since deserialized sets are combined or finalized rather than appended to.
   *
   * @param payload bytes produced by {@link #serialize(DistinctSet)}
   * @param allocator allocator of the group that will own the set
   * @param options sizing options for later growth
   * @throws CorruptStateException if the payload does not match its header
   */
  public static DistinctSet deserialize(
      byte[] payload, BufferAllocator allocator, DistinctSetOptions options) {
    if (payload.length < HEADER_SIZE) {
      throw new CorruptStateException(
          "Serialized distinct set has "
              + payload.length
              + " bytes, shorter than its "
              + HEADER_SIZE
              + " byte header");
    }

    ByteBuffer header = ByteBuffer.wrap(payload, 0, HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
    long itemSize = Integer.toUnsignedLong(header.getInt());
    long sortedCount = Integer.toUnsignedLong(header.getInt());
    long totalCount = Integer.toUnsignedLong(header.getInt());
    long capacityBytes = Integer.toUnsignedLong(header.getInt());

    if (itemSize == 0 || totalCount == 0) {
      throw new CorruptStateException(
          "Serialized distinct set declares item size "
              + itemSize
              + " and "
              + totalCount
              + " elements");
    }
    if (sortedCount != totalCount) {
      throw new CorruptStateException(
          "Serialized distinct set is not compacted: "
              + sortedCount
              + " sorted of "
              + totalCount
              + " elements");
    }
    long dataLength = totalCount * itemSize;
    if (payload.length != HEADER_SIZE + dataLength) {
      throw new CorruptStateException(
          "Serialized distinct set has "
              + payload.length
              + " bytes, header declares "
              + (HEADER_SIZE + dataLength));
    }
    if (capacityBytes < dataLength) {
      throw new CorruptStateException(
          "Serialized distinct set declares a "
              + capacityBytes
              + " byte capacity for "
              + dataLength
              + " bytes of elements");
    }

    int count = (int) totalCount;
    ElementBuffer buffer = allocator.allocate((int) itemSize, (int) dataLength);
    for (int i = 0; i < count; i++) {
      buffer.put(i, payload, HEADER_SIZE + i * (int) itemSize);
    }
    for (int i = 1; i < count; i++) {
      if (buffer.compare(i - 1, i) >= 0) {
        allocator.release(buffer);
        throw new CorruptStateException(
            "Serialized distinct set elements are not strictly increasing at index " + i);
      }
    }
    return DistinctSet.ofSortedBuffer(buffer, count, allocator, options);
  }
}
