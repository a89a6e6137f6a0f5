/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.memory;

/**
 * Allocation handle through which a distinct set obtains, grows and releases its element
 * buffers. One allocator belongs to one aggregation group and is torn down together with it.
 */
public interface BufferAllocator {

  /**
   * Allocates a zeroed buffer.
   *
   * @param itemSize width in bytes of the elements the buffer will hold
   * @param capacityBytes total buffer size in bytes
   * @return a new buffer owned by this allocator
   */
  ElementBuffer allocate(int itemSize, int capacityBytes);

  /**
   * Allocates a buffer of a new size, copies as many leading bytes of the old buffer as fit and
   * releases the old buffer.
   *
   * @param buffer the buffer to replace, must have been allocated here
   * @param capacityBytes size of the replacement in bytes
   * @return the replacement buffer
   */
  ElementBuffer reallocate(ElementBuffer buffer, int capacityBytes);

  /** Returns the buffer's memory. The buffer must not be touched afterwards. */
  void release(ElementBuffer buffer);

  /** Bytes currently held by live buffers of this allocator. */
  long bytesInUse();
}
