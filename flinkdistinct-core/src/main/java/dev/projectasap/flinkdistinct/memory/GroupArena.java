/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.memory;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import org.apache.flink.core.memory.MemorySegment;
import org.apache.flink.core.memory.MemorySegmentFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-group allocator backed by unpooled heap memory segments. Tracks every live buffer so that
 * closing the arena releases whatever the group still holds, and keeps byte accounting for
 * memory reporting.
 */
public final class GroupArena implements BufferAllocator, AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(GroupArena.class);

  private final String name;
  private final Set<MemorySegment> liveSegments =
      Collections.newSetFromMap(new IdentityHashMap<>());
  private long bytesInUse;
  private long peakBytes;
  private boolean closed;

  public GroupArena(String name) {
    this.name = name;
  }

  @Override
  public ElementBuffer allocate(int itemSize, int capacityBytes) {
    ensureOpen();
    if (capacityBytes < 0) {
      throw new IllegalArgumentException(
          "Buffer capacity (" + capacityBytes + ") cannot be negative");
    }
    MemorySegment segment = MemorySegmentFactory.allocateUnpooledSegment(capacityBytes);
    liveSegments.add(segment);
    bytesInUse += capacityBytes;
    peakBytes = Math.max(peakBytes, bytesInUse);
    return new ElementBuffer(segment, itemSize);
  }

  @Override
  public ElementBuffer reallocate(ElementBuffer buffer, int capacityBytes) {
    ElementBuffer replacement = allocate(buffer.itemSize(), capacityBytes);
    int bytesToCopy = Math.min(buffer.capacityBytes(), capacityBytes);
    if (bytesToCopy > 0) {
      buffer.segment().copyTo(0, replacement.segment(), 0, bytesToCopy);
    }
    release(buffer);
    return replacement;
  }

  @Override
  public void release(ElementBuffer buffer) {
    MemorySegment segment = buffer.segment();
    if (!liveSegments.remove(segment)) {
      throw new IllegalStateException(
          "Buffer of " + buffer.capacityBytes() + " bytes is not owned by arena " + name);
    }
    bytesInUse -= segment.size();
    segment.free();
  }

  @Override
  public long bytesInUse() {
    return bytesInUse;
  }

  public long peakBytes() {
    return peakBytes;
  }

  public int liveBuffers() {
    return liveSegments.size();
  }

  public boolean isClosed() {
    return closed;
  }

  /** Releases every buffer still alive. Further allocations fail. */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (!liveSegments.isEmpty()) {
      LOG.debug(
          "Arena {} releasing {} live buffers ({} bytes, peak {} bytes)",
          name,
          liveSegments.size(),
          bytesInUse,
          peakBytes);
    }
    for (MemorySegment segment : liveSegments) {
      segment.free();
    }
    liveSegments.clear();
    bytesInUse = 0;
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("Arena " + name + " is already closed");
    }
  }

  @Override
  public String toString() {
    return "GroupArena{" + "name='" + name + '\'' + ", bytesInUse=" + bytesInUse + '}';
  }
}
