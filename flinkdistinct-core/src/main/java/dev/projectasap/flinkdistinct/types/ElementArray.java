/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.types;

import java.util.Arrays;
import java.util.List;

/**
 * Array value fed to the per-element aggregates. Non-null elements are packed back to back, each
 * starting at an offset aligned to the element type's alignment, and a null bitmap marks which
 * positions hold a value (bit set means present). The bitmap is omitted when no element is null.
 */
public final class ElementArray {

  /** Receives one stored element: {@code itemSize} bytes of source starting at offset. */
  @FunctionalInterface
  public interface ElementConsumer {
    void accept(byte[] source, int offset);
  }

  private final ElementType elementType;
  private final int length;
  private final byte[] data;
  private final byte[] nullBitmap;

  private ElementArray(ElementType elementType, int length, byte[] data, byte[] nullBitmap) {
    this.elementType = elementType;
    this.length = length;
    this.data = data;
    this.nullBitmap = nullBitmap;
  }

  public static ElementArray of(ElementType elementType, Number... values) {
    return of(elementType, values == null ? null : Arrays.asList(values));
  }

  /**
   * Packs values into array form.
   *
   * @param elementType type of every element
   * @param values elements, any of which may be null
   * @return the packed array
   */
  public static ElementArray of(ElementType elementType, List<? extends Number> values) {
    if (values == null || values.isEmpty()) {
      return new ElementArray(elementType, 0, new byte[0], null);
    }

    int nonNull = 0;
    for (Number value : values) {
      if (value != null) {
        nonNull++;
      }
    }
    if (nonNull == 0) {
      return new ElementArray(elementType, values.size(), new byte[0], nullBitmap(values));
    }

    int stride = alignedStride(elementType);
    byte[] data = new byte[nonNull * stride];
    int offset = 0;
    for (Number value : values) {
      if (value != null) {
        elementType.encode(value, data, offset);
        offset += stride;
      }
    }
    byte[] bitmap = nonNull == values.size() ? null : nullBitmap(values);
    return new ElementArray(elementType, values.size(), data, bitmap);
  }

  private static byte[] nullBitmap(List<? extends Number> values) {
    byte[] bitmap = new byte[(values.size() + 7) / 8];
    for (int i = 0; i < values.size(); i++) {
      if (values.get(i) != null) {
        bitmap[i / 8] |= (byte) (1 << (i % 8));
      }
    }
    return bitmap;
  }

  private static int alignedStride(ElementType elementType) {
    int itemSize = elementType.itemSize();
    int alignment = elementType.alignment();
    return (itemSize + alignment - 1) / alignment * alignment;
  }

  public ElementType elementType() {
    return elementType;
  }

  /** Number of positions, nulls included. */
  public int length() {
    return length;
  }

  public boolean isNull(int index) {
    if (index < 0 || index >= length) {
      throw new IndexOutOfBoundsException("Index " + index + " outside array of " + length);
    }
    return nullBitmap != null && (nullBitmap[index / 8] & (1 << (index % 8))) == 0;
  }

  public boolean hasNonNull() {
    return data.length > 0;
  }

  /** Hands every non-null element to consumer, in array order. */
  public void forEachNonNull(ElementConsumer consumer) {
    if (data.length == 0) {
      return;
    }
    int stride = alignedStride(elementType);
    int offset = 0;
    for (int i = 0; i < length; i++) {
      if (isNull(i)) {
        continue;
      }
      consumer.accept(data, offset);
      offset += stride;
    }
  }
}
