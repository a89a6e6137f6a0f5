/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.types;

import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import com.google.common.primitives.Shorts;
import dev.projectasap.flinkdistinct.exceptions.UnsupportedElementTypeException;
import java.util.Locale;

/**
 * Element types an aggregation can be declared over, with the storage properties a distinct set
 * needs: byte width, whether values are passed by value, and alignment inside packed arrays.
 *
 * <p>Supported types encode to big-endian bytes whose unsigned order matches numeric order
 * (sign bit flipped for integers, sign-magnitude flip for IEEE floats), so sorted output comes
 * back in ascending numeric order.
 */
public enum ElementType {
  INT2("int2", 2, true, 2),
  INT4("int4", 4, true, 4),
  INT8("int8", 8, true, 8),
  FLOAT4("float4", 4, true, 4),
  FLOAT8("float8", 8, true, 8),
  /** Days since the epoch. */
  DATE("date", 4, true, 4),
  /** Microseconds since the epoch. */
  TIMESTAMP("timestamp", 8, true, 8),
  NUMERIC("numeric", -1, false, 4),
  TEXT("text", -1, false, 4),
  UUID("uuid", 16, false, 1),
  INTERVAL("interval", 16, false, 8);

  private final String typeName;
  private final int length;
  private final boolean byValue;
  private final int alignment;

  ElementType(String typeName, int length, boolean byValue, int alignment) {
    this.typeName = typeName;
    this.length = length;
    this.byValue = byValue;
    this.alignment = alignment;
  }

  /**
   * Resolves a type by name. Accepts the short names above plus common SQL aliases.
   *
   * @param name type name, case-insensitive
   * @return the element type
   */
  public static ElementType fromName(String name) {
    if (name == null) {
      throw new IllegalArgumentException("Element type name is missing");
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    switch (normalized) {
      case "smallint":
        return INT2;
      case "int":
      case "integer":
        return INT4;
      case "bigint":
        return INT8;
      case "real":
        return FLOAT4;
      case "double":
      case "double precision":
        return FLOAT8;
      case "decimal":
        return NUMERIC;
      case "varchar":
        return TEXT;
      default:
        break;
    }
    for (ElementType type : values()) {
      if (type.typeName.equals(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown element type '" + name + "'");
  }

  public String typeName() {
    return typeName;
  }

  /** Width in bytes, or -1 for variable-width types. */
  public int length() {
    return length;
  }

  public boolean isFixedWidth() {
    return length > 0;
  }

  public boolean isByValue() {
    return byValue;
  }

  public int alignment() {
    return alignment;
  }

  /** Whether a distinct set can store this type. */
  public boolean isSupported() {
    return isFixedWidth() && byValue;
  }

  public void checkSupported() {
    if (!isSupported()) {
      throw new UnsupportedElementTypeException(
          "Distinct aggregation handles only fixed-length types passed by value, got "
              + typeName
              + (isFixedWidth() ? " (passed by reference)" : " (variable length)"));
    }
  }

  /** Width of a stored element. Only defined for supported types. */
  public int itemSize() {
    checkSupported();
    return length;
  }

  public byte[] encode(Number value) {
    byte[] target = new byte[itemSize()];
    encode(value, target, 0);
    return target;
  }

  /**
   * Writes the order-preserving encoding of value into target.
   *
   * @param value a non-null number, range-checked for integral types
   * @param target destination array
   * @param offset position of the first byte written
   */
  public void encode(Number value, byte[] target, int offset) {
    checkSupported();
    byte[] bytes;
    switch (this) {
      case INT2:
        bytes = Shorts.toByteArray((short) (Shorts.checkedCast(value.longValue()) ^ 0x8000));
        break;
      case INT4:
      case DATE:
        bytes = Ints.toByteArray(Ints.checkedCast(value.longValue()) ^ Integer.MIN_VALUE);
        break;
      case INT8:
      case TIMESTAMP:
        bytes = Longs.toByteArray(value.longValue() ^ Long.MIN_VALUE);
        break;
      case FLOAT4:
        {
          int bits = Float.floatToIntBits(value.floatValue());
          bytes = Ints.toByteArray(bits < 0 ? ~bits : bits ^ Integer.MIN_VALUE);
          break;
        }
      case FLOAT8:
        {
          long bits = Double.doubleToLongBits(value.doubleValue());
          bytes = Longs.toByteArray(bits < 0 ? ~bits : bits ^ Long.MIN_VALUE);
          break;
        }
      default:
        throw new UnsupportedElementTypeException("No encoding for " + typeName);
    }
    System.arraycopy(bytes, 0, target, offset, bytes.length);
  }

  public Number decode(byte[] source) {
    return decode(source, 0);
  }

  /** Inverse of {@link #encode(Number, byte[], int)}. */
  public Number decode(byte[] source, int offset) {
    checkSupported();
    switch (this) {
      case INT2:
        return (short) (Shorts.fromBytes(source[offset], source[offset + 1]) ^ 0x8000);
      case INT4:
      case DATE:
        return readInt(source, offset) ^ Integer.MIN_VALUE;
      case INT8:
      case TIMESTAMP:
        return readLong(source, offset) ^ Long.MIN_VALUE;
      case FLOAT4:
        {
          int bits = readInt(source, offset);
          return Float.intBitsToFloat(bits < 0 ? bits ^ Integer.MIN_VALUE : ~bits);
        }
      case FLOAT8:
        {
          long bits = readLong(source, offset);
          return Double.longBitsToDouble(bits < 0 ? bits ^ Long.MIN_VALUE : ~bits);
        }
      default:
        throw new UnsupportedElementTypeException("No decoding for " + typeName);
    }
  }

  private static int readInt(byte[] source, int offset) {
    return Ints.fromBytes(
        source[offset], source[offset + 1], source[offset + 2], source[offset + 3]);
  }

  private static long readLong(byte[] source, int offset) {
    return Longs.fromBytes(
        source[offset],
        source[offset + 1],
        source[offset + 2],
        source[offset + 3],
        source[offset + 4],
        source[offset + 5],
        source[offset + 6],
        source[offset + 7]);
  }
}
