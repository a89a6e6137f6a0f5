/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.exceptions;

/** Thrown on the first append of a variable-width or by-reference element type. */
public class UnsupportedElementTypeException extends DistinctAggregationException {

  public UnsupportedElementTypeException(String message) {
    super(message);
  }
}
