/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.exceptions;

/** Internal fault: a distinct set reached a state its algorithms never produce. */
public class InvariantViolationException extends DistinctAggregationException {

  public InvariantViolationException(String message) {
    super(message);
  }
}
