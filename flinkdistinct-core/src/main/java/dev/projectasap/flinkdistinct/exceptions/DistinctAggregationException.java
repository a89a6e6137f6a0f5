/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct.exceptions;

/**
 * Base class for failures that abort a distinct aggregation. None of them is retried: a wrong
 * distinct count is worse than a failed job.
 */
public class DistinctAggregationException extends RuntimeException {

  public DistinctAggregationException(String message) {
    super(message);
  }

  public DistinctAggregationException(String message, Throwable cause) {
    super(message, cause);
  }
}
