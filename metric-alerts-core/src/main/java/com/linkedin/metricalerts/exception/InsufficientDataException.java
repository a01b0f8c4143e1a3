/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricalerts.exception;

/**
 * Thrown when a series or an entity history holds fewer observations than a detector needs. Detectors translate it
 * into an insufficient-data outcome rather than a failure.
 */
public class InsufficientDataException extends MetricAlertsException {

  public InsufficientDataException(String message) {
    super(message);
  }
}
