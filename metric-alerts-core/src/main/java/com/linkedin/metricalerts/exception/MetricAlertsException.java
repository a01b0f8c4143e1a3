/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricalerts.exception;

public class MetricAlertsException extends Exception {

  public MetricAlertsException(String message, Throwable cause) {
    super(message, cause);
  }

  public MetricAlertsException(String message) {
    super(message);
  }

  public MetricAlertsException(Throwable cause) {
    super(cause);
  }
}
