/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricalerts.model;

import static com.linkedin.metricalerts.common.utils.Utils.validateNotNull;


/**
 * The outcome of one detector invocation. Distinguishes a found anomaly, a normal observation, a lack of data to
 * judge, and an internal failure of the detector.
 */
public final class DetectionResult {
  private static final DetectionResult NO_ANOMALY = new DetectionResult(Status.NO_ANOMALY, null, null, null);
  private final Status _status;
  private final AnomalyRecord _record;
  private final String _reason;
  private final Throwable _cause;

  private DetectionResult(Status status, AnomalyRecord record, String reason, Throwable cause) {
    _status = status;
    _record = record;
    _reason = reason;
    _cause = cause;
  }

  public static DetectionResult anomaly(AnomalyRecord record) {
    return new DetectionResult(Status.ANOMALY, validateNotNull(record, "Anomaly record cannot be null."), null, null);
  }

  public static DetectionResult noAnomaly() {
    return NO_ANOMALY;
  }

  public static DetectionResult insufficientData(String reason) {
    return new DetectionResult(Status.INSUFFICIENT_DATA, null, reason, null);
  }

  public static DetectionResult failed(Throwable cause) {
    return new DetectionResult(Status.FAILED, null, cause.getMessage(), cause);
  }

  public Status status() {
    return _status;
  }

  public boolean hasAnomaly() {
    return _status == Status.ANOMALY;
  }

  /**
   * @return The anomaly record if {@link #status()} is {@link Status#ANOMALY}, {@code null} otherwise.
   */
  public AnomalyRecord record() {
    return _record;
  }

  /**
   * @return Why data was insufficient or the detector failed, {@code null} otherwise.
   */
  public String reason() {
    return _reason;
  }

  public Throwable cause() {
    return _cause;
  }

  @Override
  public String toString() {
    switch (_status) {
      case ANOMALY:
        return "ANOMALY " + _record;
      case INSUFFICIENT_DATA:
      case FAILED:
        return _status + " (" + _reason + ")";
      default:
        return _status.toString();
    }
  }

  public enum Status {
    ANOMALY, NO_ANOMALY, INSUFFICIENT_DATA, FAILED
  }
}
