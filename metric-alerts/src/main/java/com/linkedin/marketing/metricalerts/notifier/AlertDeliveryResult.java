/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.marketing.metricalerts.notifier;

/**
 * The result of an alert delivery.
 */
public final class AlertDeliveryResult {
  public static final int NO_STATUS_CODE = -1;

  public enum Status {
    DELIVERED, FAILED, SKIPPED
  }

  private final Status _status;
  private final int _statusCode;
  private final String _reason;

  private AlertDeliveryResult(Status status, int statusCode, String reason) {
    _status = status;
    _statusCode = statusCode;
    _reason = reason;
  }

  /**
   * @param statusCode Response status code of the receiver, {@link #NO_STATUS_CODE} if there is none.
   * @return A delivery result to indicate the receiver accepted the alert.
   */
  public static AlertDeliveryResult delivered(int statusCode) {
    return new AlertDeliveryResult(Status.DELIVERED, statusCode, null);
  }

  /**
   * @param statusCode Response status code of the receiver, {@link #NO_STATUS_CODE} if there is none.
   * @param reason Why the delivery failed.
   * @return A delivery result to indicate the alert did not reach the receiver.
   */
  public static AlertDeliveryResult failed(int statusCode, String reason) {
    return new AlertDeliveryResult(Status.FAILED, statusCode, reason);
  }

  /**
   * @param reason Why the alert was not sent.
   * @return A delivery result to indicate the alert was not sent at all.
   */
  public static AlertDeliveryResult skipped(String reason) {
    return new AlertDeliveryResult(Status.SKIPPED, NO_STATUS_CODE, reason);
  }

  public Status status() {
    return _status;
  }

  /**
   * @return The response status code of the receiver, or {@link #NO_STATUS_CODE}.
   */
  public int statusCode() {
    return _statusCode;
  }

  public String reason() {
    return _reason;
  }

  @Override
  public String toString() {
    return "{" + _status + "," + _statusCode + (_reason == null ? "" : "," + _reason) + "}";
  }
}
