/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricalerts;

import java.math.BigDecimal;
import java.math.RoundingMode;


/**
 * Utils class for metric alerts.
 */
public final class MetricAlertsUtils {
  private MetricAlertsUtils() {

  }

  /**
   * Round half-up to the given number of decimals. Non-finite values are returned unchanged.
   *
   * @param value Value to round.
   * @param decimals Number of decimals to keep.
   * @return The rounded value.
   */
  public static double round(double value, int decimals) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return value;
    }
    return BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_UP).doubleValue();
  }
}
