/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricalerts.model;

/**
 * Additive decomposition of a series into trend, seasonal and residual components of equal length.
 */
public final class DecompositionResult {
  private final int _period;
  private final double[] _trend;
  private final double[] _seasonal;
  private final double[] _residual;

  public DecompositionResult(int period, double[] trend, double[] seasonal, double[] residual) {
    if (trend.length != seasonal.length || trend.length != residual.length) {
      throw new IllegalArgumentException(String.format("Component lengths differ (trend: %d, seasonal: %d, "
                                                       + "residual: %d).", trend.length, seasonal.length,
                                                       residual.length));
    }
    _period = period;
    _trend = trend.clone();
    _seasonal = seasonal.clone();
    _residual = residual.clone();
  }

  public int period() {
    return _period;
  }

  public int size() {
    return _residual.length;
  }

  public double[] trend() {
    return _trend.clone();
  }

  public double[] seasonal() {
    return _seasonal.clone();
  }

  public double[] residual() {
    return _residual.clone();
  }

  public double residual(int index) {
    return _residual[index];
  }
}
