/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricalerts.detector.seasonal;

import com.linkedin.metricalerts.exception.InsufficientDataException;
import com.linkedin.metricalerts.model.DecompositionResult;
import org.apache.commons.math3.stat.regression.SimpleRegression;


/**
 * Classical additive decomposition of a series into trend, seasonal and residual components.
 *
 * <ul>
 *   <li>Trend: centered moving average over one period. For an even period the window spans {@code period + 1}
 *   points with half weights at both ends. Edge points that the window cannot cover are filled by a least-squares
 *   line fitted to the {@code period - 1} nearest defined trend values.</li>
 *   <li>Seasonal: the average detrended value of each cycle position, centered to sum to zero and tiled over the
 *   series. Position 0 is the first observation.</li>
 *   <li>Residual: series minus trend minus seasonal.</li>
 * </ul>
 */
public final class SeasonalDecomposition {

  private SeasonalDecomposition() {

  }

  /**
   * @param values Observations, oldest first.
   * @param period Number of observations in one seasonal cycle.
   * @return The decomposition of the given values.
   * @throws InsufficientDataException If the series covers fewer than two full cycles.
   * @throws IllegalArgumentException If the period is below 2 or a value is not finite.
   */
  public static DecompositionResult decompose(double[] values, int period) throws InsufficientDataException {
    if (period < 2) {
      throw new IllegalArgumentException("Seasonal period must be at least 2, but was " + period);
    }
    int n = values.length;
    if (n < 2 * period) {
      throw new InsufficientDataException(String.format("Seasonal decomposition with period %d requires at least %d "
                                                        + "observations, but only %d are available.", period,
                                                        2 * period, n));
    }
    for (int i = 0; i < n; i++) {
      if (!Double.isFinite(values[i])) {
        throw new IllegalArgumentException(String.format("Cannot decompose a series with non-finite value %s at index "
                                                         + "%d.", values[i], i));
      }
    }
    double[] trend = centeredMovingAverage(values, period);
    extrapolateTrend(trend, period / 2, n - 1 - period / 2, period - 1);

    double[] detrended = new double[n];
    for (int i = 0; i < n; i++) {
      detrended[i] = values[i] - trend[i];
    }
    double[] cycle = seasonalCycle(detrended, period);

    double[] seasonal = new double[n];
    double[] residual = new double[n];
    for (int i = 0; i < n; i++) {
      seasonal[i] = cycle[i % period];
      residual[i] = detrended[i] - seasonal[i];
    }
    return new DecompositionResult(period, trend, seasonal, residual);
  }

  /**
   * Indices closer than {@code period / 2} to either edge are left as NaN.
   */
  static double[] centeredMovingAverage(double[] values, int period) {
    int n = values.length;
    int halfWindow = period / 2;
    boolean even = period % 2 == 0;
    double[] trend = new double[n];
    for (int i = 0; i < n; i++) {
      if (i < halfWindow || i > n - 1 - halfWindow) {
        trend[i] = Double.NaN;
        continue;
      }
      double sum = 0.0;
      for (int j = i - halfWindow; j <= i + halfWindow; j++) {
        double weight = even && (j == i - halfWindow || j == i + halfWindow) ? 0.5 : 1.0;
        sum += weight * values[j];
      }
      trend[i] = sum / period;
    }
    return trend;
  }

  /**
   * Fill the undefined head and tail of the trend with straight lines.
   * <ul>
   *   <li>The head is fitted over the defined indices {@code [front, min(front + numPoints, back))}.</li>
   *   <li>The tail is fitted over the defined indices {@code [max(front, back - numPoints), back)}.</li>
   * </ul>
   *
   * @param trend Trend with NaN edges, filled in place.
   * @param front First defined index.
   * @param back Last defined index.
   * @param numPoints Number of defined values a line is fitted to.
   */
  static void extrapolateTrend(double[] trend, int front, int back, int numPoints) {
    SimpleRegression head = fit(trend, front, Math.min(front + numPoints, back));
    for (int i = 0; i < front; i++) {
      trend[i] = predict(head, trend, front, i);
    }
    int tailStart = Math.max(front, back - numPoints);
    SimpleRegression tail = fit(trend, tailStart, back);
    for (int i = back + 1; i < trend.length; i++) {
      trend[i] = predict(tail, trend, tailStart, i);
    }
  }

  private static SimpleRegression fit(double[] trend, int fromIndex, int toIndex) {
    SimpleRegression regression = new SimpleRegression(true);
    for (int i = fromIndex; i < toIndex; i++) {
      regression.addData(i, trend[i]);
    }
    return regression;
  }

  private static double predict(SimpleRegression regression, double[] trend, int anchorIndex, int index) {
    // A line needs two points, a single defined value is carried over as is.
    if (regression.getN() < 2) {
      return trend[anchorIndex];
    }
    return regression.predict(index);
  }

  private static double[] seasonalCycle(double[] detrended, int period) {
    double[] cycle = new double[period];
    int[] counts = new int[period];
    for (int i = 0; i < detrended.length; i++) {
      cycle[i % period] += detrended[i];
      counts[i % period]++;
    }
    double mean = 0.0;
    for (int p = 0; p < period; p++) {
      cycle[p] /= counts[p];
      mean += cycle[p];
    }
    mean /= period;
    for (int p = 0; p < period; p++) {
      cycle[p] -= mean;
    }
    return cycle;
  }
}
