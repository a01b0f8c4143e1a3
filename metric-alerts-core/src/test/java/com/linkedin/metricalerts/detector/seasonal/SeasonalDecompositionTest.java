/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricalerts.detector.seasonal;

import com.linkedin.metricalerts.exception.InsufficientDataException;
import com.linkedin.metricalerts.model.DecompositionResult;
import java.util.Random;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.junit.Test;

import static org.junit.Assert.assertEquals;


public class SeasonalDecompositionTest {
  private static final double DELTA = 1e-9;
  private static final int PERIOD = 7;

  @Test
  public void testLinearSeriesIsAllTrend() throws InsufficientDataException {
    double[] values = new double[21];
    for (int i = 0; i < values.length; i++) {
      values[i] = 3.0 + 2.0 * i;
    }
    DecompositionResult result = SeasonalDecomposition.decompose(values, PERIOD);
    for (int i = 0; i < values.length; i++) {
      assertEquals("trend at " + i, values[i], result.trend()[i], DELTA);
      assertEquals("seasonal at " + i, 0.0, result.seasonal()[i], DELTA);
      assertEquals("residual at " + i, 0.0, result.residual(i), DELTA);
    }
  }

  @Test
  public void testWeeklyPatternIsAllSeasonal() throws InsufficientDataException {
    double[] pattern = {-3.0, -1.0, 0.0, 5.0, 2.0, -2.0, -1.0};
    double[] values = new double[28];
    for (int i = 0; i < values.length; i++) {
      values[i] = 100.0 + pattern[i % PERIOD];
    }
    DecompositionResult result = SeasonalDecomposition.decompose(values, PERIOD);
    for (int i = 0; i < values.length; i++) {
      assertEquals("trend at " + i, 100.0, result.trend()[i], DELTA);
      assertEquals("seasonal at " + i, pattern[i % PERIOD], result.seasonal()[i], DELTA);
      assertEquals("residual at " + i, 0.0, result.residual(i), DELTA);
    }
  }

  @Test
  public void testComponentsAddUpToSeries() throws InsufficientDataException {
    double[] values = randomValues(45, 1L);
    DecompositionResult result = SeasonalDecomposition.decompose(values, PERIOD);
    double[] trend = result.trend();
    double[] seasonal = result.seasonal();
    double cycleSum = 0.0;
    for (int i = 0; i < values.length; i++) {
      assertEquals(values[i], trend[i] + seasonal[i] + result.residual(i), DELTA);
      if (i + PERIOD < values.length) {
        assertEquals(seasonal[i], seasonal[i + PERIOD], DELTA);
      }
      if (i < PERIOD) {
        cycleSum += seasonal[i];
      }
    }
    assertEquals(0.0, cycleSum, DELTA);
  }

  @Test
  public void testTrendMatchesReferenceMovingAverageAndEdgeFits() throws InsufficientDataException {
    double[] values = randomValues(30, 7L);
    int n = values.length;
    double[] trend = SeasonalDecomposition.decompose(values, PERIOD).trend();

    double[] movingAverage = new double[n];
    for (int i = 3; i < n - 3; i++) {
      double sum = 0.0;
      for (int j = i - 3; j <= i + 3; j++) {
        sum += values[j];
      }
      movingAverage[i] = sum / PERIOD;
      assertEquals("trend at " + i, movingAverage[i], trend[i], DELTA);
    }

    // Head is fitted to the first six defined values, tail to the six defined values before the last one.
    SimpleRegression head = new SimpleRegression();
    for (int i = 3; i < 9; i++) {
      head.addData(i, movingAverage[i]);
    }
    SimpleRegression tail = new SimpleRegression();
    for (int i = n - 10; i < n - 4; i++) {
      tail.addData(i, movingAverage[i]);
    }
    for (int i = 0; i < 3; i++) {
      assertEquals("trend at " + i, head.predict(i), trend[i], DELTA);
      assertEquals("trend at " + (n - 1 - i), tail.predict(n - 1 - i), trend[n - 1 - i], DELTA);
    }
  }

  @Test
  public void testEvenPeriodUsesHalfWeightsAtWindowEnds() throws InsufficientDataException {
    double[] values = randomValues(12, 3L);
    double[] trend = SeasonalDecomposition.decompose(values, 4).trend();
    for (int i = 2; i < values.length - 2; i++) {
      double expected = (0.5 * values[i - 2] + values[i - 1] + values[i] + values[i + 1] + 0.5 * values[i + 2]) / 4;
      assertEquals("trend at " + i, expected, trend[i], DELTA);
    }
  }

  @Test(expected = InsufficientDataException.class)
  public void testFewerThanTwoCyclesIsInsufficient() throws InsufficientDataException {
    SeasonalDecomposition.decompose(randomValues(13, 5L), PERIOD);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonFiniteValueIsRejected() throws InsufficientDataException {
    double[] values = randomValues(28, 5L);
    values[10] = Double.NaN;
    SeasonalDecomposition.decompose(values, PERIOD);
  }

  @Test
  public void testExactlyTwoCyclesIsSufficient() throws InsufficientDataException {
    assertEquals(14, SeasonalDecomposition.decompose(randomValues(14, 5L), PERIOD).size());
  }

  private static double[] randomValues(int n, long seed) {
    Random random = new Random(seed);
    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      values[i] = 100.0 + 0.5 * i + 10.0 * Math.sin(2 * Math.PI * i / PERIOD) + 5.0 * random.nextGaussian();
    }
    return values;
  }
}
