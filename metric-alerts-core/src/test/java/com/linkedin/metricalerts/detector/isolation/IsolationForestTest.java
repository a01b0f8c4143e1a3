/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricalerts.detector.isolation;

import java.util.Arrays;
import java.util.Random;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;


public class IsolationForestTest {
  private static final double DELTA = 1e-12;

  @Test
  public void testAveragePathLength() {
    assertEquals(0.0, IsolationForest.averagePathLength(0), DELTA);
    assertEquals(0.0, IsolationForest.averagePathLength(1), DELTA);
    assertEquals(0.15443132979999996, IsolationForest.averagePathLength(2), DELTA);
    assertEquals(10.244770920116851, IsolationForest.averagePathLength(256), DELTA);
  }

  @Test
  public void testIsolatedPointScoresHighest() {
    double[][] data = clusterWithOutlier();
    IsolationForest forest = IsolationForest.fit(data, 100, 256, new Random(1L));
    assertEquals(100, forest.numTrees());
    assertEquals(data.length, forest.sampleSize());

    double[] scores = forest.scores(data);
    int outlier = data.length - 1;
    for (int i = 0; i < outlier; i++) {
      assertTrue("Point " + i + " scores above the outlier.", scores[i] < scores[outlier]);
      assertTrue(scores[i] > 0.0 && scores[i] <= 1.0);
    }
    assertTrue(IsolationForest.outliers(scores, 0.01)[outlier]);
  }

  @Test
  public void testSameSeedSameScores() {
    double[][] data = clusterWithOutlier();
    double[] first = IsolationForest.fit(data, 50, 64, new Random(42L)).scores(data);
    double[] second = IsolationForest.fit(data, 50, 64, new Random(42L)).scores(data);
    assertArrayEquals(first, second, 0.0);
  }

  @Test
  public void testSampleSizeIsBoundedByMaxSamples() {
    assertEquals(16, IsolationForest.fit(clusterWithOutlier(), 10, 16, new Random(3L)).sampleSize());
  }

  @Test
  public void testContaminationBoundsNumberOfOutliers() {
    double[][] data = clusterWithOutlier();
    double[] scores = IsolationForest.fit(data, 100, 256, new Random(1L)).scores(data);
    boolean[] outliers = IsolationForest.outliers(scores, 0.05);
    int numOutliers = 0;
    for (boolean outlier : outliers) {
      numOutliers += outlier ? 1 : 0;
    }
    assertTrue(numOutliers >= 1);
    assertTrue(numOutliers <= 5);
  }

  @Test
  public void testIdenticalPointsAreNotOutliers() {
    double[][] data = new double[10][];
    Arrays.fill(data, new double[]{1.0, 2.0});
    double[] scores = IsolationForest.fit(data, 10, 256, new Random(1L)).scores(data);
    for (double score : scores) {
      assertEquals(0.5, score, DELTA);
    }
    for (boolean outlier : IsolationForest.outliers(scores, 0.1)) {
      assertFalse(outlier);
    }
  }

  @Test
  public void testScoreThresholdInterpolatesBetweenOrderStatistics() {
    double[] scores = {0.1, 0.2, 0.3, 0.4, 0.5};
    // Position 0.9 * 4 = 3.6 between 0.4 and 0.5.
    assertEquals(0.46, IsolationForest.scoreThreshold(scores, 0.1), 1e-9);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testContaminationAboveHalfIsRejected() {
    IsolationForest.scoreThreshold(new double[]{0.1, 0.2}, 0.6);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testFitWithoutObservationsIsRejected() {
    IsolationForest.fit(new double[0][], 10, 256, new Random(1L));
  }

  private static double[][] clusterWithOutlier() {
    Random random = new Random(7L);
    double[][] data = new double[100][];
    for (int i = 0; i < 99; i++) {
      data[i] = new double[]{(random.nextDouble() - 0.5) * 2, (random.nextDouble() - 0.5) * 2};
    }
    data[99] = new double[]{10.0, 10.0};
    return data;
  }
}
