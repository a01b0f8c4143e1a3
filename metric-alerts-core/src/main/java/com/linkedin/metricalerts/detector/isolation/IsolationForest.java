/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricalerts.detector.isolation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import static com.linkedin.metricalerts.common.utils.Utils.validateNotNull;


/**
 * An ensemble of {@link IsolationTree}s. The anomaly score of a point is {@code 2^(-E[h(x)] / c(psi))}, where
 * {@code E[h(x)]} is its mean path length over all trees and {@code c(psi)} is the average path length of an
 * unsuccessful binary search among {@code psi} points. Scores close to 1 indicate outliers, scores well below 0.5
 * indicate normal points.
 */
public final class IsolationForest {
  public static final double EULER_MASCHERONI = 0.5772156649;
  private final List<IsolationTree> _trees;
  private final int _sampleSize;

  private IsolationForest(List<IsolationTree> trees, int sampleSize) {
    _trees = Collections.unmodifiableList(trees);
    _sampleSize = sampleSize;
  }

  /**
   * Build an ensemble on the given data. One seed per tree is drawn from the given random up-front, so the same data
   * and the same random state always produce the same ensemble.
   *
   * @param data Observations, one row per point, all rows of equal length.
   * @param numTrees Number of trees.
   * @param maxSamples Upper bound of the subsample each tree is built on.
   * @param random Source of the per-tree seeds.
   * @return The fitted ensemble.
   */
  public static IsolationForest fit(double[][] data, int numTrees, int maxSamples, Random random) {
    validateNotNull(data, "Data cannot be null.");
    validateNotNull(random, "Random cannot be null.");
    if (data.length == 0) {
      throw new IllegalArgumentException("Cannot fit an isolation forest without observations.");
    }
    if (numTrees < 1 || maxSamples < 1) {
      throw new IllegalArgumentException(String.format("Number of trees (%d) and max samples (%d) must be positive.",
                                                       numTrees, maxSamples));
    }
    int sampleSize = Math.min(maxSamples, data.length);
    int maxDepth = (int) Math.ceil(Math.log(sampleSize) / Math.log(2));

    long[] seeds = new long[numTrees];
    for (int t = 0; t < numTrees; t++) {
      seeds[t] = random.nextLong();
    }
    List<IsolationTree> trees = new ArrayList<>(numTrees);
    for (long seed : seeds) {
      Random treeRandom = new Random(seed);
      trees.add(IsolationTree.build(data, sampleWithoutReplacement(data.length, sampleSize, treeRandom), maxDepth,
                                    treeRandom));
    }
    return new IsolationForest(trees, sampleSize);
  }

  /**
   * Partial Fisher-Yates shuffle of the row indices.
   */
  private static int[] sampleWithoutReplacement(int numRows, int sampleSize, Random random) {
    int[] indices = new int[numRows];
    for (int i = 0; i < numRows; i++) {
      indices[i] = i;
    }
    for (int i = 0; i < sampleSize; i++) {
      int j = i + random.nextInt(numRows - i);
      int tmp = indices[i];
      indices[i] = indices[j];
      indices[j] = tmp;
    }
    int[] sample = new int[sampleSize];
    System.arraycopy(indices, 0, sample, 0, sampleSize);
    return sample;
  }

  /**
   * The average path length of an unsuccessful search in a binary search tree of the given size.
   *
   * @param size Number of points.
   * @return {@code 2 * (ln(size - 1) + gamma) - 2 * (size - 1) / size} for sizes above 1, 0 otherwise.
   */
  public static double averagePathLength(int size) {
    if (size <= 1) {
      return 0.0;
    }
    return 2.0 * (Math.log(size - 1) + EULER_MASCHERONI) - 2.0 * (size - 1) / size;
  }

  public int numTrees() {
    return _trees.size();
  }

  /**
   * @return The subsample size each tree was built on.
   */
  public int sampleSize() {
    return _sampleSize;
  }

  /**
   * @param point A point with the dimensions of the fitted data.
   * @return The anomaly score of the point in (0, 1].
   */
  public double score(double[] point) {
    double totalPathLength = 0.0;
    for (IsolationTree tree : _trees) {
      totalPathLength += tree.pathLength(point);
    }
    double normalizer = averagePathLength(_sampleSize);
    if (normalizer == 0.0) {
      return 1.0;
    }
    return Math.pow(2.0, -(totalPathLength / _trees.size()) / normalizer);
  }

  /**
   * @param data Points with the dimensions of the fitted data.
   * @return The anomaly score of each point.
   */
  public double[] scores(double[][] data) {
    double[] scores = new double[data.length];
    for (int i = 0; i < data.length; i++) {
      scores[i] = score(data[i]);
    }
    return scores;
  }

  /**
   * The score threshold above which a point is an outlier, i.e. the {@code 1 - contamination} quantile of the given
   * scores interpolated linearly between order statistics.
   *
   * @param scores In-sample anomaly scores.
   * @param contamination Expected share of outliers in (0, 0.5].
   * @return The score threshold.
   */
  public static double scoreThreshold(double[] scores, double contamination) {
    if (contamination <= 0.0 || contamination > 0.5) {
      throw new IllegalArgumentException("Contamination must be in (0, 0.5], but was " + contamination);
    }
    Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
    return percentile.evaluate(scores, (1.0 - contamination) * 100.0);
  }

  /**
   * @param scores In-sample anomaly scores.
   * @param contamination Expected share of outliers in (0, 0.5].
   * @return For each score whether it is strictly above {@link #scoreThreshold(double[], double)}.
   */
  public static boolean[] outliers(double[] scores, double contamination) {
    double threshold = scoreThreshold(scores, contamination);
    boolean[] outliers = new boolean[scores.length];
    for (int i = 0; i < scores.length; i++) {
      outliers[i] = scores[i] > threshold;
    }
    return outliers;
  }
}
