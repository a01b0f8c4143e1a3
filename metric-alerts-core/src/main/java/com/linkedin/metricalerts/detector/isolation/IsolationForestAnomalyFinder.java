/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricalerts.detector.isolation;

import com.linkedin.metricalerts.detector.AnomalyFinder;
import com.linkedin.metricalerts.model.AnomalyKind;
import com.linkedin.metricalerts.model.AnomalyRecord;
import com.linkedin.metricalerts.model.DetectionMethod;
import com.linkedin.metricalerts.model.DetectionResult;
import com.linkedin.metricalerts.model.EntityHistory;
import com.linkedin.metricalerts.model.MetricSeries;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.metricalerts.MetricAlertsUtils.round;
import static com.linkedin.metricalerts.common.utils.Utils.validateNotNull;


/**
 * Identifies days on which the joint values of all metrics of an entity are unusual, even if no single metric is.
 *
 * Observations are aligned on the union of the dates of all metrics, with missing values imputed as zero. An
 * {@link IsolationForest} is fitted on all aligned observations and the target date is reported as a
 * {@link AnomalyKind#MULTIVARIATE_PATTERN} if its score is above the {@code 1 - contamination} quantile of the
 * in-sample scores.
 */
public class IsolationForestAnomalyFinder implements AnomalyFinder {
  private static final Logger LOG = LoggerFactory.getLogger(IsolationForestAnomalyFinder.class);
  protected double _contamination;
  protected int _numTrees;
  protected int _maxSamples;
  protected int _minObservations;
  protected long _randomSeed;

  public IsolationForestAnomalyFinder() {
    this(IsolationForestAnomalyFinderConfig.DEFAULT_CONTAMINATION,
         IsolationForestAnomalyFinderConfig.DEFAULT_ISOLATION_FOREST_NUM_TREES,
         IsolationForestAnomalyFinderConfig.DEFAULT_ISOLATION_FOREST_MAX_SAMPLES,
         IsolationForestAnomalyFinderConfig.DEFAULT_ISOLATION_FOREST_MIN_OBSERVATIONS,
         IsolationForestAnomalyFinderConfig.DEFAULT_ISOLATION_FOREST_RANDOM_SEED);
  }

  public IsolationForestAnomalyFinder(double contamination,
                                      int numTrees,
                                      int maxSamples,
                                      int minObservations,
                                      long randomSeed) {
    _contamination = contamination;
    _numTrees = numTrees;
    _maxSamples = maxSamples;
    _minObservations = minObservations;
    _randomSeed = randomSeed;
  }

  @Override
  public DetectionMethod method() {
    return DetectionMethod.ISOLATION_ENSEMBLE;
  }

  @Override
  public List<DetectionResult> anomalies(EntityHistory history, LocalDate targetDate) {
    return Collections.singletonList(anomalyFor(history, targetDate));
  }

  /**
   * Evaluate the target date over all metrics of the given history jointly. Never throws: unexpected failures are
   * reported as {@link DetectionResult.Status#FAILED}.
   *
   * @param history History of the entity, restricted to the metrics of interest.
   * @param targetDate The date to evaluate, which must be the most recent aligned date.
   * @return The detection result of the target date.
   */
  public DetectionResult anomalyFor(EntityHistory history, LocalDate targetDate) {
    try {
      validateNotNull(history, "Entity history cannot be null.");
      validateNotNull(targetDate, "Target date cannot be null.");
      List<LocalDate> dates = new ArrayList<>(history.alignedDates());
      if (dates.size() < _minObservations) {
        String reason = String.format("Entity %s has %d aligned observations, at least %d are required.",
                                      history.entity(), dates.size(), _minObservations);
        LOG.debug(reason);
        return DetectionResult.insufficientData(reason);
      }
      LocalDate lastDate = dates.get(dates.size() - 1);
      if (!targetDate.equals(lastDate)) {
        String reason = String.format("Latest aligned observation of entity %s is on %s instead of target date %s.",
                                      history.entity(), lastDate, targetDate);
        LOG.debug(reason);
        return DetectionResult.insufficientData(reason);
      }
      return evaluate(history, dates, targetDate);
    } catch (RuntimeException e) {
      LOG.warn("Multivariate detection failed for entity {} on {}.", history == null ? null : history.entity(),
               targetDate, e);
      return DetectionResult.failed(e);
    }
  }

  private DetectionResult evaluate(EntityHistory history, List<LocalDate> dates, LocalDate targetDate) {
    List<MetricSeries> metricSeries = new ArrayList<>(history.seriesByMetric().values());
    if (metricSeries.isEmpty()) {
      throw new IllegalArgumentException("Entity " + history.entity() + " has no metrics to evaluate.");
    }
    double[][] data = alignedObservations(metricSeries, dates);

    IsolationForest forest = IsolationForest.fit(data, _numTrees, _maxSamples, new Random(_randomSeed));
    double[] scores = forest.scores(data);
    double threshold = IsolationForest.scoreThreshold(scores, _contamination);
    int targetIndex = data.length - 1;
    double targetScore = scores[targetIndex];
    LOG.trace("Entity {} scores {} on {} against threshold {}.", history.entity(), targetScore, targetDate, threshold);
    if (targetScore <= threshold) {
      return DetectionResult.noAnomaly();
    }

    Map<String, Double> context = new LinkedHashMap<>();
    for (int m = 0; m < metricSeries.size(); m++) {
      context.put(metricSeries.get(m).metric(), data[targetIndex][m]);
    }
    AnomalyRecord record = new AnomalyRecord(null,
                                             AnomalyRecord.MULTIVARIATE_METRIC,
                                             targetDate,
                                             null,
                                             AnomalyKind.MULTIVARIATE_PATTERN,
                                             DetectionMethod.ISOLATION_ENSEMBLE,
                                             round(targetScore, 4),
                                             String.format("trees=%d, samples=%d, contamination=%s, threshold=%s",
                                                           forest.numTrees(), forest.sampleSize(), _contamination,
                                                           round(threshold, 4)),
                                             context);
    LOG.debug("Entity {} has a multivariate pattern on {} with score {} above threshold {}.", history.entity(),
              targetDate, targetScore, threshold);
    return DetectionResult.anomaly(record);
  }

  /**
   * @param metricSeries Series of each metric.
   * @param dates Sorted union of the observation dates.
   * @return One row per date with one column per metric, zero where a metric has no observation.
   * @throws IllegalArgumentException If an observation is not finite.
   */
  static double[][] alignedObservations(List<MetricSeries> metricSeries, List<LocalDate> dates) {
    double[][] data = new double[dates.size()][metricSeries.size()];
    for (int i = 0; i < dates.size(); i++) {
      for (int m = 0; m < metricSeries.size(); m++) {
        Double value = metricSeries.get(m).valueOn(dates.get(i));
        if (value != null && !Double.isFinite(value)) {
          throw new IllegalArgumentException(String.format("Metric %s has non-finite value %s on %s.",
                                                           metricSeries.get(m).metric(), value, dates.get(i)));
        }
        data[i][m] = value == null ? 0.0 : value;
      }
    }
    return data;
  }

  @Override
  public void configure(Map<String, ?> configs) {
    IsolationForestAnomalyFinderConfig internalConfig = new IsolationForestAnomalyFinderConfig(configs);
    _contamination = internalConfig.getDouble(IsolationForestAnomalyFinderConfig.CONTAMINATION_CONFIG);
    _numTrees = internalConfig.getInt(IsolationForestAnomalyFinderConfig.ISOLATION_FOREST_NUM_TREES_CONFIG);
    _maxSamples = internalConfig.getInt(IsolationForestAnomalyFinderConfig.ISOLATION_FOREST_MAX_SAMPLES_CONFIG);
    _minObservations =
        internalConfig.getInt(IsolationForestAnomalyFinderConfig.ISOLATION_FOREST_MIN_OBSERVATIONS_CONFIG);
    _randomSeed = internalConfig.getLong(IsolationForestAnomalyFinderConfig.ISOLATION_FOREST_RANDOM_SEED_CONFIG);
  }
}
