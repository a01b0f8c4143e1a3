/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricalerts.detector.seasonal;

import com.linkedin.metricalerts.detector.AnomalyFinder;
import com.linkedin.metricalerts.exception.InsufficientDataException;
import com.linkedin.metricalerts.model.AnomalyKind;
import com.linkedin.metricalerts.model.AnomalyRecord;
import com.linkedin.metricalerts.model.DecompositionResult;
import com.linkedin.metricalerts.model.DetectionMethod;
import com.linkedin.metricalerts.model.DetectionResult;
import com.linkedin.metricalerts.model.EntityHistory;
import com.linkedin.metricalerts.model.MetricSeries;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.metricalerts.MetricAlertsUtils.round;
import static com.linkedin.metricalerts.common.utils.Utils.validateNotNull;


/**
 * Identifies spikes and drops of a single metric by decomposing its history into trend, seasonal and residual
 * components and comparing the residual on the target date against the median residual.
 *
 * The spread of the residuals is measured by the median absolute deviation scaled by {@link #MAD_SCALE_FACTOR}, so
 * that it estimates the standard deviation of normally distributed residuals while staying robust to the outliers it
 * is meant to find. A residual above {@code median + k * scaledMad} is a {@link AnomalyKind#SPIKE}, a residual below
 * {@code median - k * scaledMad} is a {@link AnomalyKind#DROP}.
 */
public class SeasonalMadAnomalyFinder implements AnomalyFinder {
  private static final Logger LOG = LoggerFactory.getLogger(SeasonalMadAnomalyFinder.class);
  public static final double MAD_SCALE_FACTOR = 1.4826;
  public static final double MIN_SCALED_MAD = 1e-6;
  public static final String RESIDUAL = "residual";
  public static final String MEDIAN_RESIDUAL = "median_residual";
  public static final String SCALED_MAD = "scaled_mad";
  public static final String UPPER_THRESHOLD = "upper_threshold";
  public static final String LOWER_THRESHOLD = "lower_threshold";
  public static final String RELATIVE_MAGNITUDE_PCT = "relative_magnitude_pct";
  protected double _madThreshold;
  protected int _period;

  public SeasonalMadAnomalyFinder() {
    this(SeasonalMadAnomalyFinderConfig.DEFAULT_MAD_THRESHOLD, SeasonalMadAnomalyFinderConfig.DEFAULT_SEASONAL_PERIOD);
  }

  public SeasonalMadAnomalyFinder(double madThreshold, int period) {
    _madThreshold = madThreshold;
    _period = period;
  }

  @Override
  public DetectionMethod method() {
    return DetectionMethod.SEASONAL_MAD;
  }

  /**
   * Evaluate every metric of the given history independently.
   *
   * @param history History of the entity, restricted to the metrics of interest.
   * @param targetDate The date to evaluate.
   * @return One detection result per metric, in metric order.
   */
  @Override
  public List<DetectionResult> anomalies(EntityHistory history, LocalDate targetDate) {
    validateNotNull(history, "Entity history cannot be null.");
    List<DetectionResult> results = new ArrayList<>(history.seriesByMetric().size());
    for (MetricSeries series : history.seriesByMetric().values()) {
      DetectionResult result = anomalyFor(series, targetDate);
      LOG.trace("Seasonal detection of metric {} for entity {} on {}: {}.", series.metric(), history.entity(),
                targetDate, result);
      results.add(result);
    }
    return results;
  }

  /**
   * Evaluate the target date of the given series. Never throws: unexpected failures are reported as
   * {@link DetectionResult.Status#FAILED}.
   *
   * @param series Daily series of one metric.
   * @param targetDate The date to evaluate, which must be the most recent date of the series.
   * @return The detection result of the target date.
   */
  public DetectionResult anomalyFor(MetricSeries series, LocalDate targetDate) {
    try {
      validateNotNull(series, "Metric series cannot be null.");
      validateNotNull(targetDate, "Target date cannot be null.");
      if (!targetDate.equals(series.lastDate())) {
        String reason = String.format("Latest observation of metric %s is on %s instead of target date %s.",
                                      series.metric(), series.lastDate(), targetDate);
        LOG.debug(reason);
        return DetectionResult.insufficientData(reason);
      }
      return evaluate(series, targetDate);
    } catch (InsufficientDataException ide) {
      LOG.debug("Insufficient data to evaluate metric {} on {}: {}", series.metric(), targetDate, ide.getMessage());
      return DetectionResult.insufficientData(ide.getMessage());
    } catch (RuntimeException e) {
      LOG.warn("Seasonal detection failed for metric {} on {}.", series == null ? null : series.metric(), targetDate,
               e);
      return DetectionResult.failed(e);
    }
  }

  private DetectionResult evaluate(MetricSeries series, LocalDate targetDate) throws InsufficientDataException {
    DecompositionResult decomposition = SeasonalDecomposition.decompose(series.values(), _period);
    double[] residuals = decomposition.residual();

    double medianResidual = new Median().evaluate(residuals);
    double[] absoluteDeviations = new double[residuals.length];
    for (int i = 0; i < residuals.length; i++) {
      absoluteDeviations[i] = Math.abs(residuals[i] - medianResidual);
    }
    double scaledMad = new Median().evaluate(absoluteDeviations) * MAD_SCALE_FACTOR;
    if (scaledMad == 0.0) {
      scaledMad = MIN_SCALED_MAD;
    }
    double upperThreshold = medianResidual + _madThreshold * scaledMad;
    double lowerThreshold = medianResidual - _madThreshold * scaledMad;

    int targetIndex = series.size() - 1;
    double residual = decomposition.residual(targetIndex);
    AnomalyKind kind;
    if (residual > upperThreshold) {
      kind = AnomalyKind.SPIKE;
    } else if (residual < lowerThreshold) {
      kind = AnomalyKind.DROP;
    } else {
      return DetectionResult.noAnomaly();
    }

    double mean = series.mean();
    Map<String, Double> context = new LinkedHashMap<>();
    context.put(RESIDUAL, round(residual, 4));
    context.put(MEDIAN_RESIDUAL, round(medianResidual, 4));
    context.put(SCALED_MAD, round(scaledMad, 6));
    context.put(UPPER_THRESHOLD, round(upperThreshold, 4));
    context.put(LOWER_THRESHOLD, round(lowerThreshold, 4));
    context.put(RELATIVE_MAGNITUDE_PCT, mean == 0.0 ? 0.0 : round(Math.abs(residual) / mean * 100, 2));

    AnomalyRecord record = new AnomalyRecord(null,
                                             series.metric(),
                                             targetDate,
                                             series.value(targetIndex),
                                             kind,
                                             DetectionMethod.SEASONAL_MAD,
                                             round(Math.abs(residual) / scaledMad, 2),
                                             String.format("k=%s, period=%d", _madThreshold, _period),
                                             context);
    LOG.debug("Metric {} has a {} on {} with residual {} outside of [{}, {}].", series.metric(), kind.wireName(),
              targetDate, residual, lowerThreshold, upperThreshold);
    return DetectionResult.anomaly(record);
  }

  @Override
  public void configure(Map<String, ?> configs) {
    SeasonalMadAnomalyFinderConfig internalConfig = new SeasonalMadAnomalyFinderConfig(configs);
    _madThreshold = internalConfig.getDouble(SeasonalMadAnomalyFinderConfig.MAD_THRESHOLD_CONFIG);
    _period = internalConfig.getInt(SeasonalMadAnomalyFinderConfig.SEASONAL_PERIOD_CONFIG);
  }
}
