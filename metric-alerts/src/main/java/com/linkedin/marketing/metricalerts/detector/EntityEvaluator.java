/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.marketing.metricalerts.detector;

import com.linkedin.metricalerts.detector.AnomalyFinder;
import com.linkedin.metricalerts.model.AnomalyRecord;
import com.linkedin.metricalerts.model.DetectionMethod;
import com.linkedin.metricalerts.model.DetectionResult;
import com.linkedin.metricalerts.model.EntityHistory;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.metricalerts.common.utils.Utils.validateNotNull;


/**
 * Evaluates the history of a single entity with every configured {@link AnomalyFinder} and stamps the resulting
 * records with the entity. All records are kept; a day that is both a seasonal and a multivariate anomaly produces a
 * record for each.
 *
 * Thread-safe as long as the finders are.
 */
public class EntityEvaluator {
  private static final Logger LOG = LoggerFactory.getLogger(EntityEvaluator.class);
  private final List<AnomalyFinder> _anomalyFinders;
  private final List<String> _metricSet;

  /**
   * @param anomalyFinders Finders to run, in order.
   * @param metricSet Ordered names of the metrics to evaluate.
   */
  public EntityEvaluator(List<AnomalyFinder> anomalyFinders, List<String> metricSet) {
    _anomalyFinders = Collections.unmodifiableList(new ArrayList<>(validateNotNull(anomalyFinders,
                                                                                   "Anomaly finders cannot be null.")));
    _metricSet = Collections.unmodifiableList(new ArrayList<>(validateNotNull(metricSet,
                                                                              "Metric set cannot be null.")));
  }

  /**
   * @param history History of the entity.
   * @param targetDate Date to evaluate.
   * @return The evaluation of the entity.
   */
  public EntityEvaluation evaluate(EntityHistory history, LocalDate targetDate) {
    String entity = history.entity();
    EntityHistory restricted = history.restrictTo(_metricSet);
    if (restricted.isEmpty()) {
      return EntityEvaluation.skipped(entity);
    }
    boolean missingTargetDate = !targetDate.equals(restricted.lastDate());
    if (missingTargetDate) {
      LOG.info("Entity {} has no observation on {}, latest observation is on {}.", entity, targetDate,
               restricted.lastDate());
    }

    List<AnomalyRecord> records = new ArrayList<>();
    Map<DetectionMethod, List<DetectionResult.Status>> outcomes = new EnumMap<>(DetectionMethod.class);
    for (AnomalyFinder finder : _anomalyFinders) {
      List<DetectionResult> results;
      try {
        results = finder.anomalies(restricted, targetDate);
      } catch (RuntimeException e) {
        LOG.warn("Anomaly finder {} failed for entity {} on {}.", finder.getClass().getSimpleName(), entity,
                 targetDate, e);
        results = Collections.singletonList(DetectionResult.failed(e));
      }
      List<DetectionResult.Status> statuses = outcomes.computeIfAbsent(finder.method(), m -> new ArrayList<>());
      for (DetectionResult result : results) {
        statuses.add(result.status());
        if (result.hasAnomaly()) {
          records.add(result.record().withEntity(entity));
        }
      }
    }
    LOG.debug("Entity {} has {} anomalies on {}.", entity, records.size(), targetDate);
    return EntityEvaluation.evaluated(entity, missingTargetDate, records, outcomes);
  }

  public List<String> metricSet() {
    return _metricSet;
  }
}
