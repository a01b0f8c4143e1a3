/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricalerts.detector;

import com.linkedin.metricalerts.common.MetricAlertsConfigurable;
import com.linkedin.metricalerts.model.DetectionMethod;
import com.linkedin.metricalerts.model.DetectionResult;
import com.linkedin.metricalerts.model.EntityHistory;
import java.time.LocalDate;
import java.util.List;


/**
 * An interface to provide custom finders for anomalies in the daily metrics of an entity.
 *
 * Implementations must be safe to invoke concurrently for different entities and must not let runtime failures
 * escape: a failure is reported as {@link DetectionResult.Status#FAILED}.
 */
public interface AnomalyFinder extends MetricAlertsConfigurable {

  /**
   * @return The detection method of the records produced by this finder.
   */
  DetectionMethod method();

  /**
   * Get the detection results for the target date of the given entity history. Anomaly records in the results are not
   * stamped with an entity.
   *
   * @param history History of the entity, restricted to the metrics of interest.
   * @param targetDate The date to evaluate.
   * @return One detection result per detector invocation.
   */
  List<DetectionResult> anomalies(EntityHistory history, LocalDate targetDate);
}
