/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.marketing.metricalerts.source;

import com.linkedin.metricalerts.common.MetricAlertsConfigurable;
import com.linkedin.metricalerts.exception.MetricAlertsException;
import com.linkedin.metricalerts.model.EntityHistory;
import java.time.LocalDate;
import java.util.List;


/**
 * Provides the entities to evaluate and their daily metric history. Implementations must allow concurrent calls to
 * {@link #history(String, LocalDate, LocalDate, List)} for different entities.
 */
public interface MetricSource extends MetricAlertsConfigurable {

  /**
   * @return The entities to evaluate, in a stable order.
   */
  List<String> entities() throws MetricAlertsException;

  /**
   * Get the daily observations of the given metrics of an entity within {@code [startDate, endDate]}. Metrics without
   * observations are returned as empty series.
   *
   * @param entity The entity.
   * @param startDate First date of the window, inclusive.
   * @param endDate Last date of the window, inclusive.
   * @param metrics Ordered metric names.
   * @return The history of the entity, with exactly the given metrics in the given order.
   */
  EntityHistory history(String entity, LocalDate startDate, LocalDate endDate, List<String> metrics)
      throws MetricAlertsException;
}
