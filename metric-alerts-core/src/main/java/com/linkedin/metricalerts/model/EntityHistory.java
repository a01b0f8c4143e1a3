/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricalerts.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import static com.linkedin.metricalerts.common.utils.Utils.validateNotNull;


/**
 * The metric series of one entity over the requested history window, keyed by metric name in a stable order.
 */
public final class EntityHistory {
  private final String _entity;
  private final Map<String, MetricSeries> _seriesByMetric;

  public EntityHistory(String entity, Map<String, MetricSeries> seriesByMetric) {
    _entity = validateNotNull(entity, "Entity cannot be null.");
    validateNotNull(seriesByMetric, "Series cannot be null.");
    for (Map.Entry<String, MetricSeries> entry : seriesByMetric.entrySet()) {
      if (!entry.getKey().equals(entry.getValue().metric())) {
        throw new IllegalArgumentException(String.format("Series of metric %s is registered as %s for entity %s.",
                                                         entry.getValue().metric(), entry.getKey(), entity));
      }
    }
    _seriesByMetric = Collections.unmodifiableMap(new LinkedHashMap<>(seriesByMetric));
  }

  public String entity() {
    return _entity;
  }

  /**
   * @return Series by metric name, in insertion order.
   */
  public Map<String, MetricSeries> seriesByMetric() {
    return _seriesByMetric;
  }

  /**
   * @param metric Metric name.
   * @return The series of the given metric, or an empty series if the entity has no such metric.
   */
  public MetricSeries series(String metric) {
    MetricSeries series = _seriesByMetric.get(metric);
    return series == null ? MetricSeries.empty(metric) : series;
  }

  /**
   * @return {@code true} if no metric has any observation.
   */
  public boolean isEmpty() {
    return _seriesByMetric.values().stream().allMatch(MetricSeries::isEmpty);
  }

  /**
   * @return The most recent date observed by any metric, or {@code null} if the history is empty.
   */
  public LocalDate lastDate() {
    LocalDate last = null;
    for (MetricSeries series : _seriesByMetric.values()) {
      LocalDate candidate = series.lastDate();
      if (candidate != null && (last == null || candidate.isAfter(last))) {
        last = candidate;
      }
    }
    return last;
  }

  /**
   * @return The union of the observation dates of all metrics, sorted.
   */
  public SortedSet<LocalDate> alignedDates() {
    SortedSet<LocalDate> dates = new TreeSet<>();
    _seriesByMetric.values().forEach(series -> dates.addAll(series.dates()));
    return dates;
  }

  /**
   * Restrict this history to the given metrics. Metrics the entity does not have are kept as empty series so that the
   * resulting history always has the requested metrics in the requested order.
   *
   * @param metrics Ordered metric names.
   * @return A history of exactly the given metrics.
   */
  public EntityHistory restrictTo(List<String> metrics) {
    Map<String, MetricSeries> restricted = new LinkedHashMap<>();
    for (String metric : metrics) {
      restricted.put(metric, series(metric));
    }
    return new EntityHistory(_entity, restricted);
  }

  @Override
  public String toString() {
    return String.format("EntityHistory{entity=%s, metrics=%s, lastDate=%s}", _entity, _seriesByMetric.keySet(),
                         lastDate());
  }
}
