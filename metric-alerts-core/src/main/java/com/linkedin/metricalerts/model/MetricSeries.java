/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricalerts.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import static com.linkedin.metricalerts.common.utils.Utils.validateNotNull;


/**
 * An immutable daily time series of one metric for one entity. Dates are strictly increasing.
 */
public final class MetricSeries {
  private final String _metric;
  private final List<LocalDate> _dates;
  private final double[] _values;

  /**
   * @param metric Name of the metric.
   * @param dates Observation dates, strictly increasing.
   * @param values Observed values, one per date.
   */
  public MetricSeries(String metric, List<LocalDate> dates, double[] values) {
    _metric = validateNotNull(metric, "Metric name cannot be null.");
    validateNotNull(dates, "Dates cannot be null.");
    validateNotNull(values, "Values cannot be null.");
    if (dates.size() != values.length) {
      throw new IllegalArgumentException(String.format("Metric %s has %d dates but %d values.", metric, dates.size(),
                                                       values.length));
    }
    for (int i = 1; i < dates.size(); i++) {
      if (!dates.get(i).isAfter(dates.get(i - 1))) {
        throw new IllegalArgumentException(String.format("Dates of metric %s are not strictly increasing at %s.",
                                                         metric, dates.get(i)));
      }
    }
    _dates = Collections.unmodifiableList(new ArrayList<>(dates));
    _values = values.clone();
  }

  /**
   * Create a series from date to value observations in any order.
   *
   * @param metric Name of the metric.
   * @param observations Observed value by date.
   * @return A new series sorted by date.
   */
  public static MetricSeries of(String metric, Map<LocalDate, Double> observations) {
    SortedMap<LocalDate, Double> sorted = new TreeMap<>(observations);
    List<LocalDate> dates = new ArrayList<>(sorted.keySet());
    double[] values = new double[sorted.size()];
    int i = 0;
    for (Double value : sorted.values()) {
      values[i++] = validateNotNull(value, () -> "Metric " + metric + " has a null observation.");
    }
    return new MetricSeries(metric, dates, values);
  }

  /**
   * @param metric Name of the metric.
   * @return A series without observations.
   */
  public static MetricSeries empty(String metric) {
    return new MetricSeries(metric, Collections.emptyList(), new double[0]);
  }

  public String metric() {
    return _metric;
  }

  public int size() {
    return _values.length;
  }

  public boolean isEmpty() {
    return _values.length == 0;
  }

  public List<LocalDate> dates() {
    return _dates;
  }

  /**
   * @return A copy of the observed values.
   */
  public double[] values() {
    return _values.clone();
  }

  public double value(int index) {
    return _values[index];
  }

  public LocalDate date(int index) {
    return _dates.get(index);
  }

  /**
   * @return The most recent observation date, or {@code null} if the series is empty.
   */
  public LocalDate lastDate() {
    return _dates.isEmpty() ? null : _dates.get(_dates.size() - 1);
  }

  /**
   * @param date Date to look up.
   * @return The value observed on the given date, or {@code null} if there is no observation.
   */
  public Double valueOn(LocalDate date) {
    int index = Collections.binarySearch(_dates, date);
    return index < 0 ? null : _values[index];
  }

  /**
   * @return Arithmetic mean of the values, 0 for an empty series.
   */
  public double mean() {
    return _values.length == 0 ? 0.0 : Arrays.stream(_values).sum() / _values.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    MetricSeries that = (MetricSeries) o;
    return _metric.equals(that._metric) && _dates.equals(that._dates) && Arrays.equals(_values, that._values);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * _metric.hashCode() + _dates.hashCode()) + Arrays.hashCode(_values);
  }

  @Override
  public String toString() {
    return String.format("MetricSeries{metric=%s, size=%d, first=%s, last=%s}", _metric, size(),
                         _dates.isEmpty() ? null : _dates.get(0), lastDate());
  }
}
