/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricalerts.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static com.linkedin.metricalerts.common.utils.Utils.validateNotNull;


/**
 * An alert produced by a detector for one entity on one date.
 *
 * <p>Detectors create records without an entity; the entity is stamped by the evaluator through
 * {@link #withEntity(String)}. The value is {@code null} for multivariate records, which have no single observed
 * value and are rendered as {@link #NOT_AVAILABLE}.</p>
 */
public final class AnomalyRecord {
  public static final String MULTIVARIATE_METRIC = "multivariate";
  public static final String NOT_AVAILABLE = "N/A";
  private final String _entity;
  private final String _metric;
  private final LocalDate _date;
  private final Double _value;
  private final AnomalyKind _kind;
  private final DetectionMethod _method;
  private final double _score;
  private final String _params;
  private final Map<String, Double> _context;

  public AnomalyRecord(String entity,
                       String metric,
                       LocalDate date,
                       Double value,
                       AnomalyKind kind,
                       DetectionMethod method,
                       double score,
                       String params,
                       Map<String, Double> context) {
    _entity = entity;
    _metric = validateNotNull(metric, "Metric cannot be null.");
    _date = validateNotNull(date, "Date cannot be null.");
    _value = value;
    _kind = validateNotNull(kind, "Anomaly kind cannot be null.");
    _method = validateNotNull(method, "Detection method cannot be null.");
    _score = score;
    _params = params == null ? "" : params;
    _context = context == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  /**
   * @param entity Entity the record belongs to.
   * @return A copy of this record stamped with the given entity.
   */
  public AnomalyRecord withEntity(String entity) {
    return new AnomalyRecord(entity, _metric, _date, _value, _kind, _method, _score, _params, _context);
  }

  /**
   * @return The entity, or {@code null} if the record has not been stamped yet.
   */
  public String entity() {
    return _entity;
  }

  public String metric() {
    return _metric;
  }

  public LocalDate date() {
    return _date;
  }

  /**
   * @return The observed raw value, or {@code null} for multivariate records.
   */
  public Double value() {
    return _value;
  }

  /**
   * @return The observed value as displayed to users.
   */
  public String displayValue() {
    return _value == null ? NOT_AVAILABLE : String.valueOf(_value);
  }

  public AnomalyKind kind() {
    return _kind;
  }

  public DetectionMethod method() {
    return _method;
  }

  public double score() {
    return _score;
  }

  public String params() {
    return _params;
  }

  public Map<String, Double> context() {
    return _context;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    AnomalyRecord that = (AnomalyRecord) o;
    return Double.compare(that._score, _score) == 0 && Objects.equals(_entity, that._entity)
           && _metric.equals(that._metric) && _date.equals(that._date) && Objects.equals(_value, that._value)
           && _kind == that._kind && _method == that._method && _params.equals(that._params)
           && _context.equals(that._context);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_entity, _metric, _date, _value, _kind, _method, _score, _params, _context);
  }

  @Override
  public String toString() {
    return String.format("{entity=%s, metric=%s, date=%s, kind=%s, value=%s, method=%s, score=%s, params=%s}",
                         _entity, _metric, _date, _kind.wireName(), displayValue(), _method.wireName(), _score,
                         _params);
  }
}
