/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricalerts.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static com.linkedin.metricalerts.common.utils.Utils.validateNotNull;


/**
 * Counts describing one alerting run. Instances are immutable; delivery counts are attached through
 * {@link #withDeliveryCounts(int, int, int)} once the alert sink has been invoked.
 */
public final class RunSummary {
  private final LocalDate _targetDate;
  private final int _numEntities;
  private final int _numEvaluatedEntities;
  private final int _numSkippedEntities;
  private final int _numEntitiesMissingTargetDate;
  private final int _numFailedEntities;
  private final Map<DetectionMethod, Integer> _numAlertsByMethod;
  private final Map<DetectionMethod, Integer> _numInsufficientDataByMethod;
  private final Map<DetectionMethod, Integer> _numDetectorFailuresByMethod;
  private final int _numDeliveredAlerts;
  private final int _numFailedDeliveries;
  private final int _numSkippedDeliveries;

  private RunSummary(Builder builder, int numDeliveredAlerts, int numFailedDeliveries, int numSkippedDeliveries) {
    _targetDate = builder._targetDate;
    _numEntities = builder._numEntities;
    _numEvaluatedEntities = builder._numEvaluatedEntities;
    _numSkippedEntities = builder._numSkippedEntities;
    _numEntitiesMissingTargetDate = builder._numEntitiesMissingTargetDate;
    _numFailedEntities = builder._numFailedEntities;
    _numAlertsByMethod = Collections.unmodifiableMap(new EnumMap<>(builder._numAlertsByMethod));
    _numInsufficientDataByMethod = Collections.unmodifiableMap(new EnumMap<>(builder._numInsufficientDataByMethod));
    _numDetectorFailuresByMethod = Collections.unmodifiableMap(new EnumMap<>(builder._numDetectorFailuresByMethod));
    _numDeliveredAlerts = numDeliveredAlerts;
    _numFailedDeliveries = numFailedDeliveries;
    _numSkippedDeliveries = numSkippedDeliveries;
  }

  private RunSummary(RunSummary other, int numDeliveredAlerts, int numFailedDeliveries, int numSkippedDeliveries) {
    _targetDate = other._targetDate;
    _numEntities = other._numEntities;
    _numEvaluatedEntities = other._numEvaluatedEntities;
    _numSkippedEntities = other._numSkippedEntities;
    _numEntitiesMissingTargetDate = other._numEntitiesMissingTargetDate;
    _numFailedEntities = other._numFailedEntities;
    _numAlertsByMethod = other._numAlertsByMethod;
    _numInsufficientDataByMethod = other._numInsufficientDataByMethod;
    _numDetectorFailuresByMethod = other._numDetectorFailuresByMethod;
    _numDeliveredAlerts = numDeliveredAlerts;
    _numFailedDeliveries = numFailedDeliveries;
    _numSkippedDeliveries = numSkippedDeliveries;
  }

  /**
   * @param numDeliveredAlerts Number of alerts the sink accepted.
   * @param numFailedDeliveries Number of alerts the sink failed to deliver.
   * @param numSkippedDeliveries Number of alerts the sink skipped.
   * @return A copy of this summary with the given delivery counts.
   */
  public RunSummary withDeliveryCounts(int numDeliveredAlerts, int numFailedDeliveries, int numSkippedDeliveries) {
    return new RunSummary(this, numDeliveredAlerts, numFailedDeliveries, numSkippedDeliveries);
  }

  public LocalDate targetDate() {
    return _targetDate;
  }

  /**
   * @return Number of entities reported by the metric source.
   */
  public int numEntities() {
    return _numEntities;
  }

  public int numEvaluatedEntities() {
    return _numEvaluatedEntities;
  }

  /**
   * @return Number of entities skipped because their history was empty.
   */
  public int numSkippedEntities() {
    return _numSkippedEntities;
  }

  /**
   * @return Number of evaluated entities whose most recent observation is not the target date.
   */
  public int numEntitiesMissingTargetDate() {
    return _numEntitiesMissingTargetDate;
  }

  /**
   * @return Number of entities whose history could not be loaded or evaluated.
   */
  public int numFailedEntities() {
    return _numFailedEntities;
  }

  public int numAlerts() {
    return _numAlertsByMethod.values().stream().mapToInt(Integer::intValue).sum();
  }

  public int numAlerts(DetectionMethod method) {
    return _numAlertsByMethod.getOrDefault(method, 0);
  }

  public Map<DetectionMethod, Integer> numAlertsByMethod() {
    return _numAlertsByMethod;
  }

  public Map<DetectionMethod, Integer> numInsufficientDataByMethod() {
    return _numInsufficientDataByMethod;
  }

  public Map<DetectionMethod, Integer> numDetectorFailuresByMethod() {
    return _numDetectorFailuresByMethod;
  }

  public int numDetectorFailures(DetectionMethod method) {
    return _numDetectorFailuresByMethod.getOrDefault(method, 0);
  }

  public int numDeliveredAlerts() {
    return _numDeliveredAlerts;
  }

  public int numFailedDeliveries() {
    return _numFailedDeliveries;
  }

  public int numSkippedDeliveries() {
    return _numSkippedDeliveries;
  }

  @Override
  public String toString() {
    return String.format("RunSummary{targetDate=%s, entities=%d, evaluated=%d, skipped=%d, missingTargetDate=%d, "
                         + "failed=%d, alerts=%d, alertsByMethod=%s, insufficientDataByMethod=%s, "
                         + "detectorFailuresByMethod=%s, delivered=%d, failedDeliveries=%d, skippedDeliveries=%d}",
                         _targetDate, _numEntities, _numEvaluatedEntities, _numSkippedEntities,
                         _numEntitiesMissingTargetDate, _numFailedEntities, numAlerts(), _numAlertsByMethod,
                         _numInsufficientDataByMethod, _numDetectorFailuresByMethod, _numDeliveredAlerts,
                         _numFailedDeliveries, _numSkippedDeliveries);
  }

  /**
   * Accumulates per-entity outcomes of a run. Not thread-safe.
   */
  public static final class Builder {
    private final LocalDate _targetDate;
    private int _numEntities;
    private int _numEvaluatedEntities;
    private int _numSkippedEntities;
    private int _numEntitiesMissingTargetDate;
    private int _numFailedEntities;
    private final Map<DetectionMethod, Integer> _numAlertsByMethod;
    private final Map<DetectionMethod, Integer> _numInsufficientDataByMethod;
    private final Map<DetectionMethod, Integer> _numDetectorFailuresByMethod;

    public Builder(LocalDate targetDate) {
      _targetDate = validateNotNull(targetDate, "Target date cannot be null.");
      _numAlertsByMethod = new EnumMap<>(DetectionMethod.class);
      _numInsufficientDataByMethod = new EnumMap<>(DetectionMethod.class);
      _numDetectorFailuresByMethod = new EnumMap<>(DetectionMethod.class);
      for (DetectionMethod method : DetectionMethod.cachedValues()) {
        _numAlertsByMethod.put(method, 0);
        _numInsufficientDataByMethod.put(method, 0);
        _numDetectorFailuresByMethod.put(method, 0);
      }
    }

    public Builder numEntities(int numEntities) {
      _numEntities = numEntities;
      return this;
    }

    public Builder addEvaluatedEntity(boolean missingTargetDate) {
      _numEvaluatedEntities++;
      if (missingTargetDate) {
        _numEntitiesMissingTargetDate++;
      }
      return this;
    }

    public Builder addSkippedEntity() {
      _numSkippedEntities++;
      return this;
    }

    public Builder addFailedEntity() {
      _numFailedEntities++;
      return this;
    }

    /**
     * Record the outcome of one detector invocation.
     *
     * @param method Method of the detector.
     * @param status Outcome of the invocation.
     * @return This builder.
     */
    public Builder addDetectionOutcome(DetectionMethod method, DetectionResult.Status status) {
      switch (status) {
        case ANOMALY:
          _numAlertsByMethod.merge(method, 1, Integer::sum);
          break;
        case INSUFFICIENT_DATA:
          _numInsufficientDataByMethod.merge(method, 1, Integer::sum);
          break;
        case FAILED:
          _numDetectorFailuresByMethod.merge(method, 1, Integer::sum);
          break;
        default:
          break;
      }
      return this;
    }

    /**
     * @return A summary without delivery counts.
     */
    public RunSummary build() {
      return new RunSummary(this, 0, 0, 0);
    }
  }
}
