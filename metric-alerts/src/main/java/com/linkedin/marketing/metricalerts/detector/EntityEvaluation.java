/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.marketing.metricalerts.detector;

import com.linkedin.metricalerts.model.AnomalyRecord;
import com.linkedin.metricalerts.model.DetectionMethod;
import com.linkedin.metricalerts.model.DetectionResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;


/**
 * The outcome of evaluating one entity: the stamped anomaly records and the status of every detector invocation.
 */
public final class EntityEvaluation {
  private final String _entity;
  private final boolean _skipped;
  private final boolean _missingTargetDate;
  private final List<AnomalyRecord> _records;
  private final Map<DetectionMethod, List<DetectionResult.Status>> _outcomes;

  private EntityEvaluation(String entity,
                           boolean skipped,
                           boolean missingTargetDate,
                           List<AnomalyRecord> records,
                           Map<DetectionMethod, List<DetectionResult.Status>> outcomes) {
    _entity = entity;
    _skipped = skipped;
    _missingTargetDate = missingTargetDate;
    _records = Collections.unmodifiableList(new ArrayList<>(records));
    _outcomes = Collections.unmodifiableMap(new EnumMap<>(outcomes));
  }

  /**
   * @param entity The entity.
   * @return The evaluation of an entity that was not evaluated because its history is empty.
   */
  public static EntityEvaluation skipped(String entity) {
    return new EntityEvaluation(entity, true, false, Collections.emptyList(),
                                new EnumMap<>(DetectionMethod.class));
  }

  static EntityEvaluation evaluated(String entity,
                                    boolean missingTargetDate,
                                    List<AnomalyRecord> records,
                                    Map<DetectionMethod, List<DetectionResult.Status>> outcomes) {
    return new EntityEvaluation(entity, false, missingTargetDate, records, outcomes);
  }

  public String entity() {
    return _entity;
  }

  /**
   * @return {@code true} if the entity had no history to evaluate.
   */
  public boolean isSkipped() {
    return _skipped;
  }

  /**
   * @return {@code true} if the most recent observation of the entity is not on the target date.
   */
  public boolean isMissingTargetDate() {
    return _missingTargetDate;
  }

  public List<AnomalyRecord> records() {
    return _records;
  }

  /**
   * @return The status of every detector invocation by detection method.
   */
  public Map<DetectionMethod, List<DetectionResult.Status>> outcomes() {
    return _outcomes;
  }

  /**
   * @param method Detection method.
   * @param status Detection status.
   * @return Number of invocations of the given method that ended with the given status.
   */
  public int numOutcomes(DetectionMethod method, DetectionResult.Status status) {
    return (int) _outcomes.getOrDefault(method, Collections.emptyList()).stream().filter(s -> s == status).count();
  }

  @Override
  public String toString() {
    return String.format("EntityEvaluation{entity=%s, skipped=%s, missingTargetDate=%s, records=%d, outcomes=%s}",
                         _entity, _skipped, _missingTargetDate, _records.size(), _outcomes);
  }
}
