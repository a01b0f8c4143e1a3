/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.marketing.metricalerts.detector;

import com.linkedin.metricalerts.model.AnomalyRecord;
import com.linkedin.metricalerts.model.RunSummary;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;


/**
 * The alerts of one run together with its summary.
 */
public final class AlertRunResult {
  private final RunSummary _summary;
  private final List<AnomalyRecord> _alerts;

  public AlertRunResult(RunSummary summary, List<AnomalyRecord> alerts) {
    _summary = summary;
    _alerts = Collections.unmodifiableList(new ArrayList<>(alerts));
  }

  public RunSummary summary() {
    return _summary;
  }

  /**
   * @return All alerts of the run, grouped by entity in the order the metric source listed the entities.
   */
  public List<AnomalyRecord> alerts() {
    return _alerts;
  }
}
