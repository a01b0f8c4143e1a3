/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricalerts.model;

import java.util.Collections;
import java.util.List;


/**
 * The kind of an anomaly as it appears in alert records.
 *
 * <ul>
 *   <li>{@link #SPIKE}: The residual of a metric is above the upper robust threshold.</li>
 *   <li>{@link #DROP}: The residual of a metric is below the lower robust threshold.</li>
 *   <li>{@link #MULTIVARIATE_PATTERN}: The joint values of the metric set are an ensemble outlier.</li>
 * </ul>
 */
public enum AnomalyKind {
  SPIKE("spike"), DROP("drop"), MULTIVARIATE_PATTERN("multivariate-pattern");

  private static final List<AnomalyKind> CACHED_VALUES = List.of(values());
  private final String _wireName;

  AnomalyKind(String wireName) {
    _wireName = wireName;
  }

  /**
   * @return The name used in alert payloads.
   */
  public String wireName() {
    return _wireName;
  }

  /**
   * @param wireName Name used in alert payloads.
   * @return The kind with the given wire name.
   */
  public static AnomalyKind forWireName(String wireName) {
    for (AnomalyKind kind : CACHED_VALUES) {
      if (kind._wireName.equals(wireName)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown anomaly kind " + wireName);
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<AnomalyKind> cachedValues() {
    return Collections.unmodifiableList(CACHED_VALUES);
  }
}
