/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricalerts.model;

import java.util.Collections;
import java.util.List;


/**
 * The detection method that produced an alert record.
 */
public enum DetectionMethod {
  SEASONAL_MAD("seasonal-mad"), ISOLATION_ENSEMBLE("isolation-ensemble");

  private static final List<DetectionMethod> CACHED_VALUES = List.of(values());
  private final String _wireName;

  DetectionMethod(String wireName) {
    _wireName = wireName;
  }

  public String wireName() {
    return _wireName;
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<DetectionMethod> cachedValues() {
    return Collections.unmodifiableList(CACHED_VALUES);
  }
}
