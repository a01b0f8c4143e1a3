/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.marketing.metricalerts.config.constants;

import com.linkedin.marketing.metricalerts.source.CsvMetricSource;
import com.linkedin.metricalerts.common.config.ConfigDef;


/**
 * A class to keep the metric source configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class MetricSourceConfig {

  /**
   * <code>metric.source.class</code>
   */
  public static final String METRIC_SOURCE_CLASS_CONFIG = "metric.source.class";
  public static final String DEFAULT_METRIC_SOURCE_CLASS = CsvMetricSource.class.getName();
  public static final String METRIC_SOURCE_CLASS_DOC = "The class that lists the entities and provides their daily "
      + "metric history.";

  private MetricSourceConfig() {
  }

  /**
   * Define configs for Metric Source.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for Metric Source.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(METRIC_SOURCE_CLASS_CONFIG,
                            ConfigDef.Type.CLASS,
                            DEFAULT_METRIC_SOURCE_CLASS,
                            ConfigDef.Importance.HIGH,
                            METRIC_SOURCE_CLASS_DOC);
  }
}
