/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.marketing.metricalerts.config;

import com.linkedin.marketing.metricalerts.config.constants.AlertSinkConfig;
import com.linkedin.marketing.metricalerts.config.constants.AnomalyDetectorConfig;
import com.linkedin.marketing.metricalerts.config.constants.MetricSourceConfig;
import com.linkedin.metricalerts.common.config.AbstractConfig;
import com.linkedin.metricalerts.common.config.ConfigDef;
import com.linkedin.metricalerts.common.config.ConfigException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;


/**
 * The configuration class of the metric alerting run.
 *
 * To avoid having a huge monolithic class that mixes unrelated configs, config names, their defaults, and definitions
 * reside in the relevant classes under {@link com.linkedin.marketing.metricalerts.config.constants}.
 */
public class MetricAlertsConfig extends AbstractConfig {
  private static final ConfigDef CONFIG;

  static {
    CONFIG = AlertSinkConfig.define(MetricSourceConfig.define(AnomalyDetectorConfig.define(new ConfigDef())));
  }

  public MetricAlertsConfig(Map<?, ?> originals) {
    this(originals, true);
  }

  public MetricAlertsConfig(Map<?, ?> originals, boolean doLog) {
    super(CONFIG, originals, doLog);
    sanityCheckMetricSet();
  }

  /**
   * @return The definition of all configs of the metric alerting run.
   */
  public static ConfigDef definition() {
    return new ConfigDef(CONFIG);
  }

  /**
   * @return The configured metrics in order.
   */
  public List<String> metricSet() {
    return getList(AnomalyDetectorConfig.METRIC_SET_CONFIG);
  }

  /**
   * @return The configured time zone.
   */
  public ZoneId zoneId() {
    return ZoneId.of(getString(AnomalyDetectorConfig.TIMEZONE_CONFIG));
  }

  /**
   * @return The configured target date, or {@code null} if the run should evaluate yesterday.
   */
  public LocalDate targetDateOverride() {
    String targetDate = getString(AnomalyDetectorConfig.TARGET_DATE_CONFIG);
    return targetDate == null || targetDate.isEmpty() ? null : LocalDate.parse(targetDate);
  }

  /**
   * Sanity check to ensure that {@link AnomalyDetectorConfig#METRIC_SET_CONFIG} has no duplicate metric.
   */
  void sanityCheckMetricSet() {
    List<String> metrics = metricSet();
    Set<String> distinct = new HashSet<>(metrics);
    if (distinct.size() != metrics.size()) {
      throw new ConfigException(AnomalyDetectorConfig.METRIC_SET_CONFIG, metrics, "Metric set contains duplicates.");
    }
  }
}
