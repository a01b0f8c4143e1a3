/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.marketing.metricalerts.config.constants;

import com.linkedin.metricalerts.common.config.ConfigDef;
import com.linkedin.metricalerts.detector.isolation.IsolationForestAnomalyFinder;
import com.linkedin.metricalerts.detector.seasonal.SeasonalMadAnomalyFinder;
import java.util.StringJoiner;

import static com.linkedin.metricalerts.common.config.ConfigDef.Range.atLeast;


/**
 * A class to keep the anomaly detection configs and defaults of the metric alerting run.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 *
 * The settings of the individual finders live with the finders, see
 * {@link com.linkedin.metricalerts.detector.seasonal.SeasonalMadAnomalyFinderConfig} and
 * {@link com.linkedin.metricalerts.detector.isolation.IsolationForestAnomalyFinderConfig}.
 */
public final class AnomalyDetectorConfig {

  /**
   * <code>anomaly.finder.classes</code>
   */
  public static final String ANOMALY_FINDER_CLASSES_CONFIG = "anomaly.finder.classes";
  public static final String DEFAULT_ANOMALY_FINDER_CLASSES =
      new StringJoiner(",").add(SeasonalMadAnomalyFinder.class.getName())
                           .add(IsolationForestAnomalyFinder.class.getName()).toString();
  public static final String ANOMALY_FINDER_CLASSES_DOC = "A list of anomaly finder classes that evaluate the history "
      + "of every entity. The records of all finders are reported without suppression.";

  /**
   * <code>historical.window.days</code>
   */
  public static final String HISTORICAL_WINDOW_DAYS_CONFIG = "historical.window.days";
  public static final int DEFAULT_HISTORICAL_WINDOW_DAYS = 60;
  public static final String HISTORICAL_WINDOW_DAYS_DOC = "The number of days of history, including the target date, "
      + "requested from the metric source for every entity.";

  /**
   * <code>metric.set</code>
   */
  public static final String METRIC_SET_CONFIG = "metric.set";
  public static final String DEFAULT_METRIC_SET = "spend,leads,sessions";
  public static final String METRIC_SET_DOC = "The ordered list of metrics to evaluate. Every metric is evaluated on "
      + "its own by the seasonal detector and all metrics are evaluated jointly by the multivariate detector.";

  /**
   * <code>timezone</code>
   */
  public static final String TIMEZONE_CONFIG = "timezone";
  public static final String DEFAULT_TIMEZONE = "UTC";
  public static final String TIMEZONE_DOC = "The time zone in which the default target date, yesterday, is computed.";

  /**
   * <code>target.date</code>
   */
  public static final String TARGET_DATE_CONFIG = "target.date";
  public static final String DEFAULT_TARGET_DATE = "";
  public static final String TARGET_DATE_DOC = "An ISO-8601 date (e.g. 2026-03-01) to evaluate instead of yesterday. "
      + "Used to re-run past days.";

  /**
   * <code>num.evaluation.threads</code>
   */
  public static final String NUM_EVALUATION_THREADS_CONFIG = "num.evaluation.threads";
  public static final int DEFAULT_NUM_EVALUATION_THREADS = 4;
  public static final String NUM_EVALUATION_THREADS_DOC = "The number of threads that load and evaluate entities "
      + "concurrently.";

  private AnomalyDetectorConfig() {
  }

  /**
   * Define configs for Anomaly Detector.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for Anomaly Detector.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(ANOMALY_FINDER_CLASSES_CONFIG,
                            ConfigDef.Type.LIST,
                            DEFAULT_ANOMALY_FINDER_CLASSES,
                            new ConfigDef.NonEmptyList(),
                            ConfigDef.Importance.MEDIUM,
                            ANOMALY_FINDER_CLASSES_DOC)
                    .define(HISTORICAL_WINDOW_DAYS_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_HISTORICAL_WINDOW_DAYS,
                            atLeast(14),
                            ConfigDef.Importance.HIGH,
                            HISTORICAL_WINDOW_DAYS_DOC)
                    .define(METRIC_SET_CONFIG,
                            ConfigDef.Type.LIST,
                            DEFAULT_METRIC_SET,
                            new ConfigDef.NonEmptyList(),
                            ConfigDef.Importance.HIGH,
                            METRIC_SET_DOC)
                    .define(TIMEZONE_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_TIMEZONE,
                            new ConfigDef.ValidZoneId(),
                            ConfigDef.Importance.MEDIUM,
                            TIMEZONE_DOC)
                    .define(TARGET_DATE_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_TARGET_DATE,
                            new ConfigDef.OptionalIsoDate(),
                            ConfigDef.Importance.LOW,
                            TARGET_DATE_DOC)
                    .define(NUM_EVALUATION_THREADS_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_NUM_EVALUATION_THREADS,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            NUM_EVALUATION_THREADS_DOC);
  }
}
