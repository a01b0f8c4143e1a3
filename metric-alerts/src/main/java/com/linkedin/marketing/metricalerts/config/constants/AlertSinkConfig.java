/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.marketing.metricalerts.config.constants;

import com.linkedin.marketing.metricalerts.notifier.MSTeamsAlertSink;
import com.linkedin.metricalerts.common.config.ConfigDef;


/**
 * A class to keep the alert delivery and reporting configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class AlertSinkConfig {

  /**
   * <code>alert.sink.class</code>
   */
  public static final String ALERT_SINK_CLASS_CONFIG = "alert.sink.class";
  public static final String DEFAULT_ALERT_SINK_CLASS = MSTeamsAlertSink.class.getName();
  public static final String ALERT_SINK_CLASS_DOC = "The class that delivers the alerts of a run once all entities "
      + "have been evaluated.";

  /**
   * <code>alert.dashboard.url</code>
   */
  public static final String ALERT_DASHBOARD_URL_CONFIG = "alert.dashboard.url";
  public static final String DEFAULT_ALERT_DASHBOARD_URL = "";
  public static final String ALERT_DASHBOARD_URL_DOC = "The dashboard linked from every alert. No link is added if "
      + "empty.";

  /**
   * <code>run.report.file</code>
   */
  public static final String RUN_REPORT_FILE_CONFIG = "run.report.file";
  public static final String DEFAULT_RUN_REPORT_FILE = "";
  public static final String RUN_REPORT_FILE_DOC = "The file the JSON report of a run, with the run summary and all "
      + "alerts, is written to. No report is written if empty.";

  private AlertSinkConfig() {
  }

  /**
   * Define configs for Alert Sink.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for Alert Sink.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(ALERT_SINK_CLASS_CONFIG,
                            ConfigDef.Type.CLASS,
                            DEFAULT_ALERT_SINK_CLASS,
                            ConfigDef.Importance.HIGH,
                            ALERT_SINK_CLASS_DOC)
                    .define(ALERT_DASHBOARD_URL_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_ALERT_DASHBOARD_URL,
                            ConfigDef.Importance.LOW,
                            ALERT_DASHBOARD_URL_DOC)
                    .define(RUN_REPORT_FILE_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_RUN_REPORT_FILE,
                            ConfigDef.Importance.LOW,
                            RUN_REPORT_FILE_DOC);
  }
}
