/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.marketing.metricalerts;

import com.linkedin.marketing.metricalerts.config.MetricAlertsConfig;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Properties;


/**
 * Util class for convenience.
 */
public final class MetricAlertsAppUtils {
  public static final String ALERT_RUNNER_SENSOR = "AlertRunner";

  private MetricAlertsAppUtils() {

  }

  /**
   * Reads the configuration file, parses and validates the configs.
   *
   * @param propertiesFile The configuration file.
   * @return The parsed configs.
   */
  public static MetricAlertsConfig readConfig(String propertiesFile) throws IOException {
    Properties props = new Properties();
    try (InputStream propStream = new FileInputStream(propertiesFile)) {
      props.load(propStream);
    }
    return new MetricAlertsConfig(props);
  }

  /**
   * Get the date to evaluate: the configured target date if any, otherwise yesterday in the configured time zone.
   *
   * @param config The configurations of the run.
   * @param clock Clock to read the current instant from.
   * @return The date to evaluate.
   */
  public static LocalDate targetDate(MetricAlertsConfig config, Clock clock) {
    LocalDate override = config.targetDateOverride();
    if (override != null) {
      return override;
    }
    return LocalDate.now(clock.withZone(config.zoneId())).minusDays(1);
  }
}
