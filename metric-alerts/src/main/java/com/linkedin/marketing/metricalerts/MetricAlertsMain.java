/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.marketing.metricalerts;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import com.linkedin.marketing.metricalerts.config.MetricAlertsConfig;
import com.linkedin.marketing.metricalerts.config.constants.AlertSinkConfig;
import com.linkedin.marketing.metricalerts.detector.AlertRunResult;
import com.linkedin.marketing.metricalerts.detector.AlertRunner;
import com.linkedin.marketing.metricalerts.report.RunReportWriter;
import com.linkedin.metricalerts.model.DetectionMethod;
import com.linkedin.metricalerts.model.RunSummary;
import java.io.IOException;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.marketing.metricalerts.MetricAlertsAppUtils.readConfig;
import static com.linkedin.marketing.metricalerts.MetricAlertsAppUtils.targetDate;

/**
 * The main class to run one pass of the metric alerts.
 */
public final class MetricAlertsMain {
  private static final Logger LOG = LoggerFactory.getLogger(MetricAlertsMain.class);

  private MetricAlertsMain() { }

  /**
   * The main function to run the metric alerts for one target date.
   * @param args Arguments passed while starting the run.
   */
  public static void main(String[] args) throws Exception {
    if (args.length == 0) {
      throw new IllegalArgumentException(
              String.format("USAGE: java %s alerts.properties", MetricAlertsMain.class.getSimpleName()));
    }

    Thread.setDefaultUncaughtExceptionHandler((t, e) -> LOG.error("Uncaught exception on thread {}", t, e));

    MetricAlertsConfig config = readConfig(args[0]);
    LocalDate targetDate = targetDate(config, Clock.systemUTC());
    MetricRegistry dropwizardMetricRegistry = new MetricRegistry();
    AlertRunResult result;
    try (AlertRunner runner = new AlertRunner(config, dropwizardMetricRegistry)) {
      config.logUnused();
      result = runner.run(targetDate);
    }
    writeReport(config, result);
    logSummary(result.summary());
    Slf4jReporter.forRegistry(dropwizardMetricRegistry).outputTo(LOG).build().report();
  }

  private static void writeReport(MetricAlertsConfig config, AlertRunResult result) {
    String reportFile = config.getString(AlertSinkConfig.RUN_REPORT_FILE_CONFIG);
    if (reportFile == null || reportFile.isEmpty()) {
      return;
    }
    try {
      new RunReportWriter().write(result, Paths.get(reportFile));
    } catch (IOException e) {
      LOG.error("Failed to write the run report to {}.", reportFile, e);
    }
  }

  private static void logSummary(RunSummary summary) {
    LOG.info("Run for {} completed.", summary.targetDate());
    LOG.info("Entities analyzed: {} (skipped: {}, failed: {})", summary.numEvaluatedEntities(),
             summary.numSkippedEntities(), summary.numFailedEntities());
    LOG.info("Total alerts: {}", summary.numAlerts());
    for (DetectionMethod method : DetectionMethod.cachedValues()) {
      LOG.info("{} alerts: {} (insufficient data: {}, failures: {})", method.wireName(), summary.numAlerts(method),
               summary.numInsufficientDataByMethod().get(method), summary.numDetectorFailures(method));
    }
    LOG.info("Entities without data on the target date: {}", summary.numEntitiesMissingTargetDate());
    LOG.info("Deliveries: {} delivered, {} failed, {} skipped", summary.numDeliveredAlerts(),
             summary.numFailedDeliveries(), summary.numSkippedDeliveries());
  }
}
