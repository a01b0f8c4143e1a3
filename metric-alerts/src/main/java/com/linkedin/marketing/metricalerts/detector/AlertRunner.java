/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.marketing.metricalerts.detector;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.linkedin.marketing.metricalerts.common.MetricAlertsThreadFactory;
import com.linkedin.marketing.metricalerts.config.MetricAlertsConfig;
import com.linkedin.marketing.metricalerts.config.constants.AlertSinkConfig;
import com.linkedin.marketing.metricalerts.config.constants.AnomalyDetectorConfig;
import com.linkedin.marketing.metricalerts.config.constants.MetricSourceConfig;
import com.linkedin.marketing.metricalerts.notifier.AlertDeliveryResult;
import com.linkedin.marketing.metricalerts.notifier.AlertSink;
import com.linkedin.marketing.metricalerts.source.MetricSource;
import com.linkedin.metricalerts.detector.AnomalyFinder;
import com.linkedin.metricalerts.exception.MetricAlertsException;
import com.linkedin.metricalerts.model.AnomalyRecord;
import com.linkedin.metricalerts.model.DetectionMethod;
import com.linkedin.metricalerts.model.DetectionResult;
import com.linkedin.metricalerts.model.EntityHistory;
import com.linkedin.metricalerts.model.RunSummary;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.marketing.metricalerts.MetricAlertsAppUtils.ALERT_RUNNER_SENSOR;
import static com.linkedin.metricalerts.common.utils.Utils.validateNotNull;


/**
 * Runs one alerting pass for a target date:
 * <ol>
 *   <li>lists the entities of the {@link MetricSource},</li>
 *   <li>loads and evaluates every entity on a bounded worker pool,</li>
 *   <li>compiles the {@link RunSummary} once all entities are done, and</li>
 *   <li>hands every alert to the {@link AlertSink}.</li>
 * </ol>
 * A failure to load or evaluate an entity is logged and counted, and does not affect other entities. Alerts are only
 * delivered after detection finished for all entities.
 */
public class AlertRunner implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(AlertRunner.class);
  private static final long EXECUTOR_SHUTDOWN_TIMEOUT_MS = TimeUnit.SECONDS.toMillis(30);
  private final MetricSource _metricSource;
  private final AlertSink _alertSink;
  private final EntityEvaluator _entityEvaluator;
  private final int _historicalWindowDays;
  private final MetricAlertsThreadFactory _threadFactory;
  private final ExecutorService _evaluationExecutor;
  private final Timer _entityEvaluationTimer;
  private final Counter _failedEntities;
  private final Map<DetectionMethod, Counter> _alertsByMethod;
  private final Counter _deliveredAlerts;
  private final Counter _failedAlertDeliveries;

  /**
   * @param config The configurations of the run.
   * @param dropwizardMetricRegistry The metric registry that holds the metrics of the run.
   */
  public AlertRunner(MetricAlertsConfig config, MetricRegistry dropwizardMetricRegistry) throws MetricAlertsException {
    this(config.getConfiguredInstance(MetricSourceConfig.METRIC_SOURCE_CLASS_CONFIG, MetricSource.class),
         config.getConfiguredInstance(AlertSinkConfig.ALERT_SINK_CLASS_CONFIG, AlertSink.class),
         new EntityEvaluator(config.getConfiguredInstances(AnomalyDetectorConfig.ANOMALY_FINDER_CLASSES_CONFIG,
                                                           AnomalyFinder.class), config.metricSet()),
         config.getInt(AnomalyDetectorConfig.HISTORICAL_WINDOW_DAYS_CONFIG),
         config.getInt(AnomalyDetectorConfig.NUM_EVALUATION_THREADS_CONFIG),
         dropwizardMetricRegistry);
  }

  /**
   * Package private for unit tests.
   */
  AlertRunner(MetricSource metricSource,
              AlertSink alertSink,
              EntityEvaluator entityEvaluator,
              int historicalWindowDays,
              int numEvaluationThreads,
              MetricRegistry dropwizardMetricRegistry) {
    _metricSource = validateNotNull(metricSource, "Metric source cannot be null.");
    _alertSink = validateNotNull(alertSink, "Alert sink cannot be null.");
    _entityEvaluator = validateNotNull(entityEvaluator, "Entity evaluator cannot be null.");
    _historicalWindowDays = historicalWindowDays;
    _threadFactory = new MetricAlertsThreadFactory("EntityEvaluator", LOG);
    _evaluationExecutor = Executors.newFixedThreadPool(numEvaluationThreads, _threadFactory);
    _entityEvaluationTimer = dropwizardMetricRegistry.timer(MetricRegistry.name(ALERT_RUNNER_SENSOR,
                                                                                "entity-evaluation-timer"));
    _failedEntities = dropwizardMetricRegistry.counter(MetricRegistry.name(ALERT_RUNNER_SENSOR, "failed-entities"));
    _alertsByMethod = new EnumMap<>(DetectionMethod.class);
    for (DetectionMethod method : DetectionMethod.cachedValues()) {
      _alertsByMethod.put(method, dropwizardMetricRegistry.counter(
          MetricRegistry.name(ALERT_RUNNER_SENSOR, String.format("%s-alerts", method.wireName()))));
    }
    _deliveredAlerts = dropwizardMetricRegistry.counter(MetricRegistry.name(ALERT_RUNNER_SENSOR, "delivered-alerts"));
    _failedAlertDeliveries = dropwizardMetricRegistry.counter(MetricRegistry.name(ALERT_RUNNER_SENSOR,
                                                                                  "failed-alert-deliveries"));
  }

  /**
   * Evaluate all entities for the given date and deliver the alerts.
   *
   * @param targetDate The date to evaluate.
   * @return The alerts and summary of the run.
   */
  public AlertRunResult run(LocalDate targetDate) throws MetricAlertsException {
    validateNotNull(targetDate, "Target date cannot be null.");
    LocalDate startDate = targetDate.minusDays(_historicalWindowDays - 1L);
    List<String> entities = _metricSource.entities();
    LOG.info("Evaluating {} entities on {} with history since {}.", entities.size(), targetDate, startDate);

    List<Future<EntityEvaluation>> futures = new ArrayList<>(entities.size());
    for (String entity : entities) {
      futures.add(_evaluationExecutor.submit(() -> evaluate(entity, startDate, targetDate)));
    }

    RunSummary.Builder summary = new RunSummary.Builder(targetDate).numEntities(entities.size());
    List<AnomalyRecord> alerts = new ArrayList<>();
    for (int i = 0; i < futures.size(); i++) {
      EntityEvaluation evaluation;
      try {
        evaluation = futures.get(i).get();
      } catch (ExecutionException e) {
        LOG.warn("Failed to evaluate entity {} on {}.", entities.get(i), targetDate, e.getCause());
        _failedEntities.inc();
        summary.addFailedEntity();
        continue;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        futures.forEach(future -> future.cancel(true));
        throw new MetricAlertsException("Interrupted while evaluating entities on " + targetDate, e);
      }
      if (evaluation.isSkipped()) {
        LOG.debug("Skipping entity {} without history.", evaluation.entity());
        summary.addSkippedEntity();
        continue;
      }
      summary.addEvaluatedEntity(evaluation.isMissingTargetDate());
      evaluation.outcomes().forEach((method, statuses) -> statuses.forEach(
          status -> summary.addDetectionOutcome(method, status)));
      for (AnomalyRecord record : evaluation.records()) {
        _alertsByMethod.get(record.method()).inc();
        alerts.add(record);
      }
    }
    RunSummary detectionSummary = summary.build();
    LOG.info("Detection finished: {}", detectionSummary);
    if (_threadFactory.numUncaughtExceptions() > 0) {
      LOG.warn("{} evaluation threads died with an uncaught exception.", _threadFactory.numUncaughtExceptions());
    }
    return new AlertRunResult(deliver(alerts, detectionSummary), alerts);
  }

  private EntityEvaluation evaluate(String entity, LocalDate startDate, LocalDate targetDate)
      throws MetricAlertsException {
    EntityHistory history = _metricSource.history(entity, startDate, targetDate, _entityEvaluator.metricSet());
    if (history.isEmpty()) {
      return EntityEvaluation.skipped(entity);
    }
    try (Timer.Context ignored = _entityEvaluationTimer.time()) {
      return _entityEvaluator.evaluate(history, targetDate);
    }
  }

  private RunSummary deliver(List<AnomalyRecord> alerts, RunSummary detectionSummary) {
    int numDelivered = 0;
    int numFailed = 0;
    int numSkipped = 0;
    for (AnomalyRecord alert : alerts) {
      AlertDeliveryResult result;
      try {
        result = _alertSink.deliver(alert);
      } catch (RuntimeException e) {
        LOG.warn("Alert sink failed to deliver {}.", alert, e);
        result = AlertDeliveryResult.failed(AlertDeliveryResult.NO_STATUS_CODE, e.getMessage());
      }
      switch (result.status()) {
        case DELIVERED:
          numDelivered++;
          _deliveredAlerts.inc();
          break;
        case FAILED:
          numFailed++;
          _failedAlertDeliveries.inc();
          break;
        default:
          numSkipped++;
          break;
      }
    }
    LOG.info("Delivered {} of {} alerts ({} failed, {} skipped).", numDelivered, alerts.size(), numFailed, numSkipped);
    return detectionSummary.withDeliveryCounts(numDelivered, numFailed, numSkipped);
  }

  @Override
  public void close() {
    _evaluationExecutor.shutdown();
    try {
      if (!_evaluationExecutor.awaitTermination(EXECUTOR_SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
        LOG.warn("The evaluation executor failed to shutdown in {} ms.", EXECUTOR_SHUTDOWN_TIMEOUT_MS);
        _evaluationExecutor.shutdownNow();
      }
    } catch (InterruptedException e) {
      LOG.warn("Interrupted while waiting for the evaluation executor to shutdown.");
      Thread.currentThread().interrupt();
    }
  }
}
