/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.marketing.metricalerts.report;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.linkedin.marketing.metricalerts.detector.AlertRunResult;
import com.linkedin.metricalerts.model.AnomalyRecord;
import com.linkedin.metricalerts.model.DetectionMethod;
import com.linkedin.metricalerts.model.RunSummary;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Writes the summary and alerts of a run as a pretty-printed JSON document.
 */
public class RunReportWriter {
  private static final Logger LOG = LoggerFactory.getLogger(RunReportWriter.class);
  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
  private final Clock _clock;

  public RunReportWriter() {
    this(Clock.systemUTC());
  }

  public RunReportWriter(Clock clock) {
    _clock = clock;
  }

  /**
   * @param result The result of a run.
   * @param file The file to write, replaced if it exists.
   */
  public void write(AlertRunResult result, Path file) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      GSON.toJson(toJson(result), writer);
    }
    LOG.info("Wrote report of {} alerts to {}.", result.alerts().size(), file);
  }

  /**
   * @param result The result of a run.
   * @return The report of the run.
   */
  public JsonObject toJson(AlertRunResult result) {
    JsonObject report = new JsonObject();
    report.addProperty("executionTime", Instant.now(_clock).toString());
    report.add("summary", toJson(result.summary()));
    JsonArray alerts = new JsonArray();
    result.alerts().forEach(alert -> alerts.add(toJson(alert)));
    report.add("alerts", alerts);
    return report;
  }

  /**
   * @param summary Summary of a run.
   * @return The JSON representation of the summary.
   */
  public static JsonObject toJson(RunSummary summary) {
    JsonObject json = new JsonObject();
    json.addProperty("targetDate", summary.targetDate().toString());
    json.addProperty("entities", summary.numEntities());
    json.addProperty("evaluatedEntities", summary.numEvaluatedEntities());
    json.addProperty("skippedEntities", summary.numSkippedEntities());
    json.addProperty("entitiesMissingTargetDate", summary.numEntitiesMissingTargetDate());
    json.addProperty("failedEntities", summary.numFailedEntities());
    json.addProperty("alerts", summary.numAlerts());
    json.add("alertsByMethod", byMethod(summary.numAlertsByMethod()));
    json.add("insufficientDataByMethod", byMethod(summary.numInsufficientDataByMethod()));
    json.add("detectorFailuresByMethod", byMethod(summary.numDetectorFailuresByMethod()));
    json.addProperty("deliveredAlerts", summary.numDeliveredAlerts());
    json.addProperty("failedDeliveries", summary.numFailedDeliveries());
    json.addProperty("skippedDeliveries", summary.numSkippedDeliveries());
    return json;
  }

  /**
   * @param alert An alert.
   * @return The JSON representation of the alert, with "N/A" as the value of multivariate alerts.
   */
  public static JsonObject toJson(AnomalyRecord alert) {
    JsonObject json = new JsonObject();
    json.addProperty("entity", alert.entity());
    json.addProperty("metric", alert.metric());
    json.addProperty("date", alert.date().toString());
    json.addProperty("kind", alert.kind().wireName());
    if (alert.value() == null) {
      json.addProperty("value", AnomalyRecord.NOT_AVAILABLE);
    } else {
      json.addProperty("value", alert.value());
    }
    json.addProperty("method", alert.method().wireName());
    json.addProperty("score", alert.score());
    json.addProperty("params", alert.params());
    JsonObject context = new JsonObject();
    alert.context().forEach(context::addProperty);
    json.add("context", context);
    return json;
  }

  private static JsonObject byMethod(Map<DetectionMethod, Integer> counts) {
    JsonObject json = new JsonObject();
    counts.forEach((method, count) -> json.addProperty(method.wireName(), count));
    return json;
  }
}
