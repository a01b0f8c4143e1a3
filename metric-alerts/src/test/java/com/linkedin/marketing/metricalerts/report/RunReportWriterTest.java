/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.marketing.metricalerts.report;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.linkedin.marketing.metricalerts.detector.AlertRunResult;
import com.linkedin.metricalerts.model.AnomalyKind;
import com.linkedin.metricalerts.model.DetectionMethod;
import com.linkedin.metricalerts.model.DetectionResult;
import com.linkedin.metricalerts.model.RunSummary;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static com.linkedin.marketing.metricalerts.MetricAlertsAppUnitTestUtils.ENTITY;
import static com.linkedin.marketing.metricalerts.MetricAlertsAppUnitTestUtils.TARGET_DATE;
import static com.linkedin.marketing.metricalerts.MetricAlertsAppUnitTestUtils.multivariateAlert;
import static com.linkedin.marketing.metricalerts.MetricAlertsAppUnitTestUtils.seasonalAlert;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;


public class RunReportWriterTest {
  private static final Instant NOW = Instant.parse("2026-03-02T06:00:00Z");

  @Rule
  public TemporaryFolder _folder = new TemporaryFolder();

  @Test
  public void testWriteReport() throws IOException {
    RunSummary summary = new RunSummary.Builder(TARGET_DATE)
        .numEntities(3)
        .addEvaluatedEntity(false)
        .addEvaluatedEntity(true)
        .addSkippedEntity()
        .addDetectionOutcome(DetectionMethod.SEASONAL_MAD, DetectionResult.Status.ANOMALY)
        .addDetectionOutcome(DetectionMethod.ISOLATION_ENSEMBLE, DetectionResult.Status.ANOMALY)
        .build()
        .withDeliveryCounts(1, 1, 0);
    AlertRunResult result = new AlertRunResult(summary, Arrays.asList(seasonalAlert(ENTITY, AnomalyKind.SPIKE),
                                                                      multivariateAlert(ENTITY)));
    Path file = _folder.getRoot().toPath().resolve("reports").resolve("report.json");

    new RunReportWriter(Clock.fixed(NOW, ZoneOffset.UTC)).write(result, file);

    assertTrue(Files.exists(file));
    JsonObject report = JsonParser.parseString(new String(Files.readAllBytes(file), StandardCharsets.UTF_8))
                                  .getAsJsonObject();
    assertEquals(NOW.toString(), report.get("executionTime").getAsString());

    JsonObject summaryJson = report.getAsJsonObject("summary");
    assertEquals("2026-03-01", summaryJson.get("targetDate").getAsString());
    assertEquals(3, summaryJson.get("entities").getAsInt());
    assertEquals(1, summaryJson.get("entitiesMissingTargetDate").getAsInt());
    assertEquals(2, summaryJson.get("alerts").getAsInt());
    assertEquals(1, summaryJson.getAsJsonObject("alertsByMethod").get("isolation-ensemble").getAsInt());
    assertEquals(1, summaryJson.get("failedDeliveries").getAsInt());

    JsonArray alerts = report.getAsJsonArray("alerts");
    assertEquals(2, alerts.size());
    JsonObject seasonal = alerts.get(0).getAsJsonObject();
    assertEquals("spike", seasonal.get("kind").getAsString());
    assertEquals(5000.0, seasonal.get("value").getAsDouble(), 0.0);
    assertEquals("seasonal-mad", seasonal.get("method").getAsString());
    JsonObject multivariate = alerts.get(1).getAsJsonObject();
    assertEquals("multivariate", multivariate.get("metric").getAsString());
    assertEquals("N/A", multivariate.get("value").getAsString());
    assertEquals(3000.0, multivariate.getAsJsonObject("context").get("spend").getAsDouble(), 0.0);
  }
}
