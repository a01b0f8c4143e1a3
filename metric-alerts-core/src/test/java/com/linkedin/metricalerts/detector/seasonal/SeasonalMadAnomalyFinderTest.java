/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricalerts.detector.seasonal;

import com.linkedin.metricalerts.common.config.ConfigException;
import com.linkedin.metricalerts.model.AnomalyKind;
import com.linkedin.metricalerts.model.AnomalyRecord;
import com.linkedin.metricalerts.model.DetectionMethod;
import com.linkedin.metricalerts.model.DetectionResult;
import com.linkedin.metricalerts.model.EntityHistory;
import com.linkedin.metricalerts.model.MetricSeries;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;

import static com.linkedin.metricalerts.MetricAlertsUnitTestUtils.ENTITY;
import static com.linkedin.metricalerts.MetricAlertsUnitTestUtils.LEADS;
import static com.linkedin.metricalerts.MetricAlertsUnitTestUtils.SESSIONS;
import static com.linkedin.metricalerts.MetricAlertsUnitTestUtils.TARGET_DATE;
import static com.linkedin.metricalerts.MetricAlertsUnitTestUtils.constantValues;
import static com.linkedin.metricalerts.MetricAlertsUnitTestUtils.history;
import static com.linkedin.metricalerts.MetricAlertsUnitTestUtils.series;
import static com.linkedin.metricalerts.MetricAlertsUnitTestUtils.weeklyValues;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;


public class SeasonalMadAnomalyFinderTest {
  private static final int NUM_DAYS = 28;

  @Test
  public void testSpikeOnTargetDate() {
    double[] values = weeklyValues(NUM_DAYS, 100.0, 20.0);
    values[NUM_DAYS - 1] += 40.0;
    DetectionResult result = new SeasonalMadAnomalyFinder().anomalyFor(series(SESSIONS, TARGET_DATE, values),
                                                                       TARGET_DATE);
    assertEquals(DetectionResult.Status.ANOMALY, result.status());
    AnomalyRecord record = result.record();
    assertEquals(AnomalyKind.SPIKE, record.kind());
    assertEquals(DetectionMethod.SEASONAL_MAD, record.method());
    assertEquals(SESSIONS, record.metric());
    assertEquals(TARGET_DATE, record.date());
    assertEquals(values[NUM_DAYS - 1], record.value(), 0.0);
    assertTrue(record.score() > 3.2);
    assertEquals("k=3.2, period=7", record.params());
    assertNull(record.entity());
    double residual = record.context().get(SeasonalMadAnomalyFinder.RESIDUAL);
    assertTrue(residual > record.context().get(SeasonalMadAnomalyFinder.UPPER_THRESHOLD));
    assertTrue(record.context().get(SeasonalMadAnomalyFinder.RELATIVE_MAGNITUDE_PCT) > 0.0);
  }

  @Test
  public void testDropOnTargetDate() {
    double[] values = weeklyValues(NUM_DAYS, 100.0, 20.0);
    values[NUM_DAYS - 1] -= 40.0;
    DetectionResult result = new SeasonalMadAnomalyFinder().anomalyFor(series(LEADS, TARGET_DATE, values),
                                                                       TARGET_DATE);
    assertEquals(DetectionResult.Status.ANOMALY, result.status());
    assertEquals(AnomalyKind.DROP, result.record().kind());
    assertTrue(result.record().context().get(SeasonalMadAnomalyFinder.RESIDUAL) < 0.0);
  }

  @Test
  public void testRegularWeekHasNoAnomaly() {
    DetectionResult result = new SeasonalMadAnomalyFinder().anomalyFor(
        series(SESSIONS, TARGET_DATE, weeklyValues(NUM_DAYS, 100.0, 20.0)), TARGET_DATE);
    assertEquals(DetectionResult.Status.NO_ANOMALY, result.status());
    assertFalse(result.hasAnomaly());
    assertNull(result.record());
  }

  @Test
  public void testConstantSeriesUsesMadFloorAndHasNoAnomaly() {
    DetectionResult result = new SeasonalMadAnomalyFinder().anomalyFor(
        series(SESSIONS, TARGET_DATE, constantValues(NUM_DAYS, 100.0)), TARGET_DATE);
    assertEquals(DetectionResult.Status.NO_ANOMALY, result.status());
  }

  @Test
  public void testStaleSeriesIsInsufficientData() {
    MetricSeries stale = series(SESSIONS, TARGET_DATE.minusDays(1), weeklyValues(NUM_DAYS, 100.0, 20.0));
    DetectionResult result = new SeasonalMadAnomalyFinder().anomalyFor(stale, TARGET_DATE);
    assertEquals(DetectionResult.Status.INSUFFICIENT_DATA, result.status());
    assertTrue(result.reason().contains(TARGET_DATE.toString()));
  }

  @Test
  public void testShortSeriesIsInsufficientData() {
    double[] values = weeklyValues(13, 100.0, 20.0);
    values[12] += 1000.0;
    DetectionResult result = new SeasonalMadAnomalyFinder().anomalyFor(series(SESSIONS, TARGET_DATE, values),
                                                                       TARGET_DATE);
    assertEquals(DetectionResult.Status.INSUFFICIENT_DATA, result.status());
  }

  @Test
  public void testEmptySeriesIsInsufficientData() {
    DetectionResult result = new SeasonalMadAnomalyFinder().anomalyFor(MetricSeries.empty(SESSIONS), TARGET_DATE);
    assertEquals(DetectionResult.Status.INSUFFICIENT_DATA, result.status());
  }

  @Test
  public void testNullSeriesIsReportedAsFailure() {
    DetectionResult result = new SeasonalMadAnomalyFinder().anomalyFor(null, TARGET_DATE);
    assertEquals(DetectionResult.Status.FAILED, result.status());
    assertTrue(result.cause() instanceof IllegalArgumentException);
  }

  @Test
  public void testNonFiniteValueInHistoryIsReportedAsFailure() {
    for (double invalid : new double[]{Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY}) {
      double[] values = weeklyValues(NUM_DAYS, 100.0, 20.0);
      values[NUM_DAYS - 1] += 40.0;
      values[3] = invalid;
      DetectionResult result = new SeasonalMadAnomalyFinder().anomalyFor(series(SESSIONS, TARGET_DATE, values),
                                                                         TARGET_DATE);
      assertEquals("value " + invalid, DetectionResult.Status.FAILED, result.status());
      assertNull(result.record());
    }
  }

  @Test
  public void testLowerThresholdFlagsEveryPointAHigherThresholdFlags() {
    SeasonalMadAnomalyFinder strict = new SeasonalMadAnomalyFinder(3.5, 7);
    SeasonalMadAnomalyFinder lenient = new SeasonalMadAnomalyFinder(1.5, 7);
    int numStrict = 0;
    int numLenient = 0;
    for (int spike = 0; spike <= 30; spike++) {
      double[] values = weeklyValues(NUM_DAYS, 100.0, 20.0);
      values[NUM_DAYS - 1] += spike;
      MetricSeries s = series(SESSIONS, TARGET_DATE, values);
      boolean strictFlag = strict.anomalyFor(s, TARGET_DATE).hasAnomaly();
      boolean lenientFlag = lenient.anomalyFor(s, TARGET_DATE).hasAnomaly();
      assertTrue("spike " + spike, !strictFlag || lenientFlag);
      numStrict += strictFlag ? 1 : 0;
      numLenient += lenientFlag ? 1 : 0;
    }
    assertTrue(numLenient >= numStrict);
    assertTrue(numStrict > 0);
  }

  @Test
  public void testAnomaliesEvaluatesEachMetric() {
    double[] spiking = weeklyValues(NUM_DAYS, 100.0, 20.0);
    spiking[NUM_DAYS - 1] += 40.0;
    EntityHistory history = history(ENTITY,
                                     series(SESSIONS, TARGET_DATE, spiking),
                                     series(LEADS, TARGET_DATE, weeklyValues(NUM_DAYS, 100.0, 20.0)));
    List<DetectionResult> results = new SeasonalMadAnomalyFinder().anomalies(history, TARGET_DATE);
    assertEquals(2, results.size());
    assertEquals(SESSIONS, results.get(0).record().metric());
    assertEquals(DetectionResult.Status.NO_ANOMALY, results.get(1).status());
  }

  @Test
  public void testConfigure() {
    SeasonalMadAnomalyFinder finder = new SeasonalMadAnomalyFinder();
    Map<String, Object> configs = new HashMap<>();
    configs.put(SeasonalMadAnomalyFinderConfig.MAD_THRESHOLD_CONFIG, "2.5");
    finder.configure(configs);

    double[] values = weeklyValues(NUM_DAYS, 100.0, 20.0);
    values[NUM_DAYS - 1] += 40.0;
    DetectionResult result = finder.anomalyFor(series(SESSIONS, TARGET_DATE, values), TARGET_DATE);
    assertEquals("k=2.5, period=7", result.record().params());
  }

  @Test(expected = ConfigException.class)
  public void testConfigureRejectsNonPositiveThreshold() {
    new SeasonalMadAnomalyFinder().configure(
        Collections.singletonMap(SeasonalMadAnomalyFinderConfig.MAD_THRESHOLD_CONFIG, "0"));
  }
}
