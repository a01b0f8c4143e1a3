/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.marketing.metricalerts.detector;

import com.linkedin.metricalerts.detector.AnomalyFinder;
import com.linkedin.metricalerts.detector.isolation.IsolationForestAnomalyFinder;
import com.linkedin.metricalerts.detector.seasonal.SeasonalMadAnomalyFinder;
import com.linkedin.metricalerts.model.AnomalyKind;
import com.linkedin.metricalerts.model.AnomalyRecord;
import com.linkedin.metricalerts.model.DetectionMethod;
import com.linkedin.metricalerts.model.DetectionResult;
import com.linkedin.metricalerts.model.EntityHistory;
import com.linkedin.metricalerts.model.MetricSeries;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.easymock.EasyMock;
import org.junit.Test;

import static com.linkedin.marketing.metricalerts.MetricAlertsAppUnitTestUtils.ENTITY;
import static com.linkedin.marketing.metricalerts.MetricAlertsAppUnitTestUtils.METRIC_SET;
import static com.linkedin.marketing.metricalerts.MetricAlertsAppUnitTestUtils.TARGET_DATE;
import static com.linkedin.marketing.metricalerts.MetricAlertsAppUnitTestUtils.regularHistory;
import static com.linkedin.marketing.metricalerts.MetricAlertsAppUnitTestUtils.seasonalAlert;
import static com.linkedin.marketing.metricalerts.MetricAlertsAppUnitTestUtils.series;
import static com.linkedin.marketing.metricalerts.MetricAlertsAppUnitTestUtils.weeklyValues;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;


public class EntityEvaluatorTest {
  private static final int NUM_DAYS = 60;

  @Test
  public void testRecordsOfAllFindersAreStampedWithEntity() {
    double[] sessions = weeklyValues(NUM_DAYS, 1000.0);
    sessions[NUM_DAYS - 1] = 5000.0;
    EntityHistory regular = regularHistory(ENTITY, TARGET_DATE, NUM_DAYS);
    EntityHistory history = withSeries(regular, series("sessions", TARGET_DATE, sessions));
    EntityEvaluator evaluator = new EntityEvaluator(Arrays.asList(new SeasonalMadAnomalyFinder(),
                                                                  new IsolationForestAnomalyFinder()), METRIC_SET);

    EntityEvaluation evaluation = evaluator.evaluate(history, TARGET_DATE);
    assertFalse(evaluation.isSkipped());
    assertFalse(evaluation.isMissingTargetDate());
    assertEquals(3, evaluation.outcomes().get(DetectionMethod.SEASONAL_MAD).size());
    assertEquals(1, evaluation.outcomes().get(DetectionMethod.ISOLATION_ENSEMBLE).size());
    assertEquals(1, evaluation.numOutcomes(DetectionMethod.SEASONAL_MAD, DetectionResult.Status.ANOMALY));

    AnomalyRecord sessionsSpike = evaluation.records().get(0);
    assertEquals(ENTITY, sessionsSpike.entity());
    assertEquals("sessions", sessionsSpike.metric());
    assertEquals(AnomalyKind.SPIKE, sessionsSpike.kind());
    for (AnomalyRecord record : evaluation.records()) {
      assertEquals(ENTITY, record.entity());
    }
  }

  @Test
  public void testFinderFailureIsIsolated() {
    AnomalyFinder failing = EasyMock.mock(AnomalyFinder.class);
    EasyMock.expect(failing.anomalies(EasyMock.anyObject(EntityHistory.class), EasyMock.eq(TARGET_DATE)))
            .andThrow(new IllegalStateException("boom"));
    EasyMock.expect(failing.method()).andReturn(DetectionMethod.ISOLATION_ENSEMBLE).anyTimes();
    AnomalyFinder reporting = EasyMock.mock(AnomalyFinder.class);
    EasyMock.expect(reporting.anomalies(EasyMock.anyObject(EntityHistory.class), EasyMock.eq(TARGET_DATE)))
            .andReturn(Collections.singletonList(DetectionResult.anomaly(seasonalAlert(null, AnomalyKind.DROP))));
    EasyMock.expect(reporting.method()).andReturn(DetectionMethod.SEASONAL_MAD).anyTimes();
    EasyMock.replay(failing, reporting);

    EntityEvaluation evaluation = new EntityEvaluator(Arrays.asList(failing, reporting), METRIC_SET)
        .evaluate(regularHistory(ENTITY, TARGET_DATE, NUM_DAYS), TARGET_DATE);
    assertEquals(1, evaluation.numOutcomes(DetectionMethod.ISOLATION_ENSEMBLE, DetectionResult.Status.FAILED));
    assertEquals(1, evaluation.records().size());
    assertEquals(ENTITY, evaluation.records().get(0).entity());
    EasyMock.verify(failing, reporting);
  }

  @Test
  public void testFindersOnlySeeMetricSet() {
    AnomalyFinder finder = EasyMock.mock(AnomalyFinder.class);
    EasyMock.expect(finder.anomalies(EasyMock.anyObject(EntityHistory.class), EasyMock.eq(TARGET_DATE)))
            .andAnswer(() -> {
              EntityHistory history = (EntityHistory) EasyMock.getCurrentArguments()[0];
              assertEquals(Arrays.asList("leads"), Arrays.asList(history.seriesByMetric().keySet().toArray()));
              return Collections.singletonList(DetectionResult.noAnomaly());
            });
    EasyMock.expect(finder.method()).andReturn(DetectionMethod.SEASONAL_MAD).anyTimes();
    EasyMock.replay(finder);

    EntityEvaluation evaluation = new EntityEvaluator(Collections.singletonList(finder), Arrays.asList("leads"))
        .evaluate(regularHistory(ENTITY, TARGET_DATE, NUM_DAYS), TARGET_DATE);
    assertTrue(evaluation.records().isEmpty());
    EasyMock.verify(finder);
  }

  @Test
  public void testEmptyHistoryIsSkipped() {
    AnomalyFinder finder = EasyMock.mock(AnomalyFinder.class);
    EasyMock.replay(finder);
    EntityHistory history = new EntityHistory(ENTITY, Collections.singletonMap("clicks",
                                                                               series("clicks", TARGET_DATE,
                                                                                      new double[]{1.0})));
    EntityEvaluation evaluation = new EntityEvaluator(Collections.singletonList(finder), METRIC_SET)
        .evaluate(history, TARGET_DATE);
    assertTrue(evaluation.isSkipped());
    EasyMock.verify(finder);
  }

  @Test
  public void testStaleHistoryIsMissingTargetDate() {
    EntityEvaluation evaluation = new EntityEvaluator(Arrays.asList(new SeasonalMadAnomalyFinder(),
                                                                    new IsolationForestAnomalyFinder()), METRIC_SET)
        .evaluate(regularHistory(ENTITY, TARGET_DATE.minusDays(1), NUM_DAYS), TARGET_DATE);
    assertTrue(evaluation.isMissingTargetDate());
    assertTrue(evaluation.records().isEmpty());
    assertEquals(3, evaluation.numOutcomes(DetectionMethod.SEASONAL_MAD, DetectionResult.Status.INSUFFICIENT_DATA));
    assertEquals(1, evaluation.numOutcomes(DetectionMethod.ISOLATION_ENSEMBLE,
                                           DetectionResult.Status.INSUFFICIENT_DATA));
  }

  private static EntityHistory withSeries(EntityHistory history, MetricSeries replacement) {
    Map<String, MetricSeries> seriesByMetric = new LinkedHashMap<>(history.seriesByMetric());
    seriesByMetric.put(replacement.metric(), replacement);
    return new EntityHistory(history.entity(), seriesByMetric);
  }
}
