/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.marketing.metricalerts.source;

import com.linkedin.marketing.metricalerts.config.constants.AnomalyDetectorConfig;
import com.linkedin.metricalerts.exception.MetricAlertsException;
import com.linkedin.metricalerts.model.EntityHistory;
import com.linkedin.metricalerts.model.MetricSeries;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static com.linkedin.marketing.metricalerts.MetricAlertsAppUnitTestUtils.METRIC_SET;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;


public class CsvMetricSourceTest {
  private static final LocalDate DAY1 = LocalDate.of(2026, 2, 27);
  private static final LocalDate DAY2 = LocalDate.of(2026, 2, 28);
  private static final LocalDate DAY3 = LocalDate.of(2026, 3, 1);

  @Rule
  public TemporaryFolder _folder = new TemporaryFolder();

  @Test
  public void testLoadsEntitiesInOrderOfFirstAppearance() throws IOException, MetricAlertsException {
    CsvMetricSource source = source(csv("\uFEFFdomain,date,spend,leads,sessions",
                                        "b.example.com,2026-02-27,10,1,100",
                                        "a.example.com,2026-02-27,20,2,200",
                                        "b.example.com,2026-02-28,11,1,110"), null);
    assertEquals(Arrays.asList("b.example.com", "a.example.com"), source.entities());
  }

  @Test
  public void testHistoryIsRestrictedToWindowAndMetrics() throws IOException, MetricAlertsException {
    CsvMetricSource source = source(csv("domain,date,spend,leads,sessions,clicks",
                                        "example.com,2026-02-27,10,1,100,5",
                                        "example.com,2026-02-28,11,2,110,6",
                                        "example.com,2026-03-01,12,3,120,7"), null);
    EntityHistory history = source.history("example.com", DAY2, DAY3, Arrays.asList("sessions", "spend"));
    assertEquals(Arrays.asList("sessions", "spend"), Arrays.asList(history.seriesByMetric().keySet().toArray()));
    MetricSeries sessions = history.series("sessions");
    assertEquals(Arrays.asList(DAY2, DAY3), sessions.dates());
    assertArrayEquals(new double[]{110.0, 120.0}, sessions.values(), 0.0);
  }

  @Test
  public void testEmptyAndInvalidCellsAreMissing() throws IOException, MetricAlertsException {
    CsvMetricSource source = source(csv("domain,date,spend,leads,sessions",
                                        "example.com,2026-02-27,10,,100",
                                        "example.com,2026-02-28,11,n/a,110",
                                        "example.com,2026-03-01,12,3,\"120\""), null);
    EntityHistory history = source.history("example.com", DAY1, DAY3, METRIC_SET);
    assertEquals(Arrays.asList(DAY3), history.series("leads").dates());
    assertEquals(120.0, history.series("sessions").valueOn(DAY3), 0.0);
    assertEquals(3, history.series("spend").size());
  }

  @Test
  public void testNonFiniteCellsAreMissing() throws IOException, MetricAlertsException {
    CsvMetricSource source = source(csv("domain,date,spend,leads,sessions",
                                        "example.com,2026-02-27,NaN,1,Infinity",
                                        "example.com,2026-02-28,11,-Infinity,110",
                                        "example.com,2026-03-01,12,3,120"), null);
    EntityHistory history = source.history("example.com", DAY1, DAY3, METRIC_SET);
    assertEquals(Arrays.asList(DAY2, DAY3), history.series("spend").dates());
    assertEquals(Arrays.asList(DAY1, DAY3), history.series("leads").dates());
    assertEquals(Arrays.asList(DAY2, DAY3), history.series("sessions").dates());
  }

  @Test
  public void testDuplicateRowKeepsFirst() throws IOException, MetricAlertsException {
    CsvMetricSource source = source(csv("domain,date,spend,leads,sessions",
                                        "example.com,2026-03-01,12,3,120",
                                        "example.com,2026-03-01,99,99,999"), null);
    EntityHistory history = source.history("example.com", DAY1, DAY3, METRIC_SET);
    assertEquals(1, history.series("sessions").size());
    assertEquals(120.0, history.series("sessions").valueOn(DAY3), 0.0);
  }

  @Test
  public void testUnknownEntityHasEmptyHistory() throws IOException, MetricAlertsException {
    CsvMetricSource source = source(csv("domain,date,spend,leads,sessions",
                                        "example.com,2026-03-01,12,3,120"), null);
    EntityHistory history = source.history("unknown.example.com", DAY1, DAY3, METRIC_SET);
    assertTrue(history.isEmpty());
    assertNull(history.lastDate());
  }

  @Test
  public void testCustomColumns() throws IOException, MetricAlertsException {
    Map<String, Object> overrides = new HashMap<>();
    overrides.put(CsvMetricSourceConfig.METRIC_SOURCE_CSV_ENTITY_COLUMN_CONFIG, "dominio");
    overrides.put(CsvMetricSourceConfig.METRIC_SOURCE_CSV_DATE_COLUMN_CONFIG, "fecha");
    CsvMetricSource source = source(csv("fecha,dominio,spend,leads,sessions",
                                        "2026-03-01,example.com,12,3,120"), overrides);
    assertEquals(Arrays.asList("example.com"), source.entities());
  }

  @Test(expected = MetricAlertsException.class)
  public void testMissingEntityColumn() throws IOException, MetricAlertsException {
    source(csv("site,date,spend,leads,sessions", "example.com,2026-03-01,12,3,120"), null).entities();
  }

  @Test(expected = MetricAlertsException.class)
  public void testMissingMetricColumn() throws IOException, MetricAlertsException {
    source(csv("domain,date,spend,sessions", "example.com,2026-03-01,12,120"), null).entities();
  }

  @Test(expected = MetricAlertsException.class)
  public void testInvalidDate() throws IOException, MetricAlertsException {
    source(csv("domain,date,spend,leads,sessions", "example.com,01/03/2026,12,3,120"), null).entities();
  }

  @Test(expected = MetricAlertsException.class)
  public void testEmptyFile() throws IOException, MetricAlertsException {
    source(csv(), null).entities();
  }

  private File csv(String... lines) throws IOException {
    File file = _folder.newFile();
    Files.write(file.toPath(), Arrays.asList(lines), StandardCharsets.UTF_8);
    return file;
  }

  private static CsvMetricSource source(File file, Map<String, Object> overrides) {
    Map<String, Object> configs = new HashMap<>();
    configs.put(CsvMetricSourceConfig.METRIC_SOURCE_CSV_FILE_CONFIG, file.getAbsolutePath());
    configs.put(AnomalyDetectorConfig.METRIC_SET_CONFIG, String.join(",", METRIC_SET));
    if (overrides != null) {
      configs.putAll(overrides);
    }
    CsvMetricSource source = new CsvMetricSource();
    source.configure(configs);
    return source;
  }
}
