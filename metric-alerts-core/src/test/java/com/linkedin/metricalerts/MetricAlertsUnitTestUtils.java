/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricalerts;

import com.linkedin.metricalerts.model.EntityHistory;
import com.linkedin.metricalerts.model.MetricSeries;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;


public final class MetricAlertsUnitTestUtils {
  public static final String ENTITY = "example.com";
  public static final String SPEND = "spend";
  public static final String LEADS = "leads";
  public static final String SESSIONS = "sessions";
  public static final LocalDate TARGET_DATE = LocalDate.of(2026, 3, 1);
  public static final int PERIOD = 7;

  private MetricAlertsUnitTestUtils() {

  }

  /**
   * @param metric Metric name.
   * @param lastDate Date of the last value.
   * @param values Daily values, oldest first.
   * @return A series of consecutive days ending on the given date.
   */
  public static MetricSeries series(String metric, LocalDate lastDate, double[] values) {
    List<LocalDate> dates = new ArrayList<>(values.length);
    for (int i = 0; i < values.length; i++) {
      dates.add(lastDate.minusDays(values.length - 1 - i));
    }
    return new MetricSeries(metric, dates, values);
  }

  /**
   * A weekly pattern around the given level plus a deterministic ripple with a period of three days, which gives the
   * residuals a spread of about two without any randomness.
   *
   * @param numDays Number of days.
   * @param level Mean level.
   * @param amplitude Amplitude of the weekly pattern.
   * @return Daily values, oldest first.
   */
  public static double[] weeklyValues(int numDays, double level, double amplitude) {
    double[] values = new double[numDays];
    for (int i = 0; i < numDays; i++) {
      values[i] = level + amplitude * Math.sin(2 * Math.PI * i / PERIOD) + 2.0 * ((i % 3) - 1);
    }
    return values;
  }

  /**
   * @param numDays Number of days.
   * @param value The value of every day.
   * @return Daily values, oldest first.
   */
  public static double[] constantValues(int numDays, double value) {
    double[] values = new double[numDays];
    Arrays.fill(values, value);
    return values;
  }

  /**
   * @param entity The entity.
   * @param series Series of distinct metrics.
   * @return The history of the entity with the given series in order.
   */
  public static EntityHistory history(String entity, MetricSeries... series) {
    Map<String, MetricSeries> seriesByMetric = new LinkedHashMap<>();
    for (MetricSeries s : series) {
      seriesByMetric.put(s.metric(), s);
    }
    return new EntityHistory(entity, seriesByMetric);
  }

  /**
   * A history of spend, leads and sessions around 800, 50 and 1000 with small deterministic variation.
   *
   * @param numDays Number of days.
   * @param lastDate Date of the last day.
   * @return The history of {@link #ENTITY}.
   */
  public static EntityHistory marketingHistory(int numDays, LocalDate lastDate) {
    double[] spend = new double[numDays];
    double[] leads = new double[numDays];
    double[] sessions = new double[numDays];
    for (int i = 0; i < numDays; i++) {
      spend[i] = 800 + 10 * ((i * 7) % 11);
      leads[i] = 50 + (i * 3) % 5;
      sessions[i] = 1000 + 20 * Math.sin(2 * Math.PI * i / PERIOD) + (i * 5) % 9;
    }
    return history(ENTITY, series(SPEND, lastDate, spend), series(LEADS, lastDate, leads),
                   series(SESSIONS, lastDate, sessions));
  }
}
