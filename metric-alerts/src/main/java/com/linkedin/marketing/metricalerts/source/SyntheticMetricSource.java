/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.marketing.metricalerts.source;

import com.linkedin.metricalerts.model.EntityHistory;
import com.linkedin.metricalerts.model.MetricSeries;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.PoissonDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;


/**
 * A {@link MetricSource} that generates demonstration data: weekly-seasonal Poisson sessions and leads and normally
 * distributed spend for a fixed set of entities. On the last requested date a sessions spike, a leads drop and a spend
 * surge are injected into three of the entities; {@link #STEADY_ENTITY} stays unremarkable.
 *
 * The value of an entity on a date only depends on the seed, the entity and the date, so that overlapping windows
 * agree with each other.
 */
public class SyntheticMetricSource implements MetricSource {
  public static final String SESSIONS = "sessions";
  public static final String LEADS = "leads";
  public static final String SPEND = "spend";
  public static final String SESSIONS_SPIKE_ENTITY = "sessions-spike.example.com";
  public static final String LEADS_DROP_ENTITY = "leads-drop.example.com";
  public static final String SPEND_SURGE_ENTITY = "spend-surge.example.com";
  public static final String STEADY_ENTITY = "steady.example.com";
  public static final double INJECTED_SESSIONS = 5000.0;
  public static final double INJECTED_LEADS = 5.0;
  public static final double INJECTED_SPEND = 3000.0;
  private static final List<String> ENTITIES =
      Collections.unmodifiableList(Arrays.asList(SESSIONS_SPIKE_ENTITY, LEADS_DROP_ENTITY, SPEND_SURGE_ENTITY,
                                                 STEADY_ENTITY));
  private static final long DATE_SEED_MULTIPLIER = 0x9E3779B97F4A7C15L;
  private long _seed;

  public SyntheticMetricSource() {
    _seed = SyntheticMetricSourceConfig.DEFAULT_METRIC_SOURCE_SYNTHETIC_SEED;
  }

  @Override
  public void configure(Map<String, ?> configs) {
    SyntheticMetricSourceConfig config = new SyntheticMetricSourceConfig(configs);
    _seed = config.getLong(SyntheticMetricSourceConfig.METRIC_SOURCE_SYNTHETIC_SEED_CONFIG);
  }

  @Override
  public List<String> entities() {
    return ENTITIES;
  }

  @Override
  public EntityHistory history(String entity, LocalDate startDate, LocalDate endDate, List<String> metrics) {
    Map<String, Map<LocalDate, Double>> observations = new LinkedHashMap<>();
    for (String metric : metrics) {
      observations.put(metric, new TreeMap<>());
    }
    if (ENTITIES.contains(entity)) {
      for (LocalDate date = startDate; !date.isAfter(endDate); date = date.plusDays(1)) {
        RandomGenerator rng = new Well19937c(_seed ^ entity.hashCode() ^ (date.toEpochDay() * DATE_SEED_MULTIPLIER));
        double weekly = Math.sin(2 * Math.PI * (date.getDayOfWeek().getValue() % 7) / 7.0);
        boolean injected = date.equals(endDate);
        put(observations, SESSIONS, date, injected && SESSIONS_SPIKE_ENTITY.equals(entity)
                                          ? INJECTED_SESSIONS
                                          : poisson(rng, 1000) + weekly * 200);
        put(observations, LEADS, date, injected && LEADS_DROP_ENTITY.equals(entity)
                                       ? INJECTED_LEADS
                                       : poisson(rng, 50) + weekly * 10);
        put(observations, SPEND, date, injected && SPEND_SURGE_ENTITY.equals(entity)
                                       ? INJECTED_SPEND
                                       : new NormalDistribution(rng, 800, 100).sample());
      }
    }
    Map<String, MetricSeries> seriesByMetric = new LinkedHashMap<>();
    observations.forEach((metric, byDate) -> seriesByMetric.put(metric, MetricSeries.of(metric, byDate)));
    return new EntityHistory(entity, seriesByMetric);
  }

  private static double poisson(RandomGenerator rng, double mean) {
    return new PoissonDistribution(rng, mean, PoissonDistribution.DEFAULT_EPSILON,
                                   PoissonDistribution.DEFAULT_MAX_ITERATIONS).sample();
  }

  private static void put(Map<String, Map<LocalDate, Double>> observations, String metric, LocalDate date,
                          double value) {
    Map<LocalDate, Double> byDate = observations.get(metric);
    if (byDate != null) {
      byDate.put(date, value);
    }
  }
}
