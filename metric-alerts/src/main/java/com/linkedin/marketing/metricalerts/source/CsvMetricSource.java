/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.marketing.metricalerts.source;

import com.linkedin.marketing.metricalerts.config.constants.AnomalyDetectorConfig;
import com.linkedin.metricalerts.common.config.ConfigDef;
import com.linkedin.metricalerts.exception.MetricAlertsException;
import com.linkedin.metricalerts.model.EntityHistory;
import com.linkedin.metricalerts.model.MetricSeries;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * A {@link MetricSource} backed by a comma separated file with a header row, one row per entity and day:
 *
 * <pre>
 * domain,date,spend,leads,sessions
 * example.com,2026-03-01,812.5,48,1043
 * </pre>
 *
 * The file is read once, on first use. Empty cells are missing observations. Of several rows for the same entity and
 * date only the first is kept.
 */
public class CsvMetricSource implements MetricSource {
  private static final Logger LOG = LoggerFactory.getLogger(CsvMetricSource.class);
  private static final String SEPARATOR = ",";
  private static final char UTF8_BOM = '\uFEFF';
  private Path _file;
  private String _entityColumn;
  private String _dateColumn;
  private List<String> _requiredMetrics;
  // entity -> metric -> date -> value, entities in order of first appearance.
  private volatile Map<String, Map<String, NavigableMap<LocalDate, Double>>> _observations;

  @Override
  public void configure(Map<String, ?> configs) {
    CsvMetricSourceConfig config = new CsvMetricSourceConfig(configs);
    _file = Paths.get(config.getString(CsvMetricSourceConfig.METRIC_SOURCE_CSV_FILE_CONFIG));
    _entityColumn = config.getString(CsvMetricSourceConfig.METRIC_SOURCE_CSV_ENTITY_COLUMN_CONFIG);
    _dateColumn = config.getString(CsvMetricSourceConfig.METRIC_SOURCE_CSV_DATE_COLUMN_CONFIG);
    Object metricSet = configs.get(AnomalyDetectorConfig.METRIC_SET_CONFIG);
    @SuppressWarnings("unchecked")
    List<String> requiredMetrics = metricSet == null
                                   ? Collections.emptyList()
                                   : (List<String>) ConfigDef.parseType(AnomalyDetectorConfig.METRIC_SET_CONFIG,
                                                                        metricSet, ConfigDef.Type.LIST);
    _requiredMetrics = requiredMetrics;
  }

  @Override
  public List<String> entities() throws MetricAlertsException {
    return new ArrayList<>(observations().keySet());
  }

  @Override
  public EntityHistory history(String entity, LocalDate startDate, LocalDate endDate, List<String> metrics)
      throws MetricAlertsException {
    Map<String, NavigableMap<LocalDate, Double>> byMetric = observations().getOrDefault(entity, Collections.emptyMap());
    Map<String, MetricSeries> seriesByMetric = new LinkedHashMap<>();
    for (String metric : metrics) {
      NavigableMap<LocalDate, Double> byDate = byMetric.get(metric);
      seriesByMetric.put(metric, byDate == null
                                 ? MetricSeries.empty(metric)
                                 : MetricSeries.of(metric, byDate.subMap(startDate, true, endDate, true)));
    }
    return new EntityHistory(entity, seriesByMetric);
  }

  private Map<String, Map<String, NavigableMap<LocalDate, Double>>> observations() throws MetricAlertsException {
    Map<String, Map<String, NavigableMap<LocalDate, Double>>> observations = _observations;
    if (observations == null) {
      synchronized (this) {
        observations = _observations;
        if (observations == null) {
          observations = load();
          _observations = observations;
        }
      }
    }
    return observations;
  }

  private Map<String, Map<String, NavigableMap<LocalDate, Double>>> load() throws MetricAlertsException {
    if (_file == null) {
      throw new IllegalStateException("CSV metric source is used before it is configured.");
    }
    Map<String, Map<String, NavigableMap<LocalDate, Double>>> observations = new LinkedHashMap<>();
    try (BufferedReader reader = Files.newBufferedReader(_file, StandardCharsets.UTF_8)) {
      String headerLine = reader.readLine();
      if (headerLine == null) {
        throw new MetricAlertsException(String.format("CSV file %s is empty.", _file));
      }
      if (!headerLine.isEmpty() && headerLine.charAt(0) == UTF8_BOM) {
        headerLine = headerLine.substring(1);
      }
      List<String> header = split(headerLine);
      int entityIndex = columnIndex(header, _entityColumn);
      int dateIndex = columnIndex(header, _dateColumn);
      Map<String, Integer> metricIndices = new LinkedHashMap<>();
      for (int i = 0; i < header.size(); i++) {
        if (i != entityIndex && i != dateIndex) {
          metricIndices.put(header.get(i), i);
        }
      }
      List<String> missingMetrics = new ArrayList<>(_requiredMetrics);
      missingMetrics.removeAll(metricIndices.keySet());
      if (!missingMetrics.isEmpty()) {
        throw new MetricAlertsException(String.format("CSV file %s lacks the metric columns %s.", _file,
                                                      missingMetrics));
      }

      Map<String, Set<LocalDate>> seenDates = new HashMap<>();
      int numDuplicates = 0;
      int lineNumber = 1;
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.trim().isEmpty()) {
          continue;
        }
        List<String> cells = split(line);
        String entity = cell(cells, entityIndex);
        if (entity.isEmpty()) {
          LOG.warn("Skipping row {} of {} without an entity.", lineNumber, _file);
          continue;
        }
        LocalDate date = parseDate(cell(cells, dateIndex), lineNumber);
        if (!seenDates.computeIfAbsent(entity, e -> new HashSet<>()).add(date)) {
          numDuplicates++;
          LOG.warn("Row {} of {} repeats entity {} on {}, keeping the first row.", lineNumber, _file, entity, date);
          continue;
        }
        Map<String, NavigableMap<LocalDate, Double>> byMetric =
            observations.computeIfAbsent(entity, e -> new HashMap<>());
        for (Map.Entry<String, Integer> metric : metricIndices.entrySet()) {
          Double value = parseValue(cell(cells, metric.getValue()), metric.getKey(), lineNumber);
          if (value != null) {
            byMetric.computeIfAbsent(metric.getKey(), m -> new TreeMap<>()).put(date, value);
          }
        }
      }
      LOG.info("Loaded {} entities from {} rows of {} ({} duplicate rows skipped).", observations.size(),
               lineNumber - 1, _file, numDuplicates);
    } catch (IOException e) {
      throw new MetricAlertsException(String.format("Failed to read CSV file %s.", _file), e);
    }
    return Collections.unmodifiableMap(observations);
  }

  private int columnIndex(List<String> header, String column) throws MetricAlertsException {
    int index = header.indexOf(column);
    if (index < 0) {
      throw new MetricAlertsException(String.format("CSV file %s has no column %s (header: %s).", _file, column,
                                                    header));
    }
    return index;
  }

  private LocalDate parseDate(String cell, int lineNumber) throws MetricAlertsException {
    try {
      return LocalDate.parse(cell);
    } catch (DateTimeParseException e) {
      throw new MetricAlertsException(String.format("Row %d of %s has an invalid date '%s'.", lineNumber, _file, cell),
                                      e);
    }
  }

  private Double parseValue(String cell, String metric, int lineNumber) {
    if (cell.isEmpty()) {
      return null;
    }
    double value;
    try {
      value = Double.parseDouble(cell);
    } catch (NumberFormatException e) {
      value = Double.NaN;
    }
    if (!Double.isFinite(value)) {
      LOG.warn("Treating invalid value '{}' of metric {} in row {} of {} as missing.", cell, metric, lineNumber,
               _file);
      return null;
    }
    return value;
  }

  private static String cell(List<String> cells, int index) {
    return index < cells.size() ? cells.get(index) : "";
  }

  private static List<String> split(String line) {
    String[] tokens = line.split(SEPARATOR, -1);
    List<String> cells = new ArrayList<>(tokens.length);
    for (String token : tokens) {
      String cell = token.trim();
      if (cell.length() >= 2 && cell.startsWith("\"") && cell.endsWith("\"")) {
        cell = cell.substring(1, cell.length() - 1).trim();
      }
      cells.add(cell);
    }
    return cells;
  }
}
