/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.marketing.metricalerts.source;

import com.linkedin.metricalerts.common.config.AbstractConfig;
import com.linkedin.metricalerts.common.config.ConfigDef;
import java.util.Map;


public class CsvMetricSourceConfig extends AbstractConfig {
  /**
   * <code>metric.source.csv.file</code>
   */
  public static final String METRIC_SOURCE_CSV_FILE_CONFIG = "metric.source.csv.file";
  public static final String METRIC_SOURCE_CSV_FILE_DOC = "The CSV file with one row per entity and day. The first "
      + "row is the header naming the entity column, the date column and one column per metric.";

  /**
   * <code>metric.source.csv.entity.column</code>
   */
  public static final String METRIC_SOURCE_CSV_ENTITY_COLUMN_CONFIG = "metric.source.csv.entity.column";
  public static final String DEFAULT_METRIC_SOURCE_CSV_ENTITY_COLUMN = "domain";
  public static final String METRIC_SOURCE_CSV_ENTITY_COLUMN_DOC = "The header of the column that holds the entity.";

  /**
   * <code>metric.source.csv.date.column</code>
   */
  public static final String METRIC_SOURCE_CSV_DATE_COLUMN_CONFIG = "metric.source.csv.date.column";
  public static final String DEFAULT_METRIC_SOURCE_CSV_DATE_COLUMN = "date";
  public static final String METRIC_SOURCE_CSV_DATE_COLUMN_DOC = "The header of the column that holds the ISO-8601 "
      + "date of the row.";

  private static final ConfigDef CONFIG =
      new ConfigDef().define(METRIC_SOURCE_CSV_FILE_CONFIG,
                             ConfigDef.Type.STRING,
                             ConfigDef.Importance.HIGH,
                             METRIC_SOURCE_CSV_FILE_DOC)
                     .define(METRIC_SOURCE_CSV_ENTITY_COLUMN_CONFIG,
                             ConfigDef.Type.STRING,
                             DEFAULT_METRIC_SOURCE_CSV_ENTITY_COLUMN,
                             ConfigDef.Importance.MEDIUM,
                             METRIC_SOURCE_CSV_ENTITY_COLUMN_DOC)
                     .define(METRIC_SOURCE_CSV_DATE_COLUMN_CONFIG,
                             ConfigDef.Type.STRING,
                             DEFAULT_METRIC_SOURCE_CSV_DATE_COLUMN,
                             ConfigDef.Importance.MEDIUM,
                             METRIC_SOURCE_CSV_DATE_COLUMN_DOC);

  CsvMetricSourceConfig(Map<?, ?> originals) {
    super(CONFIG, originals, false);
  }
}
