/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricalerts.detector.seasonal;

import com.linkedin.metricalerts.common.config.AbstractConfig;
import com.linkedin.metricalerts.common.config.ConfigDef;
import java.util.Map;

import static com.linkedin.metricalerts.common.config.ConfigDef.Range.aboveAndAtMost;
import static com.linkedin.metricalerts.common.config.ConfigDef.Range.atLeast;


public class SeasonalMadAnomalyFinderConfig extends AbstractConfig {
  /**
   * <code>mad.threshold</code>
   */
  public static final String MAD_THRESHOLD_CONFIG = "mad.threshold";
  public static final double DEFAULT_MAD_THRESHOLD = 3.2;
  public static final String MAD_THRESHOLD_DOC = "The number of scaled median absolute deviations that the residual of "
      + "a metric on the target date may deviate from the median residual before the seasonal detector reports a spike "
      + "or a drop. Larger values report fewer anomalies.";

  /**
   * <code>seasonal.period</code>
   */
  public static final String SEASONAL_PERIOD_CONFIG = "seasonal.period";
  public static final int DEFAULT_SEASONAL_PERIOD = 7;
  public static final String SEASONAL_PERIOD_DOC = "The number of daily observations in one seasonal cycle of the "
      + "additive decomposition. A series needs at least two full cycles to be evaluated.";

  private static final ConfigDef CONFIG =
      new ConfigDef().define(MAD_THRESHOLD_CONFIG,
                             ConfigDef.Type.DOUBLE,
                             DEFAULT_MAD_THRESHOLD,
                             aboveAndAtMost(0.0, 100.0),
                             ConfigDef.Importance.HIGH,
                             MAD_THRESHOLD_DOC)
                     .define(SEASONAL_PERIOD_CONFIG,
                             ConfigDef.Type.INT,
                             DEFAULT_SEASONAL_PERIOD,
                             atLeast(2),
                             ConfigDef.Importance.MEDIUM,
                             SEASONAL_PERIOD_DOC);

  SeasonalMadAnomalyFinderConfig(Map<?, ?> originals) {
    super(CONFIG, originals);
  }
}
