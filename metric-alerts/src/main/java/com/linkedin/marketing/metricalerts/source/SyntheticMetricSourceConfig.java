/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.marketing.metricalerts.source;

import com.linkedin.metricalerts.common.config.AbstractConfig;
import com.linkedin.metricalerts.common.config.ConfigDef;
import java.util.Map;


public class SyntheticMetricSourceConfig extends AbstractConfig {
  /**
   * <code>metric.source.synthetic.seed</code>
   */
  public static final String METRIC_SOURCE_SYNTHETIC_SEED_CONFIG = "metric.source.synthetic.seed";
  public static final long DEFAULT_METRIC_SOURCE_SYNTHETIC_SEED = 42L;
  public static final String METRIC_SOURCE_SYNTHETIC_SEED_DOC = "The seed of the generated demonstration data. The "
      + "same seed always yields the same value for an entity, metric and date.";

  private static final ConfigDef CONFIG =
      new ConfigDef().define(METRIC_SOURCE_SYNTHETIC_SEED_CONFIG,
                             ConfigDef.Type.LONG,
                             DEFAULT_METRIC_SOURCE_SYNTHETIC_SEED,
                             ConfigDef.Importance.LOW,
                             METRIC_SOURCE_SYNTHETIC_SEED_DOC);

  SyntheticMetricSourceConfig(Map<?, ?> originals) {
    super(CONFIG, originals, false);
  }
}
