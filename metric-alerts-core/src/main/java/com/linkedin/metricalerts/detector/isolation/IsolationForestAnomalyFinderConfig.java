/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricalerts.detector.isolation;

import com.linkedin.metricalerts.common.config.AbstractConfig;
import com.linkedin.metricalerts.common.config.ConfigDef;
import java.util.Map;

import static com.linkedin.metricalerts.common.config.ConfigDef.Range.aboveAndAtMost;
import static com.linkedin.metricalerts.common.config.ConfigDef.Range.atLeast;


public class IsolationForestAnomalyFinderConfig extends AbstractConfig {
  /**
   * <code>contamination</code>
   */
  public static final String CONTAMINATION_CONFIG = "contamination";
  public static final double DEFAULT_CONTAMINATION = 0.01;
  public static final String CONTAMINATION_DOC = "The expected share of outliers among the daily observations of an "
      + "entity. The multivariate detector flags the target date if its anomaly score is above the (1 - contamination) "
      + "quantile of the scores of all observations in the history window.";

  /**
   * <code>isolation.forest.num.trees</code>
   */
  public static final String ISOLATION_FOREST_NUM_TREES_CONFIG = "isolation.forest.num.trees";
  public static final int DEFAULT_ISOLATION_FOREST_NUM_TREES = 100;
  public static final String ISOLATION_FOREST_NUM_TREES_DOC = "The number of isolation trees in the ensemble.";

  /**
   * <code>isolation.forest.max.samples</code>
   */
  public static final String ISOLATION_FOREST_MAX_SAMPLES_CONFIG = "isolation.forest.max.samples";
  public static final int DEFAULT_ISOLATION_FOREST_MAX_SAMPLES = 256;
  public static final String ISOLATION_FOREST_MAX_SAMPLES_DOC = "The maximum number of observations each isolation "
      + "tree is built on. Trees use all observations if the history window has fewer.";

  /**
   * <code>isolation.forest.min.observations</code>
   */
  public static final String ISOLATION_FOREST_MIN_OBSERVATIONS_CONFIG = "isolation.forest.min.observations";
  public static final int DEFAULT_ISOLATION_FOREST_MIN_OBSERVATIONS = 20;
  public static final String ISOLATION_FOREST_MIN_OBSERVATIONS_DOC = "The minimum number of aligned daily "
      + "observations an entity needs for the multivariate detector to evaluate it.";

  /**
   * <code>isolation.forest.random.seed</code>
   */
  public static final String ISOLATION_FOREST_RANDOM_SEED_CONFIG = "isolation.forest.random.seed";
  public static final long DEFAULT_ISOLATION_FOREST_RANDOM_SEED = 42L;
  public static final String ISOLATION_FOREST_RANDOM_SEED_DOC = "The seed of the random source the ensemble is built "
      + "with. The same history and seed always produce the same scores.";

  private static final ConfigDef CONFIG =
      new ConfigDef().define(CONTAMINATION_CONFIG,
                             ConfigDef.Type.DOUBLE,
                             DEFAULT_CONTAMINATION,
                             aboveAndAtMost(0.0, 0.5),
                             ConfigDef.Importance.HIGH,
                             CONTAMINATION_DOC)
                     .define(ISOLATION_FOREST_NUM_TREES_CONFIG,
                             ConfigDef.Type.INT,
                             DEFAULT_ISOLATION_FOREST_NUM_TREES,
                             atLeast(1),
                             ConfigDef.Importance.MEDIUM,
                             ISOLATION_FOREST_NUM_TREES_DOC)
                     .define(ISOLATION_FOREST_MAX_SAMPLES_CONFIG,
                             ConfigDef.Type.INT,
                             DEFAULT_ISOLATION_FOREST_MAX_SAMPLES,
                             atLeast(2),
                             ConfigDef.Importance.LOW,
                             ISOLATION_FOREST_MAX_SAMPLES_DOC)
                     .define(ISOLATION_FOREST_MIN_OBSERVATIONS_CONFIG,
                             ConfigDef.Type.INT,
                             DEFAULT_ISOLATION_FOREST_MIN_OBSERVATIONS,
                             atLeast(2),
                             ConfigDef.Importance.MEDIUM,
                             ISOLATION_FOREST_MIN_OBSERVATIONS_DOC)
                     .define(ISOLATION_FOREST_RANDOM_SEED_CONFIG,
                             ConfigDef.Type.LONG,
                             DEFAULT_ISOLATION_FOREST_RANDOM_SEED,
                             ConfigDef.Importance.LOW,
                             ISOLATION_FOREST_RANDOM_SEED_DOC);

  IsolationForestAnomalyFinderConfig(Map<?, ?> originals) {
    super(CONFIG, originals);
  }
}
