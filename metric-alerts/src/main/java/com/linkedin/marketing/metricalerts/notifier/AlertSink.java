/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.marketing.metricalerts.notifier;

import com.linkedin.metricalerts.common.MetricAlertsConfigurable;
import com.linkedin.metricalerts.model.AnomalyRecord;


/**
 * Delivers alert records to the people who act on them. Invoked sequentially once all entities have been evaluated.
 */
public interface AlertSink extends MetricAlertsConfigurable {

  /**
   * Deliver a single alert. A failure to deliver one alert must not prevent the delivery of the others, hence
   * failures are reported through the result rather than thrown.
   *
   * @param record The alert to deliver.
   * @return The result of the delivery.
   */
  AlertDeliveryResult deliver(AnomalyRecord record);
}
