/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.marketing.metricalerts.notifier;

import com.linkedin.metricalerts.model.AnomalyRecord;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * An alert sink that only writes every alert to the log. Useful for local runs and backfills.
 */
public class LoggingAlertSink implements AlertSink {
  private static final Logger LOG = LoggerFactory.getLogger(LoggingAlertSink.class);

  @Override
  public void configure(Map<String, ?> configs) {

  }

  @Override
  public AlertDeliveryResult deliver(AnomalyRecord record) {
    LOG.info("[ALERT] {} | entity: {} | metric: {} | date: {} | value: {} | method: {} | score: {}",
             record.kind().wireName(), record.entity(), record.metric(), record.date(), record.displayValue(),
             record.method().wireName(), record.score());
    return AlertDeliveryResult.delivered(AlertDeliveryResult.NO_STATUS_CODE);
  }
}
