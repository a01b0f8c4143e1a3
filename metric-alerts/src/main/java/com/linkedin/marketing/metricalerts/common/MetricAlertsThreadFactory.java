/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.marketing.metricalerts.common;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Creates daemon worker threads named {@code <prefix>-<index>} that log and count uncaught exceptions, so that a
 * worker dying never goes unnoticed in the run summary logs.
 */
public class MetricAlertsThreadFactory implements ThreadFactory {
  private static final Logger LOG = LoggerFactory.getLogger(MetricAlertsThreadFactory.class);
  private final String _prefix;
  private final AtomicInteger _nextIndex;
  private final AtomicLong _numUncaughtExceptions;
  private final Logger _logger;

  public MetricAlertsThreadFactory(String prefix) {
    this(prefix, null);
  }

  public MetricAlertsThreadFactory(String prefix, Logger logger) {
    _prefix = prefix;
    _nextIndex = new AtomicInteger(0);
    _numUncaughtExceptions = new AtomicLong(0L);
    _logger = logger == null ? LOG : logger;
  }

  @Override
  public Thread newThread(Runnable r) {
    Thread thread = new Thread(r, _prefix + "-" + _nextIndex.getAndIncrement());
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler((t, e) -> {
      _numUncaughtExceptions.incrementAndGet();
      _logger.error("Uncaught exception in {}: ", t.getName(), e);
    });
    return thread;
  }

  /**
   * @return Number of exceptions that terminated a thread of this factory.
   */
  public long numUncaughtExceptions() {
    return _numUncaughtExceptions.get();
  }
}
