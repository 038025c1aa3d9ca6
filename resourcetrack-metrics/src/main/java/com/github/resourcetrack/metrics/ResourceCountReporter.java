/**
 * Copyright 2026 LinkedIn Corp. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 */
package com.github.resourcetrack.metrics;

import com.github.resourcetrack.Registry;
import com.github.resourcetrack.config.ResourceTrackConfig;
import com.github.resourcetrack.utils.Pair;
import com.github.resourcetrack.utils.Utils;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.json.JSONArray;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Logs a snapshot of every category of a {@link Registry} at a fixed period, as a JSON array of
 * {@code {"category": ..., "count": ...}} objects.
 * <p>
 *   {@link ResourceCountReporter} reporter = new ResourceCountReporter(registry, config);
 *   reporter.start();
 *   ...
 *   reporter.stop();
 * </p>
 * Reporting is off when {@link ResourceTrackConfig#reportPeriodInSecs} is 0.
 * @param <Id> the category identifier type.
 */
public class ResourceCountReporter<Id> implements AutoCloseable {
  static final String CATEGORY_KEY = "category";
  static final String COUNT_KEY = "count";

  private static final Logger logger = LoggerFactory.getLogger(ResourceCountReporter.class);
  private final Registry<Id> registry;
  private final ResourceTrackConfig config;
  private final Comparator<Pair<Id, Long>> order;
  private ScheduledExecutorService scheduler = null;

  /**
   * Reports categories ordered by their string form, when sorting is configured.
   * @param registry the registry to report.
   * @param config the reporting configs.
   */
  public ResourceCountReporter(Registry<Id> registry, ResourceTrackConfig config) {
    this(registry, config, Comparator.comparing((Id category) -> String.valueOf(category)));
  }

  /**
   * @param registry the registry to report.
   * @param config the reporting configs.
   * @param categoryOrder the order of reported categories, when sorting is configured.
   */
  public ResourceCountReporter(Registry<Id> registry, ResourceTrackConfig config,
      Comparator<? super Id> categoryOrder) {
    this.registry = Objects.requireNonNull(registry, "Registry is null");
    this.config = Objects.requireNonNull(config, "Config is null");
    Objects.requireNonNull(categoryOrder, "Category order is null");
    this.order = (first, second) -> categoryOrder.compare(first.getFirst(), second.getFirst());
  }

  /**
   * Starts periodic reporting. Does nothing if reporting is disabled or already running.
   */
  public synchronized void start() {
    if (config.reportPeriodInSecs == 0) {
      logger.info("Resource count reporting is disabled");
      return;
    }
    if (scheduler == null) {
      scheduler = Utils.newScheduler(1, "resourcetrack-reporter-", true);
      scheduler.scheduleAtFixedRate(this::report, config.reportPeriodInSecs, config.reportPeriodInSecs,
          TimeUnit.SECONDS);
      logger.info("Reporting resource counts every {} seconds", config.reportPeriodInSecs);
    }
  }

  /**
   * @return {@code true} while periodic reporting is scheduled.
   */
  public synchronized boolean isRunning() {
    return scheduler != null;
  }

  /**
   * Logs the current snapshot once.
   */
  public void report() {
    try {
      logger.info("Resource counts: {}", formatCounts());
    } catch (RuntimeException e) {
      logger.error("Failed to report resource counts", e);
    }
  }

  /**
   * @return the current snapshot as a JSON array, ordered when sorting is configured.
   */
  String formatCounts() {
    List<Pair<Id, Long>> counts = new ArrayList<>(registry.readCounts());
    if (config.reportSorted) {
      counts.sort(order);
    }
    JSONArray array = new JSONArray();
    for (Pair<Id, Long> count : counts) {
      array.put(new JSONObject().put(CATEGORY_KEY, String.valueOf(count.getFirst())).put(COUNT_KEY, count.getSecond()));
    }
    return array.toString();
  }

  /**
   * Stops periodic reporting. The reporter can be started again afterwards.
   */
  public synchronized void stop() {
    if (scheduler != null) {
      Utils.shutDownExecutorService(scheduler, config.reportStopWaitTimeoutInSecs, TimeUnit.SECONDS);
      scheduler = null;
      logger.info("Stopped reporting resource counts");
    }
  }

  @Override
  public void close() {
    stop();
  }
}
