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

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import com.github.resourcetrack.Registry;
import com.github.resourcetrack.RegistryListener;
import com.github.resourcetrack.Tracker;
import com.github.resourcetrack.config.ResourceTrackConfig;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Publishes every category of a {@link Registry} as a {@link Gauge} in a {@link MetricRegistry}.
 * <p>
 *   {@link ResourceTrackMetrics} metrics = new ResourceTrackMetrics(registry, new MetricRegistry(), config);
 *   metrics.start();
 * </p>
 * Each category gets a gauge named {@code <prefix>.<category>} reading its live total, and {@code <prefix>.NumCategories}
 * reads how many categories exist. Categories created after {@link #start()} are picked up as they appear, until
 * {@link #stop()}.
 * @param <Id> the category identifier type.
 */
public class ResourceTrackMetrics<Id> implements RegistryListener<Id> {
  static final String NUM_CATEGORIES = "NumCategories";

  private static final Logger logger = LoggerFactory.getLogger(ResourceTrackMetrics.class);
  private final Registry<Id> registry;
  private final MetricRegistry metricRegistry;
  private final String prefix;
  private final AtomicBoolean started = new AtomicBoolean();

  /**
   * @param registry the registry whose categories are published.
   * @param metricRegistry the metric registry to publish to.
   * @param config supplies the gauge name prefix.
   */
  public ResourceTrackMetrics(Registry<Id> registry, MetricRegistry metricRegistry, ResourceTrackConfig config) {
    this.registry = Objects.requireNonNull(registry, "Registry is null");
    this.metricRegistry = Objects.requireNonNull(metricRegistry, "MetricRegistry is null");
    this.prefix = Objects.requireNonNull(config, "Config is null").metricsNamePrefix;
  }

  /**
   * Registers gauges for the existing categories and starts following new ones.
   */
  public void start() {
    if (started.compareAndSet(false, true)) {
      // Listen first so a category created while the existing ones are registered is not missed.
      registry.listen(this);
      register(MetricRegistry.name(prefix, NUM_CATEGORIES), (Gauge<Integer>) registry::size);
      for (Id category : registry.readCountsAsMap().keySet()) {
        onCategory(category, registry.category(category));
      }
      logger.info("Publishing {} resource categories under {}", registry.size(), prefix);
    }
  }

  /**
   * Stops following new categories. Gauges already registered stay in the {@link MetricRegistry} and keep reading
   * live totals.
   */
  public void stop() {
    if (started.compareAndSet(true, false)) {
      registry.unlisten(this);
      logger.info("Stopped following new resource categories under {}", prefix);
    }
  }

  @Override
  public void onCategory(Id category, Tracker<Id> tracker) {
    register(gaugeName(category), (Gauge<Long>) tracker::total);
  }

  /**
   * @param category a category identifier.
   * @return the name of the gauge that publishes {@code category}.
   */
  public String gaugeName(Id category) {
    return MetricRegistry.name(prefix, String.valueOf(category));
  }

  private void register(String name, Gauge<?> gauge) {
    if (!metricRegistry.getMetrics().containsKey(name)) {
      try {
        metricRegistry.register(name, gauge);
        logger.debug("Registered gauge {}", name);
      } catch (IllegalArgumentException e) {
        // Someone else registered the name first; keep theirs.
        logger.warn("Gauge {} is already registered: {}", name, e.toString());
      }
    }
  }
}
