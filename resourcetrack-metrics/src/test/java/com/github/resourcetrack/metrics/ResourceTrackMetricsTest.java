/*
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
import com.github.resourcetrack.ResourceTrack;
import com.github.resourcetrack.config.ResourceTrackConfig;
import com.github.resourcetrack.config.VerifiableProperties;
import com.github.resourcetrack.tracked.Count;
import com.github.resourcetrack.tracked.Size;
import java.util.Properties;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;


/**
 * Tests for {@link ResourceTrackMetrics}.
 */
public class ResourceTrackMetricsTest {

  private enum Resources {
    CONNECTIONS, BUFFER_BYTES, SESSIONS
  }

  private Registry<Resources> registry;
  private MetricRegistry metricRegistry;
  private ResourceTrackMetrics<Resources> metrics;

  @Before
  public void setup() {
    Properties props = new Properties();
    props.setProperty(ResourceTrackConfig.METRICS_NAME_PREFIX, "myapp");
    ResourceTrackConfig config = new ResourceTrackConfig(new VerifiableProperties(props));
    registry = ResourceTrack.newRegistry();
    metricRegistry = new MetricRegistry();
    metrics = new ResourceTrackMetrics<>(registry, metricRegistry, config);
  }

  /**
   * Categories that exist at start, and ones created later, get gauges that read live totals.
   */
  @Test
  public void testGaugesFollowCategories() {
    Count connection = registry.category(Resources.CONNECTIONS).track();
    metrics.start();
    assertEquals("myapp.CONNECTIONS", metrics.gaugeName(Resources.CONNECTIONS));
    assertEquals(1L, gaugeValue("myapp.CONNECTIONS"));
    assertEquals(1, gaugeValue("myapp." + ResourceTrackMetrics.NUM_CATEGORIES));

    Size buffer = registry.category(Resources.BUFFER_BYTES).trackSized(512);
    assertEquals(512L, gaugeValue("myapp.BUFFER_BYTES"));
    assertEquals(2, gaugeValue("myapp." + ResourceTrackMetrics.NUM_CATEGORIES));

    buffer.add(512);
    connection.close();
    assertEquals(1024L, gaugeValue("myapp.BUFFER_BYTES"));
    assertEquals(0L, gaugeValue("myapp.CONNECTIONS"));
    buffer.close();
  }

  /**
   * After stop, gauges already registered keep working but new categories are not published.
   */
  @Test
  public void testStop() {
    metrics.start();
    registry.category(Resources.CONNECTIONS);
    metrics.stop();
    metrics.stop();
    Count connection = registry.category(Resources.CONNECTIONS).track();
    registry.category(Resources.SESSIONS);
    assertEquals(1L, gaugeValue("myapp.CONNECTIONS"));
    assertFalse(metricRegistry.getGauges().containsKey("myapp.SESSIONS"));
    connection.close();

    // restarting picks up what was missed.
    metrics.start();
    assertTrue(metricRegistry.getGauges().containsKey("myapp.SESSIONS"));
  }

  /**
   * A name registered by someone else is left alone and does not fail start.
   */
  @Test
  public void testExistingGaugeIsKept() {
    metricRegistry.register("myapp.CONNECTIONS", (Gauge<Long>) () -> -1L);
    registry.category(Resources.CONNECTIONS).track();
    metrics.start();
    metrics.start();
    assertEquals(-1L, gaugeValue("myapp.CONNECTIONS"));
  }

  private Object gaugeValue(String name) {
    Gauge<?> gauge = metricRegistry.getGauges().get(name);
    assertNotNull("Gauge " + name + " is not registered", gauge);
    return gauge.getValue();
  }
}
