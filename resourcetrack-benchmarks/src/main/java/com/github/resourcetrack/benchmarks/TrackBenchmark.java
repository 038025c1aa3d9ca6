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
package com.github.resourcetrack.benchmarks;

import com.github.resourcetrack.Registry;
import com.github.resourcetrack.ResourceTrack;
import com.github.resourcetrack.Tracker;
import com.github.resourcetrack.tracked.Count;
import com.github.resourcetrack.tracked.Size;
import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;


/**
 * Compares tracking through a registry lookup on every call against tracking through a cached {@link Tracker}.
 * Each operation creates a handle and releases it, so the category total stays flat for the whole run.
 * Run with several threads to see contention on the shared counter.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 2, time = 2)
@Measurement(iterations = 3, time = 2)
@Fork(1)
@State(Scope.Benchmark)
public class TrackBenchmark {

  private enum Categories {
    MISCELLANEOUS
  }

  private Registry<Categories> registry;
  private Tracker<Categories> cachedTracker;

  @Setup(Level.Trial)
  public void setup() {
    registry = ResourceTrack.newRegistry();
    cachedTracker = registry.category(Categories.MISCELLANEOUS);
  }

  @Benchmark
  public long uncached() {
    try (Count count = registry.category(Categories.MISCELLANEOUS).track()) {
      return count.isReleased() ? 0 : 1;
    }
  }

  @Benchmark
  public long cachedCategory() {
    try (Count count = cachedTracker.track()) {
      return count.isReleased() ? 0 : 1;
    }
  }

  @Benchmark
  @Threads(4)
  public long cachedCategoryContended() {
    try (Count count = cachedTracker.track()) {
      return count.isReleased() ? 0 : 1;
    }
  }

  @Benchmark
  public long sized() {
    try (Size size = cachedTracker.trackSized(64)) {
      size.add(64);
      return size.net();
    }
  }
}
