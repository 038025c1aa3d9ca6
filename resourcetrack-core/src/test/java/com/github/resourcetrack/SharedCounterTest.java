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
package com.github.resourcetrack;

import java.util.concurrent.CountDownLatch;
import org.junit.Test;

import static org.junit.Assert.*;


/**
 * Tests for {@link SharedCounter}.
 */
public class SharedCounterTest {

  @Test
  public void testIncrementAndRead() {
    SharedCounter counter = new SharedCounter();
    assertEquals(0, counter.read());
    counter.incrementBy(5);
    counter.incrementBy(-7);
    assertEquals(-2, counter.read());
    assertEquals("-2", counter.toString());
  }

  /**
   * Overflow wraps in both directions.
   */
  @Test
  public void testOverflowWraps() {
    SharedCounter high = new SharedCounter(Long.MAX_VALUE);
    high.incrementBy(1);
    assertEquals(Long.MIN_VALUE, high.read());
    high.incrementBy(-1);
    assertEquals("Wrapping back should restore the value", Long.MAX_VALUE, high.read());

    SharedCounter low = new SharedCounter(Long.MIN_VALUE);
    low.incrementBy(-2);
    assertEquals(Long.MAX_VALUE - 1, low.read());
  }

  /**
   * Concurrent increments and decrements from many threads are never lost.
   */
  @Test
  public void testConcurrentIncrements() throws Exception {
    final int numThreads = 8;
    final int perThread = 10_000;
    SharedCounter counter = new SharedCounter();
    CountDownLatch start = new CountDownLatch(1);
    Thread[] threads = new Thread[numThreads];
    for (int i = 0; i < numThreads; i++) {
      final long delta = i % 2 == 0 ? 3 : -1;
      threads[i] = new Thread(() -> {
        try {
          start.await();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return;
        }
        for (int j = 0; j < perThread; j++) {
          counter.incrementBy(delta);
        }
      });
      threads[i].start();
    }
    start.countDown();
    for (Thread thread : threads) {
      thread.join();
    }
    assertEquals((numThreads / 2) * perThread * 3L - (numThreads / 2) * perThread, counter.read());
  }
}
