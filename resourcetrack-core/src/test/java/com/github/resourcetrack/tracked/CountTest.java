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
package com.github.resourcetrack.tracked;

import com.github.resourcetrack.SharedCounter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import org.junit.Test;

import static org.junit.Assert.*;


/**
 * Tests for {@link Count}.
 */
public class CountTest {

  @Test
  public void testCountAndRelease() {
    SharedCounter counter = new SharedCounter();
    Count first = new Count(counter);
    assertEquals("Creating a count should add one", 1, counter.read());
    assertFalse(first.isReleased());
    try (Count second = new Count(counter)) {
      assertEquals(2, counter.read());
      assertEquals("Count: 2", second.toString());
    }
    assertEquals("Closing should take the count back", 1, counter.read());
    first.close();
    assertTrue(first.isReleased());
    assertEquals(0, counter.read());
  }

  /**
   * A count is given back exactly once, however often it is closed.
   */
  @Test
  public void testReleaseIsExactlyOnce() {
    SharedCounter counter = new SharedCounter();
    Count other = new Count(counter);
    Count count = new Count(counter);
    count.close();
    count.close();
    count.close();
    assertEquals("Repeated close must not decrement again", 1, counter.read());
    other.close();
    assertEquals(0, counter.read());
  }

  /**
   * Racing closes on one count from many threads still release it once.
   */
  @Test
  public void testConcurrentCloseIsExactlyOnce() throws Exception {
    SharedCounter counter = new SharedCounter();
    Count keep = new Count(counter);
    Count count = new Count(counter);
    CountDownLatch start = new CountDownLatch(1);
    List<Thread> threads = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      Thread thread = new Thread(() -> {
        try {
          start.await();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return;
        }
        count.close();
      });
      thread.start();
      threads.add(thread);
    }
    start.countDown();
    for (Thread thread : threads) {
      thread.join();
    }
    assertEquals(1, counter.read());
    assertTrue(count.isReleased());
    assertFalse(keep.isReleased());
  }

  @Test(expected = NullPointerException.class)
  public void testNullCounter() {
    new Count(null);
  }
}
