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
package com.github.resourcetrack.tracked;

import com.github.resourcetrack.SharedCounter;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;


/**
 * Fixed handle for a resource that is only counted by its existence. Creating a {@code Count} adds one to its
 * category and {@link #close()} takes that one back.
 * <p>
 * Compose it into the object being counted and close it from that object's own {@code close()}, or hold it in a
 * try-with-resources block:
 * <pre>
 *   try (Count ignored = connections.track()) {
 *     ...
 *   }
 * </pre>
 * A {@code Count} that is never closed keeps its category inflated, the same way a leaked resource would.
 */
public final class Count implements AutoCloseable {
  private final SharedCounter total;
  private final AtomicBoolean released = new AtomicBoolean(false);

  /**
   * Adds one to {@code total} before returning.
   * @param total the category counter this handle is counted against.
   */
  public Count(SharedCounter total) {
    this.total = Objects.requireNonNull(total, "total");
    total.incrementBy(1);
  }

  /**
   * @return {@code true} once this handle has given its count back.
   */
  public boolean isReleased() {
    return released.get();
  }

  /**
   * Takes this handle's count back from its category. Only the first call has an effect.
   */
  @Override
  public void close() {
    if (released.compareAndSet(false, true)) {
      total.incrementBy(-1);
    }
  }

  @Override
  public String toString() {
    return "Count: " + total.read();
  }
}
