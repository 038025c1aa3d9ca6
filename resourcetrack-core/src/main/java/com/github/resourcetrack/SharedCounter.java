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
package com.github.resourcetrack;

import java.util.concurrent.atomic.AtomicLong;


/**
 * The atomically updated total behind one category. A single instance is shared by the category's {@link Tracker}
 * and by every handle that tracker has produced.
 * <p>
 * Overflow wraps: adding past {@link Long#MAX_VALUE} continues from {@link Long#MIN_VALUE} (and the reverse), which is
 * plain two's complement arithmetic on the underlying {@link AtomicLong}. Live category totals are expected to stay
 * far away from either end.
 */
public final class SharedCounter {
  private final AtomicLong total;

  public SharedCounter() {
    this(0);
  }

  SharedCounter(long initial) {
    total = new AtomicLong(initial);
  }

  /**
   * Atomically adds {@code delta}, which may be negative.
   * @param delta the amount to add.
   */
  public void incrementBy(long delta) {
    total.addAndGet(delta);
  }

  /**
   * @return the total at some instant between the call and its return.
   */
  public long read() {
    return total.get();
  }

  @Override
  public String toString() {
    return Long.toString(read());
  }
}
