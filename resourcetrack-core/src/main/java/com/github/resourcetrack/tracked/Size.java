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
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Mutable handle for a resource of changing size, for example a buffer whose capacity grows. The handle remembers
 * the net amount it has added to its category, and {@link #close()} removes exactly that amount.
 * <p>
 * Every mutation is applied to the category counter before the call returns. Mutations after {@link #close()} are
 * ignored, since nothing would ever take them back.
 */
public final class Size implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(Size.class);

  private final SharedCounter total;
  private final AtomicLong local;
  private final AtomicBoolean released = new AtomicBoolean(false);

  /**
   * Adds {@code initial} to {@code total} before returning.
   * @param total the category counter this handle is counted against.
   * @param initial the starting size. May be zero or negative.
   */
  public Size(SharedCounter total, long initial) {
    this.total = Objects.requireNonNull(total, "total");
    this.local = new AtomicLong(initial);
    total.incrementBy(initial);
  }

  /**
   * Changes the tracked size by {@code delta}.
   * @param delta the change, which may be negative.
   */
  public void add(long delta) {
    if (isReleased()) {
      logger.warn("Ignoring add of {} on a released Size", delta);
      return;
    }
    local.addAndGet(delta);
    total.incrementBy(delta);
  }

  /**
   * Changes the tracked size to {@code newSize}. This is {@code add(newSize - net())}.
   * @param newSize the new size of the resource.
   */
  public void set(long newSize) {
    if (isReleased()) {
      logger.warn("Ignoring set to {} on a released Size", newSize);
      return;
    }
    long previous = local.getAndSet(newSize);
    total.incrementBy(newSize - previous);
  }

  /**
   * Shrinks the tracked size by up to {@code amount}, stopping at zero. Subtracting more than the handle holds only
   * removes what it holds, and a handle whose net is already zero or negative is left alone.
   * @param amount how much to remove. Zero or negative amounts remove nothing.
   */
  public void subtract(long amount) {
    if (isReleased()) {
      logger.warn("Ignoring subtract of {} on a released Size", amount);
      return;
    }
    if (amount <= 0) {
      return;
    }
    long current;
    long removed;
    do {
      current = local.get();
      removed = Math.min(amount, Math.max(current, 0));
    } while (!local.compareAndSet(current, current - removed));
    total.incrementBy(-removed);
  }

  /**
   * @return the net amount this handle currently holds against its category, 0 once released.
   */
  public long net() {
    return local.get();
  }

  /**
   * @return {@code true} once this handle has removed its net amount.
   */
  public boolean isReleased() {
    return released.get();
  }

  /**
   * Removes this handle's whole net amount from its category. Only the first call has an effect.
   */
  @Override
  public void close() {
    if (released.compareAndSet(false, true)) {
      total.incrementBy(-local.getAndSet(0));
    }
  }

  @Override
  public String toString() {
    return "Size{total=" + total.read() + ", local=" + local.get() + "}";
  }
}
