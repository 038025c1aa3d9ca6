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

import com.github.resourcetrack.tracked.Count;
import com.github.resourcetrack.tracked.Size;


/**
 * Produces handles for one category. Trackers are cheap to hold and safe to share between threads, so look one up
 * from the {@link Registry} once and keep it. {@link #track()} and {@link #trackSized(long)} never block.
 * <p>
 * Use either {@link #track()} or {@link #trackSized(long)} for a category, not both: the category total is the plain
 * sum of whatever its handles added.
 * @param <Id> the category identifier type.
 */
public final class Tracker<Id> {
  private final Id category;
  private final SharedCounter total;

  Tracker(Id category, SharedCounter total) {
    this.category = category;
    this.total = total;
  }

  /**
   * Holds a count of one against the category until the returned {@link Count} is closed.
   * @return the new handle, already counted.
   */
  public Count track() {
    return new Count(total);
  }

  /**
   * Holds {@code initial} against the category until the returned {@link Size} is closed. The size can change in the
   * meantime, for example when a tracked buffer is resized.
   * @param initial the starting size. May be zero or negative.
   * @return the new handle, already counted.
   */
  public Size trackSized(long initial) {
    return new Size(total, initial);
  }

  /**
   * @return the category this tracker counts.
   */
  public Id category() {
    return category;
  }

  /**
   * @return the current total of the category.
   */
  public long total() {
    return total.read();
  }

  @Override
  public String toString() {
    return Long.toString(total());
  }
}
