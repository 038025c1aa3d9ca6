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

/**
 * Entry point for counting live resources by category.
 * <pre>
 *   enum Resources { CONNECTIONS, BUFFER_BYTES }
 *
 *   static final Registry&lt;Resources&gt; REGISTRY = ResourceTrack.newRegistry();
 *   static final Tracker&lt;Resources&gt; CONNECTIONS = REGISTRY.category(Resources.CONNECTIONS);
 *   static final Tracker&lt;Resources&gt; BUFFER_BYTES = REGISTRY.category(Resources.BUFFER_BYTES);
 *
 *   class PooledConnection implements Closeable {
 *     private final Count count = CONNECTIONS.track();
 *     private final Size bufferBytes = BUFFER_BYTES.trackSized(0);
 *
 *     void grow(int bytes) {
 *       bufferBytes.add(bytes);
 *     }
 *
 *     public void close() {
 *       bufferBytes.close();
 *       count.close();
 *     }
 *   }
 * </pre>
 * {@link Registry#readCounts()} then reports the live totals for logging or metrics.
 */
public final class ResourceTrack {

  private ResourceTrack() {
  }

  /**
   * @param <Id> the category identifier type. It needs consistent {@code equals} and {@code hashCode}.
   * @return a new, empty registry.
   */
  public static <Id> Registry<Id> newRegistry() {
    return new Registry<>();
  }
}
