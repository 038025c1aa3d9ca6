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

import com.github.resourcetrack.utils.Pair;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.stream.Collector;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Maps categories to their {@link Tracker}s and reads back every category's total.
 * <p>
 * Categories are created lazily: the first {@link #category(Object)} call for an identifier creates its counter at
 * zero, and a new registry reads back no categories at all. Categories are never removed. Identifiers are compared
 * with {@code equals}/{@code hashCode}; enums are the natural choice, and {@code String} constants work too.
 * <p>
 * Looking a category up goes through a concurrent map, which is fine occasionally but is not the fast path. Cache
 * the returned {@link Tracker}; tracking through it never touches the registry.
 * @param <Id> the category identifier type.
 */
public class Registry<Id> {
  private static final Logger logger = LoggerFactory.getLogger(Registry.class);

  private final ConcurrentMap<Id, Tracker<Id>> categories = new ConcurrentHashMap<>();
  private final Set<RegistryListener<Id>> listeners = new CopyOnWriteArraySet<>();

  /**
   * Returns the tracker for {@code category}, creating the category on first use. Equal identifiers always get the
   * same tracker, backed by the same counter.
   * @param category the category identifier.
   * @return the category's tracker.
   */
  public Tracker<Id> category(Id category) {
    Objects.requireNonNull(category, "category");
    Tracker<Id> tracker = categories.get(category);
    if (tracker != null) {
      return tracker;
    }
    Tracker<Id> created = new Tracker<>(category, new SharedCounter());
    tracker = categories.putIfAbsent(category, created);
    if (tracker != null) {
      return tracker;
    }
    logger.debug("Created resource category {}", category);
    for (RegistryListener<Id> listener : listeners) {
      listener.onCategory(category, created);
    }
    return created;
  }

  /**
   * Reads every category's current total. Each value is read atomically, but categories are read one after the
   * other, so the snapshot as a whole may mix instants when handles are changing concurrently.
   * @return one entry per category ever requested, in no particular order.
   */
  public List<Pair<Id, Long>> readCounts() {
    return readCounts(Collectors.toList());
  }

  /**
   * Reads every category's current total into a collection of the caller's choice.
   * @param collector how to collect the {@code (category, total)} pairs.
   * @param <R> the collected result type.
   * @return the collected snapshot.
   */
  public <R> R readCounts(Collector<? super Pair<Id, Long>, ?, R> collector) {
    return categories.values()
        .stream()
        .map(tracker -> new Pair<>(tracker.category(), tracker.total()))
        .collect(collector);
  }

  /**
   * @return every category's current total, keyed by category.
   */
  public Map<Id, Long> readCountsAsMap() {
    Map<Id, Long> counts = new HashMap<>();
    categories.forEach((category, tracker) -> counts.put(category, tracker.total()));
    return counts;
  }

  /**
   * @return the number of categories created so far.
   */
  public int size() {
    return categories.size();
  }

  /**
   * Registers {@code listener} for categories created from now on. Categories that already exist are not replayed.
   * @param listener the listener to add.
   */
  public void listen(RegistryListener<Id> listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  /**
   * @param listener the listener to remove.
   */
  public void unlisten(RegistryListener<Id> listener) {
    listeners.remove(listener);
  }

  @Override
  public String toString() {
    return "Registry{categories=" + readCountsAsMap() + "}";
  }
}
