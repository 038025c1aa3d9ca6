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
 * Callback for categories created in a {@link Registry}.
 * @param <Id> the category identifier type.
 */
public interface RegistryListener<Id> {

  /**
   * Called once for each category, on the thread that first asked for it, after the category is visible to
   * {@link Registry#readCounts()}.
   * @param category the new category.
   * @param tracker the category's tracker.
   */
  void onCategory(Id category, Tracker<Id> tracker);
}
