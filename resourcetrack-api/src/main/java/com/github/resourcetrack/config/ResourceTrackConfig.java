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

package com.github.resourcetrack.config;

/**
 * The configs for exporting resource counts to metrics and logs.
 */
public class ResourceTrackConfig {
  public static final String REPORT_PERIOD_IN_SECS = "resourcetrack.report.period.in.secs";
  public static final String REPORT_STOP_WAIT_TIMEOUT_IN_SECS = "resourcetrack.report.stop.wait.timeout.secs";
  public static final String REPORT_SORTED = "resourcetrack.report.sorted";
  public static final String METRICS_NAME_PREFIX = "resourcetrack.metrics.name.prefix";

  /**
   * How often, in seconds, the count reporter logs a snapshot of every category. Set it to 0 to disable periodic
   * reporting.
   */
  @Config(REPORT_PERIOD_IN_SECS)
  @Default("0")
  public final long reportPeriodInSecs;

  /**
   * How long, in seconds, stopping the reporter waits for an in-flight report before forcing its scheduler down.
   */
  @Config(REPORT_STOP_WAIT_TIMEOUT_IN_SECS)
  @Default("5")
  public final long reportStopWaitTimeoutInSecs;

  /**
   * True to order reported categories. Without a caller supplied comparator, categories are ordered by their string
   * form.
   */
  @Config(REPORT_SORTED)
  @Default("true")
  public final boolean reportSorted;

  /**
   * The prefix of every gauge name registered for a category.
   */
  @Config(METRICS_NAME_PREFIX)
  @Default("resourcetrack")
  public final String metricsNamePrefix;

  public ResourceTrackConfig(VerifiableProperties verifiableProperties) {
    reportPeriodInSecs = verifiableProperties.getLongInRange(REPORT_PERIOD_IN_SECS, 0, 0, Long.MAX_VALUE);
    reportStopWaitTimeoutInSecs =
        verifiableProperties.getLongInRange(REPORT_STOP_WAIT_TIMEOUT_IN_SECS, 5, 1, Long.MAX_VALUE);
    reportSorted = verifiableProperties.getBoolean(REPORT_SORTED, true);
    metricsNamePrefix = verifiableProperties.getString(METRICS_NAME_PREFIX, "resourcetrack").trim();
    if (metricsNamePrefix.isEmpty()) {
      throw new IllegalStateException("Bad configuration, " + METRICS_NAME_PREFIX + " must not be blank");
    }
  }
}
