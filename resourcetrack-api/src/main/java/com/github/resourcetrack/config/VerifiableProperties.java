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

import java.util.Enumeration;
import java.util.HashSet;
import java.util.Properties;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Verifiable properties for configs. Every property that a config class reads is remembered so that
 * {@link #verify()} can report the ones nobody asked for.
 */
public class VerifiableProperties {

  private static final Logger logger = LoggerFactory.getLogger(VerifiableProperties.class);
  private final Set<String> referenceSet = new HashSet<>();
  private final Properties props;

  public VerifiableProperties(Properties props) {
    this.props = props;
  }

  public boolean containsKey(String name) {
    return props.containsKey(name);
  }

  public String getProperty(String name) {
    String value = props.getProperty(name);
    referenceSet.add(name);
    return value;
  }

  /**
   * Read a long from the properties instance. Throw an exception
   * if the value is not in the given range (inclusive)
   * @param name The property name
   * @param defaultVal The default value to use if the property is not found
   * @param start The start of the range in which the value must fall (inclusive)
   * @param end The end of the range in which the value must fall
   * @throws IllegalArgumentException If the value is not in the given range
   * @throws NumberFormatException If the value is not a long
   * @return the long value
   */
  public long getLongInRange(String name, long defaultVal, long start, long end) {
    long v = containsKey(name) ? Long.parseLong(getProperty(name).trim()) : defaultVal;
    if (v >= start && v <= end) {
      return v;
    } else {
      throw new IllegalArgumentException(
          name + " has value " + v + " which is not in the range " + start + "-" + end + ".");
    }
  }

  /**
   * Read a boolean value from the properties instance
   * @param name The property name
   * @param defaultVal The default value to use if the property is not found
   * @return the boolean value
   */
  public boolean getBoolean(String name, boolean defaultVal) {
    if (!containsKey(name)) {
      return defaultVal;
    }
    String v = getProperty(name).trim();
    if (v.equals("true") || v.equals("false")) {
      return Boolean.parseBoolean(v);
    } else {
      throw new IllegalArgumentException(name + " has value " + v + " which is not true or false.");
    }
  }

  /**
   * Get a string property, or, if no such property is defined, return the given default value
   */
  public String getString(String name, String defaultVal) {
    return containsKey(name) ? getProperty(name) : defaultVal;
  }

  /**
   * Logs every supplied property, warning about the ones no config read.
   */
  public void verify() {
    logger.info("Verifying properties");
    Enumeration<?> keys = props.propertyNames();
    while (keys.hasMoreElements()) {
      Object key = keys.nextElement();
      if (!referenceSet.contains(key)) {
        logger.warn("Property {} is not valid", key);
      } else {
        logger.info("Property {} is overridden to {}", key, props.getProperty(key.toString()));
      }
    }
  }

  @Override
  public String toString() {
    return props.toString();
  }
}
