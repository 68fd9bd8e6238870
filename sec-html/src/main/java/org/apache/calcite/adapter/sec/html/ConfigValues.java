/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.sec.html;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Lenient readers for values in configuration maps loaded from YAML or JSON.
 *
 * <p>Numbers may arrive as any {@link Number} or as strings; a value of the
 * wrong shape falls back to the default rather than failing.
 */
public final class ConfigValues {

  private ConfigValues() {
  }

  public static boolean booleanValue(@Nullable Map<String, Object> map, String key,
      boolean defaultValue) {
    Object value = map == null ? null : map.get(key);
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    if (value instanceof String) {
      return Boolean.parseBoolean(((String) value).trim());
    }
    return defaultValue;
  }

  public static int intValue(@Nullable Map<String, Object> map, String key, int defaultValue) {
    Object value = map == null ? null : map.get(key);
    if (value instanceof Number) {
      return ((Number) value).intValue();
    }
    if (value instanceof String) {
      try {
        return Integer.parseInt(((String) value).trim());
      } catch (NumberFormatException e) {
        return defaultValue;
      }
    }
    return defaultValue;
  }

  public static double doubleValue(@Nullable Map<String, Object> map, String key,
      double defaultValue) {
    Object value = map == null ? null : map.get(key);
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof String) {
      try {
        return Double.parseDouble(((String) value).trim());
      } catch (NumberFormatException e) {
        return defaultValue;
      }
    }
    return defaultValue;
  }

  /**
   * Reads a list of strings. A single string is treated as a one-element list.
   */
  public static List<String> stringList(@Nullable Map<String, Object> map, String key,
      List<String> defaultValue) {
    Object value = map == null ? null : map.get(key);
    if (value instanceof String) {
      return ImmutableList.of((String) value);
    }
    if (value instanceof List) {
      ImmutableList.Builder<String> builder = ImmutableList.builder();
      for (Object item : (List<?>) value) {
        if (item != null) {
          builder.add(item.toString());
        }
      }
      return builder.build();
    }
    return defaultValue;
  }

  /** Returns a nested map, or null when absent or not a map. */
  @SuppressWarnings("unchecked")
  public static @Nullable Map<String, Object> section(@Nullable Map<String, Object> map,
      String key) {
    Object value = map == null ? null : map.get(key);
    return value instanceof Map ? (Map<String, Object>) value : null;
  }
}
