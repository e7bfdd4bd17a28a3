/*
 * Copyright (C) 2026 The Lazygraph Authors.
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
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package lazygraph;

import com.google.common.base.Ascii;
import java.util.Arrays;

/** How thoroughly a dependency graph is checked for cycles before an injector is created. */
public enum CycleCheck {
  /**
   * The graph is not inspected. If it contains a cycle, resolving a member on that cycle recurses
   * until the stack overflows.
   */
  SKIP,

  /** Fails on the first cycle found, without describing it. */
  SIMPLE,

  /** Finds every cycle, grouped by strongly connected component, and reports all of them. */
  DETAILED;

  /**
   * Parses a configuration value, ignoring case.
   *
   * @throws IllegalArgumentException if {@code value} names none of the constants
   */
  static CycleCheck fromOptionValue(String key, String value) {
    try {
      return valueOf(Ascii.toUpperCase(value.trim()));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          String.format(
              "Option %s may only have the values %s (case insensitive), found: %s",
              key, Arrays.toString(values()), value),
          e);
    }
  }
}
