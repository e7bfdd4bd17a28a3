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

package lazygraph.internal;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/** Normal form and rendering of reported cycles. */
public final class Cycles {
  private static final Joiner COMMA = Joiner.on(',');

  /** Shorter cycles first, then by the comma-joined member names. */
  static final Comparator<List<String>> ORDER =
      Comparator.<List<String>>comparingInt(List::size).thenComparing(cycle -> COMMA.join(cycle));

  /**
   * Sorts the members of each cycle, then sorts the cycles by {@link #ORDER}. The result does not
   * depend on the order in which cycles or their members were discovered.
   */
  public static ImmutableList<ImmutableList<String>> normalize(
      Collection<? extends Collection<String>> cycles) {
    return cycles.stream()
        .map(cycle -> ImmutableSortedSet.copyOf(cycle).asList())
        .sorted(ORDER)
        .collect(toImmutableList());
  }

  /** Renders a cycle as {@code [a, b, c]}. */
  public static String render(List<String> cycle) {
    return "[" + Joiner.on(", ").join(cycle) + "]";
  }

  private Cycles() {}
}
