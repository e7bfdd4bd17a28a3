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

import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.Optional;
import lazygraph.internal.Cycles;

/**
 * Thrown when an {@link Injector} is created over a dependency graph that contains a cycle.
 *
 * <p>Under {@link CycleCheck#DETAILED} the exception lists every cycle. Each cycle is the sorted
 * list of its members, and cycles are ordered by size and then by their comma-joined members.
 */
public final class CyclicDependencyException extends IllegalStateException {
  public static final String STANDARD_MESSAGE = "At least one cycle found in provided dependencies";

  private final ImmutableList<ImmutableList<String>> cycles;

  /** Creates an exception that only reports that some cycle exists. */
  public CyclicDependencyException(String message) {
    super(message);
    this.cycles = null;
  }

  /** Creates an exception describing {@code cycles}, which are normalized before being stored. */
  public CyclicDependencyException(
      String message, Collection<? extends Collection<String>> cycles) {
    super(message);
    this.cycles = Cycles.normalize(cycles);
  }

  /** The cycles found, or empty if the graph was only checked for the presence of a cycle. */
  public Optional<ImmutableList<ImmutableList<String>>> cycles() {
    return Optional.ofNullable(cycles);
  }

  @Override
  public String toString() {
    if (cycles == null) {
      return super.toString();
    }
    StringBuilder builder = new StringBuilder(super.toString()).append("\nCycles: [");
    for (ImmutableList<String> cycle : cycles) {
      builder.append("\n    ").append(Cycles.render(cycle));
    }
    return builder.append("\n]").toString();
  }
}
