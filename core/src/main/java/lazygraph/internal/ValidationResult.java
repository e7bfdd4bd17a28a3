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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSetMultimap;
import java.util.Optional;
import lazygraph.CycleCheck;
import lazygraph.CyclicDependencyException;
import lazygraph.UndefinedDependencyException;

/** The outcome of checking a dependency graph with {@link GraphValidator}. */
@AutoValue
public abstract class ValidationResult {
  ValidationResult() {}

  /** The check that produced this result. */
  public abstract CycleCheck cycleCheck();

  /** True if a cycle was found. Always false for {@link CycleCheck#SKIP}. */
  public abstract boolean hasCycle();

  /**
   * Every cycle in the graph, in the order described by {@link Cycles#normalize}. Only present for
   * {@link CycleCheck#DETAILED}.
   */
  public abstract Optional<ImmutableList<ImmutableList<String>>> cycles();

  /** Members mapped to the names they depend on that are not members, sorted. */
  public abstract ImmutableSetMultimap<String, String> undefinedDependencies();

  /**
   * Throws if the graph is not usable by an injector. Cycles are reported ahead of undefined
   * dependencies.
   *
   * @throws CyclicDependencyException if a cycle was found
   * @throws UndefinedDependencyException if a dependency names no member
   */
  public void checkValid() {
    if (hasCycle()) {
      if (cycles().isPresent()) {
        throw new CyclicDependencyException(
            CyclicDependencyException.STANDARD_MESSAGE, cycles().get());
      }
      throw new CyclicDependencyException(CyclicDependencyException.STANDARD_MESSAGE);
    }
    if (!undefinedDependencies().isEmpty()) {
      throw new UndefinedDependencyException(undefinedDependencies());
    }
  }

  static ValidationResult skipped() {
    return new AutoValue_ValidationResult(
        CycleCheck.SKIP, false, Optional.empty(), ImmutableSetMultimap.of());
  }

  static ValidationResult simple(
      boolean hasCycle, ImmutableSetMultimap<String, String> undefinedDependencies) {
    return new AutoValue_ValidationResult(
        CycleCheck.SIMPLE, hasCycle, Optional.empty(), undefinedDependencies);
  }

  static ValidationResult detailed(
      ImmutableList<ImmutableList<String>> cycles,
      ImmutableSetMultimap<String, String> undefinedDependencies) {
    return new AutoValue_ValidationResult(
        CycleCheck.DETAILED, !cycles.isEmpty(), Optional.of(cycles), undefinedDependencies);
  }
}
