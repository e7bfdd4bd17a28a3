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

import com.google.common.collect.ImmutableSetMultimap;
import java.util.Map;

/**
 * Thrown when a member declares a dependency on a name that is not itself a member.
 *
 * <p>With cycle checking enabled this is detected while the {@link Injector} is created, and every
 * undefined dependency is reported at once. With {@link CycleCheck#SKIP} the graph is not
 * inspected, so the problem only surfaces when the dependent member is first resolved.
 */
public final class UndefinedDependencyException extends IllegalStateException {
  private final ImmutableSetMultimap<String, String> undefinedDependencies;

  public UndefinedDependencyException(ImmutableSetMultimap<String, String> undefinedDependencies) {
    super(message(undefinedDependencies));
    this.undefinedDependencies = undefinedDependencies;
  }

  public UndefinedDependencyException(String member, String dependency) {
    this(ImmutableSetMultimap.of(member, dependency));
  }

  /** Maps each member to the names it depends on that are not members. */
  public ImmutableSetMultimap<String, String> undefinedDependencies() {
    return undefinedDependencies;
  }

  private static String message(ImmutableSetMultimap<String, String> undefinedDependencies) {
    if (undefinedDependencies.isEmpty()) {
      throw new IllegalArgumentException("no undefined dependencies");
    }
    StringBuilder message = new StringBuilder("Undefined dependencies:");
    for (Map.Entry<String, String> entry : undefinedDependencies.entries()) {
      message
          .append("\n  ")
          .append(entry.getValue())
          .append(" required by ")
          .append(entry.getKey());
    }
    return message.toString();
  }
}
