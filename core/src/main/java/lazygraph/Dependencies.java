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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * The resolved dependencies handed to a {@link MemberProvider}, keyed by dependency name.
 *
 * <p>Only the member's declared dependencies are available. Asking for any other name is an error
 * rather than a silent null, so a provider that reads an undeclared member fails loudly.
 */
public final class Dependencies {
  private final String member;
  private final ImmutableMap<String, Object> values;

  private Dependencies(String member, ImmutableMap<String, Object> values) {
    this.member = member;
    this.values = values;
  }

  /** Returns the dependencies of {@code member}, already resolved to {@code values}. */
  public static Dependencies of(String member, ImmutableMap<String, Object> values) {
    return new Dependencies(checkNotNull(member, "member"), checkNotNull(values, "values"));
  }

  /** The member these dependencies were resolved for. */
  public String member() {
    return member;
  }

  /** The declared dependency names, in declaration order. */
  public ImmutableSet<String> names() {
    return values.keySet();
  }

  /**
   * Returns the value of the dependency {@code name}.
   *
   * @throws IllegalArgumentException if {@code name} is not a declared dependency of this member
   */
  public Object get(String name) {
    Object value = values.get(name);
    if (value == null) {
      throw new IllegalArgumentException(
          String.format("%s is not a declared dependency of %s; declared: %s",
              name, member, values.keySet()));
    }
    return value;
  }

  /**
   * Returns the value of the dependency {@code name} as a {@code type}.
   *
   * @throws IllegalArgumentException if {@code name} is not a declared dependency of this member
   * @throws ClassCastException if the value is not a {@code type}
   */
  public <T> T get(String name, Class<T> type) {
    return type.cast(get(name));
  }

  /** Returns the resolved values as a map, in declaration order. */
  public ImmutableMap<String, Object> asMap() {
    return values;
  }

  @Override
  public String toString() {
    return member + " <- " + values;
  }
}
