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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import lazygraph.Dependencies;
import lazygraph.InjectionLog;
import lazygraph.Injector;
import lazygraph.MemberProvider;
import lazygraph.UndefinedDependencyException;

/**
 * Links members to their dependencies and constructs them on demand.
 *
 * <p>Each member is resolved depth first: its dependencies are resolved in declaration order, then
 * its provider runs and the value is cached. A cached value is never replaced. All resolution
 * happens while holding this linker's lock, which is reentrant, so recursive resolution on one
 * thread proceeds and a concurrent first access waits for the construction already under way.
 *
 * <p>The linker does not look for cycles. Resolving a member that depends on itself, directly or
 * not, recurses until the stack overflows.
 */
public final class Linker {
  private static final Logger logger = Logger.getLogger(Injector.class.getName());

  /** One binding per member, in declaration order. */
  private final ImmutableMap<String, MemberBinding<?>> bindings;

  /** Constructed members. Only ever grows. */
  private final Map<String, Object> constructed = new HashMap<>();

  private final Optional<InjectionLog> log;

  public Linker(
      ImmutableMap<String, ImmutableList<String>> dependencies,
      ImmutableMap<String, MemberProvider<?>> providers,
      Optional<InjectionLog> log) {
    this.log = checkNotNull(log, "log");
    ImmutableMap.Builder<String, MemberBinding<?>> bindings = ImmutableMap.builder();
    for (Map.Entry<String, ImmutableList<String>> entry : dependencies.entrySet()) {
      MemberProvider<?> provider = providers.get(entry.getKey());
      checkArgument(provider != null, "No provider for %s", entry.getKey());
      bindings.put(entry.getKey(), bind(entry.getKey(), entry.getValue(), provider));
    }
    this.bindings = bindings.build();
  }

  private <T> MemberBinding<T> bind(
      String member, ImmutableList<String> dependencies, MemberProvider<T> provider) {
    return new MemberBinding<>(member, dependencies, provider, this);
  }

  /** All members, in declaration order. */
  public ImmutableSet<String> members() {
    return bindings.keySet();
  }

  /**
   * Returns the binding for {@code member}.
   *
   * @throws IllegalArgumentException if there is no such member
   */
  public MemberBinding<?> binding(String member) {
    MemberBinding<?> binding = bindings.get(member);
    if (binding == null) {
      throw new IllegalArgumentException(
          String.format("No member named %s; members: %s", member, bindings.keySet()));
    }
    return binding;
  }

  /** Returns true once {@code member} has been constructed and cached. */
  public synchronized boolean isConstructed(String member) {
    binding(member);
    return constructed.containsKey(member);
  }

  /**
   * Returns the value of {@code binding}'s member, constructing it and any of its transitive
   * dependencies that have not been constructed yet.
   *
   * <p>If the member's provider throws, the exception propagates unchanged and the member stays
   * unconstructed. Dependencies constructed before the failure remain cached.
   */
  synchronized Object resolve(MemberBinding<?> binding) {
    String member = binding.member;
    log(member, "get");

    Object value = constructed.get(member);
    if (value != null) {
      log(member, "already constructed");
      return value;
    }

    log(member, "constructing");
    Map<String, Object> values = new LinkedHashMap<>();
    for (String dependency : binding.dependencies) {
      values.put(dependency, requestBinding(dependency, member).get());
    }

    try {
      value = binding.provider.provide(Dependencies.of(member, ImmutableMap.copyOf(values)));
    } catch (RuntimeException e) {
      if (logger.isLoggable(Level.FINE)) {
        logger.log(Level.FINE, String.format("Provider for %s failed.", member), e);
      }
      throw e;
    }
    if (value == null) {
      throw new NullPointerException("Provider for " + member + " returned null");
    }

    constructed.put(member, value);
    log(member, "constructed");
    return value;
  }

  /**
   * Returns the binding for {@code dependency}, which {@code requiredBy} declared.
   *
   * @throws UndefinedDependencyException if {@code dependency} is not a member
   */
  private MemberBinding<?> requestBinding(String dependency, String requiredBy) {
    MemberBinding<?> binding = bindings.get(dependency);
    if (binding == null) {
      throw new UndefinedDependencyException(requiredBy, dependency);
    }
    return binding;
  }

  private void log(String member, String event) {
    if (log.isPresent()) {
      log.get().log(member + " - " + event);
    }
  }

  @Override
  public synchronized String toString() {
    return "Linker[constructed=" + constructed.keySet() + "]";
  }
}
