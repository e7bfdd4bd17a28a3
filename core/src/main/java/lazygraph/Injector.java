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

import static com.google.common.collect.ImmutableMap.toImmutableMap;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.inject.Provider;
import lazygraph.internal.GraphValidator;
import lazygraph.internal.Linker;

/**
 * A fixed set of named members, each constructed lazily from its dependencies.
 *
 * <p>An injector is created from a dependency mapping, which lists for each member the members it
 * needs, and a provider for each member. Nothing is constructed up front. The first request for a
 * member constructs its missing dependencies depth first, in declaration order, then the member
 * itself. Every value is cached: a provider runs at most once per injector, and later requests
 * return the same instance.
 *
 * <p>Unless told otherwise, {@link #create} rejects dependency graphs that contain a cycle:
 * <pre>{@code
 * Injector injector = Injector.create(
 *     ImmutableMap.of(
 *         "a", ImmutableList.of(),
 *         "b", ImmutableList.of(),
 *         "c", ImmutableList.of("a", "b")),
 *     ImmutableMap.of(
 *         "a", deps -> 3,
 *         "b", deps -> 4,
 *         "c", deps -> Math.hypot(deps.get("a", Integer.class), deps.get("b", Integer.class))));
 * double c = injector.get("c", Double.class);
 * }</pre>
 */
public abstract class Injector {
  private static final Logger logger = Logger.getLogger(Injector.class.getName());

  Injector() {}

  /**
   * Returns the value of {@code member}, constructing it first if necessary.
   *
   * @throws IllegalArgumentException if {@code member} is not a member of this injector
   */
  public abstract Object get(String member);

  /**
   * Returns the value of {@code member} as a {@code type}.
   *
   * @throws IllegalArgumentException if {@code member} is not a member of this injector
   * @throws ClassCastException if the value is not a {@code type}
   */
  public abstract <T> T get(String member, Class<T> type);

  /**
   * Returns a provider whose {@link Provider#get()} behaves like {@link #get(String) get(member)}.
   *
   * @throws IllegalArgumentException if {@code member} is not a member of this injector
   */
  public abstract Provider<?> provider(String member);

  /** Returns the names of all members, in the order they were declared. */
  public abstract ImmutableSet<String> members();

  /** Returns the declared dependencies of {@code member}. */
  public abstract ImmutableList<String> dependencies(String member);

  /** Returns true if {@code member} has already been constructed. */
  public abstract boolean isConstructed(String member);

  /**
   * Returns an injector configured by {@link InjectorOptions#defaults()}.
   *
   * @throws CyclicDependencyException if the graph contains a cycle and cycles are checked
   * @throws UndefinedDependencyException if a dependency is not a member and cycles are checked
   * @throws IllegalArgumentException if {@code providers} does not have exactly one provider for
   *     each member
   */
  public static Injector create(
      Map<String, ? extends List<String>> dependencies,
      Map<String, ? extends MemberProvider<?>> providers) {
    return create(dependencies, providers, InjectorOptions.defaults());
  }

  /**
   * Returns an injector for the members of {@code dependencies}. The graph is checked as
   * {@link InjectorOptions#checkForCycles()} asks before anything else is done.
   *
   * @throws CyclicDependencyException if the graph contains a cycle and cycles are checked
   * @throws UndefinedDependencyException if a dependency is not a member and cycles are checked
   * @throws IllegalArgumentException if {@code providers} does not have exactly one provider for
   *     each member
   */
  public static Injector create(
      Map<String, ? extends List<String>> dependencies,
      Map<String, ? extends MemberProvider<?>> providers,
      InjectorOptions options) {
    ImmutableMap<String, ImmutableList<String>> graph =
        dependencies.entrySet().stream()
            .collect(toImmutableMap(Map.Entry::getKey, e -> ImmutableList.copyOf(e.getValue())));
    GraphValidator.validate(graph, options.checkForCycles()).checkValid();

    ImmutableMap<String, MemberProvider<?>> providerTable =
        ImmutableMap.<String, MemberProvider<?>>copyOf(providers);
    checkProviders(graph.keySet(), providerTable.keySet());

    Linker linker = new Linker(graph, providerTable, options.log());
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(
          String.format(
              "Created injector for %d members (cycle check %s)",
              graph.size(), options.checkForCycles()));
    }
    return new MemoizingInjector(linker);
  }

  private static void checkProviders(ImmutableSet<String> members, ImmutableSet<String> provided) {
    List<String> errors = new ArrayList<>();
    for (String member : Sets.difference(members, provided)) {
      errors.add(member + " has no provider");
    }
    for (String member : Sets.difference(provided, members)) {
      errors.add(member + " has a provider but is not a member");
    }
    if (errors.isEmpty()) {
      return;
    }
    StringBuilder message = new StringBuilder("Errors creating injector:");
    for (String error : errors) {
      message.append("\n  ").append(error);
    }
    throw new IllegalArgumentException(message.toString());
  }

  static final class MemoizingInjector extends Injector {
    private final Linker linker;

    MemoizingInjector(Linker linker) {
      this.linker = linker;
    }

    @Override
    public Object get(String member) {
      return linker.binding(member).get();
    }

    @Override
    public <T> T get(String member, Class<T> type) {
      return type.cast(get(member));
    }

    @Override
    public Provider<?> provider(String member) {
      return linker.binding(member);
    }

    @Override
    public ImmutableSet<String> members() {
      return linker.members();
    }

    @Override
    public ImmutableList<String> dependencies(String member) {
      return linker.binding(member).dependencies();
    }

    @Override
    public boolean isConstructed(String member) {
      return linker.isConstructed(member);
    }

    @Override
    public String toString() {
      return "Injector[members=" + linker.members() + ", " + linker + "]";
    }
  }
}
