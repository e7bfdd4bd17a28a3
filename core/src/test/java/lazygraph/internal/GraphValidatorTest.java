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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.Collections2;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSetMultimap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lazygraph.CycleCheck;
import lazygraph.CyclicDependencyException;
import lazygraph.UndefinedDependencyException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class GraphValidatorTest {
  private static final ImmutableMap<String, ImmutableList<String>> THREE_COMPONENTS =
      ImmutableMap.<String, ImmutableList<String>>builder()
          .put("a", ImmutableList.of("b"))
          .put("b", ImmutableList.of("c", "e", "f"))
          .put("c", ImmutableList.of("d", "g"))
          .put("d", ImmutableList.of("c", "h"))
          .put("e", ImmutableList.of("a", "f"))
          .put("f", ImmutableList.of("g"))
          .put("g", ImmutableList.of("f"))
          .put("h", ImmutableList.of("d", "g", "h"))
          .build();

  private static final ImmutableList<ImmutableList<String>> THREE_COMPONENTS_CYCLES =
      ImmutableList.of(
          ImmutableList.of("f", "g"),
          ImmutableList.of("a", "b", "e"),
          ImmutableList.of("c", "d", "h"));

  @Test public void acyclic() {
    ImmutableMap<String, ImmutableList<String>> graph =
        ImmutableMap.of(
            "a", ImmutableList.of("b", "c"),
            "b", ImmutableList.of("c"),
            "c", ImmutableList.of());

    assertThat(GraphValidator.hasCycle(graph)).isFalse();
    assertThat(GraphValidator.findCycles(graph)).isEmpty();
  }

  @Test public void emptyGraph() {
    assertThat(GraphValidator.hasCycle(ImmutableMap.of())).isFalse();
    assertThat(GraphValidator.findCycles(ImmutableMap.of())).isEmpty();
  }

  @Test public void selfLoop() {
    ImmutableMap<String, ImmutableList<String>> graph =
        ImmutableMap.of("a", ImmutableList.of("a"), "b", ImmutableList.of("a"));

    assertThat(GraphValidator.hasCycle(graph)).isTrue();
    assertThat(GraphValidator.findCycles(graph)).containsExactly(ImmutableList.of("a"));
  }

  @Test public void selfLoopInsideLargerComponentIsNotReportedAlone() {
    ImmutableMap<String, ImmutableList<String>> graph =
        ImmutableMap.of("a", ImmutableList.of("a", "b"), "b", ImmutableList.of("a"));

    assertThat(GraphValidator.findCycles(graph)).containsExactly(ImmutableList.of("a", "b"));
  }

  @Test public void threeComponents() {
    assertThat(GraphValidator.hasCycle(THREE_COMPONENTS)).isTrue();
    assertThat(GraphValidator.findCycles(THREE_COMPONENTS))
        .containsExactlyElementsIn(THREE_COMPONENTS_CYCLES)
        .inOrder();
  }

  @Test public void threeComponents_everyDeclarationOrder() {
    for (List<String> order : Collections2.permutations(THREE_COMPONENTS.keySet())) {
      Map<String, List<String>> graph = new LinkedHashMap<>();
      for (String member : order) {
        graph.put(member, THREE_COMPONENTS.get(member));
      }
      assertThat(GraphValidator.findCycles(graph)).isEqualTo(THREE_COMPONENTS_CYCLES);
      assertThat(GraphValidator.hasCycle(graph)).isTrue();
    }
  }

  @Test public void edgeIntoClosedComponentJoinsNothing() {
    // c reaches the a-b cycle but nothing reaches back to c.
    ImmutableMap<String, ImmutableList<String>> graph =
        ImmutableMap.of(
            "a", ImmutableList.of("b"),
            "b", ImmutableList.of("a"),
            "c", ImmutableList.of("a"));

    assertThat(GraphValidator.findCycles(graph)).containsExactly(ImmutableList.of("a", "b"));
  }

  @Test public void edgeIntoOpenComponentJoinsIt() {
    // a -> b -> a closes first, then a -> c -> b brings c into the same component.
    ImmutableMap<String, ImmutableList<String>> graph =
        ImmutableMap.of(
            "a", ImmutableList.of("b", "c"),
            "b", ImmutableList.of("a"),
            "c", ImmutableList.of("b"));

    assertThat(GraphValidator.findCycles(graph)).containsExactly(ImmutableList.of("a", "b", "c"));
  }

  @Test public void undefinedDependenciesTakeNoPartInCycles() {
    ImmutableMap<String, ImmutableList<String>> graph =
        ImmutableMap.of("b", ImmutableList.of("y", "x"), "a", ImmutableList.of("b", "z"));

    assertThat(GraphValidator.hasCycle(graph)).isFalse();
    assertThat(GraphValidator.findCycles(graph)).isEmpty();
    assertThat(GraphValidator.undefinedDependencies(graph))
        .containsExactly("a", "z", "b", "x", "b", "y")
        .inOrder();
  }

  @Test public void validate_skip() {
    ValidationResult result = GraphValidator.validate(THREE_COMPONENTS, CycleCheck.SKIP);

    assertThat(result.cycleCheck()).isEqualTo(CycleCheck.SKIP);
    assertThat(result.hasCycle()).isFalse();
    assertThat(result.cycles().isPresent()).isFalse();
    result.checkValid();
  }

  @Test public void validate_simple() {
    ValidationResult result = GraphValidator.validate(THREE_COMPONENTS, CycleCheck.SIMPLE);

    assertThat(result.hasCycle()).isTrue();
    assertThat(result.cycles().isPresent()).isFalse();
    try {
      result.checkValid();
      throw new AssertionError();
    } catch (CyclicDependencyException expected) {
      assertThat(expected.cycles().isPresent()).isFalse();
    }
  }

  @Test public void validate_detailed() {
    ValidationResult result = GraphValidator.validate(THREE_COMPONENTS, CycleCheck.DETAILED);

    assertThat(result.hasCycle()).isTrue();
    assertThat(result.cycles().get()).isEqualTo(THREE_COMPONENTS_CYCLES);
    try {
      result.checkValid();
      throw new AssertionError();
    } catch (CyclicDependencyException expected) {
      assertThat(expected.cycles().get()).isEqualTo(THREE_COMPONENTS_CYCLES);
    }
  }

  @Test public void validate_undefined() {
    ImmutableMap<String, ImmutableList<String>> graph = ImmutableMap.of("a", ImmutableList.of("b"));

    for (CycleCheck check : new CycleCheck[] {CycleCheck.SIMPLE, CycleCheck.DETAILED}) {
      ValidationResult result = GraphValidator.validate(graph, check);
      assertThat(result.hasCycle()).isFalse();
      assertThat(result.undefinedDependencies()).isEqualTo(ImmutableSetMultimap.of("a", "b"));
      try {
        result.checkValid();
        throw new AssertionError();
      } catch (UndefinedDependencyException expected) {
        assertThat(expected.undefinedDependencies()).isEqualTo(result.undefinedDependencies());
      }
    }
    assertThat(GraphValidator.validate(graph, CycleCheck.SKIP).undefinedDependencies()).isEmpty();
  }

  @Test public void simpleAndDetailedAgree() {
    ImmutableMap<String, ImmutableList<String>> chain =
        ImmutableMap.of("a", ImmutableList.of("b"), "b", ImmutableList.of());
    ImmutableMap<String, ImmutableList<String>> tailLoop =
        ImmutableMap.of("a", ImmutableList.of("b"), "b", ImmutableList.of("b"));
    ImmutableMap<String, ImmutableList<String>> diamond =
        ImmutableMap.of(
            "a", ImmutableList.of("b", "c"),
            "b", ImmutableList.of("d"),
            "c", ImmutableList.of("d"),
            "d", ImmutableList.of());

    for (ImmutableMap<String, ImmutableList<String>> graph :
        ImmutableList.of(THREE_COMPONENTS, chain, tailLoop, diamond)) {
      assertThat(GraphValidator.hasCycle(graph))
          .isEqualTo(!GraphValidator.findCycles(graph).isEmpty());
    }
  }
}
