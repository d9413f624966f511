// Copyright 2014 The Bazel Authors. All rights reserved.
// Copyright 2021 Jonathan Bluett-Duncan. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package io.dagraph.graph;

import static com.google.common.collect.ImmutableSet.toImmutableSet;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.graph.Graphs;
import java.util.Random;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

/** Test for {@link TarjanScc} and {@link DependencyGraph#isCyclic}. */
class TarjanSccTests {

  private static final int RUNS = 999;

  @Test
  void testSimpleCycle() {
    DependencyGraph<String, Void> graph = newGraph("a", "b", "c");
    // a -> b -> c -> a
    graph.addEdge("b", "a");
    graph.addEdge("c", "b");
    graph.addEdge("a", "c");

    assertThat(graph.isCyclic()).isTrue();
    assertThat(graph.getStronglyConnectedComponents()).hasSize(1);
    assertThat(graph.getStronglyConnectedComponents().get(0)).containsExactly("a", "b", "c");
  }

  @Test
  void testSelfEdgeIsCyclic() {
    DependencyGraph<String, Void> graph = newGraph("a");
    assertThat(graph.isCyclic()).isFalse();

    graph.addEdge("a", "a");

    assertThat(graph.isCyclic()).isTrue();
    assertThat(graph.isCyclic(TraversalOrder.SHUFFLED)).isTrue();
    // A self-edge does not merge components.
    assertThat(graph.getStronglyConnectedComponents()).containsExactly(ImmutableList.of("a"));
  }

  @Test
  void testGraphWithoutEdgesIsNeverCyclic() {
    DependencyGraph<Integer, Void> graph = new DependencyGraph<>();
    for (int i = 0; i < 100; i++) {
      graph.addVertex(i);
    }

    for (int run = 0; run < RUNS; run++) {
      assertThat(graph.isCyclic(TraversalOrder.SHUFFLED)).isFalse();
    }
    assertThat(graph.getStronglyConnectedComponents()).hasSize(100);
  }

  @Test
  void testTreeIsAcyclicUntilBackEdgeIsAdded() {
    DependencyGraph<Integer, Void> graph = newHalvingTree();

    assertThat(graph.isCyclic()).isFalse();
    for (int run = 0; run < RUNS; run++) {
      assertThat(graph.isCyclic(TraversalOrder.SHUFFLED)).isFalse();
    }

    // 1 -> 99 closes 99 -> 49 -> 24 -> 12 -> 6 -> 3 -> 1 -> 99.
    graph.addEdge(99, 1);

    assertThat(graph.isCyclic()).isTrue();
    for (int run = 0; run < RUNS; run++) {
      assertThat(graph.isCyclic(TraversalOrder.SHUFFLED)).isTrue();
    }
    assertThat(componentsOf(graph, TraversalOrder.INSERTION))
        .contains(ImmutableSet.of(1, 3, 6, 12, 24, 49, 99));
  }

  @Test
  void testTreeWithDisconnectedCycle() {
    DependencyGraph<Object, Void> graph = new DependencyGraph<>();
    for (int i = 0; i < 100; i++) {
      graph.addVertex(i);
    }
    for (int i = 1; i < 100; i++) {
      graph.addEdge(i / 2, i);
    }
    for (int run = 0; run < RUNS; run++) {
      assertThat(graph.isCyclic(TraversalOrder.SHUFFLED)).isFalse();
    }

    graph.addVertex("a");
    graph.addVertex("b");
    graph.addVertex("c");
    graph.addEdge("b", "a");
    graph.addEdge("c", "b");
    graph.addEdge("a", "c");

    for (int run = 0; run < RUNS; run++) {
      assertThat(graph.isCyclic(TraversalOrder.SHUFFLED)).isTrue();
    }
  }

  @Test
  void testCycleNextToDisconnectedChain() {
    DependencyGraph<String, Void> graph = newGraph("a", "b", "c", "e", "f", "g");
    // a -> b -> c -> a
    graph.addEdge("b", "a");
    graph.addEdge("c", "b");
    graph.addEdge("a", "c");
    // e -> f -> g
    graph.addEdge("f", "e");
    graph.addEdge("g", "f");

    for (int run = 0; run < RUNS; run++) {
      assertThat(graph.isCyclic(TraversalOrder.SHUFFLED)).isTrue();
    }
    assertThat(componentsOf(graph, TraversalOrder.INSERTION))
        .containsExactly(
            ImmutableSet.of("a", "b", "c"),
            ImmutableSet.of("e"),
            ImmutableSet.of("f"),
            ImmutableSet.of("g"));
  }

  @Test
  void testOverlappingCyclesFormOneComponent() {
    //      a   e   h
    //     / \ / \ / \
    //    d   b   f   i
    //     \ / \ / \ /
    //      c   g   j
    DependencyGraph<String, Void> graph =
        newGraph("a", "b", "c", "d", "e", "f", "g", "h", "i", "j");
    // a -> b -> c -> d -> a
    graph.addEdge("b", "a");
    graph.addEdge("c", "b");
    graph.addEdge("d", "c");
    graph.addEdge("a", "d");
    // e -> b -> g -> f -> e
    graph.addEdge("b", "e");
    graph.addEdge("g", "b");
    graph.addEdge("f", "g");
    graph.addEdge("e", "f");
    // h -> f -> j -> i -> h
    graph.addEdge("f", "h");
    graph.addEdge("h", "i");
    graph.addEdge("i", "j");
    graph.addEdge("j", "f");

    ImmutableSet<ImmutableSet<String>> expected =
        ImmutableSet.of(ImmutableSet.copyOf(graph.keys()));
    for (int run = 0; run < RUNS; run++) {
      assertThat(graph.isCyclic(TraversalOrder.SHUFFLED)).isTrue();
      assertThat(componentsOf(graph, TraversalOrder.SHUFFLED)).isEqualTo(expected);
    }
  }

  @Test
  void testComponentRootIsListedLast() {
    DependencyGraph<String, Void> graph = newGraph("a", "b", "c");
    graph.addEdge("b", "a");
    graph.addEdge("c", "b");
    graph.addEdge("a", "c");

    // Visiting in insertion order makes "a" the root of the only component.
    assertThat(graph.getStronglyConnectedComponents())
        .containsExactly(ImmutableList.of("c", "b", "a"));
  }

  @Test
  void testAgreesWithGuavaOnRandomGraphs() {
    Random random = new Random(0x5eed);
    for (int trial = 0; trial < 500; trial++) {
      DependencyGraph<Integer, Void> graph = new DependencyGraph<>();
      int vertexCount = 1 + random.nextInt(15);
      for (int i = 0; i < vertexCount; i++) {
        graph.addVertex(i);
      }
      for (int src = 0; src < vertexCount; src++) {
        for (int dst = 0; dst < vertexCount; dst++) {
          if (random.nextInt(100) < 12) {
            graph.addEdge(dst, src);
          }
        }
      }

      boolean expected = Graphs.hasCycle(graph);
      assertThat(graph.isCyclic()).isEqualTo(expected);
      assertThat(graph.isCyclic(TraversalOrder.SHUFFLED)).isEqualTo(expected);

      ImmutableSet<ImmutableSet<Integer>> inInsertionOrder =
          componentsOf(graph, TraversalOrder.INSERTION);
      assertThat(toComponents(new TarjanScc<>(graph, new Random(trial)).run()))
          .isEqualTo(inInsertionOrder);
      assertThat(inInsertionOrder.stream().mapToInt(ImmutableSet::size).sum())
          .isEqualTo(vertexCount);
    }
  }

  @Test
  void testInstancesAreSingleUse() {
    TarjanScc<String> scc = new TarjanScc<>(newGraph("a"), null);
    scc.run();

    assertThrows(IllegalStateException.class, scc::run);
  }

  @Test
  void testLongChainExhaustsCallStack() throws InterruptedException {
    int length = 100_000;
    DependencyGraph<Integer, Void> graph = new DependencyGraph<>();
    for (int i = 0; i < length; i++) {
      graph.addVertex(i);
    }
    // 0 -> 1 -> 2 -> ..., so the walk from the first root descends the whole chain.
    for (int i = 1; i < length; i++) {
      graph.addEdge(i, i - 1);
    }

    AtomicReference<Throwable> thrown = new AtomicReference<>();
    Thread thread =
        new Thread(
            null,
            () -> {
              try {
                graph.isCyclic();
              } catch (Throwable t) {
                thrown.set(t);
              }
            },
            "shallow-stack",
            256 * 1024);
    thread.start();
    thread.join();

    assertThat(thrown.get()).isInstanceOf(StackOverflowError.class);
    // The failed search leaves the graph as it was.
    assertThat(graph.size()).isEqualTo(length);
    assertThat(graph.getDirectSuccessors(0)).containsExactly(1);
    assertThat(graph.getAllPredecessors(length - 1)).hasSize(length - 1);
  }

  private static DependencyGraph<String, Void> newGraph(String... keys) {
    DependencyGraph<String, Void> graph = new DependencyGraph<>();
    for (String key : keys) {
      graph.addVertex(key);
    }
    return graph;
  }

  /** Each vertex i > 0 has an edge to i / 2. */
  private static DependencyGraph<Integer, Void> newHalvingTree() {
    DependencyGraph<Integer, Void> graph = new DependencyGraph<>();
    for (int i = 0; i < 100; i++) {
      graph.addVertex(i);
    }
    for (int i = 1; i < 100; i++) {
      graph.addEdge(i / 2, i);
    }
    return graph;
  }

  private static <K> ImmutableSet<ImmutableSet<K>> componentsOf(
      DependencyGraph<K, ?> graph, TraversalOrder order) {
    return toComponents(graph.getStronglyConnectedComponents(order));
  }

  private static <K> ImmutableSet<ImmutableSet<K>> toComponents(
      ImmutableList<ImmutableList<K>> components) {
    return components.stream().map(ImmutableSet::copyOf).collect(toImmutableSet());
  }
}
