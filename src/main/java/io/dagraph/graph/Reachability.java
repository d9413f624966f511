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

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Computes the transitive closure of a vertex of a {@link DependencyGraph}, following edges either
 * forwards (successors) or backwards (predecessors).
 *
 * <p>The walk keeps an explicit work list rather than recursing, so its depth is not bounded by the
 * call stack, and marks each vertex when it is first discovered, so that every reachable vertex is
 * expanded exactly once even in the presence of cycles.
 *
 * <p>Clients should not modify the graph while a walk is in progress.
 */
final class Reachability<K> {

  private final DependencyGraph<K, ?> graph;

  private final boolean transpose;

  /**
   * @param transpose iff true, the graph is implicitly transposed during the walk, i.e. edges are
   *     followed from their destination to their source.
   */
  Reachability(DependencyGraph<K, ?> graph, boolean transpose) {
    this.graph = graph;
    this.transpose = transpose;
  }

  /**
   * Returns the keys reachable from {@code start} by following one or more edges, in the order in
   * which they were reached. {@code start} itself is never part of the result, even when it lies on
   * a cycle.
   *
   * @throws UnknownKeyException if {@code start} is not a vertex of the graph.
   */
  ImmutableList<K> closureOf(K start) {
    Set<K> marked = new HashSet<>();
    marked.add(start);
    Deque<K> workList = new ArrayDeque<>();
    for (K neighbour : neighbours(start)) {
      if (marked.add(neighbour)) {
        workList.push(neighbour);
      }
    }

    ImmutableList.Builder<K> closure = ImmutableList.builder();
    while (!workList.isEmpty()) {
      K key = workList.pop();
      closure.add(key);
      for (K neighbour : neighbours(key)) {
        if (marked.add(neighbour)) {
          workList.push(neighbour);
        }
      }
    }
    return closure.build();
  }

  private Set<K> neighbours(K key) {
    Vertex<K, ?> vertex = graph.vertex(key);
    return transpose ? vertex.getPredecessors() : vertex.getSuccessors();
  }
}
