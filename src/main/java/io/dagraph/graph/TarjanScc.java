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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import javax.annotation.Nullable;

/**
 * Finds the strongly connected components of a {@link DependencyGraph} using Tarjan's algorithm.
 *
 * <p>We visit vertices depth-first, numbering each one in the order it is discovered. Alongside its
 * number every vertex carries a low-link: the smallest number of any vertex known to be reachable
 * from it that has not yet been assigned to a component. Vertices whose component is still open
 * are kept on a stack. Once all successors of a vertex have been visited, if its low-link equals
 * its own number then it is the first-visited element of its component, and everything above it
 * on the stack (and the vertex itself) is popped off as one component.
 *
 * <p>Each instance holds the working state of exactly one computation and is discarded afterwards;
 * nothing is cached on the graph.
 *
 * <p>The depth-first walk is recursive, one stack frame per vertex on the current path, so a
 * sufficiently long chain of vertices ends in a {@link StackOverflowError}. That error is not
 * caught; since the computation only reads the graph, the graph is left intact.
 */
final class TarjanScc<K> {

  /** Discovery number and low-link of a visited vertex. */
  private static final class Link {
    private final int index;
    private int lowLink;

    private Link(int index) {
      this.index = index;
      this.lowLink = index;
    }
  }

  private final DependencyGraph<K, ?> graph;

  // Null means insertion order.
  @Nullable private final Random random;

  private final Map<K, Link> links = new HashMap<>();

  // Vertices visited whose component has not yet been determined.
  private final UniqueStack<K> open = new UniqueStack<>();

  private final List<ImmutableList<K>> components = new ArrayList<>();

  // Discovery number of the next vertex to be visited.
  private int counter = 0;

  /**
   * @param random the source used to shuffle roots and edges, or null to visit both in insertion
   *     order.
   */
  TarjanScc(DependencyGraph<K, ?> graph, @Nullable Random random) {
    this.graph = checkNotNull(graph, "graph");
    this.random = random;
  }

  /** Returns the components of {@code graph}, visiting it in the given order. */
  static <K> ImmutableList<ImmutableList<K>> compute(
      DependencyGraph<K, ?> graph, TraversalOrder order) {
    checkNotNull(order, "order");
    Random random = order == TraversalOrder.SHUFFLED ? new Random() : null;
    return new TarjanScc<>(graph, random).run();
  }

  /**
   * Partitions the vertices of the graph into strongly connected components, returned in the order
   * in which they were completed. Every vertex appears in exactly one component.
   */
  ImmutableList<ImmutableList<K>> run() {
    checkState(links.isEmpty(), "TarjanScc instances are single-use");
    for (K root : inVisitOrder(graph.keys())) {
      if (!links.containsKey(root)) {
        strongConnect(root);
      }
    }
    return ImmutableList.copyOf(components);
  }

  private void strongConnect(K v) {
    Link vLink = new Link(counter++);
    links.put(v, vLink);
    open.push(v);

    for (K w : inVisitOrder(graph.vertex(v).getSuccessors())) {
      Link wLink = links.get(w);
      if (wLink == null) {
        strongConnect(w);
        vLink.lowLink = Math.min(vLink.lowLink, links.get(w).lowLink);
      } else if (open.contains(w)) {
        // w is on the current path, so v and w share a component.
        vLink.lowLink = Math.min(vLink.lowLink, wLink.index);
      }
      // Otherwise w belongs to a component that is already complete.
    }

    if (vLink.lowLink == vLink.index) {
      ImmutableList.Builder<K> component = ImmutableList.builder();
      K w;
      do {
        w = open.pop();
        component.add(w);
      } while (!w.equals(v));
      components.add(component.build());
    }
  }

  private Collection<K> inVisitOrder(Collection<K> keys) {
    if (random == null) {
      return keys;
    }
    List<K> shuffled = new ArrayList<>(keys);
    Collections.shuffle(shuffled, random);
    return shuffled;
  }
}
