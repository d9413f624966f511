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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.common.graph.AbstractGraph;
import com.google.common.graph.ElementOrder;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * {@code DependencyGraph} a directed graph of keyed vertices, suitable for modeling dependency
 * relations such as those between build artifacts or tasks, together with the means to find out
 * whether those relations are free of cycles.
 *
 * <p>An instance <code>G = &lt;V,E&gt;</code> consists of a set of vertices <code>V</code>, each
 * identified by a key of type {@code K} and carrying an optional value of type {@code V}, and a set
 * of directed edges <code>E</code>, which is a subset of <code>V &times; V</code>. This permits
 * self-edges but does not represent multiple edges between the same pair of vertices.
 *
 * <p>Some invariants:
 *
 * <ul>
 *   <li>All vertices within a graph have distinct keys. The null pointer is not a valid key.
 *   <li>{@code DependencyGraph} assumes immutability of keys, much like {@link java.util.HashMap}
 *       assumes it for its keys.
 *   <li>Vertices and edges can only be added, never removed; edges can only be added between
 *       vertices that are already present.
 *   <li>Iteration over vertices and over the edges leaving a vertex follows insertion order.
 *   <li>Instances are not thread-safe. Callers sharing a graph across threads must serialize
 *       access to it, including reads that overlap with mutation.
 * </ul>
 *
 * <p>Edges are added by destination first: {@code addEdge(dst, src)} records that {@code src}
 * leads to {@code dst}, i.e. {@code dst} is a successor of {@code src}. Read as "dst depends on
 * src", the successors of a vertex are the things built from it and its predecessors are the things
 * it is built from.
 *
 * <p>The graph is also a read-only Guava {@link com.google.common.graph.Graph}, whose nodes are the
 * vertex keys, so the utilities in {@link com.google.common.graph.Graphs} apply to it.
 */
public final class DependencyGraph<K, V> extends AbstractGraph<K> {

  private static final Logger LOG = Logger.getLogger(DependencyGraph.class.getName());

  /** Maps keys to vertices, which are in strict 1:1 correspondence. */
  private final Map<K, Vertex<K, V>> vertices = new LinkedHashMap<>();

  /** Set as soon as an edge from a vertex to itself is added. Never reset. */
  private boolean directCyclic = false;

  /** Construct an empty DependencyGraph. */
  public DependencyGraph() {}

  // *** Vertices ***

  /** Equivalent to {@code addVertex(key, null)}. */
  public void addVertex(K key) {
    addVertex(key, null);
  }

  /**
   * Adds a vertex with no edges under {@code key}, storing {@code value} with it.
   *
   * @throws DuplicateKeyException if the graph already has a vertex with this key; the graph is
   *     left unchanged.
   */
  public void addVertex(K key, @Nullable V value) {
    checkNotNull(key, "key");
    if (vertices.containsKey(key)) {
      throw new DuplicateKeyException(key);
    }
    vertices.put(key, new Vertex<>(key, value));
  }

  /**
   * Equivalent to {@link #addVertex(Object, Object)}. There is no way to replace the value of an
   * existing vertex.
   *
   * @throws DuplicateKeyException if the graph already has a vertex with this key.
   */
  public void put(K key, @Nullable V value) {
    addVertex(key, value);
  }

  /**
   * Returns the value stored with the vertex {@code key}, or null if it was added without one.
   *
   * @throws UnknownKeyException if there is no such vertex.
   */
  @Nullable
  public V getValue(K key) {
    return vertex(key).getValue();
  }

  /** Returns the number of vertices. */
  public int size() {
    return vertices.size();
  }

  /** Returns true iff the graph has a vertex with this key. */
  public boolean contains(@Nullable Object key) {
    return key != null && vertices.containsKey(key);
  }

  /** Returns the keys of all vertices, in insertion order. */
  public ImmutableList<K> keys() {
    return ImmutableList.copyOf(vertices.keySet());
  }

  /**
   * Finds and returns the vertex with the specified key. The null pointer is not a valid key.
   *
   * @throws UnknownKeyException if no vertex was found with the specified key.
   */
  Vertex<K, V> vertex(K key) {
    Vertex<K, V> vertex = vertices.get(checkNotNull(key, "key"));
    if (vertex == null) {
      throw new UnknownKeyException(key);
    }
    return vertex;
  }

  // *** Edges ***

  /**
   * Adds the directed edge {@code src -> dst}. Both vertices must already exist; {@code src} is
   * checked first. Adding an edge from a vertex to itself makes the graph cyclic from then on.
   *
   * @return true iff the edge was not already present.
   *     <p>Note: multi-edges are ignored. Self-edges are permitted.
   * @throws UnknownKeyException if either vertex is absent; the graph is left unchanged.
   */
  public boolean addEdge(K dst, K src) {
    Vertex<K, V> srcVertex = vertex(src);
    Vertex<K, V> dstVertex = vertex(dst);
    if (src.equals(dst)) {
      directCyclic = true;
    }
    return srcVertex.addEdgeTo(dstVertex);
  }

  /**
   * Adds an edge {@code src -> dst} for each of {@code srcs}, in order, with the semantics of
   * {@link #addEdge}. Processing stops at the first unknown key; edges added before it remain.
   *
   * @return true iff at least one edge was not already present.
   */
  @SafeVarargs
  public final boolean addEdges(K dst, K... srcs) {
    return addEdges(dst, Arrays.asList(srcs));
  }

  /**
   * Adds an edge {@code src -> dst} for each of {@code srcs}, in iteration order, with the
   * semantics of {@link #addEdge}. Processing stops at the first unknown key; edges added before it
   * remain.
   *
   * @return true iff at least one edge was not already present.
   */
  public boolean addEdges(K dst, Iterable<? extends K> srcs) {
    checkNotNull(srcs, "srcs");
    boolean modified = false;
    for (K src : srcs) {
      modified |= addEdge(dst, src);
    }
    return modified;
  }

  // *** Traversal ***

  /**
   * Returns the keys of the vertices that {@code key} has an edge to.
   *
   * @throws UnknownKeyException if there is no such vertex.
   */
  public ImmutableList<K> getDirectSuccessors(K key) {
    return ImmutableList.copyOf(vertex(key).getSuccessors());
  }

  /**
   * Returns the keys of the vertices that have an edge to {@code key}.
   *
   * @throws UnknownKeyException if there is no such vertex.
   */
  public ImmutableList<K> getDirectPredecessors(K key) {
    return ImmutableList.copyOf(vertex(key).getPredecessors());
  }

  /**
   * Returns the keys of all vertices reachable from {@code key} by following one or more edges,
   * excluding {@code key} itself. The order of the result is unspecified. Time: O(V+E).
   *
   * @throws UnknownKeyException if there is no such vertex.
   */
  public ImmutableList<K> getAllSuccessors(K key) {
    return new Reachability<>(this, /* transpose= */ false).closureOf(key);
  }

  /**
   * Returns the keys of all vertices from which {@code key} is reachable by following one or more
   * edges, excluding {@code key} itself. The order of the result is unspecified. Time: O(V+E).
   *
   * @throws UnknownKeyException if there is no such vertex.
   */
  public ImmutableList<K> getAllPredecessors(K key) {
    return new Reachability<>(this, /* transpose= */ true).closureOf(key);
  }

  /**
   * @return the set of root vertices: those with no predecessors.
   *     <p>NOTE: in a cyclic graph, there may be vertices that are not reachable from any "root".
   */
  public ImmutableSet<K> roots() {
    ImmutableSet.Builder<K> roots = ImmutableSet.builder();
    for (Vertex<K, V> vertex : vertices.values()) {
      if (vertex.getPredecessors().isEmpty()) {
        roots.add(vertex.getKey());
      }
    }
    return roots.build();
  }

  /** @return the set of leaf vertices: those with no successors. */
  public ImmutableSet<K> leaves() {
    ImmutableSet.Builder<K> leaves = ImmutableSet.builder();
    for (Vertex<K, V> vertex : vertices.values()) {
      if (vertex.getSuccessors().isEmpty()) {
        leaves.add(vertex.getKey());
      }
    }
    return leaves.build();
  }

  // *** Cycle detection ***

  /** Equivalent to {@code isCyclic(TraversalOrder.INSERTION)}. */
  public boolean isCyclic() {
    return isCyclic(TraversalOrder.INSERTION);
  }

  /**
   * Returns true iff the graph has a cycle, including a self-edge. Time: O(V+E).
   *
   * <p>A graph with a self-edge is reported cyclic straight away. Otherwise the graph is cyclic iff
   * it has fewer strongly connected components than vertices, since every component of an acyclic
   * graph is a single vertex. The result does not depend on {@code order}.
   *
   * @throws StackOverflowError if the graph has a path too long for the depth-first walk of {@link
   *     #getStronglyConnectedComponents(TraversalOrder)}.
   */
  public boolean isCyclic(TraversalOrder order) {
    checkNotNull(order, "order");
    if (directCyclic) {
      LOG.fine("Graph has a self-edge; skipping strongly connected component search");
      return true;
    }
    int componentCount = getStronglyConnectedComponents(order).size();
    int vertexCount = vertices.size();
    LOG.fine(
        () ->
            String.format(
                "Found %d strongly connected components among %d vertices",
                componentCount, vertexCount));
    return componentCount < vertexCount;
  }

  /** Equivalent to {@code getStronglyConnectedComponents(TraversalOrder.INSERTION)}. */
  public ImmutableList<ImmutableList<K>> getStronglyConnectedComponents() {
    return getStronglyConnectedComponents(TraversalOrder.INSERTION);
  }

  /**
   * Returns a partition of the vertex keys of this graph into lists, each list being one strongly
   * connected component of the graph. Components are listed in the order in which Tarjan's
   * algorithm completes them; each component lists its root last.
   *
   * <p>Which vertices share a component does not depend on {@code order}; only the order of the
   * components and of the keys within them does.
   *
   * @throws StackOverflowError if the graph has a path too long for the recursive depth-first walk.
   */
  public ImmutableList<ImmutableList<K>> getStronglyConnectedComponents(TraversalOrder order) {
    return TarjanScc.compute(this, order);
  }

  // *** com.google.common.graph.Graph ***

  /** Returns an immutable view of the vertex keys of this graph. */
  @Override
  public Set<K> nodes() {
    return Collections.unmodifiableSet(vertices.keySet());
  }

  @Override
  public Set<K> adjacentNodes(K node) {
    return Sets.union(predecessors(node), successors(node));
  }

  @Override
  public Set<K> predecessors(K node) {
    return vertex(node).getPredecessors();
  }

  @Override
  public Set<K> successors(K node) {
    return vertex(node).getSuccessors();
  }

  @Override
  public boolean isDirected() {
    return true;
  }

  @Override
  public boolean allowsSelfLoops() {
    return true;
  }

  @Override
  public ElementOrder<K> nodeOrder() {
    return ElementOrder.insertion();
  }

  @Override
  public String toString() {
    return "DependencyGraph[" + vertices.size() + " vertices]";
  }
}
