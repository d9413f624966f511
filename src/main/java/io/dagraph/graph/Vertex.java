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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * A vertex of a {@link DependencyGraph}: a key, the value stored under it, and the keys of its
 * neighbours in both directions.
 *
 * <p>Adjacency is stored as keys rather than as references to other vertices, and both sets keep
 * insertion order, which is the order in which the graph's traversals walk them.
 */
final class Vertex<K, V> {

  private final K key;

  @Nullable private final V value;

  private final Set<K> successors = new LinkedHashSet<>();

  private final Set<K> predecessors = new LinkedHashSet<>();

  Vertex(K key, @Nullable V value) {
    this.key = key;
    this.value = value;
  }

  K getKey() {
    return key;
  }

  @Nullable
  V getValue() {
    return value;
  }

  /** Returns an unmodifiable view of the keys this vertex has an edge to. */
  Set<K> getSuccessors() {
    return Collections.unmodifiableSet(successors);
  }

  /** Returns an unmodifiable view of the keys that have an edge to this vertex. */
  Set<K> getPredecessors() {
    return Collections.unmodifiableSet(predecessors);
  }

  /**
   * Adds the edge {@code this -> that}, updating both ends.
   *
   * @return true iff the edge was not already present.
   */
  boolean addEdgeTo(Vertex<K, ?> that) {
    boolean added = successors.add(that.key);
    that.predecessors.add(key);
    return added;
  }

  @Override
  public String toString() {
    return "Vertex[" + key + "]";
  }
}
