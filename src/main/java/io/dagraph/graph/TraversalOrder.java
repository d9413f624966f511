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

/**
 * The order in which the cycle detector picks root vertices and walks the edges leaving each
 * vertex. (Preferred over a boolean to avoid parameter confusion.)
 *
 * <p>The strongly connected components found, and hence the answer to {@link
 * DependencyGraph#isCyclic(TraversalOrder)}, do not depend on the order chosen.
 */
public enum TraversalOrder {
  /** Vertices and edges are visited in the order in which they were added to the graph. */
  INSERTION,

  /** Vertices and edges are visited in a freshly shuffled order on every call. */
  SHUFFLED
}
