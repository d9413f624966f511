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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EmptyStackException;
import java.util.HashSet;
import java.util.Set;

/**
 * A last-in first-out stack whose elements are pairwise distinct. Alongside the stack itself a
 * hash set mirrors its contents, so that {@link #contains} runs in constant time.
 *
 * <p>The null pointer is not a valid element. Elements are assumed to be immutable while on the
 * stack, much like {@link java.util.HashSet} assumes it for its members.
 */
final class UniqueStack<E> {

  private final Deque<E> sequence = new ArrayDeque<>();

  // Always holds exactly the elements of 'sequence'.
  private final Set<E> membership = new HashSet<>();

  /** Constructs an empty stack. */
  UniqueStack() {}

  /**
   * Constructs a stack holding {@code elements}, pushed in iteration order so that the last element
   * ends up on top.
   *
   * @throws DuplicateElementException if {@code elements} contains the same element twice.
   */
  UniqueStack(Iterable<? extends E> elements) {
    checkNotNull(elements, "elements");
    for (E element : elements) {
      push(element);
    }
  }

  /**
   * Pushes {@code element} onto the top of this stack.
   *
   * @throws DuplicateElementException if {@code element} is already on the stack.
   */
  void push(E element) {
    checkNotNull(element, "element");
    if (!membership.add(element)) {
      throw new DuplicateElementException(element);
    }
    sequence.addLast(element);
  }

  /**
   * Removes and returns the element on top of this stack.
   *
   * @throws EmptyStackException if the stack is empty.
   */
  E pop() {
    if (sequence.isEmpty()) {
      throw new EmptyStackException();
    }
    E element = sequence.removeLast();
    membership.remove(element);
    return element;
  }

  /**
   * Returns the element on top of this stack without removing it.
   *
   * @throws EmptyStackException if the stack is empty.
   */
  E peek() {
    if (sequence.isEmpty()) {
      throw new EmptyStackException();
    }
    return sequence.peekLast();
  }

  /** Returns true iff {@code element} is on the stack. Time: O(1). */
  boolean contains(Object element) {
    return membership.contains(element);
  }

  int size() {
    return sequence.size();
  }

  boolean isEmpty() {
    return sequence.isEmpty();
  }

  @Override
  public String toString() {
    return "UniqueStack" + sequence;
  }
}
