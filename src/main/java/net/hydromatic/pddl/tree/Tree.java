/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.pddl.tree;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Condition tree: a forest of expression trees whose nodes share one list.
 *
 * <p>Node {@code i} has id {@code i}. Ids are assigned in the order nodes are
 * appended and are never reused. A child always has a greater id than its
 * parent; for example the body of an {@link NodeKind#EXISTS} node is lowered
 * after the quantifier node itself. Hence a tree has no cycles.
 *
 * <p>A tree is an immutable value. Use a {@link Builder} to create one, and
 * {@link #toBuilder()} to derive a modified copy.
 */
public final class Tree {
  private static final Tree EMPTY = new Tree(ImmutableList.of());

  public final ImmutableList<Node> nodes;

  private Tree(ImmutableList<Node> nodes) {
    for (int i = 0; i < nodes.size(); i++) {
      final Node node = nodes.get(i);
      checkArgument(node.id == i, "node %s is at position %s", node, i);
      for (int child : node.children) {
        checkElementIndex(child, nodes.size(), "child of node " + i);
        checkArgument(child > i, "child %s of node %s must follow it", child,
            i);
      }
    }
    this.nodes = nodes;
  }

  /** Returns a tree with no nodes. */
  public static Tree empty() {
    return EMPTY;
  }

  /** Creates a tree from a list of nodes. */
  public static Tree of(List<Node> nodes) {
    return nodes.isEmpty() ? EMPTY : new Tree(ImmutableList.copyOf(nodes));
  }

  /** Creates a builder that appends to an empty tree. */
  public static Builder builder() {
    return new Builder(ImmutableList.of());
  }

  /** Creates a builder that appends to this tree. */
  public Builder toBuilder() {
    return new Builder(nodes);
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  public int size() {
    return nodes.size();
  }

  /** Returns the node with a given id. */
  public Node node(int id) {
    return nodes.get(id);
  }

  /** Returns the {@code ordinal}th child of a node. */
  public Node child(int id, int ordinal) {
    return nodes.get(nodes.get(id).children.get(ordinal));
  }

  @Override
  public int hashCode() {
    return nodes.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this || o instanceof Tree && nodes.equals(((Tree) o).nodes);
  }

  @Override
  public String toString() {
    return nodes.toString();
  }

  /**
   * Append-only builder of a {@link Tree}.
   *
   * <p>Lowering a condition appends to whatever builder it is given; callers
   * that need isolated trees use a fresh builder per condition.
   */
  public static final class Builder {
    private final List<Node> nodes;

    private Builder(List<Node> nodes) {
      this.nodes = new ArrayList<>(nodes);
    }

    /** Returns the id that the next appended node will receive. */
    public int nextId() {
      return nodes.size();
    }

    /** Returns a node that has already been appended. */
    public Node get(int id) {
      return nodes.get(id);
    }

    /**
     * Appends a node. The node's id must be {@link #nextId()}; use the
     * {@code Node} factory methods with {@code nextId()} to create it.
     */
    public Node add(Node node) {
      checkArgument(
          node.id == nodes.size(),
          "node id %s should be %s",
          node.id,
          nodes.size());
      nodes.add(node);
      return node;
    }

    /**
     * Appends a child id to an existing node, and returns the new parent.
     * A child must have been appended after its parent, so that a tree never
     * contains a cycle.
     */
    public Node addChild(int parentId, int childId) {
      checkElementIndex(childId, nodes.size(), "child");
      checkArgument(childId > parentId, "child %s of node %s must follow it",
          childId, parentId);
      return update(parentId, n -> n.withChild(childId));
    }

    /** Replaces an existing node. */
    public Node update(int id, UnaryOperator<Node> transform) {
      final Node node = transform.apply(nodes.get(id));
      checkArgument(node.id == id, "transform changed id");
      nodes.set(id, node);
      return node;
    }

    public Tree build() {
      return Tree.of(nodes);
    }
  }
}

// End Tree.java
