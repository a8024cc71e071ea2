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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Element of a {@link Tree}.
 *
 * <p>A node is identified by its position in the tree's node list. It refers
 * to its children by id, never by reference, so a tree never contains a
 * cycle of owning references.
 *
 * <p>Nodes are immutable; the {@code with} methods return modified copies.
 */
public final class Node {
  public final int id;
  public final NodeKind kind;
  public final ImmutableList<Integer> children;
  /** Operator; set only for {@link NodeKind#EXPRESSION}. */
  public final @Nullable ExprOp exprOp;
  /** Operator; set only for {@link NodeKind#FUNCTION_MODIFIER}. */
  public final @Nullable ModifierOp modifierOp;
  /** Symbol; set for predicates, functions and constants, otherwise "". */
  public final String name;
  public final ImmutableList<Param> parameters;
  /** Literal value; meaningful only for {@link NodeKind#NUMBER}. */
  public final double value;

  private Node(
      int id,
      NodeKind kind,
      List<Integer> children,
      @Nullable ExprOp exprOp,
      @Nullable ModifierOp modifierOp,
      String name,
      List<Param> parameters,
      double value) {
    checkArgument(id >= 0, "negative id %s", id);
    checkArgument(
        (exprOp != null) == (kind == NodeKind.EXPRESSION),
        "expression operator is required for, and only for, EXPRESSION");
    checkArgument(
        (modifierOp != null) == (kind == NodeKind.FUNCTION_MODIFIER),
        "modifier is required for, and only for, FUNCTION_MODIFIER");
    this.id = id;
    this.kind = requireNonNull(kind);
    this.children = ImmutableList.copyOf(children);
    this.exprOp = exprOp;
    this.modifierOp = modifierOp;
    this.name = requireNonNull(name);
    this.parameters = ImmutableList.copyOf(parameters);
    this.value = value;
  }

  /** Creates a node of a kind that has no operator. */
  public static Node of(int id, NodeKind kind) {
    return new Node(
        id, kind, ImmutableList.of(), null, null, "", ImmutableList.of(), 0D);
  }

  /** Creates an {@link NodeKind#EXPRESSION} node. */
  public static Node expression(int id, ExprOp op) {
    return new Node(
        id,
        NodeKind.EXPRESSION,
        ImmutableList.of(),
        requireNonNull(op),
        null,
        "",
        ImmutableList.of(),
        0D);
  }

  /** Creates a {@link NodeKind#FUNCTION_MODIFIER} node. */
  public static Node modifier(int id, ModifierOp op) {
    return new Node(
        id,
        NodeKind.FUNCTION_MODIFIER,
        ImmutableList.of(),
        null,
        requireNonNull(op),
        "",
        ImmutableList.of(),
        0D);
  }

  /** Creates a {@link NodeKind#NUMBER} node. */
  public static Node number(int id, double value) {
    return of(id, NodeKind.NUMBER).withValue(value);
  }

  public Node withName(String name) {
    return new Node(
        id, kind, children, exprOp, modifierOp, name, parameters, value);
  }

  public Node withValue(double value) {
    return new Node(
        id, kind, children, exprOp, modifierOp, name, parameters, value);
  }

  public Node withParameters(List<Param> parameters) {
    return new Node(
        id, kind, children, exprOp, modifierOp, name, parameters, value);
  }

  public Node withChildren(List<Integer> children) {
    return new Node(
        id, kind, children, exprOp, modifierOp, name, parameters, value);
  }

  /** Returns a copy of this node with one more child. */
  public Node withChild(int childId) {
    return withChildren(
        ImmutableList.<Integer>builder().addAll(children).add(childId).build());
  }

  /** Returns the names of the parameters. */
  public List<String> parameterNames() {
    return parameters.stream()
        .map(p -> p.name)
        .collect(ImmutableList.toImmutableList());
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        id, kind, children, exprOp, modifierOp, name, parameters, value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Node)) {
      return false;
    }
    final Node that = (Node) o;
    return id == that.id
        && kind == that.kind
        && children.equals(that.children)
        && exprOp == that.exprOp
        && modifierOp == that.modifierOp
        && name.equals(that.name)
        && parameters.equals(that.parameters)
        && Double.compare(value, that.value) == 0;
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    b.append(id).append(':').append(kind);
    if (exprOp != null) {
      b.append(' ').append(exprOp);
    }
    if (modifierOp != null) {
      b.append(' ').append(modifierOp);
    }
    if (!name.isEmpty()) {
      b.append(' ').append(name);
    }
    if (!parameters.isEmpty()) {
      b.append(' ').append(parameterNames());
    }
    if (kind == NodeKind.NUMBER) {
      b.append(' ').append(value);
    }
    if (!children.isEmpty()) {
      b.append(" -> ").append(children);
    }
    return b.toString();
  }
}

// End Node.java
