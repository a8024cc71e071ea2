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

import static com.google.common.base.Preconditions.checkElementIndex;

/** Utilities for {@link Tree}. */
public class Trees {
  private Trees() {}

  /** Renders the whole forest rooted at node 0 as PDDL text. */
  public static String toString(Tree tree) {
    return tree.isEmpty() ? "" : toString(tree, 0);
  }

  /**
   * Renders the subtree rooted at a given node as PDDL text, for example
   * {@code (and (robot_at r1 kitchen)(> (battery r1) 10.0))}.
   */
  public static String toString(Tree tree, int nodeId) {
    return unparse(new StringBuilder(), tree, nodeId).toString();
  }

  /** Appends the PDDL rendering of a subtree to a buffer. */
  public static StringBuilder unparse(StringBuilder b, Tree tree, int nodeId) {
    checkElementIndex(nodeId, tree.size());
    final Node node = tree.node(nodeId);
    switch (node.kind) {
      case AND:
        return children(b.append("(and "), tree, node).append(')');
      case OR:
        return children(b.append("(or "), tree, node).append(')');
      case NOT:
        return children(b.append("(not "), tree, node).append(')');
      case PREDICATE:
      case FUNCTION:
        b.append('(').append(node.name);
        node.parameters.forEach(p -> b.append(' ').append(p.name));
        return b.append(')');
      case EXPRESSION:
        return binary(b, tree, node, String.valueOf(node.exprOp));
      case FUNCTION_MODIFIER:
        return binary(b, tree, node, String.valueOf(node.modifierOp));
      case NUMBER:
        return b.append(node.value);
      case CONSTANT:
        return b.append(node.name);
      case PARAMETER:
        return node.parameters.isEmpty()
            ? b
            : b.append(node.parameters.get(0).name);
      case EXISTS:
        b.append("(exists (");
        for (int i = 0; i < node.parameters.size(); i++) {
          b.append(i > 0 ? " " : "").append(node.parameters.get(i).name);
        }
        return children(b.append(") "), tree, node).append(')');
      default:
        throw new AssertionError(node.kind);
    }
  }

  private static StringBuilder children(StringBuilder b, Tree tree, Node node) {
    for (int child : node.children) {
      unparse(b, tree, child);
    }
    return b;
  }

  private static StringBuilder binary(
      StringBuilder b, Tree tree, Node node, String op) {
    b.append('(').append(op);
    for (int child : node.children) {
      unparse(b.append(' '), tree, child);
    }
    return b.append(')');
  }
}

// End Trees.java
