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
package net.hydromatic.pddl.util;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.List;
import java.util.Map;
import net.hydromatic.pddl.tree.Node;
import net.hydromatic.pddl.tree.Param;
import net.hydromatic.pddl.tree.Tree;

/** Utilities for replacing variables with objects. */
public class Grounding {
  private Grounding() {}

  /**
   * Returns a tree that is the same as {@code tree} except that, in the
   * subtree rooted at {@code nodeId}, every parameter whose name is a key of
   * {@code mapping} is renamed to the mapped value.
   *
   * <p>Children are rewritten before their parent. The input tree is not
   * modified.
   */
  public static Tree substitute(
      Tree tree, int nodeId, Map<String, String> mapping) {
    if (mapping.isEmpty()) {
      return tree;
    }
    final Tree.Builder builder = tree.toBuilder();
    substitute(builder, tree, nodeId, mapping);
    return builder.build();
  }

  private static void substitute(
      Tree.Builder builder, Tree tree, int nodeId,
      Map<String, String> mapping) {
    final Node node = tree.node(nodeId);
    for (int child : node.children) {
      substitute(builder, tree, child, mapping);
    }
    boolean changed = false;
    final ImmutableList.Builder<Param> params = ImmutableList.builder();
    for (Param param : node.parameters) {
      final String name = mapping.get(param.name);
      if (name != null) {
        params.add(param.withName(name));
        changed = true;
      } else {
        params.add(param);
      }
    }
    if (changed) {
      builder.update(nodeId, n -> n.withParameters(params.build()));
    }
  }

  /**
   * Returns the n-ary Cartesian product of some lists.
   *
   * <p>Tuples are in nested-loop order: the last list varies fastest. The
   * product of no lists is a single empty tuple; if any list is empty, the
   * product is empty. The result is computed lazily, so iterating over a
   * prefix of it does not enumerate the rest.
   *
   * @throws IllegalArgumentException if the product has more than {@link
   *     Integer#MAX_VALUE} tuples
   */
  public static <E> List<List<E>> cartesianProduct(
      List<? extends List<? extends E>> lists) {
    return Lists.cartesianProduct(lists);
  }

  /** Returns the number of tuples in a Cartesian product, saturating. */
  public static long productSize(List<? extends List<?>> lists) {
    long size = 1;
    for (List<?> list : lists) {
      size *= list.size();
      if (size == 0 || size > Integer.MAX_VALUE) {
        return size;
      }
    }
    return size;
  }
}

// End Grounding.java
