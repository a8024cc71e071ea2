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
package net.hydromatic.pddl;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.pddl.Matchers.isNode;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import net.hydromatic.pddl.ast.Cond;
import net.hydromatic.pddl.parse.ConditionParser;
import net.hydromatic.pddl.parse.Scope;
import net.hydromatic.pddl.tree.ExprOp;
import net.hydromatic.pddl.tree.Node;
import net.hydromatic.pddl.tree.NodeKind;
import net.hydromatic.pddl.tree.Param;
import net.hydromatic.pddl.tree.Tree;
import net.hydromatic.pddl.tree.Trees;
import net.hydromatic.pddl.util.Grounding;
import org.junit.jupiter.api.Test;

/** Tests {@link Tree}, lowering of conditions, and {@link Grounding}. */
public class TreeTest {
  @Test
  void testLowerExists() {
    final Tree tree =
        ConditionParser.toTree("(exists (?x - robot) (robot_at ?x kitchen))",
            new Scope(), ImmutableList.of());
    assertThat(tree.nodes, hasSize(2));
    assertThat(tree.node(0),
        isNode(NodeKind.EXISTS, "0:EXISTS [?0] -> [1]"));
    assertThat(tree.node(0).parameters.get(0),
        is(new Param("?0", "robot")));
    assertThat(tree.node(1),
        isNode(NodeKind.PREDICATE, "1:PREDICATE robot_at [?0, kitchen]"));
    assertThat(Trees.toString(tree),
        is("(exists (?0) (robot_at ?0 kitchen))"));
  }

  /** Variables of the enclosing action are replaced by its arguments;
   * quantified variables stay symbolic. */
  @Test
  void testLowerWithReplacement() {
    final Scope scope = Scope.of("?r", "?from");
    final Tree tree =
        ConditionParser.toTree("(and (robot_at ?r ?from)"
                + " (exists (?to) (connected ?from ?to)))",
            scope, ImmutableList.of("r2d2", "kitchen"));
    assertThat(Trees.toString(tree),
        is("(and (robot_at r2d2 kitchen)"
            + "(exists (?2) (connected kitchen ?2)))"));
    assertThat(tree.node(0).children, is(ImmutableList.of(1, 2)));
    assertThat(tree.node(2).children, is(ImmutableList.of(3)));
  }

  @Test
  void testLowerEmptyExistsBody() {
    final Tree tree =
        ConditionParser.toTree("(exists (?x) ())", new Scope(),
            ImmutableList.of());
    assertThat(tree.nodes, hasSize(2));
    assertThat(tree.node(1), isNode(NodeKind.AND, "1:AND"));
    assertThat(tree.node(0).children, is(ImmutableList.of(1)));
  }

  @Test
  void testLowerAppendsToExistingTree() {
    final Tree.Builder builder = Tree.builder();
    final Cond p = requireNonNull(ConditionParser.parse("(p a)"));
    final Cond q = requireNonNull(ConditionParser.parse("(not (q b))"));
    final Node n0 = p.lower(builder, ImmutableList.of());
    final Node n1 = q.lower(builder, ImmutableList.of());
    assertThat(n0.id, is(0));
    assertThat(n1.id, is(1));
    assertThat(n1.children, is(ImmutableList.of(2)));
    final Tree tree = builder.build();
    assertThat(Trees.toString(tree, 1), is("(not (q b))"));
  }

  @Test
  void testEmptyConditionLowersToEmptyTree() {
    final Tree tree =
        ConditionParser.toTree("()", new Scope(), ImmutableList.of());
    assertThat(tree.isEmpty(), is(true));
    assertThat(tree, sameInstance(Tree.empty()));
    assertThat(Trees.toString(tree), is(""));
  }

  @Test
  void testToString() {
    final Scope scope = Scope.of("?r");
    final List<String> replace = ImmutableList.of("r1");
    assertThat(
        Trees.toString(
            ConditionParser.toTree(
                "(and (p a) (not (q b)) (or (> (battery ?r) 10) (= ?r r2)))",
                scope, replace)),
        is("(and (p a)(not (q b))(or (> (battery r1) 10.0)(= r1 r2)))"));
    assertThat(
        Trees.toString(
            ConditionParser.toTree("(increase (battery ?r) (* 2 1.5))",
                scope, replace)),
        is("(increase (battery r1) (* 2.0 1.5))"));
  }

  @Test
  void testBuilder() {
    final Tree.Builder builder = Tree.builder();
    assertThat(builder.nextId(), is(0));
    builder.add(Node.of(0, NodeKind.AND));
    builder.add(Node.number(1, 3D));
    builder.addChild(0, 1);
    assertThat(builder.get(0).children, is(ImmutableList.of(1)));
    assertThrows(IllegalArgumentException.class,
        () -> builder.add(Node.of(5, NodeKind.OR)));
    assertThrows(IllegalArgumentException.class,
        () -> builder.addChild(1, 1));
    // A child must follow its parent, so no cycle can form
    assertThrows(IllegalArgumentException.class,
        () -> builder.addChild(1, 0));
    assertThrows(IndexOutOfBoundsException.class,
        () -> builder.addChild(0, 2));

    // Operators are required exactly where the kind needs them
    assertThrows(IllegalArgumentException.class,
        () -> Node.of(0, NodeKind.EXPRESSION));
    assertThat(Node.expression(0, ExprOp.COMP_LT).exprOp,
        is(ExprOp.COMP_LT));
  }

  @Test
  void testTreeRejectsMisplacedNodes() {
    assertThrows(IllegalArgumentException.class,
        () -> Tree.of(ImmutableList.of(Node.of(1, NodeKind.AND))));
    assertThrows(IllegalArgumentException.class,
        () -> Tree.of(
            ImmutableList.of(
                Node.of(0, NodeKind.NOT).withChildren(ImmutableList.of(0)))));
    assertThrows(IllegalArgumentException.class,
        () -> Tree.of(
            ImmutableList.of(Node.of(0, NodeKind.AND),
                Node.of(1, NodeKind.NOT).withChildren(ImmutableList.of(0)))));
    assertThrows(IndexOutOfBoundsException.class,
        () -> Tree.of(
            ImmutableList.of(
                Node.of(0, NodeKind.NOT).withChildren(ImmutableList.of(4)))));
  }

  @Test
  void testSubstitute() {
    final Tree tree =
        ConditionParser.toTree("(and (p ?x) (q ?x))", Scope.of("?x"),
            ImmutableList.of());
    final Tree grounded =
        Grounding.substitute(tree, 1, ImmutableMap.of("?0", "a"));
    assertThat(Trees.toString(grounded), is("(and (p a)(q ?0))"));
    // The input is not modified
    assertThat(Trees.toString(tree), is("(and (p ?0)(q ?0))"));

    final Tree all =
        Grounding.substitute(tree, 0, ImmutableMap.of("?0", "b"));
    assertThat(Trees.toString(all), is("(and (p b)(q b))"));
    assertThat(Grounding.substitute(tree, 0, ImmutableMap.of()),
        sameInstance(tree));
  }

  @Test
  void testSubstituteRewritesQuantifier() {
    final Tree tree =
        ConditionParser.toTree("(exists (?x ?y) (r ?x ?y))", new Scope(),
            ImmutableList.of());
    final Tree grounded =
        Grounding.substitute(tree, 0,
            ImmutableMap.of("?0", "a", "?1", "b"));
    assertThat(Trees.toString(grounded), is("(exists (a b) (r a b))"));
  }

  @Test
  void testCartesianProduct() {
    assertThat(
        Grounding.cartesianProduct(
            ImmutableList.of(ImmutableList.of("a", "b"),
                ImmutableList.of("x", "y"))),
        hasToString("[[a, x], [a, y], [b, x], [b, y]]"));

    final List<List<String>> twelve =
        Grounding.cartesianProduct(
            ImmutableList.of(ImmutableList.of("a", "b", "c"),
                ImmutableList.of("w", "x", "y", "z")));
    assertThat(twelve, hasSize(12));
    assertThat(twelve.get(5), contains("b", "x"));

    // The product of no lists is one empty tuple
    final List<List<String>> none =
        Grounding.cartesianProduct(ImmutableList.<List<String>>of());
    assertThat(none, hasSize(1));
    assertThat(none.get(0), empty());

    // If any list is empty, so is the product
    assertThat(
        Grounding.cartesianProduct(
            ImmutableList.of(ImmutableList.of("a"),
                ImmutableList.<String>of())),
        empty());

    assertThat(
        Grounding.productSize(
            ImmutableList.of(ImmutableList.of(1, 2, 3),
                ImmutableList.of(1, 2, 3, 4))),
        is(12L));
  }
}

// End TreeTest.java
