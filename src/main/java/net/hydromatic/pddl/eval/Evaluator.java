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
package net.hydromatic.pddl.eval;

import static com.google.common.base.Preconditions.checkElementIndex;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.pddl.state.Function;
import net.hydromatic.pddl.state.Predicate;
import net.hydromatic.pddl.state.StateBackend;
import net.hydromatic.pddl.tree.ExprOp;
import net.hydromatic.pddl.tree.Node;
import net.hydromatic.pddl.tree.NodeKind;
import net.hydromatic.pddl.tree.Tree;
import net.hydromatic.pddl.tree.Trees;
import net.hydromatic.pddl.util.Grounding;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates condition trees against a {@link StateBackend}.
 *
 * <p>In query mode ({@code apply} false) the evaluator computes whether a
 * condition holds. In apply mode it commits effects: it asserts or retracts
 * predicates and updates functions.
 *
 * <p>Negation is passed down the recursion as a flag rather than applied to
 * a result. A {@code not} node flips the flag and evaluates its child; a
 * predicate reached with the flag set is tested for absence, or, in apply
 * mode, retracted.
 *
 * <p>An evaluator does no locking. Callers that check and then apply against
 * a shared backend must serialize at a higher level.
 */
public class Evaluator {
  private static final Logger LOGGER = LoggerFactory.getLogger(Evaluator.class);

  private final StateBackend state;
  private final double divisionEpsilon;
  private final int groundingLimit;

  /** Creates an evaluator with default properties. */
  public Evaluator(StateBackend state) {
    this(state, ImmutableMap.of());
  }

  /** Creates an evaluator. */
  public Evaluator(StateBackend state, Map<Prop, Object> props) {
    this.state = requireNonNull(state);
    this.divisionEpsilon = Prop.DIVISION_EPSILON.doubleValue(props);
    this.groundingLimit = Prop.GROUNDING_LIMIT.intValue(props);
  }

  /** Returns whether the condition rooted at node 0 holds. */
  public boolean check(Tree tree) {
    return check(tree, 0);
  }

  /** Returns whether the condition rooted at a given node holds. */
  public boolean check(Tree tree, int nodeId) {
    return evaluate(tree, false, nodeId).truth;
  }

  /**
   * Applies the effect rooted at node 0, and returns whether it was applied
   * successfully.
   */
  public boolean apply(Tree tree) {
    return apply(tree, 0);
  }

  /**
   * Applies the effect rooted at a given node, and returns whether it was
   * applied successfully.
   */
  public boolean apply(Tree tree, int nodeId) {
    return evaluate(tree, true, nodeId).success;
  }

  /** Evaluates a node, not negated. */
  public Result evaluate(Tree tree, boolean apply, int nodeId) {
    return evaluate(tree, apply, nodeId, false);
  }

  /**
   * Evaluates a node.
   *
   * <p>An empty tree is a condition that always holds.
   *
   * @param tree Tree
   * @param apply Whether to commit effects to the state
   * @param nodeId Id of the node to evaluate
   * @param negate Whether an odd number of {@code not} nodes encloses the
   *     node
   * @return Success, truth and numeric value
   */
  public Result evaluate(Tree tree, boolean apply, int nodeId, boolean negate) {
    if (tree.isEmpty()) {
      return Result.TRUE;
    }
    checkElementIndex(nodeId, tree.size());
    final Node node = tree.node(nodeId);
    switch (node.kind) {
      case AND:
        return and(tree, apply, node, negate);

      case OR:
        return or(tree, apply, node, negate);

      case NOT:
        if (node.children.size() != 1) {
          return malformed(tree, nodeId, "not requires one operand");
        }
        return evaluate(tree, apply, node.children.get(0), !negate);

      case PREDICATE:
        if (node.name.isEmpty()) {
          return malformed(tree, nodeId, "predicate has no name");
        }
        return predicate(apply, node, negate);

      case FUNCTION:
        if (node.name.isEmpty()) {
          return malformed(tree, nodeId, "function has no name");
        }
        final Double value = state.readFunction(Function.of(node));
        return value == null ? Result.FAILURE : Result.value(value);

      case EXPRESSION:
        return expression(tree, apply, node, negate);

      case FUNCTION_MODIFIER:
        return modifier(tree, apply, node, negate);

      case NUMBER:
        return Result.of(true, true, node.value);

      case CONSTANT:
        return Result.truth(!node.name.isEmpty());

      case PARAMETER:
        return Result.truth(
            !node.parameters.isEmpty() && !node.parameters.get(0).isUnbound());

      case EXISTS:
        return exists(tree, apply, node, negate);

      default:
        return malformed(tree, nodeId, "unknown node kind " + node.kind);
    }
  }

  /** Evaluates every operand, so that every failure is reported. */
  private Result and(Tree tree, boolean apply, Node node, boolean negate) {
    boolean success = true;
    boolean truth = true;
    for (int child : node.children) {
      final Result result = evaluate(tree, apply, child, negate);
      success = success && result.success;
      truth = truth && result.truth;
    }
    return Result.of(success, truth, 0D);
  }

  private Result or(Tree tree, boolean apply, Node node, boolean negate) {
    boolean success = true;
    boolean truth = false;
    for (int child : node.children) {
      final Result result = evaluate(tree, apply, child, negate);
      success = success && result.success;
      truth = truth || result.truth;
    }
    return Result.of(success, truth, 0D);
  }

  /**
   * Tests or changes a fact.
   *
   * <p>In apply mode, a negated predicate is retracted (and reported false)
   * and any other predicate is asserted. In query mode the result is true if
   * the fact holds, inverted if negated.
   */
  private Result predicate(boolean apply, Node node, boolean negate) {
    final Predicate predicate = Predicate.of(node);
    if (apply) {
      if (negate) {
        return Result.of(state.remove(predicate), false, 0D);
      }
      return Result.of(state.add(predicate), true, 0D);
    }
    return Result.truth(negate ^ state.exists(predicate));
  }

  private Result expression(
      Tree tree, boolean apply, Node node, boolean negate) {
    if (node.children.size() != 2) {
      return malformed(tree, node.id, "expression requires two operands");
    }
    final Result left = evaluate(tree, apply, node.children.get(0), negate);
    final Result right = evaluate(tree, apply, node.children.get(1), negate);
    if (!left.success || !right.success) {
      return Result.FAILURE;
    }
    final ExprOp op = requireNonNull(node.exprOp);
    switch (op) {
      case COMP_GE:
        return Result.truth(negate ^ (left.value >= right.value));
      case COMP_GT:
        return Result.truth(negate ^ (left.value > right.value));
      case COMP_LE:
        return Result.truth(negate ^ (left.value <= right.value));
      case COMP_LT:
        return Result.truth(negate ^ (left.value < right.value));
      case COMP_EQ:
        return equal(tree, node, negate, left, right);
      case ARITH_MULT:
        return Result.value(left.value * right.value);
      case ARITH_DIV:
        if (Math.abs(right.value) <= divisionEpsilon) {
          return Result.FAILURE;
        }
        return Result.value(left.value / right.value);
      case ARITH_ADD:
        return Result.value(left.value + right.value);
      case ARITH_SUB:
        return Result.value(left.value - right.value);
      default:
        return malformed(tree, node.id, "unknown operator " + op);
    }
  }

  /**
   * Evaluates {@code =}. Two symbols (constants or parameters) are equal if
   * their names are equal; two numbers are equal if their values are equal.
   * Other combinations are not supported.
   */
  private Result equal(
      Tree tree, Node node, boolean negate, Result left, Result right) {
    final Node c0 = tree.child(node.id, 0);
    final Node c1 = tree.child(node.id, 1);
    final String name0 = symbol(c0);
    final String name1 = symbol(c1);
    if (name0 != null && name1 != null) {
      return Result.truth(negate ^ name0.equals(name1));
    }
    if (c0.kind == NodeKind.NUMBER && c1.kind == NodeKind.NUMBER) {
      return Result.truth(negate ^ (left.value == right.value));
    }
    return malformed(tree, node.id,
        "cannot compare " + c0.kind + " with " + c1.kind);
  }

  /** Returns the name of a constant or parameter node, otherwise null. */
  private static @Nullable String symbol(Node node) {
    switch (node.kind) {
      case CONSTANT:
        return node.name;
      case PARAMETER:
        return node.parameters.isEmpty() ? null : node.parameters.get(0).name;
      default:
        return null;
    }
  }

  /**
   * Computes the new value of a function; in apply mode, also stores it. The
   * left operand is the function, the right operand the amount.
   */
  private Result modifier(
      Tree tree, boolean apply, Node node, boolean negate) {
    if (node.children.size() != 2) {
      return malformed(tree, node.id, "modifier requires two operands");
    }
    final Result left = evaluate(tree, apply, node.children.get(0), negate);
    final Result right = evaluate(tree, apply, node.children.get(1), negate);
    if (!left.success || !right.success) {
      return Result.FAILURE;
    }
    final double value;
    switch (requireNonNull(node.modifierOp)) {
      case ASSIGN:
        value = right.value;
        break;
      case INCREASE:
        value = left.value + right.value;
        break;
      case DECREASE:
        value = left.value - right.value;
        break;
      case SCALE_UP:
        value = left.value * right.value;
        break;
      case SCALE_DOWN:
        if (Math.abs(right.value) <= divisionEpsilon) {
          return Result.FAILURE;
        }
        value = left.value / right.value;
        break;
      default:
        return malformed(tree, node.id, "unknown modifier " + node.modifierOp);
    }
    if (!apply) {
      return Result.value(value);
    }
    final Node function = tree.child(node.id, 0);
    if (function.kind != NodeKind.FUNCTION) {
      return malformed(tree, node.id, "modifier target is not a function");
    }
    final boolean written =
        state.writeFunction(Function.of(function).withValue(value));
    return Result.of(written, false, value);
  }

  /**
   * Evaluates an existential quantifier by trying every assignment of
   * objects to its variables.
   *
   * <p>The candidates for each variable are {@link StateBackend#objects()};
   * assignments are tried in nested-loop order, the last variable varying
   * fastest. For each assignment, the body is grounded by substitution and
   * evaluated; the first result that is true is returned. If no assignment
   * satisfies the body, the result is a successful false.
   *
   * <p>The number of evaluations is the number of objects raised to the
   * number of variables. This cost is inherent in the semantics of the
   * quantifier; use {@link Prop#GROUNDING_LIMIT} to bound it.
   */
  private Result exists(Tree tree, boolean apply, Node node, boolean negate) {
    if (node.children.size() != 1) {
      return malformed(tree, node.id, "exists requires one body");
    }
    final List<String> objects = state.objects();
    final List<List<String>> candidates =
        Collections.nCopies(node.parameters.size(), objects);
    final long size = Grounding.productSize(candidates);
    LOGGER.debug("grounding {} variable(s) over {} object(s): {} tuple(s)",
        node.parameters.size(), objects.size(), size);
    if (size > Integer.MAX_VALUE) {
      return malformed(tree, node.id, "too many groundings: " + size);
    }
    final int body = node.children.get(0);
    int tried = 0;
    for (List<String> tuple : Grounding.cartesianProduct(candidates)) {
      if (groundingLimit >= 0 && tried >= groundingLimit) {
        LOGGER.warn("grounding limit {} reached without a witness for [{}]",
            groundingLimit, Trees.toString(tree, node.id));
        return Result.FAILURE;
      }
      ++tried;
      final Map<String, String> mapping = new HashMap<>();
      for (int i = 0; i < tuple.size(); i++) {
        mapping.put(node.parameters.get(i).name, tuple.get(i));
      }
      final Tree grounded = Grounding.substitute(tree, node.id, mapping);
      final Result result = evaluate(grounded, apply, body, negate);
      if (result.truth) {
        return result;
      }
    }
    return Result.FALSE;
  }

  /** Logs a node that cannot be evaluated, and returns failure. */
  private static Result malformed(Tree tree, int nodeId, String reason) {
    LOGGER.error("evaluate: error in expression [{}]: {}",
        Trees.toString(tree, nodeId), reason);
    return Result.FAILURE;
  }
}

// End Evaluator.java
