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
package net.hydromatic.pddl.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.pddl.tree.ExprOp;
import net.hydromatic.pddl.tree.ModifierOp;
import net.hydromatic.pddl.tree.Node;
import net.hydromatic.pddl.tree.NodeKind;
import net.hydromatic.pddl.tree.Param;
import net.hydromatic.pddl.tree.Tree;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Condition, or a term inside a condition.
 *
 * <p>The set of sub-classes is closed; {@link #kind} tells them apart. Every
 * variant can print itself as PDDL ({@link #unparse}) and lower itself into
 * the nodes of a {@link Tree} ({@link #lower}).
 *
 * <p>Variables are identified by their slot in the {@link
 * net.hydromatic.pddl.parse.Scope} that was in effect when the condition was
 * parsed.
 */
public abstract class Cond {
  public final CondKind kind;

  Cond(CondKind kind) {
    this.kind = requireNonNull(kind);
  }

  /** Converts this condition to indented PDDL text. */
  @Override
  public final String toString() {
    return unparse(new CondWriter(), 0).toString();
  }

  /**
   * Writes this condition at a given nesting level. Conditions start with
   * indentation; terms are written inline and ignore the level.
   */
  public abstract CondWriter unparse(CondWriter w, int level);

  /**
   * Appends this condition's nodes to a tree and returns its root node.
   *
   * <p>A variable whose slot is less than {@code replace.size()} becomes the
   * parameter {@code replace.get(slot)}; any other variable becomes the
   * placeholder {@code ?<slot>}.
   */
  public abstract Node lower(Tree.Builder tree, List<String> replace);

  /** Lowers this condition into a new tree. */
  public Tree toTree(List<String> replace) {
    final Tree.Builder builder = Tree.builder();
    lower(builder, replace);
    return builder.build();
  }

  /** Lowers this condition into a new tree, leaving variables unbound. */
  public Tree toTree() {
    return toTree(ImmutableList.of());
  }

  static Param resolve(int slot, String type, List<String> replace) {
    return slot < replace.size()
        ? new Param(replace.get(slot), type)
        : Param.unbound(slot, type);
  }

  /** Appends a node, lowers each operand, and links them as its children. */
  static Node lowerWithChildren(
      Tree.Builder tree, Node node, List<? extends Cond> operands,
      List<String> replace) {
    tree.add(node);
    for (Cond operand : operands) {
      final Node child = operand.lower(tree, replace);
      tree.addChild(node.id, child.id);
    }
    return tree.get(node.id);
  }

  /** Writes "( keyword", each operand on its own line, and ")". */
  static CondWriter unparseBlock(
      CondWriter w, int level, String keyword, List<? extends Cond> operands) {
    w.indent(level).append("( ").append(keyword);
    for (Cond operand : operands) {
      operand.unparse(w.newline(), level + 1);
    }
    return w.newline().indent(level).append(')');
  }

  /** Conjunction. */
  public static class And extends Cond {
    public final ImmutableList<Cond> conds;

    public And(List<? extends Cond> conds) {
      super(CondKind.AND);
      this.conds = ImmutableList.copyOf(conds);
    }

    @Override
    public CondWriter unparse(CondWriter w, int level) {
      return unparseBlock(w, level, "and", conds);
    }

    @Override
    public Node lower(Tree.Builder tree, List<String> replace) {
      return lowerWithChildren(
          tree, Node.of(tree.nextId(), NodeKind.AND), conds, replace);
    }
  }

  /** Disjunction. */
  public static class Or extends Cond {
    public final ImmutableList<Cond> conds;

    public Or(List<? extends Cond> conds) {
      super(CondKind.OR);
      this.conds = ImmutableList.copyOf(conds);
    }

    @Override
    public CondWriter unparse(CondWriter w, int level) {
      return unparseBlock(w, level, "or", conds);
    }

    @Override
    public Node lower(Tree.Builder tree, List<String> replace) {
      return lowerWithChildren(
          tree, Node.of(tree.nextId(), NodeKind.OR), conds, replace);
    }
  }

  /** Negation. */
  public static class Not extends Cond {
    public final Cond cond;

    public Not(Cond cond) {
      super(CondKind.NOT);
      this.cond = requireNonNull(cond);
    }

    @Override
    public CondWriter unparse(CondWriter w, int level) {
      return unparseBlock(w, level, "not", ImmutableList.of(cond));
    }

    @Override
    public Node lower(Tree.Builder tree, List<String> replace) {
      return lowerWithChildren(
          tree, Node.of(tree.nextId(), NodeKind.NOT), ImmutableList.of(cond),
          replace);
    }
  }

  /**
   * Existential quantifier, {@code ( exists ( ?x - type ... ) condition )}.
   *
   * <p>The quantified variables occupy the slots directly after those of the
   * enclosing scope. If the body was written {@code ()}, {@link #cond} is
   * null.
   */
  public static class Exists extends Cond {
    public final ImmutableList<Var> vars;
    public final @Nullable Cond cond;

    public Exists(List<Var> vars, @Nullable Cond cond) {
      super(CondKind.EXISTS);
      this.vars = ImmutableList.copyOf(vars);
      this.cond = cond;
    }

    @Override
    public CondWriter unparse(CondWriter w, int level) {
      w.indent(level).append("( exists (");
      for (Var var : vars) {
        w.append(' ').append(var.name).append(" - ").append(var.type);
      }
      w.append(" )").newline();
      if (cond != null) {
        cond.unparse(w, level + 1);
      } else {
        w.indent(level + 1).append("()");
      }
      return w.newline().indent(level).append(')');
    }

    /**
     * Appends an EXISTS node whose parameters are the quantified variables,
     * then the body, which becomes the node's only child. An empty body
     * lowers to an empty conjunction.
     */
    @Override
    public Node lower(Tree.Builder tree, List<String> replace) {
      final ImmutableList.Builder<Param> params = ImmutableList.builder();
      for (Var var : vars) {
        params.add(resolve(var.slot, var.type, replace));
      }
      final Node node =
          tree.add(
              Node.of(tree.nextId(), NodeKind.EXISTS)
                  .withParameters(params.build()));
      final Node child =
          cond != null
              ? cond.lower(tree, replace)
              : tree.add(Node.of(tree.nextId(), NodeKind.AND));
      return tree.addChild(node.id, child.id);
    }
  }

  /** Predicate applied to terms, e.g. {@code ( robot_at ?r kitchen )}. */
  public static class Atom extends Cond {
    public final String name;
    public final ImmutableList<Term> args;

    public Atom(String name, List<? extends Term> args) {
      super(CondKind.ATOM);
      this.name = requireNonNull(name);
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    public CondWriter unparse(CondWriter w, int level) {
      return unparseCall(w.indent(level), name, args);
    }

    @Override
    public Node lower(Tree.Builder tree, List<String> replace) {
      return tree.add(
          Node.of(tree.nextId(), NodeKind.PREDICATE)
              .withName(name)
              .withParameters(Term.params(args, replace)));
    }
  }

  static CondWriter unparseCall(
      CondWriter w, String name, List<? extends Cond> args) {
    w.append("( ").append(name);
    for (Cond arg : args) {
      arg.unparse(w.append(' '), 0);
    }
    return w.append(" )");
  }

  /** Numeric or symbolic comparison, e.g. {@code ( >= ( battery ?r ) 10 )}. */
  public static class Comparison extends Cond {
    public final ExprOp op;
    public final Cond left;
    public final Cond right;

    public Comparison(ExprOp op, Cond left, Cond right) {
      super(CondKind.COMPARISON);
      checkArgument(op.comparison, "not a comparison: %s", op);
      checkArgument(left.kind.isTerm() && right.kind.isTerm(),
          "operands must be terms");
      this.op = op;
      this.left = left;
      this.right = right;
    }

    @Override
    public CondWriter unparse(CondWriter w, int level) {
      return unparseCall(w.indent(level), op.symbol,
          ImmutableList.of(left, right));
    }

    @Override
    public Node lower(Tree.Builder tree, List<String> replace) {
      return lowerWithChildren(tree, Node.expression(tree.nextId(), op),
          ImmutableList.of(left, right), replace);
    }
  }

  /** Numeric effect, e.g. {@code ( increase ( battery ?r ) 10 )}. */
  public static class Modifier extends Cond {
    public final ModifierOp op;
    public final Fn function;
    public final Cond expr;

    public Modifier(ModifierOp op, Fn function, Cond expr) {
      super(CondKind.MODIFIER);
      checkArgument(expr.kind.isTerm(), "operand must be a term");
      this.op = requireNonNull(op);
      this.function = requireNonNull(function);
      this.expr = expr;
    }

    @Override
    public CondWriter unparse(CondWriter w, int level) {
      return unparseCall(w.indent(level), op.keyword,
          ImmutableList.of(function, expr));
    }

    @Override
    public Node lower(Tree.Builder tree, List<String> replace) {
      return lowerWithChildren(tree, Node.modifier(tree.nextId(), op),
          ImmutableList.of(function, expr), replace);
    }
  }

  /** Numeric literal. */
  public static class Num extends Cond {
    public final double value;

    public Num(double value) {
      super(CondKind.NUMBER);
      this.value = value;
    }

    @Override
    public CondWriter unparse(CondWriter w, int level) {
      return w.number(value);
    }

    @Override
    public Node lower(Tree.Builder tree, List<String> replace) {
      return tree.add(Node.number(tree.nextId(), value));
    }
  }

  /** Function term, e.g. {@code ( battery ?r )}. */
  public static class Fn extends Cond {
    public final String name;
    public final ImmutableList<Term> args;

    public Fn(String name, List<? extends Term> args) {
      super(CondKind.FUNCTION);
      this.name = requireNonNull(name);
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    public CondWriter unparse(CondWriter w, int level) {
      return unparseCall(w, name, args);
    }

    @Override
    public Node lower(Tree.Builder tree, List<String> replace) {
      return tree.add(
          Node.of(tree.nextId(), NodeKind.FUNCTION)
              .withName(name)
              .withParameters(Term.params(args, replace)));
    }
  }

  /** Arithmetic term, e.g. {@code ( * 2 ( distance ?a ?b ) )}. */
  public static class Arith extends Cond {
    public final ExprOp op;
    public final Cond left;
    public final Cond right;

    public Arith(ExprOp op, Cond left, Cond right) {
      super(CondKind.ARITHMETIC);
      checkArgument(!op.comparison, "not arithmetic: %s", op);
      checkArgument(left.kind.isTerm() && right.kind.isTerm(),
          "operands must be terms");
      this.op = op;
      this.left = left;
      this.right = right;
    }

    @Override
    public CondWriter unparse(CondWriter w, int level) {
      return unparseCall(w, op.symbol, ImmutableList.of(left, right));
    }

    @Override
    public Node lower(Tree.Builder tree, List<String> replace) {
      return lowerWithChildren(tree, Node.expression(tree.nextId(), op),
          ImmutableList.of(left, right), replace);
    }
  }

  /** Argument of a predicate or function: a variable or a constant. */
  public abstract static class Term extends Cond {
    Term(CondKind kind) {
      super(kind);
    }

    /** Returns the parameter that this term becomes in a tree node. */
    public abstract Param toParam(List<String> replace);

    static List<Param> params(List<Term> terms, List<String> replace) {
      final ImmutableList.Builder<Param> params = ImmutableList.builder();
      for (Term term : terms) {
        params.add(term.toParam(replace));
      }
      return params.build();
    }
  }

  /** Reference to a variable in scope, e.g. {@code ?r}. */
  public static class Var extends Term {
    public final int slot;
    public final String name;
    public final String type;

    public Var(int slot, String name, String type) {
      super(CondKind.VARIABLE);
      checkArgument(slot >= 0, "negative slot %s", slot);
      this.slot = slot;
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
    }

    @Override
    public CondWriter unparse(CondWriter w, int level) {
      return w.append(name);
    }

    @Override
    public Param toParam(List<String> replace) {
      return resolve(slot, type, replace);
    }

    @Override
    public Node lower(Tree.Builder tree, List<String> replace) {
      return tree.add(
          Node.of(tree.nextId(), NodeKind.PARAMETER)
              .withParameters(ImmutableList.of(toParam(replace))));
    }
  }

  /** Object or constant named in the condition, e.g. {@code kitchen}. */
  public static class Const extends Term {
    public final String name;

    public Const(String name) {
      super(CondKind.CONSTANT);
      checkArgument(!name.isEmpty(), "empty constant");
      this.name = name;
    }

    @Override
    public CondWriter unparse(CondWriter w, int level) {
      return w.append(name);
    }

    @Override
    public Param toParam(List<String> replace) {
      return Param.of(name);
    }

    @Override
    public Node lower(Tree.Builder tree, List<String> replace) {
      return tree.add(Node.of(tree.nextId(), NodeKind.CONSTANT).withName(name));
    }
  }
}

// End Cond.java
