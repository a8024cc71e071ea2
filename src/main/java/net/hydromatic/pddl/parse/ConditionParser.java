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
package net.hydromatic.pddl.parse;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Doubles;
import java.util.List;
import net.hydromatic.pddl.ast.Cond;
import net.hydromatic.pddl.tree.ExprOp;
import net.hydromatic.pddl.tree.ModifierOp;
import net.hydromatic.pddl.tree.Tree;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Recursive-descent parser for PDDL conditions and effects.
 *
 * <p>After the opening parenthesis, the next keyword decides which variant
 * of {@link Cond} to build: {@code and}, {@code or}, {@code not}, {@code
 * exists}, a comparison ({@code >=}, {@code >}, {@code <=}, {@code <}, {@code
 * =}), a function modifier ({@code assign}, {@code increase}, {@code
 * decrease}, {@code scale-up}, {@code scale-down}), or otherwise the name of
 * a predicate.
 *
 * <p>Variables are resolved against a {@link Scope}. A quantifier parses its
 * body in an extended copy of the scope, so the bindings it introduces are
 * never visible to sibling conditions.
 */
public class ConditionParser {
  private ConditionParser() {}

  /** Parses a condition that refers to no variables. */
  public static @Nullable Cond parse(String text) {
    return parse(text, new Scope());
  }

  /**
   * Parses a condition.
   *
   * @param text PDDL text, for example {@code (and (p ?x) (not (q ?x)))}
   * @param scope Variables that the condition may refer to
   * @return Condition, or null if the text is {@code ()}
   * @throws PddlParseException if the text is not a valid condition
   */
  public static @Nullable Cond parse(String text, Scope scope) {
    final PddlReader reader = new PddlReader(text);
    final Cond cond = optionalCondition(reader, scope);
    if (!reader.atEnd()) {
      throw reader.error("unexpected text after condition");
    }
    return cond;
  }

  /**
   * Parses a condition and lowers it into a new tree. The empty condition
   * {@code ()} yields the empty tree.
   */
  public static Tree toTree(String text, Scope scope, List<String> replace) {
    final Cond cond = parse(text, scope);
    return cond == null ? Tree.empty() : cond.toTree(replace);
  }

  /** Parses a condition, or {@code ()}. */
  public static @Nullable Cond optionalCondition(
      PddlReader reader, Scope scope) {
    reader.expect("(");
    if (reader.peekChar() == ')') {
      reader.token();
      return null;
    }
    return conditionBody(reader, scope);
  }

  /** Parses a condition; {@code ()} is not allowed. */
  public static Cond condition(PddlReader reader, Scope scope) {
    reader.expect("(");
    return conditionBody(reader, scope);
  }

  /** Parses the rest of a condition whose "(" has been read. */
  private static Cond conditionBody(PddlReader reader, Scope scope) {
    final Pos pos = reader.pos();
    final String keyword = reader.symbol();
    switch (keyword) {
      case "and":
        return new Cond.And(conditions(reader, scope));
      case "or":
        return new Cond.Or(conditions(reader, scope));
      case "not":
        final Cond cond = condition(reader, scope);
        reader.expect(")");
        return new Cond.Not(cond);
      case "exists":
        return exists(reader, scope);
      case "forall":
      case "when":
      case "imply":
      case "preference":
      case "at":
      case "over":
        throw new PddlParseException(
            "unsupported condition '" + keyword + "'", pos);
      default:
        break;
    }
    final ExprOp exprOp = ExprOp.lookup(keyword);
    if (exprOp != null) {
      if (!exprOp.comparison) {
        throw new PddlParseException(
            "arithmetic '" + keyword + "' is not a condition", pos);
      }
      final Cond left = term(reader, scope);
      final Cond right = term(reader, scope);
      reader.expect(")");
      return new Cond.Comparison(exprOp, left, right);
    }
    final ModifierOp modifierOp = ModifierOp.lookup(keyword);
    if (modifierOp != null) {
      final Pos fnPos = reader.pos();
      final Cond function = term(reader, scope);
      if (!(function instanceof Cond.Fn)) {
        throw new PddlParseException(
            "'" + keyword + "' requires a function, found " + function, fnPos);
      }
      final Cond expr = term(reader, scope);
      reader.expect(")");
      return new Cond.Modifier(modifierOp, (Cond.Fn) function, expr);
    }
    return new Cond.Atom(keyword, arguments(reader, scope));
  }

  /** Parses conditions up to and including ")". */
  private static List<Cond> conditions(PddlReader reader, Scope scope) {
    final ImmutableList.Builder<Cond> conds = ImmutableList.builder();
    while (reader.peekChar() != ')') {
      if (reader.atEnd()) {
        throw reader.error("expected ')' but reached end of input");
      }
      conds.add(condition(reader, scope));
    }
    reader.expect(")");
    return conds.build();
  }

  /**
   * Parses the rest of {@code ( exists ( <typed-variables> ) <condition> )}.
   *
   * <p>The quantified variables are appended to a copy of {@code scope}, so
   * their slots follow those of the enclosing scope.
   */
  private static Cond exists(PddlReader reader, Scope scope) {
    reader.expect("(");
    final Scope declared = reader.typedList(true);
    final Scope inner = scope.extend(declared);
    final ImmutableList.Builder<Cond.Var> vars = ImmutableList.builder();
    for (int i = 0; i < declared.size(); i++) {
      vars.add(
          new Cond.Var(scope.size() + i, declared.name(i), declared.type(i)));
    }
    final Cond body = optionalCondition(reader, inner);
    reader.expect(")");
    return new Cond.Exists(vars.build(), body);
  }

  /** Parses predicate or function arguments up to and including ")". */
  private static List<Cond.Term> arguments(PddlReader reader, Scope scope) {
    final ImmutableList.Builder<Cond.Term> args = ImmutableList.builder();
    for (;;) {
      final Pos pos = reader.pos();
      final String token = reader.token();
      switch (token) {
        case ")":
          return args.build();
        case "(":
          throw new PddlParseException("unexpected '(' in arguments", pos);
        default:
          args.add(symbolicTerm(token, pos, scope));
      }
    }
  }

  /** Converts a token to a variable reference or a constant. */
  private static Cond.Term symbolicTerm(String token, Pos pos, Scope scope) {
    if (token.startsWith("?")) {
      final int slot = scope.indexOf(token);
      if (slot < 0) {
        throw new PddlParseException("unknown variable '" + token + "'", pos);
      }
      return new Cond.Var(slot, token, scope.type(slot));
    }
    return new Cond.Const(token);
  }

  /**
   * Parses a term: a number, a variable, a constant, a function such as
   * {@code (battery ?r)}, or arithmetic such as {@code (* 2 (battery ?r))}.
   */
  public static Cond term(PddlReader reader, Scope scope) {
    final Pos pos = reader.pos();
    final String token = reader.token();
    switch (token) {
      case ")":
        throw new PddlParseException("expected term, found ')'", pos);
      case "(":
        final Pos namePos = reader.pos();
        final String name = reader.symbol();
        final ExprOp op = ExprOp.lookup(name);
        if (op == null) {
          return new Cond.Fn(name, arguments(reader, scope));
        }
        if (op.comparison) {
          throw new PddlParseException(
              "comparison '" + name + "' is not a term", namePos);
        }
        final Cond left = term(reader, scope);
        final Cond right = term(reader, scope);
        reader.expect(")");
        return new Cond.Arith(op, left, right);
      default:
        final Double value = Doubles.tryParse(token);
        if (value != null) {
          return new Cond.Num(value);
        }
        return symbolicTerm(token, pos, scope);
    }
  }
}

// End ConditionParser.java
