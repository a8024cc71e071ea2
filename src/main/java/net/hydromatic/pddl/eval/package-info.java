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

/**
 * Evaluation of PDDL conditions and effects.
 *
 * <p>A condition travels through three stages:
 *
 * <ul>
 *   <li>{@link net.hydromatic.pddl.parse.ConditionParser} reads PDDL text
 *       into a {@link net.hydromatic.pddl.ast.Cond}, resolving variables
 *       against a {@link net.hydromatic.pddl.parse.Scope}.
 *   <li>{@link net.hydromatic.pddl.ast.Cond#lower} appends the condition's
 *       nodes to a {@link net.hydromatic.pddl.tree.Tree}, replacing the
 *       variables of an action by the objects it is applied to.
 *   <li>{@link net.hydromatic.pddl.eval.Evaluator} checks the tree against,
 *       or applies it to, a {@link net.hydromatic.pddl.state.StateBackend}.
 * </ul>
 *
 * <h2>Results</h2>
 *
 * <p>Every node evaluates to a {@link net.hydromatic.pddl.eval.Result}. A
 * result that is not successful means the condition could not be evaluated:
 * an undefined function, a divisor close to zero, a malformed node, or a
 * backend that refused an update. A successful result whose truth is false
 * is an ordinary outcome, such as an unmet precondition.
 *
 * <h2>Example</h2>
 *
 * <pre>{@code
 * Scope scope = new Scope();
 * scope.append("?r", "robot");
 * Tree tree =
 *     ConditionParser.toTree("(exists (?to - room) (connected kitchen ?to))",
 *         scope, ImmutableList.of("r2d2"));
 * LocalState state =
 *     new LocalState(
 *         ImmutableList.of(Facts.predicate("(connected kitchen bedroom)")),
 *         ImmutableList.of());
 * boolean holds = new Evaluator(state).check(tree);  // true
 * }</pre>
 */
package net.hydromatic.pddl.eval;

// End package-info.java
