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

import net.hydromatic.pddl.eval.Result;
import net.hydromatic.pddl.state.Predicate;
import net.hydromatic.pddl.tree.Node;
import net.hydromatic.pddl.tree.NodeKind;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;

/** Matchers for use in unit tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches a result that succeeded with a given truth value. */
  static Matcher<Result> isResult(boolean success, boolean truth) {
    return new TypeSafeMatcher<Result>() {
      @Override
      protected boolean matchesSafely(Result result) {
        return result.success == success && result.truth == truth;
      }

      @Override
      public void describeTo(Description description) {
        description.appendText("result with success " + success
            + " and truth " + truth);
      }
    };
  }

  /** Matches a successful numeric result. */
  static Matcher<Result> hasValue(double value) {
    return new CustomTypeSafeMatcher<Result>("successful result " + value) {
      @Override
      protected boolean matchesSafely(Result result) {
        return result.success && Math.abs(result.value - value) < 1e-9;
      }
    };
  }

  /** Matches a failed result. */
  static Matcher<Result> isFailure() {
    return new CustomTypeSafeMatcher<Result>("failed result") {
      @Override
      protected boolean matchesSafely(Result result) {
        return !result.success;
      }
    };
  }

  /** Matches a node by its kind and string representation. */
  static Matcher<Node> isNode(NodeKind kind, String expected) {
    return new CustomTypeSafeMatcher<Node>(kind + " node " + expected) {
      @Override
      protected boolean matchesSafely(Node node) {
        return node.kind == kind && node.toString().equals(expected);
      }
    };
  }

  /** Creates a predicate from a name and arguments. */
  static Predicate fact(String name, String... args) {
    return Predicate.of(name, args);
  }
}

// End Matchers.java
