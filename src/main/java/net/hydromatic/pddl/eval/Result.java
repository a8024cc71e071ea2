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

import java.util.Objects;

/**
 * Outcome of evaluating a node: (success, truth, value).
 *
 * <p>{@link #success} is false if the node could not be evaluated, for
 * example because a function is undefined or a divisor is zero. {@link
 * #truth} and {@link #value} are meaningful only if {@link #success} is true.
 * A false {@link #truth} is a normal logical outcome, not an error.
 */
public final class Result {
  /** Evaluation failed. */
  public static final Result FAILURE = new Result(false, false, 0D);
  public static final Result TRUE = new Result(true, true, 0D);
  public static final Result FALSE = new Result(true, false, 0D);

  public final boolean success;
  public final boolean truth;
  public final double value;

  private Result(boolean success, boolean truth, double value) {
    this.success = success;
    this.truth = truth;
    this.value = value;
  }

  public static Result of(boolean success, boolean truth, double value) {
    if (value == 0D) {
      if (success) {
        return truth ? TRUE : FALSE;
      } else if (!truth) {
        return FAILURE;
      }
    }
    return new Result(success, truth, value);
  }

  /** Creates a successful logical result. */
  public static Result truth(boolean truth) {
    return truth ? TRUE : FALSE;
  }

  /** Creates a successful numeric result. */
  public static Result value(double value) {
    return of(true, false, value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(success, truth, value);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Result
            && success == ((Result) o).success
            && truth == ((Result) o).truth
            && Double.compare(value, ((Result) o).value) == 0;
  }

  @Override
  public String toString() {
    return "(" + success + ", " + truth + ", " + value + ")";
  }
}

// End Result.java
