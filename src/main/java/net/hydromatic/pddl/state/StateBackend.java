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
package net.hydromatic.pddl.state;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * World state against which conditions are checked and effects applied.
 *
 * <p>{@link LocalState} holds a snapshot in memory; {@link RemoteState}
 * forwards each operation to a problem-state service.
 */
public interface StateBackend {
  /** Returns whether a predicate holds. */
  boolean exists(Predicate predicate);

  /**
   * Asserts a predicate. Adding a predicate that already holds does nothing.
   * Returns whether the state was updated successfully.
   */
  boolean add(Predicate predicate);

  /**
   * Retracts a predicate. Removing a predicate that does not hold does
   * nothing. Returns whether the state was updated successfully.
   */
  boolean remove(Predicate predicate);

  /**
   * Returns the current value of a function, or null if it is not defined.
   * The {@link Function#value} of the argument is ignored.
   */
  @Nullable Double readFunction(Function function);

  /**
   * Sets the value of a function. Returns false if the function could not
   * be updated.
   */
  boolean writeFunction(Function assignment);

  /** Returns the names of the objects that a quantified variable may take. */
  List<String> objects();
}

// End StateBackend.java
