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
import net.hydromatic.pddl.tree.Param;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Connection to the service that owns the persistent problem state.
 *
 * <p>The transport is up to the implementation. Any method may block on
 * network I/O. Failures are reported through return values, not exceptions.
 */
public interface ProblemClient {
  boolean existPredicate(Predicate predicate);

  boolean addPredicate(Predicate predicate);

  boolean removePredicate(Predicate predicate);

  /**
   * Returns a function, looked up by its reference such as {@code (battery
   * r1)}, or null if the service does not know it.
   */
  @Nullable Function getFunction(String reference);

  /** Sets a function to the value it carries. */
  boolean updateFunction(Function function);

  /** Returns the objects of the problem, with their types. */
  List<Param> getInstances();
}

// End ProblemClient.java
