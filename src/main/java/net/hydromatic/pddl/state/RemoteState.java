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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.pddl.tree.Param;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * State backend that forwards every operation to a {@link ProblemClient}.
 *
 * <p>Each call may block. Two evaluations that use the same remote state
 * concurrently are not isolated from each other.
 */
public class RemoteState implements StateBackend {
  private final ProblemClient client;

  public RemoteState(ProblemClient client) {
    this.client = requireNonNull(client);
  }

  @Override
  public boolean exists(Predicate predicate) {
    return client.existPredicate(predicate);
  }

  @Override
  public boolean add(Predicate predicate) {
    return client.addPredicate(predicate);
  }

  @Override
  public boolean remove(Predicate predicate) {
    return client.removePredicate(predicate);
  }

  @Override
  public @Nullable Double readFunction(Function function) {
    final Function f = client.getFunction(function.reference());
    return f == null ? null : f.value;
  }

  @Override
  public boolean writeFunction(Function assignment) {
    return client.updateFunction(assignment);
  }

  /** Returns every object known to the problem. */
  @Override
  public List<String> objects() {
    final ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Param instance : client.getInstances()) {
      names.add(instance.name);
    }
    return names.build();
  }
}

// End RemoteState.java
