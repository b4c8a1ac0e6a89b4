/*
 * Copyright 2025 The Pseudoflow Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.pseudoflow.code;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Combines the values arriving at a control-flow join. When reachable, its inputs are exactly the
 * values carried by its inlinks, in the same order.
 */
public final class Merge extends Instruction {
  private final ImmutableList<Value> inputs;
  private final Value result;

  public Merge(List<Value> inputs, Value result) {
    this.inputs = ImmutableList.copyOf(inputs);
    this.result = result;
  }

  @Override
  public Kind kind() {
    return Kind.MERGE;
  }

  @Override
  public List<Value> inputs() {
    return inputs;
  }

  @Override
  public Value result() {
    return result;
  }

  @Override
  public String text() {
    return "merge(" + join(inputs) + ")";
  }
}
