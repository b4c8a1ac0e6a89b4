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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Returns from a graph, optionally with a value: {@code ret(*|<v1>) L1}.
 *
 * <p>A non-local return ({@code ret(*|<v1>) L1@f}) targets the exit label of an enclosing graph;
 * it has no successor in its own graph, and is recorded as a {@link Transfer} instead.
 */
public final class ReturnInstruction extends Instruction {

  /** Where a return goes. There are two subclasses: {@link Local} and {@link NonLocal}. */
  public abstract static class Target {
    public final Label label;

    private Target(Label label) {
      this.label = label;
    }

    public abstract boolean isLocal();
  }

  /** A return to the exit of the graph containing the return. */
  public static final class Local extends Target {
    public Local(Label label) {
      super(label);
    }

    @Override
    public boolean isLocal() {
      return true;
    }

    @Override
    public String toString() {
      return label.name;
    }
  }

  /** A return from a lambda body to the exit of an enclosing graph. */
  public static final class NonLocal extends Target {
    public final Graph graph;

    public NonLocal(Graph graph) {
      super(graph.exitLabel());
      this.graph = graph;
    }

    @Override
    public boolean isLocal() {
      return false;
    }

    @Override
    public String toString() {
      return label.name + "@" + graph.name;
    }
  }

  public final Target target;
  public final @Nullable Value value;

  /**
   * True for the return the builder adds at the end of a lambda body; when unreachable it is the
   * lambda's shadow return rather than user code.
   */
  public final boolean implicit;

  private final @Nullable Value result;

  public ReturnInstruction(
      Target target, @Nullable Value value, boolean implicit, @Nullable Value result) {
    Preconditions.checkArgument(result == null || result.nonLocal);
    this.target = target;
    this.value = value;
    this.implicit = implicit;
    this.result = result;
  }

  @Override
  public Kind kind() {
    return Kind.RETURN;
  }

  @Override
  public List<Value> inputs() {
    return (value == null) ? ImmutableList.of() : ImmutableList.of(value);
  }

  @Override
  public @Nullable Value result() {
    return result;
  }

  @Override
  boolean fallsThrough() {
    return false;
  }

  @Override
  @Nullable Label jumpLabel() {
    return target.isLocal() ? target.label : null;
  }

  @Override
  public String text() {
    return (value == null) ? "ret " + target : "ret(*|" + value + ") " + target;
  }
}
