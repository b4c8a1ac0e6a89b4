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
import org.jspecify.annotations.Nullable;

/**
 * A named join point within a Graph. Until it is bound a Label acts as a placeholder target for
 * links; once bound it resolves to the next instruction emitted, and later links to it go directly
 * to that instruction.
 *
 * <p>Numbered labels ({@code L0}, {@code L1}, ...) are created by {@link GraphBuilder#newLabel};
 * {@code L0} is always the graph's START and {@code L1} its END. The ERROR and SINK instructions
 * have the unnumbered labels {@code error} and {@code sink}.
 */
public final class Label extends LinkTarget {
  public final String name;

  /** A short description of the join point, or null. */
  public final @Nullable String description;

  private Instruction instruction;

  Label(String name, @Nullable String description) {
    this.name = name;
    this.description = description;
  }

  public boolean isResolved() {
    return instruction != null;
  }

  /** The instruction this label was bound to; null until it is resolved. */
  public @Nullable Instruction instruction() {
    return instruction;
  }

  void resolve(Instruction instruction) {
    Preconditions.checkState(this.instruction == null, "%s already resolved", this);
    assert !hasInLink();
    this.instruction = instruction;
    instruction.labels.add(this);
  }

  /** Returns the label line printed before its instruction, e.g. {@code "L2 [after if]:"}. */
  public String heading() {
    return (description == null) ? name + ":" : name + " [" + description + "]:";
  }

  @Override
  public String toString() {
    return name;
  }
}
