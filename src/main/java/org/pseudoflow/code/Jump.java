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

import org.jspecify.annotations.Nullable;

/**
 * An unconditional jump. If {@link #skipped} is non-null this jump steps over the declaration of a
 * lambda literal or local function whose body is that graph, e.g. {@code jmp(L2|anonymous_0)}.
 *
 * <p>A jump used as an expression (e.g. {@code break} as an elvis operand) has a non-local
 * result.
 */
public final class Jump extends Instruction {
  public final Label target;
  public final @Nullable Graph skipped;
  private final @Nullable Value carried;
  private final @Nullable Value result;

  public Jump(
      Label target,
      @Nullable Graph skipped,
      @Nullable Value carried,
      @Nullable Value result) {
    this.target = target;
    this.skipped = skipped;
    this.carried = carried;
    this.result = result;
  }

  public static Jump to(Label target) {
    return new Jump(target, null, null, null);
  }

  @Override
  public Kind kind() {
    return Kind.JUMP;
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
    return target;
  }

  @Override
  @Nullable Value jumpValue() {
    return carried;
  }

  @Override
  public String text() {
    return (skipped == null)
        ? "jmp(" + target.name + ")"
        : "jmp(" + target.name + "|" + skipped.name + ")";
  }
}
