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
 * The result of an instruction. Values are numbered in creation order within their graph and are
 * only used by instructions in the same graph.
 *
 * <p>A <i>non-local</i> value (printed with a leading {@code "!"}) is known never to be observed
 * on a live path: it was created while the builder's cursor was unreachable, or is the result of a
 * jump expression or of a call that never completes normally.
 */
public final class Value {
  public final int index;
  public final boolean nonLocal;

  /** The instruction that produced this value; set when that instruction is emitted. */
  Instruction producer;

  /**
   * If this value is known to be a lambda literal or local function, the Graph for its body;
   * otherwise null.
   */
  private final @Nullable Graph callable;

  Value(int index, boolean nonLocal, @Nullable Graph callable) {
    this.index = index;
    this.nonLocal = nonLocal;
    this.callable = callable;
  }

  public Instruction producer() {
    return producer;
  }

  public @Nullable Graph callable() {
    return callable;
  }

  @Override
  public String toString() {
    return (nonLocal ? "!<v" : "<v") + index + ">";
  }
}
