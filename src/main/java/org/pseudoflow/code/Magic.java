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
 * Produces a value that has no counterpart in the source: a parameter's initial value, or an
 * interpolated string.
 */
public final class Magic extends Instruction {
  public enum MagicKind {
    /** The initial value of a parameter; the operand is the parameter name. */
    FAKE_INITIALIZER,
    /** The result of a string template; the inputs are its interpolated parts. */
    STRING_TEMPLATE
  }

  public final MagicKind magicKind;
  private final String operand;
  private final ImmutableList<Value> inputs;
  private final Value result;

  private Magic(MagicKind magicKind, String operand, List<Value> inputs, Value result) {
    this.magicKind = magicKind;
    this.operand = operand;
    this.inputs = ImmutableList.copyOf(inputs);
    this.result = result;
  }

  public static Magic fakeInitializer(String param, Value result) {
    return new Magic(MagicKind.FAKE_INITIALIZER, param, ImmutableList.of(), result);
  }

  public static Magic stringTemplate(List<Value> parts, Value result) {
    return new Magic(MagicKind.STRING_TEMPLATE, join(parts), parts, result);
  }

  @Override
  public Kind kind() {
    return Kind.MAGIC;
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
    return "magic[" + magicKind + "](" + operand + ")";
  }
}
