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
import org.jspecify.annotations.Nullable;

/** Throws an exception, transferring control to the graph's ERROR instruction. */
public final class ThrowInstruction extends Instruction {
  public final Value exception;
  private final Label errorLabel;
  private final @Nullable Value result;

  public ThrowInstruction(Value exception, Label errorLabel, @Nullable Value result) {
    this.exception = exception;
    this.errorLabel = errorLabel;
    this.result = result;
  }

  @Override
  public Kind kind() {
    return Kind.THROW;
  }

  @Override
  public List<Value> inputs() {
    return ImmutableList.of(exception);
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
    return errorLabel;
  }

  @Override
  public String text() {
    return "throw(" + exception + ")";
  }
}
