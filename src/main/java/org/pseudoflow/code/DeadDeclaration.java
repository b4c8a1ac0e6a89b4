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

/**
 * Stands for a lambda literal or local function declaration as a statement, which has no
 * executable effect; e.g. {@code d(fun f(x) = x)}. It always follows the jump that skips the
 * declaration, so it is never reachable.
 */
public final class DeadDeclaration extends Instruction {
  public final String source;

  public DeadDeclaration(String source) {
    this.source = source;
  }

  @Override
  public Kind kind() {
    return Kind.DECLARATION_DEAD;
  }

  @Override
  public String text() {
    return "d(" + source + ")";
  }
}
