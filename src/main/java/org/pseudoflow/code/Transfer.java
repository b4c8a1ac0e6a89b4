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
 * Records a non-local return: control leaves {@link #source} at {@link #ret} and arrives at {@link
 * #label} (the exit) of {@link #target}, carrying {@link #value}.
 */
public record Transfer(
    Graph source, ReturnInstruction ret, @Nullable Value value, Graph target, Label label) {

  @Override
  public String toString() {
    return source.name + ":" + ret.ref() + " → " + label.name + "@" + target.name;
  }
}
