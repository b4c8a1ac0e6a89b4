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

package org.pseudoflow.compiler;

/**
 * Thrown when a tree cannot be translated to a graph, e.g. because a return has no valid target or
 * a {@code break} is not inside a loop.
 */
public class BuildError extends RuntimeException {
  public final String msg;
  public final int lineNum;
  public final int column;

  public BuildError(String msg, int lineNum, int column) {
    super(msg);
    this.msg = msg;
    this.lineNum = lineNum;
    this.column = column;
  }

  @Override
  public String getMessage() {
    return String.format("%s (%s:%s)", msg, lineNum, column);
  }
}
