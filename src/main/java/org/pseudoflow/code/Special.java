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

/** The canonical START, END, ERROR, and SINK instructions that every Graph has. */
public final class Special extends Instruction {
  private final Kind kind;

  Special(Kind kind) {
    assert kind == Kind.START || kind == Kind.END || kind == Kind.ERROR || kind == Kind.SINK;
    this.kind = kind;
  }

  @Override
  public Kind kind() {
    return kind;
  }

  @Override
  public String text() {
    return "<" + kind + ">";
  }

  @Override
  boolean fallsThrough() {
    return kind == Kind.START;
  }
}
