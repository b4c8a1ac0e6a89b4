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

/** Instructions that operate on local variable slots. */
public abstract class VariableAccess extends Instruction {
  public final String name;

  private VariableAccess(String name) {
    this.name = name;
  }

  /** Declares a variable or parameter, e.g. {@code v(val y)} or {@code v(x)}. */
  public static final class Declare extends VariableAccess {
    /** "val", "var", or null for a parameter. */
    public final @Nullable String keyword;

    public Declare(@Nullable String keyword, String name) {
      super(name);
      this.keyword = keyword;
    }

    @Override
    public Kind kind() {
      return Kind.DECLARE;
    }

    @Override
    public String text() {
      return (keyword == null) ? "v(" + name + ")" : "v(" + keyword + " " + name + ")";
    }
  }

  /** Stores a value in a variable, e.g. {@code w(y|<v2>)}. */
  public static final class Write extends VariableAccess {
    public final Value value;

    public Write(String name, Value value) {
      super(name);
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.WRITE;
    }

    @Override
    public List<Value> inputs() {
      return ImmutableList.of(value);
    }

    @Override
    public String text() {
      return "w(" + name + "|" + value + ")";
    }
  }

  /**
   * Reads a variable; also used for literals, callable references, and lambda literals, in which
   * case {@link #name} is their source text (or the lambda's graph name).
   */
  public static final class Read extends VariableAccess {
    private final Value result;

    public Read(String name, Value result) {
      super(name);
      this.result = result;
    }

    @Override
    public Kind kind() {
      return Kind.READ;
    }

    @Override
    public Value result() {
      return result;
    }

    @Override
    public String text() {
      return "r(" + name + ")";
    }
  }
}
