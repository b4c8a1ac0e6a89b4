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

/**
 * A conditional jump: {@code jt} jumps to its label if the test succeeds, {@code jf} if it fails;
 * otherwise execution continues with the next instruction. Its outlinks are always ordered
 * (fallthrough, jump).
 */
public final class Branch extends Instruction {
  public enum Test {
    /** The tested value is true. */
    BOOLEAN,
    /** The tested value is not null. */
    NON_NULL
  }

  /** True for {@code jt}, false for {@code jf}. */
  public final boolean jumpIfTrue;

  public final Label target;
  public final Value tested;
  public final Test test;
  private final @Nullable Value carried;

  public Branch(
      boolean jumpIfTrue, Label target, Value tested, Test test, @Nullable Value carried) {
    this.jumpIfTrue = jumpIfTrue;
    this.target = target;
    this.tested = tested;
    this.test = test;
    this.carried = carried;
  }

  @Override
  public Kind kind() {
    return jumpIfTrue ? Kind.BRANCH_TRUE : Kind.BRANCH_FALSE;
  }

  @Override
  public List<Value> inputs() {
    return ImmutableList.of(tested);
  }

  @Override
  @Nullable Label jumpLabel() {
    return target;
  }

  @Override
  Link.Kind fallthroughKind() {
    return jumpIfTrue ? Link.Kind.FALSE : Link.Kind.TRUE;
  }

  @Override
  Link.Kind jumpKind() {
    return jumpIfTrue ? Link.Kind.TRUE : Link.Kind.FALSE;
  }

  @Override
  @Nullable Value jumpValue() {
    return carried;
  }

  @Override
  public String text() {
    String condition = (test == Test.NON_NULL) ? tested + " != null" : tested.toString();
    return (jumpIfTrue ? "jt(" : "jf(") + target.name + "|" + condition + ")";
  }
}
