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
 * Calls a function, e.g. {@code call(<v0>.let|<v1>)}. A <i>null-propagating</i> call is the
 * guarded half of a safe call ({@code call?(...)}), only reached when the receiver is non-null.
 *
 * <p>{@link #callees} are the graphs of any lambda literals or local functions the call may enter;
 * they are linked only by reference. A call that is known never to complete normally has no
 * fallthrough.
 */
public final class CallInstruction extends Instruction {
  public final @Nullable Value receiver;
  public final String name;
  public final ImmutableList<Value> args;
  public final boolean nullPropagating;
  public final ImmutableList<Graph> callees;
  public final boolean completesNormally;
  private final Value result;

  public CallInstruction(
      @Nullable Value receiver,
      String name,
      List<Value> args,
      boolean nullPropagating,
      List<Graph> callees,
      boolean completesNormally,
      Value result) {
    this.receiver = receiver;
    this.name = name;
    this.args = ImmutableList.copyOf(args);
    this.nullPropagating = nullPropagating;
    this.callees = ImmutableList.copyOf(callees);
    this.completesNormally = completesNormally;
    this.result = result;
  }

  @Override
  public Kind kind() {
    return Kind.CALL;
  }

  @Override
  public List<Value> inputs() {
    if (receiver == null) {
      return args;
    }
    return ImmutableList.<Value>builder().add(receiver).addAll(args).build();
  }

  @Override
  public Value result() {
    return result;
  }

  @Override
  boolean fallsThrough() {
    return completesNormally;
  }

  @Override
  public String text() {
    StringBuilder sb = new StringBuilder(nullPropagating ? "call?(" : "call(");
    if (receiver != null) {
      sb.append(receiver).append('.');
    }
    sb.append(name);
    if (!args.isEmpty()) {
      sb.append('|').append(join(args));
    }
    return sb.append(')').toString();
  }
}
