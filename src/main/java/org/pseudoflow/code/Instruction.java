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
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * An Instruction is a node in a {@link Graph}. Each subclass has a fixed shape: which values it
 * consumes and produces, whether execution can continue with the following instruction, and which
 * (if any) label it may transfer control to. The {@link GraphBuilder} uses that shape to create the
 * instruction's outlinks when it is emitted.
 *
 * <p>An instruction emitted while the builder's cursor is unreachable is <i>dead</i>: it has no
 * inlinks and a single {@link Link.Kind#DEAD} outlink to the graph's sink, whatever its shape.
 */
public abstract class Instruction extends LinkTarget {

  public enum Kind {
    START,
    END,
    ERROR,
    SINK,
    MARK,
    DECLARE,
    WRITE,
    READ,
    MAGIC,
    CALL,
    BRANCH_TRUE,
    BRANCH_FALSE,
    JUMP,
    DECLARATION_DEAD,
    MERGE,
    RETURN,
    THROW
  }

  /** This instruction's position in its graph's instruction list; -1 until it is added. */
  int index = -1;

  /** The source line this instruction was generated from. */
  int line;

  /** True if this instruction was emitted while the builder's cursor was unreachable. */
  boolean dead;

  final List<Link> outlinks = new ArrayList<>(2);

  /** The labels bound to this instruction, in the order they were bound. */
  final List<Label> labels = new ArrayList<>(1);

  public abstract Kind kind();

  /** This instruction's text, not including its result. */
  public abstract String text();

  /** The value produced by this instruction, or null. */
  public @Nullable Value result() {
    return null;
  }

  /** The values consumed by this instruction, in order. */
  public List<Value> inputs() {
    return ImmutableList.of();
  }

  /** True if, when reached, execution may continue with the next instruction emitted. */
  boolean fallsThrough() {
    return true;
  }

  /** The label this instruction may transfer control to, or null. */
  @Nullable Label jumpLabel() {
    return null;
  }

  Link.Kind fallthroughKind() {
    return Link.Kind.NORMAL;
  }

  Link.Kind jumpKind() {
    return Link.Kind.NORMAL;
  }

  /** If non-null, the value carried by the link to {@link #jumpLabel}. */
  @Nullable Value jumpValue() {
    return null;
  }

  public int index() {
    return index;
  }

  public int line() {
    return line;
  }

  public boolean isDead() {
    return dead;
  }

  public ImmutableList<Link> outlinks() {
    return ImmutableList.copyOf(outlinks);
  }

  public ImmutableList<Label> labels() {
    return ImmutableList.copyOf(labels);
  }

  /** The identifier used for this instruction in listings, e.g. {@code "n3"}. */
  public String ref() {
    return "n" + index;
  }

  /** Returns true for the canonical START, END, ERROR, and SINK instructions. */
  public boolean isCanonical() {
    return switch (kind()) {
      case START, END, ERROR, SINK -> true;
      default -> false;
    };
  }

  @Override
  public String toString() {
    Value result = result();
    return (result == null) ? text() : text() + " -> " + result;
  }

  static String join(List<Value> values) {
    StringBuilder sb = new StringBuilder();
    for (Value v : values) {
      if (sb.length() != 0) {
        sb.append(", ");
      }
      sb.append(v);
    }
    return sb.toString();
  }
}
