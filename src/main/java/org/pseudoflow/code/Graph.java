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
 * The control-flow graph of one function or lambda body.
 *
 * <p>Every Graph has four canonical instructions: START (the first instruction, labeled {@code
 * L0}), END (labeled {@code L1}, the target of local returns), ERROR (the target of throws), and
 * SINK. END and ERROR each link to SINK, as does every dead instruction, so SINK's inlinks are
 * always ERROR, END, and the dead instructions, in that order.
 *
 * <p>Graphs are constructed by a {@link GraphBuilder} and are read-only once it has finished.
 * Graphs for nested lambdas and local functions are separate objects, reachable from their parent
 * through {@link #nested} and from call sites through {@link CallInstruction#callees}.
 */
public final class Graph {
  public enum Kind {
    FUNCTION,
    LAMBDA
  }

  public final String name;
  public final Kind kind;

  /** The source line of the declaration this graph was built from. */
  public final int line;

  private final @Nullable Graph parent;

  final List<Graph> nested = new ArrayList<>();
  final List<Instruction> instructions = new ArrayList<>();
  final List<Label> labels = new ArrayList<>();
  final List<Value> values = new ArrayList<>();
  final List<Transfer> outgoing = new ArrayList<>();
  final List<Transfer> incoming = new ArrayList<>();

  final Special start = new Special(Instruction.Kind.START);
  final Special end = new Special(Instruction.Kind.END);
  final Special error = new Special(Instruction.Kind.ERROR);
  final Special sink = new Special(Instruction.Kind.SINK);

  private final Label entryLabel;
  private final Label exitLabel;
  private final Label errorLabel = new Label("error", null);
  private final Label sinkLabel = new Label("sink", null);

  private int linkCount;

  Graph(String name, Kind kind, @Nullable Graph parent, int line) {
    this.name = name;
    this.kind = kind;
    this.parent = parent;
    this.line = line;
    entryLabel = newLabel(null);
    exitLabel = newLabel(null);
    errorLabel.resolve(error);
    sinkLabel.resolve(sink);
    link(error, Link.Kind.NORMAL, sink);
    link(end, Link.Kind.NORMAL, sink);
  }

  Label newLabel(@Nullable String description) {
    Label label = new Label("L" + labels.size(), description);
    labels.add(label);
    return label;
  }

  Value newValue(boolean nonLocal, @Nullable Graph callable) {
    Value v = new Value(values.size(), nonLocal, callable);
    values.add(v);
    return v;
  }

  /** Creates a new outlink from {@code origin}. */
  Link link(Instruction origin, Link.Kind kind, LinkTarget target) {
    Link link = new Link(origin, kind, linkCount++);
    origin.outlinks.add(link);
    link.setTarget(target);
    return link;
  }

  public @Nullable Graph parent() {
    return parent;
  }

  /** Returns true if this graph is {@code other} or is nested (at any depth) within it. */
  public boolean isWithin(Graph other) {
    for (Graph g = this; g != null; g = g.parent) {
      if (g == other) {
        return true;
      }
    }
    return false;
  }

  /** The graphs of lambdas and local functions declared directly in this one, in source order. */
  public ImmutableList<Graph> nested() {
    return ImmutableList.copyOf(nested);
  }

  /** All instructions, in emission order; START is first and END, ERROR, SINK are last. */
  public ImmutableList<Instruction> instructions() {
    return ImmutableList.copyOf(instructions);
  }

  public Instruction instruction(int index) {
    return instructions.get(index);
  }

  public int size() {
    return instructions.size();
  }

  /** Every label created for this graph, bound or not, in creation order. */
  public ImmutableList<Label> labels() {
    return ImmutableList.copyOf(labels);
  }

  public ImmutableList<Value> values() {
    return ImmutableList.copyOf(values);
  }

  /** Non-local returns from this graph (or graphs nested in it) to enclosing graphs. */
  public ImmutableList<Transfer> outgoingTransfers() {
    return ImmutableList.copyOf(outgoing);
  }

  /** Non-local returns from nested graphs that target this graph's exit. */
  public ImmutableList<Transfer> incomingTransfers() {
    return ImmutableList.copyOf(incoming);
  }

  public Special start() {
    return start;
  }

  public Special end() {
    return end;
  }

  public Special error() {
    return error;
  }

  public Special sink() {
    return sink;
  }

  public Label entryLabel() {
    return entryLabel;
  }

  public Label exitLabel() {
    return exitLabel;
  }

  public Label errorLabel() {
    return errorLabel;
  }

  public Label sinkLabel() {
    return sinkLabel;
  }

  @Override
  public String toString() {
    return GraphListing.of(this).toString();
  }
}
