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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Builds a single {@link Graph} by emitting instructions in order.
 *
 * <p>The builder maintains an insertion cursor: the links that will target the next instruction
 * emitted. Emitting an instruction moves the cursor's links to it and then adds its own fallthrough
 * link (if it has one) to the cursor. Binding a label adds the label's links to the cursor, and
 * resolves the label to the next instruction emitted.
 *
 * <p>If the cursor has no links ({@link #nextInstructionIsReachable} is false) the next
 * instruction is emitted in <i>dead mode</i>: it gets a single DEAD link to the sink, and none of
 * the links its kind would otherwise have. The cursor only becomes live again when a label with
 * links is bound.
 */
public final class GraphBuilder {
  private final Graph graph;

  /** The target of all pending links. */
  private final Future next = new Future();

  /** Labels that have been bound but not yet resolved (they will resolve to the next emit). */
  private final List<Label> pendingLabels = new ArrayList<>();

  private int line;
  private boolean finished;

  public GraphBuilder(String name, Graph.Kind kind, @Nullable Graph parent, int line) {
    this.graph = new Graph(name, kind, parent, line);
    this.line = line;
    add(graph.start);
    graph.entryLabel().resolve(graph.start);
    graph.link(graph.start, Link.Kind.NORMAL, next);
  }

  public Graph graph() {
    return graph;
  }

  /** Sets the source line recorded on subsequently emitted instructions. */
  public void setLine(int line) {
    this.line = line;
  }

  public int line() {
    return line;
  }

  /** Returns true if the next instruction emitted will have at least one inlink. */
  public boolean nextInstructionIsReachable() {
    return next.hasInLink();
  }

  public Label newLabel(@Nullable String description) {
    Preconditions.checkState(!finished);
    return graph.newLabel(description);
  }

  /** Adds the label's pending links to the cursor; the label will resolve to the next emit. */
  public void bind(Label label) {
    Preconditions.checkState(!finished);
    Preconditions.checkArgument(
        !label.isResolved() && !pendingLabels.contains(label), "%s already bound", label);
    label.moveAllInLinks(next);
    pendingLabels.add(label);
  }

  /**
   * Like {@link #bind(Label)}, but first records {@code fallthroughValue} as the value carried by
   * the links already in the cursor (i.e. the fallthrough into the join).
   */
  public void bind(Label label, @Nullable Value fallthroughValue) {
    if (fallthroughValue != null) {
      next.forEachInLink(link -> link.value = fallthroughValue);
    }
    bind(label);
  }

  /** Returns a new value; it is non-local if the cursor is currently unreachable. */
  public Value newValue() {
    return graph.newValue(!nextInstructionIsReachable(), null);
  }

  /** Returns a new value that denotes the given lambda or local function graph. */
  public Value newValue(@Nullable Graph callable) {
    return graph.newValue(!nextInstructionIsReachable(), callable);
  }

  /** Returns a new non-local value. */
  public Value newNonLocalValue() {
    return graph.newValue(true, null);
  }

  /**
   * Adds the given instruction to the graph at the cursor; see the class comment for how its links
   * are created.
   */
  @CanIgnoreReturnValue
  public <T extends Instruction> T emit(T inst) {
    Preconditions.checkState(!finished);
    Preconditions.checkArgument(inst.index < 0, "%s already emitted", inst);
    boolean live = next.hasInLink();
    add(inst);
    next.moveAllInLinks(inst);
    resolvePendingLabels(inst);
    Value result = inst.result();
    if (result != null) {
      Preconditions.checkArgument(result.producer == null, "%s already produced", result);
      result.producer = inst;
    }
    if (inst instanceof ReturnInstruction ret
        && ret.target instanceof ReturnInstruction.NonLocal target) {
      Preconditions.checkArgument(graph != target.graph && graph.isWithin(target.graph));
      graph.outgoing.add(new Transfer(graph, ret, ret.value, target.graph, target.label));
    }
    if (!live) {
      inst.dead = true;
      graph.link(inst, Link.Kind.DEAD, graph.sink);
      return inst;
    }
    if (inst.fallsThrough()) {
      graph.link(inst, inst.fallthroughKind(), next);
    }
    Label target = inst.jumpLabel();
    if (target != null) {
      LinkTarget dest = target.isResolved() ? target.instruction() : target;
      Link link = graph.link(inst, inst.jumpKind(), dest);
      link.value = inst.jumpValue();
    }
    return inst;
  }

  /**
   * Emits a merge at the cursor. If the cursor is live the merge's inputs are the values carried
   * by the cursor's links, in order; otherwise they are {@code contributions}.
   */
  public Value merge(List<Value> contributions) {
    List<Value> inputs;
    if (nextInstructionIsReachable()) {
      ImmutableList.Builder<Value> builder = ImmutableList.builder();
      next.forEachInLink(
          link -> {
            Preconditions.checkState(
                link.value != null, "link %s into merge carries no value", link);
            builder.add(link.value);
          });
      inputs = builder.build();
    } else {
      inputs = contributions;
    }
    Value result = newValue();
    emit(new Merge(inputs, result));
    return result;
  }

  /**
   * Binds the exit label and adds END, ERROR, and SINK. No further instructions may be emitted.
   */
  @CanIgnoreReturnValue
  public Graph finish() {
    Preconditions.checkState(!finished);
    bind(graph.exitLabel());
    line = graph.line;
    add(graph.end);
    next.moveAllInLinks(graph.end);
    resolvePendingLabels(graph.end);
    add(graph.error);
    add(graph.sink);
    finished = true;
    for (Label label : graph.labels) {
      Preconditions.checkState(!label.hasInLink(), "%s was never bound", label);
    }
    return graph;
  }

  /**
   * Makes a finished graph part of its forest: adds it to its parent's nested graphs and registers
   * its non-local returns (and those of the graphs nested in it) with their targets.
   */
  public void attach() {
    Preconditions.checkState(finished);
    Graph parent = graph.parent();
    if (parent != null) {
      parent.nested.add(graph);
    }
    for (Transfer t : graph.outgoing) {
      t.target().incoming.add(t);
    }
    // Transfers that leave the parent too are also outgoing from it.
    for (Graph g = parent; g != null; g = g.parent()) {
      for (Transfer t : graph.outgoing) {
        if (t.target() != g && g.isWithin(t.target())) {
          g.outgoing.add(t);
        }
      }
    }
  }

  /**
   * Discards a graph whose construction failed: removes any transfers from it (or graphs nested in
   * it) that were registered with enclosing graphs. The graph is never attached.
   */
  public void abandon() {
    for (Graph g = graph.parent(); g != null; g = g.parent()) {
      g.incoming.removeIf(t -> t.source().isWithin(graph));
      g.outgoing.removeIf(t -> t.source().isWithin(graph));
    }
  }

  private void add(Instruction inst) {
    inst.index = graph.instructions.size();
    inst.line = line;
    graph.instructions.add(inst);
  }

  private void resolvePendingLabels(Instruction inst) {
    for (Label label : pendingLabels) {
      label.resolve(inst);
    }
    pendingLabels.clear();
  }
}
