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
import java.util.ArrayDeque;
import java.util.BitSet;

/**
 * The instructions of a single Graph that can be reached from its START by following NORMAL, TRUE,
 * and FALSE links. DEAD links are never followed, and their origins are never reachable.
 */
public final class Reachability {
  private final Graph graph;
  private final BitSet reachable;

  private Reachability(Graph graph, BitSet reachable) {
    this.graph = graph;
    this.reachable = reachable;
  }

  public static Reachability of(Graph graph) {
    BitSet visited = new BitSet(graph.size());
    ArrayDeque<Instruction> worklist = new ArrayDeque<>();
    visited.set(graph.start.index);
    worklist.add(graph.start);
    while (!worklist.isEmpty()) {
      Instruction inst = worklist.remove();
      for (Link link : inst.outlinks) {
        assert !link.isDead() : "reached dead instruction " + inst;
        if (link.isDead()) {
          continue;
        }
        Instruction target = link.targetInstruction();
        if (!visited.get(target.index)) {
          visited.set(target.index);
          worklist.add(target);
        }
      }
    }
    return new Reachability(graph, visited);
  }

  public Graph graph() {
    return graph;
  }

  public boolean isReachable(Instruction inst) {
    assert graph.instructions.get(inst.index) == inst;
    return reachable.get(inst.index);
  }

  /** The reachable instructions, in graph order. */
  public ImmutableList<Instruction> reachable() {
    return select(true);
  }

  /** The unreachable instructions (including canonical ones), in graph order. */
  public ImmutableList<Instruction> unreachable() {
    return select(false);
  }

  private ImmutableList<Instruction> select(boolean wantReachable) {
    ImmutableList.Builder<Instruction> result = ImmutableList.builder();
    for (Instruction inst : graph.instructions) {
      if (reachable.get(inst.index) == wantReachable) {
        result.add(inst);
      }
    }
    return result.build();
  }
}
