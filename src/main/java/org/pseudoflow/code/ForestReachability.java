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
import java.util.HashMap;
import java.util.Map;

/**
 * Reachability across a whole forest of graphs, starting from one graph's START. In addition to
 * following links within each graph,
 *
 * <ul>
 *   <li>a reachable call enters (makes reachable the START of) each of its callee graphs; and
 *   <li>a reachable non-local return makes its target's exit reachable.
 * </ul>
 *
 * <p>This is what decides whether a lambda is ever entered and whether it can complete normally;
 * unreachable-code diagnostics use the per-graph {@link Reachability}.
 */
public final class ForestReachability {
  private final Graph root;

  /** Lookup only; never iterated. */
  private final Map<Graph, BitSet> reached = new HashMap<>();

  private final ArrayDeque<Node> worklist = new ArrayDeque<>();

  private record Node(Graph graph, Instruction inst) {}

  private ForestReachability(Graph root) {
    this.root = root;
  }

  /** Computes reachability for {@code root} and every graph it can enter. */
  public static ForestReachability from(Graph root) {
    ForestReachability result = new ForestReachability(root);
    result.visit(root, root.start);
    result.run();
    return result;
  }

  private void visit(Graph graph, Instruction inst) {
    BitSet bits = reached.computeIfAbsent(graph, g -> new BitSet(g.size()));
    if (!bits.get(inst.index)) {
      bits.set(inst.index);
      worklist.add(new Node(graph, inst));
    }
  }

  private void run() {
    while (!worklist.isEmpty()) {
      Node node = worklist.remove();
      Instruction inst = node.inst();
      for (Link link : inst.outlinks) {
        // In a graph that is still being built, links may target a placeholder or an instruction
        // that hasn't been added yet (ERROR).
        if (!link.isDead() && link.target() instanceof Instruction target && target.index >= 0) {
          visit(node.graph(), target);
        }
      }
      if (inst instanceof CallInstruction call) {
        for (Graph callee : call.callees) {
          visit(callee, callee.start);
        }
      } else if (inst instanceof ReturnInstruction ret
          && ret.target instanceof ReturnInstruction.NonLocal target) {
        // The target may still be under construction, in which case it's outside this analysis.
        Instruction dest = target.label.instruction();
        if (dest != null) {
          visit(target.graph, dest);
        }
      }
    }
  }

  public Graph root() {
    return root;
  }

  /** Returns true if the given graph's START is reachable. */
  public boolean isEntered(Graph graph) {
    return isReachable(graph, graph.start);
  }

  public boolean isReachable(Graph graph, Instruction inst) {
    BitSet bits = reached.get(graph);
    return bits != null && bits.get(inst.index);
  }

  /** Returns true if the given graph's END is reachable. */
  public boolean completesNormally(Graph graph) {
    return isReachable(graph, graph.end);
  }

  /** Returns the graphs in {@code forest} that are entered, in forest order. */
  public ImmutableList<Graph> enteredGraphs(GraphForest forest) {
    return forest.graphs().stream()
        .filter(this::isEntered)
        .collect(ImmutableList.toImmutableList());
  }

  /** Returns the graphs in {@code forest} that are never entered, in forest order. */
  public ImmutableList<Graph> neverEntered(GraphForest forest) {
    return forest.graphs().stream()
        .filter(g -> !isEntered(g))
        .collect(ImmutableList.toImmutableList());
  }
}
