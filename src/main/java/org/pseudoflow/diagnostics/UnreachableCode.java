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

package org.pseudoflow.diagnostics;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.pseudoflow.code.DeadDeclaration;
import org.pseudoflow.code.ForestReachability;
import org.pseudoflow.code.Graph;
import org.pseudoflow.code.GraphForest;
import org.pseudoflow.code.Instruction;
import org.pseudoflow.code.Reachability;
import org.pseudoflow.code.ReturnInstruction;

/**
 * The unreachable-code facts for a forest, for a diagnostics layer to turn into warnings.
 *
 * <p>For each graph (using that graph's own {@link Reachability}):
 *
 * <ul>
 *   <li>{@link #unreachable}: instructions that can't be reached from START, excluding the
 *       canonical instructions, declaration placeholders, and the implicit returns the builder adds
 *       (whose unreachability always has some other cause);
 *   <li>{@link #deadDeclarations}: the {@link DeadDeclaration} placeholders, which are never
 *       reachable.
 * </ul>
 *
 * <p>In addition {@link #neverEntered} lists the graphs that no reachable call enters.
 */
public final class UnreachableCode {

  /** Receives the facts, in forest order and then instruction order. */
  public interface Reporter {
    void unreachable(Graph graph, Instruction inst);

    void deadDeclaration(Graph graph, DeadDeclaration decl);

    void neverEntered(Graph graph);
  }

  private final GraphForest forest;
  private final ImmutableMap<Graph, ImmutableList<Instruction>> unreachable;
  private final ImmutableMap<Graph, ImmutableList<DeadDeclaration>> deadDeclarations;
  private final ImmutableList<Graph> neverEntered;

  private UnreachableCode(
      GraphForest forest,
      ImmutableMap<Graph, ImmutableList<Instruction>> unreachable,
      ImmutableMap<Graph, ImmutableList<DeadDeclaration>> deadDeclarations,
      ImmutableList<Graph> neverEntered) {
    this.forest = forest;
    this.unreachable = unreachable;
    this.deadDeclarations = deadDeclarations;
    this.neverEntered = neverEntered;
  }

  public static UnreachableCode analyze(GraphForest forest) {
    ImmutableMap.Builder<Graph, ImmutableList<Instruction>> unreachable = ImmutableMap.builder();
    ImmutableMap.Builder<Graph, ImmutableList<DeadDeclaration>> declarations =
        ImmutableMap.builder();
    for (Graph graph : forest.graphs()) {
      ImmutableList.Builder<Instruction> insts = ImmutableList.builder();
      ImmutableList.Builder<DeadDeclaration> decls = ImmutableList.builder();
      for (Instruction inst : Reachability.of(graph).unreachable()) {
        if (inst instanceof DeadDeclaration decl) {
          decls.add(decl);
        } else if (!inst.isCanonical() && !isImplicitReturn(inst)) {
          insts.add(inst);
        }
      }
      unreachable.put(graph, insts.build());
      declarations.put(graph, decls.build());
    }
    ImmutableList<Graph> neverEntered =
        ForestReachability.from(forest.root()).neverEntered(forest);
    return new UnreachableCode(
        forest, unreachable.buildOrThrow(), declarations.buildOrThrow(), neverEntered);
  }

  private static boolean isImplicitReturn(Instruction inst) {
    return inst instanceof ReturnInstruction ret && ret.implicit;
  }

  public ImmutableList<Instruction> unreachable(Graph graph) {
    return unreachable.getOrDefault(graph, ImmutableList.of());
  }

  public ImmutableList<DeadDeclaration> deadDeclarations(Graph graph) {
    return deadDeclarations.getOrDefault(graph, ImmutableList.of());
  }

  /** Graphs that are never entered from the forest's root, in forest order. */
  public ImmutableList<Graph> neverEntered() {
    return neverEntered;
  }

  /** Returns true if no graph has unreachable instructions or is never entered. */
  public boolean isEmpty() {
    return neverEntered.isEmpty()
        && forest.graphs().stream().allMatch(g -> unreachable(g).isEmpty());
  }

  /**
   * Passes every fact to {@code reporter}, graph by graph in forest order; within a graph, never
   * entered comes first and then the instructions in order.
   */
  public void report(Reporter reporter) {
    for (Graph graph : forest.graphs()) {
      if (neverEntered.contains(graph)) {
        reporter.neverEntered(graph);
      }
      // Interleave the two lists so that each graph's facts come in instruction order.
      ImmutableList<DeadDeclaration> decls = deadDeclarations(graph);
      ImmutableList<Instruction> insts = unreachable(graph);
      int i = 0;
      int j = 0;
      while (i < decls.size() || j < insts.size()) {
        boolean declNext =
            j == insts.size()
                || (i < decls.size() && decls.get(i).index() < insts.get(j).index());
        if (declNext) {
          reporter.deadDeclaration(graph, decls.get(i++));
        } else {
          reporter.unreachable(graph, insts.get(j++));
        }
      }
    }
  }
}
