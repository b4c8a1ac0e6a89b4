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

import static com.google.common.base.Verify.verify;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks the structural invariants of a finished Graph, throwing a {@link
 * com.google.common.base.VerifyException} if any are violated.
 */
public final class GraphVerifier {

  private GraphVerifier() {}

  public static void check(Graph graph) {
    List<Instruction> insts = graph.instructions;
    int n = insts.size();
    verify(n >= 4, "%s: too few instructions", graph.name);
    verify(insts.get(0) == graph.start && !graph.start.hasInLink(), "%s: bad START", graph.name);
    verify(
        insts.get(n - 3) == graph.end
            && insts.get(n - 2) == graph.error
            && insts.get(n - 1) == graph.sink,
        "%s: canonical instructions out of place",
        graph.name);
    for (Special s : List.of(graph.end, graph.error)) {
      verify(
          s.outlinks.size() == 1
              && s.outlinks.get(0).kind == Link.Kind.NORMAL
              && s.outlinks.get(0).target() == graph.sink,
          "%s: %s must link only to SINK",
          graph.name,
          s);
    }
    verify(graph.sink.outlinks.isEmpty(), "%s: SINK has outlinks", graph.name);
    verify(graph.entryLabel().instruction() == graph.start, "%s: L0 is not START", graph.name);
    verify(graph.exitLabel().instruction() == graph.end, "%s: L1 is not END", graph.name);

    Reachability reachability = Reachability.of(graph);
    List<Instruction> expectedSinkPreds = new ArrayList<>(List.of(graph.error, graph.end));
    for (int i = 0; i < n; i++) {
      Instruction inst = insts.get(i);
      verify(inst.index == i, "%s: %s has index %s", graph.name, inst, inst.index);
      for (Link link : inst.outlinks) {
        verify(link.origin == inst, "%s: %s has foreign outlink", graph.name, inst);
        verify(
            link.target() instanceof Instruction target && ownedBy(graph, target),
            "%s: link %s does not target an instruction of this graph",
            graph.name,
            link);
      }
      if (inst.isDead()) {
        verify(!inst.hasInLink(), "%s: dead %s has inlinks", graph.name, inst.ref());
        verify(
            inst.outlinks.size() == 1
                && inst.outlinks.get(0).isDead()
                && inst.outlinks.get(0).target() == graph.sink,
            "%s: dead %s must have a single DEAD link to SINK",
            graph.name,
            inst.ref());
        verify(
            !reachability.isReachable(inst),
            "%s: dead %s is reachable",
            graph.name,
            inst.ref());
        expectedSinkPreds.add(inst);
      } else {
        verifyLive(graph, inst);
      }
      verifyValues(graph, inst);
    }
    verify(
        graph.sink.inlinks().stream().map(link -> link.origin).toList().equals(expectedSinkPreds),
        "%s: SINK preds should be %s",
        graph.name,
        expectedSinkPreds);
    for (Label label : graph.labels) {
      verify(!label.hasInLink(), "%s: %s was never bound", graph.name, label);
      verify(
          !label.isResolved() || ownedBy(graph, label.instruction()),
          "%s: %s resolved outside the graph",
          graph.name,
          label);
    }
  }

  private static boolean ownedBy(Graph graph, Instruction inst) {
    return inst.index >= 0
        && inst.index < graph.instructions.size()
        && graph.instructions.get(inst.index) == inst;
  }

  private static void verifyLive(Graph graph, Instruction inst) {
    for (Link link : inst.outlinks) {
      verify(!link.isDead(), "%s: live %s has a DEAD link", graph.name, inst.ref());
    }
    switch (inst.kind()) {
      case BRANCH_TRUE, BRANCH_FALSE ->
          verify(
              inst.outlinks.size() == 2
                  && inst.outlinks.get(0).kind == inst.fallthroughKind()
                  && inst.outlinks.get(1).kind == inst.jumpKind()
                  && inst.outlinks.get(0).kind != inst.outlinks.get(1).kind,
              "%s: bad branch %s",
              graph.name,
              inst.ref());
      case MERGE -> verifyMerge(graph, (Merge) inst);
      case RETURN -> verifyReturn(graph, (ReturnInstruction) inst);
      default -> {}
    }
    if (inst.outlinks.isEmpty()) {
      boolean terminal =
          switch (inst.kind()) {
            case SINK -> true;
            case RETURN -> !((ReturnInstruction) inst).target.isLocal();
            case CALL -> !((CallInstruction) inst).completesNormally;
            default -> false;
          };
      verify(terminal, "%s: %s has no successor", graph.name, inst.ref());
    }
  }

  private static void verifyMerge(Graph graph, Merge merge) {
    if (!merge.hasInLink()) {
      return;
    }
    List<Link> inlinks = merge.inlinks();
    List<Value> inputs = merge.inputs();
    verify(
        inputs.size() == inlinks.size(),
        "%s: %s has %s inputs but %s preds",
        graph.name,
        merge.ref(),
        inputs.size(),
        inlinks.size());
    for (int i = 0; i < inputs.size(); i++) {
      verify(
          inlinks.get(i).value == inputs.get(i),
          "%s: %s input %s does not match its link",
          graph.name,
          merge.ref(),
          i);
    }
  }

  private static void verifyReturn(Graph graph, ReturnInstruction ret) {
    if (ret.target.isLocal()) {
      verify(ret.target.label == graph.exitLabel(), "%s: local return not to L1", graph.name);
    } else {
      ReturnInstruction.NonLocal target = (ReturnInstruction.NonLocal) ret.target;
      verify(
          target.graph != graph
              && graph.isWithin(target.graph)
              && target.label == target.graph.exitLabel(),
          "%s: non-local return %s must target an enclosing graph's exit",
          graph.name,
          ret.ref());
    }
  }

  private static void verifyValues(Graph graph, Instruction inst) {
    Value result = inst.result();
    if (result != null) {
      verify(result.producer == inst, "%s: %s is not produced by %s", graph.name, result, inst);
    }
    for (Value v : inst.inputs()) {
      verify(
          v.index < graph.values.size() && graph.values.get(v.index) == v,
          "%s: %s uses foreign value %s",
          graph.name,
          inst.ref(),
          v);
      verify(
          v.producer != null && v.producer.index < inst.index,
          "%s: %s uses %s before it is produced",
          graph.name,
          inst.ref(),
          v);
    }
  }
}
