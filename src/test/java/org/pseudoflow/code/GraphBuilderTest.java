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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class GraphBuilderTest {

  private static GraphBuilder newBuilder() {
    return new GraphBuilder("f", Graph.Kind.FUNCTION, null, 1);
  }

  private static ImmutableList<Instruction> preds(Instruction inst) {
    return inst.inlinks().stream()
        .map(link -> link.origin)
        .collect(ImmutableList.toImmutableList());
  }

  private static ImmutableList<Instruction> succs(Instruction inst) {
    return inst.outlinks().stream()
        .map(Link::targetInstruction)
        .collect(ImmutableList.toImmutableList());
  }

  @Test
  public void emptyGraph() {
    Graph g = newBuilder().finish();
    assertThat(g.instructions())
        .containsExactly(g.start(), g.end(), g.error(), g.sink())
        .inOrder();
    assertThat(succs(g.start())).containsExactly(g.end());
    assertThat(preds(g.sink())).containsExactly(g.error(), g.end()).inOrder();
    assertThat(g.entryLabel().instruction()).isSameInstanceAs(g.start());
    assertThat(g.exitLabel().instruction()).isSameInstanceAs(g.end());
    assertThat(g.end().labels()).containsExactly(g.exitLabel());
    assertThat(g.error().labels()).containsExactly(g.errorLabel());
    assertThat(g.sink().labels()).containsExactly(g.sinkLabel());
    assertThat(g.instructions().stream().map(Instruction::kind).toList())
        .containsExactly(
            Instruction.Kind.START,
            Instruction.Kind.END,
            Instruction.Kind.ERROR,
            Instruction.Kind.SINK)
        .inOrder();
    assertThat(g.instructions().stream().allMatch(Instruction::isCanonical)).isTrue();
    assertThat(g.labels().stream().map(label -> label.name).toList())
        .containsExactly("L0", "L1")
        .inOrder();
    GraphVerifier.check(g);
  }

  @Test
  public void linearCode() {
    GraphBuilder b = newBuilder();
    b.setLine(2);
    Mark mark = b.emit(new Mark("foo()"));
    Value v = b.newValue();
    CallInstruction call =
        b.emit(new CallInstruction(null, "foo", List.of(), false, List.of(), true, v));
    Graph g = b.finish();
    assertThat(mark.index()).isEqualTo(1);
    assertThat(mark.line()).isEqualTo(2);
    assertThat(succs(g.start())).containsExactly(mark);
    assertThat(succs(mark)).containsExactly(call);
    assertThat(succs(call)).containsExactly(g.end());
    assertThat(v.producer()).isSameInstanceAs(call);
    assertThat(v.nonLocal).isFalse();
    // The canonical instructions use the declaration's line.
    assertThat(g.end().line()).isEqualTo(1);
    GraphVerifier.check(g);
  }

  @Test
  public void deadMode() {
    GraphBuilder b = newBuilder();
    Label target = b.newLabel("after");
    b.emit(Jump.to(target));
    assertThat(b.nextInstructionIsReachable()).isFalse();
    Value v = b.newValue();
    assertThat(v.nonLocal).isTrue();
    assertThat(v.toString()).isEqualTo("!<v0>");
    Label unused = b.newLabel("skipped");
    VariableAccess.Read read = b.emit(new VariableAccess.Read("x", v));
    Branch branch = b.emit(new Branch(true, unused, v, Branch.Test.BOOLEAN, null));
    b.bind(unused);
    assertThat(b.nextInstructionIsReachable()).isFalse();
    b.bind(target);
    assertThat(b.nextInstructionIsReachable()).isTrue();
    Mark mark = b.emit(new Mark("live()"));
    Graph g = b.finish();

    for (Instruction inst : List.of(read, branch)) {
      assertThat(inst.isDead()).isTrue();
      assertThat(inst.inlinkCount()).isEqualTo(0);
      assertThat(inst.outlinks()).hasSize(1);
      assertThat(inst.outlinks().get(0).kind).isEqualTo(Link.Kind.DEAD);
      assertThat(inst.outlinks().get(0).target()).isSameInstanceAs(g.sink());
    }
    // A label bound with no links still resolves.
    assertThat(unused.instruction()).isSameInstanceAs(mark);
    assertThat(mark.labels()).containsExactly(unused, target).inOrder();
    assertThat(preds(mark)).containsExactly(g.instruction(1));
    assertThat(preds(g.sink())).containsExactly(g.error(), g.end(), read, branch).inOrder();
    GraphVerifier.check(g);
  }

  @Test
  public void backEdgeToResolvedLabel() {
    GraphBuilder b = newBuilder();
    Label top = b.newLabel("loop entry point");
    b.bind(top);
    Mark body = b.emit(new Mark("body()"));
    Jump back = b.emit(Jump.to(top));
    Graph g = b.finish();
    assertThat(succs(back)).containsExactly(body);
    assertThat(preds(body)).containsExactly(g.start(), back).inOrder();
    // The loop never exits.
    assertThat(g.end().hasInLink()).isFalse();
    GraphVerifier.check(g);
  }

  @Test
  public void branchLinks() {
    GraphBuilder b = newBuilder();
    Value v = b.newValue();
    b.emit(new VariableAccess.Read("c", v));
    Label join = b.newLabel(null);
    Branch jf = b.emit(new Branch(false, join, v, Branch.Test.BOOLEAN, null));
    Mark then = b.emit(new Mark("then()"));
    b.bind(join);
    Mark after = b.emit(new Mark("after()"));
    Graph g = b.finish();
    assertThat(jf.kind()).isEqualTo(Instruction.Kind.BRANCH_FALSE);
    assertThat(then.isCanonical()).isFalse();
    assertThat(jf.outlinks().stream().map(link -> link.kind).toList())
        .containsExactly(Link.Kind.TRUE, Link.Kind.FALSE)
        .inOrder();
    assertThat(succs(jf)).containsExactly(then, after).inOrder();
    // Inlinks are in creation order: the jump was created before then's fallthrough.
    assertThat(preds(after)).containsExactly(jf, then).inOrder();
    GraphVerifier.check(g);
  }

  @Test
  public void mergeInputsFollowInlinks() {
    GraphBuilder b = newBuilder();
    Value left = b.newValue();
    b.emit(new VariableAccess.Read("a", left));
    Label join = b.newLabel("result of ||");
    b.emit(new Branch(true, join, left, Branch.Test.BOOLEAN, left));
    Value right = b.newValue();
    b.emit(new VariableAccess.Read("b", right));
    b.bind(join, right);
    Value result = b.merge(List.of(right, left));
    Graph g = b.finish();
    Merge merge = (Merge) result.producer();
    assertThat(merge.inputs()).containsExactly(left, right).inOrder();
    assertThat(merge.toString()).isEqualTo("merge(<v0>, <v1>) -> <v2>");
    GraphVerifier.check(g);
  }

  @Test
  public void deadMergeUsesContributions() {
    GraphBuilder b = newBuilder();
    b.emit(
        new ReturnInstruction(
            new ReturnInstruction.Local(b.graph().exitLabel()), null, false, null));
    Value x = b.newValue();
    b.emit(new VariableAccess.Read("x", x));
    Value y = b.newValue();
    b.emit(new VariableAccess.Read("y", y));
    Value result = b.merge(List.of(x, y));
    Graph g = b.finish();
    assertThat(result.producer().isDead()).isTrue();
    assertThat(result.producer().inputs()).containsExactly(x, y).inOrder();
    assertThat(result.toString()).isEqualTo("!<v2>");
    GraphVerifier.check(g);
  }

  @Test
  public void mergeRequiresCarriedValues() {
    GraphBuilder b = newBuilder();
    Value v = b.newValue();
    b.emit(new VariableAccess.Read("a", v));
    Label join = b.newLabel(null);
    b.emit(new Branch(true, join, v, Branch.Test.BOOLEAN, null));
    b.bind(join, v);
    assertThrows(IllegalStateException.class, () -> b.merge(List.of(v, v)));
  }

  @Test
  public void unboundLabel() {
    GraphBuilder b = newBuilder();
    b.emit(Jump.to(b.newLabel("nowhere")));
    IllegalStateException e = assertThrows(IllegalStateException.class, b::finish);
    assertThat(e).hasMessageThat().contains("never bound");
  }

  @Test
  public void misuse() {
    GraphBuilder b = newBuilder();
    Mark mark = b.emit(new Mark("x"));
    assertThrows(IllegalArgumentException.class, () -> b.emit(mark));
    Label label = b.newLabel(null);
    b.bind(label);
    assertThrows(IllegalArgumentException.class, () -> b.bind(label));
    b.finish();
    assertThrows(IllegalStateException.class, () -> b.emit(new Mark("y")));
    assertThrows(IllegalStateException.class, () -> b.newLabel(null));
  }

  @Test
  public void nonLocalReturnTransfers() {
    GraphBuilder outer = newBuilder();
    GraphBuilder lambda = new GraphBuilder("anonymous_0", Graph.Kind.LAMBDA, outer.graph(), 2);
    GraphBuilder inner = new GraphBuilder("anonymous_1", Graph.Kind.LAMBDA, lambda.graph(), 3);
    Value v = inner.newValue();
    inner.emit(new VariableAccess.Read("x", v));
    ReturnInstruction ret =
        inner.emit(
            new ReturnInstruction(
                new ReturnInstruction.NonLocal(outer.graph()),
                v,
                false,
                inner.newNonLocalValue()));
    assertThat(ret.toString()).isEqualTo("ret(*|<v0>) L1@f -> !<v1>");
    assertThat(ret.outlinks()).isEmpty();
    inner.finish();
    inner.attach();
    Graph outerGraph = outer.graph();
    Graph lambdaGraph = lambda.graph();
    Transfer transfer = Iterables.getOnlyElement(outerGraph.incomingTransfers());
    assertThat(transfer.source()).isSameInstanceAs(inner.graph());
    assertThat(transfer.ret()).isSameInstanceAs(ret);
    assertThat(transfer.value()).isSameInstanceAs(v);
    assertThat(transfer.target()).isSameInstanceAs(outerGraph);
    assertThat(inner.graph().outgoingTransfers()).containsExactly(transfer);
    // The intermediate lambda is also left by the return.
    assertThat(lambdaGraph.outgoingTransfers()).containsExactly(transfer);
    assertThat(lambdaGraph.nested()).containsExactly(inner.graph());

    // Abandoning the intermediate lambda discards the transfer.
    lambda.abandon();
    assertThat(outerGraph.incomingTransfers()).isEmpty();
    assertThat(outerGraph.nested()).isEmpty();
  }

  @Test
  public void nonLocalReturnMustTargetEnclosingGraph() {
    GraphBuilder outer = newBuilder();
    GraphBuilder other = new GraphBuilder("other", Graph.Kind.FUNCTION, null, 1);
    GraphBuilder lambda = new GraphBuilder("anonymous_0", Graph.Kind.LAMBDA, outer.graph(), 2);
    assertThrows(
        IllegalArgumentException.class,
        () ->
            lambda.emit(
                new ReturnInstruction(
                    new ReturnInstruction.NonLocal(other.graph()), null, false, null)));
  }
}
