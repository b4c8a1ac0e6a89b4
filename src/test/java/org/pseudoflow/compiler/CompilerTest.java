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

package org.pseudoflow.compiler;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.pseudoflow.code.CallInstruction;
import org.pseudoflow.code.Graph;
import org.pseudoflow.code.GraphForest;
import org.pseudoflow.code.Instruction;
import org.pseudoflow.code.Label;
import org.pseudoflow.code.Link;
import org.pseudoflow.code.ReturnInstruction;
import org.pseudoflow.testing.SampleProgram;
import org.pseudoflow.tree.Tree;
import org.pseudoflow.tree.TreeMaker;

@RunWith(TestParameterInjector.class)
public class CompilerTest {

  /**
   * Removes all whitespace at the beginning and end of lines in the given output, collapses runs
   * of spaces, and removes all completely blank lines.
   */
  private static String cleanLines(String output) {
    return output.replaceAll(" +", " ").replaceAll(" *\n[ \n]*", "\n").trim();
  }

  private static Instruction find(Graph graph, String text) {
    for (Instruction inst : graph.instructions()) {
      if (inst.toString().equals(text)) {
        return inst;
      }
    }
    throw new AssertionError("No " + text + " in\n" + graph);
  }

  private static ImmutableList<Instruction> succs(Instruction inst) {
    return inst.outlinks().stream()
        .map(Link::targetInstruction)
        .collect(ImmutableList.toImmutableList());
  }

  private static ImmutableList<String> labels(Instruction inst) {
    return inst.labels().stream().map(Label::heading).collect(ImmutableList.toImmutableList());
  }

  @Test
  public void compileSamples(@TestParameter SampleProgram program) {
    GraphForest forest = Compiler.compile(program.tree());
    assertThat(forest.failures()).isEmpty();
    assertThat(forest.graphs().get(0)).isSameInstanceAs(forest.root());
    System.out.format("** %s:\n%s\n", program, forest);
  }

  @Test
  public void safeCallAndElvis() {
    GraphForest forest = Compiler.compile(SampleProgram.SAFE_CALL_ELVIS.tree());
    assertWithMessage("Compilation results don't match")
        .that(cleanLines(forest.toString()))
        .isEqualTo(
            cleanLines(
                """
                == f ==
                L0:
                   1 n0   <START>
                     n1   v(x)
                     n2   magic[FAKE_INITIALIZER](x) -> <v0>
                     n3   w(x|<v0>)
                     n4   r(x) -> <v1>
                     n5   jf(L2|<v1> != null)  NEXT:[n6, n10]
                     n6   jmp(L3|anonymous_0)  NEXT:[n8]
                     n7   d({ return true })   NEXT:[n17]  PREV:[]
                L3 [after local declaration]:
                     n8   r(anonymous_0) -> <v2>  PREV:[n6]
                     n9   call?(<v1>.let|<v2>) -> !<v3>  NEXT:[]
                L2 [result of safe call]:
                     n10  merge(<v1>) -> <v4>  PREV:[n5]
                     n11  jt(L4|<v4> != null)  NEXT:[n12, n13]
                     n12  r(false) -> <v5>
                L4 [result of elvis]:
                     n13  merge(<v4>, <v5>) -> <v6>  PREV:[n11, n12]
                     n14  ret(*|<v6>) L1
                L1:
                     n15  <END>  NEXT:[n17]
                error:
                     n16  <ERROR>  PREV:[]
                sink:
                     n17  <SINK>  PREV:[n16, n15, n7]
                =====================

                == anonymous_0 ==
                L0:
                   1 n0   <START>
                     n1   mark(return true)
                     n2   r(true) -> <v0>
                     n3   ret(*|<v0>) L1@f -> !<v1>  NEXT:[]
                     n4   ret(*|!<v1>) L1  NEXT:[n7]  PREV:[]
                L1:
                     n5   <END>  NEXT:[n7]  PREV:[]
                error:
                     n6   <ERROR>  PREV:[]
                sink:
                     n7   <SINK>  PREV:[n6, n5, n4]
                =====================
                """));
  }

  @Test
  public void deadLocalFunctionDeclaration() {
    GraphForest forest = Compiler.compile(SampleProgram.DEAD_LOCAL_FUNCTION_DECLARATION.tree());
    assertWithMessage("Compilation results don't match")
        .that(cleanLines(forest.toString()))
        .isEqualTo(
            cleanLines(
                """
                == test ==
                L0:
                   1 n0   <START>
                   2 n1   mark(fun f(x) = x)
                     n2   jmp(L2|f)  NEXT:[n4]
                     n3   d(fun f(x) = x)  NEXT:[n15]  PREV:[]
                L2 [after local declaration]:
                   3 n4   mark(f(null?.let { return }))  PREV:[n2]
                     n5   r(null) -> <v0>
                     n6   jmp(L3)  NEXT:[n11]
                     n7   jmp(L4|anonymous_0)  NEXT:[n15]  PREV:[]
                     n8   d({ return })  NEXT:[n15]  PREV:[]
                L4 [after local declaration]:
                     n9   r(anonymous_0) -> !<v1>  NEXT:[n15]  PREV:[]
                     n10  call?(<v0>.let|!<v1>) -> !<v2>  NEXT:[n15]  PREV:[]
                L3 [result of safe call]:
                     n11  merge(<v0>) -> <v3>  PREV:[n6]
                     n12  call(f|<v3>) -> <v4>
                L1:
                   1 n13  <END>  NEXT:[n15]
                error:
                     n14  <ERROR>  PREV:[]
                sink:
                     n15  <SINK>  PREV:[n14, n13, n3, n7, n8, n9, n10]
                =====================

                == f ==
                L0:
                   2 n0   <START>
                     n1   v(x)
                     n2   magic[FAKE_INITIALIZER](x) -> <v0>
                     n3   w(x|<v0>)
                     n4   r(x) -> <v1>
                     n5   ret(*|<v1>) L1
                L1:
                     n6   <END>  NEXT:[n8]
                error:
                     n7   <ERROR>  PREV:[]
                sink:
                     n8   <SINK>  PREV:[n7, n6]
                =====================

                == anonymous_0 ==
                L0:
                   3 n0   <START>
                     n1   mark(return)
                     n2   ret L1@test -> !<v0>  NEXT:[]
                     n3   ret(*|!<v0>) L1  NEXT:[n6]  PREV:[]
                L1:
                     n4   <END>  NEXT:[n6]  PREV:[]
                error:
                     n5   <ERROR>  PREV:[]
                sink:
                     n6   <SINK>  PREV:[n5, n4, n3]
                =====================
                """));
    Graph test = forest.root();
    CallInstruction call = (CallInstruction) find(test, "call(f|<v3>) -> <v4>");
    assertThat(call.callees).containsExactly(forest.graph("f"));
  }

  @Test
  public void nonNullReceiverSkipsTest() {
    Graph f = Compiler.compile(SampleProgram.SAFE_CALL_NON_NULL_RECEIVER.tree()).root();
    Instruction call = find(f, "call(<v1>.let|<v2>) -> !<v3>");
    assertThat(call.outlinks()).isEmpty();
    assertThat(f.instructions().stream().filter(inst -> inst.toString().startsWith("jf(")).toList())
        .isEmpty();
    // Everything after the call is unreachable, including the right side of the elvis.
    assertThat(find(f, "jt(L3|!<v3> != null)").isDead()).isTrue();
    assertThat(find(f, "r(false) -> !<v4>").isDead()).isTrue();
    assertThat(find(f, "merge(!<v3>, !<v4>) -> !<v5>").isDead()).isTrue();
    ReturnInstruction ret = (ReturnInstruction) find(f, "ret(*|!<v5>) L1");
    assertThat(ret.implicit).isTrue();
    assertThat(ret.isDead()).isTrue();
    assertThat(f.end().hasInLink()).isFalse();
  }

  @Test
  public void ifElseWithLogicalOperators() {
    Graph choose = Compiler.compile(SampleProgram.IF_ELSE_WITH_LOGICAL.tree()).root();
    Instruction and = find(choose, "merge(<v3>, <v4>) -> <v5>");
    assertThat(labels(and)).containsExactly("L2 [result of &&]:");
    assertThat(succs(find(choose, "jf(L2|<v3>)")))
        .containsExactly(find(choose, "r(b) -> <v4>"), and)
        .inOrder();
    Instruction or = find(choose, "merge(<v5>, <v6>) -> <v7>");
    assertThat(labels(or)).containsExactly("L3 [result of ||]:");
    assertThat(succs(find(choose, "jt(L3|<v5>)")))
        .containsExactly(find(choose, "r(c) -> <v6>"), or)
        .inOrder();
    Instruction elseValue = find(choose, "r(2) -> <v9>");
    assertThat(labels(elseValue)).containsExactly("L4 [else branch]:");
    assertThat(succs(find(choose, "jf(L4|<v7>)")))
        .containsExactly(find(choose, "r(1) -> <v8>"), elseValue)
        .inOrder();
    Instruction merge = find(choose, "merge(<v8>, <v9>) -> <v10>");
    assertThat(labels(merge)).containsExactly("L5 [after if]:");
    assertThat(merge.inlinks().stream().map(link -> link.origin).toList())
        .containsExactly(find(choose, "jmp(L5)"), elseValue)
        .inOrder();
    assertThat(succs(merge)).containsExactly(find(choose, "w(y|<v10>)"));
  }

  @Test
  public void elvisWithThrow() {
    Graph require = Compiler.compile(SampleProgram.ELVIS_THROW.tree()).root();
    Instruction thrown = find(require, "throw(<v3>) -> !<v4>");
    assertThat(succs(thrown)).containsExactly(require.error());
    assertThat(require.error().inlinks().stream().map(link -> link.origin).toList())
        .containsExactly(thrown);
    // Only the non-null left side reaches the join.
    Instruction merge = find(require, "merge(<v1>) -> <v5>");
    assertThat(merge.inlinks().stream().map(link -> link.origin).toList())
        .containsExactly(find(require, "jt(L2|<v1> != null)"));
    assertThat(find(require, "call(use|<v6>) -> <v7>").isDead()).isFalse();
  }

  @Test
  public void loops() {
    Graph loops = Compiler.compile(SampleProgram.LOOPS.tree()).root();
    Instruction entry = find(loops, "r(c) -> <v2>");
    assertThat(labels(entry)).containsExactly("L2 [loop entry point]:");
    assertThat(succs(find(loops, "jmp(L2)"))).containsExactly(entry);
    Instruction doWhile = find(loops, "mark(do { if (skip()) continue; work() } while (more()))");
    assertThat(labels(doWhile)).containsExactly("L3 [loop exit point]:");
    assertThat(doWhile.inlinks().stream().map(link -> link.origin).toList())
        .containsExactly(find(loops, "jf(L3|<v2>)"), find(loops, "jmp(L3)"))
        .inOrder();
    Instruction body = find(loops, "mark(if (skip()) continue)");
    assertThat(labels(body)).containsExactly("L5 [loop body entry point]:");
    Instruction condition = find(loops, "call(more) -> <v9>");
    assertThat(labels(condition)).containsExactly("L6 [condition entry point]:");
    assertThat(succs(find(loops, "jmp(L6)"))).containsExactly(condition);
    Instruction backEdge = find(loops, "jt(L5|<v9>)");
    assertThat(succs(backEdge)).containsExactly(loops.end(), body).inOrder();
    assertThat(labels(loops.end())).containsExactly("L7 [loop exit point]:", "L1:").inOrder();
    assertThat(loops.instructions().stream().anyMatch(Instruction::isDead)).isFalse();
  }

  @Test
  public void labeledReturns() {
    GraphForest forest = Compiler.compile(SampleProgram.LABELED_RETURNS.tree());
    Graph scan = forest.root();
    Graph outer = forest.graph("anonymous_0");
    Graph inner = forest.graph("anonymous_1");
    assertThat(forest.graphs()).containsExactly(scan, outer, inner).inOrder();
    assertThat(outer.nested()).containsExactly(inner);

    // return@forEach in the lambda passed to forEach is local.
    ReturnInstruction local = (ReturnInstruction) find(outer, "ret L1");
    assertThat(local.target.isLocal()).isTrue();
    assertThat(succs(local)).containsExactly(outer.end());
    // return in a lambda exits the function.
    ReturnInstruction toScan = (ReturnInstruction) find(outer, "ret L1@scan -> !<v5>");
    assertThat(toScan.outlinks()).isEmpty();
    // return@forEach in the nested lambda exits the outer lambda; an explicit label takes
    // precedence over the name of the called function.
    ReturnInstruction toOuter = (ReturnInstruction) find(inner, "ret L1@anonymous_0");
    assertThat(toOuter.outlinks()).isEmpty();
    assertThat(find(inner, "ret L1 -> !<v1>").isDead()).isFalse();
    assertThat(find(inner, "ret(*|!<v1>) L1").isDead()).isTrue();

    assertThat(scan.incomingTransfers().stream().map(t -> t.ret()).toList())
        .containsExactly(toScan);
    assertThat(outer.incomingTransfers().stream().map(t -> t.ret()).toList())
        .containsExactly(toOuter);
    assertThat(outer.outgoingTransfers().stream().map(t -> t.ret()).toList())
        .containsExactly(toScan);
  }

  @Test
  public void stringTemplate() {
    Graph greet = Compiler.compile(SampleProgram.STRING_TEMPLATE.tree()).root();
    Instruction mark = find(greet, "mark(var s = \"hi $name, ${count()} times\")");
    assertThat(mark.line()).isEqualTo(2);
    assertThat(find(greet, "magic[STRING_TEMPLATE](<v1>, <v2>) -> <v3>").inputs()).hasSize(2);
    find(greet, "w(s|<v3>)");
    find(greet, "w(s|<v4>)");
  }

  @Test
  public void lambdaNamesAreNumberedAcrossTheForest() {
    GraphForest forest = Compiler.compile(SampleProgram.UNCALLED_LAMBDA.tree());
    assertThat(forest.graphs().stream().map(g -> g.name).toList())
        .containsExactly("lazy", "anonymous_0", "anonymous_1")
        .inOrder();
    Graph lazy = forest.root();
    CallInstruction call = (CallInstruction) find(lazy, "call(used) -> <v2>");
    assertThat(call.callees).containsExactly(forest.graph("anonymous_1"));
    assertThat(forest.graph("anonymous_0").kind).isEqualTo(Graph.Kind.LAMBDA);
    assertThat(forest.graph("anonymous_0").parent()).isSameInstanceAs(lazy);
  }

  private static BuildError compileError(Tree.FunctionDecl function) {
    return assertThrows(BuildError.class, () -> Compiler.compile(function));
  }

  @Test
  public void errors() {
    TreeMaker m = new TreeMaker();
    Tree s2 = m.setLine(2).brk();
    BuildError e = compileError(m.setLine(1).funBlock("f", List.of(), s2));
    assertThat(e.msg).isEqualTo("'break' is not inside a loop");
    assertThat(e.lineNum).isEqualTo(2);
    assertThat(e).hasMessageThat().isEqualTo("'break' is not inside a loop (2:0)");

    s2 = m.setLine(2).cont();
    e = compileError(m.setLine(1).funBlock("f", List.of(), s2));
    assertThat(e.msg).isEqualTo("'continue' is not inside a loop");

    s2 = m.setLine(2).retAt("nowhere");
    e = compileError(m.setLine(1).funBlock("f", List.of(), s2));
    assertThat(e.msg).isEqualTo("Unresolved return target '@nowhere'");

    s2 = m.setLine(2).val("a", m.literal(1));
    Tree s3 = m.setLine(3).assign("a", m.literal(2));
    e = compileError(m.setLine(1).funBlock("f", List.of(), s2, s3));
    assertThat(e.msg).isEqualTo("Cannot assign to 'a'");
    assertThat(e.lineNum).isEqualTo(3);

    s2 = m.setLine(2).val("y", m.ifThen(m.name("c"), m.literal(1)));
    e = compileError(m.setLine(1).funBlock("f", List.of("c"), s2));
    assertThat(e.msg).isEqualTo("Expression has no value: if (c) 1");

    // Parameters can't be assigned.
    s2 = m.setLine(2).assign("x", m.literal(1));
    e = compileError(m.setLine(1).funBlock("f", List.of("x"), s2));
    assertThat(e.msg).isEqualTo("Cannot assign to 'x'");
  }

  @Test
  public void breakInLambdaDoesNotLeaveLoop() {
    // while (c) { run { break } }
    TreeMaker m = new TreeMaker();
    Tree s3 = m.setLine(3).call("run", m.lambda(m.brk()));
    Tree s2 = m.setLine(2).whileLoop(m.name("c"), s3);
    GraphForest forest = Compiler.compile(m.setLine(1).funBlock("f", List.of("c"), s2));
    assertThat(forest.failures()).hasSize(1);
    assertThat(forest.failures().get(0).graphName).isEqualTo("anonymous_0");
    assertThat(forest.failures().get(0).cause)
        .hasMessageThat()
        .isEqualTo("'break' is not inside a loop (3:0)");
  }

  @Test
  public void nestedFailureIsIsolated() {
    // fun outer() {
    //   fun inner() {
    //     run { return@outer }
    //   }
    //   inner()
    // }
    TreeMaker m = new TreeMaker();
    Tree s3 = m.setLine(3).call("run", m.lambda(m.retAt("outer")));
    Tree s2 = m.setLine(2).funBlock("inner", List.of(), s3);
    Tree s5 = m.setLine(5).call("inner");
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    PrintStream log = new PrintStream(out, true, StandardCharsets.UTF_8);
    GraphForest forest =
        Compiler.compile(
            m.setLine(1).funBlock("outer", List.of(), s2, s5),
            Compiler.Options.DEFAULT.withLog(log));

    assertThat(forest.failures()).hasSize(1);
    GraphForest.Failure failure = forest.failures().get(0);
    assertThat(failure.graphName).isEqualTo("anonymous_0");
    assertThat(failure.cause).isInstanceOf(BuildError.class);
    assertThat(((BuildError) failure.cause).msg)
        .isEqualTo("'return@outer' cannot leave a local function");
    assertThat(out.toString(StandardCharsets.UTF_8))
        .startsWith("Failed to build anonymous_0: 'return@outer' cannot leave a local function");

    // The lambda is treated as an opaque value.
    Graph inner = forest.graph("inner");
    assertThat(forest.graphs().stream().map(g -> g.name).toList())
        .containsExactly("outer", "inner");
    find(inner, "r({ return@outer }) -> <v0>");
    CallInstruction run = (CallInstruction) find(inner, "call(run|<v0>) -> <v1>");
    assertThat(run.callees).isEmpty();
    assertThat(forest.root().incomingTransfers()).isEmpty();
  }

  @Test
  public void failedLocalFunctionIsNotCallable() {
    // fun outer() {
    //   fun f() { break }
    //   f()
    // }
    TreeMaker m = new TreeMaker();
    Tree s2 = m.setLine(2).funBlock("f", List.of(), m.brk());
    Tree s3 = m.setLine(3).call("f");
    GraphForest forest =
        Compiler.compile(
            m.setLine(1).funBlock("outer", List.of(), s2, s3),
            Compiler.Options.DEFAULT.withLog(
                new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8)));
    assertThat(forest.failures().get(0).graphName).isEqualTo("f");
    Graph outer = forest.root();
    assertThat(outer.nested()).isEmpty();
    CallInstruction call = (CallInstruction) find(outer, "call(f) -> <v0>");
    assertThat(call.callees).isEmpty();
    assertThat(outer.instructions().stream().anyMatch(Instruction::isDead)).isFalse();
  }

  @Test
  public void returnToFunctionByName() {
    // fun f() { run { return@f 1 }; g() }
    TreeMaker m = new TreeMaker();
    Tree s2 = m.setLine(2).call("run", m.lambda(m.retAt("f", m.literal(1))));
    Tree s3 = m.setLine(3).call("g");
    GraphForest forest = Compiler.compile(m.setLine(1).funBlock("f", List.of(), s2, s3));
    Graph lambda = forest.graph("anonymous_0");
    ReturnInstruction ret = (ReturnInstruction) find(lambda, "ret(*|<v0>) L1@f -> !<v1>");
    assertThat(ret.target.isLocal()).isFalse();
    // run isn't known to invoke its argument in place, so g() is still reachable.
    assertThat(find(forest.root(), "call(g) -> <v2>").isDead()).isFalse();
  }

  @Test
  public void verboseLogsEachGraph() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    PrintStream log = new PrintStream(out, true, StandardCharsets.UTF_8);
    Compiler.compile(
        SampleProgram.SAFE_CALL_ELVIS.tree(),
        Compiler.Options.DEFAULT.withVerbose(true).withLog(log));
    String logged = out.toString(StandardCharsets.UTF_8);
    // Nested graphs are finished before their parents.
    int lambda = logged.indexOf("== anonymous_0 ==");
    int f = logged.indexOf("== f ==");
    assertThat(lambda).isAtLeast(0);
    assertThat(f).isGreaterThan(lambda);
  }
}
