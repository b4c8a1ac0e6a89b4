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

import com.google.common.base.VerifyException;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.pseudoflow.compiler.Compiler;
import org.pseudoflow.testing.SampleProgram;

@RunWith(TestParameterInjector.class)
public class GraphVerifierTest {

  @Test
  public void compiledGraphsAreValid(@TestParameter SampleProgram program) {
    GraphForest forest =
        Compiler.compile(program.tree(), Compiler.Options.DEFAULT.withCheckInvariants(false));
    assertThat(forest.failures()).isEmpty();
    for (Graph graph : forest.graphs()) {
      GraphVerifier.check(graph);
    }
  }

  @Test
  public void mergeInputsOutOfOrder() {
    GraphBuilder b = new GraphBuilder("f", Graph.Kind.FUNCTION, null, 1);
    Value left = b.newValue();
    b.emit(new VariableAccess.Read("a", left));
    Label join = b.newLabel(null);
    b.emit(new Branch(true, join, left, Branch.Test.NON_NULL, left));
    Value right = b.newValue();
    b.emit(new VariableAccess.Read("b", right));
    b.bind(join, right);
    b.emit(new Merge(List.of(right, left), b.newValue()));
    Graph g = b.finish();
    VerifyException e = assertThrows(VerifyException.class, () -> GraphVerifier.check(g));
    assertThat(e).hasMessageThat().contains("does not match its link");
  }

  @Test
  public void valueUsedBeforeProduced() {
    GraphBuilder b = new GraphBuilder("f", Graph.Kind.FUNCTION, null, 1);
    Value v = b.newValue();
    b.emit(new VariableAccess.Write("x", v));
    b.emit(new VariableAccess.Read("x", v));
    Graph g = b.finish();
    VerifyException e = assertThrows(VerifyException.class, () -> GraphVerifier.check(g));
    assertThat(e).hasMessageThat().isEqualTo("f: n1 uses <v0> before it is produced");
  }

  @Test
  public void localReturnMustExit() {
    GraphBuilder b = new GraphBuilder("f", Graph.Kind.FUNCTION, null, 1);
    Label label = b.newLabel(null);
    b.emit(new ReturnInstruction(new ReturnInstruction.Local(label), null, false, null));
    b.bind(label);
    b.emit(new Mark("x"));
    Graph g = b.finish();
    VerifyException e = assertThrows(VerifyException.class, () -> GraphVerifier.check(g));
    assertThat(e).hasMessageThat().isEqualTo("f: local return not to L1");
  }

  @Test
  public void liveCallWithoutSuccessorMustNotComplete() {
    // A call that doesn't complete normally is terminal.
    GraphBuilder b = new GraphBuilder("f", Graph.Kind.FUNCTION, null, 1);
    b.emit(
        new CallInstruction(
            null, "fail", List.of(), false, List.of(), false, b.newNonLocalValue()));
    Graph g = b.finish();
    GraphVerifier.check(g);
    assertThat(g.end().hasInLink()).isFalse();
  }
}
