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

import com.google.common.base.VerifyException;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;
import org.pseudoflow.code.ForestReachability;
import org.pseudoflow.code.Graph;
import org.pseudoflow.code.GraphForest;
import org.pseudoflow.code.GraphListing;
import org.pseudoflow.code.GraphVerifier;
import org.pseudoflow.tree.Tree;

/**
 * Holds the state shared by all the GraphCompilers of one compilation: options, the counter used
 * to name lambdas, and the failures of nested graphs.
 */
final class ForestCompiler {
  final Compiler.Options options;

  private int anonymousCount;
  private final List<GraphForest.Failure> failures = new ArrayList<>();

  ForestCompiler(Compiler.Options options) {
    this.options = options;
  }

  GraphForest compile(Tree.FunctionDecl function) {
    GraphCompiler gc =
        new GraphCompiler(
            this, null, function.name, Graph.Kind.FUNCTION, function.pos.line(), function.name);
    gc.compileFunction(function);
    Graph root = finish(gc);
    return new GraphForest(root, failures);
  }

  /** Returns the name for the next lambda literal's graph. */
  String nextAnonymousName() {
    return "anonymous_" + anonymousCount++;
  }

  /**
   * Calls {@code body} to compile a lambda or local function graph and finishes it. If that fails
   * the failure is recorded and logged and null is returned; the caller should continue as if the
   * graph didn't exist.
   */
  @Nullable Graph compileNested(GraphCompiler gc, Consumer<GraphCompiler> body) {
    try {
      body.accept(gc);
      return finish(gc);
    } catch (BuildError | VerifyException | IllegalStateException | IllegalArgumentException e) {
      gc.builder.abandon();
      failures.add(new GraphForest.Failure(gc.graph().name, e));
      log("Failed to build %s: %s", gc.graph().name, e.getMessage());
      return null;
    }
  }

  private Graph finish(GraphCompiler gc) {
    Graph graph = gc.builder.finish();
    if (options.checkInvariants) {
      GraphVerifier.check(graph);
    }
    if (options.verbose) {
      log("%s", GraphListing.of(graph));
    }
    gc.builder.attach();
    return graph;
  }

  /**
   * Returns true if a finished lambda graph can complete normally, i.e. its END is reachable when
   * it is entered.
   */
  boolean completesNormally(Graph graph) {
    return ForestReachability.from(graph).completesNormally(graph);
  }

  @FormatMethod
  void log(String fmt, Object... args) {
    options.log.println(String.format(fmt, args));
  }
}
