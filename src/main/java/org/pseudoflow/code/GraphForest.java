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
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The graph of an outer function together with the graphs of every lambda literal and local
 * function nested in it. Graphs refer to each other only through {@link Graph#nested}, {@link
 * CallInstruction#callees}, {@link Jump#skipped}, and non-local return targets.
 */
public final class GraphForest {

  /** A nested graph that could not be built; its parent was built without it. */
  public static final class Failure {
    public final String graphName;
    public final RuntimeException cause;

    public Failure(String graphName, RuntimeException cause) {
      this.graphName = graphName;
      this.cause = cause;
    }

    @Override
    public String toString() {
      return graphName + ": " + cause.getMessage();
    }
  }

  private final Graph root;
  private final ImmutableList<Graph> graphs;
  private final ImmutableList<Failure> failures;

  public GraphForest(Graph root, List<Failure> failures) {
    this.root = root;
    ImmutableList.Builder<Graph> builder = ImmutableList.builder();
    addPreOrder(root, builder);
    this.graphs = builder.build();
    this.failures = ImmutableList.copyOf(failures);
  }

  private static void addPreOrder(Graph graph, ImmutableList.Builder<Graph> builder) {
    builder.add(graph);
    for (Graph g : graph.nested) {
      addPreOrder(g, builder);
    }
  }

  public Graph root() {
    return root;
  }

  /** All graphs, parents before the graphs nested in them and siblings in source order. */
  public ImmutableList<Graph> graphs() {
    return graphs;
  }

  public @Nullable Graph graph(String name) {
    for (Graph g : graphs) {
      if (g.name.equals(name)) {
        return g;
      }
    }
    return null;
  }

  public ImmutableList<Failure> failures() {
    return failures;
  }

  @Override
  public String toString() {
    return GraphListing.toString(GraphListing.ofForest(this));
  }
}
