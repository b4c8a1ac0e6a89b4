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

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.FormatMethod;
import java.io.PrintStream;
import org.pseudoflow.code.GraphForest;
import org.pseudoflow.tree.Tree;

/** Static methods for building control-flow graphs from trees. */
public class Compiler {

  private Compiler() {}

  /** Settings for a compilation; instances are immutable. */
  public static final class Options {
    public static final Options DEFAULT = new Options(false, true, System.err);

    /** If true, the listing of each graph is logged as it is finished. */
    public final boolean verbose;

    /** If true, each graph is checked with {@link org.pseudoflow.code.GraphVerifier}. */
    public final boolean checkInvariants;

    /** Where log messages are written. */
    public final PrintStream log;

    private Options(boolean verbose, boolean checkInvariants, PrintStream log) {
      this.verbose = verbose;
      this.checkInvariants = checkInvariants;
      this.log = Preconditions.checkNotNull(log);
    }

    public Options withVerbose(boolean verbose) {
      return new Options(verbose, checkInvariants, log);
    }

    public Options withCheckInvariants(boolean checkInvariants) {
      return new Options(verbose, checkInvariants, log);
    }

    public Options withLog(PrintStream log) {
      return new Options(verbose, checkInvariants, log);
    }
  }

  /** Builds the graphs for the given function and everything nested in it. */
  public static GraphForest compile(Tree.FunctionDecl function) {
    return compile(function, Options.DEFAULT);
  }

  /**
   * Builds the graphs for the given function and everything nested in it. If a nested lambda or
   * local function cannot be built the failure is recorded in the result's {@link
   * GraphForest#failures}; a failure in {@code function} itself is thrown.
   *
   * @throws BuildError if the tree for {@code function} (outside any nested lambda or function)
   *     is invalid
   */
  public static GraphForest compile(Tree.FunctionDecl function, Options options) {
    return new ForestCompiler(options).compile(function);
  }

  /** Returns a BuildError with the given message and the position of {@code node}. */
  static BuildError error(Tree node, String msg) {
    return new BuildError(msg, node.pos.line(), node.pos.column());
  }

  /** Returns a BuildError with the given message and the position of {@code node}. */
  @FormatMethod
  static BuildError error(Tree node, String fmt, Object... fmtArgs) {
    return error(node, String.format(fmt, fmtArgs));
  }
}
