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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.pseudoflow.code.Graph;
import org.pseudoflow.code.GraphBuilder;
import org.pseudoflow.code.Label;
import org.pseudoflow.code.Magic;
import org.pseudoflow.code.Mark;
import org.pseudoflow.code.ReturnInstruction;
import org.pseudoflow.code.Value;
import org.pseudoflow.code.VariableAccess;
import org.pseudoflow.tree.Tree;

/**
 * Compiles the body of one function or lambda literal into a Graph. Nested lambdas and local
 * functions get their own GraphCompiler, whose {@link #parent} is this one.
 */
final class GraphCompiler {
  final ForestCompiler forest;
  final GraphBuilder builder;
  final @Nullable GraphCompiler parent;

  /**
   * The name that {@code return@name} uses to target this graph: a function's name, a lambda's
   * explicit label, or the name of the function a lambda is passed to. May be null for a lambda.
   */
  final @Nullable String label;

  /** The innermost scope at the current point of compilation. */
  Scope scope;

  final ExpressionCompiler expressions;

  /** The loops enclosing the current point of compilation, innermost first. */
  private final Deque<Loop> loops = new ArrayDeque<>();

  /** The targets for {@code continue} and {@code break} in a loop. */
  record Loop(Label continueLabel, Label breakLabel) {}

  GraphCompiler(
      ForestCompiler forest,
      @Nullable GraphCompiler parent,
      String name,
      Graph.Kind kind,
      int line,
      @Nullable String label) {
    this.forest = forest;
    this.parent = parent;
    this.label = label;
    this.builder = new GraphBuilder(name, kind, (parent == null) ? null : parent.graph(), line);
    this.scope = new Scope((parent == null) ? null : parent.scope);
    this.expressions = new ExpressionCompiler(this);
  }

  Graph graph() {
    return builder.graph();
  }

  Graph.Kind kind() {
    return graph().kind;
  }

  void compileFunction(Tree.FunctionDecl function) {
    declareParams(function.params);
    if (function.expressionBody != null) {
      emitImplicitReturn(expressions.value(function.expressionBody));
    } else {
      compileBlock(function.blockBody, false);
    }
  }

  /**
   * A lambda always ends with a return of its last statement's value. If the body's last statement
   * is itself a jump that return is unreachable, and serves as the lambda's shadow return.
   */
  void compileLambda(Tree.LambdaLiteral lambda) {
    declareParams(lambda.params);
    emitImplicitReturn(compileBlock(lambda.body, true));
  }

  private void declareParams(List<String> params) {
    for (String param : params) {
      builder.emit(new VariableAccess.Declare(null, param));
      Value initial = builder.newValue();
      builder.emit(Magic.fakeInitializer(param, initial));
      builder.emit(new VariableAccess.Write(param, initial));
      scope.declare(param, false, null);
    }
  }

  private void emitImplicitReturn(@Nullable Value value) {
    builder.emit(
        new ReturnInstruction(
            new ReturnInstruction.Local(graph().exitLabel()), value, true, null));
  }

  /**
   * Compiles the statements of a block in a new scope, each preceded by a {@link Mark}. If {@code
   * valueNeeded} is true returns the value of the last statement, or null if it has none.
   */
  @Nullable Value compileBlock(Tree.Block block, boolean valueNeeded) {
    Scope saved = scope;
    scope = scope.nested();
    Value result = null;
    List<Tree> statements = block.statements;
    for (int i = 0; i < statements.size(); i++) {
      Tree statement = statements.get(i);
      builder.setLine(statement.pos.line());
      builder.emit(new Mark(statement.toString()));
      if (valueNeeded && i == statements.size() - 1) {
        result = expressions.valueOrNull(statement);
      } else {
        expressions.statement(statement);
      }
    }
    scope = saved;
    return result;
  }

  /**
   * Returns the GraphCompiler whose graph a return with the given label (or no label) exits, or
   * null if there is none in this function.
   *
   * <p>An unlabeled return exits the innermost enclosing function; a labeled return exits the
   * innermost enclosing function or lambda with that label. Returns may leave any number of
   * lambdas, but never a function.
   */
  @Nullable GraphCompiler returnTarget(@Nullable String returnLabel) {
    for (GraphCompiler gc = this; gc != null; gc = gc.parent) {
      if ((returnLabel == null) ? gc.kind() == Graph.Kind.FUNCTION : returnLabel.equals(gc.label)) {
        return gc;
      } else if (gc.kind() == Graph.Kind.FUNCTION) {
        break;
      }
    }
    return null;
  }

  /** Returns true if some graph enclosing this one (at any depth) has the given label. */
  boolean hasOuterLabel(String returnLabel) {
    for (GraphCompiler gc = this; gc != null; gc = gc.parent) {
      if (returnLabel.equals(gc.label)) {
        return true;
      }
    }
    return false;
  }

  void pushLoop(Loop loop) {
    loops.push(loop);
  }

  void popLoop() {
    loops.pop();
  }

  /** The innermost loop of this graph enclosing the current point, or null. */
  @Nullable Loop currentLoop() {
    return loops.peek();
  }
}
