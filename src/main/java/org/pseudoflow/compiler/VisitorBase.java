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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import org.pseudoflow.tree.Tree;
import org.pseudoflow.tree.TreeVisitor;

/**
 * A base class for tree visitors that provides two useful functions:
 *
 * <ul>
 *   <li>Every visit method throws an AssertionError unless it is overridden, so that a node type
 *       the subclass didn't expect fails loudly rather than silently doing nothing.
 *   <li>It tracks the node currently being visited, and provides error() methods that
 *       automatically use it as the location of the error.
 * </ul>
 */
abstract class VisitorBase<T> implements TreeVisitor<T> {

  /** The node currently being visited. */
  private Tree currentNode;

  /**
   * Visits {@code node}, binding {@link #currentNode} for the duration of the call.
   *
   * <p>Assumes that if the visit throws an exception, this Visitor will not be used again (no
   * attempt is made to restore the correct currentNode state).
   */
  @CanIgnoreReturnValue
  final T visit(Tree node) {
    Tree prevNode = currentNode;
    currentNode = node;
    nodeChanged(node);
    T result = node.accept(this);
    currentNode = prevNode;
    if (prevNode != null) {
      nodeChanged(prevNode);
    }
    return result;
  }

  /** Called whenever {@link #currentNode} changes. */
  void nodeChanged(Tree node) {}

  /** Returns a {@link BuildError} pointing at the current node. */
  BuildError error(String msg) {
    return Compiler.error(currentNode, msg);
  }

  /** Returns a {@link BuildError} pointing at the current node. */
  @FormatMethod
  BuildError error(String fmt, Object... fmtArgs) {
    return Compiler.error(currentNode, fmt, fmtArgs);
  }

  private static AssertionError unexpected(Tree node) {
    return new AssertionError("Unexpected " + node.getClass().getSimpleName() + ": " + node);
  }

  @Override
  public T visitBlock(Tree.Block block) {
    throw unexpected(block);
  }

  @Override
  public T visitLiteral(Tree.Literal literal) {
    throw unexpected(literal);
  }

  @Override
  public T visitNameRef(Tree.NameRef nameRef) {
    throw unexpected(nameRef);
  }

  @Override
  public T visitStringTemplate(Tree.StringTemplate template) {
    throw unexpected(template);
  }

  @Override
  public T visitVariableDecl(Tree.VariableDecl decl) {
    throw unexpected(decl);
  }

  @Override
  public T visitAssignment(Tree.Assignment assignment) {
    throw unexpected(assignment);
  }

  @Override
  public T visitCall(Tree.Call call) {
    throw unexpected(call);
  }

  @Override
  public T visitLambdaLiteral(Tree.LambdaLiteral lambda) {
    throw unexpected(lambda);
  }

  @Override
  public T visitFunctionDecl(Tree.FunctionDecl decl) {
    throw unexpected(decl);
  }

  @Override
  public T visitReturn(Tree.Return ret) {
    throw unexpected(ret);
  }

  @Override
  public T visitThrow(Tree.Throw t) {
    throw unexpected(t);
  }

  @Override
  public T visitElvis(Tree.Elvis elvis) {
    throw unexpected(elvis);
  }

  @Override
  public T visitIf(Tree.If ifExpr) {
    throw unexpected(ifExpr);
  }

  @Override
  public T visitLogical(Tree.Logical logical) {
    throw unexpected(logical);
  }

  @Override
  public T visitWhileLoop(Tree.WhileLoop loop) {
    throw unexpected(loop);
  }

  @Override
  public T visitBreak(Tree.Break brk) {
    throw unexpected(brk);
  }

  @Override
  public T visitContinue(Tree.Continue cont) {
    throw unexpected(cont);
  }

  @Override
  public T visitCallableRef(Tree.CallableRef ref) {
    throw unexpected(ref);
  }
}
