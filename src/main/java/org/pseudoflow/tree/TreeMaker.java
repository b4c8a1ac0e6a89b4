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

package org.pseudoflow.tree;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.pseudoflow.reflect.CallableReference;

/**
 * A convenience factory for Trees. Each node is given the position most recently set with {@link
 * #setLine}; nodes on the same line get increasing column numbers.
 *
 * <p>Names are {@link Nullability#UNKNOWN} and calls are {@link InvocationKind#UNKNOWN} unless
 * otherwise specified.
 */
public class TreeMaker {
  private int line = 1;
  private int column;

  /** Sets the line number for subsequently-created nodes. */
  @CanIgnoreReturnValue
  public TreeMaker setLine(int line) {
    this.line = line;
    this.column = 0;
    return this;
  }

  private SourcePos pos() {
    return new SourcePos(line, column++);
  }

  public Tree.Block block(Tree... statements) {
    return new Tree.Block(pos(), List.of(statements));
  }

  public Tree.Literal literal(boolean b) {
    return new Tree.Literal(pos(), Tree.Literal.Kind.BOOLEAN, b);
  }

  public Tree.Literal literal(long n) {
    return new Tree.Literal(pos(), Tree.Literal.Kind.NUMBER, n);
  }

  public Tree.Literal literal(String s) {
    return new Tree.Literal(pos(), Tree.Literal.Kind.STRING, s);
  }

  public Tree.Literal nullLiteral() {
    return new Tree.Literal(pos(), Tree.Literal.Kind.NULL, null);
  }

  public Tree.NameRef name(String name) {
    return name(name, Nullability.UNKNOWN);
  }

  public Tree.NameRef name(String name, Nullability nullability) {
    return new Tree.NameRef(pos(), name, nullability);
  }

  public Tree.StringTemplate template(Tree.Expression... parts) {
    return new Tree.StringTemplate(pos(), List.of(parts));
  }

  public Tree.VariableDecl val(String name, Tree.Expression initializer) {
    return new Tree.VariableDecl(pos(), name, false, initializer);
  }

  public Tree.VariableDecl var(String name, Tree.@Nullable Expression initializer) {
    return new Tree.VariableDecl(pos(), name, true, initializer);
  }

  public Tree.Assignment assign(String name, Tree.Expression value) {
    return new Tree.Assignment(pos(), name, value);
  }

  public Tree.Call call(String name, Tree.Expression... args) {
    return newCall(null, name, false, InvocationKind.UNKNOWN, args);
  }

  public Tree.Call call(Tree.Expression receiver, String name, Tree.Expression... args) {
    return newCall(receiver, name, false, InvocationKind.UNKNOWN, args);
  }

  public Tree.Call safeCall(Tree.Expression receiver, String name, Tree.Expression... args) {
    return newCall(receiver, name, true, InvocationKind.UNKNOWN, args);
  }

  /** A call to a function that invokes each of its lambda arguments exactly once. */
  public Tree.Call inlineCall(String name, Tree.Expression... args) {
    return newCall(null, name, false, InvocationKind.IN_PLACE, args);
  }

  public Tree.Call inlineCall(Tree.Expression receiver, String name, Tree.Expression... args) {
    return newCall(receiver, name, false, InvocationKind.IN_PLACE, args);
  }

  public Tree.Call safeInlineCall(
      Tree.Expression receiver, String name, Tree.Expression... args) {
    return newCall(receiver, name, true, InvocationKind.IN_PLACE, args);
  }

  private Tree.Call newCall(
      Tree.@Nullable Expression receiver,
      String name,
      boolean safe,
      InvocationKind invocation,
      Tree.Expression... args) {
    return new Tree.Call(
        pos(), receiver, name, List.of(args), safe, invocation, Nullability.UNKNOWN);
  }

  public Tree.LambdaLiteral lambda(Tree... statements) {
    return new Tree.LambdaLiteral(pos(), null, ImmutableList.of(), block(statements));
  }

  public Tree.LambdaLiteral lambdaWithParams(List<String> params, Tree... statements) {
    return new Tree.LambdaLiteral(pos(), null, params, block(statements));
  }

  public Tree.LambdaLiteral labeledLambda(String label, Tree... statements) {
    return new Tree.LambdaLiteral(pos(), label, ImmutableList.of(), block(statements));
  }

  /** An expression-bodied function, {@code fun name(params) = body}. */
  public Tree.FunctionDecl fun(String name, List<String> params, Tree.Expression body) {
    return new Tree.FunctionDecl(pos(), name, params, body, null);
  }

  /** A block-bodied function, {@code fun name(params) { statements }}. */
  public Tree.FunctionDecl funBlock(String name, List<String> params, Tree... statements) {
    return new Tree.FunctionDecl(pos(), name, params, null, block(statements));
  }

  public Tree.Return ret() {
    return new Tree.Return(pos(), null, null);
  }

  public Tree.Return ret(Tree.Expression value) {
    return new Tree.Return(pos(), null, value);
  }

  public Tree.Return retAt(String label) {
    return new Tree.Return(pos(), label, null);
  }

  public Tree.Return retAt(String label, Tree.Expression value) {
    return new Tree.Return(pos(), label, value);
  }

  public Tree.Throw throwing(Tree.Expression exception) {
    return new Tree.Throw(pos(), exception);
  }

  public Tree.Elvis elvis(Tree.Expression left, Tree.Expression right) {
    return new Tree.Elvis(pos(), left, right, right.nullability);
  }

  public Tree.If ifThen(Tree.Expression condition, Tree thenBranch) {
    return new Tree.If(pos(), condition, thenBranch, null, Nullability.UNKNOWN);
  }

  public Tree.If ifElse(Tree.Expression condition, Tree thenBranch, Tree elseBranch) {
    return new Tree.If(pos(), condition, thenBranch, elseBranch, Nullability.UNKNOWN);
  }

  public Tree.Logical and(Tree.Expression left, Tree.Expression right) {
    return new Tree.Logical(pos(), Tree.Logical.Op.AND, left, right);
  }

  public Tree.Logical or(Tree.Expression left, Tree.Expression right) {
    return new Tree.Logical(pos(), Tree.Logical.Op.OR, left, right);
  }

  public Tree.WhileLoop whileLoop(Tree.Expression condition, Tree... body) {
    return new Tree.WhileLoop(pos(), condition, block(body), false);
  }

  public Tree.WhileLoop doWhile(Tree.Expression condition, Tree... body) {
    return new Tree.WhileLoop(pos(), condition, block(body), true);
  }

  public Tree.Break brk() {
    return new Tree.Break(pos());
  }

  public Tree.Continue cont() {
    return new Tree.Continue(pos());
  }

  public Tree.CallableRef ref(String name) {
    return new Tree.CallableRef(pos(), name, null);
  }

  public Tree.CallableRef ref(String name, CallableReference handle) {
    return new Tree.CallableRef(pos(), name, handle);
  }
}
