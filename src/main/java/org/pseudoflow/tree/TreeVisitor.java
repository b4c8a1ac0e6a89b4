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

/** A visitor over {@link Tree} nodes; every node type must be handled. */
public interface TreeVisitor<T> {
  T visitBlock(Tree.Block block);

  T visitLiteral(Tree.Literal literal);

  T visitNameRef(Tree.NameRef nameRef);

  T visitStringTemplate(Tree.StringTemplate template);

  T visitVariableDecl(Tree.VariableDecl decl);

  T visitAssignment(Tree.Assignment assignment);

  T visitCall(Tree.Call call);

  T visitLambdaLiteral(Tree.LambdaLiteral lambda);

  T visitFunctionDecl(Tree.FunctionDecl decl);

  T visitReturn(Tree.Return ret);

  T visitThrow(Tree.Throw t);

  T visitElvis(Tree.Elvis elvis);

  T visitIf(Tree.If ifExpr);

  T visitLogical(Tree.Logical logical);

  T visitWhileLoop(Tree.WhileLoop loop);

  T visitBreak(Tree.Break brk);

  T visitContinue(Tree.Continue cont);

  T visitCallableRef(Tree.CallableRef ref);
}
