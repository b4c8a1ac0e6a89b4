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

import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.pseudoflow.code.Branch;
import org.pseudoflow.code.CallInstruction;
import org.pseudoflow.code.DeadDeclaration;
import org.pseudoflow.code.Graph;
import org.pseudoflow.code.GraphBuilder;
import org.pseudoflow.code.Jump;
import org.pseudoflow.code.Label;
import org.pseudoflow.code.Magic;
import org.pseudoflow.code.ReturnInstruction;
import org.pseudoflow.code.ThrowInstruction;
import org.pseudoflow.code.Value;
import org.pseudoflow.code.VariableAccess;
import org.pseudoflow.tree.InvocationKind;
import org.pseudoflow.tree.Nullability;
import org.pseudoflow.tree.Tree;

/**
 * Emits the instructions for statements and expressions within a single graph. Each visit method
 * returns the Value of the visited node, or null if it has none (or it is not needed).
 */
class ExpressionCompiler extends VisitorBase<Value> {
  private final GraphCompiler gc;
  private final GraphBuilder builder;

  /**
   * False if the node being visited is in statement position, i.e. its value will be discarded.
   * Jumps and if-expressions only produce a value when it is needed.
   */
  private boolean valueNeeded;

  ExpressionCompiler(GraphCompiler gc) {
    this.gc = gc;
    this.builder = gc.builder;
  }

  @Override
  void nodeChanged(Tree node) {
    builder.setLine(node.pos.line());
  }

  /** Compiles the given expression, which must produce a value. */
  Value value(Tree.Expression expression) {
    Value result = compile(expression, true);
    if (result == null) {
      throw Compiler.error(expression, "Expression has no value: %s", expression);
    }
    return result;
  }

  /** Compiles the given node and returns its value, or null if it has none. */
  @Nullable Value valueOrNull(Tree node) {
    return compile(node, true);
  }

  /** Compiles the given node, discarding its value. */
  void statement(Tree node) {
    compile(node, false);
  }

  private @Nullable Value compile(Tree node, boolean needed) {
    boolean saved = valueNeeded;
    valueNeeded = needed;
    Value result = visit(node);
    valueNeeded = saved;
    return result;
  }

  /** Compiles a branch of an if-expression, which may be a block. */
  private @Nullable Value branch(Tree node, boolean needed) {
    if (node instanceof Tree.Block block) {
      return gc.compileBlock(block, needed);
    }
    return compile(node, needed);
  }

  /** Emits a read of {@code name} and returns the new value. */
  private Value read(String name, @Nullable Graph callable) {
    Value v = builder.newValue(callable);
    builder.emit(new VariableAccess.Read(name, v));
    return v;
  }

  /** The result of a jump used as an expression; it can never be observed. */
  private @Nullable Value jumpResult() {
    return valueNeeded ? builder.newNonLocalValue() : null;
  }

  @Override
  public Value visitLiteral(Tree.Literal literal) {
    return read(literal.toString(), null);
  }

  @Override
  public Value visitNameRef(Tree.NameRef nameRef) {
    Scope.Entry entry = gc.scope.lookup(nameRef.name);
    return read(nameRef.name, (entry == null) ? null : entry.callable);
  }

  @Override
  public Value visitCallableRef(Tree.CallableRef ref) {
    // The reflective handle (if any) is opaque here; only local functions are known targets.
    Scope.Entry entry = gc.scope.lookup(ref.name);
    return read(ref.toString(), (entry == null) ? null : entry.callable);
  }

  @Override
  public Value visitStringTemplate(Tree.StringTemplate template) {
    List<Value> parts = new ArrayList<>();
    for (Tree.Expression part : template.parts) {
      if (!(part instanceof Tree.Literal literal && literal.kind == Tree.Literal.Kind.STRING)) {
        parts.add(value(part));
      }
    }
    Value result = builder.newValue();
    builder.emit(Magic.stringTemplate(parts, result));
    return result;
  }

  @Override
  public @Nullable Value visitVariableDecl(Tree.VariableDecl decl) {
    builder.emit(new VariableAccess.Declare(decl.mutable ? "var" : "val", decl.name));
    Graph callable = null;
    if (decl.initializer != null) {
      Value v = value(decl.initializer);
      builder.emit(new VariableAccess.Write(decl.name, v));
      callable = v.callable();
    }
    gc.scope.declare(decl.name, decl.mutable, callable);
    return null;
  }

  @Override
  public @Nullable Value visitAssignment(Tree.Assignment assignment) {
    Scope.Entry entry = gc.scope.lookup(assignment.name);
    if (entry != null && !entry.mutable) {
      throw error("Cannot assign to '%s'", assignment.name);
    }
    Value v = value(assignment.value);
    builder.emit(new VariableAccess.Write(assignment.name, v));
    if (entry != null) {
      entry.callable = v.callable();
    }
    return null;
  }

  /**
   * A safe call {@code x?.f(...)} tests the receiver and, if it is null, jumps directly to a join
   * that merges the receiver (i.e. null) with the result of the call. If the receiver is known to
   * be non-null there is no test; if it is known to be null the call is unreachable.
   */
  @Override
  public Value visitCall(Tree.Call call) {
    Value receiver = (call.receiver == null) ? null : value(call.receiver);
    if (!call.safe || call.receiver.nullability == Nullability.NON_NULL) {
      return emitCall(call, receiver, false);
    }
    Label join = builder.newLabel("result of safe call");
    if (call.receiver.nullability == Nullability.NULL) {
      builder.emit(new Jump(join, null, receiver, null));
    } else {
      builder.emit(new Branch(false, join, receiver, Branch.Test.NON_NULL, receiver));
    }
    Value result = emitCall(call, receiver, true);
    builder.bind(join, result);
    return builder.merge(List.of(receiver, result));
  }

  /**
   * Emits the arguments and the call itself. An in-place call doesn't complete normally if any of
   * its lambda arguments can't; its result is then non-local and it has no successor.
   */
  private Value emitCall(Tree.Call call, @Nullable Value receiver, boolean nullPropagating) {
    List<Value> args = new ArrayList<>();
    List<Graph> callees = new ArrayList<>();
    boolean completes = true;
    if (call.receiver == null) {
      Scope.Entry entry = gc.scope.lookup(call.name);
      if (entry != null && entry.callable != null) {
        callees.add(entry.callable);
      }
    } else if (receiver.callable() != null) {
      callees.add(receiver.callable());
    }
    for (Tree.Expression arg : call.args) {
      Value v;
      if (arg instanceof Tree.LambdaLiteral lambda) {
        v = lambdaValue(lambda, (lambda.label != null) ? lambda.label : call.name);
        if (call.invocation == InvocationKind.IN_PLACE
            && v.callable() != null
            && !gc.forest.completesNormally(v.callable())) {
          completes = false;
        }
      } else {
        v = value(arg);
      }
      if (v.callable() != null && !callees.contains(v.callable())) {
        callees.add(v.callable());
      }
      args.add(v);
    }
    Value result = completes ? builder.newValue() : builder.newNonLocalValue();
    builder.emit(
        new CallInstruction(
            receiver, call.name, args, nullPropagating, callees, completes, result));
    return result;
  }

  @Override
  public Value visitLambdaLiteral(Tree.LambdaLiteral lambda) {
    return lambdaValue(lambda, lambda.label);
  }

  /**
   * Builds a separate graph for the lambda's body, then emits a jump over its (dead) declaration
   * and a read of the lambda. If the body can't be built, the lambda is just an opaque value.
   */
  private Value lambdaValue(Tree.LambdaLiteral lambda, @Nullable String label) {
    String name = gc.forest.nextAnonymousName();
    GraphCompiler sub =
        new GraphCompiler(gc.forest, gc, name, Graph.Kind.LAMBDA, lambda.pos.line(), label);
    Graph graph = gc.forest.compileNested(sub, s -> s.compileLambda(lambda));
    if (graph == null) {
      return read(lambda.toString(), null);
    }
    skipDeclaration(graph, lambda);
    return read(name, graph);
  }

  private void skipDeclaration(Graph graph, Tree declaration) {
    Label skip = builder.newLabel("after local declaration");
    builder.emit(new Jump(skip, graph, null, null));
    builder.emit(new DeadDeclaration(declaration.toString()));
    builder.bind(skip);
  }

  /**
   * A local function is declared before its body is compiled, so that it can call itself; its
   * declaration statement is skipped like a lambda's.
   */
  @Override
  public @Nullable Value visitFunctionDecl(Tree.FunctionDecl decl) {
    GraphCompiler sub =
        new GraphCompiler(
            gc.forest, gc, decl.name, Graph.Kind.FUNCTION, decl.pos.line(), decl.name);
    Scope.Entry entry = gc.scope.declare(decl.name, false, sub.graph());
    Graph graph = gc.forest.compileNested(sub, s -> s.compileFunction(decl));
    if (graph == null) {
      entry.callable = null;
    } else {
      skipDeclaration(graph, decl);
    }
    return null;
  }

  @Override
  public @Nullable Value visitReturn(Tree.Return ret) {
    GraphCompiler target = gc.returnTarget(ret.label);
    if (target == null) {
      if (gc.hasOuterLabel(ret.label)) {
        throw error("'return@%s' cannot leave a local function", ret.label);
      }
      throw error("Unresolved return target '@%s'", ret.label);
    }
    Value v = (ret.value == null) ? null : value(ret.value);
    ReturnInstruction.Target dest =
        (target == gc)
            ? new ReturnInstruction.Local(gc.graph().exitLabel())
            : new ReturnInstruction.NonLocal(target.graph());
    Value result = jumpResult();
    builder.emit(new ReturnInstruction(dest, v, false, result));
    return result;
  }

  @Override
  public @Nullable Value visitThrow(Tree.Throw t) {
    Value exception = value(t.exception);
    Value result = jumpResult();
    builder.emit(new ThrowInstruction(exception, gc.graph().errorLabel(), result));
    return result;
  }

  /**
   * {@code a ?: b} jumps to the join with the value of {@code a} if it is non-null; otherwise it
   * evaluates {@code b}, and the join merges the two.
   */
  @Override
  public Value visitElvis(Tree.Elvis elvis) {
    Value left = value(elvis.left);
    Label join = builder.newLabel("result of elvis");
    builder.emit(new Branch(true, join, left, Branch.Test.NON_NULL, left));
    Value right = value(elvis.right);
    builder.bind(join, right);
    return builder.merge(List.of(left, right));
  }

  @Override
  public @Nullable Value visitIf(Tree.If ifExpr) {
    boolean needed = valueNeeded;
    Value condition = value(ifExpr.condition);
    Label elseLabel = builder.newLabel((ifExpr.elseBranch != null) ? "else branch" : "after if");
    builder.emit(new Branch(false, elseLabel, condition, Branch.Test.BOOLEAN, null));
    Value thenValue = branch(ifExpr.thenBranch, needed);
    if (ifExpr.elseBranch == null) {
      builder.bind(elseLabel);
      return null;
    }
    Label end = builder.newLabel("after if");
    builder.emit(new Jump(end, null, thenValue, null));
    builder.bind(elseLabel);
    Value elseValue = branch(ifExpr.elseBranch, needed);
    builder.bind(end, elseValue);
    if (!needed || thenValue == null || elseValue == null) {
      return null;
    }
    return builder.merge(List.of(thenValue, elseValue));
  }

  @Override
  public Value visitLogical(Tree.Logical logical) {
    boolean isOr = logical.op == Tree.Logical.Op.OR;
    Value left = value(logical.left);
    Label end = builder.newLabel(isOr ? "result of ||" : "result of &&");
    builder.emit(new Branch(isOr, end, left, Branch.Test.BOOLEAN, left));
    Value right = value(logical.right);
    builder.bind(end, right);
    return builder.merge(List.of(left, right));
  }

  @Override
  public @Nullable Value visitWhileLoop(Tree.WhileLoop loop) {
    if (loop.doWhile) {
      Label body = builder.newLabel("loop body entry point");
      Label condition = builder.newLabel("condition entry point");
      Label exit = builder.newLabel("loop exit point");
      builder.bind(body);
      gc.pushLoop(new GraphCompiler.Loop(condition, exit));
      gc.compileBlock(loop.body, false);
      gc.popLoop();
      builder.bind(condition);
      Value test = value(loop.condition);
      builder.emit(new Branch(true, body, test, Branch.Test.BOOLEAN, null));
      builder.bind(exit);
    } else {
      Label entry = builder.newLabel("loop entry point");
      Label exit = builder.newLabel("loop exit point");
      builder.bind(entry);
      if (!isTrue(loop.condition)) {
        Value test = value(loop.condition);
        builder.emit(new Branch(false, exit, test, Branch.Test.BOOLEAN, null));
      }
      gc.pushLoop(new GraphCompiler.Loop(entry, exit));
      gc.compileBlock(loop.body, false);
      gc.popLoop();
      builder.emit(Jump.to(entry));
      builder.bind(exit);
    }
    return null;
  }

  private static boolean isTrue(Tree.Expression expression) {
    return expression instanceof Tree.Literal literal && Boolean.TRUE.equals(literal.value);
  }

  @Override
  public @Nullable Value visitBreak(Tree.Break brk) {
    GraphCompiler.Loop loop = gc.currentLoop();
    if (loop == null) {
      throw error("'break' is not inside a loop");
    }
    Value result = jumpResult();
    builder.emit(new Jump(loop.breakLabel(), null, null, result));
    return result;
  }

  @Override
  public @Nullable Value visitContinue(Tree.Continue cont) {
    GraphCompiler.Loop loop = gc.currentLoop();
    if (loop == null) {
      throw error("'continue' is not inside a loop");
    }
    Value result = jumpResult();
    builder.emit(new Jump(loop.continueLabel(), null, null, result));
    return result;
  }
}
