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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.pseudoflow.reflect.CallableReference;

/**
 * An immutable statement/expression tree, as produced by the parser and validated by the type
 * checker. Every node carries a {@link SourcePos}; expressions also carry the {@link Nullability}
 * that the type checker determined for them.
 *
 * <p>Trees are usually constructed with a {@link TreeMaker}.
 */
public abstract class Tree {
  public final SourcePos pos;

  Tree(SourcePos pos) {
    this.pos = Preconditions.checkNotNull(pos);
  }

  public abstract <T> T accept(TreeVisitor<T> visitor);

  /** Returns this tree rendered as (single-line) source text. */
  @Override
  public String toString() {
    return TreePrinter.print(this);
  }

  /** A Tree that produces a value. */
  public abstract static class Expression extends Tree {
    public final Nullability nullability;

    Expression(SourcePos pos, Nullability nullability) {
      super(pos);
      this.nullability = nullability;
    }
  }

  /** A sequence of statements; the value of a block (if any) is the value of its last statement. */
  public static final class Block extends Tree {
    public final ImmutableList<Tree> statements;

    public Block(SourcePos pos, List<? extends Tree> statements) {
      super(pos);
      this.statements = ImmutableList.copyOf(statements);
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
      return visitor.visitBlock(this);
    }
  }

  public static final class Literal extends Expression {
    public enum Kind {
      BOOLEAN,
      NUMBER,
      STRING,
      NULL
    }

    public final Kind kind;

    /** A Boolean, Number, or String; null iff {@link #kind} is {@link Kind#NULL}. */
    public final @Nullable Object value;

    public Literal(SourcePos pos, Kind kind, @Nullable Object value) {
      super(pos, kind == Kind.NULL ? Nullability.NULL : Nullability.NON_NULL);
      Preconditions.checkArgument((kind == Kind.NULL) == (value == null));
      this.kind = kind;
      this.value = value;
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
      return visitor.visitLiteral(this);
    }
  }

  /** A reference to a local variable, parameter, local function, or some external name. */
  public static final class NameRef extends Expression {
    public final String name;

    public NameRef(SourcePos pos, String name, Nullability nullability) {
      super(pos, nullability);
      this.name = name;
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
      return visitor.visitNameRef(this);
    }
  }

  /**
   * A string template such as {@code "a${x}b"}; string literal parts are included verbatim, any
   * other part is interpolated.
   */
  public static final class StringTemplate extends Expression {
    public final ImmutableList<Expression> parts;

    public StringTemplate(SourcePos pos, List<? extends Expression> parts) {
      super(pos, Nullability.NON_NULL);
      this.parts = ImmutableList.copyOf(parts);
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
      return visitor.visitStringTemplate(this);
    }
  }

  /** A {@code val} or {@code var} declaration. */
  public static final class VariableDecl extends Tree {
    public final String name;
    public final boolean mutable;
    public final @Nullable Expression initializer;

    public VariableDecl(
        SourcePos pos, String name, boolean mutable, @Nullable Expression initializer) {
      super(pos);
      Preconditions.checkArgument(
          mutable || initializer != null, "val %s has no initializer", name);
      this.name = name;
      this.mutable = mutable;
      this.initializer = initializer;
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
      return visitor.visitVariableDecl(this);
    }
  }

  public static final class Assignment extends Tree {
    public final String name;
    public final Expression value;

    public Assignment(SourcePos pos, String name, Expression value) {
      super(pos);
      this.name = name;
      this.value = value;
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
      return visitor.visitAssignment(this);
    }
  }

  /**
   * A call {@code name(args)}, {@code receiver.name(args)}, or (if {@link #safe}) {@code
   * receiver?.name(args)}.
   */
  public static final class Call extends Expression {
    public final @Nullable Expression receiver;
    public final String name;
    public final ImmutableList<Expression> args;
    public final boolean safe;
    public final InvocationKind invocation;

    public Call(
        SourcePos pos,
        @Nullable Expression receiver,
        String name,
        List<? extends Expression> args,
        boolean safe,
        InvocationKind invocation,
        Nullability nullability) {
      super(pos, nullability);
      Preconditions.checkArgument(!safe || receiver != null, "safe call without a receiver");
      this.receiver = receiver;
      this.name = name;
      this.args = ImmutableList.copyOf(args);
      this.safe = safe;
      this.invocation = invocation;
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
      return visitor.visitCall(this);
    }
  }

  /**
   * A lambda literal {@code { params -> body }}, optionally labeled ({@code label@{ ... }}).
   *
   * <p>A lambda passed directly as a call argument is also implicitly labeled with the callee's
   * name, but that label is not recorded here.
   */
  public static final class LambdaLiteral extends Expression {
    public final @Nullable String label;
    public final ImmutableList<String> params;
    public final Block body;

    public LambdaLiteral(
        SourcePos pos, @Nullable String label, List<String> params, Block body) {
      super(pos, Nullability.NON_NULL);
      this.label = label;
      this.params = ImmutableList.copyOf(params);
      this.body = body;
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
      return visitor.visitLambdaLiteral(this);
    }
  }

  /**
   * A function declaration; exactly one of {@link #expressionBody} ({@code fun f(x) = x}) and
   * {@link #blockBody} ({@code fun f(x) { ... }}) is non-null.
   */
  public static final class FunctionDecl extends Tree {
    public final String name;
    public final ImmutableList<String> params;
    public final @Nullable Expression expressionBody;
    public final @Nullable Block blockBody;

    public FunctionDecl(
        SourcePos pos,
        String name,
        List<String> params,
        @Nullable Expression expressionBody,
        @Nullable Block blockBody) {
      super(pos);
      Preconditions.checkArgument((expressionBody == null) != (blockBody == null));
      this.name = name;
      this.params = ImmutableList.copyOf(params);
      this.expressionBody = expressionBody;
      this.blockBody = blockBody;
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
      return visitor.visitFunctionDecl(this);
    }
  }

  /** {@code return}, {@code return value}, or {@code return@label value}. */
  public static final class Return extends Expression {
    public final @Nullable String label;
    public final @Nullable Expression value;

    public Return(SourcePos pos, @Nullable String label, @Nullable Expression value) {
      super(pos, Nullability.NON_NULL);
      this.label = label;
      this.value = value;
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
      return visitor.visitReturn(this);
    }
  }

  public static final class Throw extends Expression {
    public final Expression exception;

    public Throw(SourcePos pos, Expression exception) {
      super(pos, Nullability.NON_NULL);
      this.exception = exception;
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
      return visitor.visitThrow(this);
    }
  }

  /** {@code left ?: right} */
  public static final class Elvis extends Expression {
    public final Expression left;
    public final Expression right;

    public Elvis(SourcePos pos, Expression left, Expression right, Nullability nullability) {
      super(pos, nullability);
      this.left = left;
      this.right = right;
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
      return visitor.visitElvis(this);
    }
  }

  /**
   * {@code if (condition) thenBranch else elseBranch}; each branch is either a Block or an
   * Expression.
   */
  public static final class If extends Expression {
    public final Expression condition;
    public final Tree thenBranch;
    public final @Nullable Tree elseBranch;

    public If(
        SourcePos pos,
        Expression condition,
        Tree thenBranch,
        @Nullable Tree elseBranch,
        Nullability nullability) {
      super(pos, nullability);
      this.condition = condition;
      this.thenBranch = thenBranch;
      this.elseBranch = elseBranch;
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
      return visitor.visitIf(this);
    }
  }

  /** {@code left && right} or {@code left || right}. */
  public static final class Logical extends Expression {
    public enum Op {
      AND("&&"),
      OR("||");

      public final String symbol;

      Op(String symbol) {
        this.symbol = symbol;
      }
    }

    public final Op op;
    public final Expression left;
    public final Expression right;

    public Logical(SourcePos pos, Op op, Expression left, Expression right) {
      super(pos, Nullability.NON_NULL);
      this.op = op;
      this.left = left;
      this.right = right;
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
      return visitor.visitLogical(this);
    }
  }

  /** {@code while (condition) body} or (if {@link #doWhile}) {@code do body while (condition)}. */
  public static final class WhileLoop extends Tree {
    public final Expression condition;
    public final Block body;
    public final boolean doWhile;

    public WhileLoop(SourcePos pos, Expression condition, Block body, boolean doWhile) {
      super(pos);
      this.condition = condition;
      this.body = body;
      this.doWhile = doWhile;
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
      return visitor.visitWhileLoop(this);
    }
  }

  public static final class Break extends Expression {
    public Break(SourcePos pos) {
      super(pos, Nullability.NON_NULL);
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
      return visitor.visitBreak(this);
    }
  }

  public static final class Continue extends Expression {
    public Continue(SourcePos pos) {
      super(pos, Nullability.NON_NULL);
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
      return visitor.visitContinue(this);
    }
  }

  /**
   * A callable reference {@code ::name}. If the front end attached a reflective handle it is kept
   * here, but it is opaque to control-flow analysis.
   */
  public static final class CallableRef extends Expression {
    public final String name;
    public final @Nullable CallableReference handle;

    public CallableRef(SourcePos pos, String name, @Nullable CallableReference handle) {
      super(pos, Nullability.NON_NULL);
      this.name = name;
      this.handle = handle;
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
      return visitor.visitCallableRef(this);
    }
  }
}
