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

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a Tree as single-line source text; used for the text of {@code mark} and {@code d}
 * instructions. Statements in a block are separated by "; ", and a lambda that is the last
 * argument of a call is written using trailing-lambda syntax.
 */
public final class TreePrinter implements TreeVisitor<String> {
  private static final TreePrinter INSTANCE = new TreePrinter();

  private TreePrinter() {}

  public static String print(Tree tree) {
    return tree.accept(INSTANCE);
  }

  /**
   * Binding strength, used to decide where parentheses are needed; jumps and if-expressions extend
   * as far right as possible and so are weakest.
   */
  private static int precedence(Tree tree) {
    if (tree instanceof Tree.Logical logical) {
      return logical.op == Tree.Logical.Op.OR ? 1 : 2;
    } else if (tree instanceof Tree.Elvis) {
      return 3;
    } else if (tree instanceof Tree.If
        || tree instanceof Tree.Return
        || tree instanceof Tree.Throw) {
      return 0;
    }
    return 4;
  }

  private String leftOperand(Tree operand, int parentPrecedence) {
    int p = precedence(operand);
    return (p == 0 || p < parentPrecedence) ? parens(operand) : print(operand);
  }

  private String rightOperand(Tree operand, int parentPrecedence) {
    int p = precedence(operand);
    return (p != 0 && p < parentPrecedence) ? parens(operand) : print(operand);
  }

  private static String parens(Tree tree) {
    return "(" + print(tree) + ")";
  }

  private static String join(List<? extends Tree> trees, String separator) {
    return trees.stream().map(TreePrinter::print).collect(Collectors.joining(separator));
  }

  /** Returns a block's statements wrapped in braces. */
  private static String braces(Tree.Block block) {
    return block.statements.isEmpty() ? "{ }" : "{ " + join(block.statements, "; ") + " }";
  }

  private static String branch(Tree tree) {
    return (tree instanceof Tree.Block block) ? braces(block) : print(tree);
  }

  @Override
  public String visitBlock(Tree.Block block) {
    return braces(block);
  }

  @Override
  public String visitLiteral(Tree.Literal literal) {
    return switch (literal.kind) {
      case NULL -> "null";
      case STRING -> "\"" + escape((String) literal.value) + "\"";
      default -> String.valueOf(literal.value);
    };
  }

  /** Escapes quotes, {@code $}, and every line terminator, so that the result is a single line. */
  private static String escape(String s) {
    return s.replace("\\", "\\\\")
        .replace("\"", "\\\"")
        .replace("$", "\\$")
        .replace("\n", "\\n")
        .replace("\r", "\\r")
        .replace("\u0085", "\\u0085")
        .replace("\u2028", "\\u2028")
        .replace("\u2029", "\\u2029");
  }

  @Override
  public String visitNameRef(Tree.NameRef nameRef) {
    return nameRef.name;
  }

  @Override
  public String visitStringTemplate(Tree.StringTemplate template) {
    StringBuilder sb = new StringBuilder("\"");
    for (Tree.Expression part : template.parts) {
      if (part instanceof Tree.Literal literal && literal.kind == Tree.Literal.Kind.STRING) {
        sb.append(escape((String) literal.value));
      } else if (part instanceof Tree.NameRef nameRef) {
        sb.append('$').append(nameRef.name);
      } else {
        sb.append("${").append(print(part)).append('}');
      }
    }
    return sb.append('"').toString();
  }

  @Override
  public String visitVariableDecl(Tree.VariableDecl decl) {
    String result = (decl.mutable ? "var " : "val ") + decl.name;
    return (decl.initializer == null) ? result : result + " = " + print(decl.initializer);
  }

  @Override
  public String visitAssignment(Tree.Assignment assignment) {
    return assignment.name + " = " + print(assignment.value);
  }

  @Override
  public String visitCall(Tree.Call call) {
    StringBuilder sb = new StringBuilder();
    if (call.receiver != null) {
      Tree receiver = call.receiver;
      boolean simple =
          receiver instanceof Tree.NameRef
              || receiver instanceof Tree.Call
              || receiver instanceof Tree.Literal
              || receiver instanceof Tree.StringTemplate
              || receiver instanceof Tree.CallableRef;
      sb.append(simple ? print(receiver) : parens(receiver)).append(call.safe ? "?." : ".");
    }
    sb.append(call.name);
    List<Tree.Expression> args = call.args;
    Tree.Expression trailing = null;
    if (!args.isEmpty() && args.get(args.size() - 1) instanceof Tree.LambdaLiteral) {
      trailing = args.get(args.size() - 1);
      args = args.subList(0, args.size() - 1);
    }
    if (trailing == null || !args.isEmpty()) {
      sb.append('(').append(join(args, ", ")).append(')');
    }
    if (trailing != null) {
      sb.append(' ').append(print(trailing));
    }
    return sb.toString();
  }

  @Override
  public String visitLambdaLiteral(Tree.LambdaLiteral lambda) {
    StringBuilder sb = new StringBuilder();
    if (lambda.label != null) {
      sb.append(lambda.label).append('@');
    }
    if (lambda.params.isEmpty() && lambda.body.statements.isEmpty()) {
      return sb.append("{ }").toString();
    }
    sb.append("{ ");
    if (!lambda.params.isEmpty()) {
      sb.append(String.join(", ", lambda.params)).append(" -> ");
    }
    if (!lambda.body.statements.isEmpty()) {
      sb.append(join(lambda.body.statements, "; ")).append(' ');
    }
    return sb.append('}').toString();
  }

  @Override
  public String visitFunctionDecl(Tree.FunctionDecl decl) {
    String header = "fun " + decl.name + "(" + String.join(", ", decl.params) + ")";
    return (decl.expressionBody != null)
        ? header + " = " + print(decl.expressionBody)
        : header + " " + braces(decl.blockBody);
  }

  @Override
  public String visitReturn(Tree.Return ret) {
    String result = (ret.label == null) ? "return" : "return@" + ret.label;
    return (ret.value == null) ? result : result + " " + print(ret.value);
  }

  @Override
  public String visitThrow(Tree.Throw t) {
    return "throw " + print(t.exception);
  }

  @Override
  public String visitElvis(Tree.Elvis elvis) {
    return leftOperand(elvis.left, 3) + " ?: " + rightOperand(elvis.right, 3);
  }

  @Override
  public String visitIf(Tree.If ifExpr) {
    String result = "if (" + print(ifExpr.condition) + ") " + branch(ifExpr.thenBranch);
    return (ifExpr.elseBranch == null) ? result : result + " else " + branch(ifExpr.elseBranch);
  }

  @Override
  public String visitLogical(Tree.Logical logical) {
    int p = precedence(logical);
    return leftOperand(logical.left, p)
        + " "
        + logical.op.symbol
        + " "
        + rightOperand(logical.right, p);
  }

  @Override
  public String visitWhileLoop(Tree.WhileLoop loop) {
    String condition = "(" + print(loop.condition) + ")";
    return loop.doWhile
        ? "do " + braces(loop.body) + " while " + condition
        : "while " + condition + " " + braces(loop.body);
  }

  @Override
  public String visitBreak(Tree.Break brk) {
    return "break";
  }

  @Override
  public String visitContinue(Tree.Continue cont) {
    return "continue";
  }

  @Override
  public String visitCallableRef(Tree.CallableRef ref) {
    return "::" + ref.name;
  }
}
