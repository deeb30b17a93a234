package dev.zxul767.tlox.parsing;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes an expression back as Lox source.
 *
 * <p>Operands that are themselves operations are wrapped in parentheses, so
 * the result shows how the parser grouped things: {@code 1 + 2 * 3} comes
 * back as {@code 1 + (2 * 3)}. Explicit groupings keep their own
 * parentheses. Parsing the output again gives an expression that evaluates
 * the same way.
 */
public class ExprFormatter implements Expr.Visitor<String> {
  public String format(Expr expr) { return expr.accept(this); }

  @Override
  public String visitAssignExpr(Expr.Assign expr) {
    // assignment targets are always bare names, so nothing is ambiguous
    return String.format("%s = %s", expr.name.lexeme, format(expr.value));
  }

  @Override
  public String visitBinaryExpr(Expr.Binary expr) {
    return infix(expr.left, expr.operator, expr.right);
  }

  @Override
  public String visitLogicalExpr(Expr.Logical expr) {
    return infix(expr.left, expr.operator, expr.right);
  }

  @Override
  public String visitUnaryExpr(Expr.Unary expr) {
    // chained prefix operators read fine without parentheses: `!!-x`
    if (expr.right instanceof Expr.Unary)
      return expr.operator.lexeme + format(expr.right);
    return expr.operator.lexeme + operand(expr.right);
  }

  @Override
  public String visitCallExpr(Expr.Call expr) {
    List<String> arguments = new ArrayList<>();
    for (Expr argument : expr.arguments) {
      arguments.add(format(argument));
    }
    return String.format(
        "%s(%s)", operand(expr.callee), String.join(", ", arguments)
    );
  }

  @Override
  public String visitGroupingExpr(Expr.Grouping expr) {
    return "(" + format(expr.expression) + ")";
  }

  @Override
  public String visitVariableExpr(Expr.Variable expr) {
    return expr.name.lexeme;
  }

  @Override
  public String visitLiteralExpr(Expr.Literal expr) {
    Object value = expr.value;
    if (value == null)
      return "nil";
    if (value instanceof String)
      return "\"" + value + "\"";
    if (value instanceof Identifier)
      return ((Identifier)value).name;
    if (value instanceof Double) {
      String text = value.toString();
      return text.endsWith(".0") ? text.substring(0, text.length() - 2)
                                 : text;
    }
    return value.toString();
  }

  private String infix(Expr left, Token operator, Expr right) {
    return String.format(
        "%s %s %s", operand(left), operator.lexeme, operand(right)
    );
  }

  // nested operations get parentheses; everything else binds tightly enough
  private String operand(Expr expr) {
    String text = format(expr);
    if (expr instanceof Expr.Binary || expr instanceof Expr.Logical ||
        expr instanceof Expr.Assign || expr instanceof Expr.Unary) {
      return "(" + text + ")";
    }
    return text;
  }
}
