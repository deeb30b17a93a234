package dev.zxul767.tlox.runtime;

import dev.zxul767.tlox.ErrorReporter;
import dev.zxul767.tlox.LoxLogger;
import dev.zxul767.tlox.parsing.*;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;

public class Interpreter
    implements Expr.Visitor<Object>, Stmt.Visitor<ExecutionOutcome> {
  private static final Logger logger = LoxLogger.getLogger(Interpreter.class);

  private final ErrorReporter reporter;
  private final PrintStream out;
  private Environment globals;
  // the innermost frame; blocks and calls swap it and always restore it
  private Environment environment;
  // when set, expression statements write the value they evaluate to
  private boolean echoExpressions = true;

  public Interpreter(ErrorReporter reporter) { this(reporter, System.out); }

  public Interpreter(ErrorReporter reporter, PrintStream out) {
    this.reporter = reporter;
    this.out = out;
    reset();
  }

  // Drops every binding and starts over from a fresh global frame that
  // only holds the standard library.
  public void reset() {
    globals = new Environment();
    for (Map.Entry<String, LoxCallable> entry :
         StandardLibrary.members.entrySet()) {
      globals.define(entry.getKey(), entry.getValue());
    }
    environment = globals;
  }

  public void setEchoExpressions(boolean echoExpressions) {
    this.echoExpressions = echoExpressions;
  }

  public Environment globals() { return globals; }

  PrintStream out() { return out; }

  // Runs `statements` in order against the current global frame. A runtime
  // error stops the run; it is reported and `false` is returned.
  public boolean interpret(List<Stmt> statements) {
    try {
      for (Stmt statement : statements) {
        // a `return` outside any function simply ends the program
        if (!execute(statement).isNormal())
          break;
      }
      return true;
    } catch (RuntimeError error) {
      logger.debug("run aborted by {} at {}", error.kind,
                   error.token.location());
      reporter.runtimeError(error);
      return false;
    }
  }

  public Object evaluate(Expr expression) { return expression.accept(this); }

  ExecutionOutcome execute(Stmt stmt) { return stmt.accept(this); }

  // Executes `statements` with `environment` as the current frame, stopping
  // early on `return`. The previous frame is restored on every exit path.
  ExecutionOutcome executeBlock(List<Stmt> statements, Environment environment) {
    Environment previous = this.environment;
    logger.trace("entering scope with {} statements", statements.size());
    try {
      this.environment = environment;
      for (Stmt statement : statements) {
        ExecutionOutcome outcome = execute(statement);
        if (!outcome.isNormal())
          return outcome;
      }
      return ExecutionOutcome.NORMAL;
    } finally {
      this.environment = previous;
      logger.trace("left scope");
    }
  }

  @Override
  public ExecutionOutcome visitBlockStmt(Stmt.Block stmt) {
    return executeBlock(stmt.statements, new Environment(environment));
  }

  @Override
  public ExecutionOutcome visitExpressionStmt(Stmt.Expression stmt) {
    Object value = evaluate(stmt.expression);
    if (echoExpressions)
      out.println(stringify(value));
    return ExecutionOutcome.NORMAL;
  }

  @Override
  public ExecutionOutcome visitFunctionStmt(Stmt.Function stmt) {
    environment.define(stmt.name.lexeme, new LoxFunction(stmt));
    return ExecutionOutcome.NORMAL;
  }

  @Override
  public ExecutionOutcome visitIfStmt(Stmt.If stmt) {
    if (isTruthy(evaluate(stmt.condition))) {
      return execute(stmt.thenBranch);
    } else if (stmt.elseBranch != null) {
      return execute(stmt.elseBranch);
    }
    return ExecutionOutcome.NORMAL;
  }

  @Override
  public ExecutionOutcome visitPrintStmt(Stmt.Print stmt) {
    Object value = evaluate(stmt.expression);
    out.println(stringify(value));
    return ExecutionOutcome.NORMAL;
  }

  @Override
  public ExecutionOutcome visitReturnStmt(Stmt.Return stmt) {
    Object value = null;
    if (stmt.value != null)
      value = evaluate(stmt.value);
    return ExecutionOutcome.returning(value);
  }

  @Override
  public ExecutionOutcome visitVarStmt(Stmt.Var stmt) {
    if (stmt.initializer == null) {
      environment.define(stmt.name.lexeme);
    } else {
      environment.define(stmt.name.lexeme, evaluate(stmt.initializer));
    }
    return ExecutionOutcome.NORMAL;
  }

  @Override
  public ExecutionOutcome visitWhileStmt(Stmt.While stmt) {
    while (isTruthy(evaluate(stmt.condition))) {
      ExecutionOutcome outcome = execute(stmt.body);
      if (!outcome.isNormal())
        return outcome;
    }
    return ExecutionOutcome.NORMAL;
  }

  @Override
  public Object visitAssignExpr(Expr.Assign expr) {
    Object value = evaluate(expr.value);
    environment.assign(expr.name, value);
    return value;
  }

  @Override
  public Object visitLiteralExpr(Expr.Literal expr) {
    if (expr.value instanceof Identifier) {
      return environment.get(((Identifier)expr.value).name);
    }
    return expr.value;
  }

  @Override
  public Object visitLogicalExpr(Expr.Logical expr) {
    Object left = evaluate(expr.left);
    switch (expr.operator.type) {
    case OR:
      if (isTruthy(left))
        return left;
      break;
    case AND:
      if (!isTruthy(left))
        return left;
      break;
    default:
      throw new RuntimeError(
          RuntimeError.Kind.LOGICAL_OPERATOR, expr.operator,
          String.format("'%s' is not a logical operator.", expr.operator.lexeme)
      );
    }
    return evaluate(expr.right);
  }

  @Override
  public Object visitUnaryExpr(Expr.Unary expr) {
    Object right = evaluate(expr.right);
    switch (expr.operator.type) {
    case BANG:
      return !isTruthy(right);
    case MINUS:
      if (right instanceof Double)
        return -(double)right;
      throw new RuntimeError(
          RuntimeError.Kind.UNARY_OPERAND, expr.operator,
          "Operand must be a number."
      );
    default:
      throw new RuntimeError(
          RuntimeError.Kind.UNARY_OPERAND, expr.operator,
          String.format("'%s' is not a unary operator.", expr.operator.lexeme)
      );
    }
  }

  @Override
  public Object visitVariableExpr(Expr.Variable expr) {
    return environment.get(expr.name);
  }

  @Override
  public Object visitGroupingExpr(Expr.Grouping expr) {
    return evaluate(expr.expression);
  }

  @Override
  public Object visitBinaryExpr(Expr.Binary expr) {
    Object left = evaluate(expr.left);
    Object right = evaluate(expr.right);

    // strings only support concatenation; everything else needs numbers
    if (expr.operator.type == TokenType.PLUS && left instanceof String &&
        right instanceof String) {
      return (String)left + (String)right;
    }
    if (!(left instanceof Double && right instanceof Double)) {
      throw binaryOperationError(expr.operator, left, right);
    }
    double a = (double)left;
    double b = (double)right;

    switch (expr.operator.type) {
    case GREATER:
      return a > b;
    case GREATER_EQUAL:
      return a >= b;
    case LESS:
      return a < b;
    case LESS_EQUAL:
      return a <= b;
    case BANG_EQUAL:
      return a != b;
    case EQUAL_EQUAL:
      return a == b;
    case MINUS:
      return a - b;
    case PLUS:
      return a + b;
    case SLASH:
      return a / b;
    case STAR:
      return a * b;
    default:
      throw binaryOperationError(expr.operator, left, right);
    }
  }

  @Override
  public Object visitCallExpr(Expr.Call expr) {
    Object callee = evaluate(expr.callee);
    List<Object> args = new ArrayList<>();
    for (Expr arg : expr.arguments) {
      args.add(evaluate(arg));
    }
    if (!(callee instanceof LoxCallable)) {
      throw new RuntimeError(
          RuntimeError.Kind.INVALID_CALL, expr.paren,
          String.format(
              "Can only call functions, not %s.", typeName(callee)
          )
      );
    }
    LoxCallable function = (LoxCallable)callee;
    if (args.size() != function.signature().arity()) {
      throw new RuntimeError(
          RuntimeError.Kind.ARITY_MISMATCH, expr.paren,
          String.format(
              "%s expected %d arguments but got %d.",
              function.signature().name, function.signature().arity(),
              args.size()
          )
      );
    }
    try {
      return function.call(this, args);
    } catch (NativeFunction.InvalidArgument error) {
      throw new RuntimeError(
          RuntimeError.Kind.INVALID_ARGUMENT, expr.paren, error.getMessage()
      );
    } catch (StackOverflowError error) {
      // unwinding frees enough stack for an enclosing call to report it
      throw new RuntimeError(
          RuntimeError.Kind.STACK_OVERFLOW, expr.paren,
          String.format(
              "Stack overflow while calling %s.", function.signature().name
          )
      );
    }
  }

  private static RuntimeError
  binaryOperationError(Token operator, Object left, Object right) {
    String expectation = operator.type == TokenType.PLUS
                             ? "Operands must be two numbers or two strings"
                             : "Operands must be numbers";
    return new RuntimeError(
        RuntimeError.Kind.BINARY_OPERATION, operator,
        String.format(
            "%s, got %s %s %s.", expectation, typeName(left), operator.lexeme,
            typeName(right)
        )
    );
  }

  // booleans are themselves, numbers are truthy unless zero, strings unless
  // empty; nil and callables are always falsy
  static boolean isTruthy(Object object) {
    if (object == null)
      return false;
    if (object instanceof Boolean)
      return (boolean)object;
    if (object instanceof Double)
      return (double)object != 0.0;
    if (object instanceof String)
      return !((String)object).isEmpty();
    return false;
  }

  public static String typeName(Object object) {
    if (object == null)
      return "nil";
    if (object instanceof Boolean)
      return "boolean";
    if (object instanceof Double)
      return "number";
    if (object instanceof String)
      return "string";
    if (object instanceof NativeFunction)
      return "native function";
    if (object instanceof LoxCallable)
      return "function";
    return object.getClass().getSimpleName();
  }

  public static String stringify(Object object) {
    if (object == null)
      return "nil";

    if (object instanceof Double) {
      String text = object.toString();
      if (text.endsWith(".0")) {
        text = text.substring(0, text.length() - 2);
      }
      return text;
    }
    return object.toString();
  }

  public static String repr(Object object) {
    if (object instanceof String) {
      return String.format("\"%s\"", object);
    }
    return stringify(object);
  }
}
