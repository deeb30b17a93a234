package dev.zxul767.tlox.runtime;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import dev.zxul767.tlox.RecordingErrorReporter;
import dev.zxul767.tlox.parsing.*;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class InterpreterTest {
  private final RecordingErrorReporter reporter = new RecordingErrorReporter();
  private final ByteArrayOutputStream output = new ByteArrayOutputStream();
  private final Interpreter interpreter = new Interpreter(
      reporter, new PrintStream(output, /* autoFlush: */ true, StandardCharsets.UTF_8));

  InterpreterTest() {
    // most tests only look at what `print` writes
    interpreter.setEchoExpressions(false);
  }

  private List<Stmt> parse(String program) {
    Scanner scanner = new Scanner(program, reporter);
    Parser parser = new Parser(scanner.scanTokens(), reporter);
    List<Stmt> statements = parser.parse();
    assertFalse(reporter.hadError(), "program should be well-formed");
    return statements;
  }

  // returns the value of the last statement (expression) in `program`.
  //
  // pre-condition: the last statement in `program` is an expression.
  // post-condition: all other statements in `program` have been executed.
  private Object interpret(String program) {
    List<Stmt> statements = parse(program);
    int lastIndex = statements.size() - 1;

    assertTrue(interpreter.interpret(statements.subList(0, lastIndex)));
    Stmt.Expression expr = (Stmt.Expression)statements.get(lastIndex);
    return interpreter.evaluate(expr.expression);
  }

  // runs `program` and returns everything it printed
  private String run(String program) {
    interpreter.interpret(parse(program));
    return output.toString(StandardCharsets.UTF_8);
  }

  private RuntimeError failure(String program) {
    List<Stmt> statements = parse(program);
    assertFalse(interpreter.interpret(statements));
    assertThat(reporter.runtimeErrors, hasSize(1));
    return reporter.runtimeErrors.get(0);
  }

  @Test
  void canInterpretArithmeticExpressions() {
    assertEquals(3.0, interpret("1 + 2;"));
    assertEquals(3.0, interpret("(10 + 20) / (2 * 5);"));
    assertEquals(-4.0, interpret("-(1 + 3);"));
  }

  @Test
  void canConcatenateStrings() {
    assertEquals("ab", interpret("\"a\" + \"b\";"));
  }

  @Test
  void mixingNumbersAndStringsIsABinaryOperationError() {
    RuntimeError error = failure("print 1 + \"a\";");
    assertEquals(RuntimeError.Kind.BINARY_OPERATION, error.kind);
    assertEquals("+", error.token.lexeme);
  }

  @Test
  void comparisonsRequireNumbers() {
    assertEquals(true, interpret("(1 + 1) == 2;"));
    assertEquals(false, interpret("1 != 1;"));
    assertEquals(true, interpret("2 >= 2;"));
    assertEquals(RuntimeError.Kind.BINARY_OPERATION,
                 failure("print \"a\" == \"a\";").kind);
  }

  @Test
  void stringsOnlySupportConcatenation() {
    assertEquals(RuntimeError.Kind.BINARY_OPERATION,
                 failure("print \"a\" - \"b\";").kind);
  }

  @Test
  void negationRequiresANumber() {
    assertEquals(RuntimeError.Kind.UNARY_OPERAND, failure("print -\"a\";").kind);
  }

  @Test
  void truthinessFollowsTheValueType() {
    assertEquals(true, interpret("!0;"));
    assertEquals(false, interpret("!1;"));
    assertEquals(true, interpret("!\"\";"));
    assertEquals(false, interpret("!\"x\";"));
    assertEquals(true, interpret("!nil;"));
    assertEquals(true, interpret("!false;"));
    assertEquals(true, interpret("fun f() {} !f;"));
    assertEquals(true, interpret("!clock;"));
  }

  @Test
  void logicalOperatorsReturnTheDecidingOperand() {
    assertEquals("yes", interpret("nil or \"yes\";"));
    assertEquals(2.0, interpret("2 or undefinedName;"));
    assertEquals(0.0, interpret("0 and undefinedName;"));
    assertEquals("last", interpret("1 and \"last\";"));
  }

  @Test
  void canUseGlobalVariables() {
    assertEquals(true, interpret("var a = 1; var b = 2; (a + b) == 3;"));
  }

  @Test
  void assignmentIsAnExpression() {
    assertEquals(3.0, interpret("var a; var b; a = b = 3; a + b - 3;"));
  }

  @Test
  void localVariablesShouldShadowGlobalOnes() {
    Object result =
        interpret("var a = 1; var result; { var a = 2; result = a; } result;");
    assertEquals(2.0, result);
  }

  @Test
  void leavingABlockRestoresTheOuterBinding() {
    assertEquals(1.0, interpret("var x = 1; { var x = 2; } x;"));
  }

  @Test
  void innerBlocksCanAssignOuterVariables() {
    assertEquals(3.0, interpret(
        "var a = 1; { var b = 2; { a = a + b; } } a;"));
  }

  @Test
  void blockFrameIsRestoredAfterARuntimeError() {
    failure("var x = 1; { var x = 2; print x + nil; }");
    assertEquals(1.0, interpreter.evaluate(
        new Expr.Variable(Token.identifier("x"))));
  }

  @Test
  void readingAnUndeclaredVariableFails() {
    assertEquals(RuntimeError.Kind.VARIABLE_NOT_FOUND,
                 failure("print missing;").kind);
  }

  @Test
  void readingAnUninitializedVariableFails() {
    assertEquals(RuntimeError.Kind.VARIABLE_NOT_INITIALIZED,
                 failure("var a; print a;").kind);
  }

  @Test
  void assigningAnUndeclaredVariableFails() {
    assertEquals(RuntimeError.Kind.VARIABLE_NOT_FOUND,
                 failure("missing = 1;").kind);
    assertFalse(interpreter.globals().isDefined("missing"));
  }

  @Test
  void identifierLiteralsAreReadAsVariables() {
    interpret("var answer = 42; answer;");
    assertEquals(42.0, interpreter.evaluate(
        new Expr.Literal(new Identifier("answer"))));
  }

  @Test
  void printWritesTheDisplayForm() {
    assertEquals("3\n2.5\nhi\ntrue\nnil\n<fn f>\n<native fn clock>\n",
                 run("print 1 + 2; print 2.5; print \"hi\"; print true; "
                     + "print nil; fun f() {} print f; print clock;"));
  }

  @Test
  void expressionStatementsWriteTheirDisplayFormByDefault() {
    ByteArrayOutputStream echoed = new ByteArrayOutputStream();
    Interpreter echoing = new Interpreter(
        reporter, new PrintStream(echoed, /* autoFlush: */ true, StandardCharsets.UTF_8));

    assertTrue(echoing.interpret(parse("1 + 2; \"hi\"; nil; var a = 1; a = 2;")));
    assertEquals("3\nhi\nnil\n2\n", echoed.toString(StandardCharsets.UTF_8));
  }

  @Test
  void echoCanBeTurnedOff() {
    assertEquals("", run("1 + 2;"));
    interpreter.setEchoExpressions(true);
    assertEquals("3\n", run("1 + 2;"));
  }

  @Test
  void canUseConditionals() {
    assertEquals("then\n", run("if (1) print \"then\"; else print \"else\";"));
  }

  @Test
  void elseBranchRunsOnFalsyConditions() {
    assertEquals("else\n", run("if (\"\") print \"then\"; else print \"else\";"));
  }

  @Test
  void whileStatementShouldProvideIteration() {
    Object result = interpret(
        "var sum = 0; var i = 1; while (i <= 10) { sum = sum + i; i = i + 1; } sum;");
    assertEquals(55.0, result);
  }

  @Test
  void forStatementShouldProvideIteration() {
    assertEquals("0\n1\n2\n", run("for (var i = 0; i < 3; i = i + 1) print i;"));
  }

  @Test
  void forLoopVariableIsScopedToTheLoop() {
    assertEquals(RuntimeError.Kind.VARIABLE_NOT_FOUND,
                 failure("for (var i = 0; i < 1; i = i + 1) {} print i;").kind);
  }

  @Test
  void failingLoopConditionStopsTheRun() {
    RuntimeError error = failure("var i = 0; while (i < nil) i = i + 1;");
    assertEquals(RuntimeError.Kind.BINARY_OPERATION, error.kind);
  }

  @Test
  void canDefineSimpleProcedures() {
    Object result = interpret(
        "var total = 10; fun addTax() { total = total * 1.5; } addTax(); total;");
    assertEquals(15.0, result);
  }

  @Test
  void parametersAreBoundPositionally() {
    assertEquals("1\n2\n", run("fun show(a, b) { print a; print b; } show(1, 2);"));
  }

  @Test
  void callsWithoutReturnYieldNil() {
    assertNull(interpret("fun f() { var x = 1; } f();"));
  }

  @Test
  void canReturnValues() {
    assertEquals(7.0, interpret("fun add(a, b) { return a + b; } add(3, 4);"));
  }

  @Test
  void returnUnwindsNestedBlocksAndLoops() {
    assertEquals(3.0, interpret(
        "fun first() {"
        + "  var i = 0;"
        + "  while (true) { i = i + 1; if (i == 3) { return i; } }"
        + "} first();"));
  }

  @Test
  void canDefineRecursiveFunctions() {
    Object result = interpret(
        "fun fib(n) { if (n <= 1) return n; return fib(n - 1) + fib(n - 2); } fib(10);");
    assertEquals(55.0, result);
  }

  @Test
  void functionsSeeGlobalsButNotTheLocalsOfTheirCaller() {
    RuntimeError error = failure(
        "fun peek() { print secret; } { var secret = 1; peek(); }");
    assertEquals(RuntimeError.Kind.VARIABLE_NOT_FOUND, error.kind);
  }

  @Test
  void functionsDoNotCloseOverTheirDefiningBlock() {
    RuntimeError error = failure(
        "var f; { var hidden = 1; fun g() { return hidden; } f = g; } f();");
    assertEquals(RuntimeError.Kind.VARIABLE_NOT_FOUND, error.kind);
  }

  @Test
  void functionLocalsDoNotLeak() {
    assertEquals(RuntimeError.Kind.VARIABLE_NOT_FOUND,
                 failure("fun f(a) { var b = a; } f(1); print b;").kind);
  }

  @Test
  void callingANonCallableIsAnInvalidCall() {
    RuntimeError error = failure("var a = 1; a();");
    assertEquals(RuntimeError.Kind.INVALID_CALL, error.kind);
    assertEquals(")", error.token.lexeme);
  }

  @Test
  void arityIsChecked() {
    RuntimeError error = failure("fun f(a, b) {} f(1);");
    assertEquals(RuntimeError.Kind.ARITY_MISMATCH, error.kind);
    assertThat(error.getMessage(), containsString("expected 2 arguments but got 1"));
  }

  @Test
  void argumentsAreEvaluatedLeftToRight() {
    assertEquals("1\n2\n", run(
        "fun note(n) { print n; return n; } fun pair(a, b) {} "
        + "pair(note(1), note(2));"));
  }

  @Test
  void canCallHigherOrderFunctions() {
    assertEquals(6.0, interpret(
        "fun twice(n) { return n * 2; } fun apply(f, x) { return f(x); } apply(twice, 3);"));
  }

  @Test
  void canUseStandardLibraryFunctions() {
    assertEquals(0.0, (double)interpret("sin(3.14159265359);"), /*delta:*/ 1e-5);
    assertEquals(3.0, interpret("sqrt(9);"));
    assertEquals("12.5", interpret("str(12.5);"));
    assertThat((double)interpret("clock();"), greaterThan(0.0));
  }

  @Test
  void nativeFunctionsValidateTheirArguments() {
    RuntimeError error = failure("var x = 1;\n\nsqrt(\"nine\");");
    assertEquals(RuntimeError.Kind.INVALID_ARGUMENT, error.kind);
    assertEquals(3, error.token.line);
    assertThat(error.getMessage(), containsString("sqrt() expects a number"));
  }

  @Test
  void unboundedRecursionIsAStackOverflowError() {
    RuntimeError error = failure("fun f(n) { return f(n + 1); } f(0);");
    assertEquals(RuntimeError.Kind.STACK_OVERFLOW, error.kind);
    assertEquals(")", error.token.lexeme);

    // the interpreter is still usable and back at the global frame
    assertEquals(2.0, interpret("var after = 2; after;"));
  }

  @Test
  void helpDescribesValues() {
    assertEquals("sqrt(n) : native function\n\"hi\" : string\n",
                 run("help(sqrt); help(\"hi\");"));
  }

  @Test
  void topLevelReturnEndsTheProgram() {
    assertEquals("1\n", run("print 1; return; print 2;"));
  }

  @Test
  void rejectsLogicalNodesWithForeignOperators() {
    // the parser never builds one of these
    Expr expr = new Expr.Logical(new Expr.Literal(true),
                                 new Token(TokenType.PLUS, "+"),
                                 new Expr.Literal(false));
    RuntimeError error =
        assertThrows(RuntimeError.class, () -> interpreter.evaluate(expr));
    assertEquals(RuntimeError.Kind.LOGICAL_OPERATOR, error.kind);
  }

  @Test
  void resetForgetsEverything() {
    interpret("var a = 1; a;");
    interpreter.reset();
    assertFalse(interpreter.globals().isDefined("a"));
    assertTrue(interpreter.globals().isDefined("clock"));
  }

  @Test
  void stringifyDropsTrailingZeroFractions() {
    assertThat(Arrays.asList(Interpreter.stringify(3.0),
                             Interpreter.stringify(0.5),
                             Interpreter.stringify(-2.0),
                             Interpreter.stringify(null)),
               contains("3", "0.5", "-2", "nil"));
  }
}
