package dev.zxul767.tlox.parsing;

import static org.junit.jupiter.api.Assertions.*;

import dev.zxul767.tlox.RecordingErrorReporter;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class ExprFormatterTest {
  private final ExprFormatter formatter = new ExprFormatter();

  private static Expr parse(String expression) {
    RecordingErrorReporter reporter = new RecordingErrorReporter();
    Scanner scanner = new Scanner(expression + ";", reporter);
    List<Stmt> statements = new Parser(scanner.scanTokens(), reporter).parse();
    assertFalse(reporter.hadError());
    return ((Stmt.Expression)statements.get(0)).expression;
  }

  @Test
  void nestedOperationsAreParenthesized() {
    Expr expression = new Expr.Binary(
        new Expr.Unary(new Token(TokenType.MINUS, "-"), new Expr.Literal(123.0)),
        new Token(TokenType.STAR, "*"),
        new Expr.Grouping(new Expr.Literal(45.67)));

    assertEquals("(-123) * (45.67)", formatter.format(expression));
  }

  @Test
  void writesLiteralsAsSource() {
    assertEquals("nil", formatter.format(new Expr.Literal(null)));
    assertEquals("true", formatter.format(new Expr.Literal(true)));
    assertEquals("\"hi\"", formatter.format(new Expr.Literal("hi")));
    assertEquals("0.5", formatter.format(new Expr.Literal(0.5)));
    assertEquals("name", formatter.format(new Expr.Literal(new Identifier("name"))));
  }

  @Test
  void writesCallsAndAssignments() {
    Expr call = new Expr.Call(
        new Expr.Variable(Token.identifier("greet")),
        new Token(TokenType.RIGHT_PAREN, ")"),
        Arrays.asList(new Expr.Literal("hi"), new Expr.Literal(null),
                      new Expr.Literal(new Identifier("name"))));
    assertEquals("greet(\"hi\", nil, name)", formatter.format(call));

    Expr assign = new Expr.Assign(
        Token.identifier("total"),
        new Expr.Logical(new Expr.Variable(Token.identifier("a")),
                         new Token(TokenType.OR, "or"),
                         new Expr.Literal(2.0)));
    assertEquals("total = a or 2", formatter.format(assign));
  }

  @Test
  void outputParsesBackToTheSameGrouping() {
    String source = "-(a - b) / c < d or !e and f(g, h = 1)";
    String once = formatter.format(parse(source));

    assertEquals("(((-(a - b)) / c) < d) or ((!e) and f(g, h = 1))", once);
    assertEquals(once, formatter.format(parse(once)));
  }
}
