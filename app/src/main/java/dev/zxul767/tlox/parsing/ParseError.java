package dev.zxul767.tlox.parsing;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A syntax error found by the {@link Parser}. There are exactly two kinds:
 * a token that does not match what the current grammar rule requires
 * ({@link UnexpectedToken}) and a position where no expression can start
 * ({@link ExpectedExpression}).
 */
public abstract class ParseError extends RuntimeException {
  // the token the parser was looking at when it gave up
  public final Token token;
  public final TokenType found;
  public final int line;
  public final int column;

  private ParseError(Token token, String message) {
    super(message, /*cause:*/ null, /*enableSuppression:*/ false,
          /*writableStackTrace*/ false);
    this.token = token;
    this.found = token.type;
    this.line = token.line;
    this.column = token.column;
  }

  public static final class UnexpectedToken extends ParseError {
    public final TokenType expected;

    public UnexpectedToken(TokenType expected, Token found, String message) {
      super(found, message);
      this.expected = expected;
    }
  }

  public static final class ExpectedExpression extends ParseError {
    public final Set<TokenType> expected;

    public ExpectedExpression(Set<TokenType> expected, Token found) {
      super(found, describe(expected, found));
      this.expected = Collections.unmodifiableSet(EnumSet.copyOf(expected));
    }

    private static String describe(Set<TokenType> expected, Token found) {
      String choices = expected.stream()
                           .map(TokenType::name)
                           .sorted()
                           .collect(Collectors.joining(", "));
      return String.format(
          "Expected expression but found %s (expected one of: %s).",
          found.type, choices
      );
    }
  }
}
