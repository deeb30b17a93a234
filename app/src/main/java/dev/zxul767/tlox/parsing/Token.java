package dev.zxul767.tlox.parsing;

public class Token {
  // `Token` is just a data structure with no behavior so it's okay for
  // its fields to be public
  public final TokenType type;
  public final String lexeme;
  // the literal payload: `Double`, `String`, `Boolean`, `Identifier` or null
  public final Object value;
  public final int line;
  // 1-based column of the first character of `lexeme`
  public final int column;

  public Token(
      TokenType type, String lexeme, Object value, int line, int column
  ) {
    this.type = type;
    this.lexeme = lexeme;
    this.value = value;
    this.line = line;
    this.column = column;
  }

  public Token(TokenType type, String lexeme) {
    this(type, lexeme, /*value:*/ null, /*line:*/ 1, /*column:*/ 1);
  }

  public static Token identifier(String name) {
    return new Token(
        TokenType.IDENTIFIER, name, new Identifier(name), /*line:*/ 1,
        /*column:*/ 1
    );
  }

  public String location() { return String.format("%d:%d", line, column); }

  @Override
  public String toString() {
    return String.format(
        "%s '%s' %s @%s", type, lexeme, value == null ? "null" : value,
        location()
    );
  }
}
