package dev.zxul767.tlox;

import dev.zxul767.tlox.parsing.ParseError;
import dev.zxul767.tlox.parsing.TokenType;
import dev.zxul767.tlox.runtime.RuntimeError;
import java.io.PrintStream;

public class ConsoleErrorReporter implements ErrorReporter {
  private final PrintStream err;
  private boolean hadScanError = false;
  private boolean hadParseError = false;
  private boolean hadRuntimeError = false;

  public ConsoleErrorReporter() { this(System.err); }

  public ConsoleErrorReporter(PrintStream err) { this.err = err; }

  @Override
  public void scanError(int line, int column, String message) {
    err.println(String.format(
        "Scanning Error: [line %d, column %d] %s", line, column, message
    ));
    err.flush();
    hadScanError = true;
  }

  @Override
  public void parseError(ParseError error) {
    err.println(String.format(
        "Parsing Error: [line %d, column %d] Error%s: %s", error.line,
        error.column, where(error), error.getMessage()
    ));
    err.flush();
    hadParseError = true;
  }

  @Override
  public void runtimeError(RuntimeError error) {
    err.println(String.format(
        "Runtime Error: %s\n[line %d, token: '%s']", error.getMessage(),
        error.token.line, error.token.lexeme
    ));
    err.flush();
    hadRuntimeError = true;
  }

  @Override
  public boolean hadScanError() {
    return hadScanError;
  }

  @Override
  public boolean hadParseError() {
    return hadParseError;
  }

  @Override
  public boolean hadRuntimeError() {
    return hadRuntimeError;
  }

  @Override
  public void reset() {
    hadScanError = false;
    hadParseError = false;
    hadRuntimeError = false;
  }

  private static String where(ParseError error) {
    if (error.token.type == TokenType.EOF)
      return " at end";
    return String.format(" at '%s'", error.token.lexeme);
  }
}
