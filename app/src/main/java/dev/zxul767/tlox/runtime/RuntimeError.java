package dev.zxul767.tlox.runtime;

import dev.zxul767.tlox.parsing.Token;

public class RuntimeError extends RuntimeException {
  // the closed set of failures a running program can hit
  public enum Kind {
    BINARY_OPERATION,
    UNARY_OPERAND,
    VARIABLE_NOT_FOUND,
    VARIABLE_NOT_INITIALIZED,
    LOGICAL_OPERATOR,
    INVALID_CALL,
    ARITY_MISMATCH,
    INVALID_ARGUMENT,
    // calls nested deeper than the host stack allows
    STACK_OVERFLOW
  }

  public final Kind kind;
  // where the error happened (used to show location information)
  public final Token token;

  public RuntimeError(Kind kind, Token token, String message) {
    super(message);
    this.kind = kind;
    this.token = token;
  }
}
