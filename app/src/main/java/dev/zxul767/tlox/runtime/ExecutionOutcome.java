package dev.zxul767.tlox.runtime;

/**
 * How a statement finished: either it ran to completion and the next
 * statement should follow, or it executed a `return` and control has to
 * unwind to the nearest function call.
 */
final class ExecutionOutcome {
  enum Kind { NORMAL, RETURN }

  static final ExecutionOutcome NORMAL =
      new ExecutionOutcome(Kind.NORMAL, /* value: */ null);

  final Kind kind;
  // the returned value (only meaningful for `RETURN`)
  final Object value;

  private ExecutionOutcome(Kind kind, Object value) {
    this.kind = kind;
    this.value = value;
  }

  static ExecutionOutcome returning(Object value) {
    return new ExecutionOutcome(Kind.RETURN, value);
  }

  boolean isNormal() { return kind == Kind.NORMAL; }
}
