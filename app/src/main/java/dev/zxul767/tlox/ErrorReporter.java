package dev.zxul767.tlox;

import dev.zxul767.tlox.parsing.ParseError;
import dev.zxul767.tlox.runtime.RuntimeError;

/**
 * Sink for the diagnostics produced while scanning, parsing and running a
 * program. Every stage reports through the same instance, so the caller can
 * decide after a run which kinds of failure occurred.
 */
public interface ErrorReporter {
  void scanError(int line, int column, String message);

  void parseError(ParseError error);

  void runtimeError(RuntimeError error);

  boolean hadScanError();

  boolean hadParseError();

  boolean hadRuntimeError();

  // forget everything reported so far (e.g., between REPL lines)
  void reset();

  default boolean hadError() {
    return hadScanError() || hadParseError() || hadRuntimeError();
  }
}
