package dev.zxul767.tlox;

import dev.zxul767.tlox.parsing.Parser;
import dev.zxul767.tlox.parsing.Scanner;
import dev.zxul767.tlox.parsing.Stmt;
import dev.zxul767.tlox.parsing.Token;
import dev.zxul767.tlox.runtime.Interpreter;
import java.io.PrintStream;
import java.util.List;
import org.slf4j.Logger;

/**
 * The scan → parse → interpret pipeline bound to a single interpreter.
 *
 * <p>A session either starts every run from a fresh global frame (running a
 * script) or keeps its globals between runs (the REPL, where each line is a
 * run of its own).
 */
public class Session {
  private static final Logger logger = LoxLogger.getLogger(Session.class);

  public enum Status {
    OK(0),
    SCAN_ERROR(64),
    PARSE_ERROR(65),
    RUNTIME_ERROR(70);

    // process exit code used by the command line front end
    public final int exitCode;

    Status(int exitCode) { this.exitCode = exitCode; }
  }

  private final ErrorReporter reporter;
  private final Interpreter interpreter;
  private final PrintStream out;
  private final boolean keepGlobals;
  private boolean dumpTokens = false;

  public Session(ErrorReporter reporter, PrintStream out, boolean keepGlobals) {
    this.reporter = reporter;
    this.out = out;
    this.keepGlobals = keepGlobals;
    this.interpreter = new Interpreter(reporter, out);
  }

  public Session dumpTokens(boolean dumpTokens) {
    this.dumpTokens = dumpTokens;
    return this;
  }

  public Session echoExpressions(boolean echoExpressions) {
    interpreter.setEchoExpressions(echoExpressions);
    return this;
  }

  public Interpreter interpreter() { return interpreter; }

  public Status run(String source) {
    reporter.reset();
    if (!keepGlobals)
      interpreter.reset();

    Scanner scanner = new Scanner(source, reporter);
    List<Token> tokens = scanner.scanTokens();
    logger.debug("scanned {} tokens", tokens.size());
    if (dumpTokens) {
      for (Token token : tokens) {
        out.println(token);
      }
    }

    // even if scanning failed we still parse, to surface syntax errors too
    Parser parser = new Parser(tokens, reporter);
    List<Stmt> statements = parser.parse();
    logger.debug(
        "parsed {} statements ({} syntax errors)", statements.size(),
        parser.errors().size()
    );

    if (scanner.hadError())
      return Status.SCAN_ERROR;
    if (parser.hadError())
      return Status.PARSE_ERROR;

    if (!interpreter.interpret(statements))
      return Status.RUNTIME_ERROR;
    return Status.OK;
  }
}
