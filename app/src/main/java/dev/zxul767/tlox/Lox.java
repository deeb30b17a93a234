package dev.zxul767.tlox;

import dev.zxul767.tlox.parsing.Scanner;
import dev.zxul767.tlox.runtime.StandardLibrary;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import org.jline.reader.Completer;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.reader.impl.completer.AggregateCompleter;
import org.jline.reader.impl.completer.StringsCompleter;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;
import org.slf4j.Logger;

public class Lox {
  private static final Logger logger = LoxLogger.getLogger(Lox.class);

  static final String USAGE = "Usage: tlox [--tokens] [--quiet] [script]";
  static final int EXIT_USAGE = 64;

  // what the command line asked for
  static final class Options {
    final String scriptPath;
    final boolean dumpTokens;
    final boolean echoExpressions;

    Options(String scriptPath, boolean dumpTokens, boolean echoExpressions) {
      this.scriptPath = scriptPath;
      this.dumpTokens = dumpTokens;
      this.echoExpressions = echoExpressions;
    }

    // returns null if `args` are not valid
    static Options parse(String[] args) {
      String scriptPath = null;
      boolean dumpTokens = false;
      boolean echoExpressions = true;
      for (String arg : args) {
        if (arg.equals("--tokens")) {
          dumpTokens = true;
        } else if (arg.equals("--quiet")) {
          echoExpressions = false;
        } else if (arg.startsWith("--") || scriptPath != null) {
          return null;
        } else {
          scriptPath = arg;
        }
      }
      return new Options(scriptPath, dumpTokens, echoExpressions);
    }
  }

  public static void main(String[] args) throws IOException {
    System.exit(launch(args, System.err));
  }

  // returns the process exit code; usage problems are written to `err`
  static int launch(String[] args, PrintStream err) throws IOException {
    Options options = Options.parse(args);
    if (options == null) {
      err.println(USAGE);
      return EXIT_USAGE;
    }
    if (options.scriptPath != null)
      return runFile(options);

    runPrompt(options);
    return 0;
  }

  static int runFile(Options options) throws IOException {
    byte[] bytes = Files.readAllBytes(Paths.get(options.scriptPath));
    Session session = new Session(new ConsoleErrorReporter(), System.out,
                                  /* keepGlobals: */ false)
                          .dumpTokens(options.dumpTokens)
                          .echoExpressions(options.echoExpressions);

    Session.Status status =
        session.run(new String(bytes, StandardCharsets.UTF_8));
    logger.debug("{} finished with {}", options.scriptPath, status);
    return status.exitCode;
  }

  private static void runPrompt(Options options) throws IOException {
    Terminal terminal = TerminalBuilder.builder().build();

    showBannerAndHelp(terminal);
    // when running in REPL mode, errors and output may interleave badly
    // (the error shows up after the next prompt), so we make sure both go
    // through the same channel
    System.setErr(System.out);

    Session session = new Session(new ConsoleErrorReporter(System.err),
                                  System.out, /* keepGlobals: */ true)
                          .dumpTokens(options.dumpTokens)
                          .echoExpressions(true);

    LineReader reader = createReplReader(terminal);
    while (true) {
      try {
        String line = reader.readLine(">>> ").trim();
        if (line.equals("quit"))
          break;

        if (line.isEmpty())
          continue;

        // FIXME: implement the "optional semicolon" feature properly;
        // this is a brittle kludge to make working with the REPL a little
        // less annoying in the meantime...
        if (!line.endsWith(";") && !line.endsWith("}")) {
          line += ";";
        }
        // if the user makes a mistake, we don't kill the session
        session.run(line);

      } catch (UserInterruptException e) {
        break;
      } catch (EndOfFileException e) {
        break;
      }
    }
  }

  private static void showBannerAndHelp(Terminal terminal) {
    String banner =
        new AttributedStringBuilder()
            .style(AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW))
            .style(AttributedStyle.BOLD)
            .append("tlox - a tree-walking Lox interpreter")
            .style(AttributedStyle.DEFAULT)
            .toAnsi();
    terminal.writer().println(banner);

    terminal.writer().println("- Type \"quit\" to quit. (or use «ctrl-d»)");
    terminal.writer().println("- Use «tab» for word completion");
    terminal.writer().println("- Use «ctrl-r» to search the history");
    terminal.writer().println();

    terminal.writer().flush();
  }

  private static LineReader createReplReader(Terminal terminal) {
    // provide completions (triggered via TAB) for all keywords
    Completer completer = new AggregateCompleter(
        new StringsCompleter("quit"),
        new StringsCompleter(StandardLibrary.members.keySet()),
        new StringsCompleter(Scanner.keywords.keySet())
    );

    return LineReaderBuilder.builder()
        .terminal(terminal)
        .parser(new DefaultParser())
        .completer(completer)
        .build();
  }
}
