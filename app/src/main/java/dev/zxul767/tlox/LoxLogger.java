package dev.zxul767.tlox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out SLF4J loggers. Loading this class first also keeps SLF4J from
 * reporting its own initialization on the console the interpreter shares
 * with the user's program.
 */
public final class LoxLogger {
  static {
    System.setProperty("slf4j.internal.verbosity", "WARN");
  }

  private LoxLogger() {
    // utility class
  }

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }
}
