package dev.zxul767.tlox.runtime;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class StandardLibrary {
  private StandardLibrary() {}

  static final LoxCallable clock = new NativeFunction("clock") {
    @Override
    public Object call(Interpreter interpreter, List<Object> args) {
      return (double)System.currentTimeMillis() / 1000.0;
    }
  };

  static final LoxCallable sin = new NativeFunction("sin", "n") {
    @Override
    public Object call(Interpreter interpreter, List<Object> args) {
      return Math.sin(requireNumber(args.get(0), "sin"));
    }
  };

  static final LoxCallable sqrt = new NativeFunction("sqrt", "n") {
    @Override
    public Object call(Interpreter interpreter, List<Object> args) {
      return Math.sqrt(requireNumber(args.get(0), "sqrt"));
    }
  };

  static final LoxCallable str = new NativeFunction("str", "value") {
    @Override
    public Object call(Interpreter interpreter, List<Object> args) {
      return Interpreter.stringify(args.get(0));
    }
  };

  static final LoxCallable help = new NativeFunction("help", "value") {
    @Override
    public Object call(Interpreter interpreter, List<Object> args) {
      Object arg = args.get(0);
      String valueRepr = Interpreter.repr(arg);
      if (arg instanceof LoxCallable) {
        valueRepr = ((LoxCallable)arg).signature().toString();
      }
      interpreter.out().println(
          String.format("%s : %s", valueRepr, Interpreter.typeName(arg))
      );
      return null;
    }
  };

  // TODO: this is public because it needs to be accessed from the REPL (to
  // provide auto-completion); expose only the names instead
  public static final Map<String, LoxCallable> members;
  static {
    List<LoxCallable> callables = Arrays.asList(clock, sin, sqrt, str, help);

    Map<String, LoxCallable> byName = new LinkedHashMap<>();
    for (LoxCallable callable : callables) {
      byName.put(callable.signature().name, callable);
    }
    members = Collections.unmodifiableMap(byName);
  }
}
