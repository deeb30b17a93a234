package dev.zxul767.tlox.runtime;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public interface LoxCallable {
  CallableSignature signature();

  // pre-condition: `args.size() == signature().arity()`
  Object call(Interpreter interpreter, List<Object> args);
}

class CallableSignature {
  public final String name;
  public final List<String> parameters;

  CallableSignature(String name) { this(name, Collections.emptyList()); }

  CallableSignature(String name, String... parameters) {
    this(name, Arrays.asList(parameters));
  }

  CallableSignature(String name, List<String> parameters) {
    this.name = name;
    this.parameters = List.copyOf(parameters);
  }

  public int arity() { return this.parameters.size(); }

  @Override
  public String toString() {
    return String.format(
        "%s(%s)", this.name, String.join(", ", this.parameters)
    );
  }
}
