package dev.zxul767.tlox.runtime;

import dev.zxul767.tlox.parsing.Token;
import java.util.HashMap;
import java.util.Map;

/**
 * One scope frame: the variables declared in a block, a function call or the
 * global scope, plus a link to the frame that encloses it. Lookups and
 * assignments that miss locally continue in the enclosing frame; the global
 * frame has none.
 */
public class Environment {
  // stands for "declared but never assigned" (nil is a legal value, so
  // `null` can't be used for this)
  private static final Object UNINITIALIZED = new Object();

  private final Environment enclosing;
  private final Map<String, Object> values = new HashMap<>();

  public Environment() { this(/* enclosing: */ null); }

  public Environment(Environment enclosing) { this.enclosing = enclosing; }

  // null for the global frame
  public Environment enclosing() { return enclosing; }

  // Declares `name` in this frame without a value. Re-declaring a name
  // overwrites it.
  public void define(String name) { values.put(name, UNINITIALIZED); }

  public void define(String name, Object value) { values.put(name, value); }

  public boolean isDefined(String name) {
    if (values.containsKey(name))
      return true;
    return enclosing != null && enclosing.isDefined(name);
  }

  public Object get(String name) { return get(Token.identifier(name)); }

  public Object get(Token name) {
    if (values.containsKey(name.lexeme)) {
      Object value = values.get(name.lexeme);
      if (value == UNINITIALIZED) {
        throw new RuntimeError(
            RuntimeError.Kind.VARIABLE_NOT_INITIALIZED, name,
            String.format("Variable '%s' is not initialized.", name.lexeme)
        );
      }
      return value;
    }
    if (enclosing != null)
      return enclosing.get(name);

    throw notFound(name);
  }

  public void assign(String name, Object value) {
    assign(Token.identifier(name), value);
  }

  // Rebinds `name` in the innermost frame that declares it. Assignment never
  // creates a binding.
  public void assign(Token name, Object value) {
    if (values.containsKey(name.lexeme)) {
      values.put(name.lexeme, value);
      return;
    }
    if (enclosing != null) {
      enclosing.assign(name, value);
      return;
    }
    throw notFound(name);
  }

  private static RuntimeError notFound(Token name) {
    return new RuntimeError(
        RuntimeError.Kind.VARIABLE_NOT_FOUND, name,
        String.format("Undefined variable '%s'.", name.lexeme)
    );
  }
}
