package dev.zxul767.tlox.runtime;

import dev.zxul767.tlox.parsing.Stmt;
import java.util.List;
import java.util.stream.Collectors;

// A function declared in a program. It keeps its declaration by value and
// runs its body in a fresh frame enclosed by the globals frame: the body
// sees its parameters, its own locals and the globals, but never the locals
// of the block that declared or called it.
class LoxFunction implements LoxCallable {
  private final Stmt.Function declaration;
  private final CallableSignature signature;

  LoxFunction(Stmt.Function declaration) {
    this.declaration = declaration;

    List<String> parameters = declaration.params.stream()
                                  .map(token -> token.lexeme)
                                  .collect(Collectors.toList());
    this.signature =
        new CallableSignature(this.declaration.name.lexeme, parameters);
  }

  @Override
  public Object call(Interpreter interpreter, List<Object> arguments) {
    Environment environment = new Environment(interpreter.globals());
    for (int i = 0; i < declaration.params.size(); i++) {
      environment.define(declaration.params.get(i).lexeme, arguments.get(i));
    }
    ExecutionOutcome outcome =
        interpreter.executeBlock(declaration.body, environment);
    // falling off the end of the body returns nil
    return outcome.isNormal() ? null : outcome.value;
  }

  @Override
  public CallableSignature signature() {
    return this.signature;
  }

  @Override
  public String toString() {
    return String.format("<fn %s>", signature.name);
  }
}
