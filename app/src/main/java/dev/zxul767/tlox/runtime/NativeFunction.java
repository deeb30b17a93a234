package dev.zxul767.tlox.runtime;

// A function implemented by the host (see `StandardLibrary`).
abstract class NativeFunction implements LoxCallable {
  private final CallableSignature signature;

  NativeFunction(String name, String... parameters) {
    this.signature = new CallableSignature(name, parameters);
  }

  // Raised by a native that was handed a value it cannot work with. Natives
  // don't know where they were called from, so the interpreter turns this
  // into a `RuntimeError` located at the call site.
  static class InvalidArgument extends RuntimeException {
    InvalidArgument(String message) { super(message, null, false, false); }
  }

  @Override
  public CallableSignature signature() {
    return this.signature;
  }

  static double requireNumber(Object value, String function) {
    if (value instanceof Double)
      return (double)value;
    throw new InvalidArgument(String.format(
        "%s() expects a number but got %s.", function,
        Interpreter.typeName(value)
    ));
  }

  @Override
  public String toString() {
    return String.format("<native fn %s>", signature.name);
  }
}
