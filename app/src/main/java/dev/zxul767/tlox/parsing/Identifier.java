package dev.zxul767.tlox.parsing;

import java.util.Objects;

/**
 * Literal payload of an identifier token: the bare name, kept apart from
 * string payloads so a literal node holding one is read as a variable.
 */
public final class Identifier {
  public final String name;

  public Identifier(String name) { this.name = Objects.requireNonNull(name); }

  @Override
  public boolean equals(Object other) {
    if (this == other)
      return true;
    if (!(other instanceof Identifier))
      return false;
    return name.equals(((Identifier)other).name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
