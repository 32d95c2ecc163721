package com.github.smc;

import java.util.Comparator;
import java.util.Objects;

/**
 * An entry of the {@code commands} section. Commands name the actions states and transitions run.
 */
public final class CommandDeclaration implements ModelNode {
  static final Comparator<CommandDeclaration> CANONICAL_ORDER =
      Comparator.comparing(CommandDeclaration::getName).thenComparing(CommandDeclaration::getCode);

  private final String name;
  private final String code;
  private final SourceLocation location;

  CommandDeclaration(final String name, final String code, final SourceLocation location) {
    this.name = Objects.requireNonNull(name);
    this.code = Objects.requireNonNull(code);
    this.location = location;
  }

  public String getName() {
    return name;
  }

  public String getCode() {
    return code;
  }

  @Override
  public SourceLocation getLocation() {
    return location;
  }

  @Override
  public <R> R accept(ModelVisitor<R> visitor) {
    return visitor.visitCommand(this);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, code);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    CommandDeclaration other = (CommandDeclaration) obj;
    return name.equals(other.name) && code.equals(other.code);
  }

  @Override
  public String toString() {
    return "CommandDeclaration [name=" + name + ", code=" + code + "]";
  }
}
