package com.github.smc;

import java.util.Comparator;
import java.util.Objects;

/**
 * An entry of the {@code events} section: event name plus its external code.
 */
public final class EventDeclaration implements ModelNode {
  static final Comparator<EventDeclaration> CANONICAL_ORDER =
      Comparator.comparing(EventDeclaration::getName).thenComparing(EventDeclaration::getCode);

  private final String name;
  private final String code;
  private final SourceLocation location;

  EventDeclaration(final String name, final String code, final SourceLocation location) {
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
    return visitor.visitEvent(this);
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
    EventDeclaration other = (EventDeclaration) obj;
    return name.equals(other.name) && code.equals(other.code);
  }

  @Override
  public String toString() {
    return "EventDeclaration [name=" + name + ", code=" + code + "]";
  }
}
