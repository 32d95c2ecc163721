package com.github.smc;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * A move from the source state to the target state when the event fires and the optional guard
 * holds, running the optional action on the way. Source and target are raw names as written; the
 * checker resolves them against the declared states.
 */
public final class Transition implements ModelNode {
  static final Comparator<Transition> CANONICAL_ORDER =
      Comparator.comparing(Transition::getSource).thenComparing(Transition::getEvent)
          .thenComparing(Transition::getTarget)
          .thenComparing(transition -> transition.guard.map(Guard::toString).orElse(""))
          .thenComparing(transition -> transition.action.orElse(""));

  private final String source;
  private final String event;
  private final Optional<Guard> guard;
  private final Optional<String> action;
  private final String target;
  private final SourceLocation location;

  Transition(final String source, final String event, final Optional<Guard> guard,
      final Optional<String> action, final String target, final SourceLocation location) {
    this.source = Objects.requireNonNull(source);
    this.event = Objects.requireNonNull(event);
    this.guard = Objects.requireNonNull(guard);
    this.action = Objects.requireNonNull(action);
    this.target = Objects.requireNonNull(target);
    this.location = location;
  }

  public String getSource() {
    return source;
  }

  public String getEvent() {
    return event;
  }

  public Optional<Guard> getGuard() {
    return guard;
  }

  public Optional<String> getAction() {
    return action;
  }

  public String getTarget() {
    return target;
  }

  public boolean isGuarded() {
    return guard.isPresent();
  }

  @Override
  public SourceLocation getLocation() {
    return location;
  }

  @Override
  public <R> R accept(ModelVisitor<R> visitor) {
    return visitor.visitTransition(this);
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, event, guard, action, target);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Transition other = (Transition) obj;
    return source.equals(other.source) && event.equals(other.event) && guard.equals(other.guard)
        && action.equals(other.action) && target.equals(other.target);
  }

  @Override
  public String toString() {
    return "Transition [source=" + source + ", event=" + event + ", guard="
        + guard.map(Guard::toString).orElse(null) + ", action=" + action.orElse(null) + ", target="
        + target + "]";
  }
}
