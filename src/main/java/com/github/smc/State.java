package com.github.smc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * This object represents immutable metadata about a declared state: its name, whether it is the
 * initial state, and the actions run on entering and leaving it. Outgoing transitions are owned by
 * the {@link StateMachine}, look them up with {@link StateMachine#getOutgoingTransitions(String)}.
 */
public final class State implements ModelNode {
  static final Comparator<State> CANONICAL_ORDER =
      Comparator.comparing(State::getName).thenComparing(State::isInitial)
          .thenComparing(state -> String.join(" ", state.entryActions))
          .thenComparing(state -> String.join(" ", state.exitActions));

  private final String name;
  private final boolean initial;
  private final List<String> entryActions;
  private final List<String> exitActions;
  private final SourceLocation location;

  State(final String name, final boolean initial, final List<String> entryActions,
      final List<String> exitActions, final SourceLocation location) {
    this.name = Objects.requireNonNull(name);
    this.initial = initial;
    this.entryActions = Collections.unmodifiableList(new ArrayList<>(entryActions));
    this.exitActions = Collections.unmodifiableList(new ArrayList<>(exitActions));
    this.location = location;
  }

  public String getName() {
    return name;
  }

  public boolean isInitial() {
    return initial;
  }

  public List<String> getEntryActions() {
    return entryActions;
  }

  public List<String> getExitActions() {
    return exitActions;
  }

  @Override
  public SourceLocation getLocation() {
    return location;
  }

  @Override
  public <R> R accept(ModelVisitor<R> visitor) {
    return visitor.visitState(this);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + name.hashCode();
    result = prime * result + (initial ? 1231 : 1237);
    result = prime * result + entryActions.hashCode();
    result = prime * result + exitActions.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    State other = (State) obj;
    return name.equals(other.name) && initial == other.initial
        && entryActions.equals(other.entryActions) && exitActions.equals(other.exitActions);
  }

  @Override
  public String toString() {
    return "State [name=" + name + ", initial=" + initial + ", entryActions=" + entryActions
        + ", exitActions=" + exitActions + "]";
  }
}
