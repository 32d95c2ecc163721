package com.github.smc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Root of the abstract model parsed from one {@code .sm} file. It owns the declared events,
 * commands, reset events, states and transitions, all kept in declaration order.
 *
 * Notes for users:<br>
 * 1. instances are built only by {@link StateMachineParser} and are immutable afterwards; the
 * checker, printers and generator are read-only visitors<br>
 *
 * 2. the model is allowed to be semantically broken (duplicate states, dangling transition ends,
 * several initial states). Those are reported by {@link ModelChecker}, never rejected here<br>
 *
 * 3. equality is structural: two machines are equal when they declare the same elements, whatever
 * the order or layout of the text they were parsed from. Locations do not take part<br>
 */
public final class StateMachine implements ModelNode {
  private final String name;
  private final List<EventDeclaration> events;
  private final List<String> resetEvents;
  private final List<SourceLocation> resetEventLocations;
  private final List<CommandDeclaration> commands;
  private final List<State> states;
  private final List<Transition> transitions;
  private final SourceLocation location;

  // K=state name, first declaration wins
  private final Map<String, State> stateIndex = new LinkedHashMap<>();
  // K=source state name, V=transitions leaving it in declaration order
  private final Map<String, List<Transition>> outgoingIndex = new LinkedHashMap<>();

  StateMachine(final String name, final List<EventDeclaration> events,
      final List<String> resetEvents, final List<SourceLocation> resetEventLocations,
      final List<CommandDeclaration> commands, final List<State> states,
      final List<Transition> transitions, final SourceLocation location) {
    this.name = Objects.requireNonNull(name);
    this.events = Collections.unmodifiableList(new ArrayList<>(events));
    this.resetEvents = Collections.unmodifiableList(new ArrayList<>(resetEvents));
    this.resetEventLocations = Collections.unmodifiableList(new ArrayList<>(resetEventLocations));
    this.commands = Collections.unmodifiableList(new ArrayList<>(commands));
    this.states = Collections.unmodifiableList(new ArrayList<>(states));
    this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
    this.location = location;
    for (final State state : this.states) {
      stateIndex.putIfAbsent(state.getName(), state);
    }
    for (final Transition transition : this.transitions) {
      outgoingIndex.computeIfAbsent(transition.getSource(), source -> new ArrayList<>())
          .add(transition);
    }
  }

  public String getName() {
    return name;
  }

  public List<EventDeclaration> getEvents() {
    return events;
  }

  public List<String> getResetEvents() {
    return resetEvents;
  }

  SourceLocation getResetEventLocation(final int index) {
    return resetEventLocations.get(index);
  }

  public List<CommandDeclaration> getCommands() {
    return commands;
  }

  public List<State> getStates() {
    return states;
  }

  public List<Transition> getTransitions() {
    return transitions;
  }

  /**
   * Lookup a declared state by name. When the name is declared more than once the first
   * declaration is returned.
   */
  public Optional<State> findState(final String stateName) {
    return Optional.ofNullable(stateIndex.get(stateName));
  }

  /**
   * Transitions whose source is the given name, in declaration order. Empty for unknown names.
   */
  public List<Transition> getOutgoingTransitions(final String stateName) {
    final List<Transition> outgoing = outgoingIndex.get(stateName);
    return outgoing == null ? Collections.emptyList() : Collections.unmodifiableList(outgoing);
  }

  /**
   * The first state marked initial, if any.
   */
  public Optional<State> getInitialState() {
    return states.stream().filter(State::isInitial).findFirst();
  }

  @Override
  public SourceLocation getLocation() {
    return location;
  }

  @Override
  public <R> R accept(ModelVisitor<R> visitor) {
    return visitor.visitStateMachine(this);
  }

  /**
   * Visit this machine, then every owned node in declaration order: events, commands, states,
   * transitions.
   */
  public void walk(final ModelVisitor<?> visitor) {
    accept(visitor);
    for (final EventDeclaration event : events) {
      event.accept(visitor);
    }
    for (final CommandDeclaration command : commands) {
      command.accept(visitor);
    }
    for (final State state : states) {
      state.accept(visitor);
    }
    for (final Transition transition : transitions) {
      transition.accept(visitor);
    }
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, sorted(states, State.CANONICAL_ORDER),
        sorted(transitions, Transition.CANONICAL_ORDER),
        sorted(events, EventDeclaration.CANONICAL_ORDER),
        sorted(commands, CommandDeclaration.CANONICAL_ORDER),
        sorted(resetEvents, Comparator.naturalOrder()));
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    StateMachine other = (StateMachine) obj;
    return name.equals(other.name)
        && sameElements(states, other.states, State.CANONICAL_ORDER)
        && sameElements(transitions, other.transitions, Transition.CANONICAL_ORDER)
        && sameElements(events, other.events, EventDeclaration.CANONICAL_ORDER)
        && sameElements(commands, other.commands, CommandDeclaration.CANONICAL_ORDER)
        && sameElements(resetEvents, other.resetEvents, Comparator.naturalOrder());
  }

  @Override
  public String toString() {
    return "StateMachine [name=" + name + ", states=" + states.size() + ", transitions="
        + transitions.size() + ", events=" + events.size() + ", commands=" + commands.size()
        + ", resetEvents=" + resetEvents + "]";
  }

  private static <T> boolean sameElements(final List<T> mine, final List<T> theirs,
      final Comparator<? super T> order) {
    return mine.size() == theirs.size() && sorted(mine, order).equals(sorted(theirs, order));
  }

  private static <T> List<T> sorted(final List<T> items, final Comparator<? super T> order) {
    final List<T> copy = new ArrayList<>(items);
    copy.sort(order);
    return copy;
  }
}
