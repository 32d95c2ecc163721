package com.github.smc;

import java.util.ArrayList;
import java.util.List;

/**
 * Human readable model report, the text the CLI writes to stderr:
 *
 * <pre>
 * Found states: idle, active
 * Initial state: idle
 * State idle:
 *  Action: unlockDoor
 *  Transition: doorClosed -> active
 * </pre>
 *
 * Only the model's structure goes in, so the report of a model and of its re-parsed dump match
 * line for line.
 */
public final class ModelSummary implements ModelVisitor<Void> {
  private final StringBuilder out = new StringBuilder();
  private StateMachine machine;

  public String summarize(final StateMachine machine) {
    out.setLength(0);
    machine.accept(this);
    return out.toString();
  }

  @Override
  public Void visitStateMachine(StateMachine machine) {
    this.machine = machine;
    final List<String> names = new ArrayList<>();
    for (final State state : machine.getStates()) {
      names.add(state.getName());
    }
    out.append("Found states: ").append(String.join(", ", names)).append('\n');
    out.append("Initial state: ")
        .append(machine.getInitialState().map(State::getName).orElse("<none>")).append('\n');
    for (final State state : machine.getStates()) {
      state.accept(this);
    }
    return null;
  }

  @Override
  public Void visitEvent(EventDeclaration event) {
    return null;
  }

  @Override
  public Void visitCommand(CommandDeclaration command) {
    return null;
  }

  @Override
  public Void visitState(State state) {
    out.append("State ").append(state.getName()).append(":\n");
    for (final String action : state.getEntryActions()) {
      out.append(" Action: ").append(action).append('\n');
    }
    for (final String action : state.getExitActions()) {
      out.append(" Exit action: ").append(action).append('\n');
    }
    for (final Transition transition : machine.getOutgoingTransitions(state.getName())) {
      transition.accept(this);
    }
    return null;
  }

  @Override
  public Void visitTransition(Transition transition) {
    out.append(" Transition: ").append(transition.getEvent());
    if (transition.getGuard().isPresent()) {
      out.append(" [").append(ModelPrinter.printGuard(transition.getGuard().get())).append(']');
    }
    if (transition.getAction().isPresent()) {
      out.append(" / ").append(transition.getAction().get());
    }
    out.append(" -> ").append(transition.getTarget()).append('\n');
    return null;
  }
}
