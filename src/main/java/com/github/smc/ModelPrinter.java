package com.github.smc;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Dumps a model back to canonical {@code .sm} text. Re-parsing the dump yields a structurally
 * equal model, and dumping that model again gives byte-identical text.
 *
 * Layout: header, then the events, resetEvents and commands sections (omitted when empty), then one
 * block per state with its outgoing transitions nested as {@code on} items, and finally top-level
 * {@code transition} lines for transitions whose source state is not declared. Sections are
 * separated by one blank line and the text ends with a newline.
 */
public final class ModelPrinter implements ModelVisitor<Void> {
  private final OrderingPolicy orderingPolicy;
  private final String indent;
  private final StringBuilder out = new StringBuilder();
  private StateMachine machine;

  public ModelPrinter(final CompilerConfiguration config) {
    this.orderingPolicy = config.getOrderingPolicy();
    this.indent = config.getIndent();
  }

  public String print(final StateMachine machine) {
    out.setLength(0);
    machine.accept(this);
    return out.toString();
  }

  @Override
  public Void visitStateMachine(StateMachine machine) {
    this.machine = machine;
    out.append("machine ").append(machine.getName()).append('\n');

    final List<EventDeclaration> events =
        ordered(machine.getEvents(), EventDeclaration.CANONICAL_ORDER);
    if (!events.isEmpty()) {
      out.append("\nevents\n");
      for (final EventDeclaration event : events) {
        event.accept(this);
      }
      out.append("end\n");
    }

    final List<String> resetEvents = ordered(machine.getResetEvents(), Comparator.naturalOrder());
    if (!resetEvents.isEmpty()) {
      out.append("\nresetEvents\n");
      for (final String resetEvent : resetEvents) {
        out.append(indent).append(resetEvent).append('\n');
      }
      out.append("end\n");
    }

    final List<CommandDeclaration> commands =
        ordered(machine.getCommands(), CommandDeclaration.CANONICAL_ORDER);
    if (!commands.isEmpty()) {
      out.append("\ncommands\n");
      for (final CommandDeclaration command : commands) {
        command.accept(this);
      }
      out.append("end\n");
    }

    final Set<String> printed = new HashSet<>();
    for (final State state : ordered(machine.getStates(), State.CANONICAL_ORDER)) {
      out.append('\n');
      state.accept(this);
      if (printed.add(state.getName())) {
        for (final Transition transition : ordered(
            machine.getOutgoingTransitions(state.getName()), Transition.CANONICAL_ORDER)) {
          transition.accept(this);
        }
      }
      out.append("end\n");
    }

    final List<Transition> dangling = new ArrayList<>();
    for (final Transition transition : machine.getTransitions()) {
      if (machine.findState(transition.getSource()).isEmpty()) {
        dangling.add(transition);
      }
    }
    if (!dangling.isEmpty()) {
      out.append('\n');
      for (final Transition transition : ordered(dangling, Transition.CANONICAL_ORDER)) {
        transition.accept(this);
      }
    }
    return null;
  }

  @Override
  public Void visitEvent(EventDeclaration event) {
    out.append(indent).append(event.getName()).append(' ').append(event.getCode()).append('\n');
    return null;
  }

  @Override
  public Void visitCommand(CommandDeclaration command) {
    out.append(indent).append(command.getName()).append(' ').append(command.getCode())
        .append('\n');
    return null;
  }

  /**
   * Prints the state header and its entry/exit clauses; the caller appends the nested transitions
   * and the closing {@code end}.
   */
  @Override
  public Void visitState(State state) {
    if (state.isInitial()) {
      out.append("initial ");
    }
    out.append("state ").append(state.getName()).append('\n');
    actions("entry", state.getEntryActions());
    actions("exit", state.getExitActions());
    return null;
  }

  @Override
  public Void visitTransition(Transition transition) {
    if (machine.findState(transition.getSource()).isPresent()) {
      out.append(indent).append("on ");
    } else {
      out.append("transition ").append(transition.getSource()).append(" on ");
    }
    out.append(transition.getEvent());
    if (transition.getGuard().isPresent()) {
      out.append(" [").append(printGuard(transition.getGuard().get())).append(']');
    }
    if (transition.getAction().isPresent()) {
      out.append(" / ").append(transition.getAction().get());
    }
    out.append(" => ").append(transition.getTarget()).append('\n');
    return null;
  }

  /**
   * Guard text with the fewest parentheses that still parse back into the same tree: {@code &&}
   * binds tighter than {@code ||}, both associate to the left.
   */
  public static String printGuard(final Guard guard) {
    return guard.accept(new GuardPrinter());
  }

  private void actions(final String keyword, final List<String> actions) {
    if (actions.isEmpty()) {
      return;
    }
    out.append(indent).append(keyword).append(" {");
    for (final String action : actions) {
      out.append(' ').append(action);
    }
    out.append(" }\n");
  }

  private <T> List<T> ordered(final List<T> items, final Comparator<? super T> order) {
    final List<T> copy = new ArrayList<>(items);
    if (orderingPolicy == OrderingPolicy.ALPHABETICAL) {
      copy.sort(order);
    }
    return copy;
  }

  private static final class GuardPrinter implements GuardVisitor<String> {
    @Override
    public String visitReference(Guard.Reference reference) {
      return reference.getName();
    }

    @Override
    public String visitConstant(Guard.Constant constant) {
      return Boolean.toString(constant.getValue());
    }

    @Override
    public String visitNot(Guard.Not not) {
      return "!" + operand(not.getOperand(), 3, false);
    }

    @Override
    public String visitAnd(Guard.And and) {
      return operand(and.getLeft(), 2, false) + " && " + operand(and.getRight(), 2, true);
    }

    @Override
    public String visitOr(Guard.Or or) {
      return operand(or.getLeft(), 1, false) + " || " + operand(or.getRight(), 1, true);
    }

    private String operand(final Guard child, final int parentPrecedence, final boolean right) {
      final String text = child.accept(this);
      final boolean wrap = right ? child.precedence() <= parentPrecedence
          : child.precedence() < parentPrecedence;
      return wrap ? "(" + text + ")" : text;
    }
  }
}
