package com.github.smc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Semantic checks over a parsed {@link StateMachine}. Problems never abort the check; every
 * violated rule becomes a {@link Diagnostic} and the full list is handed back.
 *
 * Rules run one after the other in {@link DiagnosticCode} order, each walking the model in
 * declaration order, so the same model always yields the same list in the same order.
 */
public final class ModelChecker {
  private static final Logger logger = LogManager.getLogger(ModelChecker.class.getSimpleName());

  public List<Diagnostic> check(final StateMachine machine) {
    final List<Diagnostic> diagnostics = new ArrayList<>();
    final List<Rule> rules = List.of(new DuplicateStateRule(), new InitialStateRule(),
        new UndeclaredStateRule(machine), new DuplicateTransitionRule(machine),
        new SelfTransitionRule(), new DuplicateEventRule(), new DuplicateCommandRule(),
        new UndeclaredEventRule(machine), new UndeclaredCommandRule(machine),
        new UndeclaredResetEventRule(machine), new OverlappingGuardsRule(machine),
        new UnreachableStateRule(machine));
    for (final Rule rule : rules) {
      rule.diagnostics = diagnostics;
      machine.walk(rule);
      rule.finish();
    }
    if (logger.isDebugEnabled()) {
      for (final Diagnostic diagnostic : diagnostics) {
        logger.debug("[c:" + machine.getName() + "] " + diagnostic);
      }
    }
    return Collections.unmodifiableList(diagnostics);
  }

  /**
   * Returns true iff at least one diagnostic is an error.
   */
  public static boolean hasErrors(final List<Diagnostic> diagnostics) {
    return diagnostics.stream().anyMatch(Diagnostic::isError);
  }

  /**
   * Group transitions by (source, event), groups and members in declaration order.
   */
  static Map<String, List<Transition>> groupBySourceAndEvent(final StateMachine machine) {
    final Map<String, List<Transition>> groups = new LinkedHashMap<>();
    for (final Transition transition : machine.getTransitions()) {
      groups.computeIfAbsent(transition.getSource() + "\u0000" + transition.getEvent(),
          key -> new ArrayList<>()).add(transition);
    }
    return groups;
  }

  /**
   * A rule sees every node through the visitor callbacks and may report once more in
   * {@link #finish()}. Callbacks default to doing nothing.
   */
  private abstract static class Rule implements ModelVisitor<Void> {
    private List<Diagnostic> diagnostics;

    void report(final DiagnosticCode code, final SourceLocation location, final String stateName,
        final String eventName, final Object... arguments) {
      diagnostics.add(Diagnostic.of(code, location, stateName, eventName, arguments));
    }

    void finish() {}

    @Override
    public Void visitStateMachine(StateMachine machine) {
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
      return null;
    }

    @Override
    public Void visitTransition(Transition transition) {
      return null;
    }
  }

  private static final class DuplicateStateRule extends Rule {
    private final Set<String> seen = new HashSet<>();
    private final Set<String> reported = new HashSet<>();

    @Override
    public Void visitState(State state) {
      if (!seen.add(state.getName()) && reported.add(state.getName())) {
        report(DiagnosticCode.DUPLICATE_STATE, state.getLocation(), state.getName(), null,
            state.getName());
      }
      return null;
    }
  }

  private static final class InitialStateRule extends Rule {
    private State initial;
    private boolean reported;
    private SourceLocation machineLocation;

    @Override
    public Void visitStateMachine(StateMachine machine) {
      machineLocation = machine.getLocation();
      return null;
    }

    @Override
    public Void visitState(State state) {
      if (!state.isInitial()) {
        return null;
      }
      if (initial == null) {
        initial = state;
      } else if (!reported) {
        // once per machine, on the second initial state
        reported = true;
        report(DiagnosticCode.MULTIPLE_INITIAL_STATES, state.getLocation(), state.getName(),
            null, state.getName(), initial.getName());
      }
      return null;
    }

    @Override
    void finish() {
      if (initial == null) {
        report(DiagnosticCode.MISSING_INITIAL_STATE, machineLocation, null, null);
      }
    }
  }

  private static final class UndeclaredStateRule extends Rule {
    private final StateMachine machine;

    private UndeclaredStateRule(final StateMachine machine) {
      this.machine = machine;
    }

    @Override
    public Void visitTransition(Transition transition) {
      if (machine.findState(transition.getSource()).isEmpty()) {
        report(DiagnosticCode.UNDECLARED_STATE, transition.getLocation(),
            transition.getSource(), transition.getEvent(), transition.getSource(),
            transition.getEvent());
      }
      if (machine.findState(transition.getTarget()).isEmpty()) {
        report(DiagnosticCode.UNDECLARED_STATE, transition.getLocation(),
            transition.getTarget(), transition.getEvent(), transition.getTarget(),
            transition.getEvent());
      }
      return null;
    }
  }

  private static final class DuplicateTransitionRule extends Rule {
    private final StateMachine machine;

    private DuplicateTransitionRule(final StateMachine machine) {
      this.machine = machine;
    }

    @Override
    void finish() {
      for (final List<Transition> group : groupBySourceAndEvent(machine).values()) {
        final Optional<Transition> secondUnguarded =
            group.stream().filter(transition -> !transition.isGuarded()).skip(1).findFirst();
        if (secondUnguarded.isPresent()) {
          duplicate(secondUnguarded.get());
        }
        for (int j = 1; j < group.size(); j++) {
          final Transition later = group.get(j);
          if (later.isGuarded() && group.subList(0, j).stream()
              .anyMatch(earlier -> earlier.getGuard().equals(later.getGuard()))) {
            duplicate(later);
          }
        }
      }
    }

    private void duplicate(final Transition transition) {
      report(DiagnosticCode.DUPLICATE_TRANSITION, transition.getLocation(),
          transition.getSource(), transition.getEvent(), transition.getSource(),
          transition.getEvent());
    }
  }

  private static final class SelfTransitionRule extends Rule {
    @Override
    public Void visitTransition(Transition transition) {
      if (transition.getSource().equals(transition.getTarget())
          && transition.getAction().isEmpty()) {
        report(DiagnosticCode.SELF_TRANSITION_NO_EFFECT, transition.getLocation(),
            transition.getSource(), transition.getEvent(), transition.getSource(),
            transition.getEvent());
      }
      return null;
    }
  }

  private static final class DuplicateEventRule extends Rule {
    private final Set<String> seen = new HashSet<>();

    @Override
    public Void visitEvent(EventDeclaration event) {
      if (!seen.add(event.getName())) {
        report(DiagnosticCode.DUPLICATE_EVENT, event.getLocation(), null, event.getName(),
            event.getName());
      }
      return null;
    }
  }

  private static final class DuplicateCommandRule extends Rule {
    private final Set<String> seen = new HashSet<>();

    @Override
    public Void visitCommand(CommandDeclaration command) {
      if (!seen.add(command.getName())) {
        report(DiagnosticCode.DUPLICATE_COMMAND, command.getLocation(), null, null,
            command.getName());
      }
      return null;
    }
  }

  private static final class UndeclaredEventRule extends Rule {
    private final Set<String> declared = new HashSet<>();

    private UndeclaredEventRule(final StateMachine machine) {
      for (final EventDeclaration event : machine.getEvents()) {
        declared.add(event.getName());
      }
    }

    @Override
    public Void visitTransition(Transition transition) {
      // undeclared events are only an error once the machine opts into declaring them
      if (!declared.isEmpty() && !declared.contains(transition.getEvent())) {
        report(DiagnosticCode.UNDECLARED_EVENT, transition.getLocation(), transition.getSource(),
            transition.getEvent(), transition.getSource(), transition.getEvent());
      }
      return null;
    }
  }

  private static final class UndeclaredCommandRule extends Rule {
    private final Set<String> declared = new HashSet<>();

    private UndeclaredCommandRule(final StateMachine machine) {
      for (final CommandDeclaration command : machine.getCommands()) {
        declared.add(command.getName());
      }
    }

    @Override
    public Void visitState(State state) {
      for (final String action : state.getEntryActions()) {
        check(action, state.getName(), null, state.getLocation());
      }
      for (final String action : state.getExitActions()) {
        check(action, state.getName(), null, state.getLocation());
      }
      return null;
    }

    @Override
    public Void visitTransition(Transition transition) {
      if (transition.getAction().isPresent()) {
        check(transition.getAction().get(), transition.getSource(), transition.getEvent(),
            transition.getLocation());
      }
      return null;
    }

    private void check(final String action, final String stateName, final String eventName,
        final SourceLocation location) {
      if (!declared.isEmpty() && !declared.contains(action)) {
        report(DiagnosticCode.UNDECLARED_COMMAND, location, stateName, eventName, stateName,
            action);
      }
    }
  }

  private static final class UndeclaredResetEventRule extends Rule {
    private final Set<String> declared = new HashSet<>();

    private UndeclaredResetEventRule(final StateMachine machine) {
      for (final EventDeclaration event : machine.getEvents()) {
        declared.add(event.getName());
      }
    }

    @Override
    public Void visitStateMachine(StateMachine machine) {
      final List<String> resetEvents = machine.getResetEvents();
      for (int i = 0; i < resetEvents.size(); i++) {
        if (!declared.contains(resetEvents.get(i))) {
          report(DiagnosticCode.UNDECLARED_RESET_EVENT, machine.getResetEventLocation(i), null,
              resetEvents.get(i), resetEvents.get(i));
        }
      }
      return null;
    }
  }

  private static final class OverlappingGuardsRule extends Rule {
    private final StateMachine machine;

    private OverlappingGuardsRule(final StateMachine machine) {
      this.machine = machine;
    }

    @Override
    void finish() {
      for (final List<Transition> group : groupBySourceAndEvent(machine).values()) {
        for (int i = 0; i < group.size(); i++) {
          for (int j = i + 1; j < group.size(); j++) {
            final Transition first = group.get(i);
            final Transition second = group.get(j);
            if (!first.isGuarded() || !second.isGuarded()
                || first.getGuard().equals(second.getGuard())) {
              // unguarded fallbacks are fine, identical guards are already duplicates
              continue;
            }
            if (GuardAnalysis.compare(first.getGuard().get(),
                second.getGuard().get()) != GuardAnalysis.Verdict.EXCLUSIVE) {
              report(DiagnosticCode.OVERLAPPING_GUARDS, second.getLocation(), second.getSource(),
                  second.getEvent(), second.getSource(), second.getEvent());
            }
          }
        }
      }
    }
  }

  private static final class UnreachableStateRule extends Rule {
    private final Set<String> entered = new HashSet<>();
    private final Set<String> seen = new HashSet<>();

    private UnreachableStateRule(final StateMachine machine) {
      for (final Transition transition : machine.getTransitions()) {
        if (!transition.getSource().equals(transition.getTarget())) {
          entered.add(transition.getTarget());
        }
      }
    }

    @Override
    public Void visitState(State state) {
      if (seen.add(state.getName()) && !state.isInitial()
          && !entered.contains(state.getName())) {
        report(DiagnosticCode.UNREACHABLE_STATE, state.getLocation(), state.getName(), null,
            state.getName());
      }
      return null;
    }
  }
}
