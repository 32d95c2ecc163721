package com.github.smc;

import com.github.smc.Diagnostic.Severity;

/**
 * Stable identifiers of the checker rules. Tests and tools match on these, never on message text.
 * The declaration order is the order in which the checker runs the rules.
 */
public enum DiagnosticCode {
  // 1. structural
  DUPLICATE_STATE("SM101", Severity.ERROR, "State {0} declared more than once"),
  // 2.
  MISSING_INITIAL_STATE("SM102", Severity.ERROR, "No initial state declared"),
  // 3.
  MULTIPLE_INITIAL_STATES("SM103", Severity.ERROR,
      "State {0} marked initial, but {1} already is"),
  // 4. resolution
  UNDECLARED_STATE("SM104", Severity.ERROR, "Transition on {1} references undeclared state {0}"),
  // 5.
  DUPLICATE_TRANSITION("SM105", Severity.ERROR, "In state {0}: event {1} redeclared"),
  // 6.
  SELF_TRANSITION_NO_EFFECT("SM106", Severity.ERROR, "In state {0}: event {1} has no effect"),
  // 7. declarations
  DUPLICATE_EVENT("SM107", Severity.ERROR, "Event {0} declared more than once"),
  // 8.
  DUPLICATE_COMMAND("SM108", Severity.ERROR, "Command {0} declared more than once"),
  // 9.
  UNDECLARED_EVENT("SM109", Severity.ERROR, "In state {0}: event {1} is not declared"),
  // 10.
  UNDECLARED_COMMAND("SM110", Severity.ERROR, "In state {0}: action {1} is not a declared command"),
  // 11.
  UNDECLARED_RESET_EVENT("SM111", Severity.ERROR, "Reset event {0} is not a declared event"),
  // 12. advisory
  OVERLAPPING_GUARDS("SM201", Severity.WARNING,
      "In state {0}: guards on event {1} are not mutually exclusive"),
  // 13.
  UNREACHABLE_STATE("SM202", Severity.WARNING, "State {0} is never entered");

  private final String id;
  private final Severity severity;
  private final String template;

  private DiagnosticCode(final String id, final Severity severity, final String template) {
    this.id = id;
    this.severity = severity;
    this.template = template;
  }

  public String getId() {
    return id;
  }

  public Severity getSeverity() {
    return severity;
  }

  /**
   * Message pattern in {@link java.text.MessageFormat} syntax.
   */
  public String getTemplate() {
    return template;
  }
}
