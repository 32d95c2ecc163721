package com.github.smc;

import java.text.MessageFormat;
import java.util.Objects;
import java.util.Optional;

/**
 * A single finding of the {@link ModelChecker}. Diagnostics are plain values: the checker returns
 * them instead of throwing, and the caller decides whether to go on.
 */
public final class Diagnostic {
  private final DiagnosticCode code;
  private final String message;
  private final SourceLocation location;
  private final Optional<String> stateName;
  private final Optional<String> eventName;

  private Diagnostic(final DiagnosticCode code, final String message,
      final SourceLocation location, final Optional<String> stateName,
      final Optional<String> eventName) {
    this.code = code;
    this.message = message;
    this.location = location;
    this.stateName = stateName;
    this.eventName = eventName;
  }

  /**
   * Build a diagnostic whose message is the code's template filled with the arguments.
   */
  static Diagnostic of(final DiagnosticCode code, final SourceLocation location,
      final String stateName, final String eventName, final Object... arguments) {
    return new Diagnostic(code, MessageFormat.format(code.getTemplate(), arguments), location,
        Optional.ofNullable(stateName), Optional.ofNullable(eventName));
  }

  public DiagnosticCode getCode() {
    return code;
  }

  public Severity getSeverity() {
    return code.getSeverity();
  }

  public boolean isError() {
    return code.getSeverity() == Severity.ERROR;
  }

  public String getMessage() {
    return message;
  }

  public SourceLocation getLocation() {
    return location;
  }

  /**
   * The state the finding is about, when there is one.
   */
  public Optional<String> getStateName() {
    return stateName;
  }

  public Optional<String> getEventName() {
    return eventName;
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, message, location, stateName, eventName);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Diagnostic)) {
      return false;
    }
    Diagnostic other = (Diagnostic) obj;
    return code == other.code && message.equals(other.message)
        && Objects.equals(location, other.location) && stateName.equals(other.stateName)
        && eventName.equals(other.eventName);
  }

  /**
   * Renders as {@code line:col: error SM105: message}.
   */
  @Override
  public String toString() {
    return location + ": " + getSeverity().getLabel() + " " + code.getId() + ": " + message;
  }

  public static enum Severity {
    ERROR("error"), WARNING("warning");

    private final String label;

    private Severity(final String label) {
      this.label = label;
    }

    public String getLabel() {
      return label;
    }
  }
}
