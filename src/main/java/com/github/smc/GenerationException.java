package com.github.smc;

/**
 * Raised by the generator when the model it was handed cannot yield correct code.
 */
public final class GenerationException extends CompilerException {
  private static final long serialVersionUID = 1L;
  private final String identifier;

  GenerationException(final Code code, final String identifier, final String message) {
    super(code, message);
    this.identifier = identifier;
  }

  /**
   * The state, event or action name the failure is about.
   */
  public String getIdentifier() {
    return identifier;
  }
}
