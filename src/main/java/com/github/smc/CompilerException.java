package com.github.smc;

/**
 * Unified checked exception thrown by the compiler. The code enum encapsulates the various failure
 * conditions so callers and tests can assert on {@link #getCode()} instead of message prose.
 * {@link SyntaxException} and {@link GenerationException} narrow it to the two fatal tiers.
 */
public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public CompilerException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public CompilerException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1. lexer
    UNEXPECTED_CHARACTER("Character is not part of the .sm language"),
    // 2. parser
    UNEXPECTED_TOKEN("Token is not valid at this position"),
    // 3.
    UNEXPECTED_END_OF_INPUT("Input ended in the middle of a declaration"),
    // 4.
    DUPLICATE_CLAUSE("Clause may appear at most once per state"),
    // 5. generator
    UNRESOLVED_STATE("Transition references a state that is not declared"),
    // 6.
    DUPLICATE_STATE("State name is declared more than once"),
    // 7.
    DUPLICATE_TRANSITION("Transitions sharing source and event cannot be told apart"),
    // 8.
    MISSING_INITIAL_STATE("No state is marked initial"),
    // 9.
    MULTIPLE_INITIAL_STATES("More than one state is marked initial"),
    // 10.
    INVALID_IDENTIFIER("Name cannot be used as a Java identifier"),
    // 11.
    NAME_CLASH("Two model names map onto the same generated name"),
    // 12. pipeline
    INVALID_CONFIG("Compiler configuration is invalid"),
    // 13.
    IO_FAILURE("Failed to read or write a file");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
