package com.github.smc;

/**
 * Fatal parse failure. No model is produced when this is thrown.
 */
public final class SyntaxException extends CompilerException {
  private static final long serialVersionUID = 1L;
  private final int line;
  private final int column;
  private final String token;

  SyntaxException(final Code code, final SourceLocation location, final String token,
      final String message) {
    super(code, location + ": " + message);
    this.line = location.getLine();
    this.column = location.getColumn();
    this.token = token;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  /**
   * Text of the offending token, empty at end of input.
   */
  public String getToken() {
    return token;
  }
}
