package com.github.smc;

/**
 * A lexeme with its kind and where it starts in the source.
 */
final class Token {
  private final TokenType type;
  private final String text;
  private final SourceLocation location;

  Token(final TokenType type, final String text, final SourceLocation location) {
    this.type = type;
    this.text = text;
    this.location = location;
  }

  TokenType getType() {
    return type;
  }

  String getText() {
    return text;
  }

  SourceLocation getLocation() {
    return location;
  }

  /**
   * How the token reads in an error message.
   */
  String describe() {
    return type == TokenType.EOF ? type.getSpelling() : "'" + text + "'";
  }

  @Override
  public String toString() {
    return type + "(" + text + ")@" + location;
  }
}
