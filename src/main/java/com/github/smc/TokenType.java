package com.github.smc;

import java.util.HashMap;
import java.util.Map;

/**
 * Token kinds of the {@code .sm} language. Keyword kinds carry their spelling, punctuation kinds
 * their symbol, so error messages can name what was expected.
 */
enum TokenType {
  // words
  IDENT("identifier"),
  CODE("code"),
  // keywords
  MACHINE("machine"),
  EVENTS("events"),
  RESET_EVENTS("resetEvents"),
  COMMANDS("commands"),
  END("end"),
  INITIAL("initial"),
  STATE("state"),
  ENTRY("entry"),
  EXIT("exit"),
  ON("on"),
  TRANSITION("transition"),
  TRUE("true"),
  FALSE("false"),
  // punctuation
  LBRACE("{"),
  RBRACE("}"),
  LBRACKET("["),
  RBRACKET("]"),
  LPAREN("("),
  RPAREN(")"),
  SLASH("/"),
  ARROW("=>"),
  NOT("!"),
  AND("&&"),
  OR("||"),
  EOF("end of input");

  private static final Map<String, TokenType> keywords = new HashMap<>();
  static {
    for (final TokenType type : values()) {
      if (type.ordinal() >= MACHINE.ordinal() && type.ordinal() <= FALSE.ordinal()) {
        keywords.put(type.spelling, type);
      }
    }
  }

  private final String spelling;

  private TokenType(final String spelling) {
    this.spelling = spelling;
  }

  String getSpelling() {
    return spelling;
  }

  /**
   * Returns the keyword kind for a word, or IDENT when the word is not reserved.
   */
  static TokenType forWord(final String word) {
    return keywords.getOrDefault(word, IDENT);
  }

  static boolean isKeyword(final String word) {
    return keywords.containsKey(word);
  }
}
