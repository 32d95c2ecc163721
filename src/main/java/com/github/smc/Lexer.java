package com.github.smc;

import java.util.ArrayList;
import java.util.List;

import com.github.smc.CompilerException.Code;

/**
 * Turns {@code .sm} source text into tokens. Whitespace and comments ({@code #} or {@code //} up to
 * the end of the line) are dropped. The token list always ends with a single EOF token.
 */
final class Lexer {
  private final String text;
  private int position;
  private int line = 1;
  private int column = 1;

  Lexer(final String text) {
    this.text = text;
  }

  List<Token> tokenize() throws SyntaxException {
    final List<Token> tokens = new ArrayList<>();
    while (true) {
      skipBlanksAndComments();
      if (position >= text.length()) {
        tokens.add(new Token(TokenType.EOF, "", here()));
        return tokens;
      }
      tokens.add(next());
    }
  }

  private Token next() throws SyntaxException {
    final SourceLocation start = here();
    final char current = text.charAt(position);
    if (isWordStart(current)) {
      final String word = word();
      return new Token(TokenType.forWord(word), word, start);
    }
    if (isDigit(current)) {
      return new Token(TokenType.CODE, word(), start);
    }
    switch (current) {
      case '{':
        return single(TokenType.LBRACE, start);
      case '}':
        return single(TokenType.RBRACE, start);
      case '[':
        return single(TokenType.LBRACKET, start);
      case ']':
        return single(TokenType.RBRACKET, start);
      case '(':
        return single(TokenType.LPAREN, start);
      case ')':
        return single(TokenType.RPAREN, start);
      case '/':
        return single(TokenType.SLASH, start);
      case '!':
        return single(TokenType.NOT, start);
      case '=':
        return pair('>', TokenType.ARROW, start);
      case '&':
        return pair('&', TokenType.AND, start);
      case '|':
        return pair('|', TokenType.OR, start);
      default:
        throw new SyntaxException(Code.UNEXPECTED_CHARACTER, start, String.valueOf(current),
            "unexpected character '" + current + "'");
    }
  }

  private String word() {
    final int begin = position;
    while (position < text.length()
        && (isWordStart(text.charAt(position)) || isDigit(text.charAt(position)))) {
      advance();
    }
    return text.substring(begin, position);
  }

  private Token single(final TokenType type, final SourceLocation start) {
    advance();
    return new Token(type, type.getSpelling(), start);
  }

  private Token pair(final char second, final TokenType type, final SourceLocation start)
      throws SyntaxException {
    final char first = text.charAt(position);
    advance();
    if (position >= text.length() || text.charAt(position) != second) {
      throw new SyntaxException(Code.UNEXPECTED_CHARACTER, start, String.valueOf(first),
          "unexpected character '" + first + "', did you mean '" + type.getSpelling() + "'?");
    }
    advance();
    return new Token(type, type.getSpelling(), start);
  }

  private void skipBlanksAndComments() {
    while (position < text.length()) {
      final char current = text.charAt(position);
      if (Character.isWhitespace(current)) {
        advance();
      } else if (current == '#' || (current == '/' && position + 1 < text.length()
          && text.charAt(position + 1) == '/')) {
        while (position < text.length() && text.charAt(position) != '\n') {
          advance();
        }
      } else {
        return;
      }
    }
  }

  // ASCII only, identifiers must stay valid Java names
  private static boolean isWordStart(final char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  private static boolean isDigit(final char c) {
    return c >= '0' && c <= '9';
  }

  private void advance() {
    if (text.charAt(position) == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    position++;
  }

  private SourceLocation here() {
    return new SourceLocation(line, column);
  }
}
