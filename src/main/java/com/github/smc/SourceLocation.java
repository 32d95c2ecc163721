package com.github.smc;

/**
 * 1-based line and column of a token or model node.
 */
public final class SourceLocation {
  private final int line;
  private final int column;

  SourceLocation(final int line, final int column) {
    this.line = line;
    this.column = column;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  @Override
  public int hashCode() {
    return 31 * line + column;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof SourceLocation)) {
      return false;
    }
    SourceLocation other = (SourceLocation) obj;
    return line == other.line && column == other.column;
  }

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
