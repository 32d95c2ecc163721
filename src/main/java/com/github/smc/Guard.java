package com.github.smc;

import java.util.Objects;

/**
 * Boolean condition attached to a transition. Leaves are guard variables and constants, inner
 * nodes are {@code !}, {@code &&} and {@code ||}. Equality is structural, so two guards written
 * with different parentheses or spacing but the same tree are equal.
 */
public abstract sealed class Guard permits Guard.Reference, Guard.Constant, Guard.Not, Guard.And,
    Guard.Or {

  public abstract <R> R accept(GuardVisitor<R> visitor);

  /**
   * Binding strength used by the printer: 1 for or, 2 for and, 3 for unary and leaves.
   */
  abstract int precedence();

  public static final class Reference extends Guard {
    private final String name;

    Reference(final String name) {
      this.name = Objects.requireNonNull(name);
    }

    public String getName() {
      return name;
    }

    @Override
    public <R> R accept(GuardVisitor<R> visitor) {
      return visitor.visitReference(this);
    }

    @Override
    int precedence() {
      return 3;
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Reference && name.equals(((Reference) obj).name);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  public static final class Constant extends Guard {
    private final boolean value;

    Constant(final boolean value) {
      this.value = value;
    }

    public boolean getValue() {
      return value;
    }

    @Override
    public <R> R accept(GuardVisitor<R> visitor) {
      return visitor.visitConstant(this);
    }

    @Override
    int precedence() {
      return 3;
    }

    @Override
    public int hashCode() {
      return Boolean.hashCode(value);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Constant && value == ((Constant) obj).value;
    }

    @Override
    public String toString() {
      return Boolean.toString(value);
    }
  }

  public static final class Not extends Guard {
    private final Guard operand;

    Not(final Guard operand) {
      this.operand = Objects.requireNonNull(operand);
    }

    public Guard getOperand() {
      return operand;
    }

    @Override
    public <R> R accept(GuardVisitor<R> visitor) {
      return visitor.visitNot(this);
    }

    @Override
    int precedence() {
      return 3;
    }

    @Override
    public int hashCode() {
      return 7 * operand.hashCode() + 1;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Not && operand.equals(((Not) obj).operand);
    }

    @Override
    public String toString() {
      return "!(" + operand + ")";
    }
  }

  public static final class And extends Guard {
    private final Guard left;
    private final Guard right;

    And(final Guard left, final Guard right) {
      this.left = Objects.requireNonNull(left);
      this.right = Objects.requireNonNull(right);
    }

    public Guard getLeft() {
      return left;
    }

    public Guard getRight() {
      return right;
    }

    @Override
    public <R> R accept(GuardVisitor<R> visitor) {
      return visitor.visitAnd(this);
    }

    @Override
    int precedence() {
      return 2;
    }

    @Override
    public int hashCode() {
      return Objects.hash("&&", left, right);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof And)) {
        return false;
      }
      And other = (And) obj;
      return left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public String toString() {
      return "(" + left + " && " + right + ")";
    }
  }

  public static final class Or extends Guard {
    private final Guard left;
    private final Guard right;

    Or(final Guard left, final Guard right) {
      this.left = Objects.requireNonNull(left);
      this.right = Objects.requireNonNull(right);
    }

    public Guard getLeft() {
      return left;
    }

    public Guard getRight() {
      return right;
    }

    @Override
    public <R> R accept(GuardVisitor<R> visitor) {
      return visitor.visitOr(this);
    }

    @Override
    int precedence() {
      return 1;
    }

    @Override
    public int hashCode() {
      return Objects.hash("||", left, right);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Or)) {
        return false;
      }
      Or other = (Or) obj;
      return left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public String toString() {
      return "(" + left + " || " + right + ")";
    }
  }
}
