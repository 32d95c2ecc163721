package com.github.smc;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether two guards can hold at the same time by walking their joint truth table. Guards
 * are small in practice; past {@link #maxVariables} distinct variables the answer is
 * {@link Verdict#UNDECIDED} rather than an exponential search.
 */
final class GuardAnalysis {
  static final int maxVariables = 16;

  enum Verdict {
    // no assignment satisfies both guards
    EXCLUSIVE,
    // some assignment satisfies both guards
    OVERLAPPING,
    // too many variables to enumerate
    UNDECIDED;
  }

  private GuardAnalysis() {}

  static Verdict compare(final Guard first, final Guard second) {
    final Set<String> names = new LinkedHashSet<>();
    first.accept(new VariableCollector(names));
    second.accept(new VariableCollector(names));
    if (names.size() > maxVariables) {
      return Verdict.UNDECIDED;
    }
    final List<String> variables = new ArrayList<>(names);
    final Map<String, Boolean> assignment = new HashMap<>();
    final Evaluator evaluator = new Evaluator(assignment);
    for (long bits = 0; bits < (1L << variables.size()); bits++) {
      for (int i = 0; i < variables.size(); i++) {
        assignment.put(variables.get(i), ((bits >> i) & 1L) == 1L);
      }
      if (first.accept(evaluator) && second.accept(evaluator)) {
        return Verdict.OVERLAPPING;
      }
    }
    return Verdict.EXCLUSIVE;
  }

  /**
   * Guard variables in first-appearance order.
   */
  static Set<String> variables(final Guard guard) {
    final Set<String> names = new LinkedHashSet<>();
    guard.accept(new VariableCollector(names));
    return names;
  }

  private static final class VariableCollector implements GuardVisitor<Void> {
    private final Set<String> names;

    private VariableCollector(final Set<String> names) {
      this.names = names;
    }

    @Override
    public Void visitReference(Guard.Reference reference) {
      names.add(reference.getName());
      return null;
    }

    @Override
    public Void visitConstant(Guard.Constant constant) {
      return null;
    }

    @Override
    public Void visitNot(Guard.Not not) {
      return not.getOperand().accept(this);
    }

    @Override
    public Void visitAnd(Guard.And and) {
      and.getLeft().accept(this);
      return and.getRight().accept(this);
    }

    @Override
    public Void visitOr(Guard.Or or) {
      or.getLeft().accept(this);
      return or.getRight().accept(this);
    }
  }

  private static final class Evaluator implements GuardVisitor<Boolean> {
    private final Map<String, Boolean> assignment;

    private Evaluator(final Map<String, Boolean> assignment) {
      this.assignment = assignment;
    }

    @Override
    public Boolean visitReference(Guard.Reference reference) {
      return assignment.get(reference.getName());
    }

    @Override
    public Boolean visitConstant(Guard.Constant constant) {
      return constant.getValue();
    }

    @Override
    public Boolean visitNot(Guard.Not not) {
      return !not.getOperand().accept(this);
    }

    @Override
    public Boolean visitAnd(Guard.And and) {
      return and.getLeft().accept(this) && and.getRight().accept(this);
    }

    @Override
    public Boolean visitOr(Guard.Or or) {
      return or.getLeft().accept(this) || or.getRight().accept(this);
    }
  }
}
