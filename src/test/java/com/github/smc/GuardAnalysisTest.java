package com.github.smc;

import static org.junit.Assert.assertEquals;

import java.util.List;

import org.junit.Test;

import com.github.smc.GuardAnalysis.Verdict;

/**
 * Tests to maintain the sanity and correctness of GuardAnalysis.
 */
public class GuardAnalysisTest {
  private static final Guard a = new Guard.Reference("a");
  private static final Guard b = new Guard.Reference("b");

  @Test
  public void testComplementsAreExclusive() {
    assertEquals(Verdict.EXCLUSIVE, GuardAnalysis.compare(a, new Guard.Not(a)));
    assertEquals(Verdict.EXCLUSIVE, GuardAnalysis.compare(new Guard.And(a, new Guard.Not(b)),
        new Guard.Or(new Guard.Not(a), b)));
  }

  @Test
  public void testIndependentVariablesOverlap() {
    assertEquals(Verdict.OVERLAPPING, GuardAnalysis.compare(a, b));
    assertEquals(Verdict.OVERLAPPING, GuardAnalysis.compare(new Guard.Or(a, b), a));
  }

  @Test
  public void testConstants() {
    assertEquals(Verdict.EXCLUSIVE, GuardAnalysis.compare(new Guard.Constant(false), a));
    assertEquals(Verdict.OVERLAPPING, GuardAnalysis.compare(new Guard.Constant(true), a));
    assertEquals(Verdict.EXCLUSIVE,
        GuardAnalysis.compare(new Guard.Constant(true), new Guard.Constant(false)));
  }

  @Test
  public void testTooManyVariablesIsUndecided() {
    Guard wide = new Guard.Reference("v0");
    for (int i = 1; i <= GuardAnalysis.maxVariables; i++) {
      wide = new Guard.And(wide, new Guard.Reference("v" + i));
    }
    assertEquals(Verdict.UNDECIDED, GuardAnalysis.compare(wide, new Guard.Not(wide)));
  }

  @Test
  public void testVariablesInFirstAppearanceOrder() {
    final Guard guard = new Guard.Or(new Guard.And(b, new Guard.Not(a)), b);
    assertEquals(List.of("b", "a"), List.copyOf(GuardAnalysis.variables(guard)));
  }
}
