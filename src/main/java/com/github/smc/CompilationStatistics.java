package com.github.smc;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters over all compile() calls of one compiler instance.
 */
public final class CompilationStatistics {
  private final long startTstampMillis = System.currentTimeMillis();
  private final AtomicInteger totalCompilations = new AtomicInteger();
  private final AtomicInteger totalSyntaxErrors = new AtomicInteger();
  private final AtomicInteger totalRejected = new AtomicInteger();
  private final AtomicInteger totalGenerated = new AtomicInteger();
  private final AtomicInteger totalRefused = new AtomicInteger();
  private final AtomicLong totalDiagnostics = new AtomicLong();
  private final AtomicLong totalGeneratedUnits = new AtomicLong();

  CompilationStatistics() {}

  void compilationStarted() {
    totalCompilations.incrementAndGet();
  }

  void syntaxError() {
    totalSyntaxErrors.incrementAndGet();
  }

  void checked(final int diagnostics) {
    totalDiagnostics.addAndGet(diagnostics);
  }

  void rejected() {
    totalRejected.incrementAndGet();
  }

  void refused() {
    totalRefused.incrementAndGet();
  }

  void generated(final int units) {
    totalGenerated.incrementAndGet();
    totalGeneratedUnits.addAndGet(units);
  }

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public int getTotalCompilations() {
    return totalCompilations.get();
  }

  public int getTotalSyntaxErrors() {
    return totalSyntaxErrors.get();
  }

  /**
   * Compilations whose diagnostics stopped generation.
   */
  public int getTotalRejected() {
    return totalRejected.get();
  }

  public int getTotalGenerated() {
    return totalGenerated.get();
  }

  /**
   * Compilations the generator refused after the diagnostics let them through.
   */
  public int getTotalRefused() {
    return totalRefused.get();
  }

  public long getTotalDiagnostics() {
    return totalDiagnostics.get();
  }

  public long getTotalGeneratedUnits() {
    return totalGeneratedUnits.get();
  }

  @Override
  public String toString() {
    return "CompilationStatistics [startTstampMillis=" + startTstampMillis
        + ", totalCompilations=" + totalCompilations + ", totalSyntaxErrors=" + totalSyntaxErrors
        + ", totalRejected=" + totalRejected + ", totalGenerated=" + totalGenerated + ", totalRefused=" + totalRefused
        + ", totalDiagnostics=" + totalDiagnostics + ", totalGeneratedUnits="
        + totalGeneratedUnits + "]";
  }

}
