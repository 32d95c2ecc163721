package com.github.smc;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one {@link StateMachineCompiler#compile(String, String, boolean)} run. Generated
 * sources are absent when generation was not asked for, when the diagnostics stopped it, or when
 * the generator refused the model.
 */
public final class CompilationResult {
  private final StateMachine machine;
  private final List<Diagnostic> diagnostics;
  private final String dump;
  private final String summary;
  private final boolean rejected;
  private final Optional<GeneratedSources> generated;
  private final Optional<GenerationException> generationFailure;

  CompilationResult(final StateMachine machine, final List<Diagnostic> diagnostics,
      final String dump, final String summary, final boolean rejected,
      final Optional<GeneratedSources> generated,
      final Optional<GenerationException> generationFailure) {
    this.machine = machine;
    this.diagnostics = List.copyOf(diagnostics);
    this.dump = dump;
    this.summary = summary;
    this.rejected = rejected;
    this.generated = generated;
    this.generationFailure = generationFailure;
  }

  public StateMachine getMachine() {
    return machine;
  }

  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  public boolean hasErrors() {
    return ModelChecker.hasErrors(diagnostics);
  }

  public String getDump() {
    return dump;
  }

  public String getSummary() {
    return summary;
  }

  /**
   * True when the diagnostics, under the configured strictness, forbid generation.
   */
  public boolean isRejected() {
    return rejected;
  }

  public Optional<GeneratedSources> getGenerated() {
    return generated;
  }

  public Optional<GenerationException> getGenerationFailure() {
    return generationFailure;
  }

  @Override
  public String toString() {
    return "CompilationResult [machine=" + machine.getName() + ", diagnostics="
        + diagnostics.size() + ", rejected=" + rejected + ", generated=" + generated.isPresent()
        + ", generationFailure=" + generationFailure.isPresent() + "]";
  }
}
