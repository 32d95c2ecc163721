package com.github.smc;

import java.nio.file.Path;
import java.util.List;

/**
 * Compiler for the {@code .sm} state machine language. Parsing yields an immutable
 * {@link StateMachine}; everything downstream (checker, dump, summary, generator) only reads it.
 *
 * Notes for users:<br>
 * 1. a compiler instance holds nothing but its configuration, so one instance may serve any number
 * of files and threads<br>
 *
 * 2. syntax errors and generator refusals are exceptions; semantic problems are data, returned as
 * {@link Diagnostic}s, and never abort the check<br>
 *
 * 3. {@link #compile(String, String)} is the strict pipeline most callers want; the single steps
 * are exposed for tooling that wants to stop early or inspect intermediate output<br>
 */
public interface StateMachineCompiler {

  /**
   * Parse {@code .sm} text. The origin names the input in log lines and diagnostics, typically a
   * file name.
   */
  StateMachine parse(final String source, final String origin) throws SyntaxException;

  /**
   * Read and parse a {@code .sm} file as UTF-8. Read failures surface as
   * {@link CompilerException.Code#IO_FAILURE}.
   */
  StateMachine parse(final Path file) throws CompilerException;

  /**
   * Run every semantic rule and return all findings in a deterministic order.
   */
  List<Diagnostic> check(final StateMachine machine);

  /**
   * Canonical {@code .sm} text of the model that parses back into an equal model.
   */
  String dump(final StateMachine machine);

  /**
   * Line oriented human readable report of states, actions and transitions.
   */
  String summarize(final StateMachine machine);

  /**
   * Generate Java sources. Models the checker would reject are refused with a
   * {@link GenerationException} rather than turned into wrong code.
   */
  GeneratedSources generate(final StateMachine machine) throws GenerationException;

  /**
   * Parse, check, dump and, unless the configuration says the diagnostics forbid it, generate.
   * Same as {@code compile(source, origin, true)}.
   */
  CompilationResult compile(final String source, final String origin) throws CompilerException;

  /**
   * Parse, check, dump and summarize; generate only when asked to and the diagnostics allow it. A
   * generator refusal does not abort the run, it is carried by
   * {@link CompilationResult#getGenerationFailure()} next to the diagnostics, dump and summary.
   * Only syntax errors are thrown.
   */
  CompilationResult compile(final String source, final String origin, final boolean generate)
      throws CompilerException;

  /**
   * {@link #compile(String, String, boolean)} over a UTF-8 file. Read failures surface as
   * {@link CompilerException.Code#IO_FAILURE}.
   */
  CompilationResult compile(final Path file, final boolean generate) throws CompilerException;

  /**
   * Returns the config this compiler is wired with.
   */
  CompilerConfiguration getConfiguration();

  /**
   * Report statistics of all compile() runs of this instance.
   */
  CompilationStatistics getStatistics();

  /**
   * A simple builder to let users use fluent APIs to build compilers.
   */
  public final static class StateMachineCompilerBuilder {
    private CompilerConfiguration config;

    public static StateMachineCompilerBuilder newBuilder() {
      return new StateMachineCompilerBuilder();
    }

    public StateMachineCompilerBuilder config(final CompilerConfiguration config) {
      this.config = config;
      return this;
    }

    public StateMachineCompiler build() {
      return new StateMachineCompilerImpl(
          config == null ? CompilerConfiguration.defaults() : config);
    }

    private StateMachineCompilerBuilder() {}
  }

}
