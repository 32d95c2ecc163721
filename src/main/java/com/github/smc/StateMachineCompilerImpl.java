package com.github.smc;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.smc.CompilerException.Code;

/**
 * Default compiler wiring parser, checker, printers and generator together.
 *
 * Notes for users:<br>
 * 1. this instance is thread-safe, every call builds its own printer and generator<br>
 *
 * 2. in strict mode compile() generates nothing once the checker reports an error, or any
 * diagnostic at all when warnings count as errors. Outside strict mode the generator still refuses
 * models it cannot handle, and the refusal is returned in the result<br>
 */
final class StateMachineCompilerImpl implements StateMachineCompiler {
  private static final Logger logger =
      LogManager.getLogger(StateMachineCompilerImpl.class.getSimpleName());

  private final CompilerConfiguration config;
  private final ModelChecker checker = new ModelChecker();
  private final CompilationStatistics statistics = new CompilationStatistics();

  StateMachineCompilerImpl(final CompilerConfiguration config) {
    this.config = config;
    logger.debug("Created compiler with " + config);
  }

  @Override
  public StateMachine parse(final String source, final String origin) throws SyntaxException {
    final long startNanos = System.nanoTime();
    try {
      final StateMachine machine = StateMachineParser.parse(source);
      if (logger.isDebugEnabled()) {
        logger.debug(String.format("[c:%s][f:%s] parsed %s in %d micros", machine.getName(),
            origin, machine, (System.nanoTime() - startNanos) / 1000L));
      }
      return machine;
    } catch (SyntaxException syntaxException) {
      logger.info("[f:" + origin + "] " + syntaxException.getMessage());
      throw syntaxException;
    }
  }

  @Override
  public StateMachine parse(final Path file) throws CompilerException {
    return parse(read(file), file.toString());
  }

  private static String read(final Path file) throws CompilerException {
    try {
      return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    } catch (IOException ioException) {
      throw new CompilerException(Code.IO_FAILURE, "Failed to read " + file, ioException);
    }
  }

  @Override
  public List<Diagnostic> check(final StateMachine machine) {
    return checker.check(machine);
  }

  @Override
  public String dump(final StateMachine machine) {
    return new ModelPrinter(config).print(machine);
  }

  @Override
  public String summarize(final StateMachine machine) {
    return new ModelSummary().summarize(machine);
  }

  @Override
  public GeneratedSources generate(final StateMachine machine) throws GenerationException {
    return new StateMachineGenerator(config).generate(machine);
  }

  @Override
  public CompilationResult compile(final String source, final String origin)
      throws CompilerException {
    return compile(source, origin, true);
  }

  @Override
  public CompilationResult compile(final Path file, final boolean generate)
      throws CompilerException {
    return compile(read(file), file.toString(), generate);
  }

  @Override
  public CompilationResult compile(final String source, final String origin,
      final boolean generate) throws CompilerException {
    statistics.compilationStarted();
    final StateMachine machine;
    try {
      machine = parse(source, origin);
    } catch (SyntaxException syntaxException) {
      statistics.syntaxError();
      throw syntaxException;
    }
    final String prefix = "[c:" + machine.getName() + "][f:" + origin + "] ";

    final List<Diagnostic> diagnostics = check(machine);
    statistics.checked(diagnostics.size());
    for (final Diagnostic diagnostic : diagnostics) {
      if (diagnostic.isError()) {
        logger.info(prefix + diagnostic);
      } else if (logger.isDebugEnabled()) {
        logger.debug(prefix + diagnostic);
      }
    }

    final String dump = dump(machine);
    final String summary = summarize(machine);

    final boolean rejected = blocksGeneration(diagnostics);
    Optional<GeneratedSources> generated = Optional.empty();
    Optional<GenerationException> failure = Optional.empty();
    if (rejected) {
      statistics.rejected();
      logger.info(prefix + "skipping generation, " + diagnostics.size() + " diagnostics");
    } else if (generate) {
      try {
        final GeneratedSources sources = generate(machine);
        statistics.generated(sources.getFiles().size());
        generated = Optional.of(sources);
        if (logger.isDebugEnabled()) {
          logger.debug(prefix + "generated " + sources.getFiles().size() + " units");
        }
      } catch (GenerationException generationException) {
        statistics.refused();
        logger.info(prefix + "generator refused: " + generationException.getMessage());
        failure = Optional.of(generationException);
      }
    }
    return new CompilationResult(machine, diagnostics, dump, summary, rejected, generated,
        failure);
  }

  private boolean blocksGeneration(final List<Diagnostic> diagnostics) {
    if (!config.isStrict()) {
      return false;
    }
    if (config.getWarningsAsErrors()) {
      return !diagnostics.isEmpty();
    }
    return ModelChecker.hasErrors(diagnostics);
  }

  @Override
  public CompilerConfiguration getConfiguration() {
    return config;
  }

  @Override
  public CompilationStatistics getStatistics() {
    return statistics;
  }

}
