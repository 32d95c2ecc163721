package com.github.smc;

import java.io.PrintStream;
import java.nio.file.Path;

import com.github.smc.CompilerConfiguration.CompilerConfigurationBuilder;
import com.github.smc.StateMachineCompiler.StateMachineCompilerBuilder;

/**
 * Command line entry point.
 *
 * <pre>
 * smc &lt;file.sm&gt; [--dump] [--generate &lt;dir|-&gt;] [--package &lt;name&gt;] [--alphabetical]
 *     [--warnings-as-errors]
 * </pre>
 *
 * The summary and diagnostics go to stderr, the dump and {@code --generate -} output to stdout.
 * Code is only generated with {@code --generate}.
 */
public final class Main {
  static final int EXIT_OK = 0;
  static final int EXIT_CHECK_FAILED = 1;
  static final int EXIT_SYNTAX_ERROR = 2;
  static final int EXIT_GENERATION_FAILED = 3;
  static final int EXIT_USAGE = 64;
  static final int EXIT_IO = 74;

  static final String USAGE = "Usage: smc <file.sm> [--dump] [--generate <dir|->]"
      + " [--package <name>] [--alphabetical] [--warnings-as-errors]";

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  static int run(final String[] args, final PrintStream out, final PrintStream err) {
    String input = null;
    boolean dump = false;
    String generateTo = null;
    final CompilerConfigurationBuilder configBuilder = CompilerConfigurationBuilder.newBuilder();
    for (int i = 0; i < args.length; i++) {
      switch (args[i]) {
        case "--dump":
          dump = true;
          break;
        case "--alphabetical":
          configBuilder.orderingPolicy(OrderingPolicy.ALPHABETICAL);
          break;
        case "--warnings-as-errors":
          configBuilder.warningsAsErrors(true);
          break;
        case "--generate":
        case "--package":
          if (i + 1 == args.length) {
            err.println(args[i] + " needs an argument");
            err.println(USAGE);
            return EXIT_USAGE;
          }
          if (args[i].equals("--generate")) {
            generateTo = args[++i];
          } else {
            configBuilder.targetPackage(args[++i]);
          }
          break;
        default:
          if (args[i].startsWith("--") || input != null) {
            err.println("Unexpected argument: " + args[i]);
            err.println(USAGE);
            return EXIT_USAGE;
          }
          input = args[i];
      }
    }
    if (input == null) {
      err.println(USAGE);
      return EXIT_USAGE;
    }

    final StateMachineCompiler compiler;
    try {
      compiler = StateMachineCompilerBuilder.newBuilder().config(configBuilder.build()).build();
    } catch (CompilerException configProblem) {
      err.println(configProblem.getMessage());
      return EXIT_USAGE;
    }

    final CompilationResult result;
    try {
      result = compiler.compile(Path.of(input), generateTo != null);
    } catch (SyntaxException syntaxException) {
      err.println(input + ":" + syntaxException.getMessage());
      return EXIT_SYNTAX_ERROR;
    } catch (CompilerException readProblem) {
      err.println(readProblem.getMessage() + ": " + readProblem.getCause());
      return EXIT_IO;
    }

    err.print(result.getSummary());
    for (final Diagnostic diagnostic : result.getDiagnostics()) {
      err.println(input + ":" + diagnostic);
    }
    if (dump) {
      out.print(result.getDump());
    }
    if (result.isRejected()) {
      return EXIT_CHECK_FAILED;
    }
    if (result.getGenerationFailure().isPresent()) {
      err.println(input + ": cannot generate code: "
          + result.getGenerationFailure().get().getMessage());
      return EXIT_GENERATION_FAILED;
    }
    if (generateTo != null) {
      final GeneratedSources generated = result.getGenerated().get();
      if (generateTo.equals("-")) {
        out.print(generated);
      } else {
        try {
          generated.writeTo(Path.of(generateTo));
        } catch (CompilerException writeProblem) {
          err.println(writeProblem.getMessage() + ": " + writeProblem.getCause());
          return EXIT_IO;
        }
      }
    }
    return EXIT_OK;
  }

  private Main() {}
}
