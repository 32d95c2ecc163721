package com.github.smc;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.github.smc.CompilerException.Code;
import com.palantir.javapoet.ClassName;
import com.palantir.javapoet.JavaFile;

/**
 * The compilation units produced for one machine, in emission order: actions interface, state
 * base class, one unit per state, context.
 */
public final class GeneratedSources {
  private final List<JavaFile> files;
  private final List<ClassName> stateUnits;
  private final ClassName contextName;

  GeneratedSources(final List<JavaFile> files, final List<ClassName> stateUnits,
      final ClassName contextName) {
    this.files = Collections.unmodifiableList(new ArrayList<>(files));
    this.stateUnits = Collections.unmodifiableList(new ArrayList<>(stateUnits));
    this.contextName = contextName;
  }

  public List<JavaFile> getFiles() {
    return files;
  }

  /**
   * Class names of the per-state units, one per declared state in declaration order.
   */
  public List<ClassName> getStateUnits() {
    return stateUnits;
  }

  public ClassName getContextName() {
    return contextName;
  }

  /**
   * Write every unit below the given source root, creating package directories as needed.
   */
  public void writeTo(final Path directory) throws CompilerException {
    for (final JavaFile file : files) {
      try {
        file.writeTo(directory);
      } catch (IOException ioException) {
        throw new CompilerException(Code.IO_FAILURE,
            "Failed to write generated sources to " + directory, ioException);
      }
    }
  }

  /**
   * All units concatenated, separated by a blank line.
   */
  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder();
    for (final JavaFile file : files) {
      if (builder.length() > 0) {
        builder.append('\n');
      }
      builder.append(file.toString());
    }
    return builder.toString();
  }
}
