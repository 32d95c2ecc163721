package com.github.smc;

import javax.lang.model.SourceVersion;

/**
 * This class encapsulates all the configuration parameters for the compiler. Use the
 * {@code CompilerConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. if nothing is set, declarations are dumped in declaration order with a 4 space indent and
 * classes are generated into the unnamed package<br>
 * 2. strict mode makes {@link StateMachineCompiler#compile(String, String)} skip generation as soon
 * as the checker reports an error; warnings only count when warningsAsErrors is set too<br>
 */
public final class CompilerConfiguration {
  private final OrderingPolicy orderingPolicy;
  private final String indent;
  private final String targetPackage;
  private final boolean strict;
  private final boolean warningsAsErrors;

  public OrderingPolicy getOrderingPolicy() {
    return orderingPolicy;
  }

  public String getIndent() {
    return indent;
  }

  public String getTargetPackage() {
    return targetPackage;
  }

  public boolean isStrict() {
    return strict;
  }

  public boolean getWarningsAsErrors() {
    return warningsAsErrors;
  }

  /**
   * All defaults: declaration order, 4 space indent, unnamed package, strict.
   */
  public static CompilerConfiguration defaults() {
    return new CompilerConfiguration(OrderingPolicy.DECLARATION, "    ", "", true, false);
  }

  public final static class CompilerConfigurationBuilder {
    private OrderingPolicy orderingPolicy = OrderingPolicy.DECLARATION;
    private String indent = "    ";
    private String targetPackage = "";
    private boolean strict = true;
    private boolean warningsAsErrors;

    public static CompilerConfigurationBuilder newBuilder() {
      return new CompilerConfigurationBuilder();
    }

    public CompilerConfigurationBuilder orderingPolicy(final OrderingPolicy orderingPolicy) {
      this.orderingPolicy = orderingPolicy;
      return this;
    }

    public CompilerConfigurationBuilder indent(final String indent) {
      this.indent = indent;
      return this;
    }

    public CompilerConfigurationBuilder targetPackage(final String targetPackage) {
      this.targetPackage = targetPackage;
      return this;
    }

    public CompilerConfigurationBuilder strict(final boolean strict) {
      this.strict = strict;
      return this;
    }

    public CompilerConfigurationBuilder warningsAsErrors(final boolean warningsAsErrors) {
      this.warningsAsErrors = warningsAsErrors;
      return this;
    }

    public CompilerConfiguration build() throws CompilerException {
      final CompilerConfiguration config = new CompilerConfiguration(orderingPolicy, indent,
          targetPackage, strict, warningsAsErrors);
      config.validate();
      return config;
    }

    private CompilerConfigurationBuilder() {}
  }

  private void validate() throws CompilerException {
    StringBuilder messages = new StringBuilder();
    if (orderingPolicy == null) {
      messages.append("OrderingPolicy cannot be null. ");
    }
    if (indent == null || indent.isEmpty() || !indent.isBlank()) {
      messages.append("Indent must be a non-empty run of blanks. ");
    }
    if (targetPackage == null) {
      messages.append("Target package cannot be null, use \"\" for the unnamed package. ");
    } else if (!targetPackage.isEmpty()
        && !SourceVersion.isName(targetPackage)) {
      messages.append("Target package '").append(targetPackage)
          .append("' is not a valid Java package name. ");
    }
    if (messages.length() > 0) {
      throw new CompilerException(CompilerException.Code.INVALID_CONFIG, messages.toString());
    }
  }

  @Override
  public String toString() {
    return "CompilerConfiguration [orderingPolicy=" + orderingPolicy + ", indent='" + indent
        + "', targetPackage=" + targetPackage + ", strict=" + strict + ", warningsAsErrors="
        + warningsAsErrors + "]";
  }

  private CompilerConfiguration(final OrderingPolicy orderingPolicy, final String indent,
      final String targetPackage, final boolean strict, final boolean warningsAsErrors) {
    this.orderingPolicy = orderingPolicy;
    this.indent = indent;
    this.targetPackage = targetPackage;
    this.strict = strict;
    this.warningsAsErrors = warningsAsErrors;
  }

}
