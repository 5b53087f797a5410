package org.pragmatica.lisp2c;

import java.util.Objects;

/**
 * Compiler configuration options.
 *
 * @param argumentSeparator text placed between generated call arguments
 * @param statementSeparator text placed between generated top-level statements
 * @param maxInputSize largest accepted input, in characters
 * @param maxNestingDepth largest number of calls nested inside each other
 */
public record CompilerConfig(
    String argumentSeparator,
    String statementSeparator,
    int maxInputSize,
    int maxNestingDepth
) {
    public static final CompilerConfig DEFAULT = new CompilerConfig(
        ",",
        "\n",
        1_000_000,
        256
    );

    public CompilerConfig {
        Objects.requireNonNull(argumentSeparator, "argumentSeparator");
        Objects.requireNonNull(statementSeparator, "statementSeparator");
        if (maxInputSize <= 0) {
            throw new IllegalArgumentException("maxInputSize must be positive, got " + maxInputSize);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got " + maxNestingDepth);
        }
    }
}
