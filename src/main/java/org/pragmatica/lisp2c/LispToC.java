package org.pragmatica.lisp2c;

import io.vavr.control.Either;
import org.pragmatica.lisp2c.error.CompileError;

/**
 * Entry point for compiling prefix-call source into infix-call source.
 *
 * <p>Example usage:
 * <pre>{@code
 * var output = LispToC.compile("(add 2 (subtract 4 2))").get();
 * // add(2,subtract(4,2));
 *
 * var spaced = LispToC.builder()
 *                     .argumentSeparator(", ")
 *                     .build()
 *                     .compile("(add 1 2)");
 * // add(1, 2);
 * }</pre>
 */
public final class LispToC {
    private static final Compiler DEFAULT_COMPILER = Compiler.create(CompilerConfig.DEFAULT);

    private LispToC() {}

    /**
     * Compile with the default configuration.
     */
    public static Either<CompileError, String> compile(String input) {
        return DEFAULT_COMPILER.compile(input);
    }

    public static Compiler compiler() {
        return DEFAULT_COMPILER;
    }

    public static Compiler compiler(CompilerConfig config) {
        return Compiler.create(config);
    }

    /**
     * Create a builder for a custom compiler configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String argumentSeparator = CompilerConfig.DEFAULT.argumentSeparator();
        private String statementSeparator = CompilerConfig.DEFAULT.statementSeparator();
        private int maxInputSize = CompilerConfig.DEFAULT.maxInputSize();
        private int maxNestingDepth = CompilerConfig.DEFAULT.maxNestingDepth();

        private Builder() {}

        public Builder argumentSeparator(String separator) {
            this.argumentSeparator = separator;
            return this;
        }

        public Builder statementSeparator(String separator) {
            this.statementSeparator = separator;
            return this;
        }

        public Builder maxInputSize(int size) {
            this.maxInputSize = size;
            return this;
        }

        public Builder maxNestingDepth(int depth) {
            this.maxNestingDepth = depth;
            return this;
        }

        public Compiler build() {
            return Compiler.create(new CompilerConfig(argumentSeparator, statementSeparator, maxInputSize, maxNestingDepth));
        }
    }
}
