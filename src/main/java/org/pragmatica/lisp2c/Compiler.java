package org.pragmatica.lisp2c;

import io.vavr.control.Either;
import org.pragmatica.lisp2c.error.CompileError;
import org.pragmatica.lisp2c.generator.CodeGenerator;
import org.pragmatica.lisp2c.lexer.Lexer;
import org.pragmatica.lisp2c.lexer.Token;
import org.pragmatica.lisp2c.parser.Parser;
import org.pragmatica.lisp2c.transform.Transformer;
import org.pragmatica.lisp2c.tree.SourceNode;
import org.pragmatica.lisp2c.tree.TargetNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Prefix-call to infix-call compiler: lexer, parser, transformer and code generator run in
 * sequence, the first failure ending the run. Instances hold only their configuration and
 * may be shared.
 */
public final class Compiler {
    private static final Logger log = LoggerFactory.getLogger(Compiler.class);

    private final CompilerConfig config;
    private final CodeGenerator generator;

    private Compiler(CompilerConfig config) {
        this.config = config;
        this.generator = CodeGenerator.create(config);
    }

    public static Compiler create(CompilerConfig config) {
        return new Compiler(config);
    }

    public CompilerConfig config() {
        return config;
    }

    public Either<CompileError, String> compile(String input) {
        return tokenize(input)
            .flatMap(this::parse)
            .flatMap(this::transform)
            .flatMap(this::generate)
            .peekLeft(error -> log.debug("Compilation failed: {}", error.message()));
    }

    public Either<CompileError, List<Token>> tokenize(String input) {
        return Lexer.tokenize(input, config)
                    .peek(tokens -> log.debug("Tokenized {} characters into {} tokens", input.length(), tokens.size()));
    }

    public Either<CompileError, SourceNode.Program> parse(List<Token> tokens) {
        return Parser.parse(tokens, config)
                     .peek(program -> log.debug("Parsed {} top-level expressions", program.body().size()));
    }

    public Either<CompileError, TargetNode.Program> transform(SourceNode.Program program) {
        return Transformer.transform(program)
                          .peek(target -> log.debug("Transformed into {} top-level statements", target.body().size()));
    }

    public Either<CompileError, String> generate(TargetNode node) {
        return generator.render(node)
                        .peek(output -> log.debug("Generated {} characters", output.length()));
    }
}
