package org.pragmatica.lisp2c.generator;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.pragmatica.lisp2c.CompilerConfig;
import org.pragmatica.lisp2c.error.CompileError;
import org.pragmatica.lisp2c.traverse.NodeKinds;
import org.pragmatica.lisp2c.tree.TargetNode;

import java.util.List;
import java.util.Objects;

/**
 * Renders a target tree as infix-call source text by structural recursion into one buffer.
 */
public final class CodeGenerator {
    private final CompilerConfig config;

    private CodeGenerator(CompilerConfig config) {
        this.config = config;
    }

    public static CodeGenerator create(CompilerConfig config) {
        return new CodeGenerator(config);
    }

    /**
     * Render with the default separators.
     */
    public static Either<CompileError, String> generate(TargetNode node) {
        return create(CompilerConfig.DEFAULT).render(node);
    }

    public Either<CompileError, String> render(TargetNode node) {
        Objects.requireNonNull(node, "node");
        var out = new StringBuilder();
        var failure = emit(node, out);
        return failure.isDefined()
               ? Either.left(failure.get())
               : Either.right(out.toString());
    }

    /**
     * Append the text for {@code node}; stops at the first node that cannot be rendered.
     */
    private Option<CompileError> emit(TargetNode node, StringBuilder out) {
        if (node instanceof TargetNode.Program program) {
            return emitAll(program.body(), config.statementSeparator(), out);
        }
        if (node instanceof TargetNode.ExpressionStatement statement) {
            var failure = emit(statement.expression(), out);
            if (failure.isEmpty()) {
                out.append(';');
            }
            return failure;
        }
        if (node instanceof TargetNode.CallExpression call) {
            var failure = emit(call.callee(), out);
            if (failure.isDefined()) {
                return failure;
            }
            out.append('(');
            failure = emitAll(call.arguments(), config.argumentSeparator(), out);
            if (failure.isEmpty()) {
                out.append(')');
            }
            return failure;
        }
        if (node instanceof TargetNode.Identifier identifier) {
            out.append(identifier.name());
            return Option.none();
        }
        if (node instanceof TargetNode.NumberLiteral number) {
            out.append(number.value());
            return Option.none();
        }
        if (node instanceof TargetNode.StringLiteral string) {
            out.append('"').append(string.value()).append('"');
            return Option.none();
        }
        return Option.some(new CompileError.UnknownNodeKind(NodeKinds.kindName(node)));
    }

    private Option<CompileError> emitAll(List<? extends TargetNode> nodes, String separator, StringBuilder out) {
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                out.append(separator);
            }
            var failure = emit(nodes.get(i), out);
            if (failure.isDefined()) {
                return failure;
            }
        }
        return Option.none();
    }
}
