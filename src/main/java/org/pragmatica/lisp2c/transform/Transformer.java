package org.pragmatica.lisp2c.transform;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.pragmatica.lisp2c.error.CompileError;
import org.pragmatica.lisp2c.traverse.Traverser;
import org.pragmatica.lisp2c.traverse.Visitor;
import org.pragmatica.lisp2c.tree.SourceNode;
import org.pragmatica.lisp2c.tree.TargetNode;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Converts a prefix-call source tree into an infix-call target tree.
 *
 * <p>The conversion is a single visitor run by the {@link Traverser}. Each source node that
 * has children owns a destination: the list in the new tree its children's output lands in.
 * The root's destination is the new program body; a call's destination is the argument list
 * of the target call built for it. Destinations are assigned on enter, before any child is
 * visited, and dropped when the pass ends.
 *
 * <p>A call landing in the program body is wrapped in an expression statement; a call landing
 * in another call's argument list stays a bare expression. Literals land unwrapped in both.
 */
public final class Transformer {
    private static final Traverser<SourceNode> TRAVERSER = Traverser.over(SourceNode.KINDS);

    private final Map<SourceNode, Destination> destinations = new IdentityHashMap<>();

    private Transformer() {}

    public static Either<CompileError, TargetNode.Program> transform(SourceNode.Program program) {
        return new Transformer().run(program);
    }

    private Either<CompileError, TargetNode.Program> run(SourceNode.Program program) {
        var body = new ArrayList<TargetNode.Statement>();
        var target = new TargetNode.Program(body);
        destinations.put(program, Destination.statements(body));
        try {
            return TRAVERSER.traverse(program, visitor())
                            .map(root -> target);
        } finally {
            destinations.clear();
        }
    }

    private Visitor<SourceNode> visitor() {
        return Visitor.<SourceNode>builder()
                      .onEnter(SourceNode.NumberLiteral.class,
                               (number, parent) -> destinationOf(parent).literals().accept(new TargetNode.NumberLiteral(number.value())))
                      .onEnter(SourceNode.StringLiteral.class,
                               (string, parent) -> destinationOf(parent).literals().accept(new TargetNode.StringLiteral(string.value())))
                      .onEnter(SourceNode.CallExpression.class, this::enterCall)
                      .build();
    }

    private void enterCall(SourceNode.CallExpression call, Option<SourceNode> parent) {
        var arguments = new ArrayList<TargetNode.Expression>();
        var expression = new TargetNode.CallExpression(new TargetNode.Identifier(call.name()), arguments);
        destinations.put(call, Destination.arguments(arguments));
        destinationOf(parent).calls().accept(expression);
    }

    private Destination destinationOf(Option<SourceNode> parent) {
        var node = parent.getOrElseThrow(() -> new IllegalStateException("Only the program may appear without a parent"));
        var destination = destinations.get(node);
        if (destination == null) {
            throw new IllegalStateException("No destination assigned to " + node.getClass().getSimpleName());
        }
        return destination;
    }

    /**
     * Backing list of a node under construction, seen through what may be added to it.
     */
    private record Destination(Consumer<TargetNode.Literal> literals, Consumer<TargetNode.CallExpression> calls) {
        static Destination statements(List<TargetNode.Statement> body) {
            return new Destination(body::add, call -> body.add(new TargetNode.ExpressionStatement(call)));
        }

        static Destination arguments(List<TargetNode.Expression> arguments) {
            return new Destination(arguments::add, arguments::add);
        }
    }
}
