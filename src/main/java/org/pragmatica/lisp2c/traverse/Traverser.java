package org.pragmatica.lisp2c.traverse;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.pragmatica.lisp2c.error.CompileError;

import java.util.Objects;

/**
 * Generic depth-first walker. Enter callbacks run before a node's children are visited,
 * exit callbacks after all of them. The walker knows nothing about the visitor it runs.
 *
 * @param <N> common supertype of all nodes in the tree
 */
public final class Traverser<N> {
    private final NodeKinds<N> kinds;

    private Traverser(NodeKinds<N> kinds) {
        this.kinds = kinds;
    }

    public static <N> Traverser<N> over(NodeKinds<N> kinds) {
        return new Traverser<>(Objects.requireNonNull(kinds, "kinds"));
    }

    /**
     * Walk the tree under {@code root}, answering the root once every node has been visited.
     * Stops at the first node whose kind is not registered.
     */
    public Either<CompileError, N> traverse(N root, Visitor<N> visitor) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(visitor, "visitor");
        return traverseNode(root, Option.none(), visitor);
    }

    private Either<CompileError, N> traverseNode(N node, Option<N> parent, Visitor<N> visitor) {
        var children = kinds.childrenOf(node);
        if (children.isEmpty()) {
            return Either.left(new CompileError.UnknownNodeKind(NodeKinds.kindName(node)));
        }
        visitor.enter(node, parent);
        var self = Option.some(node);
        for (var child : children.get()) {
            var result = traverseNode(child, self, visitor);
            if (result.isLeft()) {
                return result;
            }
        }
        visitor.exit(node, parent);
        return Either.right(node);
    }
}
