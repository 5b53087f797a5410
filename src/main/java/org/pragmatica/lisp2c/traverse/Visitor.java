package org.pragmatica.lisp2c.traverse;

import io.vavr.control.Option;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-kind enter/exit callbacks driving a {@link Traverser}.
 * Kinds without callbacks are walked silently. Instances are immutable.
 * Callbacks are keyed by a node's exact class; registering an interface or abstract class fails.
 *
 * <pre>{@code
 * var visitor = Visitor.<SourceNode>builder()
 *                      .onEnter(SourceNode.CallExpression.class, (call, parent) -> names.add(call.name()))
 *                      .build();
 * }</pre>
 *
 * @param <N> common supertype of all nodes in the tree
 */
public final class Visitor<N> {

    /**
     * Callback receiving the visited node and its parent (none for the root).
     */
    @FunctionalInterface
    public interface Callback<T, N> {
        void accept(T node, Option<N> parent);
    }

    private record Handlers<N>(Option<Callback<N, N>> enter, Option<Callback<N, N>> exit) {
        static <N> Handlers<N> none() {
            return new Handlers<>(Option.none(), Option.none());
        }

        Handlers<N> withEnter(Callback<N, N> callback) {
            return new Handlers<>(Option.some(callback), exit);
        }

        Handlers<N> withExit(Callback<N, N> callback) {
            return new Handlers<>(enter, Option.some(callback));
        }
    }

    private final Map<Class<?>, Handlers<N>> handlers;

    private Visitor(Map<Class<?>, Handlers<N>> handlers) {
        this.handlers = Map.copyOf(handlers);
    }

    public static <N> Builder<N> builder() {
        return new Builder<>();
    }

    void enter(N node, Option<N> parent) {
        handlersOf(node).enter()
                        .forEach(callback -> callback.accept(node, parent));
    }

    void exit(N node, Option<N> parent) {
        handlersOf(node).exit()
                        .forEach(callback -> callback.accept(node, parent));
    }

    private Handlers<N> handlersOf(N node) {
        return handlers.getOrDefault(node.getClass(), Handlers.none());
    }

    public static final class Builder<N> {
        private final Map<Class<?>, Handlers<N>> handlers = new HashMap<>();

        private Builder() {}

        public <T extends N> Builder<N> onEnter(Class<T> kind, Callback<? super T, N> callback) {
            handlers.put(NodeKinds.requireConcrete(kind), current(kind).withEnter(narrow(kind, callback)));
            return this;
        }

        public <T extends N> Builder<N> onExit(Class<T> kind, Callback<? super T, N> callback) {
            handlers.put(NodeKinds.requireConcrete(kind), current(kind).withExit(narrow(kind, callback)));
            return this;
        }

        public Visitor<N> build() {
            return new Visitor<>(handlers);
        }

        private Handlers<N> current(Class<?> kind) {
            return handlers.getOrDefault(kind, Handlers.none());
        }

        private static <N, T extends N> Callback<N, N> narrow(Class<T> kind, Callback<? super T, N> callback) {
            return (node, parent) -> callback.accept(kind.cast(node), parent);
        }
    }
}
