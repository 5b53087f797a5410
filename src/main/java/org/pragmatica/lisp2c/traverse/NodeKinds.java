package org.pragmatica.lisp2c.traverse;

import io.vavr.control.Option;

import java.lang.reflect.Modifier;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * The node kinds a tree is made of, each with the accessor for its child slot.
 * A kind is identified by the concrete class of its nodes; leaves have no children.
 *
 * @param <N> common supertype of all nodes in the tree
 */
public final class NodeKinds<N> {
    private final Map<Class<?>, Function<N, List<? extends N>>> slots;

    private NodeKinds(Map<Class<?>, Function<N, List<? extends N>>> slots) {
        this.slots = Map.copyOf(slots);
    }

    public static <N> Builder<N> builder() {
        return new Builder<>();
    }

    /**
     * Children of the node in slot order, or none if the node's kind is not registered.
     */
    public Option<List<? extends N>> childrenOf(N node) {
        return Option.of(slots.get(node.getClass()))
                     .map(slot -> slot.apply(node));
    }

    boolean isRegistered(Class<?> kind) {
        return slots.containsKey(kind);
    }

    public static String kindName(Object node) {
        return node.getClass()
                   .getSimpleName();
    }

    /**
     * Kinds are matched by the exact runtime class of a node, so only concrete classes can ever match.
     */
    static <T> Class<T> requireConcrete(Class<T> kind) {
        if (kind.isInterface() || Modifier.isAbstract(kind.getModifiers())) {
            throw new IllegalArgumentException("Node kind must be a concrete class, got " + kind.getName());
        }
        return kind;
    }

    public static final class Builder<N> {
        private final Map<Class<?>, Function<N, List<? extends N>>> slots = new LinkedHashMap<>();

        private Builder() {}

        public <T extends N> Builder<N> leaf(Class<T> kind) {
            slots.put(requireConcrete(kind), node -> List.of());
            return this;
        }

        public <T extends N> Builder<N> branch(Class<T> kind, Function<? super T, ? extends List<? extends N>> children) {
            slots.put(requireConcrete(kind), node -> children.apply(kind.cast(node)));
            return this;
        }

        public NodeKinds<N> build() {
            return new NodeKinds<>(slots);
        }
    }
}
