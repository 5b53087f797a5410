package org.pragmatica.lisp2c.tree;

import org.pragmatica.lisp2c.traverse.NodeKinds;

import java.util.List;

/**
 * Source AST - the structure of prefix-call input, delimiters dropped.
 */
public sealed interface SourceNode {

    /**
     * Child slots of every source node kind, for the traversal engine.
     */
    NodeKinds<SourceNode> KINDS = NodeKinds.<SourceNode>builder()
                                           .branch(Program.class, Program::body)
                                           .branch(CallExpression.class, CallExpression::params)
                                           .leaf(NumberLiteral.class)
                                           .leaf(StringLiteral.class)
                                           .build();

    /**
     * Root node, one per compilation.
     */
    record Program(List<SourceNode> body) implements SourceNode {}

    record NumberLiteral(String value) implements SourceNode {}

    record StringLiteral(String value) implements SourceNode {}

    /**
     * Named call: {@code (name param...)}. Params never contain a {@link Program}.
     */
    record CallExpression(String name, List<SourceNode> params) implements SourceNode {}
}
