package org.pragmatica.lisp2c.tree;

import org.pragmatica.lisp2c.traverse.NodeKinds;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Target AST - the structure of infix-call output. Built only by the transformer.
 *
 * <p>List-valued components are read-only views over the lists they are given. The
 * transformer keeps the backing lists as its destinations and fills them while the tree is
 * being built; callers of the finished tree cannot change it.
 */
public sealed interface TargetNode {

    NodeKinds<TargetNode> KINDS = NodeKinds.<TargetNode>builder()
                                           .branch(Program.class, Program::body)
                                           .branch(ExpressionStatement.class, statement -> List.of(statement.expression()))
                                           .branch(CallExpression.class, TargetNode::callSlots)
                                           .leaf(Identifier.class)
                                           .leaf(NumberLiteral.class)
                                           .leaf(StringLiteral.class)
                                           .build();

    /**
     * Node usable as a call argument.
     */
    sealed interface Expression extends TargetNode {}

    /**
     * Node usable in a program body.
     */
    sealed interface Statement extends TargetNode {}

    /**
     * Literal value, usable both as an argument and bare at the top level.
     */
    sealed interface Literal extends Expression, Statement {}

    record Program(List<Statement> body) implements TargetNode {
        public Program {
            body = Collections.unmodifiableList(body);
        }
    }

    record ExpressionStatement(Expression expression) implements Statement {}

    record CallExpression(Identifier callee, List<Expression> arguments) implements Expression {
        public CallExpression {
            arguments = Collections.unmodifiableList(arguments);
        }
    }

    record Identifier(String name) implements Expression {}

    record NumberLiteral(String value) implements Literal {}

    record StringLiteral(String value) implements Literal {}

    private static List<TargetNode> callSlots(CallExpression call) {
        var slots = new ArrayList<TargetNode>(call.arguments().size() + 1);
        slots.add(call.callee());
        slots.addAll(call.arguments());
        return slots;
    }
}
