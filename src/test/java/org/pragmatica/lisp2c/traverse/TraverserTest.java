package org.pragmatica.lisp2c.traverse;

import org.junit.jupiter.api.Test;
import org.pragmatica.lisp2c.error.CompileError;
import org.pragmatica.lisp2c.tree.SourceNode;
import org.pragmatica.lisp2c.tree.SourceNode.CallExpression;
import org.pragmatica.lisp2c.tree.SourceNode.NumberLiteral;
import org.pragmatica.lisp2c.tree.SourceNode.Program;
import org.pragmatica.lisp2c.tree.SourceNode.StringLiteral;
import org.pragmatica.lisp2c.tree.TargetNode;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the generic walker: ordering of callbacks, parent passing and kind checks.
 */
class TraverserTest {

    private static final Traverser<SourceNode> TRAVERSER = Traverser.over(SourceNode.KINDS);

    // (add 2 (sub 4 "x"))
    private static final Program TREE = new Program(List.of(
        new CallExpression("add", List.of(
            new NumberLiteral("2"),
            new CallExpression("sub", List.of(new NumberLiteral("4"), new StringLiteral("x")))))));

    // === Ordering ===

    @Test
    void traverse_entersPreOrderAndExitsPostOrder() {
        var events = new ArrayList<String>();
        var visitor = Visitor.<SourceNode>builder()
                             .onEnter(Program.class, (node, parent) -> events.add("enter program"))
                             .onExit(Program.class, (node, parent) -> events.add("exit program"))
                             .onEnter(CallExpression.class, (call, parent) -> events.add("enter " + call.name()))
                             .onExit(CallExpression.class, (call, parent) -> events.add("exit " + call.name()))
                             .onEnter(NumberLiteral.class, (number, parent) -> events.add("number " + number.value()))
                             .onEnter(StringLiteral.class, (string, parent) -> events.add("string " + string.value()))
                             .build();

        var result = TRAVERSER.traverse(TREE, visitor);

        assertTrue(result.isRight());
        assertSame(TREE, result.get());
        assertThat(events).containsExactly(
            "enter program",
            "enter add",
            "number 2",
            "enter sub",
            "number 4",
            "string x",
            "exit sub",
            "exit add",
            "exit program");
    }

    @Test
    void traverse_visitorWithoutCallbacks_walksSilently() {
        var result = TRAVERSER.traverse(TREE, Visitor.<SourceNode>builder().build());

        assertTrue(result.isRight());
    }

    @Test
    void traverse_leafExitCallback_runsRightAfterEnter() {
        var events = new ArrayList<String>();
        var visitor = Visitor.<SourceNode>builder()
                             .onEnter(NumberLiteral.class, (number, parent) -> events.add("enter " + number.value()))
                             .onExit(NumberLiteral.class, (number, parent) -> events.add("exit " + number.value()))
                             .build();

        TRAVERSER.traverse(TREE, visitor);

        assertThat(events).containsExactly("enter 2", "exit 2", "enter 4", "exit 4");
    }

    // === Parents ===

    @Test
    void traverse_passesParentToCallbacks() {
        var parents = new ArrayList<String>();
        var visitor = Visitor.<SourceNode>builder()
                             .onEnter(Program.class, (node, parent) -> parents.add("program <- " + parent.map(NodeKinds::kindName).getOrElse("none")))
                             .onEnter(NumberLiteral.class, (number, parent) -> parents.add(number.value() + " <- " + ((CallExpression) parent.get()).name()))
                             .onExit(CallExpression.class, (call, parent) -> parents.add(call.name() + " <- " + NodeKinds.kindName(parent.get())))
                             .build();

        TRAVERSER.traverse(TREE, visitor);

        assertThat(parents).containsExactly(
            "program <- none",
            "2 <- add",
            "4 <- sub",
            "sub <- CallExpression",
            "add <- Program");
    }

    // === Kinds ===

    @Test
    void traverse_unregisteredKind_failsWithUnknownNodeKind() {
        var kinds = NodeKinds.<SourceNode>builder()
                             .branch(Program.class, Program::body)
                             .branch(CallExpression.class, CallExpression::params)
                             .leaf(NumberLiteral.class)
                             .build();
        var entered = new ArrayList<String>();
        var visitor = Visitor.<SourceNode>builder()
                             .onEnter(StringLiteral.class, (string, parent) -> entered.add(string.value()))
                             .onExit(Program.class, (node, parent) -> entered.add("program"))
                             .build();

        var result = Traverser.over(kinds).traverse(TREE, visitor);

        var error = assertInstanceOf(CompileError.UnknownNodeKind.class, result.getLeft());
        assertEquals("StringLiteral", error.kind());
        assertTrue(entered.isEmpty());
    }

    @Test
    void traverse_targetTree_usesTargetKinds() {
        var call = new TargetNode.CallExpression(new TargetNode.Identifier("add"),
                                                 List.of(new TargetNode.NumberLiteral("1"), new TargetNode.StringLiteral("s")));
        var program = new TargetNode.Program(List.of(new TargetNode.ExpressionStatement(call)));
        var visited = new ArrayList<String>();
        var visitor = Visitor.<TargetNode>builder()
                             .onEnter(TargetNode.Identifier.class, (identifier, parent) -> visited.add(identifier.name()))
                             .onEnter(TargetNode.NumberLiteral.class, (number, parent) -> visited.add(number.value()))
                             .onEnter(TargetNode.StringLiteral.class, (string, parent) -> visited.add(string.value()))
                             .build();

        var result = Traverser.over(TargetNode.KINDS).traverse(program, visitor);

        assertTrue(result.isRight());
        assertThat(visited).containsExactly("add", "1", "s");
    }

    @Test
    void visitor_interfaceKind_isRejected() {
        var builder = Visitor.<TargetNode>builder();

        assertThrows(IllegalArgumentException.class,
                     () -> builder.onEnter(TargetNode.Expression.class, (expression, parent) -> {}));
        assertThrows(IllegalArgumentException.class,
                     () -> builder.onExit(TargetNode.Literal.class, (literal, parent) -> {}));
    }

    @Test
    void nodeKinds_interfaceKind_isRejected() {
        var builder = NodeKinds.<TargetNode>builder();

        assertThrows(IllegalArgumentException.class, () -> builder.leaf(TargetNode.Statement.class));
        assertThrows(IllegalArgumentException.class,
                     () -> builder.branch(TargetNode.Expression.class, expression -> List.of()));
    }

    @Test
    void nodeKinds_reportsRegisteredKinds() {
        assertTrue(SourceNode.KINDS.isRegistered(CallExpression.class));
        assertFalse(SourceNode.KINDS.isRegistered(TargetNode.Identifier.class));
        assertTrue(SourceNode.KINDS.childrenOf(new NumberLiteral("1")).get().isEmpty());
    }
}
