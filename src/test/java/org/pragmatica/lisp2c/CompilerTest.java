package org.pragmatica.lisp2c;

import org.junit.jupiter.api.Test;
import org.pragmatica.lisp2c.lexer.Token;
import org.pragmatica.lisp2c.lexer.TokenKind;
import org.pragmatica.lisp2c.tree.SourceNode;
import org.pragmatica.lisp2c.tree.TargetNode;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for running the stages one at a time through a configured compiler.
 */
class CompilerTest {

    private final Compiler compiler = Compiler.create(CompilerConfig.DEFAULT);

    @Test
    void stages_chainedByHand_matchCompile() {
        var input = "(add 2 (subtract 4 2))";

        var tokens = compiler.tokenize(input).get();
        var source = compiler.parse(tokens).get();
        var target = compiler.transform(source).get();
        var output = compiler.generate(target).get();

        assertThat(tokens.stream().map(Token::kind).toList()).startsWith(TokenKind.OPEN_PAREN, TokenKind.NAME);
        assertEquals(1, source.body().size());
        assertInstanceOf(TargetNode.ExpressionStatement.class, target.body().get(0));
        assertEquals(compiler.compile(input).get(), output);
    }

    @Test
    void transform_thenGenerate_acceptsHandBuiltSourceTree() {
        var source = new SourceNode.Program(List.of(
            new SourceNode.CallExpression("max", List.of(new SourceNode.NumberLiteral("1"), new SourceNode.StringLiteral("2")))));

        var output = compiler.transform(source).flatMap(compiler::generate);

        assertEquals("max(1,\"2\");", output.get());
    }

    @Test
    void compile_failingStage_stopsPipeline() {
        var result = compiler.compile("(a (b)");

        assertTrue(result.isLeft());
        assertThat(result.getLeft().message()).startsWith("Unexpected end of input");
    }
}
