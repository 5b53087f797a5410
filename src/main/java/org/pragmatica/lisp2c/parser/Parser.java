package org.pragmatica.lisp2c.parser;

import io.vavr.control.Either;
import org.pragmatica.lisp2c.CompilerConfig;
import org.pragmatica.lisp2c.error.CompileError;
import org.pragmatica.lisp2c.lexer.Token;
import org.pragmatica.lisp2c.tree.SourceNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser turning tokens into a {@link SourceNode.Program}.
 * One token of lookahead; every nested call reads through the same {@link TokenCursor}.
 * Calls nested deeper than {@link CompilerConfig#maxNestingDepth()} are rejected.
 */
public final class Parser {
    private static final String EXPRESSION = "number, string or '('";
    private static final String CALL_NAME = "call name";
    private static final String CLOSE_PAREN = "')'";

    private final TokenCursor cursor;
    private final int maxNestingDepth;
    private int depth;

    private Parser(TokenCursor cursor, int maxNestingDepth) {
        this.cursor = cursor;
        this.maxNestingDepth = maxNestingDepth;
    }

    public static Either<CompileError, SourceNode.Program> parse(List<Token> tokens) {
        return parse(tokens, CompilerConfig.DEFAULT);
    }

    public static Either<CompileError, SourceNode.Program> parse(List<Token> tokens, CompilerConfig config) {
        return new Parser(TokenCursor.over(tokens), config.maxNestingDepth()).parseProgram();
    }

    private Either<CompileError, SourceNode.Program> parseProgram() {
        var body = new ArrayList<SourceNode>();
        while (!cursor.isAtEnd()) {
            var node = walk();
            if (node.isLeft()) {
                return Either.left(node.getLeft());
            }
            body.add(node.get());
        }
        return Either.right(new SourceNode.Program(List.copyOf(body)));
    }

    private Either<CompileError, SourceNode> walk() {
        var token = cursor.peek();

        if (token instanceof Token.Number number) {
            cursor.advance();
            return Either.right(new SourceNode.NumberLiteral(number.text()));
        }
        if (token instanceof Token.StringLiteral string) {
            cursor.advance();
            return Either.right(new SourceNode.StringLiteral(string.text()));
        }
        if (token instanceof Token.OpenParen open) {
            cursor.advance();
            return parseCall(open);
        }
        return Either.left(new CompileError.UnexpectedToken(token.kind(), cursor.location(), EXPRESSION));
    }

    private Either<CompileError, SourceNode> parseCall(Token.OpenParen open) {
        if (depth == maxNestingDepth) {
            return Either.left(new CompileError.NestingTooDeep(open.span().start(), maxNestingDepth));
        }
        depth++;
        try {
            return parseCallBody(open);
        } finally {
            depth--;
        }
    }

    private Either<CompileError, SourceNode> parseCallBody(Token.OpenParen open) {
        var openedAt = open.span().start();
        if (cursor.isAtEnd()) {
            return Either.left(new CompileError.UnexpectedEndOfInput(cursor.location(), CALL_NAME, openedAt));
        }
        if (!(cursor.peek() instanceof Token.Name name)) {
            return Either.left(new CompileError.UnexpectedToken(cursor.peek().kind(), cursor.location(), CALL_NAME));
        }
        cursor.advance();

        var params = new ArrayList<SourceNode>();
        while (true) {
            if (cursor.isAtEnd()) {
                return Either.left(new CompileError.UnexpectedEndOfInput(cursor.location(), CLOSE_PAREN, openedAt));
            }
            if (cursor.peek() instanceof Token.CloseParen) {
                cursor.advance();
                return Either.right(new SourceNode.CallExpression(name.text(), List.copyOf(params)));
            }
            var param = walk();
            if (param.isLeft()) {
                return param;
            }
            params.add(param.get());
        }
    }
}
