package org.pragmatica.lisp2c.lexer;

import io.vavr.control.Either;
import org.pragmatica.lisp2c.CompilerConfig;
import org.pragmatica.lisp2c.error.CompileError;
import org.pragmatica.lisp2c.tree.SourceLocation;
import org.pragmatica.lisp2c.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for the prefix-call language. Single left-to-right pass, no backtracking.
 */
public final class Lexer {
    private static final int DEFAULT_TOKEN_CAPACITY = 16;

    private final String input;
    private SourceLocation location;

    private Lexer(String input) {
        this.input = input;
        this.location = SourceLocation.START;
    }

    public static Either<CompileError, List<Token>> tokenize(String input) {
        return tokenize(input, CompilerConfig.DEFAULT);
    }

    public static Either<CompileError, List<Token>> tokenize(String input, CompilerConfig config) {
        if (input.length() > config.maxInputSize()) {
            return Either.left(new CompileError.InputTooLarge(input.length(), config.maxInputSize()));
        }
        return new Lexer(input).tokenizeAll();
    }

    private Either<CompileError, List<Token>> tokenizeAll() {
        var tokens = new ArrayList<Token>();
        while (!isAtEnd()) {
            var start = location;
            char c = peek();

            if (c == '(') {
                advance();
                tokens.add(new Token.OpenParen(span(start)));
            } else if (c == ')') {
                advance();
                tokens.add(new Token.CloseParen(span(start)));
            } else if (Character.isWhitespace(c)) {
                advance();
            } else if (isDigit(c)) {
                tokens.add(new Token.Number(span(start), scanWhile(Lexer::isDigit)));
            } else if (c == '"') {
                var literal = scanString(start);
                if (literal.isLeft()) {
                    return Either.left(literal.getLeft());
                }
                tokens.add(literal.get());
            } else if (isLetter(c)) {
                tokens.add(new Token.Name(span(start), scanWhile(Lexer::isLetter)));
            } else {
                return Either.left(new CompileError.UnrecognizedCharacter(c, start));
            }
        }
        return Either.right(List.copyOf(tokens));
    }

    private Either<CompileError, Token> scanString(SourceLocation start) {
        // skip opening quote
        advance();
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != '"') {
            sb.append(advance());
        }
        if (isAtEnd()) {
            return Either.left(new CompileError.UnterminatedString(start));
        }
        // skip closing quote
        advance();
        return Either.right(new Token.StringLiteral(span(start), sb.toString()));
    }

    private interface CharPredicate {
        boolean test(char c);
    }

    private String scanWhile(CharPredicate predicate) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && predicate.test(peek())) {
            sb.append(advance());
        }
        return sb.toString();
    }

    private boolean isAtEnd() {
        return location.offset() >= input.length();
    }

    private char peek() {
        return input.charAt(location.offset());
    }

    private char advance() {
        char c = peek();
        location = location.after(c);
        return c;
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, location);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
