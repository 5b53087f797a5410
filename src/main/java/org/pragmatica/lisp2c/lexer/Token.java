package org.pragmatica.lisp2c.lexer;

import org.pragmatica.lisp2c.tree.SourceSpan;

/**
 * Lexical unit of the prefix-call language.
 */
public sealed interface Token {
    SourceSpan span();

    TokenKind kind();

    /**
     * Payload of the token. Parens answer their own character.
     */
    String text();

    // Delimiters
    record OpenParen(SourceSpan span) implements Token {
        @Override
        public TokenKind kind() {
            return TokenKind.OPEN_PAREN;
        }

        @Override
        public String text() {
            return "(";
        }
    }

    record CloseParen(SourceSpan span) implements Token {
        @Override
        public TokenKind kind() {
            return TokenKind.CLOSE_PAREN;
        }

        @Override
        public String text() {
            return ")";
        }
    }

    // Literals and names
    record Number(SourceSpan span, String text) implements Token {
        @Override
        public TokenKind kind() {
            return TokenKind.NUMBER;
        }
    }

    /**
     * String literal; {@code text} excludes the surrounding quotes.
     */
    record StringLiteral(SourceSpan span, String text) implements Token {
        @Override
        public TokenKind kind() {
            return TokenKind.STRING;
        }
    }

    record Name(SourceSpan span, String text) implements Token {
        @Override
        public TokenKind kind() {
            return TokenKind.NAME;
        }
    }
}
